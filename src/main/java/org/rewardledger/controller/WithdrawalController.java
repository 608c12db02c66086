package org.rewardledger.controller;

import org.rewardledger.dto.AmountRequest;
import org.rewardledger.service.WithdrawalService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/withdrawals")
public class WithdrawalController {

    @Autowired
    private WithdrawalService withdrawalService;

    @PostMapping
    public ResponseEntity<?> withdraw(@RequestBody AmountRequest req, Authentication authentication) {
        String caller = Callers.address(authentication);
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "body manquant"));
        return ResponseEntity.ok(withdrawalService.withdrawStable(caller, req.getAmount()));
    }
}
