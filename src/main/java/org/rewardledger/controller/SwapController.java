package org.rewardledger.controller;

import org.rewardledger.dto.AmountRequest;
import org.rewardledger.dto.SwapResult;
import org.rewardledger.service.SwapService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/swap")
public class SwapController {

    @Autowired
    private SwapService swapService;

    // POST /api/swap {amount} : montant en unités STABLE
    @PostMapping
    public ResponseEntity<?> swap(@RequestBody AmountRequest req, Authentication authentication) {
        String caller = Callers.address(authentication);
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "body manquant"));
        SwapResult result = swapService.swap(caller, req.getAmount());
        return ResponseEntity.ok(result);
    }
}
