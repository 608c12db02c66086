package org.rewardledger.controller;

import org.rewardledger.dto.AccountView;
import org.rewardledger.dto.AmountRequest;
import org.rewardledger.service.StakingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/staking")
public class StakingController {

    @Autowired
    private StakingService stakingService;

    @PostMapping("/stake")
    public ResponseEntity<?> stake(@RequestBody AmountRequest req, Authentication authentication) {
        String caller = Callers.address(authentication);
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "body manquant"));
        return ResponseEntity.ok(AccountView.fromEntity(stakingService.stake(caller, req.getAmount())));
    }

    @PostMapping("/unstake")
    public ResponseEntity<?> unstake(@RequestBody AmountRequest req, Authentication authentication) {
        String caller = Callers.address(authentication);
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "body manquant"));
        return ResponseEntity.ok(AccountView.fromEntity(stakingService.unstake(caller, req.getAmount())));
    }
}
