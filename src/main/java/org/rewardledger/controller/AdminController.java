package org.rewardledger.controller;

import org.rewardledger.dto.AccountView;
import org.rewardledger.dto.DistributionResult;
import org.rewardledger.dto.SetBalanceRequest;
import org.rewardledger.dto.SweepRequest;
import org.rewardledger.service.AdminService;
import org.rewardledger.service.RewardDistributionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    @Autowired
    private AdminService adminService;

    @Autowired
    private RewardDistributionService distributionService;

    @GetMapping("/config")
    public ResponseEntity<?> config(Authentication authentication) {
        return ResponseEntity.ok(adminService.config(Callers.address(authentication)));
    }

    @PutMapping("/config/daily-interest-rate")
    public ResponseEntity<?> setDailyInterestRate(@RequestBody Map<String, Long> body, Authentication authentication) {
        Long value = body.get("value");
        if (value == null) return ResponseEntity.badRequest().body(Map.of("error", "value manquant"));
        return ResponseEntity.ok(adminService.setDailyInterestRate(Callers.address(authentication), value));
    }

    @PutMapping("/config/signup-bonus")
    public ResponseEntity<?> setSignupBonus(@RequestBody Map<String, Long> body, Authentication authentication) {
        Long value = body.get("value");
        if (value == null) return ResponseEntity.badRequest().body(Map.of("error", "value manquant"));
        return ResponseEntity.ok(adminService.setSignupBonus(Callers.address(authentication), value));
    }

    @PutMapping("/config/token-to-stable-rate")
    public ResponseEntity<?> setTokenToStableRate(@RequestBody Map<String, Long> body, Authentication authentication) {
        Long value = body.get("value");
        if (value == null) return ResponseEntity.badRequest().body(Map.of("error", "value manquant"));
        return ResponseEntity.ok(adminService.setTokenToStableRate(Callers.address(authentication), value));
    }

    @PutMapping("/config/referral-percents")
    public ResponseEntity<?> setReferralPercents(@RequestBody List<Integer> table, Authentication authentication) {
        return ResponseEntity.ok(adminService.setReferralPercents(Callers.address(authentication), table));
    }

    @PutMapping("/config/pause-operations")
    public ResponseEntity<?> setPausedForOperations(@RequestBody Map<String, Boolean> body, Authentication authentication) {
        boolean paused = Boolean.TRUE.equals(body.get("paused"));
        return ResponseEntity.ok(adminService.setPausedForOperations(Callers.address(authentication), paused));
    }

    @PutMapping("/config/pause-withdrawals")
    public ResponseEntity<?> setPausedForWithdrawals(@RequestBody Map<String, Boolean> body, Authentication authentication) {
        boolean paused = Boolean.TRUE.equals(body.get("paused"));
        return ResponseEntity.ok(adminService.setPausedForWithdrawals(Callers.address(authentication), paused));
    }

    // migration de soldes
    @PostMapping("/balances")
    public ResponseEntity<?> setBalance(@RequestBody SetBalanceRequest req, Authentication authentication) {
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "body manquant"));
        return ResponseEntity.ok(AccountView.fromEntity(adminService.setBalance(
                Callers.address(authentication), req.getAddress(), req.getAmount(), req.getReferrer())));
    }

    @PostMapping("/sweep")
    public ResponseEntity<?> sweep(@RequestBody SweepRequest req, Authentication authentication) {
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "body manquant"));
        long remaining = adminService.sweep(Callers.address(authentication), req.getAsset(), req.getTo(), req.getAmount());
        return ResponseEntity.ok(Map.of("asset", req.getAsset(), "amount", req.getAmount(), "custodyBalance", remaining));
    }

    @PostMapping("/distribute")
    public ResponseEntity<?> distribute(@RequestParam int count, Authentication authentication) {
        DistributionResult result = distributionService.distributeDailyRewards(Callers.address(authentication), count);
        return ResponseEntity.ok(result);
    }
}
