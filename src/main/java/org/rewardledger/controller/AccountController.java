package org.rewardledger.controller;

import org.rewardledger.dto.AccountView;
import org.rewardledger.dto.SignupRequest;
import org.rewardledger.model.Account;
import org.rewardledger.service.AccountService;
import org.rewardledger.service.StakingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    @Autowired
    private AccountService accountService;

    @Autowired
    private StakingService stakingService;

    // POST /api/accounts/signup : inscription de l'appelant, parrain optionnel
    @PostMapping("/signup")
    public ResponseEntity<?> signup(@RequestBody(required = false) SignupRequest req, Authentication authentication) {
        String caller = Callers.address(authentication);
        Account account = accountService.signup(caller, req != null ? req.getReferrer() : null);
        return ResponseEntity.ok(AccountView.fromEntity(account));
    }

    @GetMapping("/me")
    public ResponseEntity<?> me(Authentication authentication) {
        return view(Callers.address(authentication));
    }

    @GetMapping("/{address}")
    public ResponseEntity<?> byAddress(@PathVariable String address) {
        return view(address);
    }

    @GetMapping("/{address}/pending")
    public ResponseEntity<?> pending(@PathVariable String address) {
        return ResponseEntity.ok(Map.of("address", address, "pendingRewards", stakingService.pendingRewards(address)));
    }

    // n'importe qui peut déclencher le settlement d'un compte (relayeur)
    @PostMapping("/{address}/claim")
    public ResponseEntity<?> claim(@PathVariable String address, Authentication authentication) {
        Account account = stakingService.claim(Callers.address(authentication), address);
        return ResponseEntity.ok(AccountView.fromEntity(account));
    }

    private ResponseEntity<?> view(String address) {
        return accountService.find(address)
                .<ResponseEntity<?>>map(a -> {
                    AccountView v = AccountView.fromEntity(a);
                    v.setPendingRewards(stakingService.pendingRewards(a.getAddress()));
                    return ResponseEntity.ok(v);
                })
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Compte inconnu", "reason", "NOT_REGISTERED")));
    }
}
