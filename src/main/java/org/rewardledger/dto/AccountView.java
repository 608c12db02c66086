package org.rewardledger.dto;

import lombok.*;
import org.rewardledger.model.Account;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountView {
    private String address;
    private boolean registered;
    private long stakedAmount;
    private Long lastClaimEpochMs;   // null si jamais démarré
    private long claimableBalance;
    private String referrer;
    private long referralEarnings;
    private Long pendingRewards;     // optionnel (aperçu d'accrual)

    public static AccountView fromEntity(Account account) {
        if (account == null) return null;
        return AccountView.builder()
                .address(account.getAddress())
                .registered(account.isRegistered())
                .stakedAmount(account.getStakedAmount())
                .lastClaimEpochMs(account.getLastClaimTime() != null ? account.getLastClaimTime().toEpochMilli() : null)
                .claimableBalance(account.getClaimableBalance())
                .referrer(account.getReferrer())
                .referralEarnings(account.getReferralEarnings())
                .build();
    }
}
