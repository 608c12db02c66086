package org.rewardledger.dto;

import lombok.*;
import org.rewardledger.service.referral.ReferralCredit;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SwapResult {
    private long stableAmount;      // STABLE versés par l'appelant
    private long tokenAmount;       // TOKEN reçus
    private long operatorFee;       // 5 % du montant STABLE
    private List<ReferralCredit> referralCredits;
}
