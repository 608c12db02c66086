package org.rewardledger.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WithdrawalResult {
    private long amount;
    private long operatorFee;
    private long paidOut;           // amount - operatorFee
    private long claimableBalance;  // solde restant
}
