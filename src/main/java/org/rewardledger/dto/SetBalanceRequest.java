package org.rewardledger.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetBalanceRequest {
    private String address;
    private long amount;
    private String referrer; // null = parrain inchangé
}
