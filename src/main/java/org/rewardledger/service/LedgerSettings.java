package org.rewardledger.service;

import java.util.List;

/**
 * Instantané immuable de la configuration globale, lu au début de chaque opération
 * et passé explicitement aux moteurs (accrual, parrainage).
 */
public record LedgerSettings(long dailyInterestRate,
                             long signupBonusAmount,
                             long tokenToStableRate,
                             List<Integer> referralPercents,
                             boolean pausedForOperations,
                             boolean pausedForWithdrawals,
                             String operatorAddress,
                             String gasEstimatorAddress) {

    public LedgerSettings {
        referralPercents = List.copyOf(referralPercents);
    }

    public boolean isOperator(String identity) {
        return operatorAddress != null && operatorAddress.equals(Identities.normalize(identity));
    }
}
