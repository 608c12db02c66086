package org.rewardledger.model;

import jakarta.persistence.*;
import lombok.*;

// Une seule ligne : paramètres globaux modifiables par l'opérateur
@Entity
@Table(name = "ledger_config")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerConfig {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // pourcentage journalier (2 = 2 %/jour)
    private long dailyInterestRate;

    private long signupBonusAmount;

    // STABLE pour 100 TOKEN
    private long tokenToStableRate;

    // 5 entrées en pour-mille, sérialisées en JSON
    @Column(nullable = false, length = 128)
    private String referralPercentsJson;

    private boolean pausedForOperations;

    private boolean pausedForWithdrawals;

    @Column(nullable = false, length = 64)
    private String operatorAddress;

    @Column(length = 64)
    private String gasEstimatorAddress;
}
