package org.rewardledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "account")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Account {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // adresse du compte, toujours en minuscules
    @Column(nullable = false, unique = true, length = 64)
    private String address;

    // passe à true une seule fois (inscription ou setBalance admin)
    private boolean registered;

    // jetons stakés (unités TOKEN)
    private long stakedAmount;

    // début de la fenêtre d'accrual, ne recule jamais
    private Instant lastClaimTime;

    // solde réclamable (unités STABLE)
    private long claimableBalance;

    // parrain fixé à l'inscription, jamais modifié ensuite
    @Column(length = 64)
    private String referrer;

    // cumul des gains de parrainage (audit, distinct du solde réclamable)
    private long referralEarnings;

    private Instant registeredAt;

    public boolean hasReferrer() {
        return referrer != null && !referrer.isBlank();
    }
}
