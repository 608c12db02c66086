package org.rewardledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "ledger_event", indexes = @Index(name = "idx_ledger_event_address", columnList = "address"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private LedgerEventType type;

    // compte concerné (bénéficiaire pour REFERRAL_REWARD)
    @Column(nullable = false, length = 64)
    private String address;

    // filleul pour REFERRAL_REWARD, relayeur pour CLAIM, actif pour SWEEP
    @Column(length = 64)
    private String counterparty;

    private long amount;

    // niveau 1..5 pour REFERRAL_REWARD
    private Integer level;

    @Column(nullable = false)
    private Instant createdAt;
}
