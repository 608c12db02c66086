package org.rewardledger.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "ledger_balance",
        uniqueConstraints = @UniqueConstraint(columnNames = {"asset", "holder"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerBalance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Asset asset;

    @Column(nullable = false, length = 64)
    private String holder;

    @Column(nullable = false)
    private long amount; // unités entières, jamais négatif
}
