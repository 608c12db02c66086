package org.rewardledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

// Registre append-only : l'id généré donne l'ordre d'inscription
@Entity
@Table(name = "registry_entry")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistryEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String address;

    @Column(nullable = false)
    private Instant registeredAt;
}
