package org.rewardledger.repo;

import org.rewardledger.model.RegistryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

// Registre append-only : pas de delete côté service
public interface RegistryEntryRepository extends JpaRepository<RegistryEntry, Long> {
    boolean existsByAddress(String address);

    List<RegistryEntry> findAllByOrderByIdAsc(Pageable pageable);
}
