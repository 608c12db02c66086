package org.rewardledger.repo;

import org.rewardledger.model.LedgerConfig;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerConfigRepository extends JpaRepository<LedgerConfig, Long> {
}
