package org.rewardledger.repo;

import org.rewardledger.model.LedgerEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {
    List<LedgerEvent> findByAddressOrderByIdDesc(String address, Pageable pageable);
}
