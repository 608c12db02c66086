package org.rewardledger.repo;

import org.rewardledger.model.Asset;
import org.rewardledger.model.LedgerBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface LedgerBalanceRepository extends JpaRepository<LedgerBalance, Long> {

    // lecture scalaire : ne passe pas par le cache de la session
    @Query("select b.amount from LedgerBalance b where b.asset = :asset and b.holder = :holder")
    Optional<Long> findAmount(@Param("asset") Asset asset, @Param("holder") String holder);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update LedgerBalance b set b.amount = b.amount + :amount where b.asset = :asset and b.holder = :holder")
    int increment(@Param("asset") Asset asset, @Param("holder") String holder, @Param("amount") long amount);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update LedgerBalance b set b.amount = b.amount - :amount " +
            "where b.asset = :asset and b.holder = :holder and b.amount >= :amount")
    int decrementIfEnough(@Param("asset") Asset asset, @Param("holder") String holder, @Param("amount") long amount);
}
