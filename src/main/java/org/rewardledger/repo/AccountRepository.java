package org.rewardledger.repo;

import org.rewardledger.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AccountRepository extends JpaRepository<Account, Long> {
    Optional<Account> findByAddress(String address);

    List<Account> findByAddressIn(Collection<String> addresses);
}
