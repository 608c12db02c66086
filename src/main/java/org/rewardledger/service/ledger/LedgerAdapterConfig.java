package org.rewardledger.service.ledger;

import org.rewardledger.model.Asset;
import org.rewardledger.repo.LedgerBalanceRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerAdapterConfig {

    @Value("${ledger.custody-address}")
    private String custodyAddress;

    @Bean
    public JpaFungibleLedger tokenLedger(LedgerBalanceRepository balances) {
        return new JpaFungibleLedger(Asset.TOKEN, custodyAddress, balances);
    }

    @Bean
    public JpaFungibleLedger stableLedger(LedgerBalanceRepository balances) {
        return new JpaFungibleLedger(Asset.STABLE, custodyAddress, balances);
    }
}
