package org.rewardledger.service.ledger;

import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class CustodyBootstrap {
    private final JpaFungibleLedger tokenLedger;
    private final JpaFungibleLedger stableLedger;
    private final long initialTokenSupply;
    private final long initialStableSupply;

    public CustodyBootstrap(@Qualifier("tokenLedger") JpaFungibleLedger tokenLedger,
                            @Qualifier("stableLedger") JpaFungibleLedger stableLedger,
                            @Value("${ledger.custody.initial-token-supply:0}") long initialTokenSupply,
                            @Value("${ledger.custody.initial-stable-supply:0}") long initialStableSupply) {
        this.tokenLedger = tokenLedger;
        this.stableLedger = stableLedger;
        this.initialTokenSupply = initialTokenSupply;
        this.initialStableSupply = initialStableSupply;
    }

    // seulement si la garde est vide (premier démarrage)
    @PostConstruct
    public void seed() {
        tokenLedger.seedCustody(initialTokenSupply);
        stableLedger.seedCustody(initialStableSupply);
    }
}
