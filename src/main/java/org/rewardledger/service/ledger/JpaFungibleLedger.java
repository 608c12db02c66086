package org.rewardledger.service.ledger;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Asset;
import org.rewardledger.model.LedgerBalance;
import org.rewardledger.repo.LedgerBalanceRepository;
import org.rewardledger.service.Identities;

// Adaptateur en base : débit conditionnel puis crédit, dans la transaction de l'appelant
@Slf4j
public class JpaFungibleLedger implements FungibleLedger {

    private final Asset asset;
    private final String custodyAddress;
    private final LedgerBalanceRepository balances;

    public JpaFungibleLedger(Asset asset, String custodyAddress, LedgerBalanceRepository balances) {
        this.asset = asset;
        this.custodyAddress = Identities.normalize(custodyAddress);
        this.balances = balances;
    }

    @Override
    public Asset asset() {
        return asset;
    }

    @Override
    public String custodyAddress() {
        return custodyAddress;
    }

    @Override
    public void transfer(String to, long amount) {
        transferFrom(custodyAddress, to, amount);
    }

    @Override
    public void transferFrom(String from, String to, long amount) {
        if (amount < 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "Montant négatif: " + amount);
        }
        String source = Identities.normalize(from);
        String target = Identities.normalize(to);
        if (source == null || target == null) {
            throw new LedgerException(LedgerError.EXTERNAL_LEDGER_FAILURE, "Adresse de transfert manquante");
        }
        if (amount == 0) return;

        int updated = balances.decrementIfEnough(asset, source, amount);
        if (updated == 0) {
            throw new LedgerException(LedgerError.EXTERNAL_LEDGER_FAILURE,
                    "Solde " + asset + " insuffisant pour " + source);
        }
        credit(target, amount);
        log.debug("{} transfer {} -> {} : {}", asset, source, target, amount);
    }

    @Override
    public long balanceOf(String holder) {
        String h = Identities.normalize(holder);
        if (h == null) return 0L;
        return balances.findAmount(asset, h).orElse(0L);
    }

    /**
     * Alimente la garde au démarrage ; hors de ce cas, aucun jeton n'est créé.
     */
    public void seedCustody(long amount) {
        if (amount <= 0 || balanceOf(custodyAddress) > 0) return;
        credit(custodyAddress, amount);
        log.info("{} custody {} seeded with {}", asset, custodyAddress, amount);
    }

    private void credit(String holder, long amount) {
        int updated = balances.increment(asset, holder, amount);
        if (updated == 0) {
            balances.save(LedgerBalance.builder()
                    .asset(asset)
                    .holder(holder)
                    .amount(amount)
                    .build());
        }
    }
}
