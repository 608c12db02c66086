package org.rewardledger.service.ledger;

import org.rewardledger.model.Asset;

/**
 * Registre fongible externe (jeton de récompense ou actif stable).
 * Un échec (solde insuffisant) lève une exception et annule toute l'opération englobante.
 */
public interface FungibleLedger {

    Asset asset();

    // adresse qui détient les fonds sous la garde du registre de comptes
    String custodyAddress();

    // depuis la garde vers {@code to}
    void transfer(String to, long amount);

    void transferFrom(String from, String to, long amount);

    long balanceOf(String holder);
}
