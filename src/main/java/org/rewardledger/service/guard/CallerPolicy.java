package org.rewardledger.service.guard;

// Heuristique d'admission : l'identité porte-t-elle du code exécutable ?
public interface CallerPolicy {
    boolean hasCode(String identity);
}
