package org.rewardledger.service;

import java.util.Locale;

public final class Identities {
    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private Identities() {}

    // null si absent ou adresse nulle : c'est la sentinelle "aucun parrain"
    public static String normalize(String identity) {
        if (identity == null || identity.isBlank()) return null;
        String id = identity.trim().toLowerCase(Locale.ROOT);
        return ZERO_ADDRESS.equals(id) ? null : id;
    }
}
