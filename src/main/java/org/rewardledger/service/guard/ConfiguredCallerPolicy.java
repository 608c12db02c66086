package org.rewardledger.service.guard;

import org.rewardledger.service.Identities;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

// Adresses connues comme contrats, listées dans ledger.contract-addresses
@Component
public class ConfiguredCallerPolicy implements CallerPolicy {
    private final Set<String> contracts;

    public ConfiguredCallerPolicy(@Value("${ledger.contract-addresses:}") String contractAddresses) {
        this.contracts = Arrays.stream(contractAddresses.split(","))
                .map(Identities::normalize)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean hasCode(String identity) {
        String id = Identities.normalize(identity);
        return id != null && contracts.contains(id);
    }
}
