package org.rewardledger.service;

import lombok.RequiredArgsConstructor;
import org.rewardledger.model.LedgerEvent;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.repo.LedgerEventRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LedgerEventService {
    private static final int MAX_RECENT = 100;

    private final LedgerEventRepository repo;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    // persisté dans la transaction de l'opération ; poussé en SSE après commit
    public LedgerEvent record(LedgerEventType type, String address, String counterparty, long amount, Integer level) {
        LedgerEvent e = LedgerEvent.builder()
                .type(type)
                .address(address)
                .counterparty(counterparty)
                .amount(amount)
                .level(level)
                .createdAt(Instant.now(clock))
                .build();
        LedgerEvent saved = repo.save(e);
        publisher.publishEvent(saved);
        return saved;
    }

    public LedgerEvent record(LedgerEventType type, String address, long amount) {
        return record(type, address, null, amount, null);
    }

    public List<LedgerEvent> recent(String address, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT));
        return repo.findByAddressOrderByIdDesc(Identities.normalize(address), PageRequest.of(0, size));
    }
}
