package org.rewardledger.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.rewardledger.model.LedgerEvent;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Component
@Slf4j
public class LedgerEventStream {
    private final Map<String, List<SseEmitter>> emitters = new ConcurrentHashMap<>();
    // un seul thread : l'ordre des faits est conservé, et un client lent ne bloque jamais la porte d'exécution
    private final Executor pushExecutor;

    public LedgerEventStream() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-sse-push");
            t.setDaemon(true);
            return t;
        }));
    }

    LedgerEventStream(Executor pushExecutor) {
        this.pushExecutor = pushExecutor;
    }

    public SseEmitter register(String address) {
        String key = Identities.normalize(address);
        // 6 heures, le client se reconnecte ensuite
        SseEmitter emitter = new SseEmitter(6L * 60 * 60 * 1000L);
        emitters.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> removeEmitter(key, emitter));
        emitter.onTimeout(() -> removeEmitter(key, emitter));
        emitter.onError((e) -> removeEmitter(key, emitter));

        try {
            emitter.send(SseEmitter.event().name("connected").data("ok"));
        } catch (IOException e) {
            removeEmitter(key, emitter);
        }
        return emitter;
    }

    private void removeEmitter(String address, SseEmitter emitter) {
        List<SseEmitter> list = emitters.get(address);
        if (list != null) {
            list.remove(emitter);
            if (list.isEmpty()) emitters.remove(address);
        }
    }

    // uniquement les faits commités : une opération annulée ne produit rien
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onLedgerEvent(LedgerEvent event) {
        if (!emitters.containsKey(event.getAddress())) return;
        pushExecutor.execute(() -> push(event));
    }

    private void push(LedgerEvent event) {
        List<SseEmitter> list = emitters.get(event.getAddress());
        if (list == null) return;

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", event.getType().name());
        payload.put("amount", event.getAmount());
        payload.put("createdAt", event.getCreatedAt().toString());
        if (event.getCounterparty() != null) payload.put("counterparty", event.getCounterparty());
        if (event.getLevel() != null) payload.put("level", event.getLevel());

        for (SseEmitter emitter : list.toArray(new SseEmitter[0])) {
            try {
                emitter.send(SseEmitter.event().name("ledger-event").data(payload));
            } catch (IOException e) {
                log.debug("Dropping SSE subscriber of {}: {}", event.getAddress(), e.getMessage());
                removeEmitter(event.getAddress(), emitter);
            }
        }
    }

    // Heartbeat toutes les 15s pour garder le flux ouvert derrière les proxies
    @Scheduled(fixedDelay = 15000)
    public void heartbeat() {
        for (var entry : emitters.entrySet()) {
            String address = entry.getKey();
            for (SseEmitter emitter : entry.getValue().toArray(new SseEmitter[0])) {
                try {
                    emitter.send(SseEmitter.event().name("ping").data("keepalive"));
                } catch (IOException e) {
                    removeEmitter(address, emitter);
                }
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (pushExecutor instanceof ExecutorService es) es.shutdownNow();
    }

    int subscriberCount(String address) {
        List<SseEmitter> list = emitters.get(Identities.normalize(address));
        return list == null ? 0 : list.size();
    }
}
