package org.rewardledger.service;

import org.junit.jupiter.api.Test;
import org.rewardledger.model.LedgerEvent;
import org.rewardledger.model.LedgerEventType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LedgerEventStreamTest {

    private final List<Runnable> pending = new ArrayList<>();
    private final LedgerEventStream stream = new LedgerEventStream(pending::add);

    @Test
    void register_shouldTrackSubscriberByNormalizedAddress() {
        SseEmitter emitter = stream.register("0xAlice");

        assertThat(emitter).isNotNull();
        assertThat(stream.subscriberCount("0xalice")).isEqualTo(1);
        assertThat(stream.subscriberCount("0xbob")).isZero();
    }

    @Test
    void onLedgerEvent_withoutSubscriber_shouldBeIgnored() {
        LedgerEvent e = LedgerEvent.builder()
                .type(LedgerEventType.CLAIM)
                .address("0xnobody")
                .amount(3)
                .createdAt(Instant.now())
                .build();

        assertThatCode(() -> stream.onLedgerEvent(e)).doesNotThrowAnyException();
    }

    @Test
    void onLedgerEvent_shouldHandPushToExecutorAndReturnImmediately() {
        stream.register("0xAlice");
        LedgerEvent e = LedgerEvent.builder()
                .type(LedgerEventType.SWAP)
                .address("0xalice")
                .amount(42)
                .createdAt(Instant.now())
                .build();

        stream.onLedgerEvent(e);

        // l'écriture sur le socket n'a pas lieu dans le thread appelant
        assertThat(pending).hasSize(1);

        assertThatCode(() -> pending.forEach(Runnable::run)).doesNotThrowAnyException();
        assertThat(stream.subscriberCount("0xalice")).isEqualTo(1);
    }

    @Test
    void onLedgerEvent_withoutSubscriber_shouldNotScheduleAnything() {
        LedgerEvent e = LedgerEvent.builder()
                .type(LedgerEventType.CLAIM)
                .address("0xnobody")
                .amount(1)
                .createdAt(Instant.now())
                .build();

        stream.onLedgerEvent(e);

        assertThat(pending).isEmpty();
    }
}
