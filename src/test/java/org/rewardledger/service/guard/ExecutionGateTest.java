package org.rewardledger.service.guard;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ExecutionGateTest {

    private PlatformTransactionManager txManager;
    private ExecutionGate gate;

    @BeforeEach
    void setUp() {
        txManager = mock(PlatformTransactionManager.class);
        gate = new ExecutionGate(txManager);
    }

    @Test
    void execute_shouldCommitAndReturnResult() {
        String result = gate.execute("op", () -> "ok");

        assertThat(result).isEqualTo("ok");
        verify(txManager).commit(isNull());
        verify(txManager, never()).rollback(any());
    }

    @Test
    void execute_nestedCall_shouldBeRejectedAsReentrant() {
        assertThatThrownBy(() -> gate.execute("outer", () -> gate.execute("inner", () -> 1)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.REENTRANT_CALL);

        // l'opération externe est annulée en entier
        verify(txManager).rollback(isNull());
        verify(txManager, never()).commit(any());
    }

    @Test
    void execute_failure_shouldRollbackAndReleaseLock() {
        assertThatThrownBy(() -> gate.<Integer>execute("boom", () -> {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "x");
        })).isInstanceOf(LedgerException.class);

        verify(txManager).rollback(isNull());
        // le verrou est libéré : un appel suivant passe
        assertThat(gate.execute("next", () -> 42)).isEqualTo(42);
    }

    @Test
    void execute_concurrentCalls_shouldNeverOverlap() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        List<Integer> observed = Collections.synchronizedList(new ArrayList<>());
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    start.await();
                    return gate.execute("op", () -> {
                        observed.add(inside.incrementAndGet());
                        Thread.yield();
                        inside.decrementAndGet();
                        return null;
                    });
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(observed).hasSize(threads).containsOnly(1);
    }
}
