package org.rewardledger.service.guard;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Exécution sérialisée globale : une opération à la fois, chacune dans sa propre transaction.
 * Le verrou englobe la transaction, donc la suivante voit toujours l'état commité.
 * Une entrée imbriquée sur le même thread (rappel depuis un transfert) est refusée.
 */
@Component
@Slf4j
public class ExecutionGate {
    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate tx;

    public ExecutionGate(PlatformTransactionManager transactionManager) {
        this.tx = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Re-entrant call to '{}' rejected", operation);
            throw new LedgerException(LedgerError.REENTRANT_CALL, "Appel ré-entrant refusé: " + operation);
        }
        lock.lock();
        try {
            return tx.execute(status -> body.get());
        } finally {
            lock.unlock();
        }
    }
}
