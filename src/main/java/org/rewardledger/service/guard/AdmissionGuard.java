package org.rewardledger.service.guard;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.service.LedgerSettings;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class AdmissionGuard {
    private final CallerPolicy callerPolicy;

    public void requireOperationsOpen(String caller, LedgerSettings settings) {
        if (settings.pausedForOperations()) {
            log.warn("Operation rejected for {}: operations paused", caller);
            throw new LedgerException(LedgerError.OPERATIONS_PAUSED, "Opérations en pause");
        }
        requireExternallyOwned(caller);
    }

    // indépendant de la pause générale
    public void requireWithdrawalsOpen(String caller, LedgerSettings settings) {
        if (settings.pausedForWithdrawals()) {
            log.warn("Withdrawal rejected for {}: withdrawals paused", caller);
            throw new LedgerException(LedgerError.WITHDRAWALS_PAUSED, "Retraits en pause");
        }
        requireExternallyOwned(caller);
    }

    public void requireOperator(String caller, LedgerSettings settings) {
        if (!settings.isOperator(caller)) {
            log.warn("Administrative call rejected for {}", caller);
            throw new LedgerException(LedgerError.FORBIDDEN, "Réservé à l'opérateur");
        }
    }

    private void requireExternallyOwned(String caller) {
        if (callerPolicy.hasCode(caller)) {
            log.warn("Contract caller {} rejected", caller);
            throw new LedgerException(LedgerError.CONTRACT_CALLER, "Appelant contrat refusé");
        }
    }
}
