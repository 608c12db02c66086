package org.rewardledger.service;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.dto.DistributionResult;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.accrual.InterestAccrualEngine;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Settlement par lot des {@code count} premiers inscrits. Aucun état de reprise :
 * l'appelant suit lui-même sa progression entre deux appels.
 */
@Service
@Slf4j
public class RewardDistributionService {
    private final AccountService accounts;
    private final InterestAccrualEngine accrualEngine;
    private final LedgerEventService events;
    private final LedgerConfigService configService;
    private final AdmissionGuard admission;
    private final ExecutionGate gate;
    private final Clock clock;

    public RewardDistributionService(AccountService accounts,
                                     InterestAccrualEngine accrualEngine,
                                     LedgerEventService events,
                                     LedgerConfigService configService,
                                     AdmissionGuard admission,
                                     ExecutionGate gate,
                                     Clock clock) {
        this.accounts = accounts;
        this.accrualEngine = accrualEngine;
        this.events = events;
        this.configService = configService;
        this.admission = admission;
        this.gate = gate;
        this.clock = clock;
    }

    public DistributionResult distributeDailyRewards(String caller, int count) {
        return gate.execute("distributeDailyRewards", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperator(caller, settings);
            long size = accounts.registrySize();
            if (count < 0 || count > size) {
                throw new LedgerException(LedgerError.REGISTRY_RANGE_EXCEEDED,
                        "Nombre demandé " + count + " hors du registre (" + size + ")");
            }

            Instant now = Instant.now(clock);
            List<Account> batch = accounts.firstRegistered(count);
            long total = 0;
            for (Account account : batch) {
                // sans stake : rien à accrocher, mais l'horloge avance quand même
                long accrued = accrualEngine.accrue(account, settings, now);
                if (account.getStakedAmount() > 0) {
                    events.record(LedgerEventType.CLAIM, account.getAddress(), accrued);
                }
                total = LedgerMath.add(total, accrued);
            }

            long percent = size == 0 ? 0 : (long) count * 100 / size;
            log.info("Daily rewards distributed to {}/{} accounts ({}%), total accrued {}",
                    count, size, percent, total);
            return DistributionResult.builder()
                    .processed(batch.size())
                    .registrySize(size)
                    .percentProcessed(percent)
                    .totalAccrued(total)
                    .build();
        });
    }
}
