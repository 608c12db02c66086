package org.rewardledger.service;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.accrual.InterestAccrualEngine;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.rewardledger.service.ledger.FungibleLedger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
public class StakingService {
    private final FungibleLedger tokenLedger;
    private final AccountService accounts;
    private final InterestAccrualEngine accrualEngine;
    private final LedgerEventService events;
    private final LedgerConfigService configService;
    private final AdmissionGuard admission;
    private final ExecutionGate gate;
    private final Clock clock;

    public StakingService(@Qualifier("tokenLedger") FungibleLedger tokenLedger,
                          AccountService accounts,
                          InterestAccrualEngine accrualEngine,
                          LedgerEventService events,
                          LedgerConfigService configService,
                          AdmissionGuard admission,
                          ExecutionGate gate,
                          Clock clock) {
        this.tokenLedger = tokenLedger;
        this.accounts = accounts;
        this.accrualEngine = accrualEngine;
        this.events = events;
        this.configService = configService;
        this.admission = admission;
        this.gate = gate;
        this.clock = clock;
    }

    /**
     * Met {@code amount} jetons sous garde. L'horloge d'accrual repart de zéro pour
     * tout le solde staké, pas seulement pour l'ajout.
     */
    public Account stake(String caller, long amount) {
        return gate.execute("stake", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperationsOpen(caller, settings);
            LedgerMath.requirePositive(amount);
            Account account = accounts.requireRegistered(caller);

            if (tokenLedger.balanceOf(account.getAddress()) < amount) {
                throw new LedgerException(LedgerError.INSUFFICIENT_TOKEN_BALANCE, "Solde TOKEN insuffisant");
            }
            tokenLedger.transferFrom(account.getAddress(), tokenLedger.custodyAddress(), amount);
            account.setStakedAmount(LedgerMath.add(account.getStakedAmount(), amount));
            Instant now = Instant.now(clock);
            if (account.getLastClaimTime() == null || now.isAfter(account.getLastClaimTime())) {
                account.setLastClaimTime(now);
            }

            events.record(LedgerEventType.STAKE, account.getAddress(), amount);
            log.info("Stake {} : +{} (staked={})", account.getAddress(), amount, account.getStakedAmount());
            return account;
        });
    }

    // settlement forcé d'abord : la part retirée rapporte jusqu'à l'instant du retrait
    public Account unstake(String caller, long amount) {
        return gate.execute("unstake", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperationsOpen(caller, settings);
            LedgerMath.requirePositive(amount);
            Account account = accounts.find(caller)
                    .filter(a -> a.getStakedAmount() >= amount)
                    .orElseThrow(() -> new LedgerException(LedgerError.INSUFFICIENT_STAKE, "Stake insuffisant"));

            long accrued = accrualEngine.settle(account, settings, Instant.now(clock));
            account.setStakedAmount(account.getStakedAmount() - amount);
            tokenLedger.transfer(account.getAddress(), amount);

            events.record(LedgerEventType.UNSTAKE, account.getAddress(), amount);
            log.info("Unstake {} : -{} (staked={}, accrued={})",
                    account.getAddress(), amount, account.getStakedAmount(), accrued);
            return account;
        });
    }

    // déclenchement public du settlement pour le compte d'un autre (relayeur)
    public Account claim(String caller, String identity) {
        return gate.execute("claim", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperationsOpen(caller, settings);
            Account account = accounts.find(identity)
                    .orElseThrow(() -> new LedgerException(LedgerError.NOTHING_STAKED,
                            "Aucun jeton staké pour " + Identities.normalize(identity)));

            long accrued = accrualEngine.settle(account, settings, Instant.now(clock));
            events.record(LedgerEventType.CLAIM, account.getAddress(), Identities.normalize(caller), accrued, null);
            log.info("Claim {} by {} : +{} (claimable={})",
                    account.getAddress(), caller, accrued, account.getClaimableBalance());
            return account;
        });
    }

    public long pendingRewards(String identity) {
        return accounts.find(identity)
                .map(a -> accrualEngine.pending(a, configService.current(), Instant.now(clock)))
                .orElse(0L);
    }
}
