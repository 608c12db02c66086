package org.rewardledger.service;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.model.Asset;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.rewardledger.service.ledger.FungibleLedger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Surface d'administration : réservée à l'opérateur configuré, chaque appel passe
 * par la même porte d'exécution que les opérations utilisateur.
 */
@Service
@Slf4j
public class AdminService {
    private final LedgerConfigService configService;
    private final AccountService accounts;
    private final LedgerEventService events;
    private final FungibleLedger tokenLedger;
    private final FungibleLedger stableLedger;
    private final AdmissionGuard admission;
    private final ExecutionGate gate;
    private final Clock clock;

    public AdminService(LedgerConfigService configService,
                        AccountService accounts,
                        LedgerEventService events,
                        @Qualifier("tokenLedger") FungibleLedger tokenLedger,
                        @Qualifier("stableLedger") FungibleLedger stableLedger,
                        AdmissionGuard admission,
                        ExecutionGate gate,
                        Clock clock) {
        this.configService = configService;
        this.accounts = accounts;
        this.events = events;
        this.tokenLedger = tokenLedger;
        this.stableLedger = stableLedger;
        this.admission = admission;
        this.gate = gate;
        this.clock = clock;
    }

    public LedgerSettings config(String caller) {
        LedgerSettings settings = configService.current();
        admission.requireOperator(caller, settings);
        return settings;
    }

    public LedgerSettings setDailyInterestRate(String caller, long rate) {
        return asOperator(caller, "setDailyInterestRate", () -> configService.setDailyInterestRate(rate));
    }

    public LedgerSettings setSignupBonus(String caller, long amount) {
        return asOperator(caller, "setSignupBonus", () -> configService.setSignupBonus(amount));
    }

    public LedgerSettings setTokenToStableRate(String caller, long rate) {
        return asOperator(caller, "setTokenToStableRate", () -> configService.setTokenToStableRate(rate));
    }

    public LedgerSettings setReferralPercents(String caller, List<Integer> table) {
        return asOperator(caller, "setReferralPercents", () -> configService.setReferralPercents(table));
    }

    public LedgerSettings setPausedForOperations(String caller, boolean paused) {
        return asOperator(caller, "setPausedForOperations", () -> configService.setPausedForOperations(paused));
    }

    public LedgerSettings setPausedForWithdrawals(String caller, boolean paused) {
        return asOperator(caller, "setPausedForWithdrawals", () -> configService.setPausedForWithdrawals(paused));
    }

    // migration : force le solde réclamable sans settlement
    public Account setBalance(String caller, String identity, long amount, String referrer) {
        return gate.execute("setBalance", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperator(caller, settings);
            return accounts.setBalance(identity, amount, referrer, settings, Instant.now(clock));
        });
    }

    // récupère des fonds détenus en garde vers une adresse quelconque
    public long sweep(String caller, Asset asset, String to, long amount) {
        return gate.execute("sweep", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperator(caller, settings);
            LedgerMath.requirePositive(amount);
            String destination = Identities.normalize(to);
            if (destination == null) {
                throw new LedgerException(LedgerError.INVALID_IDENTITY, "Destination manquante");
            }
            if (asset == null) {
                throw new LedgerException(LedgerError.INVALID_AMOUNT, "Actif manquant");
            }
            FungibleLedger ledger = asset == Asset.TOKEN ? tokenLedger : stableLedger;
            ledger.transfer(destination, amount);

            events.record(LedgerEventType.SWEEP, destination, asset.name(), amount, null);
            log.info("Swept {} {} from custody to {}", amount, asset, destination);
            return ledger.balanceOf(ledger.custodyAddress());
        });
    }

    private LedgerSettings asOperator(String caller, String operation, Supplier<LedgerSettings> change) {
        return gate.execute(operation, () -> {
            admission.requireOperator(caller, configService.current());
            return change.get();
        });
    }
}
