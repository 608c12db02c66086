package org.rewardledger.service;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.model.RegistryEntry;
import org.rewardledger.repo.AccountRepository;
import org.rewardledger.repo.RegistryEntryRepository;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.rewardledger.service.ledger.FungibleLedger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class AccountService {
    private final AccountRepository accountRepo;
    private final RegistryEntryRepository registryRepo;
    private final LedgerEventService events;
    private final FungibleLedger tokenLedger;
    private final LedgerConfigService configService;
    private final AdmissionGuard admission;
    private final ExecutionGate gate;
    private final Clock clock;

    public AccountService(AccountRepository accountRepo,
                          RegistryEntryRepository registryRepo,
                          LedgerEventService events,
                          @Qualifier("tokenLedger") FungibleLedger tokenLedger,
                          LedgerConfigService configService,
                          AdmissionGuard admission,
                          ExecutionGate gate,
                          Clock clock) {
        this.accountRepo = accountRepo;
        this.registryRepo = registryRepo;
        this.events = events;
        this.tokenLedger = tokenLedger;
        this.configService = configService;
        this.admission = admission;
        this.gate = gate;
        this.clock = clock;
    }

    // --- Inscription par l'utilisateur lui-même ---
    public Account signup(String caller, String referrer) {
        return gate.execute("signup", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperationsOpen(caller, settings);
            return register(caller, referrer, settings, Instant.now(clock));
        });
    }

    /**
     * Marque le compte inscrit, démarre son horloge d'accrual, l'ajoute au registre,
     * fixe son parrain et lui verse le bonus d'inscription depuis la garde.
     */
    public Account register(String identity, String referrer, LedgerSettings settings, Instant now) {
        String id = requireIdentity(identity);
        Account account = getOrCreate(id);
        if (account.isRegistered()) {
            throw new LedgerException(LedgerError.ALREADY_REGISTERED, "Compte déjà inscrit: " + id);
        }

        account.setRegistered(true);
        account.setRegisteredAt(now);
        account.setLastClaimTime(now);
        account.setReferrer(resolveReferrer(id, referrer, settings));
        appendToRegistry(id, now);

        tokenLedger.transfer(id, settings.signupBonusAmount());
        events.record(LedgerEventType.SIGNUP, id, account.getReferrer(), settings.signupBonusAmount(), null);
        log.info("Signup {} (referrer={}, bonus={})", id, account.getReferrer(), settings.signupBonusAmount());
        return account;
    }

    /**
     * Chemin de migration de confiance : force le solde réclamable, inscrit le compte,
     * sans settlement. {@code referrer == null} laisse le parrain inchangé.
     */
    public Account setBalance(String identity, long amount, String referrer, LedgerSettings settings, Instant now) {
        String id = requireIdentity(identity);
        if (amount < 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "Montant invalide: " + amount);
        }
        Account account = getOrCreate(id);
        boolean firstRegistration = !account.isRegistered();

        account.setClaimableBalance(amount);
        account.setRegistered(true);
        if (referrer != null && !account.hasReferrer()) {
            account.setReferrer(resolveReferrer(id, referrer, settings));
        }
        if (firstRegistration) {
            account.setRegisteredAt(now);
            if (account.getLastClaimTime() == null) account.setLastClaimTime(now);
            appendToRegistry(id, now);
        }

        events.record(LedgerEventType.BALANCE_SET, id, account.getReferrer(), amount, null);
        log.info("Balance set for {} to {} (referrer={})", id, amount, account.getReferrer());
        return account;
    }

    public Optional<Account> find(String identity) {
        String id = Identities.normalize(identity);
        if (id == null) return Optional.empty();
        return accountRepo.findByAddress(id);
    }

    public Account requireRegistered(String identity) {
        return find(identity)
                .filter(Account::isRegistered)
                .orElseThrow(() -> new LedgerException(LedgerError.NOT_REGISTERED,
                        "Compte non inscrit: " + Identities.normalize(identity)));
    }

    // les comptes crédités par parrainage peuvent exister sans être inscrits
    public Account getOrCreate(String identity) {
        String id = requireIdentity(identity);
        return accountRepo.findByAddress(id).orElseGet(() -> accountRepo.save(Account.builder()
                .address(id)
                .registered(false)
                .build()));
    }

    public long registrySize() {
        return registryRepo.count();
    }

    // les {@code count} premiers inscrits, dans l'ordre d'inscription
    public List<Account> firstRegistered(int count) {
        if (count <= 0) return List.of();
        List<String> addresses = registryRepo.findAllByOrderByIdAsc(PageRequest.of(0, count)).stream()
                .map(RegistryEntry::getAddress)
                .toList();
        Map<String, Account> byAddress = accountRepo.findByAddressIn(addresses).stream()
                .collect(Collectors.toMap(Account::getAddress, Function.identity()));
        return addresses.stream()
                .map(byAddress::get)
                .filter(Objects::nonNull)
                .toList();
    }

    // absent ou auto-parrainage => opérateur ; l'opérateur lui-même n'a pas de parrain
    String resolveReferrer(String identity, String referrer, LedgerSettings settings) {
        String r = Identities.normalize(referrer);
        if (r == null || r.equals(identity)) {
            r = settings.operatorAddress();
        }
        return identity.equals(r) ? null : r;
    }

    private void appendToRegistry(String id, Instant now) {
        if (registryRepo.existsByAddress(id)) return;
        registryRepo.save(RegistryEntry.builder()
                .address(id)
                .registeredAt(now)
                .build());
    }

    private String requireIdentity(String identity) {
        String id = Identities.normalize(identity);
        if (id == null) {
            throw new LedgerException(LedgerError.INVALID_IDENTITY, "Identité manquante");
        }
        return id;
    }
}
