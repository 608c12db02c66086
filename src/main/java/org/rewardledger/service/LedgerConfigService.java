package org.rewardledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.LedgerConfig;
import org.rewardledger.repo.LedgerConfigRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

@Service
@Slf4j
public class LedgerConfigService {
    public static final int REFERRAL_LEVELS = 5;

    private final LedgerConfigRepository repo;
    private final ObjectMapper objectMapper;
    private final LedgerConfig defaults;
    private volatile LedgerSettings current;

    // Valeurs initiales lues depuis application.properties, utilisées seulement si la table est vide
    public LedgerConfigService(LedgerConfigRepository repo,
                               ObjectMapper objectMapper,
                               @Value("${ledger.operator-address}") String operatorAddress,
                               @Value("${ledger.gas-estimator-address:}") String gasEstimatorAddress,
                               @Value("${ledger.daily-interest-rate:2}") long dailyInterestRate,
                               @Value("${ledger.signup-bonus:100}") long signupBonus,
                               @Value("${ledger.token-to-stable-rate:100}") long tokenToStableRate,
                               @Value("${ledger.referral-percents:50,30,20,10,5}") String referralPercents) {
        this.repo = repo;
        this.objectMapper = objectMapper;
        List<Integer> table = Arrays.stream(referralPercents.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .map(Integer::valueOf)
                .toList();
        validateReferralTable(table);
        this.defaults = LedgerConfig.builder()
                .operatorAddress(Identities.normalize(operatorAddress))
                .gasEstimatorAddress(Identities.normalize(gasEstimatorAddress))
                .dailyInterestRate(dailyInterestRate)
                .signupBonusAmount(signupBonus)
                .tokenToStableRate(tokenToStableRate)
                .referralPercentsJson(writeTable(table))
                .pausedForOperations(false)
                .pausedForWithdrawals(false)
                .build();
    }

    @PostConstruct // au démarrage → charge la config depuis la DB (ou persiste les valeurs par défaut)
    public void initFromDb() {
        List<LedgerConfig> all = repo.findAll();
        LedgerConfig cfg;
        if (all.isEmpty()) {
            cfg = repo.save(defaults);
            log.info("Ledger config initialised from properties (operator={})", cfg.getOperatorAddress());
        } else {
            cfg = all.get(0);
        }
        this.current = toSettings(cfg);
    }

    public LedgerSettings current() {
        return current;
    }

    public synchronized LedgerSettings setDailyInterestRate(long rate) {
        if (rate < 0) throw new LedgerException(LedgerError.INVALID_AMOUNT, "Taux journalier invalide: " + rate);
        return update(c -> c.setDailyInterestRate(rate));
    }

    public synchronized LedgerSettings setSignupBonus(long amount) {
        if (amount < 0) throw new LedgerException(LedgerError.INVALID_AMOUNT, "Bonus invalide: " + amount);
        return update(c -> c.setSignupBonusAmount(amount));
    }

    public synchronized LedgerSettings setTokenToStableRate(long rate) {
        LedgerMath.requirePositive(rate);
        return update(c -> c.setTokenToStableRate(rate));
    }

    public synchronized LedgerSettings setReferralPercents(List<Integer> table) {
        validateReferralTable(table);
        String json = writeTable(table);
        return update(c -> c.setReferralPercentsJson(json));
    }

    public synchronized LedgerSettings setPausedForOperations(boolean paused) {
        return update(c -> c.setPausedForOperations(paused));
    }

    public synchronized LedgerSettings setPausedForWithdrawals(boolean paused) {
        return update(c -> c.setPausedForWithdrawals(paused));
    }

    // persiste d'abord ; le nouvel instantané n'est visible qu'une fois la transaction commitée
    private LedgerSettings update(Consumer<LedgerConfig> change) {
        LedgerConfig cfg = repo.findAll().stream().findFirst().orElse(defaults);
        change.accept(cfg);
        LedgerConfig saved = repo.save(cfg);
        LedgerSettings settings = toSettings(saved);
        publishAfterCommit(settings);
        log.info("Ledger config updated: rate={} bonus={} swapRate={} referral={} pausedOps={} pausedWithdrawals={}",
                settings.dailyInterestRate(), settings.signupBonusAmount(), settings.tokenToStableRate(),
                settings.referralPercents(), settings.pausedForOperations(), settings.pausedForWithdrawals());
        return settings;
    }

    private void publishAfterCommit(LedgerSettings settings) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            this.current = settings;
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                current = settings;
            }
        });
    }

    private LedgerSettings toSettings(LedgerConfig cfg) {
        return new LedgerSettings(
                cfg.getDailyInterestRate(),
                cfg.getSignupBonusAmount(),
                cfg.getTokenToStableRate(),
                readTable(cfg.getReferralPercentsJson()),
                cfg.isPausedForOperations(),
                cfg.isPausedForWithdrawals(),
                cfg.getOperatorAddress(),
                cfg.getGasEstimatorAddress());
    }

    static void validateReferralTable(List<Integer> table) {
        if (table == null || table.size() != REFERRAL_LEVELS) {
            throw new LedgerException(LedgerError.INVALID_REFERRAL_TABLE,
                    "La table de parrainage doit contenir exactement " + REFERRAL_LEVELS + " entrées");
        }
        for (Integer p : table) {
            if (p == null || p < 0 || p > 1000) {
                throw new LedgerException(LedgerError.INVALID_REFERRAL_TABLE, "Pour-mille invalide: " + p);
            }
        }
    }

    private String writeTable(List<Integer> table) {
        try {
            return objectMapper.writeValueAsString(table);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Impossible de sérialiser la table de parrainage", e);
        }
    }

    private List<Integer> readTable(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<List<Integer>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Table de parrainage corrompue: " + json, e);
        }
    }
}
