package org.rewardledger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.LedgerConfig;
import org.rewardledger.repo.LedgerConfigRepository;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerConfigServiceTest {

    @Mock
    private LedgerConfigRepository repo;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LedgerConfigService service;

    @BeforeEach
    void setUp() {
        service = new LedgerConfigService(repo, objectMapper,
                "0x00000000000000000000000000000000000000AA", "", 2, 100, 100, "50,30,20,10,5");
        lenient().when(repo.save(any(LedgerConfig.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // --- @PostConstruct initFromDb() ---

    @Test
    void initFromDb_whenNoConfigInDb_shouldPersistDefaults() {
        when(repo.findAll()).thenReturn(Collections.emptyList());

        service.initFromDb();

        LedgerSettings s = service.current();
        assertThat(s.dailyInterestRate()).isEqualTo(2L);
        assertThat(s.signupBonusAmount()).isEqualTo(100L);
        assertThat(s.tokenToStableRate()).isEqualTo(100L);
        assertThat(s.referralPercents()).containsExactly(50, 30, 20, 10, 5);
        assertThat(s.operatorAddress()).isEqualTo(TestSettings.OPERATOR);
        assertThat(s.gasEstimatorAddress()).isNull();

        ArgumentCaptor<LedgerConfig> captor = ArgumentCaptor.forClass(LedgerConfig.class);
        verify(repo).save(captor.capture());
        assertThat(captor.getValue().getReferralPercentsJson()).isEqualTo("[50,30,20,10,5]");
    }

    @Test
    void initFromDb_whenConfigExists_shouldLoadIt() {
        LedgerConfig existing = LedgerConfig.builder()
                .id(1L)
                .dailyInterestRate(7)
                .signupBonusAmount(1)
                .tokenToStableRate(50)
                .referralPercentsJson("[100,0,0,0,0]")
                .pausedForOperations(true)
                .operatorAddress("0xop")
                .build();
        when(repo.findAll()).thenReturn(List.of(existing));

        service.initFromDb();

        assertThat(service.current().dailyInterestRate()).isEqualTo(7L);
        assertThat(service.current().referralPercents()).containsExactly(100, 0, 0, 0, 0);
        assertThat(service.current().pausedForOperations()).isTrue();
        verify(repo, never()).save(any(LedgerConfig.class));
    }

    // --- setters ---

    @Test
    void setReferralPercents_shouldPersistAndRefreshSnapshot() {
        when(repo.findAll()).thenReturn(Collections.emptyList());
        service.initFromDb();
        LedgerSettings before = service.current();

        LedgerSettings after = service.setReferralPercents(List.of(100, 50, 25, 0, 1000));

        assertThat(after.referralPercents()).containsExactly(100, 50, 25, 0, 1000);
        assertThat(service.current()).isSameAs(after);
        // l'ancien instantané reste inchangé
        assertThat(before.referralPercents()).containsExactly(50, 30, 20, 10, 5);
    }

    @Test
    void setReferralPercents_wrongLengthOrRange_shouldFail() {
        assertThatThrownBy(() -> service.setReferralPercents(List.of(1, 2, 3)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_REFERRAL_TABLE);

        assertThatThrownBy(() -> service.setReferralPercents(List.of(50, 30, 20, 10, 1001)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_REFERRAL_TABLE);

        verify(repo, never()).save(any(LedgerConfig.class));
    }

    @Test
    void constructor_invalidDefaultTable_shouldFail() {
        assertThatThrownBy(() -> new LedgerConfigService(repo, objectMapper,
                "0xop", "", 2, 100, 100, "50,30"))
                .isInstanceOf(LedgerException.class);
    }

    @Test
    void setTokenToStableRate_zero_shouldFail() {
        assertThatThrownBy(() -> service.setTokenToStableRate(0))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INVALID_AMOUNT);
    }

    @Test
    void pauseFlags_shouldBeIndependent() {
        when(repo.findAll()).thenReturn(Collections.emptyList());
        service.initFromDb();

        service.setPausedForWithdrawals(true);

        assertThat(service.current().pausedForWithdrawals()).isTrue();
        assertThat(service.current().pausedForOperations()).isFalse();
    }

    @Test
    void setDailyInterestRate_shouldUpdateRate() {
        when(repo.findAll()).thenReturn(Collections.emptyList());
        service.initFromDb();

        assertThat(service.setDailyInterestRate(5).dailyInterestRate()).isEqualTo(5L);
        assertThat(service.setSignupBonus(0).signupBonusAmount()).isZero();
    }

    // --- publication après commit ---

    @Test
    void setter_insideTransaction_shouldPublishOnlyAfterCommit() {
        when(repo.findAll()).thenReturn(Collections.emptyList());
        service.initFromDb();
        TransactionSynchronizationManager.initSynchronization();
        try {
            service.setPausedForOperations(true);

            // pas encore commité : les opérations voient toujours l'ancien instantané
            assertThat(service.current().pausedForOperations()).isFalse();

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);

            assertThat(service.current().pausedForOperations()).isTrue();
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void setter_rolledBack_shouldKeepPreviousSnapshot() {
        when(repo.findAll()).thenReturn(Collections.emptyList());
        service.initFromDb();
        TransactionSynchronizationManager.initSynchronization();
        try {
            service.setDailyInterestRate(9);

            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

            assertThat(service.current().dailyInterestRate()).isEqualTo(2L);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }
}
