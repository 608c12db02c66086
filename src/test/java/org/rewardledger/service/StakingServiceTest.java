package org.rewardledger.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.accrual.InterestAccrualEngine;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.rewardledger.service.ledger.FungibleLedger;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StakingServiceTest {
    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");
    private static final String CUSTODY = "0xcustody";

    @Mock
    private FungibleLedger tokenLedger;
    @Mock
    private AccountService accounts;
    @Mock
    private LedgerEventService events;
    @Mock
    private LedgerConfigService configService;
    @Mock
    private AdmissionGuard admission;

    private Account alice;

    @BeforeEach
    void setUp() {
        lenient().when(configService.current()).thenReturn(TestSettings.defaults());
        lenient().when(tokenLedger.custodyAddress()).thenReturn(CUSTODY);
        alice = Account.builder().address("0xalice").registered(true).lastClaimTime(T0).build();
    }

    private StakingService at(Instant now) {
        return new StakingService(tokenLedger, accounts, new InterestAccrualEngine(), events, configService,
                admission, new ExecutionGate(mock(PlatformTransactionManager.class)), Clock.fixed(now, ZoneOffset.UTC));
    }

    // --- stake ---

    @Test
    void stake_shouldPullTokensAndRestartClock() {
        when(accounts.requireRegistered("0xalice")).thenReturn(alice);
        when(tokenLedger.balanceOf("0xalice")).thenReturn(1000L);
        Instant now = T0.plusSeconds(3600);

        Account a = at(now).stake("0xalice", 600);

        assertThat(a.getStakedAmount()).isEqualTo(600L);
        assertThat(a.getLastClaimTime()).isEqualTo(now);
        verify(tokenLedger).transferFrom("0xalice", CUSTODY, 600L);
        verify(events).record(LedgerEventType.STAKE, "0xalice", 600L);
    }

    @Test
    void stake_insufficientBalance_shouldFailWithoutTransfer() {
        when(accounts.requireRegistered("0xalice")).thenReturn(alice);
        when(tokenLedger.balanceOf("0xalice")).thenReturn(10L);

        assertThatThrownBy(() -> at(T0).stake("0xalice", 11))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INSUFFICIENT_TOKEN_BALANCE);
        verify(tokenLedger, never()).transferFrom(anyString(), anyString(), anyLong());
        assertThat(alice.getStakedAmount()).isZero();
    }

    @Test
    void stake_unregistered_shouldFail() {
        when(accounts.requireRegistered("0xbob"))
                .thenThrow(new LedgerException(LedgerError.NOT_REGISTERED, "non inscrit"));

        assertThatThrownBy(() -> at(T0).stake("0xbob", 5))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.NOT_REGISTERED);
    }

    @Test
    void stakeThenUnstake_atSameInstant_shouldRestoreStakeWithZeroAccrual() {
        alice.setStakedAmount(200);
        when(accounts.requireRegistered("0xalice")).thenReturn(alice);
        when(accounts.find("0xalice")).thenReturn(Optional.of(alice));
        when(tokenLedger.balanceOf("0xalice")).thenReturn(500L);
        StakingService s = at(T0);

        s.stake("0xalice", 300);
        s.unstake("0xalice", 300);

        assertThat(alice.getStakedAmount()).isEqualTo(200L);
        assertThat(alice.getClaimableBalance()).isZero();
        verify(tokenLedger).transfer("0xalice", 300L);
    }

    // --- unstake ---

    @Test
    void unstake_shouldSettleBeforeReducingStake() {
        alice.setStakedAmount(1000);
        when(accounts.find("0xalice")).thenReturn(Optional.of(alice));

        Account a = at(T0.plusSeconds(43_200)).unstake("0xalice", 400);

        // l'accrual porte sur les 1000 stakés avant le retrait
        assertThat(a.getClaimableBalance()).isEqualTo(10L);
        assertThat(a.getStakedAmount()).isEqualTo(600L);
        assertThat(a.getLastClaimTime()).isEqualTo(T0.plusSeconds(43_200));
        verify(events).record(LedgerEventType.UNSTAKE, "0xalice", 400L);
    }

    @Test
    void unstake_moreThanStaked_shouldFail() {
        alice.setStakedAmount(10);
        when(accounts.find("0xalice")).thenReturn(Optional.of(alice));

        assertThatThrownBy(() -> at(T0).unstake("0xalice", 11))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.INSUFFICIENT_STAKE);
        verify(tokenLedger, never()).transfer(anyString(), anyLong());
    }

    // --- claim ---

    @Test
    void claim_byRelayer_shouldCreditTargetAccount() {
        alice.setStakedAmount(1000);
        when(accounts.find("0xalice")).thenReturn(Optional.of(alice));

        Account a = at(T0.plusSeconds(86_400)).claim("0xRelayer", "0xalice");

        assertThat(a.getClaimableBalance()).isEqualTo(20L);
        verify(events).record(LedgerEventType.CLAIM, "0xalice", "0xrelayer", 20L, null);
        verify(admission).requireOperationsOpen("0xRelayer", TestSettings.defaults());
    }

    @Test
    void claim_nothingStaked_shouldFail() {
        when(accounts.find("0xalice")).thenReturn(Optional.of(alice));

        assertThatThrownBy(() -> at(T0.plusSeconds(60)).claim("0xalice", "0xalice"))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getError())
                .isEqualTo(LedgerError.NOTHING_STAKED);
        verifyNoInteractions(events);
    }

    @Test
    void pendingRewards_shouldPreviewWithoutMutation() {
        alice.setStakedAmount(1000);
        when(accounts.find("0xalice")).thenReturn(Optional.of(alice));
        when(accounts.find("0xnobody")).thenReturn(Optional.empty());
        StakingService s = at(T0.plusSeconds(43_200));

        assertThat(s.pendingRewards("0xalice")).isEqualTo(10L);
        assertThat(s.pendingRewards("0xnobody")).isZero();
        assertThat(alice.getLastClaimTime()).isEqualTo(T0);
    }
}
