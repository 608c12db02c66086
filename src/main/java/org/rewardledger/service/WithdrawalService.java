package org.rewardledger.service;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.dto.WithdrawalResult;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.rewardledger.service.ledger.FungibleLedger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WithdrawalService {
    private final FungibleLedger stableLedger;
    private final AccountService accounts;
    private final LedgerEventService events;
    private final LedgerConfigService configService;
    private final AdmissionGuard admission;
    private final ExecutionGate gate;

    public WithdrawalService(@Qualifier("stableLedger") FungibleLedger stableLedger,
                             AccountService accounts,
                             LedgerEventService events,
                             LedgerConfigService configService,
                             AdmissionGuard admission,
                             ExecutionGate gate) {
        this.stableLedger = stableLedger;
        this.accounts = accounts;
        this.events = events;
        this.configService = configService;
        this.admission = admission;
        this.gate = gate;
    }

    // soumis à la seule pause des retraits, pas à la pause générale
    public WithdrawalResult withdrawStable(String caller, long amount) {
        return gate.execute("withdrawStable", () -> {
            LedgerSettings settings = configService.current();
            admission.requireWithdrawalsOpen(caller, settings);
            LedgerMath.requirePositive(amount);
            Account account = accounts.find(caller)
                    .filter(a -> a.getClaimableBalance() >= amount)
                    .orElseThrow(() -> new LedgerException(LedgerError.INSUFFICIENT_CLAIMABLE,
                            "Solde réclamable insuffisant"));

            account.setClaimableBalance(account.getClaimableBalance() - amount);
            long fee = LedgerMath.operatorFee(amount);
            long paidOut = amount - fee;
            stableLedger.transfer(settings.operatorAddress(), fee);
            stableLedger.transfer(account.getAddress(), paidOut);

            events.record(LedgerEventType.WITHDRAWAL, account.getAddress(), amount);
            log.info("Withdrawal {} : {} (fee={}, claimable={})",
                    account.getAddress(), amount, fee, account.getClaimableBalance());

            return WithdrawalResult.builder()
                    .amount(amount)
                    .operatorFee(fee)
                    .paidOut(paidOut)
                    .claimableBalance(account.getClaimableBalance())
                    .build();
        });
    }
}
