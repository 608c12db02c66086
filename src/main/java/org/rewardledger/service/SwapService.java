package org.rewardledger.service;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.dto.SwapResult;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.guard.AdmissionGuard;
import org.rewardledger.service.guard.ExecutionGate;
import org.rewardledger.service.ledger.FungibleLedger;
import org.rewardledger.service.referral.ReferralCascadeEngine;
import org.rewardledger.service.referral.ReferralCredit;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class SwapService {
    private final FungibleLedger tokenLedger;
    private final FungibleLedger stableLedger;
    private final AccountService accounts;
    private final ReferralCascadeEngine referralEngine;
    private final LedgerEventService events;
    private final LedgerConfigService configService;
    private final AdmissionGuard admission;
    private final ExecutionGate gate;

    public SwapService(@Qualifier("tokenLedger") FungibleLedger tokenLedger,
                       @Qualifier("stableLedger") FungibleLedger stableLedger,
                       AccountService accounts,
                       ReferralCascadeEngine referralEngine,
                       LedgerEventService events,
                       LedgerConfigService configService,
                       AdmissionGuard admission,
                       ExecutionGate gate) {
        this.tokenLedger = tokenLedger;
        this.stableLedger = stableLedger;
        this.accounts = accounts;
        this.referralEngine = referralEngine;
        this.events = events;
        this.configService = configService;
        this.admission = admission;
        this.gate = gate;
    }

    // STABLE -> TOKEN au taux courant, 5 % de frais à l'opérateur, puis cascade de parrainage
    public SwapResult swap(String caller, long stableAmount) {
        return gate.execute("swap", () -> {
            LedgerSettings settings = configService.current();
            admission.requireOperationsOpen(caller, settings);
            LedgerMath.requirePositive(stableAmount);
            String id = Identities.normalize(caller);

            stableLedger.transferFrom(id, stableLedger.custodyAddress(), stableAmount);
            long tokenAmount = LedgerMath.mulDiv(stableAmount, 100, settings.tokenToStableRate());
            long fee = LedgerMath.operatorFee(stableAmount);
            stableLedger.transfer(settings.operatorAddress(), fee);
            tokenLedger.transfer(id, tokenAmount);

            String referrer = accounts.find(id)
                    .filter(Account::hasReferrer)
                    .map(Account::getReferrer)
                    .orElse(null);
            List<ReferralCredit> credits = referrer == null
                    ? List.of()
                    : referralEngine.distribute(id, referrer, tokenAmount, settings);

            events.record(LedgerEventType.SWAP, id, null, tokenAmount, null);
            log.info("Swap {} : {} STABLE -> {} TOKEN (fee={}, referral levels={})",
                    id, stableAmount, tokenAmount, fee, credits.size());

            return SwapResult.builder()
                    .stableAmount(stableAmount)
                    .tokenAmount(tokenAmount)
                    .operatorFee(fee)
                    .referralCredits(credits)
                    .build();
        });
    }
}
