package org.rewardledger.service.accrual;

import lombok.extern.slf4j.Slf4j;
import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;
import org.rewardledger.model.Account;
import org.rewardledger.service.LedgerMath;
import org.rewardledger.service.LedgerSettings;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Accrual paresseux : calculé à chaque interaction à partir de (stakedAmount, lastClaimTime, now),
 * sans aucune tâche planifiée.
 */
@Component
@Slf4j
public class InterestAccrualEngine {

    public long pending(Account account, LedgerSettings settings, Instant now) {
        long elapsed = AccrualRules.elapsedSeconds(account.getLastClaimTime(), now);
        return AccrualRules.claimable(account.getStakedAmount(), settings.dailyInterestRate(), elapsed);
    }

    public long settle(Account account, LedgerSettings settings, Instant now) {
        if (account.getStakedAmount() == 0) {
            throw new LedgerException(LedgerError.NOTHING_STAKED, "Aucun jeton staké pour " + account.getAddress());
        }
        return accrue(account, settings, now);
    }

    // comme settle, mais sans exiger de stake (balayage par lot)
    public long accrue(Account account, LedgerSettings settings, Instant now) {
        Instant last = account.getLastClaimTime();
        long elapsed = AccrualRules.elapsedSeconds(last, now);
        long amount = AccrualRules.claimable(account.getStakedAmount(), settings.dailyInterestRate(), elapsed);
        account.setClaimableBalance(LedgerMath.add(account.getClaimableBalance(), amount));
        // la fenêtre n'avance que des secondes entières comptabilisées ; la fraction reste due
        if (last == null) {
            account.setLastClaimTime(now);
        } else if (elapsed > 0) {
            account.setLastClaimTime(last.plusSeconds(elapsed));
        }
        log.debug("Accrued {} for {} (staked={})", amount, account.getAddress(), account.getStakedAmount());
        return amount;
    }
}
