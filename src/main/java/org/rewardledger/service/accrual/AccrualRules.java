package org.rewardledger.service.accrual;

import org.rewardledger.service.LedgerMath;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

public final class AccrualRules {
    public static final long SECONDS_PER_DAY = 86_400L;

    private AccrualRules() {}

    // jamais négatif, même si l'horloge recule
    public static long elapsedSeconds(Instant lastClaimTime, Instant now) {
        if (lastClaimTime == null || !now.isAfter(lastClaimTime)) return 0L;
        return Duration.between(lastClaimTime, now).getSeconds();
    }

    /**
     * staked * rate * elapsed / 100 / 86400, division entière tronquée.
     */
    public static long claimable(long stakedAmount, long dailyInterestRate, long elapsedSeconds) {
        if (stakedAmount <= 0 || dailyInterestRate <= 0 || elapsedSeconds <= 0) return 0L;
        BigInteger v = BigInteger.valueOf(stakedAmount)
                .multiply(BigInteger.valueOf(dailyInterestRate))
                .multiply(BigInteger.valueOf(elapsedSeconds))
                .divide(BigInteger.valueOf(100))
                .divide(BigInteger.valueOf(SECONDS_PER_DAY));
        return LedgerMath.narrow(v);
    }
}
