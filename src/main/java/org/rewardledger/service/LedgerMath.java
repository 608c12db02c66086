package org.rewardledger.service;

import org.rewardledger.exception.LedgerError;
import org.rewardledger.exception.LedgerException;

import java.math.BigInteger;

// Arithmétique entière tronquée : les restes sous l'unité sont perdus, jamais reportés
public final class LedgerMath {
    public static final long OPERATOR_FEE_PERCENT = 5L;

    private LedgerMath() {}

    public static long mulDiv(long a, long b, long divisor) {
        if (divisor <= 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "Diviseur invalide: " + divisor);
        }
        BigInteger r = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divide(BigInteger.valueOf(divisor));
        return narrow(r);
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "Dépassement arithmétique");
        }
    }

    public static long operatorFee(long amount) {
        return mulDiv(amount, OPERATOR_FEE_PERCENT, 100);
    }

    public static long narrow(BigInteger value) {
        if (value.bitLength() > 63) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "Dépassement arithmétique");
        }
        return value.longValue();
    }

    public static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "Montant invalide: " + amount);
        }
    }
}
