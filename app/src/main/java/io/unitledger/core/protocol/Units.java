package io.unitledger.core.protocol;

import static java.lang.Math.addExact;

/** Checked arithmetic on unit quantities (non-negative longs). */
public final class Units {
    private Units(){}

    public static long add(long a, long b) {
        try {
            return addExact(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, "Unit total overflow: " + a + " + " + b, e);
        }
    }

    /** Subtraction that refuses to go below zero. Underflow is a programming error, not a rejection. */
    public static long subtract(long a, long b) {
        if (b > a) {
            throw new IllegalStateException("Unit underflow: " + a + " - " + b);
        }
        return a - b;
    }

    public static long requirePositive(long amount, String what) {
        if (amount <= 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, what + " must be > 0 (was " + amount + ")");
        }
        return amount;
    }
}
