package com.bitaware.util;

import com.bitaware.flag.BitFlag;

/**
 * Bit arithmetic shared by flag sets and bit-aware values.
 */
public final class Bits {

    private Bits() {} // utility class

    /**
     * @param value the candidate flag value
     * @return true if value is strictly positive and has exactly one bit set
     */
    public static boolean isPowerOfTwo(long value) {
        return value > 0 && (value & (value - 1)) == 0;
    }

    public static boolean intersects(long value, long mask) {
        return (value & mask) != 0;
    }

    /**
     * Sum of member values. Members are distinct powers of two, so the sum never overflows
     * and equals their bitwise OR.
     */
    public static long sum(Iterable<? extends BitFlag> flags) {
        long total = 0;
        for (var flag : flags) {
            total += flag.getValue();
        }
        return total;
    }
}
