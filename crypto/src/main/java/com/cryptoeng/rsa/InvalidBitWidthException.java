/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * Requested bit length is outside of the supported range. This is a caller error and is never
 * retried.
 */
public class InvalidBitWidthException extends IllegalArgumentException {

    private final int requested;
    private final int min;
    private final int max;

    public InvalidBitWidthException(int requested, int min, int max) {
        super(String.format("bit length %d is out of range [%d, %d]", requested, min, max));
        this.requested = requested;
        this.min = min;
        this.max = max;
    }

    /**
     * Throw unless {@code min <= bits <= max}.
     */
    static void check(int bits, int min, int max) {
        if (bits < min || bits > max)
            throw new InvalidBitWidthException(bits, min, max);
    }

    public int getRequested() {
        return requested;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }
}
