/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * No suitable prime was found within the retry budget.
 */
public class PrimeGenerationExhaustedException extends KeyGenerationError {

    private final int bitLength;
    private final int attempts;

    public PrimeGenerationExhaustedException(int bitLength, int attempts) {
        super(String.format("no %d-bit prime found in %d attempts", bitLength, attempts));
        this.bitLength = bitLength;
        this.attempts = attempts;
    }

    public int getBitLength() {
        return bitLength;
    }

    public int getAttempts() {
        return attempts;
    }
}
