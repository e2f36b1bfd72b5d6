/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import java.math.BigInteger;

/**
 * The two fixed public exponents. Every key pair supports both; the exponent tells which role a
 * public key plays.
 */
public enum PublicExponent {
    /** Signature verification, paired with the private exponent d3. */
    VERIFICATION(3),
    /** Symmetric key encryption, paired with the private exponent d5. */
    ENCRYPTION(5);

    private final int value;
    private final BigInteger bigValue;

    PublicExponent(int value) {
        this.value = value;
        this.bigValue = BigInteger.valueOf(value);
    }

    public int getValue() {
        return value;
    }

    public BigInteger toBigInteger() {
        return bigValue;
    }

    /**
     * Find the exponent by its numeric value.
     *
     * @throws IllegalArgumentException if the value is neither 3 nor 5
     */
    public static PublicExponent of(int value) {
        for (PublicExponent e : values())
            if (e.value == value)
                return e;
        throw new IllegalArgumentException("unsupported public exponent: " + value);
    }
}
