/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * A fixed public exponent has no inverse modulo lcm(p-1, q-1), so the primes are unusable.
 */
public class ExponentNotInvertibleException extends KeyGenerationError {

    private final PublicExponent exponent;

    public ExponentNotInvertibleException(PublicExponent exponent, ArithmeticException cause) {
        super("public exponent " + exponent.getValue() + " is not invertible for these primes", cause);
        this.exponent = exponent;
    }

    public PublicExponent getExponent() {
        return exponent;
    }
}
