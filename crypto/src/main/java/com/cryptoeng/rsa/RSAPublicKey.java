/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.math.BigInteger;

/**
 * RSA public key: the modulus and one of the fixed {@link PublicExponent}s.
 */
public final class RSAPublicKey {

    private final @NonNull BigInteger modulus;
    private final @NonNull PublicExponent exponent;

    public RSAPublicKey(BigInteger modulus, PublicExponent exponent) {
        if (modulus == null || modulus.signum() <= 0)
            throw new IllegalArgumentException("modulus must be positive");
        if (exponent == null)
            throw new IllegalArgumentException("exponent must not be null");
        this.modulus = modulus;
        this.exponent = exponent;
    }

    public BigInteger getModulus() {
        return modulus;
    }

    public PublicExponent getExponent() {
        return exponent;
    }

    /**
     * Modulus size in bits.
     */
    public int getBitStrength() {
        return modulus.bitLength();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof RSAPublicKey))
            return false;
        RSAPublicKey other = (RSAPublicKey) obj;
        return exponent == other.exponent && modulus.equals(other.modulus);
    }

    @Override
    public int hashCode() {
        return modulus.hashCode() * 31 + exponent.hashCode();
    }

    @Override
    public String toString() {
        return String.format("RSAPublicKey(%d bits, e=%d)", getBitStrength(), exponent.getValue());
    }
}
