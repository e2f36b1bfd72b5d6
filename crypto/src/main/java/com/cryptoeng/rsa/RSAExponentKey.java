/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.math.BigInteger;

/**
 * Private half of an RSA key for one role: the modulus and a private exponent. Signing uses the
 * exponent paired with 3, decryption the one paired with 5, but nothing here enforces which.
 */
public final class RSAExponentKey {

    private final @NonNull BigInteger modulus;
    private final @NonNull BigInteger exponent;

    public RSAExponentKey(BigInteger modulus, BigInteger exponent) {
        if (modulus == null || modulus.signum() <= 0)
            throw new IllegalArgumentException("modulus must be positive");
        if (exponent == null || exponent.signum() <= 0)
            throw new IllegalArgumentException("exponent must be positive");
        this.modulus = modulus;
        this.exponent = exponent;
    }

    public BigInteger getModulus() {
        return modulus;
    }

    public BigInteger getExponent() {
        return exponent;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof RSAExponentKey))
            return false;
        RSAExponentKey other = (RSAExponentKey) obj;
        return modulus.equals(other.modulus) && exponent.equals(other.exponent);
    }

    @Override
    public int hashCode() {
        return modulus.hashCode() * 31 + exponent.hashCode();
    }

    @Override
    public String toString() {
        return String.format("RSAExponentKey#%s", System.identityHashCode(this));
    }
}
