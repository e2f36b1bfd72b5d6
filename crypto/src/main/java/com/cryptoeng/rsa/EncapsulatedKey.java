/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Result of {@link RSAEncapsulation#encryptSymmetricKey(RSAPublicKey)}: the 256-bit symmetric key
 * and the RSA ciphertext it is recovered from. Only the ciphertext is meant to be sent.
 */
public final class EncapsulatedKey {

    private final @NonNull byte[] key;
    private final @NonNull BigInteger ciphertext;

    public EncapsulatedKey(byte[] key, BigInteger ciphertext) {
        if (key == null || ciphertext == null)
            throw new IllegalArgumentException("key and ciphertext are required");
        this.key = key.clone();
        this.ciphertext = ciphertext;
    }

    /**
     * @return copy of the symmetric key bytes
     */
    public byte[] getKey() {
        return key.clone();
    }

    public BigInteger getCiphertext() {
        return ciphertext;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof EncapsulatedKey))
            return false;
        EncapsulatedKey other = (EncapsulatedKey) obj;
        return ciphertext.equals(other.ciphertext) && Arrays.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return ciphertext.hashCode();
    }

    @Override
    public String toString() {
        return String.format("EncapsulatedKey(%d-bit ciphertext)", ciphertext.bitLength());
    }
}
