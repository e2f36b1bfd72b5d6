/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa.random;

import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * {@link RandomSource} backed by a {@link SecureRandom}. Sampling uses rejection so every value of
 * the range is equally likely.
 */
public class SecureRandomSource implements RandomSource {

    private final SecureRandom rng;

    public SecureRandomSource() {
        this(new SecureRandom());
    }

    public SecureRandomSource(SecureRandom rng) {
        if (rng == null)
            throw new IllegalArgumentException("rng must not be null");
        this.rng = rng;
    }

    @Override
    public BigInteger uniform(BigInteger low, BigInteger high) {
        if (low.compareTo(high) > 0)
            throw new IllegalArgumentException("empty range: " + low + " > " + high);
        return BigIntegers.createRandomInRange(low, high, rng);
    }

    @Override
    public String toString() {
        return String.format("SecureRandomSource(%s)", rng.getAlgorithm());
    }
}
