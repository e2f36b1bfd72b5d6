/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa.random;

import java.math.BigInteger;

/**
 * Source of uniformly distributed big integers. Every component that needs randomness receives
 * one explicitly, so tests can substitute a deterministic one without touching real entropy.
 * <p>
 * Implementations are not required to be thread-safe.
 */
public interface RandomSource {

    /**
     * Draw a uniformly distributed integer from the inclusive range.
     *
     * @param low  lower bound, inclusive
     * @param high upper bound, inclusive, must not be less than {@code low}
     *
     * @return value in {@code [low, high]}
     */
    BigInteger uniform(BigInteger low, BigInteger high);
}
