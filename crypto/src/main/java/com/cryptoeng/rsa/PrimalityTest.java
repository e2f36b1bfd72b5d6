/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import java.math.BigInteger;

/**
 * Probabilistic primality verdict for a large integer.
 */
@FunctionalInterface
public interface PrimalityTest {
    boolean isProbablePrime(BigInteger n);
}
