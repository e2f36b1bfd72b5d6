/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;

/**
 * Small integer helpers shared by the RSA primitives.
 */
final class RSAMath {

    private RSAMath() {
    }

    /**
     * Minimal unsigned big-endian encoding; zero is a single zero byte.
     *
     * @throws IllegalArgumentException on negative values
     */
    static byte[] encodeUnsigned(BigInteger value) {
        if (value.signum() < 0)
            throw new IllegalArgumentException("negative value can't be encoded as unsigned");
        return BigIntegers.asUnsignedByteArray(value);
    }

    /**
     * Number of bytes in {@link #encodeUnsigned(BigInteger)} of the value.
     */
    static int byteLength(BigInteger value) {
        return encodeUnsigned(value).length;
    }

    static BigInteger lcm(BigInteger a, BigInteger b) {
        return a.divide(a.gcd(b)).multiply(b);
    }

    static BigInteger twoPower(int bits) {
        return BigInteger.ONE.shiftLeft(bits);
    }
}
