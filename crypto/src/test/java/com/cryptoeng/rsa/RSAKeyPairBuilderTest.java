/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.random.SecureRandomSource;
import com.cryptoeng.rsa.test.FixedRandomSource;
import com.cryptoeng.rsa.test.TestKeys;
import org.junit.Test;

import java.math.BigInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

public class RSAKeyPairBuilderTest {

    @Test
    public void generate2048() throws Exception {
        RSAKeyPairBuilder builder = new RSAKeyPairBuilder(
                new RSAPrimeGenerator(new SecureRandomSource(), new MillerRabinPrimalityTest()));
        RSAPrivateKey key = builder.generateKeyPair(2048);

        BigInteger p = key.getP(), q = key.getQ();
        assertNotEquals(p, q);
        assertEquals(1024, p.bitLength());
        assertEquals(1024, q.bitLength());
        assertEquals(p.multiply(q), key.getModulus());
        assertThat(key.getBitStrength(), is(greaterThanOrEqualTo(2047)));

        BigInteger t = RSAMath.lcm(p.subtract(BigInteger.ONE), q.subtract(BigInteger.ONE));
        assertEquals(BigInteger.ONE, key.getD3().multiply(BigInteger.valueOf(3)).mod(t));
        assertEquals(BigInteger.ONE, key.getD5().multiply(BigInteger.valueOf(5)).mod(t));
    }

    @Test
    public void buildsFromDrawnPrimes() throws Exception {
        RSAKeyPairBuilder builder = new RSAKeyPairBuilder(
                new RSAPrimeGenerator(new FixedRandomSource(TestKeys.P, TestKeys.Q), n -> true));
        assertEquals(TestKeys.privateKey(), builder.generateKeyPair(2048));
    }

    @Test
    public void coincidingPrimesAreReported() throws Exception {
        FixedRandomSource random = new FixedRandomSource(TestKeys.P, TestKeys.P, TestKeys.Q);
        RSAKeyPairBuilder builder = new RSAKeyPairBuilder(new RSAPrimeGenerator(random, n -> true));
        try {
            builder.generateKeyPair(2048);
            fail("equal primes accepted");
        } catch (DegenerateKeyPairException e) {
            assertEquals("prime factors coincide", e.getMessage());
        }
        // no silent resampling of the second prime
        assertEquals(1, random.remaining());
    }

    @Test
    public void rejectsBadBitLength() throws Exception {
        RSAKeyPairBuilder builder = new RSAKeyPairBuilder(
                new RSAPrimeGenerator(new FixedRandomSource(), n -> true));
        for (int bits : new int[]{1024, 2047, 8193, 16384}) {
            try {
                builder.generateKeyPair(bits);
                fail("accepted " + bits);
            } catch (InvalidBitWidthException e) {
                assertEquals(2048, e.getMin());
                assertEquals(8192, e.getMax());
            }
        }
    }
}
