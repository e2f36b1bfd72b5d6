/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.random.RandomSource;
import com.cryptoeng.utils.LogPrinter;

import java.math.BigInteger;

/**
 * Generates primes for RSA moduli with fixed public exponents 3 and 5.
 * <p>
 * A candidate is drawn uniformly from {@code [2^(k-1), 2^k - 1]} and accepted when
 * {@code p mod 3 != 1}, {@code p mod 5 != 1} and it is a probable prime. Otherwise a fresh
 * candidate is drawn, at most {@code attemptsPerBit * k} times in total.
 *
 * @see RSAKeyPairBuilder
 */
public class RSAPrimeGenerator {

    public static final int MIN_BITS = 1024;
    public static final int MAX_BITS = 4096;
    public static final int DEFAULT_ATTEMPTS_PER_BIT = 100;
    /**
     * Largest attempts-per-bit factor whose budget for a {@link #MAX_BITS} prime fits an int.
     */
    public static final int MAX_ATTEMPTS_PER_BIT = Integer.MAX_VALUE / MAX_BITS;

    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final BigInteger FIVE = BigInteger.valueOf(5);

    private static final LogPrinter log = new LogPrinter("PRIM");

    private final RandomSource random;
    private final PrimalityTest primalityTest;
    private final int attemptsPerBit;

    public RSAPrimeGenerator(RandomSource random, PrimalityTest primalityTest) {
        this(random, primalityTest, DEFAULT_ATTEMPTS_PER_BIT);
    }

    public RSAPrimeGenerator(RandomSource random, PrimalityTest primalityTest, int attemptsPerBit) {
        if (random == null || primalityTest == null)
            throw new IllegalArgumentException("random source and primality test are required");
        checkAttemptsPerBit(attemptsPerBit);
        this.random = random;
        this.primalityTest = primalityTest;
        this.attemptsPerBit = attemptsPerBit;
    }

    /**
     * Generate a prime of exactly {@code bits} bits.
     *
     * @param bits prime size, in [{@link #MIN_BITS}, {@link #MAX_BITS}]
     *
     * @return the prime
     *
     * @throws InvalidBitWidthException           if bits is out of range
     * @throws PrimeGenerationExhaustedException if no prime was found within the budget
     */
    public BigInteger generatePrime(int bits) throws PrimeGenerationExhaustedException {
        InvalidBitWidthException.check(bits, MIN_BITS, MAX_BITS);

        final BigInteger low = RSAMath.twoPower(bits - 1);
        final BigInteger high = RSAMath.twoPower(bits).subtract(BigInteger.ONE);
        final int budget = getAttemptBudget(bits);

        for (int attempt = 1; attempt <= budget; attempt++) {
            BigInteger candidate = random.uniform(low, high);
            if (isSuitable(candidate)) {
                log.d("%d-bit prime found after %d attempts", bits, attempt);
                return candidate;
            }
        }
        log.w("no %d-bit prime in %d attempts", bits, budget);
        throw new PrimeGenerationExhaustedException(bits, budget);
    }

    /**
     * Check the congruence filters first; the primality test runs only for candidates passing them.
     */
    boolean isSuitable(BigInteger candidate) {
        return !candidate.mod(THREE).equals(BigInteger.ONE)
                && !candidate.mod(FIVE).equals(BigInteger.ONE)
                && primalityTest.isProbablePrime(candidate);
    }

    static void checkAttemptsPerBit(int attemptsPerBit) {
        if (attemptsPerBit < 1 || attemptsPerBit > MAX_ATTEMPTS_PER_BIT)
            throw new IllegalArgumentException(String.format("attempts per bit must be in [1, %d], got %d",
                                                             MAX_ATTEMPTS_PER_BIT, attemptsPerBit));
    }

    /**
     * Maximum number of candidates drawn for a prime of the given size.
     */
    public int getAttemptBudget(int bits) {
        return attemptsPerBit * bits;
    }
}
