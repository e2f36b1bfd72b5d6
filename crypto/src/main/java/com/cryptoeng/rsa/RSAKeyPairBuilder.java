/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.utils.LogPrinter;

import java.math.BigInteger;

/**
 * Generates full RSA key pairs from two independently generated primes of half the modulus size.
 * <p>
 * A pair that turns out unusable (equal primes, or an exponent without inverse) is reported, not
 * repaired: the caller should start the whole generation again.
 */
public class RSAKeyPairBuilder {

    public static final int MIN_BITS = 2048;
    public static final int MAX_BITS = 8192;

    private static final LogPrinter log = new LogPrinter("RSAK");

    private final RSAPrimeGenerator primeGenerator;

    public RSAKeyPairBuilder(RSAPrimeGenerator primeGenerator) {
        if (primeGenerator == null)
            throw new IllegalArgumentException("prime generator is required");
        this.primeGenerator = primeGenerator;
    }

    /**
     * Generate a new key.
     *
     * @param bits modulus size, in [{@link #MIN_BITS}, {@link #MAX_BITS}]
     *
     * @return new private key; public keys are derived from it
     *
     * @throws InvalidBitWidthException           if bits is out of range
     * @throws PrimeGenerationExhaustedException if a prime could not be found
     * @throws DegenerateKeyPairException        if both primes are the same
     * @throws ExponentNotInvertibleException    if 3 or 5 is not invertible for the primes
     */
    public RSAPrivateKey generateKeyPair(int bits) throws KeyGenerationError {
        InvalidBitWidthException.check(bits, MIN_BITS, MAX_BITS);

        BigInteger p = primeGenerator.generatePrime(bits / 2);
        BigInteger q = primeGenerator.generatePrime(bits / 2);
        try {
            RSAPrivateKey key = RSAPrivateKey.fromPrimes(p, q);
            log.d("generated %d-bit key", key.getBitStrength());
            return key;
        } catch (KeyGenerationError e) {
            log.w("discarding %d-bit key pair: %s", bits, e.getMessage());
            throw e;
        }
    }
}
