/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import org.checkerframework.checker.nullness.qual.NonNull;

import java.math.BigInteger;

/**
 * RSA private key with fixed public exponents: the prime factors p and q, the modulus n = pq,
 * and the private exponents d3 and d5, inverses of 3 and 5 modulo lcm(p-1, q-1).
 * <p>
 * d3 signs (verified with 3), d5 decrypts (encrypted with 5). Instances are immutable and never
 * reveal their components in {@link #toString()}.
 */
public final class RSAPrivateKey {

    private final @NonNull BigInteger p;
    private final @NonNull BigInteger q;
    private final @NonNull BigInteger n;
    private final @NonNull BigInteger d3;
    private final @NonNull BigInteger d5;

    private RSAPrivateKey(BigInteger p, BigInteger q, BigInteger n, BigInteger d3, BigInteger d5) {
        this.p = p;
        this.q = q;
        this.n = n;
        this.d3 = d3;
        this.d5 = d5;
    }

    /**
     * Build the key from two primes. Primality is not checked here.
     *
     * @param p first prime factor
     * @param q second prime factor
     *
     * @return full private key
     *
     * @throws DegenerateKeyPairException     if p equals q
     * @throws ExponentNotInvertibleException if 3 or 5 shares a factor with lcm(p-1, q-1)
     */
    public static RSAPrivateKey fromPrimes(BigInteger p, BigInteger q)
            throws DegenerateKeyPairException, ExponentNotInvertibleException {
        if (p == null || q == null)
            throw new IllegalArgumentException("primes must not be null");
        if (p.compareTo(BigInteger.ONE) <= 0 || q.compareTo(BigInteger.ONE) <= 0)
            throw new IllegalArgumentException("primes must be greater than 1");
        if (p.equals(q))
            throw new DegenerateKeyPairException();

        BigInteger t = RSAMath.lcm(p.subtract(BigInteger.ONE), q.subtract(BigInteger.ONE));
        BigInteger d3 = invert(PublicExponent.VERIFICATION, t);
        BigInteger d5 = invert(PublicExponent.ENCRYPTION, t);
        return new RSAPrivateKey(p, q, p.multiply(q), d3, d5);
    }

    private static BigInteger invert(PublicExponent e, BigInteger t) throws ExponentNotInvertibleException {
        try {
            return e.toBigInteger().modInverse(t);
        } catch (ArithmeticException x) {
            throw new ExponentNotInvertibleException(e, x);
        }
    }

    public BigInteger getP() {
        return p;
    }

    public BigInteger getQ() {
        return q;
    }

    public BigInteger getModulus() {
        return n;
    }

    public BigInteger getD3() {
        return d3;
    }

    public BigInteger getD5() {
        return d5;
    }

    public int getBitStrength() {
        return n.bitLength();
    }

    /**
     * Public key for the given role.
     */
    public RSAPublicKey getPublicKey(PublicExponent exponent) {
        return new RSAPublicKey(n, exponent);
    }

    /**
     * (n, d3): signs messages verified with exponent 3.
     */
    public RSAExponentKey getSigningKey() {
        return new RSAExponentKey(n, d3);
    }

    /**
     * (n, d5): decrypts data encrypted with exponent 5.
     */
    public RSAExponentKey getDecryptionKey() {
        return new RSAExponentKey(n, d5);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof RSAPrivateKey))
            return false;
        RSAPrivateKey other = (RSAPrivateKey) obj;
        return n.equals(other.n) && d3.equals(other.d3) && d5.equals(other.d5)
                && p.equals(other.p) && q.equals(other.q);
    }

    @Override
    public int hashCode() {
        return n.hashCode();
    }

    @Override
    public String toString() {
        return String.format("RSAPrivateKey#%s", System.identityHashCode(this));
    }
}
