/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.digest.Sha256;
import com.cryptoeng.rsa.random.RandomSource;

import java.math.BigInteger;

/**
 * Transports a random 256-bit symmetric key under an RSA public key with exponent 5.
 * <p>
 * The sender draws a random r of the modulus bit size, keeps {@code K = SHA-256(r)} and sends
 * {@code c = r^5 mod n}. The receiver computes {@code r = c^d5 mod n} and hashes it again.
 * <p>
 * r is drawn from {@code [0, 2^bitLength(n))}, not from {@code [0, n)}. When r &ge; n the receiver
 * recovers {@code r mod n} and derives a different key; the sender has no way to notice.
 */
public class RSAEncapsulation {

    private final RandomSource random;

    public RSAEncapsulation(RandomSource random) {
        if (random == null)
            throw new IllegalArgumentException("random source is required");
        this.random = random;
    }

    /**
     * Generate a fresh symmetric key and encrypt it.
     *
     * @param publicKey recipient key, must have the {@link PublicExponent#ENCRYPTION} exponent
     *
     * @return the key to use locally and the ciphertext to send
     */
    public EncapsulatedKey encryptSymmetricKey(RSAPublicKey publicKey) {
        if (publicKey.getExponent() != PublicExponent.ENCRYPTION)
            throw new IllegalArgumentException("encryption requires exponent "
                    + PublicExponent.ENCRYPTION.getValue() + ", got " + publicKey.getExponent().getValue());
        final BigInteger n = publicKey.getModulus();
        final int bits = n.bitLength();
        final BigInteger r = random.uniform(BigInteger.ZERO, RSAMath.twoPower(bits).subtract(BigInteger.ONE));
        final byte[] key = deriveKey(r);
        return new EncapsulatedKey(key, r.modPow(publicKey.getExponent().toBigInteger(), n));
    }

    /**
     * Recover the symmetric key from its ciphertext.
     *
     * @param privateKey (n, d5)
     * @param ciphertext value received from the sender
     *
     * @return 32-byte symmetric key
     *
     * @throws CiphertextOutOfRangeException if ciphertext is not in [0, n)
     */
    public byte[] decryptSymmetricKey(RSAExponentKey privateKey, BigInteger ciphertext)
            throws CiphertextOutOfRangeException {
        final BigInteger n = privateKey.getModulus();
        if (ciphertext == null || ciphertext.signum() < 0 || ciphertext.compareTo(n) >= 0)
            throw new CiphertextOutOfRangeException("ciphertext is not in [0, n)");
        return deriveKey(ciphertext.modPow(privateKey.getExponent(), n));
    }

    static byte[] deriveKey(BigInteger r) {
        return Sha256.hash(RSAMath.encodeUnsigned(r));
    }
}
