/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.digest.Sha256;
import com.cryptoeng.rsa.random.DigestCounterStream;
import com.cryptoeng.rsa.random.SeededStream;

import java.math.BigInteger;

/**
 * RSA signatures over a pseudo-random representative of the message.
 * <p>
 * Instead of exponentiating the message hash directly, the hash seeds a {@link SeededStream}, and
 * as many bytes as the modulus has are read from it and reduced modulo n. The resulting value is
 * signed with the private exponent paired with 3. Because the message-to-number map is not
 * multiplicative, {@code sign(m1) * sign(m2)} is not a signature of {@code m1 * m2}.
 * <p>
 * The seeded stream is created per call, so signing and verification never consume or reseed
 * any shared generator.
 */
public class RSASignatureScheme {

    private final SeededStream.Factory streamFactory;

    public RSASignatureScheme() {
        this(DigestCounterStream::new);
    }

    public RSASignatureScheme(SeededStream.Factory streamFactory) {
        if (streamFactory == null)
            throw new IllegalArgumentException("stream factory is required");
        this.streamFactory = streamFactory;
    }

    /**
     * Map the message to a number modulo n. Same inputs always give the same result.
     *
     * @param modulus RSA modulus
     * @param message message bytes
     *
     * @return value in [0, n)
     */
    public BigInteger messageToResidue(BigInteger modulus, byte[] message) {
        final int length = RSAMath.byteLength(modulus);
        final SeededStream stream = streamFactory.seed(Sha256.hash(message));
        return new BigInteger(1, stream.nextBytes(length)).mod(modulus);
    }

    /**
     * Sign the message.
     *
     * @param privateKey (n, d), normally {@link RSAPrivateKey#getSigningKey()}
     * @param message    message bytes
     *
     * @return signature in [0, n)
     */
    public BigInteger sign(RSAExponentKey privateKey, byte[] message) {
        final BigInteger n = privateKey.getModulus();
        return messageToResidue(n, message).modPow(privateKey.getExponent(), n);
    }

    /**
     * Sign a message given as a non-negative integer, using its minimal unsigned big-endian bytes.
     */
    public BigInteger sign(RSAExponentKey privateKey, BigInteger message) {
        return sign(privateKey, RSAMath.encodeUnsigned(message));
    }

    /**
     * Check the signature.
     *
     * @param publicKey (n, e), normally with {@link PublicExponent#VERIFICATION}
     * @param message   message bytes
     * @param signature signature to check
     *
     * @throws InvalidSignatureException if the signature does not match
     */
    public void verify(RSAPublicKey publicKey, byte[] message, BigInteger signature)
            throws InvalidSignatureException {
        if (!isValid(publicKey, message, signature))
            throw new InvalidSignatureException();
    }

    public void verify(RSAPublicKey publicKey, BigInteger message, BigInteger signature)
            throws InvalidSignatureException {
        verify(publicKey, RSAMath.encodeUnsigned(message), signature);
    }

    /**
     * Same as {@link #verify(RSAPublicKey, byte[], BigInteger)} but reports the verdict instead
     * of throwing.
     */
    public boolean isValid(RSAPublicKey publicKey, byte[] message, BigInteger signature) {
        if (signature == null || signature.signum() < 0)
            return false;
        final BigInteger n = publicKey.getModulus();
        final BigInteger expected = messageToResidue(n, message);
        return expected.equals(signature.modPow(publicKey.getExponent().toBigInteger(), n));
    }
}
