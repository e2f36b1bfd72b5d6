/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.random.RandomSource;
import com.cryptoeng.rsa.random.SecureRandomSource;
import com.cryptoeng.utils.LogPrinter;

import java.io.IOException;
import java.math.BigInteger;

/**
 * One-stop shop for the RSA primitives. Owns its random source and serializes every operation
 * that draws from it, so a single instance can be shared between threads. Signing and
 * verification do not use the random source and are not synchronized.
 * <p>
 * Key roles are enforced here: encryption uses exponent 5, verification exponent 3, signing d3
 * and decryption d5.
 */
public class RSA {

    private static final LogPrinter log = new LogPrinter("RSA");

    private final RSAConfig config;
    private final RandomSource random;
    private final RSAPrimeGenerator primeGenerator;
    private final RSAKeyPairBuilder keyPairBuilder;
    private final RSAEncapsulation encapsulation;
    private final RSASignatureScheme signatures = new RSASignatureScheme();

    /**
     * Instance configured from the {@code rsa.yaml} resource.
     */
    public RSA() throws IOException {
        this(RSAConfig.loadDefault());
    }

    public RSA(RSAConfig config) {
        this(config, new SecureRandomSource());
    }

    public RSA(RSAConfig config, RandomSource random) {
        this(config, random, new MillerRabinPrimalityTest(config.getMillerRabinIterations()));
    }

    public RSA(RSAConfig config, RandomSource random, PrimalityTest primalityTest) {
        if (config == null || random == null || primalityTest == null)
            throw new IllegalArgumentException("config, random source and primality test are required");
        this.config = config;
        this.random = random;
        this.primeGenerator = new RSAPrimeGenerator(random, primalityTest, config.getAttemptsPerBit());
        this.keyPairBuilder = new RSAKeyPairBuilder(primeGenerator);
        this.encapsulation = new RSAEncapsulation(random);
        if (config.isDebugLog())
            LogPrinter.showDebug(true);
        log.d("created with %s", config);
    }

    public RSAConfig getConfig() {
        return config;
    }

    /**
     * Generate a key of the configured default size.
     */
    public RSAPrivateKey generateKeyPair() throws KeyGenerationError {
        return generateKeyPair(config.getDefaultKeyBits());
    }

    public synchronized RSAPrivateKey generateKeyPair(int bits) throws KeyGenerationError {
        return keyPairBuilder.generateKeyPair(bits);
    }

    public synchronized BigInteger generatePrime(int bits) throws PrimeGenerationExhaustedException {
        return primeGenerator.generatePrime(bits);
    }

    /**
     * Create a new symmetric key for the owner of the private key behind publicKey.
     *
     * @param publicKey public key with {@link PublicExponent#ENCRYPTION}
     */
    public synchronized EncapsulatedKey encryptRandomKey(RSAPublicKey publicKey) {
        return encapsulation.encryptSymmetricKey(publicKey);
    }

    /**
     * Recover the symmetric key from the ciphertext created by {@link #encryptRandomKey(RSAPublicKey)}.
     */
    public byte[] decryptRandomKey(RSAPrivateKey privateKey, BigInteger ciphertext)
            throws CiphertextOutOfRangeException {
        return encapsulation.decryptSymmetricKey(privateKey.getDecryptionKey(), ciphertext);
    }

    public BigInteger sign(RSAPrivateKey privateKey, byte[] message) {
        return signatures.sign(privateKey.getSigningKey(), message);
    }

    public BigInteger sign(RSAPrivateKey privateKey, BigInteger message) {
        return signatures.sign(privateKey.getSigningKey(), message);
    }

    /**
     * @param publicKey public key with {@link PublicExponent#VERIFICATION}
     *
     * @throws InvalidSignatureException if the signature does not match
     */
    public void verify(RSAPublicKey publicKey, byte[] message, BigInteger signature)
            throws InvalidSignatureException {
        signatures.verify(checkVerificationKey(publicKey), message, signature);
    }

    public void verify(RSAPublicKey publicKey, BigInteger message, BigInteger signature)
            throws InvalidSignatureException {
        signatures.verify(checkVerificationKey(publicKey), message, signature);
    }

    public boolean isValid(RSAPublicKey publicKey, byte[] message, BigInteger signature) {
        return signatures.isValid(checkVerificationKey(publicKey), message, signature);
    }

    private static RSAPublicKey checkVerificationKey(RSAPublicKey publicKey) {
        if (publicKey.getExponent() != PublicExponent.VERIFICATION)
            throw new IllegalArgumentException("verification requires exponent "
                    + PublicExponent.VERIFICATION.getValue() + ", got " + publicKey.getExponent().getValue());
        return publicKey;
    }
}
