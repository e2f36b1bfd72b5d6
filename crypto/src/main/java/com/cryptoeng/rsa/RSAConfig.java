/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.tools.Binder;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * RSA library settings, normally read from the {@code rsa.yaml} resource:
 * <pre>
 * key:
 *   default_bits: 2048
 * prime:
 *   attempts_per_bit: 100
 *   miller_rabin_iterations: 64
 * log:
 *   debug: false
 * </pre>
 * Missing values take the defaults shown.
 */
public class RSAConfig {

    public static final String DEFAULT_RESOURCE = "/rsa.yaml";

    public static final int DEFAULT_KEY_BITS = 2048;

    private final int defaultKeyBits;
    private final int attemptsPerBit;
    private final int millerRabinIterations;
    private final boolean debugLog;

    public RSAConfig() {
        this(DEFAULT_KEY_BITS, RSAPrimeGenerator.DEFAULT_ATTEMPTS_PER_BIT,
             MillerRabinPrimalityTest.DEFAULT_ITERATIONS, false);
    }

    public RSAConfig(int defaultKeyBits, int attemptsPerBit, int millerRabinIterations, boolean debugLog) {
        InvalidBitWidthException.check(defaultKeyBits, RSAKeyPairBuilder.MIN_BITS, RSAKeyPairBuilder.MAX_BITS);
        RSAPrimeGenerator.checkAttemptsPerBit(attemptsPerBit);
        if (millerRabinIterations < 1)
            throw new IllegalArgumentException("prime.miller_rabin_iterations must be positive: "
                                                       + millerRabinIterations);
        this.defaultKeyBits = defaultKeyBits;
        this.attemptsPerBit = attemptsPerBit;
        this.millerRabinIterations = millerRabinIterations;
        this.debugLog = debugLog;
    }

    /**
     * Build from parsed settings.
     */
    public static RSAConfig fromBinder(Binder settings) {
        Binder key = settings.getBinder("key");
        Binder prime = settings.getBinder("prime");
        Binder log = settings.getBinder("log");
        return new RSAConfig(
                key.getInt("default_bits", DEFAULT_KEY_BITS),
                prime.getInt("attempts_per_bit", RSAPrimeGenerator.DEFAULT_ATTEMPTS_PER_BIT),
                prime.getInt("miller_rabin_iterations", MillerRabinPrimalityTest.DEFAULT_ITERATIONS),
                log.getBoolean("debug", false)
        );
    }

    public static RSAConfig load(InputStream in) {
        Yaml yaml = new Yaml();
        return fromBinder(Binder.from(yaml.load(in)));
    }

    public static RSAConfig load(String fileName) throws IOException {
        try (InputStream in = new FileInputStream(fileName)) {
            return load(in);
        }
    }

    /**
     * Read {@link #DEFAULT_RESOURCE} from the classpath.
     *
     * @throws FileNotFoundException if the resource is missing
     */
    public static RSAConfig loadDefault() throws IOException {
        try (InputStream in = RSAConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null)
                throw new FileNotFoundException("resource not found: " + DEFAULT_RESOURCE);
            return load(in);
        }
    }

    public int getDefaultKeyBits() {
        return defaultKeyBits;
    }

    public int getAttemptsPerBit() {
        return attemptsPerBit;
    }

    public int getMillerRabinIterations() {
        return millerRabinIterations;
    }

    public boolean isDebugLog() {
        return debugLog;
    }

    @Override
    public String toString() {
        return String.format("RSAConfig(key=%d bits, attempts/bit=%d, MR=%d, debug=%s)",
                             defaultKeyBits, attemptsPerBit, millerRabinIterations, debugLog);
    }
}
