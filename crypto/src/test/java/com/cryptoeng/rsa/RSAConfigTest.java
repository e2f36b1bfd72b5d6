/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import com.cryptoeng.rsa.random.SecureRandomSource;
import com.cryptoeng.tools.Binder;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

import static org.junit.Assert.*;

public class RSAConfigTest {

    private static RSAConfig parse(String yaml) {
        return RSAConfig.load(new ByteArrayInputStream(yaml.getBytes()));
    }

    @Test
    public void defaultResource() throws Exception {
        RSAConfig config = RSAConfig.loadDefault();
        assertEquals(2048, config.getDefaultKeyBits());
        assertEquals(100, config.getAttemptsPerBit());
        assertEquals(64, config.getMillerRabinIterations());
        assertFalse(config.isDebugLog());
    }

    @Test
    public void partialOverride() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/rsa-test.yaml")) {
            RSAConfig config = RSAConfig.load(in);
            assertEquals(3072, config.getDefaultKeyBits());
            assertEquals(100, config.getAttemptsPerBit());
            assertEquals(20, config.getMillerRabinIterations());
        }
    }

    @Test
    public void emptyDocumentGivesDefaults() throws Exception {
        RSAConfig config = parse("");
        assertEquals(2048, config.getDefaultKeyBits());
        assertEquals(100, config.getAttemptsPerBit());
    }

    @Test
    public void stringValues() throws Exception {
        RSAConfig config = parse("prime:\n  attempts_per_bit: '7'\nlog:\n  debug: 'true'\n");
        assertEquals(7, config.getAttemptsPerBit());
        assertTrue(config.isDebugLog());
    }

    @Test
    public void fromBinder() throws Exception {
        Binder settings = Binder.fromKeysValues(
                "key", Binder.fromKeysValues("default_bits", 4096),
                "prime", Binder.fromKeysValues("attempts_per_bit", 10, "miller_rabin_iterations", 8)
        );
        RSAConfig config = RSAConfig.fromBinder(settings);
        assertEquals(4096, config.getDefaultKeyBits());
        assertEquals(10, config.getAttemptsPerBit());
        assertEquals(8, config.getMillerRabinIterations());
    }

    @Test(expected = InvalidBitWidthException.class)
    public void badKeySize() throws Exception {
        parse("key:\n  default_bits: 1024\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badAttempts() throws Exception {
        parse("prime:\n  attempts_per_bit: 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void attemptsBudgetWouldOverflow() throws Exception {
        parse("prime:\n  attempts_per_bit: 600000\n");
    }

    @Test
    public void largestAttemptsPerBit() throws Exception {
        RSAConfig config = new RSAConfig(2048, RSAPrimeGenerator.MAX_ATTEMPTS_PER_BIT, 64, false);
        RSAPrimeGenerator generator = new RSAPrimeGenerator(new SecureRandomSource(), n -> true,
                                                            config.getAttemptsPerBit());
        assertEquals(RSAPrimeGenerator.MAX_ATTEMPTS_PER_BIT * 4096, generator.getAttemptBudget(4096));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badIterations() throws Exception {
        parse("prime:\n  miller_rabin_iterations: -3\n");
    }
}
