/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * Key material could not be produced from the random data drawn. The caller may retry the whole
 * generation with fresh randomness.
 */
public class KeyGenerationError extends CryptoError {
    public KeyGenerationError(String reason) {
        super(reason);
    }

    public KeyGenerationError(String reason, Throwable cause) {
        super(reason, cause);
    }
}
