/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * Base class for failures of RSA operations that the caller is expected to handle.
 */
public class CryptoError extends Exception {
    public CryptoError() { super(); }

    public CryptoError(String reason) {
        super(reason);
    }

    public CryptoError(String reason, Throwable cause) {
        super(reason, cause);
    }
}
