/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

import java.io.IOException;

/**
 * Malformed or tampered encrypted data.
 */
public class EncryptionError extends IOException {
    public EncryptionError() {
    }

    public EncryptionError(String reason) {
        super(reason);
    }

    public EncryptionError(String reason, Throwable cause) {
        super(reason, cause);
    }
}
