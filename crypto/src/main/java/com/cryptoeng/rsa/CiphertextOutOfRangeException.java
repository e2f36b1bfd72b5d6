/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * RSA ciphertext is not in {@code [0, N)}.
 */
public class CiphertextOutOfRangeException extends EncryptionError {
    public CiphertextOutOfRangeException(String reason) {
        super(reason);
    }
}
