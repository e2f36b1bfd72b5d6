/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * Signature does not match the message under the given public key.
 */
public class InvalidSignatureException extends CryptoError {
    public InvalidSignatureException() {
        super("signature does not match the message");
    }
}
