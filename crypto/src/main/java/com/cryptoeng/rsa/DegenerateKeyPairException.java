/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa;

/**
 * Both prime factors of the modulus are equal. The whole key pair must be generated again.
 */
public class DegenerateKeyPairException extends KeyGenerationError {
    public DegenerateKeyPairException() {
        super("prime factors coincide");
    }
}
