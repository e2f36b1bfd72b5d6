/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa.digest;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * SHA-256 (SHA-2 family) digest implementation. This is the 256-bit hash used to derive
 * symmetric keys and signature seeds.
 */
public class Sha256 extends BouncyCastleDigest {

    /** Digest size in bytes. */
    public static final int LENGTH = 32;

    final org.bouncycastle.crypto.Digest md = new SHA256Digest();

    public Sha256() {
    }

    /**
     * Shortcut: SHA-256 of the whole data in one call.
     */
    public static byte[] hash(byte[] data) {
        return new Sha256().digest(data);
    }

    @Override
    protected Digest getUnderlyingDigest() {
        return md;
    }
}
