/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa.random;

import com.cryptoeng.rsa.digest.Sha256;
import org.bouncycastle.util.Pack;

/**
 * {@link SeededStream} built from SHA-256 in counter mode: block {@code i} is
 * {@code SHA-256(seed || I2OSP(i, 4))}, starting with {@code i = 0}. The output is the same as
 * MGF1 with SHA-256 over the seed.
 * <p>
 * Not thread safe.
 */
public class DigestCounterStream implements SeededStream {

    /** Seed size in bytes. */
    public static final int SEED_LENGTH = Sha256.LENGTH;

    private static final long MAX_COUNTER = 0xFFFFFFFFL;

    private final byte[] seed;
    private long counter = 0;
    private byte[] block = new byte[0];
    private int blockOffset = 0;

    public DigestCounterStream(byte[] seed) {
        if (seed == null || seed.length != SEED_LENGTH)
            throw new IllegalArgumentException("seed must be " + SEED_LENGTH + " bytes");
        this.seed = seed.clone();
    }

    @Override
    public byte[] nextBytes(int length) {
        if (length < 0)
            throw new IllegalArgumentException("negative length: " + length);
        byte[] result = new byte[length];
        int pos = 0;
        while (pos < length) {
            if (blockOffset == block.length) {
                block = nextBlock();
                blockOffset = 0;
            }
            int chunk = Math.min(length - pos, block.length - blockOffset);
            System.arraycopy(block, blockOffset, result, pos, chunk);
            pos += chunk;
            blockOffset += chunk;
        }
        return result;
    }

    private byte[] nextBlock() {
        if (counter > MAX_COUNTER)
            throw new IllegalStateException("seeded stream exhausted");
        Sha256 sha = new Sha256();
        sha.update(seed);
        sha.update(Pack.intToBigEndian((int) counter++));
        return sha.digest();
    }
}
