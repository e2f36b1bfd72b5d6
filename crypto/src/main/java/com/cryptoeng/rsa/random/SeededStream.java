/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa.random;

/**
 * Deterministic pseudo-random byte stream. Two streams created from the same seed produce the
 * same bytes for the same sequence of {@link #nextBytes(int)} calls.
 * <p>
 * A stream is a local object: creating or reading one never affects any other source of
 * randomness in the process.
 */
public interface SeededStream {

    /**
     * Read the next bytes of the stream.
     *
     * @param length number of bytes, non-negative
     *
     * @return new array of the requested length
     */
    byte[] nextBytes(int length);

    /**
     * Creates streams from seeds.
     */
    @FunctionalInterface
    interface Factory {
        SeededStream seed(byte[] seed);
    }
}
