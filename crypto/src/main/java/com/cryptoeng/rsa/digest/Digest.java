/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.rsa.digest;

import com.cryptoeng.utils.Bytes;

/**
 * Abstract base class for all hash functions. Implementation must provide only {@link #getLength()},
 * {@link #_update(byte[], int, int)} and {@link #_digest()} methods.
 * <p>
 * An instance calculates exactly one digest: once {@link #digest()} is called, further updates are
 * not allowed, while repeated {@link #digest()} calls return the same value.
 */
public abstract class Digest {

    /**
     * Override to process sequence of bytes. Is called only if the #_digest() was not called.
     *
     * @param data
     *         source message
     * @param offset
     *         index to start processing from
     * @param size
     *         number of bytes to proces
     */
    protected abstract void _update(byte[] data, int offset, int size);

    /**
     * Override it to calculate and return digest of all processed data. It is called only once per
     * instance.
     *
     * @return digest
     */
    protected abstract byte[] _digest();

    /**
     * Override to provide digest length in bytes.
     */
    public abstract int getLength();

    private byte[] lastDigest = null;

    public void update(byte[] data, int offset, int length) {
        if (lastDigest == null)
            _update(data, offset, length);
        else
            throw new IllegalStateException("digest is already calculated");
    }

    /**
     * Update digest using specified data. Can not be executed after any {@link #digest()} call.
     *
     * @return self
     */
    public Digest update(byte[] data) {
        update(data, 0, data.length);
        return this;
    }

    /**
     * Calculate and return message digest or return last calculated digest.
     *
     * @return message digest
     */
    public byte[] digest() {
        if (lastDigest == null)
            lastDigest = _digest();
        return lastDigest.clone();
    }

    public byte[] digest(byte[] data) {
        update(data);
        return digest();
    }

    public String hexDigest() {
        return new Bytes(digest()).toHex(false);
    }

    public String hexDigest(byte[] data) {
        return new Bytes(digest(data)).toHex(false);
    }
}
