/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.utils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * Wrap for byte[] utility class. Allow usage as an HashMap key and provides hex conversions.
 * <p>
 * Construction from byte[] and back ({@link #toArray()}) does no copying.
 */
public class Bytes {

    final byte data[];
    private boolean noHashcode = true;
    private int cachedHashCode;

    public Bytes(final byte[] data) {
        this.data = data;
    }

    /**
     * Construct from hexadecimal string. any spaces between digits are ignored.
     *
     * @param hex
     *         hexidecimal string, like "FF 01"
     *
     * @return decoded bytes
     */
    public static Bytes fromHex(String hex) {
        ArrayList<Byte> data = new ArrayList<>(hex.length() / 2);

        int l = hex.length();
        for (int i = 0; i < l; i++) {
            char c = hex.charAt(i);
            if (!Character.isWhitespace(c)) {
                if (i + 1 >= l)
                    throw new IllegalArgumentException("Hex format failure: odd number of digits");
                int hi = Character.digit(c, 16);
                int lo = Character.digit(hex.charAt(i + 1), 16);
                if (hi < 0 || lo < 0)
                    throw new IllegalArgumentException("Hex format failure: bad digit at " + i);
                data.add((byte) ((hi << 4) + lo));
                i++;
            }
        }
        byte[] result = new byte[data.size()];
        int i = 0;
        for (byte b : data) {
            result[i++] = b;
        }
        return new Bytes(result);
    }

    /**
     * Convert HEX string (ignoring whitespaces) to a byte[]
     */
    public static byte[] hexToByteArray(String hex) {
        return Bytes.fromHex(hex).toArray();
    }

    /**
     * Interpret own bytes as an unsigned big-endian integer.
     *
     * @return non-negative value
     */
    public BigInteger toUnsignedBigInteger() {
        return new BigInteger(1, data);
    }

    /**
     * return underlying bytes. This is cheap operation: no copying/conversion is performed.
     *
     * @return the wrapped bytes
     */
    public final byte[] toArray() {
        return data;
    }

    public String toHex(boolean useSpaces) {
        StringBuilder str = new StringBuilder();
        String format = useSpaces ? "%02X " : "%02X";
        for (byte b : data)
            str.append(String.format(format, b));
        return str.toString().trim();
    }

    @Override
    public int hashCode() {
        if (noHashcode) {
            CRC32 crc = new CRC32();
            crc.update(data);
            cachedHashCode = (int) crc.getValue();
            noHashcode = false;
        }
        return cachedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Bytes) {
            byte[] other = ((Bytes) obj).data;
            return Arrays.equals(other, data);
        }
        return false;
    }

    @Override
    public String toString() {
        return toHex(false);
    }
}
