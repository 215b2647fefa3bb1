package com.intenovation.pop3migration.hash;

import java.util.Arrays;

/**
 * A SHA-1 fingerprint of a canonical header section.
 * Ordered by unsigned byte comparison so digests can be merge-joined.
 */
public final class HeaderDigest implements Comparable<HeaderDigest> {
    public static final int LENGTH = 20;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    private HeaderDigest(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wrap a copy of raw digest bytes
     *
     * @throws IllegalArgumentException If the array isn't {@link #LENGTH} bytes long
     */
    public static HeaderDigest of(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Header digest must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new HeaderDigest(bytes.clone());
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder(LENGTH * 2);
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(HeaderDigest other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HeaderDigest)) {
            return false;
        }
        return Arrays.equals(bytes, ((HeaderDigest) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
