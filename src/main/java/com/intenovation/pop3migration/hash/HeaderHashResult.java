package com.intenovation.pop3migration.hash;

/**
 * The digest of a header section and whether the section ended with a
 * proper end-of-headers line.
 */
public final class HeaderHashResult {
    private final HeaderDigest digest;
    private final boolean endOfHeaders;

    public HeaderHashResult(HeaderDigest digest, boolean endOfHeaders) {
        this.digest = digest;
        this.endOfHeaders = endOfHeaders;
    }

    public HeaderDigest getDigest() {
        return digest;
    }

    /**
     * @return false if the stream ended before the empty line that
     * terminates the header section
     */
    public boolean hasEndOfHeaders() {
        return endOfHeaders;
    }
}
