package com.intenovation.pop3migration.hash;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Computes a header digest that is the same for a message whether its
 * header came from a POP3 TOP or an IMAP BODY[HEADER] fetch.
 * <p>
 * The header section is filtered line by line:
 * <ul>
 *   <li>headers in {@link #SKIP_HEADERS} are dropped with their continuation lines,</li>
 *   <li>continuation lines holding only whitespace are dropped,</li>
 *   <li>lines without a "name:" part are dropped,</li>
 *   <li>headers whose name contains control, space or 8bit characters are dropped,</li>
 *   <li>a line of only CRs ends the header section; everything up to the
 *       real end-of-headers line is dropped.</li>
 * </ul>
 * The body is never read past the end-of-headers line. The filtered text
 * is then normalized while hashing: CRs, spaces and tabs are removed and any
 * run of control characters, 8bit characters and '?' becomes a single '?'.
 */
public final class HeaderCanonicalizer {

    /** Headers that differ between servers or change over time. Must stay sorted. */
    static final String[] SKIP_HEADERS = {
            "Content-Length",
            "Return-Path", // Yahoo IMAP has it, Yahoo POP3 doesn't
            "Status",
            "X-IMAP",
            "X-IMAPbase",
            "X-Keywords",
            "X-Message-Flag",
            "X-Status",
            "X-UID",
            "X-UIDL",
            "X-Yahoo-Newman-Property"
    };

    private static final String ALGORITHM = "SHA-1";

    private HeaderCanonicalizer() {
    }

    /**
     * Check whether a header is excluded from the digest
     */
    public static boolean isSkippedHeader(String name) {
        return Arrays.binarySearch(SKIP_HEADERS, name, String.CASE_INSENSITIVE_ORDER) >= 0;
    }

    /**
     * Hash the header section of a message stream. The stream may contain
     * just the header or the full message; it is not closed.
     *
     * @param input The raw message or header bytes
     * @return The digest and whether the end-of-headers line was seen
     * @throws IOException If reading the stream failed
     */
    public static HeaderHashResult digest(InputStream input) throws IOException {
        NormalizingHasher hasher = new NormalizingHasher(newMessageDigest());
        boolean endOfHeaders = filter(input, hasher);
        return new HeaderHashResult(HeaderDigest.of(hasher.finish()), endOfHeaders);
    }

    /**
     * Return the filtered header text, before hash normalization.
     * Mostly useful for diagnosing digest mismatches.
     */
    public static byte[] canonicalHeader(InputStream input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        filter(input, (buf, len) -> {
            out.write(buf, 0, len);
            out.write('\n');
        });
        return out.toByteArray();
    }

    private static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    private static boolean filter(InputStream input, LineSink sink) throws IOException {
        BufferedInputStream in = new BufferedInputStream(input);
        LineBuffer line = new LineBuffer();
        boolean stopped = false;
        boolean dropping = true;

        while (line.read(in)) {
            int len = line.length;
            // LF is the terminator; a single CR before it belongs to the terminator too
            if (len > 0 && line.buf[len - 1] == '\r') {
                len--;
            }
            if (len == 0) {
                sink.line(line.buf, 0);
                return true;
            }
            if (onlyCarriageReturns(line.buf, len)) {
                // CR+CR+LF: some servers end the header here and some don't
                stopped = true;
                continue;
            }
            if (stopped) {
                continue;
            }

            byte first = line.buf[0];
            if (first == ' ' || first == '\t') {
                if (dropping || onlyWhitespace(line.buf, len)) {
                    continue;
                }
                sink.line(line.buf, len);
                continue;
            }

            int colon = indexOf(line.buf, len, (byte) ':');
            if (colon < 0) {
                // not a "name: value" line
                dropping = true;
                continue;
            }
            int nameEnd = colon;
            while (nameEnd > 0 && (line.buf[nameEnd - 1] == ' ' || line.buf[nameEnd - 1] == '\t')) {
                nameEnd--;
            }
            if (!isValidName(line.buf, nameEnd)) {
                dropping = true;
                continue;
            }
            String name = new String(line.buf, 0, nameEnd, StandardCharsets.US_ASCII);
            if (isSkippedHeader(name)) {
                dropping = true;
                continue;
            }
            dropping = false;
            sink.line(line.buf, len);
        }
        return false;
    }

    private static boolean isValidName(byte[] buf, int len) {
        if (len == 0) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            int c = buf[i] & 0xff;
            if (c <= 0x20 || c >= 0x7f) {
                return false;
            }
        }
        return true;
    }

    private static boolean onlyCarriageReturns(byte[] buf, int len) {
        for (int i = 0; i < len; i++) {
            if (buf[i] != '\r') {
                return false;
            }
        }
        return true;
    }

    private static boolean onlyWhitespace(byte[] buf, int len) {
        for (int i = 0; i < len; i++) {
            if (buf[i] != ' ' && buf[i] != '\t') {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] buf, int len, byte b) {
        for (int i = 0; i < len; i++) {
            if (buf[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private interface LineSink {
        /** Receives one kept line without its terminator */
        void line(byte[] buf, int len);
    }

    /**
     * Growable buffer holding the current line, without the LF
     */
    private static final class LineBuffer {
        byte[] buf = new byte[256];
        int length;

        boolean read(InputStream in) throws IOException {
            length = 0;
            int c;
            while ((c = in.read()) != -1) {
                if (c == '\n') {
                    return true;
                }
                if (length == buf.length) {
                    buf = Arrays.copyOf(buf, buf.length * 2);
                }
                buf[length++] = (byte) c;
            }
            return length > 0;
        }
    }

    /**
     * Feeds kept lines into the digest with the character normalization applied
     */
    private static final class NormalizingHasher implements LineSink {
        private final MessageDigest digest;
        private boolean previousWasQuestionMark;

        NormalizingHasher(MessageDigest digest) {
            this.digest = digest;
        }

        @Override
        public void line(byte[] buf, int len) {
            for (int i = 0; i < len; i++) {
                int c = buf[i] & 0xff;
                if (c == ' ' || c == '\t' || c == '\r') {
                    previousWasQuestionMark = false;
                } else if (c < 0x20 || c >= 0x7f || c == '?') {
                    if (!previousWasQuestionMark) {
                        digest.update((byte) '?');
                    }
                    previousWasQuestionMark = true;
                } else {
                    digest.update((byte) c);
                    previousWasQuestionMark = false;
                }
            }
            digest.update((byte) '\n');
            previousWasQuestionMark = false;
        }

        byte[] finish() {
            return digest.digest();
        }
    }
}
