package com.intenovation.pop3migration.hash;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for HeaderDigest
 */
public class HeaderDigestTest {

    private static HeaderDigest digestStartingWith(int firstByte) {
        byte[] bytes = new byte[HeaderDigest.LENGTH];
        bytes[0] = (byte) firstByte;
        return HeaderDigest.of(bytes);
    }

    @Test
    public void testUnsignedOrdering() {
        // 0x80 is negative as a Java byte but must sort after 0x7f
        assertTrue(digestStartingWith(0x80).compareTo(digestStartingWith(0x7f)) > 0);
        assertTrue(digestStartingWith(0x01).compareTo(digestStartingWith(0xff)) < 0);
        assertEquals(0, digestStartingWith(0x42).compareTo(digestStartingWith(0x42)));
    }

    @Test
    public void testWrongLengthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> HeaderDigest.of(new byte[16]));
    }

    @Test
    public void testCopiesBytes() {
        byte[] bytes = new byte[HeaderDigest.LENGTH];
        HeaderDigest digest = HeaderDigest.of(bytes);
        bytes[0] = 1;
        assertEquals(0, digest.toByteArray()[0]);
        assertEquals("0000000000000000000000000000000000000000", digest.toHex());
        assertEquals(digest, HeaderDigest.of(new byte[HeaderDigest.LENGTH]));
    }
}
