package com.intenovation.pop3migration.store;

import com.intenovation.pop3migration.hash.HeaderDigest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Test cases for AttributeCacheAdapter
 */
public class AttributeCacheAdapterTest {

    @Mock
    private AttributeCache cache;

    private AttributeCacheAdapter adapter;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        adapter = new AttributeCacheAdapter(cache, "INBOX");
    }

    @Test
    public void testDigestRoundTripsThroughCache() throws IOException {
        byte[] bytes = new byte[HeaderDigest.LENGTH];
        bytes[0] = 42;
        HeaderDigest digest = HeaderDigest.of(bytes);

        adapter.putDigest("uid:1", digest);
        verify(cache).put("INBOX", "uid:1", AttributeCacheAdapter.ATTR_HEADER_DIGEST, bytes);

        when(cache.get("INBOX", "uid:1", AttributeCacheAdapter.ATTR_HEADER_DIGEST)).thenReturn(bytes);
        assertEquals(digest, adapter.getDigest("uid:1"));
    }

    @Test
    public void testDigestOfWrongLengthIsIgnored() throws IOException {
        when(cache.get("INBOX", "uid:1", AttributeCacheAdapter.ATTR_HEADER_DIGEST)).thenReturn(new byte[16]);

        assertNull(adapter.getDigest("uid:1"));
    }

    @Test
    public void testUidl() throws IOException {
        adapter.putUidl("uid:3", "UIDL-3");
        verify(cache).put("INBOX", "uid:3", AttributeCacheAdapter.ATTR_POP3_UIDL,
                "UIDL-3".getBytes(StandardCharsets.UTF_8));

        when(cache.get("INBOX", "uid:3", AttributeCacheAdapter.ATTR_POP3_UIDL))
                .thenReturn("UIDL-3".getBytes(StandardCharsets.UTF_8));
        assertEquals("UIDL-3", adapter.getUidl("uid:3"));
    }

    @Test
    public void testEmptyUidlCountsAsMissing() throws IOException {
        when(cache.get("INBOX", "uid:3", AttributeCacheAdapter.ATTR_POP3_UIDL)).thenReturn(new byte[0]);

        assertNull(adapter.getUidl("uid:3"));
    }

    @Test
    public void testReadFailureCountsAsMissing() throws IOException {
        when(cache.get(anyString(), anyString(), anyString())).thenThrow(new IOException("disk gone"));

        assertNull(adapter.getDigest("uid:1"));
        assertNull(adapter.getUidl("uid:1"));
    }

    @Test
    public void testWriteFailureIsNotPropagated() throws IOException {
        doThrow(new IOException("disk full")).when(cache).put(anyString(), anyString(), anyString(), any(byte[].class));

        adapter.putUidl("uid:1", "UIDL-1");
        adapter.putDigest("uid:1", HeaderDigest.of(new byte[HeaderDigest.LENGTH]));

        verify(cache, times(2)).put(anyString(), anyString(), anyString(), any(byte[].class));
    }
}
