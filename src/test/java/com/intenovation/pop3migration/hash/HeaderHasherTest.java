package com.intenovation.pop3migration.hash;

import com.intenovation.pop3migration.Pop3MigrationException;
import com.intenovation.pop3migration.map.ImapEntry;
import com.intenovation.pop3migration.store.AttributeCacheAdapter;
import com.intenovation.pop3migration.store.InMemoryAttributeCache;
import com.intenovation.pop3migration.store.InMemoryMessageSource;
import com.intenovation.pop3migration.store.MessageInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.mail.MessagingException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.intenovation.pop3migration.store.InMemoryMessageSource.message;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for HeaderHasher
 */
public class HeaderHasherTest {

    private InMemoryMessageSource source;
    private InMemoryAttributeCache cache;
    private AttributeCacheAdapter attributes;
    private HeaderHasher hasher;

    @BeforeEach
    public void setUp() {
        source = new InMemoryMessageSource("imap/INBOX");
        cache = new InMemoryAttributeCache();
        attributes = new AttributeCacheAdapter(cache, source.getName());
        hasher = new HeaderHasher(source, attributes);
    }

    private List<ImapEntry> entries() throws MessagingException {
        List<ImapEntry> entries = new ArrayList<>();
        for (MessageInfo info : source.enumerate(true)) {
            entries.add(new ImapEntry(info, null));
        }
        return entries;
    }

    private static HeaderDigest digestOf(byte[] raw) throws IOException {
        return HeaderCanonicalizer.digest(new ByteArrayInputStream(raw)).getDigest();
    }

    @Test
    public void testDigestIsComputedAndCached() throws Exception {
        byte[] raw = message("body", "Subject: one", "From: a@example.com");
        source.addImap(1, raw);

        List<ImapEntry> entries = entries();
        hasher.hashRange(entries, 0, false);

        assertEquals(digestOf(raw), entries.get(0).getHeaderDigest());
        assertEquals(digestOf(raw), attributes.getDigest("uid:1"));
        assertEquals(1, source.getHeaderFetchCount());
        assertEquals(0, source.getFullFetchCount());
        assertEquals(1, hasher.getComputedCount());
    }

    @Test
    public void testCachedDigestSkipsFetch() throws Exception {
        source.addImap(1, message("body", "Subject: one"));
        HeaderDigest cached = digestOf(message("", "Subject: cached"));
        attributes.putDigest("uid:1", cached);

        List<ImapEntry> entries = entries();
        hasher.hashRange(entries, 0, false);

        assertEquals(cached, entries.get(0).getHeaderDigest());
        assertEquals(0, source.getHeaderFetchCount());
        assertEquals(0, hasher.getComputedCount());
    }

    @Test
    public void testRangeStartsAtIndex() throws Exception {
        source.addImap(1, message("", "Subject: one"));
        source.addImap(2, message("", "Subject: two"));

        List<ImapEntry> entries = entries();
        hasher.hashRange(entries, 1, false);

        assertFalse(entries.get(0).isDigestSet());
        assertTrue(entries.get(1).isDigestSet());
        assertEquals(1, source.getHeaderFetchCount());
    }

    @Test
    public void testMatchedEntriesAreSkipped() throws Exception {
        source.addImap(1, message("", "Subject: one"));
        List<ImapEntry> entries = new ArrayList<>();
        entries.add(new ImapEntry(source.enumerate(true).get(0), "cached-uidl"));

        hasher.hashRange(entries, 0, true);

        assertFalse(entries.get(0).isDigestSet());
        assertEquals(0, source.getHeaderFetchCount());
    }

    @Test
    public void testTruncatedHeaderFallsBackToFullMessage() throws Exception {
        byte[] raw = message("body", "From: a", "Subject: x", "To: b");
        // The header fetch stops before the end-of-headers line
        byte[] cutHeader = "From: a\r\nSubject: x\r\n".getBytes(StandardCharsets.ISO_8859_1);
        source.addImap(1, raw.length, cutHeader, raw);

        List<ImapEntry> entries = entries();
        assertTrue(hasher.hash(entries.get(0)));

        assertEquals(digestOf(raw), entries.get(0).getHeaderDigest());
        assertEquals(1, source.getHeaderFetchCount());
        assertEquals(1, source.getFullFetchCount());
    }

    @Test
    public void testStillTruncatedMessageIsHashedAnyway() throws Exception {
        byte[] cut = "From: a\r\nSubject: x\r\n".getBytes(StandardCharsets.ISO_8859_1);
        source.addImap(1, cut.length, cut, cut);

        List<ImapEntry> entries = entries();
        assertTrue(hasher.hash(entries.get(0)));
        assertTrue(entries.get(0).isDigestSet());
        assertNotNull(attributes.getDigest("uid:1"));
    }

    @Test
    public void testExpungedMessageIsTolerated() throws Exception {
        source.addImap(1, message("", "Subject: one"));
        source.addImap(2, message("", "Subject: two"));
        source.expunge(1);

        List<ImapEntry> entries = entries();
        hasher.hashRange(entries, 0, false);

        assertFalse(entries.get(0).isDigestSet());
        assertTrue(entries.get(1).isDigestSet());
    }

    @Test
    public void testFetchFailureIsIoFailure() throws Exception {
        source.addImap(1, message("", "Subject: one"));
        source.failFetch(new MessagingException("connection reset"));

        List<ImapEntry> entries = entries();
        Pop3MigrationException e = assertThrows(Pop3MigrationException.class,
                () -> hasher.hashRange(entries, 0, false));
        assertEquals(Pop3MigrationException.Kind.IO_FAILURE, e.getKind());
        assertTrue(e.getMessage().contains("connection reset"));
    }
}
