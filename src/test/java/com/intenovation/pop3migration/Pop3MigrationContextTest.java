package com.intenovation.pop3migration;

import com.intenovation.pop3migration.store.AttributeCache;
import com.intenovation.pop3migration.store.InMemoryAttributeCache;
import com.intenovation.pop3migration.store.InMemoryMessageSource;
import com.intenovation.pop3migration.store.LegacyMailboxResolver;
import com.intenovation.pop3migration.store.MessageSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import javax.mail.MessagingException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Test cases for which mailboxes Pop3MigrationContext wraps
 */
public class Pop3MigrationContextTest {

    @Mock
    private LegacyMailboxResolver resolver;

    @Mock
    private IdentityFieldResolver inner;

    private Pop3MigrationSettings settings;
    private InMemoryMessageSource inbox;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        settings = new Pop3MigrationSettings().setMailbox("pop3/INBOX");
        inbox = new InMemoryMessageSource("imap/INBOX");
        when(resolver.isLegacyMailbox(anyString())).thenAnswer(
                invocation -> ((String) invocation.getArgument(0)).startsWith("pop3/"));
    }

    private Pop3MigrationContext context() {
        return new Pop3MigrationContext(settings, resolver, new InMemoryAttributeCache());
    }

    @Test
    public void testInboxIsWrapped() {
        IdentityFieldResolver wrapped = context().wrap(inner, inbox, true);

        assertTrue(wrapped instanceof Pop3MigrationIdentityResolver);
        Pop3MigrationIdentityResolver migration = (Pop3MigrationIdentityResolver) wrapped;
        assertSame(inner, migration.getInner());
        assertSame(inbox, migration.getSync().getTarget());
        assertFalse(migration.getSync().isSynced());
    }

    @Test
    public void testDisabledWithoutMailbox() {
        settings.setMailbox("");

        assertSame(inner, context().wrap(inner, inbox, true));
    }

    @Test
    public void testOtherMailboxesNeedAllMailboxes() {
        InMemoryMessageSource archive = new InMemoryMessageSource("imap/Archive");

        assertSame(inner, context().wrap(inner, archive, false));

        settings.setAllMailboxes(true);
        assertTrue(context().wrap(inner, archive, false) instanceof Pop3MigrationIdentityResolver);
    }

    @Test
    public void testLegacyNamespaceIsNeverWrapped() {
        settings.setAllMailboxes(true);
        InMemoryMessageSource legacy = new InMemoryMessageSource("pop3/INBOX");

        assertSame(inner, context().wrap(inner, legacy, true));
    }

    @Test
    public void testWrappingDoesNoRemoteWork() throws Exception {
        context().wrap(inner, inbox, true);

        assertEquals(0, inbox.getEnumerateCount());
        verify(resolver, never()).resolve(anyString());
    }

    @Test
    public void testCacheNamespaceFollowsUidValidity() throws Pop3MigrationException {
        assertEquals("imap/INBOX", context().attributesOf(inbox).getMailbox());

        inbox.setUidValidity(42);
        assertEquals("imap/INBOX;42", context().attributesOf(inbox).getMailbox());
    }

    @Test
    public void testUidValidityFailure() throws MessagingException {
        MessageSource broken = mock(MessageSource.class);
        when(broken.getName()).thenReturn("imap/INBOX");
        when(broken.getUidValidity()).thenThrow(new MessagingException("STATUS failed"));

        Pop3MigrationException e = assertThrows(Pop3MigrationException.class,
                () -> context().attributesOf(broken));
        assertEquals(Pop3MigrationException.Kind.IO_FAILURE, e.getKind());
    }

    @Test
    public void testFlushFailureIsOnlyLogged() throws IOException {
        AttributeCache cache = mock(AttributeCache.class);
        doThrow(new IOException("disk full")).when(cache).flush();

        new Pop3MigrationContext(settings, resolver, cache).flushAttributes();

        verify(cache).flush();
    }
}
