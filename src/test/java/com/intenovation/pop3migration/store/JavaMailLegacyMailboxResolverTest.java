package com.intenovation.pop3migration.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import javax.mail.Folder;
import javax.mail.FolderNotFoundException;
import javax.mail.MessagingException;
import javax.mail.Store;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Test cases for JavaMailLegacyMailboxResolver
 */
public class JavaMailLegacyMailboxResolverTest {

    @Mock
    private Store store;

    @Mock
    private Folder folder;

    private JavaMailLegacyMailboxResolver resolver;

    @BeforeEach
    public void setUp() throws MessagingException {
        MockitoAnnotations.openMocks(this);
        when(store.getFolder("INBOX")).thenReturn(folder);
        when(folder.getFullName()).thenReturn("INBOX");
        resolver = new JavaMailLegacyMailboxResolver(store, "pop.example.com", 110, "user", "secret");
    }

    @Test
    public void testResolveConnectsOnce() throws MessagingException {
        when(folder.exists()).thenReturn(true);

        MessageSource source = resolver.resolve("INBOX");
        when(store.isConnected()).thenReturn(true);
        resolver.resolve("INBOX");

        assertEquals("pop3/INBOX", source.getName());
        verify(store, times(1)).connect("pop.example.com", 110, "user", "secret");
    }

    @Test
    public void testMissingFolder() throws MessagingException {
        when(folder.exists()).thenReturn(false);

        assertThrows(FolderNotFoundException.class, () -> resolver.resolve("INBOX"));
    }

    @Test
    public void testLegacyNamespace() {
        assertTrue(resolver.isLegacyMailbox("pop3/INBOX"));
        assertFalse(resolver.isLegacyMailbox("imap/INBOX"));
    }

    @Test
    public void testClose() throws MessagingException {
        resolver.close();
        verify(store, never()).close();

        when(store.isConnected()).thenReturn(true);
        resolver.close();
        verify(store).close();
    }
}
