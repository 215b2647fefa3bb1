package com.intenovation.pop3migration;

import org.junit.jupiter.api.Test;

import javax.mail.Session;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for Pop3MigrationSettings
 */
public class Pop3MigrationSettingsTest {

    @Test
    public void testDefaults() {
        Pop3MigrationSettings settings = Pop3MigrationSettings.fromProperties(new Properties());

        assertFalse(settings.isEnabled());
        assertEquals("", settings.getMailbox());
        assertFalse(settings.isAllMailboxes());
        assertFalse(settings.isIgnoreMissingUidls());
        assertFalse(settings.isIgnoreExtraUidls());
        assertFalse(settings.isSkipSizeCheck());
        assertFalse(settings.isSkipUidlCache());
        assertNull(settings.getCacheDirectory());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(Pop3MigrationSettings.PROP_MAILBOX, " pop3/INBOX ");
        props.setProperty(Pop3MigrationSettings.PROP_ALL_MAILBOXES, "yes");
        props.setProperty(Pop3MigrationSettings.PROP_IGNORE_MISSING_UIDLS, "TRUE");
        props.setProperty(Pop3MigrationSettings.PROP_IGNORE_EXTRA_UIDLS, "1");
        props.setProperty(Pop3MigrationSettings.PROP_SKIP_SIZE_CHECK, "no");
        props.setProperty(Pop3MigrationSettings.PROP_SKIP_UIDL_CACHE, "0");
        props.setProperty(Pop3MigrationSettings.PROP_CACHE_DIRECTORY, "/var/cache/pop3migration");

        Pop3MigrationSettings settings = Pop3MigrationSettings.fromProperties(props);

        assertTrue(settings.isEnabled());
        assertEquals("pop3/INBOX", settings.getMailbox());
        assertTrue(settings.isAllMailboxes());
        assertTrue(settings.isIgnoreMissingUidls());
        assertTrue(settings.isIgnoreExtraUidls());
        assertFalse(settings.isSkipSizeCheck());
        assertFalse(settings.isSkipUidlCache());
        assertEquals("/var/cache/pop3migration", settings.getCacheDirectory());
    }

    @Test
    public void testInvalidBooleanUsesDefault() {
        Properties props = new Properties();
        props.setProperty(Pop3MigrationSettings.PROP_SKIP_SIZE_CHECK, "maybe");

        assertFalse(Pop3MigrationSettings.fromProperties(props).isSkipSizeCheck());
    }

    @Test
    public void testFromSession() {
        Properties props = new Properties();
        props.setProperty(Pop3MigrationSettings.PROP_MAILBOX, "pop3/INBOX");
        props.setProperty(Pop3MigrationSettings.PROP_SKIP_UIDL_CACHE, "yes");

        Pop3MigrationSettings settings = Pop3MigrationSettings.fromSession(Session.getInstance(props));

        assertEquals("pop3/INBOX", settings.getMailbox());
        assertTrue(settings.isSkipUidlCache());
    }

    @Test
    public void testSettersChain() {
        Pop3MigrationSettings settings = new Pop3MigrationSettings()
                .setMailbox("pop3/INBOX")
                .setSkipSizeCheck(true)
                .setMailbox(null);

        assertFalse(settings.isEnabled());
        assertTrue(settings.isSkipSizeCheck());
        assertTrue(settings.toString().contains("skipSizeCheck=true"));
    }
}
