package com.intenovation.pop3migration;

import javax.mail.Session;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings of the POP3 migration layer
 */
public class Pop3MigrationSettings {
    private static final Logger LOGGER = Logger.getLogger(Pop3MigrationSettings.class.getName());

    public static final String PREFIX = "mail.pop3migration.";
    public static final String PROP_MAILBOX = PREFIX + "mailbox";
    public static final String PROP_ALL_MAILBOXES = PREFIX + "all_mailboxes";
    public static final String PROP_IGNORE_MISSING_UIDLS = PREFIX + "ignore_missing_uidls";
    public static final String PROP_IGNORE_EXTRA_UIDLS = PREFIX + "ignore_extra_uidls";
    public static final String PROP_SKIP_SIZE_CHECK = PREFIX + "skip_size_check";
    public static final String PROP_SKIP_UIDL_CACHE = PREFIX + "skip_uidl_cache";
    public static final String PROP_CACHE_DIRECTORY = PREFIX + "cache.directory";

    private String mailbox = "";
    private boolean allMailboxes = false;
    private boolean ignoreMissingUidls = false;
    private boolean ignoreExtraUidls = false;
    private boolean skipSizeCheck = false;
    private boolean skipUidlCache = false;
    private String cacheDirectory;

    /**
     * Create settings with default values; the migration is disabled
     * until a mailbox is set
     */
    public Pop3MigrationSettings() {
        // Default values are set in field initializers
    }

    /**
     * Read the settings from a JavaMail session
     */
    public static Pop3MigrationSettings fromSession(Session session) {
        return fromProperties(session.getProperties());
    }

    /**
     * Read the settings from mail.pop3migration.* properties
     */
    public static Pop3MigrationSettings fromProperties(Properties props) {
        Pop3MigrationSettings settings = new Pop3MigrationSettings();
        String mailbox = props.getProperty(PROP_MAILBOX);
        if (mailbox != null) {
            settings.setMailbox(mailbox.trim());
        }
        settings.setAllMailboxes(parseBoolean(props, PROP_ALL_MAILBOXES, false));
        settings.setIgnoreMissingUidls(parseBoolean(props, PROP_IGNORE_MISSING_UIDLS, false));
        settings.setIgnoreExtraUidls(parseBoolean(props, PROP_IGNORE_EXTRA_UIDLS, false));
        settings.setSkipSizeCheck(parseBoolean(props, PROP_SKIP_SIZE_CHECK, false));
        settings.setSkipUidlCache(parseBoolean(props, PROP_SKIP_UIDL_CACHE, false));
        settings.setCacheDirectory(props.getProperty(PROP_CACHE_DIRECTORY));
        return settings;
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "yes":
            case "true":
            case "1":
                return true;
            case "no":
            case "false":
            case "0":
                return false;
            default:
                LOGGER.warning("pop3_migration: Invalid boolean '" + value + "' for " + key +
                        ", using " + defaultValue);
                return defaultValue;
        }
    }

    /**
     * Whether the migration layer is active at all
     */
    public boolean isEnabled() {
        return !mailbox.isEmpty();
    }

    /**
     * The legacy POP3 mailbox that IMAP messages are matched against
     */
    public String getMailbox() {
        return mailbox;
    }

    public Pop3MigrationSettings setMailbox(String mailbox) {
        this.mailbox = mailbox == null ? "" : mailbox;
        return this;
    }

    /**
     * Whether every mailbox gets POP3 identities, not just INBOX.
     * POP3 messages are then expected to be spread over several mailboxes.
     */
    public boolean isAllMailboxes() {
        return allMailboxes;
    }

    public Pop3MigrationSettings setAllMailboxes(boolean allMailboxes) {
        this.allMailboxes = allMailboxes;
        return this;
    }

    /**
     * Whether POP3 messages without an IMAP match are only warned about
     */
    public boolean isIgnoreMissingUidls() {
        return ignoreMissingUidls;
    }

    public Pop3MigrationSettings setIgnoreMissingUidls(boolean ignoreMissingUidls) {
        this.ignoreMissingUidls = ignoreMissingUidls;
        return this;
    }

    /**
     * Whether extra POP3 messages are accepted silently when every
     * IMAP message was matched, e.g. because new mail just arrived
     */
    public boolean isIgnoreExtraUidls() {
        return ignoreExtraUidls;
    }

    public Pop3MigrationSettings setIgnoreExtraUidls(boolean ignoreExtraUidls) {
        this.ignoreExtraUidls = ignoreExtraUidls;
        return this;
    }

    /**
     * Whether message sizes are left out of the listing and the
     * positional size match is skipped
     */
    public boolean isSkipSizeCheck() {
        return skipSizeCheck;
    }

    public Pop3MigrationSettings setSkipSizeCheck(boolean skipSizeCheck) {
        this.skipSizeCheck = skipSizeCheck;
        return this;
    }

    /**
     * Whether UIDLs matched in earlier sessions are ignored and not stored
     */
    public boolean isSkipUidlCache() {
        return skipUidlCache;
    }

    public Pop3MigrationSettings setSkipUidlCache(boolean skipUidlCache) {
        this.skipUidlCache = skipUidlCache;
        return this;
    }

    /**
     * Directory of the file based attribute cache, null if not configured
     */
    public String getCacheDirectory() {
        return cacheDirectory;
    }

    public Pop3MigrationSettings setCacheDirectory(String cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
        return this;
    }

    @Override
    public String toString() {
        return "Pop3MigrationSettings[mailbox=" + mailbox +
                ", allMailboxes=" + allMailboxes +
                ", ignoreMissingUidls=" + ignoreMissingUidls +
                ", ignoreExtraUidls=" + ignoreExtraUidls +
                ", skipSizeCheck=" + skipSizeCheck +
                ", skipUidlCache=" + skipUidlCache + "]";
    }
}
