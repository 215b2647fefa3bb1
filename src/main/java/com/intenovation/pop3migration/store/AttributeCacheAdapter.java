package com.intenovation.pop3migration.store;

import com.intenovation.pop3migration.hash.HeaderDigest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes the migration attributes of one mailbox.
 * <p>
 * Reads that fail count as "nothing cached" and writes are best effort:
 * a failed write only means the work is repeated in the next session.
 */
public class AttributeCacheAdapter {
    private static final Logger LOGGER = Logger.getLogger(AttributeCacheAdapter.class.getName());

    /** Attribute holding the header digest of a message */
    public static final String ATTR_HEADER_DIGEST = "pop3-migration.hdr";

    /** Attribute holding the POP3 UIDL matched to an IMAP message */
    public static final String ATTR_POP3_UIDL = "pop3-uidl";

    private final AttributeCache cache;
    private final String mailbox;

    public AttributeCacheAdapter(AttributeCache cache, String mailbox) {
        this.cache = cache;
        this.mailbox = mailbox;
    }

    public String getMailbox() {
        return mailbox;
    }

    /**
     * Get the cached header digest of a message
     *
     * @return The digest, or null if none is cached or the cached value is unusable
     */
    public HeaderDigest getDigest(String messageKey) {
        byte[] value = read(messageKey, ATTR_HEADER_DIGEST);
        if (value == null) {
            return null;
        }
        if (value.length != HeaderDigest.LENGTH) {
            LOGGER.fine("pop3_migration: Ignoring cached header digest of " + messageKey +
                    " with wrong length " + value.length);
            return null;
        }
        return HeaderDigest.of(value);
    }

    public void putDigest(String messageKey, HeaderDigest digest) {
        write(messageKey, ATTR_HEADER_DIGEST, digest.toByteArray());
    }

    /**
     * Get the POP3 UIDL stored for a message by an earlier session
     *
     * @return The UIDL, or null if none is cached
     */
    public String getUidl(String messageKey) {
        byte[] value = read(messageKey, ATTR_POP3_UIDL);
        if (value == null || value.length == 0) {
            return null;
        }
        return new String(value, StandardCharsets.UTF_8);
    }

    public void putUidl(String messageKey, String uidl) {
        write(messageKey, ATTR_POP3_UIDL, uidl.getBytes(StandardCharsets.UTF_8));
    }

    private byte[] read(String messageKey, String attribute) {
        try {
            return cache.get(mailbox, messageKey, attribute);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "pop3_migration: Failed to read " + attribute + " of " +
                    messageKey + " in " + mailbox + " - ignoring", e);
            return null;
        }
    }

    private void write(String messageKey, String attribute, byte[] value) {
        try {
            cache.put(mailbox, messageKey, attribute, value);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "pop3_migration: Failed to cache " + attribute + " of " +
                    messageKey + " in " + mailbox, e);
        }
    }
}
