package com.intenovation.pop3migration.map;

import com.intenovation.pop3migration.Pop3MigrationException;
import com.intenovation.pop3migration.store.AttributeCacheAdapter;
import com.intenovation.pop3migration.store.MessageInfo;
import com.intenovation.pop3migration.store.MessageSource;

import javax.mail.MessagingException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists the IMAP mailbox into ImapEntry objects, picking up the UIDLs
 * stored by earlier sessions
 */
public class ImapMapBuilder {
    private static final Logger LOGGER = Logger.getLogger(ImapMapBuilder.class.getName());

    private final boolean skipSizeCheck;
    private final boolean skipUidlCache;

    public ImapMapBuilder(boolean skipSizeCheck, boolean skipUidlCache) {
        this.skipSizeCheck = skipSizeCheck;
        this.skipUidlCache = skipUidlCache;
    }

    /**
     * List every message in ascending UID order
     *
     * @param target The IMAP mailbox
     * @param cache  The attribute cache of the IMAP mailbox
     * @return The entries in UID order
     * @throws Pop3MigrationException If the mailbox couldn't be listed
     */
    public List<ImapEntry> build(MessageSource target, AttributeCacheAdapter cache) throws Pop3MigrationException {
        List<MessageInfo> messages;
        try {
            messages = target.enumerate(!skipSizeCheck);
        } catch (MessagingException e) {
            LOGGER.log(Level.SEVERE, "pop3_migration: Failed to search all IMAP mails in " + target.getName(), e);
            throw new Pop3MigrationException(Pop3MigrationException.Kind.IO_FAILURE,
                    "pop3_migration: Failed to list IMAP mailbox " + target.getName() + ": " + e.getMessage(), e);
        }

        List<ImapEntry> entries = new ArrayList<>(messages.size());
        int cached = 0;
        for (MessageInfo message : messages) {
            String cachedUidl = null;
            if (!skipUidlCache) {
                cachedUidl = cache.getUidl(ImapEntry.cacheKey(message.getUid()));
                if (cachedUidl != null) {
                    cached++;
                }
            }
            entries.add(new ImapEntry(message, cachedUidl));
        }
        // UIDs only grow, but don't trust every server to list in UID order
        entries.sort((a, b) -> Long.compare(a.getUid(), b.getUid()));
        LOGGER.fine("pop3_migration: Read " + entries.size() + " IMAP messages from " + target.getName() +
                ", " + cached + " with cached UIDLs");
        return entries;
    }
}
