package com.intenovation.pop3migration.map;

import com.intenovation.pop3migration.Pop3MigrationException;
import com.intenovation.pop3migration.store.MessageInfo;
import com.intenovation.pop3migration.store.MessageSource;

import javax.mail.MessagingException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists the legacy POP3 mailbox into PopEntry objects
 */
public class Pop3MapBuilder {
    private static final Logger LOGGER = Logger.getLogger(Pop3MapBuilder.class.getName());

    private final boolean skipSizeCheck;

    public Pop3MapBuilder(boolean skipSizeCheck) {
        this.skipSizeCheck = skipSizeCheck;
    }

    /**
     * List every message in ascending POP3 sequence order. Messages with an
     * empty UIDL can never be matched and are left out.
     *
     * @param legacy The legacy mailbox
     * @return The entries in POP3 sequence order
     * @throws Pop3MigrationException If the mailbox couldn't be listed
     */
    public List<PopEntry> build(MessageSource legacy) throws Pop3MigrationException {
        List<MessageInfo> messages;
        try {
            messages = legacy.enumerate(!skipSizeCheck);
        } catch (MessagingException e) {
            LOGGER.log(Level.SEVERE, "pop3_migration: Failed to list POP3 mailbox " + legacy.getName(), e);
            throw new Pop3MigrationException(Pop3MigrationException.Kind.IO_FAILURE,
                    "pop3_migration: Couldn't sync mailbox " + legacy.getName() + ": " + e.getMessage(), e);
        }

        List<PopEntry> entries = new ArrayList<>(messages.size());
        for (MessageInfo message : messages) {
            String uidl = message.getUidl();
            if (uidl == null || uidl.isEmpty()) {
                LOGGER.warning("pop3_migration: UIDL for msg " + message.getSequence() + " is empty");
                continue;
            }
            entries.add(new PopEntry(message));
        }
        LOGGER.fine("pop3_migration: Read " + entries.size() + " POP3 messages from " + legacy.getName());
        return entries;
    }
}
