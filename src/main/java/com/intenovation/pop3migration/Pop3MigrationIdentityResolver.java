package com.intenovation.pop3migration;

import com.intenovation.pop3migration.match.MatchTable;

import javax.mail.MessagingException;
import java.util.Collection;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Answers UIDL and POP3 order lookups of an IMAP mailbox from the POP3
 * mailbox it was migrated from. Everything it can't answer goes to the
 * mailbox's own resolver.
 */
public class Pop3MigrationIdentityResolver implements IdentityFieldResolver {
    private static final Logger LOGGER = Logger.getLogger(Pop3MigrationIdentityResolver.class.getName());

    private final IdentityFieldResolver inner;
    private final MailboxUidlSync sync;

    public Pop3MigrationIdentityResolver(IdentityFieldResolver inner, MailboxUidlSync sync) {
        this.inner = inner;
        this.sync = sync;
    }

    public IdentityFieldResolver getInner() {
        return inner;
    }

    public MailboxUidlSync getSync() {
        return sync;
    }

    @Override
    public String getSpecial(long uid, SpecialField field) throws MessagingException {
        if (field.isPop3Derived()) {
            MatchTable.Match match = sync.lookup(uid);
            if (match != null) {
                if (field == SpecialField.UIDL) {
                    return match.getUidl();
                }
                if (match.getPop3Seq() != 0) {
                    return String.valueOf(match.getPop3Seq());
                }
            }
            // not found from the POP3 server
        }
        return inner.getSpecial(uid, field);
    }

    /**
     * Start the sync before a search that will ask for POP3 fields, so it
     * runs before the search starts fetching message bodies. A failure is
     * not raised here; the lookups report it.
     *
     * @param wantedFields The fields the search is going to fetch
     */
    public void beforeSearch(Collection<SpecialField> wantedFields) {
        boolean wanted = false;
        for (SpecialField field : wantedFields) {
            if (field.isPop3Derived()) {
                wanted = true;
                break;
            }
        }
        if (!wanted) {
            return;
        }
        try {
            sync.syncIfNeeded();
        } catch (Pop3MigrationException e) {
            LOGGER.log(Level.FINE, "pop3_migration: UIDL sync before search failed, lookups will report it", e);
        }
    }
}
