package com.intenovation.pop3migration.match;

import com.intenovation.pop3migration.Pop3MigrationException;
import com.intenovation.pop3migration.Pop3MigrationSettings;
import com.intenovation.pop3migration.map.PopEntry;

import java.util.logging.Logger;

/**
 * Decides whether POP3 messages left unmatched fail the sync
 */
public class PolicyGate {
    private static final Logger LOGGER = Logger.getLogger(PolicyGate.class.getName());

    private final Pop3MigrationSettings settings;

    public PolicyGate(Pop3MigrationSettings settings) {
        this.settings = settings;
    }

    /**
     * Check a digest match report against the configured tolerances.
     *
     * @param report The report of the header digest match
     * @throws Pop3MigrationException If unmatched POP3 messages aren't tolerated
     */
    public void check(MatchReport report) throws Pop3MigrationException {
        int missing = report.getMissingCount();
        if (missing == 0 || settings.isAllMailboxes()) {
            // with all_mailboxes the rest may well be in other mailboxes
            LOGGER.fine("pop3_migration: " + report.getDigestMatches() + " mails matched by headers, " +
                    missing + " POP3 mails unmatched out of " + report.getPopCount());
            return;
        }

        PopEntry first = report.getFirstMissing();
        StringBuilder text = new StringBuilder();
        text.append("pop3_migration: ").append(missing)
                .append(" POP3 messages have no matching IMAP messages (first POP3 msg ")
                .append(first.getPopSeq()).append(" UIDL ").append(first.getUidl()).append(")");

        boolean allImapMailsFound = report.isAllImapMessagesFound();
        if (allImapMailsFound) {
            text.append(" - all IMAP messages were found (POP3 contains more than IMAP INBOX")
                    .append(" - you may want to set all_mailboxes=yes)");
        }

        if (allImapMailsFound && settings.isIgnoreExtraUidls()) {
            // POP3 has more mails than IMAP, maybe new mail was just delivered
            LOGGER.warning(text.toString());
            return;
        }
        if (!settings.isIgnoreMissingUidls()) {
            text.append(" - set ignore_missing_uidls=yes");
            if (allImapMailsFound) {
                text.append(" or ignore_extra_uidls=yes");
            }
            text.append(" to continue anyway");
            LOGGER.severe(text.toString());
            throw new Pop3MigrationException(Pop3MigrationException.Kind.UNRESOLVED_IDENTITY, text.toString());
        }
        LOGGER.warning(text.toString());
    }
}
