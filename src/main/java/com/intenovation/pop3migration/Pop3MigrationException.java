package com.intenovation.pop3migration;

import javax.mail.MessagingException;

/**
 * Raised when POP3 identities couldn't be assigned to a mailbox.
 */
public class Pop3MigrationException extends MessagingException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Listing or fetching from one of the mailboxes failed */
        IO_FAILURE,
        /** POP3 messages were left without an IMAP match */
        UNRESOLVED_IDENTITY,
        /** The UIDL sync of the mailbox failed; a temporary error for the client */
        SYNC_FAILED
    }

    private final Kind kind;

    public Pop3MigrationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Pop3MigrationException(Kind kind, String message, Exception cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
