package com.intenovation.pop3migration.store;

import javax.mail.MessagingException;

/**
 * Finds the legacy POP3 mailbox that IMAP messages are matched against.
 */
public interface LegacyMailboxResolver {

    /**
     * Resolve the configured legacy mailbox identifier to a mailbox handle.
     *
     * @param identifier The configured mailbox identifier
     * @return The legacy mailbox, never null
     * @throws javax.mail.FolderNotFoundException If there is no such mailbox
     * @throws MessagingException                 If the lookup failed
     */
    MessageSource resolve(String identifier) throws MessagingException;

    /**
     * Check whether a mailbox belongs to the legacy namespace itself.
     * Such mailboxes never get POP3 identities assigned.
     *
     * @param mailboxName A name as returned by {@link MessageSource#getName()}
     */
    boolean isLegacyMailbox(String mailboxName);
}
