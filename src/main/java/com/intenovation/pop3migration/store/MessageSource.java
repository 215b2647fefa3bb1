package com.intenovation.pop3migration.store;

import javax.mail.MessageRemovedException;
import javax.mail.MessagingException;
import java.io.InputStream;
import java.util.List;

/**
 * Read access to one mailbox, either the legacy POP3 mailbox or
 * the IMAP mailbox whose messages get POP3 identities assigned.
 * <p>
 * All calls block until the remote server has answered.
 */
public interface MessageSource {

    /**
     * Get a name that identifies this mailbox, qualified with its protocol
     * (for example {@code pop3/INBOX}). Used as the attribute cache namespace.
     */
    String getName();

    /**
     * Get the UIDVALIDITY of the mailbox, 0 if it has none (POP3). Cached
     * per-UID attributes only stay valid while this value is unchanged.
     *
     * @throws MessagingException If the mailbox couldn't be opened
     */
    long getUidValidity() throws MessagingException;

    /**
     * List every message in ascending sequence order.
     *
     * @param withSizes false to skip the size lookup; sizes are then
     *                  reported as {@link MessageInfo#UNKNOWN_SIZE}
     * @return The messages in ascending sequence order
     * @throws MessagingException If the mailbox couldn't be synchronized or a
     *                            lookup failed for a message that still exists
     */
    List<MessageInfo> enumerate(boolean withSizes) throws MessagingException;

    /**
     * Fetch the header section of a message.
     *
     * @throws MessageRemovedException If the message was expunged on the server
     * @throws MessagingException      If the fetch failed
     */
    InputStream fetchHeader(MessageInfo message) throws MessagingException;

    /**
     * Fetch the full message, header and body.
     *
     * @throws MessageRemovedException If the message was expunged on the server
     * @throws MessagingException      If the fetch failed
     */
    InputStream fetchFullMessage(MessageInfo message) throws MessagingException;

    /**
     * Release the connection held by this mailbox, if any
     */
    void close() throws MessagingException;
}
