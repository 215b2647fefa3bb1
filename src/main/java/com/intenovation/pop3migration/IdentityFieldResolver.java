package com.intenovation.pop3migration;

import javax.mail.MessagingException;

/**
 * Answers protocol specific identity fields of the messages of one mailbox
 */
public interface IdentityFieldResolver {

    /**
     * Get a special field of a message
     *
     * @param uid   The IMAP UID of the message
     * @param field The field to look up
     * @return The field value, or null if the mailbox has none
     * @throws MessagingException If the lookup failed
     */
    String getSpecial(long uid, SpecialField field) throws MessagingException;
}
