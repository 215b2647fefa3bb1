package com.intenovation.pop3migration.map;

import com.intenovation.pop3migration.hash.HeaderDigest;
import com.intenovation.pop3migration.store.MessageInfo;

/**
 * State shared by the POP3 and IMAP side of the message map:
 * the listing entry and the lazily computed header digest.
 */
public abstract class MessageMapEntry {
    private final MessageInfo message;
    private HeaderDigest headerDigest;

    protected MessageMapEntry(MessageInfo message) {
        this.message = message;
    }

    public MessageInfo getMessage() {
        return message;
    }

    /**
     * Key of this message in the attribute cache of its mailbox
     */
    public abstract String getCacheKey();

    /**
     * Whether this entry has been paired with a message of the other side
     */
    public abstract boolean isMatched();

    public HeaderDigest getHeaderDigest() {
        return headerDigest;
    }

    public boolean isDigestSet() {
        return headerDigest != null;
    }

    public void setHeaderDigest(HeaderDigest headerDigest) {
        this.headerDigest = headerDigest;
    }
}
