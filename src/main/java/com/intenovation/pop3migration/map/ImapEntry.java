package com.intenovation.pop3migration.map;

import com.intenovation.pop3migration.store.MessageInfo;

/**
 * One message of the IMAP mailbox.
 * <p>
 * The POP3 UIDL starts out as the value cached by an earlier session, if
 * any, and is replaced by the matched UIDL. The POP3 sequence is only
 * known once the message was matched in this session.
 */
public class ImapEntry extends MessageMapEntry {
    private final String cachedUidl;
    private String pop3Uidl;
    private int pop3Seq;

    public ImapEntry(MessageInfo message, String cachedUidl) {
        super(message);
        this.cachedUidl = cachedUidl;
        this.pop3Uidl = cachedUidl;
    }

    public long getUid() {
        return getMessage().getUid();
    }

    public long getPhysicalSize() {
        return getMessage().getSize();
    }

    /**
     * Get the UIDL read from the attribute cache, null if none
     */
    public String getCachedUidl() {
        return cachedUidl;
    }

    /**
     * Get the UIDL assigned to this message, cached or matched
     */
    public String getPop3Uidl() {
        return pop3Uidl;
    }

    /**
     * Get the sequence number of the matched POP3 message, 0 if not matched
     */
    public int getPop3Seq() {
        return pop3Seq;
    }

    /**
     * Record the POP3 message this one was matched to
     */
    public void assign(PopEntry pop) {
        this.pop3Uidl = pop.getUidl();
        this.pop3Seq = pop.getPopSeq();
    }

    /**
     * Forget a cached UIDL that turned out to be unusable, so the message
     * can be matched again by size or header digest
     */
    public void dropCachedUidl() {
        if (pop3Seq == 0) {
            this.pop3Uidl = null;
        }
    }

    /**
     * Whether a UIDL is known for this message, cached or matched
     */
    @Override
    public boolean isMatched() {
        return pop3Uidl != null;
    }

    @Override
    public String getCacheKey() {
        return cacheKey(getUid());
    }

    /**
     * Get the attribute cache key of the IMAP message with the given UID
     */
    public static String cacheKey(long uid) {
        return "uid:" + uid;
    }

    @Override
    public String toString() {
        return "ImapEntry[uid=" + getUid() + ", size=" + getPhysicalSize() +
                ", uidl=" + pop3Uidl + ", pop3Seq=" + pop3Seq + "]";
    }
}
