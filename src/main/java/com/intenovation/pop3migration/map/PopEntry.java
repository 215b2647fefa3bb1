package com.intenovation.pop3migration.map;

import com.intenovation.pop3migration.store.MessageInfo;

/**
 * One message of the legacy POP3 mailbox
 */
public class PopEntry extends MessageMapEntry {
    private long imapUid;

    public PopEntry(MessageInfo message) {
        super(message);
    }

    public int getPopSeq() {
        return getMessage().getSequence();
    }

    public String getUidl() {
        return getMessage().getUidl();
    }

    public long getSize() {
        return getMessage().getSize();
    }

    /**
     * Get the UID of the IMAP message matched to this one, 0 if none
     */
    public long getImapUid() {
        return imapUid;
    }

    public void setImapUid(long imapUid) {
        this.imapUid = imapUid;
    }

    @Override
    public boolean isMatched() {
        return imapUid != 0;
    }

    @Override
    public String getCacheKey() {
        return "uidl:" + getUidl();
    }

    @Override
    public String toString() {
        return "PopEntry[seq=" + getPopSeq() + ", uidl=" + getUidl() + ", size=" + getSize() +
                ", imapUid=" + imapUid + "]";
    }
}
