package com.intenovation.pop3migration.store;

/**
 * One message as reported by a mailbox listing.
 * POP3 listings fill in the UIDL, IMAP listings fill in the UID.
 */
public final class MessageInfo {
    /** Size value used when the size lookup was skipped */
    public static final long UNKNOWN_SIZE = -1;

    private final int sequence;
    private final long uid;
    private final String uidl;
    private final long size;

    public MessageInfo(int sequence, long uid, String uidl, long size) {
        this.sequence = sequence;
        this.uid = uid;
        this.uidl = uidl;
        this.size = size;
    }

    /**
     * Create the listing entry of a POP3 message
     */
    public static MessageInfo pop3(int sequence, String uidl, long size) {
        return new MessageInfo(sequence, 0, uidl, size);
    }

    /**
     * Create the listing entry of an IMAP message
     */
    public static MessageInfo imap(int sequence, long uid, long size) {
        return new MessageInfo(sequence, uid, null, size);
    }

    /**
     * Get the 1-based position of the message in the listing
     */
    public int getSequence() {
        return sequence;
    }

    /**
     * Get the IMAP UID, 0 for POP3 messages
     */
    public long getUid() {
        return uid;
    }

    /**
     * Get the POP3 UIDL, null for IMAP messages
     */
    public String getUidl() {
        return uidl;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "MessageInfo[seq=" + sequence + ", uid=" + uid + ", uidl=" + uidl + ", size=" + size + "]";
    }
}
