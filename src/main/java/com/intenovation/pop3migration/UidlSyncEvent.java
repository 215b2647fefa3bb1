package com.intenovation.pop3migration;

import java.util.EventObject;

/**
 * Event fired by a MailboxUidlSync.
 */
public class UidlSyncEvent extends EventObject {
    private static final long serialVersionUID = 1L;

    public enum Type {
        SYNC_STARTED,
        SYNC_COMPLETED,
        SYNC_FAILED
    }

    private final Type type;
    private final transient Object detail;

    /**
     * Create a new sync event.
     * @param source The MailboxUidlSync that fired the event
     * @param type The event type
     * @param detail The MatchTable on completion, the exception on failure, otherwise null
     */
    public UidlSyncEvent(Object source, Type type, Object detail) {
        super(source);
        this.type = type;
        this.detail = detail;
    }

    public Type getType() {
        return type;
    }

    public Object getDetail() {
        return detail;
    }
}
