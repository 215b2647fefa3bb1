package com.intenovation.pop3migration;

/**
 * Protocol specific identity fields a mailbox can be asked for
 */
public enum SpecialField {
    /**
     * The POP3 UIDL of the message
     */
    UIDL("POP3 unique identifier listing value", true),

    /**
     * The 1-based position of the message in the POP3 listing
     */
    POP3_ORDER("Position of the message in the POP3 listing", true),

    /**
     * Message-ID header; never answered by the migration layer
     */
    MESSAGE_ID("Message-ID header value", false);

    private final String description;
    private final boolean pop3Derived;

    SpecialField(String description, boolean pop3Derived) {
        this.description = description;
        this.pop3Derived = pop3Derived;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether answering this field needs the POP3 UIDL sync
     */
    public boolean isPop3Derived() {
        return pop3Derived;
    }
}
