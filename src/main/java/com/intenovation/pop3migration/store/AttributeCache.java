package com.intenovation.pop3migration.store;

import java.io.IOException;

/**
 * Storage for small per-message binary attributes that survive restarts.
 */
public interface AttributeCache {

    /**
     * Look up an attribute.
     *
     * @param mailbox    The mailbox name, see {@link MessageSource#getName()}
     * @param messageKey The stable identifier of the message within the mailbox
     * @param attribute  The attribute name
     * @return The stored value, or null if there is none
     * @throws IOException If the backing store couldn't be read
     */
    byte[] get(String mailbox, String messageKey, String attribute) throws IOException;

    /**
     * Store an attribute, replacing any previous value.
     *
     * @throws IOException If the backing store couldn't be written
     */
    void put(String mailbox, String messageKey, String attribute, byte[] value) throws IOException;

    /**
     * Write out the values stored since the last flush. Implementations
     * may keep puts in memory until this is called.
     *
     * @throws IOException If the backing store couldn't be written
     */
    void flush() throws IOException;
}
