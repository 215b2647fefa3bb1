package com.intenovation.pop3migration;

/**
 * Interface for listeners that want to know when the UIDLs of a mailbox
 * were synced.
 */
public interface UidlSyncListener {
    /**
     * Called when a sync starts, completes or fails.
     * @param event The sync event
     */
    void uidlSyncChanged(UidlSyncEvent event);
}
