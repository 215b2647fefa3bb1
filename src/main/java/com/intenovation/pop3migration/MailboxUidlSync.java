package com.intenovation.pop3migration;

import com.intenovation.pop3migration.hash.HeaderHasher;
import com.intenovation.pop3migration.map.ImapEntry;
import com.intenovation.pop3migration.map.ImapMapBuilder;
import com.intenovation.pop3migration.map.PopEntry;
import com.intenovation.pop3migration.match.MatchReport;
import com.intenovation.pop3migration.match.MatchTable;
import com.intenovation.pop3migration.match.SizeMatchResult;
import com.intenovation.pop3migration.store.AttributeCacheAdapter;
import com.intenovation.pop3migration.store.MessageSource;

import javax.mail.MessagingException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns POP3 UIDLs to the messages of one IMAP mailbox.
 * <p>
 * The sync runs once, on the first lookup that needs it. The result is
 * kept for the rest of the mailbox session; a failure is kept as well, so
 * later lookups fail right away instead of repeating the remote work.
 * Not thread safe: one sync per mailbox object at a time.
 */
public class MailboxUidlSync {
    private static final Logger LOGGER = Logger.getLogger(MailboxUidlSync.class.getName());

    public static final String SYNC_FAILED_MESSAGE = "POP3 UIDLs couldn't be synced";

    private final Pop3MigrationContext context;
    private final MessageSource target;
    private AttributeCacheAdapter targetAttributes;
    private final List<UidlSyncListener> listeners = new CopyOnWriteArrayList<>();

    private List<ImapEntry> imapMap;
    private int firstUnfoundIndex;
    private MatchTable matchTable;
    private Pop3MigrationException failure;

    MailboxUidlSync(Pop3MigrationContext context, MessageSource target) {
        this.context = context;
        this.target = target;
    }

    public MessageSource getTarget() {
        return target;
    }

    public void addSyncListener(UidlSyncListener listener) {
        listeners.add(listener);
    }

    public void removeSyncListener(UidlSyncListener listener) {
        listeners.remove(listener);
    }

    protected void fireSyncEvent(UidlSyncEvent event) {
        for (UidlSyncListener listener : listeners) {
            try {
                listener.uidlSyncChanged(event);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Error notifying listener", e);
            }
        }
    }

    public boolean isSynced() {
        return matchTable != null;
    }

    public boolean isSyncFailed() {
        return failure != null;
    }

    /**
     * Get the match table, null until the sync has completed
     */
    public MatchTable getMatchTable() {
        return matchTable;
    }

    /**
     * Index of the first IMAP/POP3 position the size match couldn't resolve
     */
    public int getFirstUnfoundIndex() {
        return firstUnfoundIndex;
    }

    /**
     * Run the sync unless it already ran in this session.
     *
     * @throws Pop3MigrationException A SYNC_FAILED error if this or an
     *                                earlier attempt failed
     */
    public void syncIfNeeded() throws Pop3MigrationException {
        if (matchTable != null) {
            return;
        }
        if (failure == null) {
            try {
                sync();
                return;
            } catch (Pop3MigrationException e) {
                failure = e;
                fireSyncEvent(new UidlSyncEvent(this, UidlSyncEvent.Type.SYNC_FAILED, e));
            }
        }
        throw new Pop3MigrationException(Pop3MigrationException.Kind.SYNC_FAILED, SYNC_FAILED_MESSAGE, failure);
    }

    /**
     * Get the POP3 identity of an IMAP message, syncing first if needed
     *
     * @param uid The IMAP UID
     * @return The match, or null if the message has no POP3 counterpart
     */
    public MatchTable.Match lookup(long uid) throws Pop3MigrationException {
        syncIfNeeded();
        return matchTable.get(uid);
    }

    private void sync() throws Pop3MigrationException {
        Pop3MigrationSettings settings = context.getSettings();
        LOGGER.info("pop3_migration: Syncing POP3 UIDLs of " + target.getName() + " with " + settings.getMailbox());
        fireSyncEvent(new UidlSyncEvent(this, UidlSyncEvent.Type.SYNC_STARTED, null));

        try {
            // all IMAP traffic first, so the POP3 server doesn't drop us for idling
            readImapMap();

            MessageSource legacy = context.openLegacyMailbox();
            try {
                List<PopEntry> pop3Map = context.readPop3Map(legacy);

                if (!settings.isSkipUidlCache()) {
                    context.getMatcher().assignCached(pop3Map, imapMap);
                }
                SizeMatchResult sizeMatch = context.getMatcher().assignBySize(pop3Map, imapMap);
                firstUnfoundIndex = sizeMatch.getFirstUnfoundIndex();

                if (!sizeMatch.isComplete()) {
                    // everything wasn't assigned, figure out the rest with header hashes
                    context.readLegacyDigests(legacy, firstUnfoundIndex);
                    new HeaderHasher(target, targetAttributes).hashRange(imapMap, firstUnfoundIndex, true);
                    MatchReport report = context.getMatcher().assignByDigest(pop3Map, imapMap);
                    context.getPolicyGate().check(report);
                }
            } finally {
                close(legacy);
            }

            if (!settings.isSkipUidlCache()) {
                storeUidls();
            }
        } finally {
            // digests computed before a failure are kept as well
            context.flushAttributes();
        }
        matchTable = MatchTable.from(imapMap);
        LOGGER.info("pop3_migration: " + matchTable.size() + " of " + imapMap.size() +
                " messages in " + target.getName() + " have POP3 UIDLs");
        fireSyncEvent(new UidlSyncEvent(this, UidlSyncEvent.Type.SYNC_COMPLETED, matchTable));
    }

    private void readImapMap() throws Pop3MigrationException {
        if (imapMap != null) {
            throw new IllegalStateException("IMAP map of " + target.getName() + " was already read");
        }
        Pop3MigrationSettings settings = context.getSettings();
        targetAttributes = context.attributesOf(target);
        imapMap = new ImapMapBuilder(settings.isSkipSizeCheck(), settings.isSkipUidlCache())
                .build(target, targetAttributes);
    }

    private void storeUidls() {
        for (ImapEntry entry : imapMap) {
            String uidl = entry.getPop3Uidl();
            if (uidl != null && !uidl.equals(entry.getCachedUidl())) {
                targetAttributes.putUidl(entry.getCacheKey(), uidl);
            }
        }
    }

    private void close(MessageSource legacy) {
        try {
            legacy.close();
        } catch (MessagingException e) {
            LOGGER.log(Level.WARNING, "pop3_migration: Failed to close " + legacy.getName(), e);
        }
    }
}
