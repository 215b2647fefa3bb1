package com.intenovation.pop3migration;

import com.intenovation.pop3migration.hash.HeaderHasher;
import com.intenovation.pop3migration.map.Pop3MapBuilder;
import com.intenovation.pop3migration.map.PopEntry;
import com.intenovation.pop3migration.match.PolicyGate;
import com.intenovation.pop3migration.match.UidlMatcher;
import com.intenovation.pop3migration.store.AttributeCache;
import com.intenovation.pop3migration.store.AttributeCacheAdapter;
import com.intenovation.pop3migration.store.LegacyMailboxResolver;
import com.intenovation.pop3migration.store.MessageSource;

import javax.mail.MessagingException;
import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State shared by all mailboxes of one user session: the settings, the
 * POP3 message map and whether every POP3 header was hashed already.
 * <p>
 * The legacy mailbox is assumed not to change during the session, so its
 * listing is read once and only the match annotations are reset when
 * another mailbox is synced.
 */
public class Pop3MigrationContext {
    private static final Logger LOGGER = Logger.getLogger(Pop3MigrationContext.class.getName());

    private final Pop3MigrationSettings settings;
    private final LegacyMailboxResolver legacyResolver;
    private final AttributeCache attributeCache;
    private final UidlMatcher matcher;
    private final PolicyGate policyGate;

    private List<PopEntry> pop3Map;
    private boolean allLegacyDigestsSet = false;

    public Pop3MigrationContext(Pop3MigrationSettings settings, LegacyMailboxResolver legacyResolver,
                                AttributeCache attributeCache) {
        this.settings = settings;
        this.legacyResolver = legacyResolver;
        this.attributeCache = attributeCache;
        this.matcher = new UidlMatcher(settings.isSkipSizeCheck());
        this.policyGate = new PolicyGate(settings);
    }

    public Pop3MigrationSettings getSettings() {
        return settings;
    }

    public AttributeCache getAttributeCache() {
        return attributeCache;
    }

    UidlMatcher getMatcher() {
        return matcher;
    }

    PolicyGate getPolicyGate() {
        return policyGate;
    }

    /**
     * Get the POP3 map read so far, null before the first sync
     */
    public List<PopEntry> getPop3Map() {
        return pop3Map;
    }

    /**
     * Whether the digest of every POP3 message has been computed
     */
    public boolean isAllLegacyDigestsSet() {
        return allLegacyDigestsSet;
    }

    /**
     * Create the attribute cache view of a mailbox. Mailboxes with a
     * UIDVALIDITY get one namespace per value, so a recreated mailbox
     * never sees the attributes of its predecessor's UIDs.
     *
     * @throws Pop3MigrationException If the UIDVALIDITY couldn't be read
     */
    public AttributeCacheAdapter attributesOf(MessageSource mailbox) throws Pop3MigrationException {
        long uidValidity;
        try {
            uidValidity = mailbox.getUidValidity();
        } catch (MessagingException e) {
            String text = "pop3_migration: Failed to get UIDVALIDITY of " + mailbox.getName() +
                    ": " + e.getMessage();
            LOGGER.log(Level.SEVERE, text, e);
            throw new Pop3MigrationException(Pop3MigrationException.Kind.IO_FAILURE, text, e);
        }
        return new AttributeCacheAdapter(attributeCache, cacheNamespace(mailbox.getName(), uidValidity));
    }

    /**
     * Get the attribute cache namespace of a mailbox, e.g. {@code imap/INBOX;1234}
     */
    public static String cacheNamespace(String mailboxName, long uidValidity) {
        return uidValidity == 0 ? mailboxName : mailboxName + ";" + uidValidity;
    }

    /**
     * Write out the attributes cached during a sync
     */
    void flushAttributes() {
        try {
            attributeCache.flush();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "pop3_migration: Failed to write the attribute cache", e);
        }
    }

    /**
     * Look up the configured legacy mailbox
     *
     * @throws Pop3MigrationException If it can't be found or opened
     */
    MessageSource openLegacyMailbox() throws Pop3MigrationException {
        try {
            return legacyResolver.resolve(settings.getMailbox());
        } catch (MessagingException e) {
            String text = "pop3_migration: Couldn't open POP3 mailbox " + settings.getMailbox() +
                    ": " + e.getMessage();
            LOGGER.log(Level.SEVERE, text, e);
            throw new Pop3MigrationException(Pop3MigrationException.Kind.IO_FAILURE, text, e);
        }
    }

    /**
     * Get the POP3 map, reading it on first use. Later calls only clear
     * the IMAP UIDs assigned by the previous mailbox's sync.
     */
    List<PopEntry> readPop3Map(MessageSource legacy) throws Pop3MigrationException {
        if (pop3Map != null) {
            for (PopEntry entry : pop3Map) {
                entry.setImapUid(0);
            }
            return pop3Map;
        }
        pop3Map = new Pop3MapBuilder(settings.isSkipSizeCheck()).build(legacy);
        return pop3Map;
    }

    /**
     * Compute the POP3 header digests from {@code firstIndex} on. With
     * all_mailboxes every digest is computed, once per session, since
     * several mailboxes get matched against the same POP3 messages.
     */
    void readLegacyDigests(MessageSource legacy, int firstIndex) throws Pop3MigrationException {
        if (allLegacyDigestsSet) {
            return;
        }
        int from = settings.isAllMailboxes() ? 0 : firstIndex;
        new HeaderHasher(legacy, attributesOf(legacy)).hashRange(pop3Map, from, false);
        if (from == 0) {
            allLegacyDigestsSet = true;
        }
    }

    /**
     * Create the UIDL sync of one IMAP mailbox
     */
    public MailboxUidlSync createMailboxSync(MessageSource target) {
        return new MailboxUidlSync(this, target);
    }

    /**
     * Put the migration layer in front of a mailbox's own identity field
     * resolver. The inner resolver is returned unchanged when the layer is
     * disabled, when the mailbox isn't INBOX and all_mailboxes isn't set, or
     * when the mailbox belongs to the legacy namespace itself.
     *
     * @param inner  The mailbox's own resolver
     * @param target The mailbox
     * @param inbox  Whether the mailbox is the user's INBOX
     * @return The resolver to use for the mailbox
     */
    public IdentityFieldResolver wrap(IdentityFieldResolver inner, MessageSource target, boolean inbox) {
        if (!settings.isEnabled()) {
            LOGGER.fine("pop3_migration: No pop3 migration mailbox setting - disabled");
            return inner;
        }
        if (!settings.isAllMailboxes() && !inbox) {
            return inner;
        }
        if (legacyResolver.isLegacyMailbox(target.getName())) {
            return inner;
        }
        return new Pop3MigrationIdentityResolver(inner, createMailboxSync(target));
    }
}
