package com.intenovation.pop3migration.hash;

import com.intenovation.pop3migration.Pop3MigrationException;
import com.intenovation.pop3migration.map.MessageMapEntry;
import com.intenovation.pop3migration.store.AttributeCacheAdapter;
import com.intenovation.pop3migration.store.MessageInfo;
import com.intenovation.pop3migration.store.MessageSource;

import javax.mail.MessageRemovedException;
import javax.mail.MessagingException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fills in the header digests of the messages of one mailbox, using the
 * attribute cache where possible.
 */
public class HeaderHasher {
    private static final Logger LOGGER = Logger.getLogger(HeaderHasher.class.getName());

    private final MessageSource source;
    private final AttributeCacheAdapter cache;
    private int computedCount;

    public HeaderHasher(MessageSource source, AttributeCacheAdapter cache) {
        this.source = source;
        this.cache = cache;
    }

    /**
     * Get the number of digests computed from fetched messages so far
     */
    public int getComputedCount() {
        return computedCount;
    }

    /**
     * Set the digest of every entry from {@code fromIndex} on.
     * <p>
     * Cached digests are picked up for the whole range first, so only the
     * messages that were never hashed are fetched. Entries whose message was
     * expunged meanwhile are left without a digest.
     *
     * @param entries       The entries of this mailbox
     * @param fromIndex     Index of the first entry to hash
     * @param skipMatched   true to leave already matched entries alone
     * @throws Pop3MigrationException If a message couldn't be fetched or read
     */
    public void hashRange(List<? extends MessageMapEntry> entries, int fromIndex, boolean skipMatched)
            throws Pop3MigrationException {
        int cached = 0;
        for (int i = fromIndex; i < entries.size(); i++) {
            MessageMapEntry entry = entries.get(i);
            if (entry.isDigestSet() || (skipMatched && entry.isMatched())) {
                continue;
            }
            HeaderDigest digest = cache.getDigest(entry.getCacheKey());
            if (digest != null) {
                entry.setHeaderDigest(digest);
                cached++;
            }
        }

        int fetched = 0;
        for (int i = fromIndex; i < entries.size(); i++) {
            MessageMapEntry entry = entries.get(i);
            if (entry.isDigestSet() || (skipMatched && entry.isMatched())) {
                continue;
            }
            if (hash(entry)) {
                fetched++;
            }
        }
        LOGGER.fine("pop3_migration: " + source.getName() + ": " + cached + " cached header hashes, " +
                fetched + " fetched");
    }

    /**
     * Fetch the header of one message and compute its digest. If the header
     * has no end-of-headers line the full message is fetched and hashed
     * instead, since some servers cut BODY[HEADER] short where POP3 TOP
     * doesn't.
     *
     * @return false if the message has been expunged and has no digest
     * @throws Pop3MigrationException If fetching or reading failed
     */
    public boolean hash(MessageMapEntry entry) throws Pop3MigrationException {
        MessageInfo message = entry.getMessage();
        HeaderHashResult result;
        try {
            result = digest(source.fetchHeader(message), message);
        } catch (MessageRemovedException e) {
            LOGGER.warning("pop3_migration: Failed to get header for msg " + message.getSequence() +
                    " in " + source.getName() + ": expunged");
            return false;
        } catch (MessagingException e) {
            throw fetchFailure("header", message, e);
        }

        if (!result.hasEndOfHeaders()) {
            try {
                result = digest(source.fetchFullMessage(message), message);
            } catch (MessageRemovedException e) {
                LOGGER.warning("pop3_migration: Failed to get body for msg " + message.getSequence() +
                        " in " + source.getName() + ": expunged");
                return false;
            } catch (MessagingException e) {
                throw fetchFailure("body", message, e);
            }
            if (!result.hasEndOfHeaders()) {
                LOGGER.warning("pop3_migration: Truncated email " + entry.getCacheKey() + " in " +
                        source.getName() + " stored as truncated");
            }
        }

        entry.setHeaderDigest(result.getDigest());
        cache.putDigest(entry.getCacheKey(), result.getDigest());
        computedCount++;
        return true;
    }

    private HeaderHashResult digest(InputStream input, MessageInfo message) throws MessagingException {
        try (InputStream in = input) {
            return HeaderCanonicalizer.digest(in);
        } catch (IOException e) {
            throw new MessagingException("Failed to read header for msg " + message.getSequence(), e);
        }
    }

    private Pop3MigrationException fetchFailure(String what, MessageInfo message, MessagingException e) {
        String text = "pop3_migration: Failed to get " + what + " for msg " + message.getSequence() +
                " in " + source.getName() + ": " + e.getMessage();
        LOGGER.log(Level.SEVERE, text, e);
        return new Pop3MigrationException(Pop3MigrationException.Kind.IO_FAILURE, text, e);
    }
}
