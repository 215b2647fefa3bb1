package com.intenovation.pop3migration.match;

import com.intenovation.pop3migration.map.PopEntry;

/**
 * What the header digest match left unresolved
 */
public final class MatchReport {
    private final int popCount;
    private final int imapCount;
    private final int digestMatches;
    private final int missingCount;
    private final PopEntry firstMissing;

    MatchReport(int popCount, int imapCount, int digestMatches, int missingCount, PopEntry firstMissing) {
        this.popCount = popCount;
        this.imapCount = imapCount;
        this.digestMatches = digestMatches;
        this.missingCount = missingCount;
        this.firstMissing = firstMissing;
    }

    public int getPopCount() {
        return popCount;
    }

    public int getImapCount() {
        return imapCount;
    }

    /**
     * Pairs matched by header digest in this pass
     */
    public int getDigestMatches() {
        return digestMatches;
    }

    /**
     * POP3 messages that have a digest but no IMAP match.
     * Expunged POP3 messages aren't counted.
     */
    public int getMissingCount() {
        return missingCount;
    }

    /**
     * The missing POP3 message with the lowest sequence, null if none is missing
     */
    public PopEntry getFirstMissing() {
        return firstMissing;
    }

    /**
     * Whether the IMAP messages plus the missing POP3 messages add up to
     * the POP3 mailbox, i.e. POP3 holds every IMAP message and then some
     */
    public boolean isAllImapMessagesFound() {
        return imapCount + missingCount == popCount;
    }

    /**
     * Number of messages by which the IMAP side plus the missing POP3
     * messages exceed the POP3 mailbox
     */
    public int getExtraCount() {
        return Math.max(0, imapCount + missingCount - popCount);
    }
}
