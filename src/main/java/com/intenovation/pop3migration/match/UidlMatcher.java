package com.intenovation.pop3migration.match;

import com.intenovation.pop3migration.map.ImapEntry;
import com.intenovation.pop3migration.map.PopEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Pairs POP3 messages with IMAP messages.
 * <p>
 * The entry lists passed in stay in enumeration order (POP3 sequence, IMAP
 * UID); each phase sorts its own copy. Matching a pair removes both
 * entries from every later phase.
 */
public class UidlMatcher {
    private static final Logger LOGGER = Logger.getLogger(UidlMatcher.class.getName());

    private static final Comparator<PopEntry> POP_BY_UIDL = Comparator.comparing(PopEntry::getUidl);
    private static final Comparator<ImapEntry> IMAP_BY_UIDL =
            Comparator.comparing(ImapEntry::getPop3Uidl, Comparator.nullsLast(Comparator.naturalOrder()));
    private static final Comparator<PopEntry> POP_BY_DIGEST =
            Comparator.comparing(PopEntry::getHeaderDigest, Comparator.nullsLast(Comparator.naturalOrder()));
    private static final Comparator<ImapEntry> IMAP_BY_DIGEST =
            Comparator.comparing(ImapEntry::getHeaderDigest, Comparator.nullsLast(Comparator.naturalOrder()));

    private final boolean skipSizeCheck;

    public UidlMatcher(boolean skipSizeCheck) {
        this.skipSizeCheck = skipSizeCheck;
    }

    /**
     * Match IMAP messages carrying a UIDL cached by an earlier session
     * against the POP3 UIDLs.
     *
     * @return The number of pairs matched
     */
    public int assignCached(List<PopEntry> pop3Map, List<ImapEntry> imapMap) {
        List<PopEntry> pops = new ArrayList<>(pop3Map);
        List<ImapEntry> imaps = new ArrayList<>(imapMap);
        pops.sort(POP_BY_UIDL);
        imaps.sort(IMAP_BY_UIDL);

        int matches = 0;
        int popIdx = 0;
        int imapIdx = 0;
        while (popIdx < pops.size() && imapIdx < imaps.size()) {
            ImapEntry imap = imaps.get(imapIdx);
            if (imap.getPop3Uidl() == null) {
                // nulls sort last, nothing cached from here on
                break;
            }
            PopEntry pop = pops.get(popIdx);
            if (pop.isMatched()) {
                popIdx++;
                continue;
            }
            int cmp = imap.getPop3Uidl().compareTo(pop.getUidl());
            if (cmp > 0) {
                popIdx++;
            } else if (cmp < 0) {
                imapIdx++;
            } else {
                assign(pop, imap);
                matches++;
                popIdx++;
                imapIdx++;
            }
        }
        dropDuplicateCachedUidls(imaps);
        return matches;
    }

    /**
     * A UIDL cached for several IMAP messages can belong to one of them at
     * most. The ones that didn't get it from the POP3 join lose it.
     *
     * @param imaps The IMAP entries sorted by UIDL, nulls last
     */
    private static void dropDuplicateCachedUidls(List<ImapEntry> imaps) {
        int start = 0;
        while (start < imaps.size() && imaps.get(start).getPop3Uidl() != null) {
            String uidl = imaps.get(start).getPop3Uidl();
            int end = start + 1;
            while (end < imaps.size() && uidl.equals(imaps.get(end).getPop3Uidl())) {
                end++;
            }
            if (end - start > 1) {
                LOGGER.warning("pop3_migration: UIDL " + uidl + " is cached for " + (end - start) +
                        " IMAP messages, ignoring the unmatched ones");
                for (int i = start; i < end; i++) {
                    imaps.get(i).dropCachedUidl();
                }
            }
            start = end;
        }
    }

    /**
     * Walk both mailboxes in enumeration order and pair messages at the
     * same position while their sizes agree. The walk stops at the first
     * position where a cached UIDL disagrees, the sizes differ, or the
     * POP3 size repeats at the next position; nothing past that point is
     * guessed.
     */
    public SizeMatchResult assignBySize(List<PopEntry> pop3Map, List<ImapEntry> imapMap) {
        int count = Math.min(pop3Map.size(), imapMap.size());
        int uidlMatches = 0;
        int sizeMatches = 0;

        int i;
        for (i = 0; i < count; i++) {
            PopEntry pop = pop3Map.get(i);
            ImapEntry imap = imapMap.get(i);
            if (imap.getPop3Uidl() != null) {
                if (imap.getPop3Uidl().equals(pop.getUidl())) {
                    uidlMatches++;
                    continue;
                }
                // cached UIDL disagrees with the position, sizes can't be trusted
                break;
            }

            if (pop.isMatched()) {
                // taken by a cached UIDL elsewhere, positions have diverged
                break;
            }
            if (skipSizeCheck || pop.getSize() != imap.getPhysicalSize()) {
                break;
            }
            if (i + 1 < count && pop.getSize() == pop3Map.get(i + 1).getSize()) {
                // two messages with the same size
                break;
            }
            assign(pop, imap);
            sizeMatches++;
        }

        LOGGER.fine("pop3_migration: cached uidls=" + uidlMatches + ", size matches=" + sizeMatches +
                ", total=" + count);
        boolean complete = i == count && pop3Map.size() == imapMap.size();
        return new SizeMatchResult(i, complete, uidlMatches, sizeMatches);
    }

    /**
     * Pair the still unmatched messages whose header digests are equal.
     * Entries without a digest are skipped.
     *
     * @return What was left unmatched on the POP3 side
     */
    public MatchReport assignByDigest(List<PopEntry> pop3Map, List<ImapEntry> imapMap) {
        List<PopEntry> pops = new ArrayList<>(pop3Map);
        List<ImapEntry> imaps = new ArrayList<>(imapMap);
        pops.sort(POP_BY_DIGEST);
        imaps.sort(IMAP_BY_DIGEST);

        int matches = 0;
        int popIdx = 0;
        int imapIdx = 0;
        while (popIdx < pops.size() && imapIdx < imaps.size()) {
            PopEntry pop = pops.get(popIdx);
            if (!pop.isDigestSet() || pop.isMatched()) {
                popIdx++;
                continue;
            }
            ImapEntry imap = imaps.get(imapIdx);
            if (!imap.isDigestSet() || imap.isMatched()) {
                imapIdx++;
                continue;
            }
            int cmp = pop.getHeaderDigest().compareTo(imap.getHeaderDigest());
            if (cmp < 0) {
                popIdx++;
            } else if (cmp > 0) {
                imapIdx++;
            } else {
                assign(pop, imap);
                matches++;
            }
        }

        int missing = 0;
        PopEntry firstMissing = null;
        for (PopEntry pop : pop3Map) {
            if (pop.isMatched() || !pop.isDigestSet()) {
                // matched, or expunged before it could be hashed
                continue;
            }
            if (firstMissing == null || pop.getPopSeq() < firstMissing.getPopSeq()) {
                firstMissing = pop;
            }
            missing++;
        }
        return new MatchReport(pop3Map.size(), imapMap.size(), matches, missing, firstMissing);
    }

    private static void assign(PopEntry pop, ImapEntry imap) {
        pop.setImapUid(imap.getUid());
        imap.assign(pop);
    }
}
