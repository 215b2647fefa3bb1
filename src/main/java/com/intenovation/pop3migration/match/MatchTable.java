package com.intenovation.pop3migration.match;

import com.intenovation.pop3migration.map.ImapEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POP3 identities of the messages of one IMAP mailbox, keyed by IMAP UID.
 * Built once per mailbox session and never changed afterwards.
 */
public final class MatchTable {

    /**
     * The POP3 identity of one IMAP message
     */
    public static final class Match {
        private final String uidl;
        private final int pop3Seq;

        public Match(String uidl, int pop3Seq) {
            this.uidl = uidl;
            this.pop3Seq = pop3Seq;
        }

        public String getUidl() {
            return uidl;
        }

        /**
         * Get the POP3 sequence number, 0 if the UIDL came from the
         * cache and the message is no longer on the POP3 server
         */
        public int getPop3Seq() {
            return pop3Seq;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Match)) {
                return false;
            }
            Match other = (Match) o;
            return pop3Seq == other.pop3Seq && uidl.equals(other.uidl);
        }

        @Override
        public int hashCode() {
            return 31 * uidl.hashCode() + pop3Seq;
        }

        @Override
        public String toString() {
            return pop3Seq + " " + uidl;
        }
    }

    private final Map<Long, Match> matches;

    private MatchTable(Map<Long, Match> matches) {
        this.matches = Collections.unmodifiableMap(matches);
    }

    /**
     * Collect the identities of every IMAP entry that has a UIDL
     */
    public static MatchTable from(List<ImapEntry> imapMap) {
        Map<Long, Match> matches = new LinkedHashMap<>();
        for (ImapEntry entry : imapMap) {
            if (entry.getPop3Uidl() != null) {
                matches.put(entry.getUid(), new Match(entry.getPop3Uidl(), entry.getPop3Seq()));
            }
        }
        return new MatchTable(matches);
    }

    /**
     * Get the POP3 identity of an IMAP message
     *
     * @return The match, or null if the message has none
     */
    public Match get(long uid) {
        return matches.get(uid);
    }

    /**
     * All matches in IMAP UID order
     */
    public Map<Long, Match> asMap() {
        return matches;
    }

    public int size() {
        return matches.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MatchTable && matches.equals(((MatchTable) o).matches);
    }

    @Override
    public int hashCode() {
        return matches.hashCode();
    }
}
