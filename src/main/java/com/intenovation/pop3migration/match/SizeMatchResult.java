package com.intenovation.pop3migration.match;

/**
 * Outcome of the positional size match
 */
public final class SizeMatchResult {
    private final int firstUnfoundIndex;
    private final boolean complete;
    private final int uidlMatches;
    private final int sizeMatches;

    SizeMatchResult(int firstUnfoundIndex, boolean complete, int uidlMatches, int sizeMatches) {
        this.firstUnfoundIndex = firstUnfoundIndex;
        this.complete = complete;
        this.uidlMatches = uidlMatches;
        this.sizeMatches = sizeMatches;
    }

    /**
     * Index of the first position where the walk stopped. Every entry
     * before it on both sides is matched.
     */
    public int getFirstUnfoundIndex() {
        return firstUnfoundIndex;
    }

    /**
     * Whether every message on both sides was matched
     */
    public boolean isComplete() {
        return complete;
    }

    /**
     * Positions confirmed by a UIDL cached in an earlier session
     */
    public int getUidlMatches() {
        return uidlMatches;
    }

    /**
     * Positions matched by size alone
     */
    public int getSizeMatches() {
        return sizeMatches;
    }
}
