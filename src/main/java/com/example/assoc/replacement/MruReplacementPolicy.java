package com.example.assoc.replacement;

import java.util.List;

/**
 * Evicts the most recently used valid entry. Useful for cyclic access
 * patterns slightly larger than a set, where LRU always evicts the entry
 * needed next.
 */
public class MruReplacementPolicy extends AbstractReplacementPolicy<MruReplacementPolicy.MruData> {

    static class MruData implements ReplacementData {
        long lastTouch;

        @Override
        public String toString() {
            return "lastTouch=" + lastTouch;
        }
    }

    private long clock;

    public MruReplacementPolicy() {
        super(MruData.class);
    }

    @Override
    protected MruData newData() {
        return new MruData();
    }

    @Override
    protected void onTouch(MruData data) {
        data.lastTouch = ++clock;
    }

    @Override
    protected void onReset(MruData data) {
        data.lastTouch = ++clock;
    }

    @Override
    protected void onInvalidate(MruData data) {
        data.lastTouch = 0;
    }

    @Override
    protected ReplaceableEntry selectAmongValid(List<? extends ReplaceableEntry> candidates) {
        ReplaceableEntry victim = candidates.get(0);
        for (ReplaceableEntry candidate : candidates) {
            if (dataOf(candidate).lastTouch > dataOf(victim).lastTouch) {
                victim = candidate;
            }
        }
        return victim;
    }

    @Override
    public String name() {
        return "mru";
    }
}
