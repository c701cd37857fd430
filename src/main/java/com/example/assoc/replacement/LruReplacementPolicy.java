package com.example.assoc.replacement;

import java.util.List;

public class LruReplacementPolicy extends AbstractReplacementPolicy<LruReplacementPolicy.LruData> {

    static class LruData implements ReplacementData {
        // 0 means never touched, which is also what invalidation restores
        long lastTouch;

        @Override
        public String toString() {
            return "lastTouch=" + lastTouch;
        }
    }

    // Stands in for simulated time; only relative order matters
    private long clock;

    public LruReplacementPolicy() {
        super(LruData.class);
    }

    @Override
    protected LruData newData() {
        return new LruData();
    }

    @Override
    protected void onTouch(LruData data) {
        data.lastTouch = ++clock;
    }

    @Override
    protected void onReset(LruData data) {
        data.lastTouch = ++clock;
    }

    @Override
    protected void onInvalidate(LruData data) {
        data.lastTouch = 0;
    }

    @Override
    protected ReplaceableEntry selectAmongValid(List<? extends ReplaceableEntry> candidates) {
        ReplaceableEntry victim = candidates.get(0);
        for (ReplaceableEntry candidate : candidates) {
            if (dataOf(candidate).lastTouch < dataOf(victim).lastTouch) {
                victim = candidate;
            }
        }
        return victim;
    }

    @Override
    public String name() {
        return "lru";
    }
}
