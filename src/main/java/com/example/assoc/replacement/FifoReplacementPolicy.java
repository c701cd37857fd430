package com.example.assoc.replacement;

import java.util.List;

public class FifoReplacementPolicy extends AbstractReplacementPolicy<FifoReplacementPolicy.FifoData> {

    static class FifoData implements ReplacementData {
        long insertedAt;

        @Override
        public String toString() {
            return "insertedAt=" + insertedAt;
        }
    }

    private long clock;

    public FifoReplacementPolicy() {
        super(FifoData.class);
    }

    @Override
    protected FifoData newData() {
        return new FifoData();
    }

    @Override
    protected void onTouch(FifoData data) {
        // hits do not change insertion order
    }

    @Override
    protected void onReset(FifoData data) {
        data.insertedAt = ++clock;
    }

    @Override
    protected void onInvalidate(FifoData data) {
        data.insertedAt = 0;
    }

    @Override
    protected ReplaceableEntry selectAmongValid(List<? extends ReplaceableEntry> candidates) {
        ReplaceableEntry victim = candidates.get(0);
        for (ReplaceableEntry candidate : candidates) {
            if (dataOf(candidate).insertedAt < dataOf(victim).insertedAt) {
                victim = candidate;
            }
        }
        return victim;
    }

    @Override
    public String name() {
        return "fifo";
    }
}
