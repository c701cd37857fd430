package com.example.assoc.replacement;

import java.util.List;

/**
 * Second chance (clock-style) replacement.
 *
 * Entries are ranked in insertion order like FIFO, but a hit only sets a
 * referenced bit instead of moving anything. When a victim is needed the
 * oldest entry is inspected: if it was referenced, the bit is cleared and the
 * entry is re-queued behind the others; otherwise it is evicted. Entries that
 * are only streamed through once never get their bit set and leave first,
 * which makes the policy resistant to scans.
 */
public class SecondChanceReplacementPolicy
    extends AbstractReplacementPolicy<SecondChanceReplacementPolicy.SecondChanceData> {

    static class SecondChanceData implements ReplacementData {
        long queuedAt;
        boolean referenced;

        @Override
        public String toString() {
            return "queuedAt=" + queuedAt + " referenced=" + referenced;
        }
    }

    private long clock;

    public SecondChanceReplacementPolicy() {
        super(SecondChanceData.class);
    }

    @Override
    protected SecondChanceData newData() {
        return new SecondChanceData();
    }

    @Override
    protected void onTouch(SecondChanceData data) {
        data.referenced = true;
    }

    @Override
    protected void onReset(SecondChanceData data) {
        // inserted unreferenced, a single use does not earn a second chance
        data.queuedAt = ++clock;
        data.referenced = false;
    }

    @Override
    protected void onInvalidate(SecondChanceData data) {
        data.queuedAt = 0;
        data.referenced = false;
    }

    @Override
    protected ReplaceableEntry selectAmongValid(List<? extends ReplaceableEntry> candidates) {
        // Each pass either returns or clears one bit, so this ends within 2 * candidates passes
        while (true) {
            ReplaceableEntry oldest = candidates.get(0);
            for (ReplaceableEntry candidate : candidates) {
                if (dataOf(candidate).queuedAt < dataOf(oldest).queuedAt) {
                    oldest = candidate;
                }
            }

            SecondChanceData data = dataOf(oldest);
            if (!data.referenced) {
                return oldest;
            }
            data.referenced = false;
            data.queuedAt = ++clock;
        }
    }

    @Override
    public String name() {
        return "second-chance";
    }
}
