package com.example.assoc.replacement;

import java.util.List;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Picks a uniformly random valid entry. Seeded, so a given access sequence
 * always produces the same victims.
 */
public class RandomReplacementPolicy extends AbstractReplacementPolicy<RandomReplacementPolicy.RandomData> {

    static class RandomData implements ReplacementData {
        // Random ranking keeps no history; the flag only feeds the dump
        boolean filled;

        @Override
        public String toString() {
            return filled ? "filled" : "empty";
        }
    }

    private final RandomGenerator random;

    public RandomReplacementPolicy(long seed) {
        this(new Well19937c(seed));
    }

    public RandomReplacementPolicy(RandomGenerator random) {
        super(RandomData.class);
        this.random = random;
    }

    @Override
    protected RandomData newData() {
        return new RandomData();
    }

    @Override
    protected void onTouch(RandomData data) {
        // no-op
    }

    @Override
    protected void onReset(RandomData data) {
        data.filled = true;
    }

    @Override
    protected void onInvalidate(RandomData data) {
        data.filled = false;
    }

    @Override
    protected ReplaceableEntry selectAmongValid(List<? extends ReplaceableEntry> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }

    @Override
    public String name() {
        return "random";
    }
}
