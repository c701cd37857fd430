package com.example.assoc.indexing;

import com.example.assoc.core.CacheConfigurationException;
import com.example.assoc.core.EntryHandle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shift-and-mask geometry shared by the set-associative indexing policies.
 *
 * An address is split as {@code | tag | set | offset |}: the offset covers
 * one entry's granularity, the set field selects one of the power-of-two
 * sets and the tag is whatever is left above, truncated to the configured
 * tag width.
 */
public abstract class BaseSetAssociative<K> implements IndexingPolicy<K> {

    protected final int numEntries;
    protected final int associativity;
    protected final int numSets;
    protected final int entrySize;
    protected final int tagBits;

    protected final int setShift;
    protected final long setMask;
    protected final int tagShift;
    protected final long tagMask;

    // Handles are immutable, so every lookup can share the same per-set list
    private final List<List<EntryHandle>> sets;

    protected BaseSetAssociative(int numEntries, int associativity, int entrySize, int tagBits) {
        if (numEntries <= 0) {
            throw new CacheConfigurationException("Number of entries must be positive: " + numEntries);
        }
        if (associativity <= 0) {
            throw new CacheConfigurationException("Associativity must be positive: " + associativity);
        }
        if (numEntries % associativity != 0) {
            throw new CacheConfigurationException(
                "Number of entries (" + numEntries + ") is not a multiple of the associativity (" + associativity + ")");
        }
        if (!isPowerOf2(entrySize)) {
            throw new CacheConfigurationException("Entry size must be a power of 2: " + entrySize);
        }
        if (tagBits < 1 || tagBits > 64) {
            throw new CacheConfigurationException("Tag width must be between 1 and 64 bits: " + tagBits);
        }
        int sets = numEntries / associativity;
        if (!isPowerOf2(sets)) {
            throw new CacheConfigurationException("Number of sets must be a power of 2: " + sets);
        }

        this.numEntries = numEntries;
        this.associativity = associativity;
        this.numSets = sets;
        this.entrySize = entrySize;
        this.tagBits = tagBits;

        this.setShift = log2(entrySize);
        this.setMask = sets - 1;
        this.tagShift = setShift + log2(sets);
        this.tagMask = tagBits == 64 ? -1L : (1L << tagBits) - 1;

        this.sets = new ArrayList<>(sets);
        for (int set = 0; set < sets; set++) {
            List<EntryHandle> ways = new ArrayList<>(associativity);
            for (int way = 0; way < associativity; way++) {
                ways.add(new EntryHandle(set, way));
            }
            this.sets.add(Collections.unmodifiableList(ways));
        }
    }

    @Override
    public int getNumSets() {
        return numSets;
    }

    @Override
    public int getAssociativity() {
        return associativity;
    }

    public int getNumEntries() {
        return numEntries;
    }

    public int getEntrySize() {
        return entrySize;
    }

    public int getTagBits() {
        return tagBits;
    }

    @Override
    public List<EntryHandle> getPossibleEntries(K key) {
        return sets.get(extractSet(key));
    }

    protected int extractSetFromAddress(long address) {
        return (int) ((address >>> setShift) & setMask);
    }

    protected long extractTagFromAddress(long address) {
        if (tagShift >= 64) {
            return 0;
        }
        return (address >>> tagShift) & tagMask;
    }

    protected long regenerateAddress(long tag, int set) {
        if (set < 0 || set >= numSets) {
            throw new IllegalArgumentException("Set " + set + " out of range [0, " + numSets + ")");
        }
        long high = tagShift >= 64 ? 0 : (tag & tagMask) << tagShift;
        return high | ((long) set << setShift);
    }

    static boolean isPowerOf2(long n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    static int log2(long powerOf2) {
        return Long.numberOfTrailingZeros(powerOf2);
    }
}
