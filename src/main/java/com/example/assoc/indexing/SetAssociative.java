package com.example.assoc.indexing;

import com.example.assoc.core.EntryHandle;

/**
 * Direct-mapped-by-shift indexing for flat addresses.
 */
public class SetAssociative extends BaseSetAssociative<Long> {

    public SetAssociative(int numEntries, int associativity, int entrySize, int tagBits) {
        super(numEntries, associativity, entrySize, tagBits);
    }

    @Override
    public int extractSet(Long address) {
        return extractSetFromAddress(address);
    }

    @Override
    public long extractTag(Long address) {
        return extractTagFromAddress(address);
    }

    @Override
    public Long regenerateAddr(long tag, EntryHandle handle) {
        return regenerateAddress(tag, handle.getSet());
    }

    @Override
    public String toString() {
        return "SetAssociative{sets=" + numSets + ", ways=" + associativity
            + ", entrySize=" + entrySize + ", tagBits=" + tagBits + "}";
    }
}
