package com.example.assoc.indexing;

import static org.junit.Assert.*;

import com.example.assoc.core.CacheConfigurationException;
import com.example.assoc.core.EntryHandle;
import java.util.List;
import org.junit.Test;

public class SetAssociativeTest {

    // 64 entries, 4 ways -> 16 sets; 4-byte entries -> setShift 2, tagShift 6
    private final SetAssociative indexing = new SetAssociative(64, 4, 4, 12);

    @Test
    public void splitsAddressIntoSetAndTag() {
        long address = 0x12345L;

        assertEquals((int) ((address >> 2) & 0xf), indexing.extractSet(address));
        assertEquals((address >> 6) & 0xfff, indexing.extractTag(address));
    }

    @Test
    public void tagIsTruncatedToConfiguredWidth() {
        long a = 0x1000L << 6;
        long b = 0x2000L << 6;

        assertEquals(0, indexing.extractTag(a));
        assertEquals(indexing.extractTag(a), indexing.extractTag(b));
    }

    @Test
    public void offsetBitsDoNotAffectIndexing() {
        assertEquals(indexing.extractSet(0x40L), indexing.extractSet(0x43L));
        assertEquals(indexing.extractTag(0x40L), indexing.extractTag(0x43L));
    }

    @Test
    public void candidatesAreTheWholeSetInWayOrder() {
        List<EntryHandle> candidates = indexing.getPossibleEntries(0x14L);

        assertEquals(4, candidates.size());
        for (int way = 0; way < 4; way++) {
            assertEquals(new EntryHandle(5, way), candidates.get(way));
        }
    }

    @Test
    public void regenerateAddrRebuildsAlignedAddress() {
        long address = 0xabcL << 6 | 7L << 2;
        long tag = indexing.extractTag(address);
        int set = indexing.extractSet(address);

        assertEquals(Long.valueOf(address), indexing.regenerateAddr(tag, new EntryHandle(set, 3)));
    }

    @Test
    public void fullWidthTagKeepsAllHighBits() {
        SetAssociative wide = new SetAssociative(2, 2, 1, 64);

        assertEquals(0, wide.extractSet(-1L));
        assertEquals(-1L, wide.extractTag(-1L));
    }

    @Test(expected = CacheConfigurationException.class)
    public void setCountMustBeAPowerOfTwo() {
        new SetAssociative(24, 2, 4, 16);
    }

    @Test(expected = CacheConfigurationException.class)
    public void entriesMustDivideIntoSets() {
        new SetAssociative(6, 4, 4, 16);
    }

    @Test(expected = CacheConfigurationException.class)
    public void entrySizeMustBeAPowerOfTwo() {
        new SetAssociative(16, 4, 3, 16);
    }

    @Test(expected = CacheConfigurationException.class)
    public void tagWidthMustBeInRange() {
        new SetAssociative(16, 4, 4, 65);
    }
}
