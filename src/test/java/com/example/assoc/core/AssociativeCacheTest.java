package com.example.assoc.core;

import static org.junit.Assert.*;

import com.example.assoc.indexing.SetAssociative;
import com.example.assoc.replacement.LruReplacementPolicy;
import com.example.assoc.replacement.ReplacementPolicies;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.junit.Before;
import org.junit.Test;

/**
 * 8 entries, 2 ways, 4 sets, byte granularity: set = address & 3, tag = address >> 2.
 */
public class AssociativeCacheTest {

    private AssociativeCache<Long, String> cache;

    @Before
    public void setUp() {
        cache = newCache(8, 2);
    }

    private static AssociativeCache<Long, String> newCache(int entries, int ways) {
        return new AssociativeCache<>("test", entries, ways, new LruReplacementPolicy(),
            new SetAssociative(entries, ways, 1, 64));
    }

    @Test
    public void insertedEntryIsFoundWithPayloadAndTag() {
        cache.insert(13L, "thirteen");

        Optional<CacheEntry<String>> entry = cache.lookup(13L);
        assertTrue(entry.isPresent());
        assertEquals("thirteen", entry.get().getPayload());
        assertEquals(cache.getTag(13L), entry.get().getTag());
        assertEquals(3L, entry.get().getTag());
        assertEquals(1, entry.get().getHandle().getSet());
        assertTrue(cache.isEntryValid(13L));
    }

    @Test
    public void lookupOfMissingKeyIsEmpty() {
        assertFalse(cache.lookup(7L).isPresent());
        assertFalse(cache.access(7L).isPresent());
        assertFalse(cache.isEntryValid(7L));
    }

    @Test
    public void thirdTagInFullSetEvictsOneOfTheFirstTwo() {
        // 1, 5 and 9 all map to set 1 with tags 0, 1 and 2
        cache.insert(1L, "a");
        cache.insert(5L, "b");
        cache.insert(9L, "c");

        assertTrue(cache.isEntryValid(9L));
        assertFalse("least recently used tag is evicted", cache.isEntryValid(1L));
        assertTrue(cache.isEntryValid(5L));
        assertEquals(3, cache.validEntryCount());
    }

    @Test
    public void accessProtectsEntryButLookupDoesNot() {
        cache.insert(1L, "a");
        cache.insert(5L, "b");
        cache.access(1L);
        cache.insert(9L, "c");
        assertTrue(cache.isEntryValid(1L));
        assertFalse(cache.isEntryValid(5L));

        AssociativeCache<Long, String> other = newCache(8, 2);
        other.insert(1L, "a");
        other.insert(5L, "b");
        other.lookup(1L);
        other.insert(9L, "c");
        assertFalse(other.isEntryValid(1L));
        assertTrue(other.isEntryValid(5L));
    }

    @Test
    public void victimAlwaysComesFromTheKeysSet() {
        for (long address = 0; address < 8; address++) {
            cache.insert(address, "v" + address);
        }
        for (long address = 8; address < 64; address++) {
            CacheEntry<String> victim = cache.findVictim(address);
            assertEquals(cache.getSetIndex(address), victim.getHandle().getSet());
            cache.insertEntry(address, victim, "v" + address);
        }
    }

    @Test
    public void findVictimInvalidatesBeforeTheFill() {
        cache.insert(1L, "a");
        cache.insert(5L, "b");

        CacheEntry<String> victim = cache.findVictim(9L);
        assertFalse(victim.isValid());
        assertEquals(1, cache.validEntryCount());
        assertFalse(cache.isEntryValid(1L));

        // abandoning the reservation leaves the entry empty, it is reused first
        CacheEntry<String> next = cache.findVictim(13L);
        assertSame(victim, next);
    }

    @Test
    public void findVictimReusesTheEntryAlreadyHoldingTheKey() {
        cache.insert(1L, "a");
        cache.insert(5L, "b");
        CacheEntry<String> existing = cache.lookup(5L).get();

        CacheEntry<String> victim = cache.findVictim(5L);
        assertSame(existing, victim);
        cache.insertEntry(5L, victim, "b2");

        assertTrue(cache.isEntryValid(1L));
        assertEquals("b2", cache.lookup(5L).get().getPayload());
    }

    @Test
    public void insertEntryRemovesOtherCopiesOfTheKey() {
        CacheEntry<String> first = cache.insert(1L, "a");
        CacheEntry<String> other = cache.getEntry(new EntryHandle(1, first.getHandle().getWay() == 0 ? 1 : 0));

        cache.insertEntry(1L, other, "again");

        assertFalse(first.isValid());
        assertEquals(1, cache.validEntryCount());
        assertEquals("again", cache.lookup(1L).get().getPayload());
    }

    @Test(expected = IllegalArgumentException.class)
    public void insertEntryRejectsVictimFromAnotherSet() {
        CacheEntry<String> victim = cache.findVictim(0L);
        cache.insertEntry(1L, victim, "wrong set");
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidateRejectsForeignEntry() {
        AssociativeCache<Long, String> other = newCache(8, 2);
        cache.invalidate(other.insert(1L, "a"));
    }

    @Test
    public void invalidateDropsTheEntry() {
        CacheEntry<String> entry = cache.insert(2L, "x");
        cache.insert(6L, "y");
        cache.invalidate(entry);

        assertFalse(entry.isValid());
        assertFalse(cache.isEntryValid(2L));
        assertTrue(cache.isEntryValid(6L));
        // the invalidated way is the next victim of its set
        assertSame(entry, cache.findVictim(10L));
        assertTrue(cache.isEntryValid(6L));
    }

    @Test
    public void clearIsIdempotent() {
        for (long address = 0; address < 16; address++) {
            cache.insert(address, "v");
        }
        cache.clear();
        cache.clear();

        assertEquals(0, cache.validEntryCount());
        for (long address = 0; address < 16; address++) {
            assertFalse(cache.isEntryValid(address));
        }
    }

    @Test
    public void randomOperationsNeverDuplicateATagInASet() {
        for (String policy : ReplacementPolicies.NAMES) {
            AssociativeCache<Long, String> subject = new AssociativeCache<>(policy, 8, 2,
                ReplacementPolicies.create(policy), new SetAssociative(8, 2, 1, 64));
            Random random = new Random(7);
            for (int i = 0; i < 5_000; i++) {
                long address = random.nextInt(40);
                switch (random.nextInt(5)) {
                    case 0:
                        subject.insert(address, "v" + i);
                        break;
                    case 1:
                        subject.access(address);
                        break;
                    case 2:
                        subject.lookup(address).ifPresent(subject::invalidate);
                        break;
                    case 3:
                        subject.findVictim(address);
                        break;
                    default:
                        if (random.nextInt(100) == 0) {
                            subject.clear();
                        } else {
                            subject.insertEntry(address, subject.findVictim(address), "w" + i);
                        }
                }
                assertNoDuplicateTags(subject);
            }
        }
    }

    @Test(expected = IllegalStateException.class)
    public void validEntryCannotBeFilledAgain() {
        CacheEntry<String> entry = cache.insert(5L, "five");

        entry.insert(9L, "nine");
    }

    @Test
    public void capacityNotMultipleOfAssociativityIsRejected() {
        try {
            new AssociativeCache<Long, String>("bad", 6, 4, new LruReplacementPolicy(),
                new SetAssociative(8, 4, 1, 64));
            fail("6 entries cannot be split into 4-way sets");
        } catch (CacheConfigurationException e) {
            assertTrue(e.getMessage().contains("not a multiple"));
        }
    }

    @Test(expected = CacheConfigurationException.class)
    public void indexingGeometryMustMatchTheCache() {
        new AssociativeCache<Long, String>("bad", 16, 4, new LruReplacementPolicy(),
            new SetAssociative(16, 2, 1, 64));
    }

    @Test
    public void regenerateKeyInvertsTheIndexing() {
        CacheEntry<String> entry = cache.insert(0x2aL, "x");
        assertEquals(Long.valueOf(0x2aL), cache.regenerateKey(entry));
    }

    @Test
    public void dumpHasOneLinePerEntry() {
        cache.insert(5L, "five");
        List<String> lines = cache.dump();

        assertEquals(8, lines.size());
        assertTrue(lines.stream().anyMatch(l -> l.contains("valid: true") && l.contains("five")));
        assertTrue(lines.get(0).startsWith("test[0][0]"));
    }

    private static void assertNoDuplicateTags(AssociativeCache<Long, String> cache) {
        for (int set = 0; set < cache.getNumSets(); set++) {
            Set<Long> tags = new HashSet<>();
            for (int way = 0; way < cache.getAssociativity(); way++) {
                CacheEntry<String> entry = cache.getEntry(new EntryHandle(set, way));
                if (entry.isValid()) {
                    assertTrue("duplicate tag " + entry.getTag() + " in set " + set, tags.add(entry.getTag()));
                }
            }
        }
    }
}
