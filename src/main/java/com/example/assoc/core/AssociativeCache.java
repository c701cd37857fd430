package com.example.assoc.core;

import com.example.assoc.indexing.IndexingPolicy;
import com.example.assoc.replacement.ReplacementPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity set-associative container.
 *
 * <p>The cache owns every entry for its whole lifetime. Where a key may live
 * is decided by the {@link IndexingPolicy}; which entry to give up when a set
 * is full is decided by the {@link ReplacementPolicy}. Insertion is split in
 * two steps, {@link #findVictim} and {@link #insertEntry}: the victim is
 * invalidated as soon as it is chosen, so a caller that gives up between the
 * two steps leaves behind an empty entry rather than a half-written one.
 *
 * <p>Not thread safe. Callers must not let another operation touch the same
 * set between {@code findVictim} and {@code insertEntry}.
 *
 * @param <K> lookup key type
 * @param <P> payload type
 */
public class AssociativeCache<K, P> {

    private static final Logger logger = LoggerFactory.getLogger(AssociativeCache.class);

    private final String name;
    private final int numEntries;
    private final int associativity;
    private final int numSets;
    private final ReplacementPolicy replPolicy;
    private final IndexingPolicy<K> indexingPolicy;

    // flat grid, entry (set, way) lives at set * associativity + way
    private final List<CacheEntry<P>> entries;

    public AssociativeCache(String name,
                            int numEntries,
                            int associativity,
                            ReplacementPolicy replPolicy,
                            IndexingPolicy<K> indexingPolicy) {
        if (name == null || name.isEmpty()) {
            throw new CacheConfigurationException("Cache name must not be empty");
        }
        if (numEntries <= 0 || associativity <= 0) {
            throw new CacheConfigurationException(name + ": entries (" + numEntries
                + ") and associativity (" + associativity + ") must be positive");
        }
        if (numEntries % associativity != 0) {
            throw new CacheConfigurationException(name + ": number of entries (" + numEntries
                + ") is not a multiple of the associativity (" + associativity + ")");
        }
        if (replPolicy == null || indexingPolicy == null) {
            throw new CacheConfigurationException(name + ": replacement and indexing policies are required");
        }
        int sets = numEntries / associativity;
        if (indexingPolicy.getNumSets() != sets || indexingPolicy.getAssociativity() != associativity) {
            throw new CacheConfigurationException(name + ": indexing policy describes "
                + indexingPolicy.getNumSets() + " sets x " + indexingPolicy.getAssociativity()
                + " ways, cache has " + sets + " sets x " + associativity + " ways");
        }

        this.name = name;
        this.numEntries = numEntries;
        this.associativity = associativity;
        this.numSets = sets;
        this.replPolicy = replPolicy;
        this.indexingPolicy = indexingPolicy;

        List<CacheEntry<P>> grid = new ArrayList<>(numEntries);
        for (int set = 0; set < sets; set++) {
            for (int way = 0; way < associativity; way++) {
                grid.add(new CacheEntry<>(new EntryHandle(set, way), replPolicy.instantiateEntry()));
            }
        }
        this.entries = Collections.unmodifiableList(grid);

        logger.info("Created cache {}: {} entries, {} sets x {} ways, replacement={}, indexing={}",
            name, numEntries, sets, associativity, replPolicy.name(), indexingPolicy);
    }

    public String getName() {
        return name;
    }

    public int getNumEntries() {
        return numEntries;
    }

    public int getAssociativity() {
        return associativity;
    }

    public int getNumSets() {
        return numSets;
    }

    public ReplacementPolicy getReplacementPolicy() {
        return replPolicy;
    }

    public IndexingPolicy<K> getIndexingPolicy() {
        return indexingPolicy;
    }

    public long getTag(K key) {
        return indexingPolicy.extractTag(key);
    }

    public int getSetIndex(K key) {
        return indexingPolicy.extractSet(key);
    }

    public boolean isEntryValid(K key) {
        return lookup(key).isPresent();
    }

    /**
     * Finds the valid entry holding the key without affecting replacement state.
     */
    public Optional<CacheEntry<P>> lookup(K key) {
        long tag = indexingPolicy.extractTag(key);
        for (CacheEntry<P> entry : candidatesOf(key)) {
            if (entry.matchTag(tag) && matchesKey(entry, key)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #lookup} but counts as an access: a hit is reported to the
     * replacement policy.
     */
    public Optional<CacheEntry<P>> access(K key) {
        Optional<CacheEntry<P>> entry = lookup(key);
        entry.ifPresent(e -> replPolicy.touch(e.getReplacementData()));
        return entry;
    }

    /**
     * Picks the entry that will receive the key and invalidates it. If the
     * key is already cached its own entry is chosen, otherwise the replacement
     * policy decides among the key's candidates.
     */
    public CacheEntry<P> findVictim(K key) {
        List<CacheEntry<P>> candidates = candidatesOf(key);

        CacheEntry<P> victim = lookup(key).orElse(null);
        if (victim == null) {
            EntryHandle chosen = replPolicy.getVictim(candidates);
            victim = entryAt(chosen);
            if (!candidates.contains(victim)) {
                throw new IllegalStateException(replPolicy.name() + " chose " + chosen
                    + " outside the candidate set " + indexingPolicy.extractSet(key));
            }
        }

        if (victim.isValid()) {
            logger.debug("{}: evicting {} for {}", name, victim, key);
        }
        invalidate(victim);
        return victim;
    }

    /**
     * Fills {@code victim} with the key's tag and the payload and marks it as
     * the most valuable entry of its set.
     *
     * @throws IllegalArgumentException if the victim is not one of the key's candidates
     */
    public CacheEntry<P> insertEntry(K key, CacheEntry<P> victim, P payload) {
        List<CacheEntry<P>> candidates = candidatesOf(key);
        if (victim == null || !candidates.contains(victim)) {
            throw new IllegalArgumentException(name + ": " + (victim == null ? "null" : victim.getHandle())
                + " is not a candidate for " + key);
        }

        long tag = indexingPolicy.extractTag(key);
        for (CacheEntry<P> other : candidates) {
            if (other != victim && other.matchTag(tag) && matchesKey(other, key)) {
                invalidate(other);
            }
        }
        if (victim.isValid()) {
            invalidate(victim);
        }

        victim.insert(tag, payload);
        replPolicy.reset(victim.getReplacementData());
        logger.debug("{}: inserted {} at {}", name, key, victim.getHandle());
        return victim;
    }

    /** {@link #findVictim} followed by {@link #insertEntry}. */
    public CacheEntry<P> insert(K key, P payload) {
        return insertEntry(key, findVictim(key), payload);
    }

    public void invalidate(CacheEntry<P> entry) {
        if (entry == null || entryAt(entry.getHandle()) != entry) {
            throw new IllegalArgumentException(name + ": entry does not belong to this cache");
        }
        entry.invalidate();
        replPolicy.invalidate(entry.getReplacementData());
    }

    /** Invalidates every entry. */
    public void clear() {
        for (CacheEntry<P> entry : entries) {
            invalidate(entry);
        }
    }

    public CacheEntry<P> getEntry(EntryHandle handle) {
        return entryAt(handle);
    }

    public int validEntryCount() {
        int count = 0;
        for (CacheEntry<P> entry : entries) {
            if (entry.isValid()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Rebuilds the key held by a valid entry.
     *
     * @throws UnsupportedOperationException when the indexing policy cannot invert keys
     */
    public K regenerateKey(CacheEntry<P> entry) {
        if (!entry.isValid()) {
            throw new IllegalArgumentException(name + ": entry " + entry.getHandle() + " is not valid");
        }
        return indexingPolicy.regenerateAddr(entry.getTag(), entry.getHandle());
    }

    /** One line per entry: position, tag, validity, replacement metadata and payload. */
    public List<String> dump() {
        List<String> lines = new ArrayList<>(numEntries);
        for (CacheEntry<P> entry : entries) {
            lines.add(name + entry);
        }
        return lines;
    }

    /**
     * Extra discriminator on top of the tag comparison. Only called for valid
     * entries whose tag already matches.
     */
    protected boolean matchesKey(CacheEntry<P> entry, K key) {
        return true;
    }

    private List<CacheEntry<P>> candidatesOf(K key) {
        List<EntryHandle> handles = indexingPolicy.getPossibleEntries(key);
        List<CacheEntry<P>> candidates = new ArrayList<>(handles.size());
        for (EntryHandle handle : handles) {
            candidates.add(entryAt(handle));
        }
        return candidates;
    }

    private CacheEntry<P> entryAt(EntryHandle handle) {
        if (handle == null || handle.getSet() >= numSets || handle.getWay() >= associativity) {
            throw new IllegalArgumentException(name + ": no entry at " + handle);
        }
        return entries.get(handle.getSet() * associativity + handle.getWay());
    }
}
