package com.example.assoc.btb;

import com.example.assoc.core.AssociativeCache;
import com.example.assoc.core.CacheConfigurationException;
import com.example.assoc.core.CacheEntry;
import com.example.assoc.indexing.ThreadedAddress;
import com.example.assoc.indexing.ThreadedSetAssociative;
import com.example.assoc.replacement.ReplacementPolicy;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Branch-target buffer backed by an {@link AssociativeCache}, shared by all
 * hardware threads. Entries are tagged with the branch PC and additionally
 * matched on the thread id stored in the payload.
 */
public class SimpleBtb {

    private static final Logger logger = LoggerFactory.getLogger(SimpleBtb.class);

    private final String name;
    private final int confidenceBits;
    private final int confidenceInit;
    private final AssociativeCache<ThreadedAddress, BtbEntry> btb;

    public SimpleBtb(String name,
                     int numEntries,
                     int associativity,
                     int instBytes,
                     int tagBits,
                     int numThreads,
                     int confidenceBits,
                     int confidenceInit,
                     ReplacementPolicy replPolicy) {
        if (numEntries <= 0 || (numEntries & (numEntries - 1)) != 0) {
            throw new CacheConfigurationException("BTB entries is not a power of 2: " + numEntries);
        }
        SaturatingCounter.validate(confidenceBits, confidenceInit);

        this.name = name;
        this.confidenceBits = confidenceBits;
        this.confidenceInit = confidenceInit;
        this.btb = new BtbCache(name, numEntries, associativity, replPolicy,
            new ThreadedSetAssociative(numEntries, associativity, instBytes, tagBits, numThreads));
        logger.info("Created BTB {}", name);
    }

    public String getName() {
        return name;
    }

    /** Whether the branch has an entry. Does not count as an access. */
    public boolean valid(ThreadedAddress key) {
        return btb.isEntryValid(key);
    }

    /**
     * Predicted target of the branch, empty on a miss. A hit refreshes the
     * entry's replacement state.
     */
    public OptionalLong lookup(ThreadedAddress key, BranchType type) {
        Optional<CacheEntry<BtbEntry>> entry = btb.access(key);
        if (entry.isPresent()) {
            return OptionalLong.of(entry.get().getPayload().getTarget());
        }
        logger.trace("{}: miss for {} ({})", name, key, type);
        return OptionalLong.empty();
    }

    public Optional<String> getInst(ThreadedAddress key) {
        return btb.lookup(key).map(e -> e.getPayload().getInst());
    }

    public Optional<BranchType> getBranchType(ThreadedAddress key) {
        return btb.lookup(key).map(e -> e.getPayload().getBranchType());
    }

    /**
     * Installs or replaces the entry for the branch. The confidence counter
     * restarts from its initial value.
     */
    public void update(ThreadedAddress key, long target, BranchType type, String inst) {
        CacheEntry<BtbEntry> victim = btb.findVictim(key);
        btb.insertEntry(key, victim, new BtbEntry(key.getThreadId(), target, type, inst,
            new SaturatingCounter(confidenceBits, confidenceInit)));
    }

    public OptionalInt getConfidence(ThreadedAddress key) {
        Optional<CacheEntry<BtbEntry>> entry = btb.lookup(key);
        return entry.isPresent()
            ? OptionalInt.of(entry.get().getPayload().getConfidence().get())
            : OptionalInt.empty();
    }

    /** @return false if the branch has no entry */
    public boolean incrementConfidence(ThreadedAddress key) {
        Optional<CacheEntry<BtbEntry>> entry = btb.lookup(key);
        entry.ifPresent(e -> e.getPayload().getConfidence().increment());
        return entry.isPresent();
    }

    /** @return false if the branch has no entry */
    public boolean decrementConfidence(ThreadedAddress key) {
        Optional<CacheEntry<BtbEntry>> entry = btb.lookup(key);
        entry.ifPresent(e -> e.getPayload().getConfidence().decrement());
        return entry.isPresent();
    }

    /** Drops every entry, for example when the instruction memory changes. */
    public void memInvalidate() {
        btb.clear();
        logger.info("{}: invalidated all entries", name);
    }

    public int validEntryCount() {
        return btb.validEntryCount();
    }

    public List<String> dump() {
        return btb.dump();
    }

    AssociativeCache<ThreadedAddress, BtbEntry> cache() {
        return btb;
    }

    private static class BtbCache extends AssociativeCache<ThreadedAddress, BtbEntry> {

        BtbCache(String name, int numEntries, int associativity, ReplacementPolicy replPolicy,
                 ThreadedSetAssociative indexingPolicy) {
            super(name, numEntries, associativity, replPolicy, indexingPolicy);
        }

        @Override
        protected boolean matchesKey(CacheEntry<BtbEntry> entry, ThreadedAddress key) {
            return entry.getPayload().getThreadId() == key.getThreadId();
        }
    }
}
