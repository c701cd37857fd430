package com.example.assoc.indexing;

import com.example.assoc.core.CacheConfigurationException;
import com.example.assoc.core.EntryHandle;

/**
 * Set-associative indexing for keys carrying a thread id. The thread id is
 * folded into the top bits of the set index so that threads running the
 * same code spread over different sets; the tag ignores it, which means
 * entries must store the thread id themselves.
 */
public class ThreadedSetAssociative extends BaseSetAssociative<ThreadedAddress> {

    private final int numThreads;
    private final int threadShift;

    public ThreadedSetAssociative(int numEntries, int associativity, int entrySize, int tagBits, int numThreads) {
        super(numEntries, associativity, entrySize, tagBits);
        if (!isPowerOf2(numThreads)) {
            throw new CacheConfigurationException("Number of threads must be a power of 2: " + numThreads);
        }
        int log2Sets = tagShift - setShift;
        int log2Threads = log2(numThreads);
        if (log2Threads > log2Sets) {
            throw new CacheConfigurationException(
                numThreads + " threads do not fit into the set index of " + numSets + " sets");
        }
        this.numThreads = numThreads;
        this.threadShift = log2Sets - log2Threads;
    }

    public int getNumThreads() {
        return numThreads;
    }

    @Override
    public int extractSet(ThreadedAddress key) {
        long threadBits = (long) key.getThreadId() << threadShift;
        return (int) (((key.getAddress() >>> setShift) ^ threadBits) & setMask);
    }

    @Override
    public long extractTag(ThreadedAddress key) {
        return extractTagFromAddress(key.getAddress());
    }

    /**
     * Always fails: the set index mixes in the thread id, which the tag does
     * not keep, so neither the address nor the thread can be recovered.
     */
    @Override
    public ThreadedAddress regenerateAddr(long tag, EntryHandle handle) {
        throw new UnsupportedOperationException(
            "Cannot regenerate a threaded address from tag " + Long.toHexString(tag) + " at " + handle);
    }

    @Override
    public String toString() {
        return "ThreadedSetAssociative{sets=" + numSets + ", ways=" + associativity
            + ", entrySize=" + entrySize + ", tagBits=" + tagBits + ", threads=" + numThreads + "}";
    }
}
