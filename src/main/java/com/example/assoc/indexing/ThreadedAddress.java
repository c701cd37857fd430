package com.example.assoc.indexing;

/**
 * Lookup key for structures shared between hardware threads.
 */
public final class ThreadedAddress {

    private final long address;
    private final int threadId;

    public ThreadedAddress(long address, int threadId) {
        if (threadId < 0) {
            throw new IllegalArgumentException("Thread id must not be negative: " + threadId);
        }
        this.address = address;
        this.threadId = threadId;
    }

    public long getAddress() {
        return address;
    }

    public int getThreadId() {
        return threadId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreadedAddress)) {
            return false;
        }
        ThreadedAddress other = (ThreadedAddress) o;
        return address == other.address && threadId == other.threadId;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(address) + threadId;
    }

    @Override
    public String toString() {
        return String.format("%#x@tid%d", address, threadId);
    }
}
