package com.example.assoc.core;

/**
 * Position of an entry inside a cache: set index plus way index.
 * Policies exchange handles instead of entry references, so nothing outside
 * the cache ever keeps an entry alive.
 */
public final class EntryHandle {

    private final int set;
    private final int way;

    public EntryHandle(int set, int way) {
        if (set < 0 || way < 0) {
            throw new IllegalArgumentException("Negative set or way: set=" + set + ", way=" + way);
        }
        this.set = set;
        this.way = way;
    }

    public int getSet() {
        return set;
    }

    public int getWay() {
        return way;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntryHandle)) {
            return false;
        }
        EntryHandle other = (EntryHandle) o;
        return set == other.set && way == other.way;
    }

    @Override
    public int hashCode() {
        return 31 * set + way;
    }

    @Override
    public String toString() {
        return "[" + set + "][" + way + "]";
    }
}
