package com.example.assoc.core;

import com.example.assoc.replacement.ReplaceableEntry;
import com.example.assoc.replacement.ReplacementData;

/**
 * One storage slot of an {@link AssociativeCache}. Tag, validity and
 * replacement metadata belong to the cache; only the payload is the
 * consumer's business. State changes go through the cache so the
 * replacement policy always hears about them.
 *
 * @param <P> payload type
 */
public class CacheEntry<P> implements ReplaceableEntry {

    static final long NO_TAG = -1L;

    private final EntryHandle handle;
    private final ReplacementData replacementData;
    private long tag = NO_TAG;
    private boolean valid;
    private P payload;

    CacheEntry(EntryHandle handle, ReplacementData replacementData) {
        this.handle = handle;
        this.replacementData = replacementData;
    }

    @Override
    public EntryHandle getHandle() {
        return handle;
    }

    @Override
    public boolean isValid() {
        return valid;
    }

    @Override
    public ReplacementData getReplacementData() {
        return replacementData;
    }

    /** Meaningful only while the entry is valid. */
    public long getTag() {
        return tag;
    }

    /**
     * The last payload written into this entry. Invalidation does not clear
     * it, so callers should check {@link #isValid()} first.
     */
    public P getPayload() {
        return payload;
    }

    boolean matchTag(long other) {
        return valid && tag == other;
    }

    void insert(long newTag, P newPayload) {
        if (valid) {
            throw new IllegalStateException("Entry " + handle + " must be invalidated before insertion");
        }
        this.tag = newTag;
        this.payload = newPayload;
        this.valid = true;
    }

    void invalidate() {
        this.valid = false;
        this.tag = NO_TAG;
    }

    @Override
    public String toString() {
        return String.format("%s tag: %#x valid: %b | %s | %s",
            handle, tag, valid, replacementData, valid ? payload : "-");
    }
}
