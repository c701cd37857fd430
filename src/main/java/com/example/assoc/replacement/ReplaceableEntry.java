package com.example.assoc.replacement;

import com.example.assoc.core.EntryHandle;

/**
 * The view of a cache entry a replacement policy gets while choosing a victim.
 */
public interface ReplaceableEntry {

    EntryHandle getHandle();

    boolean isValid();

    ReplacementData getReplacementData();
}
