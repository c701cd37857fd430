package com.example.assoc.indexing;

import com.example.assoc.core.EntryHandle;
import java.util.List;

/**
 * Maps a lookup key to the set of entries that may hold it and to the tag
 * stored in those entries. Implementations are pure functions of their
 * configuration and the key.
 *
 * @param <K> lookup key type
 */
public interface IndexingPolicy<K> {

    int getNumSets();

    int getAssociativity();

    int extractSet(K key);

    long extractTag(K key);

    /**
     * Candidate entries for the key, ordered by way. Always exactly
     * {@link #getAssociativity()} handles.
     */
    List<EntryHandle> getPossibleEntries(K key);

    /**
     * Rebuilds the key that produced {@code tag} in the set of {@code handle}.
     *
     * @throws UnsupportedOperationException if the key space cannot be
     *                                       inverted from tag and position
     */
    K regenerateAddr(long tag, EntryHandle handle);
}
