package com.example.assoc.replacement;

import com.example.assoc.core.EntryHandle;
import java.util.List;

public interface ReplacementPolicy {

    /** Called once per entry when the cache is built. */
    ReplacementData instantiateEntry();

    /** Records a hit on the entry. */
    void touch(ReplacementData data);

    /** Called right after the entry is filled; gives it maximal retention priority. */
    void reset(ReplacementData data);

    /** Called when the entry is evicted or cleared; makes it the next victim. */
    void invalidate(ReplacementData data);

    /**
     * Chooses the entry to evict among the candidates. An invalid candidate is
     * always returned before any valid one.
     */
    EntryHandle getVictim(List<? extends ReplaceableEntry> candidates);

    String name();
}
