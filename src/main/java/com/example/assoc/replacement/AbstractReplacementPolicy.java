package com.example.assoc.replacement;

import com.example.assoc.core.EntryHandle;
import java.util.List;

/**
 * Base for the concrete policies. Takes care of the metadata casts and of
 * preferring invalid candidates, so subclasses only rank valid entries.
 */
public abstract class AbstractReplacementPolicy<D extends ReplacementData> implements ReplacementPolicy {

    private final Class<D> dataType;

    protected AbstractReplacementPolicy(Class<D> dataType) {
        this.dataType = dataType;
    }

    protected abstract D newData();

    protected abstract void onTouch(D data);

    protected abstract void onReset(D data);

    protected abstract void onInvalidate(D data);

    /**
     * @param candidates non-empty, all valid
     */
    protected abstract ReplaceableEntry selectAmongValid(List<? extends ReplaceableEntry> candidates);

    @Override
    public final ReplacementData instantiateEntry() {
        return newData();
    }

    @Override
    public final void touch(ReplacementData data) {
        onTouch(cast(data));
    }

    @Override
    public final void reset(ReplacementData data) {
        onReset(cast(data));
    }

    @Override
    public final void invalidate(ReplacementData data) {
        onInvalidate(cast(data));
    }

    @Override
    public final EntryHandle getVictim(List<? extends ReplaceableEntry> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("There must be at least one replacement candidate");
        }
        for (ReplaceableEntry candidate : candidates) {
            if (!candidate.isValid()) {
                return candidate.getHandle();
            }
        }
        return selectAmongValid(candidates).getHandle();
    }

    protected D dataOf(ReplaceableEntry entry) {
        return cast(entry.getReplacementData());
    }

    private D cast(ReplacementData data) {
        if (!dataType.isInstance(data)) {
            throw new IllegalArgumentException(
                name() + " cannot use replacement data of type "
                    + (data == null ? "null" : data.getClass().getSimpleName()));
        }
        return dataType.cast(data);
    }

    @Override
    public String toString() {
        return name();
    }
}
