package io.routeflow.core.executor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Destinations a message will still be dispatched to, bound as {@code destinationSet} in source connector scripts.
 * Destinations are addressed by metaDataId or by connector name; a script can only remove them.
 *
 * <pre>
 * #destinationSet.remove('billing')
 * #destinationSet.removeAllExcept({1, 'archive'})
 * </pre>
 *
 * <p>Not thread-safe; one set belongs to one message.
 */
public final class DestinationSet {

    private final Map<String, Integer> idsByName;
    private final Set<Integer> metaDataIds;

    /**
     * @param idsByName every destination of the channel, connector name to metaDataId
     */
    public DestinationSet(Map<String, Integer> idsByName) {
        this.idsByName = Collections.unmodifiableMap(new LinkedHashMap<>(idsByName));
        this.metaDataIds = new LinkedHashSet<>(this.idsByName.values());
    }

    /**
     * Removes one destination (an integer metaDataId or a connector name) or every destination in a collection.
     *
     * @return whether the set changed
     */
    public boolean remove(Object metaDataIdOrName) {
        if (metaDataIdOrName instanceof Collection<?> many) {
            boolean removed = false;
            for (Object one : many) {
                removed |= remove(one);
            }
            return removed;
        }
        Integer metaDataId = resolve(metaDataIdOrName);
        return metaDataId != null && metaDataIds.remove(metaDataId);
    }

    /**
     * Keeps only the given destination (or destinations, when a collection is passed).
     *
     * @return whether the set changed
     */
    public boolean removeAllExcept(Object metaDataIdOrNames) {
        Set<Integer> keep = new LinkedHashSet<>();
        if (metaDataIdOrNames instanceof Collection<?> many) {
            for (Object one : many) {
                Integer metaDataId = resolve(one);
                if (metaDataId != null) {
                    keep.add(metaDataId);
                }
            }
        } else {
            Integer metaDataId = resolve(metaDataIdOrNames);
            if (metaDataId != null) {
                keep.add(metaDataId);
            }
        }
        return metaDataIds.retainAll(keep);
    }

    /** @return whether any destination was left to remove */
    public boolean removeAll() {
        boolean changed = !metaDataIds.isEmpty();
        metaDataIds.clear();
        return changed;
    }

    public boolean contains(int metaDataId) {
        return metaDataIds.contains(metaDataId);
    }

    /** Remaining metaDataIds in channel order. */
    public Set<Integer> metaDataIds() {
        return Collections.unmodifiableSet(metaDataIds);
    }

    private Integer resolve(Object metaDataIdOrName) {
        if (metaDataIdOrName instanceof Number number) {
            return number.intValue();
        }
        if (metaDataIdOrName instanceof CharSequence name) {
            return idsByName.get(name.toString());
        }
        return null;
    }

    @Override
    public String toString() {
        return "DestinationSet" + metaDataIds;
    }
}
