package com.propertyintel.listings.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-action counters for a page or a whole scan. Not thread-safe; a scan runs on one thread.
 */
public class ActionTally {

    private final EnumMap<ReconcileAction, Integer> counts = new EnumMap<>(ReconcileAction.class);

    public ActionTally() {
        for (ReconcileAction action : ReconcileAction.values()) {
            counts.put(action, 0);
        }
    }

    public void increment(ReconcileAction action) {
        counts.merge(action, 1, Integer::sum);
    }

    public void addAll(ActionTally other) {
        other.counts.forEach((action, count) -> counts.merge(action, count, Integer::sum));
    }

    public int get(ReconcileAction action) {
        return counts.get(action);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Ordered map keyed by {@link ReconcileAction#key()}, the shape written to job metadata */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        counts.forEach((action, count) -> map.put(action.key(), count));
        return map;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
