package com.propertyintel.listings.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of Idealista search results.
 *
 * The raw payload is kept as-is for archiving; elements are the entries of its
 * elementList, each a loose map of listing fields.
 */
public record SearchPage(
        int total,
        int totalPages,
        int actualPage,
        List<Map<String, Object>> elements,
        Map<String, Object> payload) {

    public static SearchPage fromPayload(Map<String, Object> payload) {
        if (payload == null) {
            return new SearchPage(0, 0, 0, List.of(), Map.of());
        }
        return new SearchPage(
                intValue(payload.get("total"), 0),
                intValue(payload.get("totalPages"), 1),
                intValue(payload.get("actualPage"), 0),
                elementList(payload.get("elementList")),
                payload);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> elementList(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> elements = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                elements.add((Map<String, Object>) map);
            }
        }
        return Collections.unmodifiableList(elements);
    }

    private static int intValue(Object raw, int fallback) {
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
