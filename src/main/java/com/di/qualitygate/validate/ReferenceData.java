package com.di.qualitygate.validate;

import com.di.qualitygate.util.TypeConverter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parent key sets for referential plausibility checks, keyed by {@code parentTable.parentColumn}.
 * Numeric ids are compared by value, so {@code 7}, {@code 7L} and {@code 7.0} match.
 */
public final class ReferenceData {

    private final Map<String, Set<Object>> idsByReference = new ConcurrentHashMap<>();

    public static ReferenceData empty() {
        return new ReferenceData();
    }

    public ReferenceData put(String parentTable, String parentColumn, Collection<?> ids) {
        Set<Object> normalized = new HashSet<>();
        for (Object id : ids) {
            if (id != null) {
                normalized.add(normalize(id));
            }
        }
        idsByReference.put(parentTable + "." + parentColumn, normalized);
        return this;
    }

    public boolean has(ForeignKey fk) {
        return idsByReference.containsKey(fk.referenceKey());
    }

    public boolean contains(ForeignKey fk, Object value) {
        Set<Object> ids = idsByReference.get(fk.referenceKey());
        return ids != null && ids.contains(normalize(value));
    }

    private static Object normalize(Object id) {
        return TypeConverter.valueKey(id);
    }
}
