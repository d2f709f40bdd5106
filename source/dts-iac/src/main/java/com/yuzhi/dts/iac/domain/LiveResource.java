package com.yuzhi.dts.iac.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of an entity as read from the backend.
 */
public record LiveResource(String id, String name, Map<String, Object> fields) {
    public LiveResource {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object field(String field) {
        return fields.get(field);
    }
}
