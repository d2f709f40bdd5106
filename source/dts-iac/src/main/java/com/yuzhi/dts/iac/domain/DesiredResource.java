package com.yuzhi.dts.iac.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entity of the desired configuration. Secrets are never literal, only {@link SecretRef} pointers keyed by the
 * payload field they resolve into.
 */
public record DesiredResource(String name, Map<String, Object> fields, Map<String, SecretRef> secrets) {
    public DesiredResource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Desired resource requires a name");
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        secrets = secrets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(secrets));
    }

    public static DesiredResource of(String name, Map<String, Object> fields) {
        return new DesiredResource(name, fields, Map.of());
    }

    public Object field(String field) {
        return fields.get(field);
    }
}
