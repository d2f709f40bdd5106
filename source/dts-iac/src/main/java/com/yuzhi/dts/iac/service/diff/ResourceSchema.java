package com.yuzhi.dts.iac.service.diff;

import com.yuzhi.dts.iac.domain.FieldType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Declared comparable fields of one kind. Fields on the ignore-list are never compared even when desired config
 * sets them: secrets cannot be read back and server-assigned values are not ours to drive.
 */
public record ResourceSchema(ResourceKind kind, Map<String, FieldType> comparable, Set<String> ignored) {
    public ResourceSchema {
        comparable = comparable == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(comparable));
        ignored = ignored == null ? Set.of() : Set.copyOf(ignored);
    }

    public FieldType typeOf(String field) {
        if (ignored.contains(field)) {
            return null;
        }
        return comparable.get(field);
    }

    public boolean isComparable(String field) {
        return typeOf(field) != null;
    }
}
