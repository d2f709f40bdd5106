package com.yuzhi.dts.iac.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One proposed action. For CREATE and UPDATE the payload is the full resolved desired field map, not a delta.
 * Role payloads keep set references as names; they are turned into ids only when the item is applied.
 */
public final class DiffItem {

    private final DiffAction action;
    private final ResourceKind kind;
    private final String name;
    private final String id;
    private final List<FieldChange> changes;
    private final Map<String, Object> payload;
    private final List<String> unresolvedSecrets;

    private DiffItem(
        DiffAction action,
        ResourceKind kind,
        String name,
        String id,
        List<FieldChange> changes,
        Map<String, Object> payload,
        List<String> unresolvedSecrets
    ) {
        this.action = action;
        this.kind = kind;
        this.name = name;
        this.id = id;
        this.changes = changes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(changes));
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.unresolvedSecrets = unresolvedSecrets == null ? List.of() : List.copyOf(unresolvedSecrets);
    }

    public static DiffItem create(ResourceKind kind, String name, Map<String, Object> payload, List<FieldChange> changes) {
        return new DiffItem(DiffAction.CREATE, kind, name, null, changes, payload, List.of());
    }

    public static DiffItem update(
        ResourceKind kind,
        String name,
        String id,
        List<FieldChange> changes,
        Map<String, Object> payload
    ) {
        return new DiffItem(DiffAction.UPDATE, kind, name, id, changes, payload, List.of());
    }

    public static DiffItem delete(ResourceKind kind, String name, String id) {
        return new DiffItem(DiffAction.DELETE, kind, name, id, List.of(), Map.of(), List.of());
    }

    public DiffItem withUnresolvedSecrets(List<String> fields) {
        return new DiffItem(action, kind, name, id, changes, payload, fields);
    }

    public DiffAction getAction() {
        return action;
    }

    public ResourceKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getId() {
        return id;
    }

    public List<FieldChange> getChanges() {
        return changes;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public List<String> getUnresolvedSecrets() {
        return unresolvedSecrets;
    }

    public boolean hasUnresolvedSecrets() {
        return !unresolvedSecrets.isEmpty();
    }

    @Override
    public String toString() {
        return action + " " + kind.getDisplayName() + " '" + name + "'" + (id == null ? "" : " (id=" + id + ")");
    }
}
