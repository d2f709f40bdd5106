package com.yuzhi.dts.iac.service.oidc;

import com.yuzhi.dts.iac.domain.FieldChange;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.service.role.UnresolvedDependencyException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Identity provider groups mirrored onto roles inside the OIDC configuration. Desired groups name their roles; the
 * backend stores role ids and assigns ids to groups, so both directions need the live role list.
 */
@Component
public class OidcGroupMirroring {

    public static final String GROUPS_FIELD = "groups_with_role_ids";

    /** Reads the live {@code groups_with_role_ids} value into groups carrying role ids. */
    public List<MirroredGroup> readLive(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<MirroredGroup> groups = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            List<String> roleIds = new ArrayList<>();
            if (map.get("role_ids") instanceof Collection<?> ids) {
                ids.forEach(id -> roleIds.add(String.valueOf(id)));
            }
            groups.add(new MirroredGroup(Objects.toString(map.get("id"), null), Objects.toString(map.get("name"), null), roleIds));
        }
        return groups;
    }

    /**
     * Compares group to role-name sets, order-insensitive. Live role ids are turned back into names through
     * {@code roleIds} (role name to id).
     */
    public Optional<FieldChange> compare(List<MirroredGroup> desired, List<MirroredGroup> live, Map<String, String> roleIds) {
        Map<String, String> roleNames = new LinkedHashMap<>();
        roleIds.forEach((name, id) -> roleNames.put(id, name));
        Map<String, Set<String>> current = new TreeMap<>();
        for (MirroredGroup group : live) {
            Set<String> names = group
                .roles()
                .stream()
                .map(id -> roleNames.getOrDefault(id, "Unknown ID " + id))
                .collect(Collectors.toCollection(TreeSet::new));
            current.put(group.name(), names);
        }
        Map<String, Set<String>> target = new TreeMap<>();
        for (MirroredGroup group : desired) {
            target.put(group.name(), new TreeSet<>(group.roles()));
        }
        if (current.equals(target)) {
            return Optional.empty();
        }
        return Optional.of(new FieldChange(GROUPS_FIELD, render(current), render(target)));
    }

    /**
     * Builds the value written back: role names become ids, groups that already exist keep their id.
     *
     * @throws UnresolvedDependencyException when a role name has no live id
     */
    public List<Map<String, Object>> resolve(List<MirroredGroup> desired, List<MirroredGroup> live, Map<String, String> roleIds) {
        Map<String, String> liveGroupIds = new LinkedHashMap<>();
        live.forEach(group -> liveGroupIds.putIfAbsent(group.name(), group.id()));
        List<Map<String, Object>> resolved = new ArrayList<>();
        for (MirroredGroup group : desired) {
            List<String> ids = new ArrayList<>();
            for (String role : group.roles()) {
                String id = roleIds.get(role);
                if (id == null) {
                    throw new UnresolvedDependencyException(
                        "OIDC group '" + group.name() + "' references Role '" + role + "' which does not exist"
                    );
                }
                ids.add(id);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            String groupId = liveGroupIds.get(group.name());
            if (groupId != null) {
                entry.put("id", groupId);
            }
            entry.put("name", group.name());
            entry.put("role_ids", ids);
            resolved.add(entry);
        }
        return resolved;
    }

    private static String render(Map<String, Set<String>> groups) {
        return groups.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining("; "));
    }
}
