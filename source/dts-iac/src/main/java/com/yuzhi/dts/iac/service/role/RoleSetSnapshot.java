package com.yuzhi.dts.iac.service.role;

import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live permission sets, model sets and roles, with name to id maps kept current while a plan is applied.
 */
public class RoleSetSnapshot {

    private final List<LiveResource> permissionSets;
    private final List<LiveResource> modelSets;
    private final List<LiveResource> roles;
    private final Map<String, String> permissionSetIds = new LinkedHashMap<>();
    private final Map<String, String> modelSetIds = new LinkedHashMap<>();

    public RoleSetSnapshot(List<LiveResource> permissionSets, List<LiveResource> modelSets, List<LiveResource> roles) {
        this.permissionSets = List.copyOf(permissionSets);
        this.modelSets = List.copyOf(modelSets);
        this.roles = List.copyOf(roles);
        permissionSets.forEach(set -> permissionSetIds.put(set.name(), set.id()));
        modelSets.forEach(set -> modelSetIds.put(set.name(), set.id()));
    }

    /**
     * @throws com.yuzhi.dts.iac.service.directory.DirectoryFetchException when any of the three listings fails
     */
    public static RoleSetSnapshot fetch(DirectoryClient client) {
        return new RoleSetSnapshot(
            client.listAll(ResourceKind.PERMISSION_SET),
            client.listAll(ResourceKind.MODEL_SET),
            client.listAll(ResourceKind.ROLE)
        );
    }

    public List<LiveResource> getPermissionSets() {
        return permissionSets;
    }

    public List<LiveResource> getModelSets() {
        return modelSets;
    }

    public List<LiveResource> getRoles() {
        return roles;
    }

    public String permissionSetId(String name) {
        return permissionSetIds.get(name);
    }

    public String modelSetId(String name) {
        return modelSetIds.get(name);
    }

    public String permissionSetName(Object id) {
        return nameOf(permissionSetIds, id);
    }

    public String modelSetName(Object id) {
        return nameOf(modelSetIds, id);
    }

    /** Role name to role id, for resolving references from other kinds. */
    public Map<String, String> roleIds() {
        Map<String, String> ids = new LinkedHashMap<>();
        roles.forEach(role -> ids.put(role.name(), role.id()));
        return ids;
    }

    void recordSet(ResourceKind kind, String name, String id) {
        setMap(kind).put(name, id);
    }

    void forgetSet(ResourceKind kind, String name) {
        setMap(kind).remove(name);
    }

    private Map<String, String> setMap(ResourceKind kind) {
        if (kind == ResourceKind.PERMISSION_SET) {
            return permissionSetIds;
        }
        if (kind == ResourceKind.MODEL_SET) {
            return modelSetIds;
        }
        throw new IllegalArgumentException("Not a set kind: " + kind);
    }

    private static String nameOf(Map<String, String> ids, Object id) {
        if (id == null) {
            return null;
        }
        String key = id.toString();
        return ids
            .entrySet()
            .stream()
            .filter(e -> key.equals(e.getValue()))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse("Unknown ID " + key);
    }
}
