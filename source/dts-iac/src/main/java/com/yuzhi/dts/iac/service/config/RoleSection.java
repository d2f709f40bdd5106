package com.yuzhi.dts.iac.service.config;

import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Desired permission sets, model sets and roles. Only kinds listed in {@code declared} were written in the file;
 * delete-detection runs for declared kinds only.
 */
public record RoleSection(
    List<DesiredResource> permissionSets,
    List<DesiredResource> modelSets,
    List<DesiredResource> roles,
    Set<ResourceKind> declared
) {
    public RoleSection {
        permissionSets = permissionSets == null ? List.of() : List.copyOf(permissionSets);
        modelSets = modelSets == null ? List.of() : List.copyOf(modelSets);
        roles = roles == null ? List.of() : List.copyOf(roles);
        declared = declared == null ? Set.of() : Set.copyOf(declared);
    }

    /** Section where every kind is declared. */
    public static RoleSection of(List<DesiredResource> permissionSets, List<DesiredResource> modelSets, List<DesiredResource> roles) {
        return new RoleSection(
            permissionSets,
            modelSets,
            roles,
            EnumSet.of(ResourceKind.PERMISSION_SET, ResourceKind.MODEL_SET, ResourceKind.ROLE)
        );
    }

    public boolean declares(ResourceKind kind) {
        return declared.contains(kind);
    }

    public List<DesiredResource> resources(ResourceKind kind) {
        return switch (kind) {
            case PERMISSION_SET -> permissionSets;
            case MODEL_SET -> modelSets;
            case ROLE -> roles;
            default -> throw new IllegalArgumentException("Not a role section kind: " + kind);
        };
    }
}
