package com.yuzhi.dts.iac.service.config;

import com.yuzhi.dts.iac.domain.DesiredResource;
import java.util.List;

/**
 * Everything read from the config directory. {@code roles} and {@code oidc} are null when their file is absent.
 */
public record DesiredConfig(
    List<DesiredResource> connections,
    List<ProjectSpec> projects,
    RoleSection roles,
    List<FolderSpec> folders,
    OidcSpec oidc
) {
    public DesiredConfig {
        connections = connections == null ? List.of() : List.copyOf(connections);
        projects = projects == null ? List.of() : List.copyOf(projects);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }

    public static DesiredConfig empty() {
        return new DesiredConfig(List.of(), List.of(), null, List.of(), null);
    }

    public List<DesiredResource> models() {
        return projects.stream().flatMap(project -> project.models().stream()).toList();
    }

    public boolean hasRoles() {
        return roles != null;
    }

    public boolean hasOidc() {
        return oidc != null;
    }
}
