package com.yuzhi.dts.iac.service.config;

import com.yuzhi.dts.iac.domain.DesiredResource;
import java.util.List;

/**
 * Desired project and the LookML models bound to it.
 */
public record ProjectSpec(DesiredResource project, List<DesiredResource> models) {
    public ProjectSpec {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public String name() {
        return project.name();
    }
}
