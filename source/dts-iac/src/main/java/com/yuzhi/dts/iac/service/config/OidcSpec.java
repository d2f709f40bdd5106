package com.yuzhi.dts.iac.service.config;

import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import java.util.List;

/**
 * Desired OIDC settings. {@code mirroredGroups} is null when the file does not declare any, which leaves the live
 * group mirroring untouched.
 */
public record OidcSpec(DesiredResource settings, List<MirroredGroup> mirroredGroups) {
    public OidcSpec {
        mirroredGroups = mirroredGroups == null ? null : List.copyOf(mirroredGroups);
    }

    public boolean declaresGroups() {
        return mirroredGroups != null;
    }
}
