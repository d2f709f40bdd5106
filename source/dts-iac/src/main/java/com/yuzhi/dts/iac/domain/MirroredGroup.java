package com.yuzhi.dts.iac.domain;

import java.util.List;

/**
 * Identity provider group mirrored onto backend roles. Desired groups carry role names, live groups carry role ids.
 */
public record MirroredGroup(String id, String name, List<String> roles) {
    public MirroredGroup {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
