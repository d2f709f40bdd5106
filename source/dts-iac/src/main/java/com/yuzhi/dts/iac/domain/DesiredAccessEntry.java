package com.yuzhi.dts.iac.domain;

import java.util.Locale;

/**
 * Access entry as written in the desired configuration, principal referenced by name (group) or email (user).
 */
public record DesiredAccessEntry(PrincipalType principalType, String principalName, String permission) {
    public static final String DEFAULT_PERMISSION = "view";

    public DesiredAccessEntry {
        permission = permission == null || permission.isBlank() ? DEFAULT_PERMISSION : permission.trim().toLowerCase(Locale.ROOT);
    }

    public String describe() {
        return principalType.label() + " '" + principalName + "' (" + permission + ")";
    }
}
