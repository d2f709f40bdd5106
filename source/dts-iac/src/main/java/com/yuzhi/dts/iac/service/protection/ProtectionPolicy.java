package com.yuzhi.dts.iac.service.protection;

import com.yuzhi.dts.iac.domain.DiffAction;
import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Built-in entities that reconciliation must never destroy. The lists are compiled in on purpose: they cannot be
 * edited through the desired-state files this policy guards. Matching is by exact name.
 */
@Component
public class ProtectionPolicy {

    public static final String SUPER_ADMIN_ROLE = "Admin";

    static final Set<String> PROTECTED_PERMISSION_SETS = Set.of(
        "Admin",
        "Support Basic Editor",
        "Support Advanced Editor",
        "Customer Engineer Advanced Editor",
        "Gemini",
        "LookML Dashboard User",
        "User who can't view LookML"
    );

    static final Set<String> PROTECTED_MODEL_SETS = Set.of("All");

    static final Set<String> PROTECTED_ROLES = Set.of(
        "Admin",
        "Developer",
        "User",
        "Viewer",
        "Support Basic Editor",
        "Support Advanced Editor",
        "Customer Engineer Advanced Editor"
    );

    private static final Map<ResourceKind, Set<String>> DELETE_PROTECTED = Map.of(
        ResourceKind.PERMISSION_SET,
        PROTECTED_PERMISSION_SETS,
        ResourceKind.MODEL_SET,
        PROTECTED_MODEL_SETS,
        ResourceKind.ROLE,
        PROTECTED_ROLES
    );

    public boolean isProtected(ResourceKind kind, String name, DiffAction action) {
        if (name == null) {
            return false;
        }
        return switch (action) {
            case DELETE -> DELETE_PROTECTED.getOrDefault(kind, Set.of()).contains(name);
            case UPDATE -> kind == ResourceKind.ROLE && SUPER_ADMIN_ROLE.equals(name);
            case CREATE -> false;
        };
    }

    /**
     * Built-in names that exist on every backend, so a reference to them never needs a definition in desired config.
     */
    public boolean isBuiltIn(ResourceKind kind, String name) {
        return DELETE_PROTECTED.getOrDefault(kind, Set.of()).contains(name);
    }
}
