package com.yuzhi.dts.iac.service.protection;

import static org.assertj.core.api.Assertions.assertThat;

import com.yuzhi.dts.iac.domain.DiffAction;
import com.yuzhi.dts.iac.domain.ResourceKind;
import org.junit.jupiter.api.Test;

class ProtectionPolicyTest {

    private final ProtectionPolicy policy = new ProtectionPolicy();

    @Test
    void builtInEntitiesCannotBeDeleted() {
        assertThat(policy.isProtected(ResourceKind.ROLE, "Admin", DiffAction.DELETE)).isTrue();
        assertThat(policy.isProtected(ResourceKind.ROLE, "Viewer", DiffAction.DELETE)).isTrue();
        assertThat(policy.isProtected(ResourceKind.PERMISSION_SET, "Admin", DiffAction.DELETE)).isTrue();
        assertThat(policy.isProtected(ResourceKind.MODEL_SET, "All", DiffAction.DELETE)).isTrue();
        assertThat(policy.isProtected(ResourceKind.ROLE, "Analyst", DiffAction.DELETE)).isFalse();
    }

    @Test
    void matchingIsExact() {
        assertThat(policy.isProtected(ResourceKind.ROLE, "admin", DiffAction.DELETE)).isFalse();
        assertThat(policy.isProtected(ResourceKind.ROLE, null, DiffAction.DELETE)).isFalse();
    }

    @Test
    void onlyTheSuperAdminRoleIsProtectedFromUpdates() {
        assertThat(policy.isProtected(ResourceKind.ROLE, "Admin", DiffAction.UPDATE)).isTrue();
        assertThat(policy.isProtected(ResourceKind.ROLE, "Developer", DiffAction.UPDATE)).isFalse();
        assertThat(policy.isProtected(ResourceKind.PERMISSION_SET, "Admin", DiffAction.UPDATE)).isFalse();
        assertThat(policy.isProtected(ResourceKind.ROLE, "Admin", DiffAction.CREATE)).isFalse();
    }

    @Test
    void builtInNamesAreKnownPerKind() {
        assertThat(policy.isBuiltIn(ResourceKind.MODEL_SET, "All")).isTrue();
        assertThat(policy.isBuiltIn(ResourceKind.PERMISSION_SET, "All")).isFalse();
    }
}
