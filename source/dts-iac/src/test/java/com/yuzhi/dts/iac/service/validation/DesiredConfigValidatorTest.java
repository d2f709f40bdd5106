package com.yuzhi.dts.iac.service.validation;

import static com.yuzhi.dts.iac.support.IacTestSupport.fields;
import static com.yuzhi.dts.iac.support.IacTestSupport.modelSet;
import static com.yuzhi.dts.iac.support.IacTestSupport.permissionSet;
import static com.yuzhi.dts.iac.support.IacTestSupport.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.config.DesiredConfig;
import com.yuzhi.dts.iac.service.config.FolderSpec;
import com.yuzhi.dts.iac.service.config.OidcSpec;
import com.yuzhi.dts.iac.service.config.ProjectSpec;
import com.yuzhi.dts.iac.service.config.RoleSection;
import com.yuzhi.dts.iac.service.directory.InMemoryDirectoryClient;
import com.yuzhi.dts.iac.service.directory.PrincipalDirectory;
import com.yuzhi.dts.iac.support.IacTestSupport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DesiredConfigValidatorTest {

    private final IacTestSupport support = new IacTestSupport();
    private final InMemoryDirectoryClient client = support.client;
    private final DesiredConfigValidator validator = support.validator;

    @Test
    void consistentConfigPasses() {
        client.registerPermissions("access_data", "see_looks");
        client.addGroup("Analysts");
        DesiredConfig config = new DesiredConfig(
            List.of(DesiredResource.of("warehouse", fields("name", "warehouse"))),
            List.of(project("analytics", model("sales", "warehouse"))),
            RoleSection.of(
                List.of(permissionSet("Analyst Permissions", "access_data")),
                List.of(modelSet("Sales Models", "sales")),
                List.of(role("Analyst", "Analyst Permissions", "Sales Models"), role("Reader", "Analyst Permissions", "All"))
            ),
            List.of(new FolderSpec("Sales", null, List.of(new DesiredAccessEntry(PrincipalType.GROUP, "Analysts", "view")))),
            new OidcSpec(
                DesiredResource.of("OIDC Configuration", Map.of()),
                List.of(new MirroredGroup(null, "Analysts", List.of("Analyst")))
            )
        );

        assertThatCode(() -> validate(config)).doesNotThrowAnyException();
    }

    @Test
    void everyProblemIsReportedTogether() {
        client.registerPermissions("access_data");
        DesiredConfig config = new DesiredConfig(
            List.of(),
            List.of(),
            RoleSection.of(
                List.of(permissionSet("Analyst Permissions", "access_data", "fly"), permissionSet("Analyst Permissions")),
                List.of(),
                List.of(role("Analyst", "Missing Permissions", "Missing Models"), role("Loose", null, "All"))
            ),
            List.of(),
            null
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors())
            .containsExactlyInAnyOrder(
                "Permission Set 'Analyst Permissions' is defined more than once",
                "Invalid permission 'fly' in Permission Set 'Analyst Permissions'",
                "Role 'Analyst' references undefined Permission Set 'Missing Permissions'",
                "Role 'Analyst' references undefined Model Set 'Missing Models'",
                "Role 'Loose' has no Permission Set"
            );
        assertThat(ex.getMessage()).startsWith("Configuration validation failed:\n- ");
    }

    @Test
    void emptyPermissionCatalogSkipsThePermissionCheck() {
        DesiredConfig config = rolesOnly(
            RoleSection.of(List.of(permissionSet("Analyst Permissions", "anything")), List.of(), List.of())
        );

        assertThatCode(() -> validate(config)).doesNotThrowAnyException();
    }

    @Test
    void superAdminRoleReferencesAreNotChecked() {
        DesiredConfig config = rolesOnly(RoleSection.of(List.of(), List.of(), List.of(role("Admin", "Whatever", "Else"))));

        assertThatCode(() -> validate(config)).doesNotThrowAnyException();
    }

    @Test
    void oidcGroupsMayReferenceLiveRoles() {
        client.seed(ResourceKind.ROLE, "Viewer", Map.of());
        DesiredConfig config = new DesiredConfig(
            List.of(),
            List.of(),
            null,
            List.of(),
            new OidcSpec(
                DesiredResource.of("OIDC Configuration", Map.of()),
                List.of(new MirroredGroup(null, "Everyone", List.of("Viewer", "Phantom")))
            )
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors()).containsExactly("OIDC Group 'Everyone' references unknown Role 'Phantom'");
    }

    @Test
    void modelsMayOnlyUseKnownConnections() {
        client.seed(ResourceKind.CONNECTION, "legacy", Map.of());
        DesiredConfig config = new DesiredConfig(
            List.of(),
            List.of(project("analytics", model("sales", "legacy")), project("ops", model("ops", "warehouse"))),
            null,
            List.of(),
            null
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors()).containsExactly("Model 'ops' references unknown Connection 'warehouse'");
    }

    @Test
    void folderPrincipalsMustBeUniqueAndResolvable() {
        client.addGroup("Analysts");
        DesiredConfig config = new DesiredConfig(
            List.of(),
            List.of(),
            null,
            List.of(
                new FolderSpec(
                    "Sales",
                    null,
                    List.of(
                        new DesiredAccessEntry(PrincipalType.GROUP, "Analysts", "view"),
                        new DesiredAccessEntry(PrincipalType.GROUP, "Analysts", "edit"),
                        new DesiredAccessEntry(PrincipalType.USER, "ghost@example.com", "view")
                    )
                )
            ),
            null
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors())
            .containsExactly(
                "Folder 'Sales' lists group 'Analysts' more than once",
                "Folder 'Sales' references unknown user 'ghost@example.com'"
            );
    }

    @Test
    void principalsAreComparedByWhatTheyResolveTo() {
        client.addGroup("Sales (OIDC)");
        client.addUser("ana@example.com");
        DesiredConfig config = foldersOnly(
            new FolderSpec(
                "Reports",
                null,
                List.of(
                    new DesiredAccessEntry(PrincipalType.GROUP, "Sales", "edit"),
                    new DesiredAccessEntry(PrincipalType.GROUP, "Sales (OIDC)", "view"),
                    new DesiredAccessEntry(PrincipalType.USER, "ana@example.com", "view"),
                    new DesiredAccessEntry(PrincipalType.USER, "Ana@Example.com", "edit")
                )
            )
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors())
            .containsExactly(
                "Folder 'Reports' lists group 'Sales (OIDC)' and 'Sales', which are the same group",
                "Folder 'Reports' lists user 'Ana@Example.com' and 'ana@example.com', which are the same user"
            );
    }

    @Test
    void unresolvedPrincipalsDifferingOnlyInEmailCaseAreDuplicates() {
        support.properties.getValidation().setStrictPrincipals(false);
        DesiredConfig config = foldersOnly(
            new FolderSpec(
                "Reports",
                null,
                List.of(
                    new DesiredAccessEntry(PrincipalType.USER, "new.hire@example.com", "view"),
                    new DesiredAccessEntry(PrincipalType.USER, "New.Hire@example.com", "view")
                )
            )
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors())
            .containsExactly("Folder 'Reports' lists user 'New.Hire@example.com' and 'new.hire@example.com', which are the same user");
    }

    @Test
    void accessPermissionMustBeViewOrEdit() {
        client.addGroup("Analysts");
        DesiredConfig config = foldersOnly(
            new FolderSpec("Reports", null, List.of(new DesiredAccessEntry(PrincipalType.GROUP, "Analysts", "veiw")))
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors()).containsExactly("Folder 'Reports' grants unknown permission 'veiw' to group 'Analysts'");
    }

    @Test
    void sameFolderNameIsAllowedUnderDifferentParents() {
        DesiredConfig config = foldersOnly(
            new FolderSpec("Finance", null, List.of()),
            new FolderSpec("Sales", null, List.of()),
            new FolderSpec("Reports", "Finance", List.of()),
            new FolderSpec("Reports", "Sales", List.of())
        );

        assertThatCode(() -> validate(config)).doesNotThrowAnyException();
    }

    @Test
    void sameFolderUnderTheSameParentOrAsAnAmbiguousParentIsRejected() {
        DesiredConfig config = foldersOnly(
            new FolderSpec("Finance", null, List.of()),
            new FolderSpec("Reports", "Finance", List.of()),
            new FolderSpec("Reports", "Finance", List.of()),
            new FolderSpec("Monthly", "Reports", List.of())
        );

        ConfigValidationException ex = catchThrowableOfType(() -> validate(config), ConfigValidationException.class);

        assertThat(ex.getErrors())
            .containsExactly(
                "Folder 'Finance/Reports' is defined more than once",
                "Folder 'Monthly' has ambiguous parent 'Reports', defined more than once"
            );
    }

    @Test
    void unknownPrincipalsAreToleratedWhenNotStrict() {
        support.properties.getValidation().setStrictPrincipals(false);
        DesiredConfig config = new DesiredConfig(
            List.of(),
            List.of(),
            null,
            List.of(new FolderSpec("Sales", null, List.of(new DesiredAccessEntry(PrincipalType.GROUP, "Nobody", "view")))),
            null
        );

        assertThatCode(() -> validate(config)).doesNotThrowAnyException();
    }

    private void validate(DesiredConfig config) {
        validator.validate(config, new PrincipalDirectory(client));
    }

    private static DesiredConfig foldersOnly(FolderSpec... folders) {
        return new DesiredConfig(List.of(), List.of(), null, List.of(folders), null);
    }

    private static DesiredConfig rolesOnly(RoleSection roles) {
        return new DesiredConfig(List.of(), List.of(), roles, List.of(), null);
    }

    private static ProjectSpec project(String name, DesiredResource... models) {
        return new ProjectSpec(DesiredResource.of(name, Map.of("name", name)), List.of(models));
    }

    private static DesiredResource model(String name, String connection) {
        return DesiredResource.of(
            name,
            fields("name", name, "project_name", "analytics", "allowed_db_connection_names", List.of(connection))
        );
    }
}
