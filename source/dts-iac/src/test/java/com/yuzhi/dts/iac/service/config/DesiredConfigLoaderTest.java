package com.yuzhi.dts.iac.service.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.domain.SecretRef;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DesiredConfigLoaderTest {

    private final DesiredConfigLoader loader = new DesiredConfigLoader(new DesiredResourceMapper());

    @TempDir
    Path configDir;

    @Test
    void emptyDirectoryManagesNothing() {
        DesiredConfig config = loader.load(configDir);

        assertThat(config.connections()).isEmpty();
        assertThat(config.projects()).isEmpty();
        assertThat(config.folders()).isEmpty();
        assertThat(config.hasRoles()).isFalse();
        assertThat(config.hasOidc()).isFalse();
    }

    @Test
    void missingDirectoryIsAnError() {
        assertThatThrownBy(() -> loader.load(configDir.resolve("nope")))
            .isInstanceOf(ConfigLoadException.class)
            .hasMessageContaining("Config directory not found");
    }

    @Test
    void connectionSecretsBecomePointersAndLiteralsAreDropped() throws IOException {
        write(
            DesiredConfigLoader.CONNECTIONS_FILE,
            """
            - name: warehouse
              host: db.internal
              port: 5432
              dialect_name: postgres
              password_env_var: WAREHOUSE_PASSWORD
              certificate: literal-should-not-survive
            """
        );

        DesiredResource connection = loader.load(configDir).connections().get(0);

        assertThat(connection.name()).isEqualTo("warehouse");
        assertThat(connection.fields()).containsEntry("host", "db.internal").containsEntry("port", 5432);
        assertThat(connection.fields()).doesNotContainKeys("password_env_var", "certificate");
        assertThat(connection.secrets()).containsEntry("password", new SecretRef("WAREHOUSE_PASSWORD"));
    }

    @Test
    void projectsCarryTheirModels() throws IOException {
        write(
            DesiredConfigLoader.PROJECTS_FILE,
            """
            projects:
              - name: analytics
                models:
                  - model_name: sales
                    connection_names: [warehouse, replica]
            """
        );

        DesiredConfig config = loader.load(configDir);

        assertThat(config.projects()).extracting(ProjectSpec::name).containsExactly("analytics");
        DesiredResource model = config.models().get(0);
        assertThat(model.name()).isEqualTo("sales");
        assertThat(model.fields())
            .containsEntry("project_name", "analytics")
            .containsEntry("allowed_db_connection_names", List.of("warehouse", "replica"));
    }

    @Test
    void onlyKeysPresentInRolesFileAreDeclared() throws IOException {
        write(
            DesiredConfigLoader.ROLES_FILE,
            """
            permission_sets:
              - name: Analyst Permissions
                permissions: [access_data, see_looks]
            roles:
              - name: Analyst
                permission_set: Analyst Permissions
                model_set: All
            """
        );

        RoleSection roles = loader.load(configDir).roles();

        assertThat(roles.declares(ResourceKind.PERMISSION_SET)).isTrue();
        assertThat(roles.declares(ResourceKind.ROLE)).isTrue();
        assertThat(roles.declares(ResourceKind.MODEL_SET)).isFalse();
        assertThat(roles.roles().get(0).fields()).containsEntry("permission_set", "Analyst Permissions").containsEntry("model_set", "All");
    }

    @Test
    void folderAccessDefaultsToView() throws IOException {
        write(
            DesiredConfigLoader.FOLDERS_FILE,
            """
            folders:
              - name: Sales
                access:
                  - group: Sales Team
                  - user: ana@example.com
                    permission: EDIT
              - name: Pipeline
                parent: Sales
            """
        );

        List<FolderSpec> folders = loader.load(configDir).folders();

        assertThat(folders.get(0).parent()).isNull();
        assertThat(folders.get(0).access())
            .containsExactly(
                new DesiredAccessEntry(PrincipalType.GROUP, "Sales Team", "view"),
                new DesiredAccessEntry(PrincipalType.USER, "ana@example.com", "edit")
            );
        assertThat(folders.get(1).parent()).isEqualTo("Sales");
    }

    @Test
    void accessEntryNamingBothPrincipalsIsRejected() throws IOException {
        write(
            DesiredConfigLoader.FOLDERS_FILE,
            """
            folders:
              - name: Sales
                access:
                  - group: Sales Team
                    user: ana@example.com
            """
        );

        assertThatThrownBy(() -> loader.load(configDir))
            .isInstanceOf(ConfigLoadException.class)
            .hasMessageContaining("exactly one of 'group' or 'user'");
    }

    @Test
    void oidcFileIsMappedOntoBackendFields() throws IOException {
        write(
            DesiredConfigLoader.OIDC_FILE,
            """
            client_id: looker-client
            client_secret_env_var: OIDC_SECRET
            display_name: Corporate SSO
            issuer: https://idp.example.com
            scopes: [openid, email]
            user_attribute_map:
              email: mail
              first_name: given_name
            mirrored_groups:
              - name: Analysts
                roles: [Analyst]
            """
        );

        OidcSpec oidc = loader.load(configDir).oidc();

        assertThat(oidc.settings().name()).isEqualTo(DesiredResourceMapper.OIDC_NAME);
        assertThat(oidc.settings().fields())
            .containsEntry("identifier", "looker-client")
            .containsEntry("issuer", "https://idp.example.com")
            .containsEntry("user_attribute_map_email", "mail")
            .containsEntry("user_attribute_map_first_name", "given_name")
            .doesNotContainKeys("display_name", "client_id", "client_secret_env_var");
        assertThat(oidc.settings().secrets()).containsEntry("secret", new SecretRef("OIDC_SECRET"));
        assertThat(oidc.mirroredGroups()).containsExactly(new MirroredGroup(null, "Analysts", List.of("Analyst")));
    }

    @Test
    void oidcWithoutMirroredGroupsLeavesThemUnmanaged() throws IOException {
        write(DesiredConfigLoader.OIDC_FILE, "client_id: looker-client\n");

        assertThat(loader.load(configDir).oidc().declaresGroups()).isFalse();
    }

    @Test
    void malformedYamlIsALoadError() throws IOException {
        write(DesiredConfigLoader.CONNECTIONS_FILE, "- name: [unterminated\n");

        assertThatThrownBy(() -> loader.load(configDir))
            .isInstanceOf(ConfigLoadException.class)
            .hasMessageStartingWith("Cannot read connections.yaml");
    }

    @Test
    void entryWithoutNameIsALoadError() throws IOException {
        write(DesiredConfigLoader.CONNECTIONS_FILE, "- host: db.internal\n");

        assertThatThrownBy(() -> loader.load(configDir)).isInstanceOf(ConfigLoadException.class).hasMessageContaining("without 'name'");
    }

    private void write(String fileName, String content) throws IOException {
        Files.writeString(configDir.resolve(fileName), content);
    }
}
