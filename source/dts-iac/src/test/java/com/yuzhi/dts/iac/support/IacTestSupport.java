package com.yuzhi.dts.iac.support;

import com.yuzhi.dts.iac.config.IacProperties;
import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.service.ReconciliationService;
import com.yuzhi.dts.iac.service.access.AccessReconciler;
import com.yuzhi.dts.iac.service.access.FolderReconciler;
import com.yuzhi.dts.iac.service.diff.ResourceDiffer;
import com.yuzhi.dts.iac.service.directory.InMemoryDirectoryClient;
import com.yuzhi.dts.iac.service.oidc.OidcGroupMirroring;
import com.yuzhi.dts.iac.service.protection.ProtectionPolicy;
import com.yuzhi.dts.iac.service.report.ChangeReportFormatter;
import com.yuzhi.dts.iac.service.role.RoleSetReconciler;
import com.yuzhi.dts.iac.service.secret.EnvironmentSecretResolver;
import com.yuzhi.dts.iac.service.validation.DesiredConfigValidator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.mock.env.MockEnvironment;

/**
 * The engine wired by hand against the in-memory backend.
 */
public class IacTestSupport {

    public final InMemoryDirectoryClient client = new InMemoryDirectoryClient();
    public final MockEnvironment environment = new MockEnvironment();
    public final IacProperties properties = new IacProperties();
    public final ProtectionPolicy protectionPolicy = new ProtectionPolicy();
    public final ResourceDiffer differ = new ResourceDiffer(new EnvironmentSecretResolver(environment));
    public final RoleSetReconciler roleSetReconciler = new RoleSetReconciler(client, differ, protectionPolicy);
    public final AccessReconciler accessReconciler = new AccessReconciler(client);
    public final FolderReconciler folderReconciler = new FolderReconciler(client, accessReconciler);
    public final OidcGroupMirroring groupMirroring = new OidcGroupMirroring();
    public final ChangeReportFormatter formatter = new ChangeReportFormatter();
    public final DesiredConfigValidator validator = new DesiredConfigValidator(client, protectionPolicy, properties);
    public final ReconciliationService reconciliationService = new ReconciliationService(
        client,
        validator,
        differ,
        roleSetReconciler,
        folderReconciler,
        groupMirroring,
        formatter,
        properties
    );

    public static DesiredResource permissionSet(String name, String... permissions) {
        return DesiredResource.of(name, Map.of("name", name, "permissions", List.of(permissions)));
    }

    public static DesiredResource modelSet(String name, String... models) {
        return DesiredResource.of(name, Map.of("name", name, "models", List.of(models)));
    }

    public static DesiredResource role(String name, String permissionSet, String modelSet) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("permission_set", permissionSet);
        fields.put("model_set", modelSet);
        return DesiredResource.of(name, fields);
    }

    public static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return fields;
    }
}
