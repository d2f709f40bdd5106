package com.yuzhi.dts.iac.service.diff;

import static com.yuzhi.dts.iac.domain.FieldType.NUMERIC;
import static com.yuzhi.dts.iac.domain.FieldType.SCALAR;
import static com.yuzhi.dts.iac.domain.FieldType.UNORDERED_LIST;

import com.yuzhi.dts.iac.domain.FieldType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static per-kind field schemas.
 */
public final class ResourceSchemas {

    private static final Map<ResourceKind, ResourceSchema> SCHEMAS = new EnumMap<>(ResourceKind.class);

    static {
        Map<String, FieldType> connection = new LinkedHashMap<>();
        connection.put("host", SCALAR);
        connection.put("port", NUMERIC);
        connection.put("database", SCALAR);
        connection.put("schema", SCALAR);
        connection.put("dialect_name", SCALAR);
        connection.put("username", SCALAR);
        connection.put("ssl", SCALAR);
        connection.put("verify_ssl", SCALAR);
        connection.put("tmp_db_name", SCALAR);
        connection.put("jdbc_additional_params", SCALAR);
        connection.put("max_connections", NUMERIC);
        connection.put("pool_timeout", NUMERIC);
        connection.put("uses_application_default_credentials", SCALAR);
        connection.put("db_timezone", SCALAR);
        connection.put("query_timezone", SCALAR);
        register(
            new ResourceSchema(ResourceKind.CONNECTION, connection, Set.of("password", "certificate", "created_at", "user_id", "example"))
        );

        register(new ResourceSchema(ResourceKind.PROJECT, Map.of(), Set.of()));

        Map<String, FieldType> model = new LinkedHashMap<>();
        model.put("project_name", SCALAR);
        model.put("allowed_db_connection_names", UNORDERED_LIST);
        register(new ResourceSchema(ResourceKind.LOOKML_MODEL, model, Set.of()));

        register(new ResourceSchema(ResourceKind.PERMISSION_SET, Map.of("permissions", UNORDERED_LIST), Set.of()));
        register(new ResourceSchema(ResourceKind.MODEL_SET, Map.of("models", UNORDERED_LIST), Set.of()));
        register(new ResourceSchema(ResourceKind.ROLE, Map.of("permission_set", SCALAR, "model_set", SCALAR), Set.of()));
        register(new ResourceSchema(ResourceKind.FOLDER, Map.of(), Set.of()));

        Map<String, FieldType> oidc = new LinkedHashMap<>();
        oidc.put("identifier", SCALAR);
        oidc.put("audience", SCALAR);
        oidc.put("issuer", SCALAR);
        oidc.put("authorization_endpoint", SCALAR);
        oidc.put("token_endpoint", SCALAR);
        oidc.put("userinfo_endpoint", SCALAR);
        oidc.put("groups_attribute", SCALAR);
        oidc.put("enabled", SCALAR);
        oidc.put("set_roles_from_groups", SCALAR);
        oidc.put("auth_requires_role", SCALAR);
        oidc.put("alternate_email_login_allowed", SCALAR);
        oidc.put("new_user_migration_types", SCALAR);
        oidc.put("user_attribute_map_email", SCALAR);
        oidc.put("user_attribute_map_first_name", SCALAR);
        oidc.put("user_attribute_map_last_name", SCALAR);
        oidc.put("scopes", UNORDERED_LIST);
        register(new ResourceSchema(ResourceKind.OIDC_CONFIG, oidc, Set.of("secret", "url", "can", "modified_at", "modified_by")));
    }

    private ResourceSchemas() {}

    private static void register(ResourceSchema schema) {
        SCHEMAS.put(schema.kind(), schema);
    }

    public static ResourceSchema forKind(ResourceKind kind) {
        ResourceSchema schema = SCHEMAS.get(kind);
        if (schema == null) {
            throw new IllegalArgumentException("No schema declared for " + kind);
        }
        return schema;
    }
}
