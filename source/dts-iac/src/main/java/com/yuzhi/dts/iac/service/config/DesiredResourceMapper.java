package com.yuzhi.dts.iac.service.config;

import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.domain.SecretRef;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps parsed YAML trees onto desired resources with backend field names. Keys ending in {@code _env_var} become
 * secret pointers; literal secrets are dropped.
 */
@Component
public class DesiredResourceMapper {

    private static final Logger LOG = LoggerFactory.getLogger(DesiredResourceMapper.class);

    public static final String OIDC_NAME = "OIDC Configuration";

    static final String SECRET_SUFFIX = "_env_var";
    private static final Set<String> LITERAL_SECRETS = Set.of("password", "certificate", "client_secret", "secret");
    private static final Set<String> USER_ATTRIBUTES = Set.of("email", "first_name", "last_name");

    public List<DesiredResource> connections(Object raw, String source) {
        List<DesiredResource> resources = new ArrayList<>();
        for (Map<String, Object> item : listOfMaps(raw, source)) {
            String name = requireName(item, "name", source);
            Map<String, Object> fields = new LinkedHashMap<>();
            Map<String, SecretRef> secrets = new LinkedHashMap<>();
            item.forEach((key, value) -> {
                if (key.endsWith(SECRET_SUFFIX)) {
                    if (value != null) {
                        secrets.put(StringUtils.removeEnd(key, SECRET_SUFFIX), new SecretRef(value.toString()));
                    }
                } else if (LITERAL_SECRETS.contains(key)) {
                    LOG.warn("{}: literal '{}' of connection '{}' ignored, use '{}{}'", source, key, name, key, SECRET_SUFFIX);
                } else {
                    fields.put(key, value);
                }
            });
            resources.add(new DesiredResource(name, fields, secrets));
        }
        return resources;
    }

    public List<ProjectSpec> projects(Object raw, String source) {
        List<ProjectSpec> projects = new ArrayList<>();
        for (Map<String, Object> item : listOfMaps(section(raw, "projects", source), source)) {
            String name = requireName(item, "name", source);
            List<DesiredResource> models = new ArrayList<>();
            for (Map<String, Object> model : listOfMaps(item.get("models"), source)) {
                String modelName = requireName(model, "model_name", source);
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("name", modelName);
                fields.put("project_name", name);
                fields.put("allowed_db_connection_names", stringList(model.get("connection_names")));
                models.add(DesiredResource.of(modelName, fields));
            }
            projects.add(new ProjectSpec(DesiredResource.of(name, Map.of("name", name)), models));
        }
        return projects;
    }

    public RoleSection roles(Object raw, String source) {
        if (raw == null) {
            return null;
        }
        Map<String, Object> root = map(raw, source);
        Set<ResourceKind> declared = EnumSet.noneOf(ResourceKind.class);
        List<DesiredResource> permissionSets = new ArrayList<>();
        List<DesiredResource> modelSets = new ArrayList<>();
        List<DesiredResource> roles = new ArrayList<>();
        if (root.containsKey("permission_sets")) {
            declared.add(ResourceKind.PERMISSION_SET);
            for (Map<String, Object> item : listOfMaps(root.get("permission_sets"), source)) {
                permissionSets.add(named(item, source, "permissions", stringList(item.get("permissions"))));
            }
        }
        if (root.containsKey("model_sets")) {
            declared.add(ResourceKind.MODEL_SET);
            for (Map<String, Object> item : listOfMaps(root.get("model_sets"), source)) {
                modelSets.add(named(item, source, "models", stringList(item.get("models"))));
            }
        }
        if (root.containsKey("roles")) {
            declared.add(ResourceKind.ROLE);
            for (Map<String, Object> item : listOfMaps(root.get("roles"), source)) {
                String name = requireName(item, "name", source);
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("name", name);
                fields.put("permission_set", item.get("permission_set"));
                fields.put("model_set", item.get("model_set"));
                roles.add(DesiredResource.of(name, fields));
            }
        }
        if (declared.isEmpty()) {
            return null;
        }
        return new RoleSection(permissionSets, modelSets, roles, declared);
    }

    public List<FolderSpec> folders(Object raw, String source) {
        List<FolderSpec> folders = new ArrayList<>();
        for (Map<String, Object> item : listOfMaps(section(raw, "folders", source), source)) {
            String name = requireName(item, "name", source);
            List<DesiredAccessEntry> access = new ArrayList<>();
            for (Map<String, Object> entry : listOfMaps(item.get("access"), source)) {
                access.add(accessEntry(entry, name, source));
            }
            folders.add(new FolderSpec(name, Objects.toString(item.get("parent"), null), access));
        }
        return folders;
    }

    public OidcSpec oidc(Object raw, String source) {
        if (raw == null) {
            return null;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, SecretRef> secrets = new LinkedHashMap<>();
        List<MirroredGroup> groups = null;
        for (Map.Entry<String, Object> entry : map(raw, source).entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "client_id" -> fields.put("identifier", value);
                case "client_secret_env_var" -> {
                    if (value != null) {
                        secrets.put("secret", new SecretRef(value.toString()));
                    }
                }
                case "display_name" -> LOG.debug("{}: 'display_name' is not part of the OIDC configuration, ignored", source);
                case "user_attribute_map" -> map(value, source).forEach((attribute, mapped) -> {
                    if (USER_ATTRIBUTES.contains(attribute)) {
                        fields.put("user_attribute_map_" + attribute, mapped);
                    } else {
                        LOG.warn("{}: user attribute '{}' is not supported, ignored", source, attribute);
                    }
                });
                case "mirrored_groups" -> groups = mirroredGroups(value, source);
                default -> {
                    if (LITERAL_SECRETS.contains(key)) {
                        LOG.warn("{}: literal '{}' ignored, use 'client_secret_env_var'", source, key);
                    } else {
                        fields.put(key, value);
                    }
                }
            }
        }
        return new OidcSpec(new DesiredResource(OIDC_NAME, fields, secrets), groups);
    }

    private List<MirroredGroup> mirroredGroups(Object raw, String source) {
        List<MirroredGroup> groups = new ArrayList<>();
        for (Map<String, Object> item : listOfMaps(raw, source)) {
            groups.add(new MirroredGroup(null, requireName(item, "name", source), stringList(item.get("roles"))));
        }
        return groups;
    }

    private DesiredAccessEntry accessEntry(Map<String, Object> entry, String folder, String source) {
        Object group = entry.get("group");
        Object user = entry.get("user");
        if ((group == null) == (user == null)) {
            throw new ConfigLoadException(source + ": access entry of folder '" + folder + "' needs exactly one of 'group' or 'user'");
        }
        String permission = Objects.toString(entry.get("permission"), null);
        return group != null
            ? new DesiredAccessEntry(PrincipalType.GROUP, group.toString(), permission)
            : new DesiredAccessEntry(PrincipalType.USER, user.toString(), permission);
    }

    private static DesiredResource named(Map<String, Object> item, String source, String listField, List<String> values) {
        String name = requireName(item, "name", source);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put(listField, values);
        return DesiredResource.of(name, fields);
    }

    private static String requireName(Map<String, Object> item, String key, String source) {
        Object value = item.get(key);
        if (value == null || StringUtils.isBlank(value.toString())) {
            throw new ConfigLoadException(source + ": entry without '" + key + "': " + item);
        }
        return value.toString().trim();
    }

    private static Object section(Object raw, String key, String source) {
        if (raw == null) {
            return null;
        }
        return map(raw, source).get(key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object raw, String source) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?>)) {
            throw new ConfigLoadException(source + ": expected a mapping but found " + raw.getClass().getSimpleName());
        }
        return (Map<String, Object>) raw;
    }

    private static List<Map<String, Object>> listOfMaps(Object raw, String source) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Collection<?> items)) {
            throw new ConfigLoadException(source + ": expected a list but found " + raw.getClass().getSimpleName());
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : items) {
            result.add(map(item, source));
        }
        return result;
    }

    private static List<String> stringList(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        return List.of(raw.toString());
    }
}
