package com.yuzhi.dts.iac.service.validation;

import com.yuzhi.dts.iac.config.IacProperties;
import com.yuzhi.dts.iac.domain.AccessKey;
import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.access.FolderReconciler;
import com.yuzhi.dts.iac.service.config.DesiredConfig;
import com.yuzhi.dts.iac.service.config.FolderSpec;
import com.yuzhi.dts.iac.service.config.ProjectSpec;
import com.yuzhi.dts.iac.service.config.RoleSection;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import com.yuzhi.dts.iac.service.directory.DirectoryFetchException;
import com.yuzhi.dts.iac.service.directory.PrincipalDirectory;
import com.yuzhi.dts.iac.service.protection.ProtectionPolicy;
import com.yuzhi.dts.iac.service.role.RoleSetReconciler;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cross-reference checks over the whole desired config. Runs before any diff so a broken reference can never leave
 * the backend half applied. Checks that need live data are skipped with a warning when the data cannot be read.
 */
@Component
public class DesiredConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(DesiredConfigValidator.class);

    private static final Set<String> ACCESS_PERMISSIONS = Set.of("view", "edit");

    private final DirectoryClient client;
    private final ProtectionPolicy protectionPolicy;
    private final IacProperties properties;

    public DesiredConfigValidator(DirectoryClient client, ProtectionPolicy protectionPolicy, IacProperties properties) {
        this.client = client;
        this.protectionPolicy = protectionPolicy;
        this.properties = properties;
    }

    /**
     * @throws ConfigValidationException listing every problem, when there is at least one
     */
    public void validate(DesiredConfig config, PrincipalDirectory principals) {
        List<String> errors = new ArrayList<>();
        checkUniqueNames(config, errors);
        if (config.hasRoles()) {
            checkPermissions(config.roles(), errors);
            checkRoleReferences(config.roles(), errors);
        }
        if (config.hasOidc() && config.oidc().declaresGroups()) {
            checkOidcRoles(config, errors);
        }
        checkModelConnections(config, errors);
        checkFolderParents(config.folders(), errors);
        checkFolderAccess(config.folders(), principals, errors);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
        LOG.info("Configuration validation passed");
    }

    private void checkUniqueNames(DesiredConfig config, List<String> errors) {
        duplicates(ResourceKind.CONNECTION, config.connections(), DesiredResource::name, errors);
        duplicates(ResourceKind.PROJECT, config.projects(), ProjectSpec::name, errors);
        duplicates(ResourceKind.LOOKML_MODEL, config.models(), DesiredResource::name, errors);
        if (config.hasRoles()) {
            duplicates(ResourceKind.PERMISSION_SET, config.roles().permissionSets(), DesiredResource::name, errors);
            duplicates(ResourceKind.MODEL_SET, config.roles().modelSets(), DesiredResource::name, errors);
            duplicates(ResourceKind.ROLE, config.roles().roles(), DesiredResource::name, errors);
        }
        duplicates(ResourceKind.FOLDER, config.folders(), folder -> FolderReconciler.parentName(folder) + "/" + folder.name(), errors);
    }

    private void checkPermissions(RoleSection roles, List<String> errors) {
        if (roles.permissionSets().isEmpty()) {
            return;
        }
        Set<String> catalog;
        try {
            catalog = client.listPermissionNames();
        } catch (DirectoryFetchException ex) {
            LOG.warn("Skipping permission validation, catalog unavailable: {}", ex.getMessage());
            return;
        }
        if (catalog.isEmpty()) {
            LOG.warn("Skipping permission validation, backend reported an empty permission catalog");
            return;
        }
        for (DesiredResource set : roles.permissionSets()) {
            for (Object permission : asCollection(set.field("permissions"))) {
                if (!catalog.contains(String.valueOf(permission))) {
                    errors.add("Invalid permission '" + permission + "' in Permission Set '" + set.name() + "'");
                }
            }
        }
    }

    private void checkRoleReferences(RoleSection roles, List<String> errors) {
        Set<String> permissionSets = names(roles.permissionSets());
        Set<String> modelSets = names(roles.modelSets());
        for (DesiredResource role : roles.roles()) {
            if (ProtectionPolicy.SUPER_ADMIN_ROLE.equals(role.name())) {
                continue;
            }
            checkReference(role, RoleSetReconciler.PERMISSION_SET_FIELD, ResourceKind.PERMISSION_SET, permissionSets, errors);
            checkReference(role, RoleSetReconciler.MODEL_SET_FIELD, ResourceKind.MODEL_SET, modelSets, errors);
        }
    }

    private void checkReference(DesiredResource role, String field, ResourceKind kind, Set<String> defined, List<String> errors) {
        Object target = role.field(field);
        if (target == null) {
            errors.add("Role '" + role.name() + "' has no " + kind.getDisplayName());
            return;
        }
        String name = target.toString();
        if (!defined.contains(name) && !protectionPolicy.isBuiltIn(kind, name)) {
            errors.add("Role '" + role.name() + "' references undefined " + kind.getDisplayName() + " '" + name + "'");
        }
    }

    private void checkOidcRoles(DesiredConfig config, List<String> errors) {
        Set<String> known;
        try {
            known = client.listAll(ResourceKind.ROLE).stream().map(LiveResource::name).collect(Collectors.toCollection(HashSet::new));
        } catch (DirectoryFetchException ex) {
            LOG.warn("Skipping OIDC role validation, roles unavailable: {}", ex.getMessage());
            return;
        }
        if (config.hasRoles()) {
            known.addAll(names(config.roles().roles()));
        }
        for (MirroredGroup group : config.oidc().mirroredGroups()) {
            for (String role : group.roles()) {
                if (!known.contains(role)) {
                    errors.add("OIDC Group '" + group.name() + "' references unknown Role '" + role + "'");
                }
            }
        }
    }

    private void checkModelConnections(DesiredConfig config, List<String> errors) {
        List<DesiredResource> models = config.models();
        if (models.isEmpty()) {
            return;
        }
        Set<String> known = names(config.connections());
        try {
            client.listAll(ResourceKind.CONNECTION).forEach(connection -> known.add(connection.name()));
        } catch (DirectoryFetchException ex) {
            LOG.warn("Skipping model connection validation, connections unavailable: {}", ex.getMessage());
            return;
        }
        for (DesiredResource model : models) {
            for (Object connection : asCollection(model.field("allowed_db_connection_names"))) {
                if (!known.contains(String.valueOf(connection))) {
                    errors.add("Model '" + model.name() + "' references unknown Connection '" + connection + "'");
                }
            }
        }
    }

    private void checkFolderAccess(List<FolderSpec> folders, PrincipalDirectory principals, List<String> errors) {
        boolean strict = properties.getValidation().isStrictPrincipals();
        for (FolderSpec folder : folders) {
            Map<Object, DesiredAccessEntry> seen = new HashMap<>();
            for (DesiredAccessEntry entry : folder.access()) {
                String principal = entry.principalType().label() + " '" + entry.principalName() + "'";
                if (!ACCESS_PERMISSIONS.contains(entry.permission())) {
                    errors.add("Folder '" + folder.name() + "' grants unknown permission '" + entry.permission() + "' to " + principal);
                }
                Optional<AccessKey> resolved = principals.resolve(entry);
                Object identity = resolved.isPresent() ? resolved.get() : nameKey(entry);
                DesiredAccessEntry first = seen.putIfAbsent(identity, entry);
                if (first != null) {
                    errors.add(duplicateMessage(folder, first, entry, principal));
                    continue;
                }
                if (strict && resolved.isEmpty()) {
                    errors.add("Folder '" + folder.name() + "' references unknown " + principal);
                }
            }
        }
    }

    private void checkFolderParents(List<FolderSpec> folders, List<String> errors) {
        Map<String, Long> definitions = folders
            .stream()
            .collect(Collectors.groupingBy(FolderSpec::name, Collectors.counting()));
        for (FolderSpec folder : folders) {
            String parent = folder.parent();
            if (parent != null && definitions.getOrDefault(parent, 0L) > 1) {
                errors.add("Folder '" + folder.name() + "' has ambiguous parent '" + parent + "', defined more than once");
            }
        }
    }

    private static String nameKey(DesiredAccessEntry entry) {
        String name = entry.principalType() == PrincipalType.USER
            ? StringUtils.lowerCase(entry.principalName(), Locale.ROOT)
            : entry.principalName();
        return entry.principalType().label() + ":" + name;
    }

    private static String duplicateMessage(FolderSpec folder, DesiredAccessEntry first, DesiredAccessEntry entry, String principal) {
        if (Objects.equals(first.principalName(), entry.principalName())) {
            return "Folder '" + folder.name() + "' lists " + principal + " more than once";
        }
        return "Folder '" + folder.name() + "' lists " + principal + " and '" + first.principalName() + "', which are the same "
            + entry.principalType().label();
    }

    private static <T> void duplicates(ResourceKind kind, List<T> items, Function<T, String> name, List<String> errors) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new LinkedHashSet<>();
        for (T item : items) {
            String value = name.apply(item);
            if (!seen.add(value)) {
                reported.add(value);
            }
        }
        reported.forEach(value -> errors.add(kind.getDisplayName() + " '" + value + "' is defined more than once"));
    }

    private static Set<String> names(List<DesiredResource> resources) {
        return resources.stream().map(DesiredResource::name).filter(Objects::nonNull).collect(Collectors.toCollection(HashSet::new));
    }

    private static Collection<?> asCollection(Object value) {
        return value instanceof Collection<?> collection ? collection : List.of();
    }
}
