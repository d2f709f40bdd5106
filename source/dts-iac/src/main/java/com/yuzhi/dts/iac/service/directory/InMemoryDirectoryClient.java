package com.yuzhi.dts.iac.service.directory;

import com.yuzhi.dts.iac.domain.AccessEntry;
import com.yuzhi.dts.iac.domain.ContainerInfo;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Backend kept entirely in memory. Behaves like the real directory where it matters to reconciliation: connections,
 * projects and models are keyed by name, write-only secrets are never read back, breaking inheritance materializes
 * the parent's entries, projects and models are only reachable in the development workspace.
 * Every mutation is appended to an ordered log.
 */
@Service
@ConditionalOnProperty(prefix = "dts.iac.backend", name = "mode", havingValue = "in-memory")
public class InMemoryDirectoryClient implements DirectoryClient {

    public static final String ROOT_CONTAINER_ID = "1";
    public static final String ROOT_CONTAINER_NAME = "Shared";
    public static final String EMBED_ROOT_CONTAINER_ID = "cm_embed:1";
    public static final String EMBED_ROOT_CONTAINER_NAME = "Embed";
    public static final String PRODUCTION_WORKSPACE = "production";
    public static final String DEVELOPMENT_WORKSPACE = "dev";
    public static final String OIDC_ID = "oidc";

    private static final Set<String> WRITE_ONLY_FIELDS = Set.of("password", "certificate", "secret");
    private static final Set<ResourceKind> NAME_KEYED = EnumSet.of(
        ResourceKind.CONNECTION,
        ResourceKind.PROJECT,
        ResourceKind.LOOKML_MODEL
    );
    private static final Set<ResourceKind> WORKSPACE_BOUND = EnumSet.of(ResourceKind.PROJECT, ResourceKind.LOOKML_MODEL);

    private final AtomicLong sequence = new AtomicLong(100);
    private final Map<ResourceKind, Map<String, LiveResource>> resources = new EnumMap<>(ResourceKind.class);
    private final Map<String, Map<String, Object>> writeOnlyValues = new LinkedHashMap<>();
    private final Map<String, Container> containers = new LinkedHashMap<>();
    private final Map<String, AccessEntry> accessEntries = new LinkedHashMap<>();
    private final Map<String, String> groups = new LinkedHashMap<>();
    private final Map<String, String> users = new LinkedHashMap<>();
    private final Set<String> permissions = new LinkedHashSet<>();
    private final List<String> mutations = new ArrayList<>();
    private final Set<ResourceKind> failingListings = EnumSet.noneOf(ResourceKind.class);
    private final Set<String> failingMutations = new HashSet<>();
    private String workspace = PRODUCTION_WORKSPACE;

    public InMemoryDirectoryClient() {
        for (ResourceKind kind : ResourceKind.values()) {
            resources.put(kind, new LinkedHashMap<>());
        }
        containers.put(ROOT_CONTAINER_ID, new Container(ROOT_CONTAINER_ID, ROOT_CONTAINER_NAME, null, false));
        containers.put(EMBED_ROOT_CONTAINER_ID, new Container(EMBED_ROOT_CONTAINER_ID, EMBED_ROOT_CONTAINER_NAME, null, false));
    }

    // ---- Seeding and inspection ----

    public String seed(ResourceKind kind, String name, Map<String, Object> fields) {
        String id = NAME_KEYED.contains(kind) ? name : nextId();
        if (kind == ResourceKind.OIDC_CONFIG) {
            id = OIDC_ID;
        }
        store(kind, id, name, fields);
        return id;
    }

    public String seedContainer(String name, String parentId, boolean inherits) {
        String id = nextId();
        containers.put(id, new Container(id, name, parentId, inherits));
        return id;
    }

    public String seedAccessEntry(String containerId, PrincipalType type, String principalId, String permission) {
        String id = nextId();
        accessEntries.put(id, new AccessEntry(id, containerId, type, principalId, permission));
        return id;
    }

    public String addGroup(String name) {
        return groups.computeIfAbsent(name, key -> nextId());
    }

    public String addUser(String email) {
        return users.computeIfAbsent(email.toLowerCase(Locale.ROOT), key -> nextId());
    }

    public void registerPermissions(String... names) {
        permissions.addAll(List.of(names));
    }

    public void failListing(ResourceKind kind) {
        failingListings.add(kind);
    }

    /** Every mutation touching the given entity name (or id) of the kind is rejected. */
    public void failMutations(ResourceKind kind, String nameOrId) {
        failingMutations.add(kind + "/" + nameOrId);
    }

    public List<String> getMutations() {
        return List.copyOf(mutations);
    }

    public void clearMutations() {
        mutations.clear();
    }

    public Optional<LiveResource> findByName(ResourceKind kind, String name) {
        return resources.get(kind).values().stream().filter(r -> Objects.equals(r.name(), name)).findFirst();
    }

    public Object writeOnlyValue(ResourceKind kind, String id, String field) {
        Map<String, Object> values = writeOnlyValues.get(kind + "/" + id);
        return values == null ? null : values.get(field);
    }

    public List<AccessEntry> effectiveAccess(String containerId) {
        Container container = containers.get(containerId);
        if (container == null) {
            return List.of();
        }
        if (container.inherits && container.parentId != null) {
            return effectiveAccess(container.parentId);
        }
        return ownEntries(containerId);
    }

    // ---- Generic resources ----

    @Override
    public List<LiveResource> listAll(ResourceKind kind) {
        checkListing(kind);
        return List.copyOf(resources.get(kind).values());
    }

    @Override
    public Optional<LiveResource> get(ResourceKind kind, String id) {
        checkListing(kind);
        return Optional.ofNullable(resources.get(kind).get(id));
    }

    @Override
    public String create(ResourceKind kind, Map<String, Object> payload) {
        String name = Objects.toString(payload.get("name"), "");
        checkMutation(kind, name, null);
        if (kind == ResourceKind.OIDC_CONFIG) {
            throw new DirectoryMutationException("OIDC configuration is a singleton and cannot be created");
        }
        if (StringUtils.isBlank(name)) {
            throw new DirectoryMutationException("Cannot create " + kind.getDisplayName() + " without a name");
        }
        if (findByName(kind, name).isPresent()) {
            throw new DirectoryMutationException(kind.getDisplayName() + " '" + name + "' already exists");
        }
        String id = NAME_KEYED.contains(kind) ? name : nextId();
        store(kind, id, name, payload);
        mutations.add("create " + kind + " " + name);
        return id;
    }

    @Override
    public void update(ResourceKind kind, String id, Map<String, Object> payload) {
        LiveResource existing = resources.get(kind).get(id);
        if (existing == null) {
            throw new DirectoryMutationException(kind.getDisplayName() + " not found: " + id);
        }
        checkMutation(kind, existing.name(), id);
        Map<String, Object> merged = new LinkedHashMap<>(existing.fields());
        Map<String, Object> secrets = writeOnlyValues.get(kind + "/" + id);
        if (secrets != null) {
            merged.putAll(secrets);
        }
        merged.putAll(payload);
        String name = existing.name();
        store(kind, id, name, merged);
        mutations.add("update " + kind + " " + name);
    }

    @Override
    public void delete(ResourceKind kind, String id) {
        LiveResource existing = resources.get(kind).get(id);
        if (existing == null) {
            throw new DirectoryMutationException(kind.getDisplayName() + " not found: " + id);
        }
        checkMutation(kind, existing.name(), id);
        if (kind == ResourceKind.PERMISSION_SET || kind == ResourceKind.MODEL_SET) {
            String refField = kind == ResourceKind.PERMISSION_SET ? "permission_set_id" : "model_set_id";
            boolean referenced = resources
                .get(ResourceKind.ROLE)
                .values()
                .stream()
                .anyMatch(role -> Objects.equals(String.valueOf(role.field(refField)), id));
            if (referenced) {
                throw new DirectoryMutationException(kind.getDisplayName() + " '" + existing.name() + "' is still referenced by a role");
            }
        }
        resources.get(kind).remove(id);
        writeOnlyValues.remove(kind + "/" + id);
        mutations.add("delete " + kind + " " + existing.name());
    }

    // ---- Containers ----

    @Override
    public Optional<ContainerInfo> getContainer(String containerId) {
        checkListing(ResourceKind.FOLDER);
        Container container = containers.get(containerId);
        return container == null ? Optional.empty() : Optional.of(container.toInfo());
    }

    @Override
    public Optional<ContainerInfo> findChildContainer(String parentId, String name) {
        checkListing(ResourceKind.FOLDER);
        return containers
            .values()
            .stream()
            .filter(c -> Objects.equals(c.parentId, parentId) && Objects.equals(c.name, name))
            .map(Container::toInfo)
            .findFirst();
    }

    @Override
    public Optional<ContainerInfo> searchContainer(String name) {
        checkListing(ResourceKind.FOLDER);
        return containers.values().stream().filter(c -> Objects.equals(c.name, name)).map(Container::toInfo).findFirst();
    }

    @Override
    public ContainerInfo createContainer(String name, String parentId) {
        checkMutation(ResourceKind.FOLDER, name, null);
        if (!containers.containsKey(parentId)) {
            throw new DirectoryMutationException("Parent folder not found: " + parentId);
        }
        String id = nextId();
        Container container = new Container(id, name, parentId, true);
        containers.put(id, container);
        mutations.add("createFolder " + name);
        return container.toInfo();
    }

    @Override
    public List<AccessEntry> listAccessEntries(String containerId) {
        checkListing(ResourceKind.FOLDER);
        requireContainer(containerId);
        return ownEntries(containerId);
    }

    @Override
    public String addAccessEntry(String containerId, PrincipalType principalType, String principalId, String permission) {
        Container container = requireContainer(containerId);
        checkMutation(ResourceKind.FOLDER, container.name, containerId);
        if (container.inherits) {
            throw new DirectoryMutationException("Folder '" + container.name + "' inherits its access; break inheritance first");
        }
        boolean duplicate = ownEntries(containerId)
            .stream()
            .anyMatch(e -> e.principalType() == principalType && Objects.equals(e.principalId(), principalId));
        if (duplicate) {
            throw new DirectoryMutationException("Access for " + principalType.label() + " " + principalId + " already exists");
        }
        String id = nextId();
        accessEntries.put(id, new AccessEntry(id, containerId, principalType, principalId, permission));
        mutations.add("addAccess " + container.name + " " + principalType.label() + " " + principalId + " " + permission);
        return id;
    }

    @Override
    public void updateAccessEntry(String entryId, String permission) {
        AccessEntry existing = accessEntries.get(entryId);
        if (existing == null) {
            throw new DirectoryMutationException("Access entry not found: " + entryId);
        }
        Container container = requireContainer(existing.containerId());
        checkMutation(ResourceKind.FOLDER, container.name, container.id);
        accessEntries.put(
            entryId,
            new AccessEntry(entryId, existing.containerId(), existing.principalType(), existing.principalId(), permission)
        );
        mutations.add(
            "updateAccess " + container.name + " " + existing.principalType().label() + " " + existing.principalId() + " " + permission
        );
    }

    @Override
    public void removeAccessEntry(String entryId) {
        AccessEntry existing = accessEntries.get(entryId);
        if (existing == null) {
            throw new DirectoryMutationException("Access entry not found: " + entryId);
        }
        Container container = requireContainer(existing.containerId());
        checkMutation(ResourceKind.FOLDER, container.name, container.id);
        accessEntries.remove(entryId);
        mutations.add("removeAccess " + container.name + " " + existing.principalType().label() + " " + existing.principalId());
    }

    @Override
    public void setInheritance(String containerId, boolean inherits) {
        Container container = requireContainer(containerId);
        checkMutation(ResourceKind.FOLDER, container.name, containerId);
        if (container.inherits == inherits) {
            return;
        }
        if (!inherits) {
            List<AccessEntry> inherited = container.parentId == null ? List.of() : effectiveAccess(container.parentId);
            for (AccessEntry entry : inherited) {
                String id = nextId();
                accessEntries.put(id, new AccessEntry(id, containerId, entry.principalType(), entry.principalId(), entry.permission()));
            }
        } else {
            accessEntries.values().removeIf(e -> Objects.equals(e.containerId(), containerId));
        }
        container.inherits = inherits;
        mutations.add("setInheritance " + container.name + " " + inherits);
    }

    // ---- Principals ----

    @Override
    public Optional<String> findGroupId(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    @Override
    public Optional<String> findUserId(String email) {
        return Optional.ofNullable(email == null ? null : users.get(email.toLowerCase(Locale.ROOT)));
    }

    // ---- Session ----

    @Override
    public String currentWorkspace() {
        return workspace;
    }

    @Override
    public void switchWorkspace(String workspaceId) {
        if (!PRODUCTION_WORKSPACE.equals(workspaceId) && !DEVELOPMENT_WORKSPACE.equals(workspaceId)) {
            throw new DirectoryMutationException("Unknown workspace: " + workspaceId);
        }
        workspace = workspaceId;
        mutations.add("switchWorkspace " + workspaceId);
    }

    @Override
    public Set<String> listPermissionNames() {
        return Set.copyOf(permissions);
    }

    // ---- Internals ----

    private void store(ResourceKind kind, String id, String name, Map<String, Object> fields) {
        Map<String, Object> visible = new LinkedHashMap<>();
        Map<String, Object> hidden = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (WRITE_ONLY_FIELDS.contains(key)) {
                hidden.put(key, value);
            } else {
                visible.put(key, value);
            }
        });
        visible.put("name", name);
        resources.get(kind).put(id, new LiveResource(id, name, visible));
        if (!hidden.isEmpty()) {
            writeOnlyValues.put(kind + "/" + id, hidden);
        }
    }

    private List<AccessEntry> ownEntries(String containerId) {
        return accessEntries.values().stream().filter(e -> Objects.equals(e.containerId(), containerId)).toList();
    }

    private Container requireContainer(String containerId) {
        Container container = containers.get(containerId);
        if (container == null) {
            throw new DirectoryMutationException("Folder not found: " + containerId);
        }
        return container;
    }

    private void checkListing(ResourceKind kind) {
        if (failingListings.contains(kind)) {
            throw new DirectoryFetchException("Listing " + kind.getDisplayName() + " failed");
        }
        if (kind == ResourceKind.PROJECT && !DEVELOPMENT_WORKSPACE.equals(workspace)) {
            throw new DirectoryFetchException("Projects are only visible in the development workspace");
        }
    }

    private void checkMutation(ResourceKind kind, String name, String id) {
        if (failingMutations.contains(kind + "/" + name) || (id != null && failingMutations.contains(kind + "/" + id))) {
            throw new DirectoryMutationException("Backend rejected change to " + kind.getDisplayName() + " '" + name + "'");
        }
        if (WORKSPACE_BOUND.contains(kind) && !DEVELOPMENT_WORKSPACE.equals(workspace)) {
            throw new DirectoryMutationException(kind.getDisplayName() + " changes require the development workspace");
        }
    }

    private String nextId() {
        return String.valueOf(sequence.incrementAndGet());
    }

    private static final class Container {

        private final String id;
        private final String name;
        private final String parentId;
        private boolean inherits;

        private Container(String id, String name, String parentId, boolean inherits) {
            this.id = id;
            this.name = name;
            this.parentId = parentId;
            this.inherits = inherits;
        }

        private ContainerInfo toInfo() {
            return new ContainerInfo(id, name, parentId, inherits);
        }
    }
}
