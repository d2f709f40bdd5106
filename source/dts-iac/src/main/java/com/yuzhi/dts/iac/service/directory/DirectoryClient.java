package com.yuzhi.dts.iac.service.directory;

import com.yuzhi.dts.iac.domain.AccessEntry;
import com.yuzhi.dts.iac.domain.ContainerInfo;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.PrincipalType;
import com.yuzhi.dts.iac.domain.ResourceKind;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port to the backend directory service. Listing failures surface as {@link DirectoryFetchException}, mutation
 * failures as {@link DirectoryMutationException}. Payload field names are the backend's.
 */
public interface DirectoryClient {

    List<LiveResource> listAll(ResourceKind kind);

    Optional<LiveResource> get(ResourceKind kind, String id);

    /**
     * Create an entity and return the id assigned by the backend.
     */
    String create(ResourceKind kind, Map<String, Object> payload);

    void update(ResourceKind kind, String id, Map<String, Object> payload);

    void delete(ResourceKind kind, String id);

    // ---- Containers ----

    Optional<ContainerInfo> getContainer(String containerId);

    /** Exact-name lookup among the direct children of a container. */
    Optional<ContainerInfo> findChildContainer(String parentId, String name);

    /** Global lookup by name, first match wins. */
    Optional<ContainerInfo> searchContainer(String name);

    ContainerInfo createContainer(String name, String parentId);

    List<AccessEntry> listAccessEntries(String containerId);

    String addAccessEntry(String containerId, PrincipalType principalType, String principalId, String permission);

    void updateAccessEntry(String entryId, String permission);

    void removeAccessEntry(String entryId);

    /**
     * Toggle inheritance. Breaking inheritance materializes copies of the parent's entries on the container.
     */
    void setInheritance(String containerId, boolean inherits);

    // ---- Principals ----

    Optional<String> findGroupId(String name);

    Optional<String> findUserId(String email);

    // ---- Session ----

    String currentWorkspace();

    void switchWorkspace(String workspaceId);

    /** Names of every permission the backend knows. */
    Set<String> listPermissionNames();
}
