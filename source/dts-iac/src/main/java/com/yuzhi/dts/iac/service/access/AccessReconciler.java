package com.yuzhi.dts.iac.service.access;

import com.yuzhi.dts.iac.domain.AccessEntry;
import com.yuzhi.dts.iac.domain.AccessKey;
import com.yuzhi.dts.iac.domain.ContainerInfo;
import com.yuzhi.dts.iac.domain.DesiredAccessEntry;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import com.yuzhi.dts.iac.service.directory.DirectoryMutationException;
import com.yuzhi.dts.iac.service.directory.PrincipalDirectory;
import com.yuzhi.dts.iac.service.report.ApplyTally;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles the access list of one container. An inheriting container with desired entries has its inheritance
 * broken first; the backend then copies the parent's entries onto it and those copies are diffed like any other
 * live entries. An inheriting container with no desired entries keeps inheriting.
 */
@Component
public class AccessReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(AccessReconciler.class);

    private final DirectoryClient client;

    public AccessReconciler(DirectoryClient client) {
        this.client = client;
    }

    /**
     * Changes that reconciling {@code container} would make. For an inheriting container the post-break diff is
     * previewed against the parent's effective entries, which is what the backend will materialize.
     */
    public List<AccessChange> plan(ContainerInfo container, List<DesiredAccessEntry> desired, PrincipalDirectory principals) {
        if (container.inherits()) {
            if (desired.isEmpty()) {
                return List.of();
            }
            List<AccessChange> changes = new ArrayList<>();
            changes.add(AccessChange.breakInheritance());
            changes.addAll(diffEntries(effectiveEntries(container.parentId()), resolveTargets(desired, principals, container.name())));
            return changes;
        }
        return diffEntries(client.listAccessEntries(container.id()), resolveTargets(desired, principals, container.name()));
    }

    /**
     * Preview for a container that does not exist yet under {@code parentId}. A null parent means the parent is itself
     * created in this pass and starts out inheriting from its own parent; nothing is materialized from it then.
     */
    public List<AccessChange> planNew(String parentId, String name, List<DesiredAccessEntry> desired, PrincipalDirectory principals) {
        if (desired.isEmpty()) {
            return List.of();
        }
        List<AccessChange> changes = new ArrayList<>();
        changes.add(AccessChange.breakInheritance());
        List<AccessEntry> inherited = parentId == null ? List.of() : effectiveEntries(parentId);
        changes.addAll(diffEntries(inherited, resolveTargets(desired, principals, name)));
        return changes;
    }

    /**
     * Apply the desired access list to a container, re-reading live entries after any inheritance break. Each access
     * mutation is tallied on its own.
     */
    public void reconcile(String containerId, List<DesiredAccessEntry> desired, PrincipalDirectory principals, ApplyTally tally) {
        ContainerInfo container = client
            .getContainer(containerId)
            .orElseThrow(() -> new DirectoryMutationException("Folder not found: " + containerId));
        if (container.inherits()) {
            if (desired.isEmpty()) {
                return;
            }
            client.setInheritance(containerId, false);
            tally.success();
            LOG.info("Folder '{}': inheritance broken", container.name());
        }
        Map<AccessKey, DesiredAccessEntry> targets = resolveTargets(desired, principals, container.name());
        List<AccessChange> changes = diffEntries(client.listAccessEntries(containerId), targets);
        for (AccessChange change : changes) {
            try {
                execute(containerId, change);
                tally.success();
                LOG.info("Folder '{}': {}", container.name(), change.describe());
            } catch (RuntimeException ex) {
                LOG.error("Folder '{}': failed to {}: {}", container.name(), change.describe(), ex.getMessage());
                tally.failure("Folder '" + container.name() + "': " + change.describe() + ": " + ex.getMessage());
            }
        }
    }

    /**
     * Pure diff of live entries against resolved targets: differing permission updates, missing key adds, extra key
     * removes.
     */
    public static List<AccessChange> diffEntries(List<AccessEntry> live, Map<AccessKey, DesiredAccessEntry> targets) {
        Map<AccessKey, AccessEntry> current = new LinkedHashMap<>();
        for (AccessEntry entry : live) {
            current.putIfAbsent(entry.key(), entry);
        }
        List<AccessChange> changes = new ArrayList<>();
        targets.forEach((key, target) -> {
            AccessEntry existing = current.get(key);
            if (existing == null) {
                changes.add(AccessChange.add(key, target.principalName(), target.permission()));
            } else if (!Objects.equals(existing.permission(), target.permission())) {
                changes.add(
                    AccessChange.update(key, target.principalName(), existing.entryId(), existing.permission(), target.permission())
                );
            }
        });
        current.forEach((key, entry) -> {
            if (!targets.containsKey(key)) {
                changes.add(AccessChange.remove(key, entry.entryId(), entry.permission()));
            }
        });
        return changes;
    }

    Map<AccessKey, DesiredAccessEntry> resolveTargets(List<DesiredAccessEntry> desired, PrincipalDirectory principals, String folderName) {
        Map<AccessKey, DesiredAccessEntry> targets = new LinkedHashMap<>();
        for (DesiredAccessEntry entry : desired) {
            Optional<AccessKey> key = principals.resolve(entry);
            if (key.isEmpty()) {
                LOG.warn("Folder '{}': {} not found, entry skipped", folderName, entry.describe());
                continue;
            }
            DesiredAccessEntry previous = targets.putIfAbsent(key.get(), entry);
            if (previous != null) {
                LOG.warn(
                    "Folder '{}': {} resolves to the same {} as {}, entry skipped",
                    folderName,
                    entry.describe(),
                    key.get(),
                    previous.describe()
                );
            }
        }
        return targets;
    }

    private List<AccessEntry> effectiveEntries(String containerId) {
        String current = containerId;
        while (current != null) {
            Optional<ContainerInfo> container = client.getContainer(current);
            if (container.isEmpty()) {
                return List.of();
            }
            if (!container.get().inherits()) {
                return client.listAccessEntries(current);
            }
            current = container.get().parentId();
        }
        return List.of();
    }

    private void execute(String containerId, AccessChange change) {
        switch (change.type()) {
            case BREAK_INHERITANCE -> client.setInheritance(containerId, false);
            case ADD -> client.addAccessEntry(containerId, change.key().principalType(), change.key().principalId(), change.after());
            case UPDATE -> client.updateAccessEntry(change.entryId(), change.after());
            case REMOVE -> client.removeAccessEntry(change.entryId());
        }
    }
}
