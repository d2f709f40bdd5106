package com.yuzhi.dts.iac.service.access;

import com.yuzhi.dts.iac.domain.ContainerInfo;
import com.yuzhi.dts.iac.service.config.FolderSpec;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import com.yuzhi.dts.iac.service.directory.DirectoryFetchException;
import com.yuzhi.dts.iac.service.directory.PrincipalDirectory;
import com.yuzhi.dts.iac.service.report.ApplyTally;
import com.yuzhi.dts.iac.service.report.KindReport;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folder hierarchy and per-folder access lists. Folders are processed in file order so a parent defined earlier can
 * be created in the same pass as its children. The root folder is never created, only its access list is managed.
 * Folders may also be placed directly under the embed root, which is addressed by name like the root folder.
 */
@Component
public class FolderReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(FolderReconciler.class);

    public static final String ROOT_FOLDER_ID = "1";
    public static final String ROOT_FOLDER_NAME = "Shared";
    public static final String EMBED_ROOT_FOLDER_ID = "cm_embed:1";
    public static final String EMBED_ROOT_FOLDER_NAME = "Embed";

    private final DirectoryClient client;
    private final AccessReconciler accessReconciler;

    public FolderReconciler(DirectoryClient client, AccessReconciler accessReconciler) {
        this.client = client;
        this.accessReconciler = accessReconciler;
    }

    public List<FolderPlan> plan(List<FolderSpec> folders, PrincipalDirectory principals, KindReport report) {
        List<FolderPlan> plans = new ArrayList<>();
        Map<String, String> existingIds = new HashMap<>();
        Set<String> pendingCreates = new HashSet<>();
        for (FolderSpec spec : folders) {
            try {
                FolderPlan plan = planFolder(spec, principals, existingIds, pendingCreates);
                if (plan == null) {
                    String error = "Parent folder '" + parentName(spec) + "' not found for folder '" + spec.name() + "'";
                    LOG.error("{}; folder skipped", error);
                    report.addError(error);
                    continue;
                }
                if (plan.isCreate()) {
                    pendingCreates.add(plan.name());
                } else {
                    existingIds.put(plan.name(), plan.containerId());
                }
                plans.add(plan);
            } catch (DirectoryFetchException ex) {
                LOG.error("Folder '{}' could not be planned: {}", spec.name(), ex.getMessage());
                report.addError("Folder '" + spec.name() + "': " + ex.getMessage());
            }
        }
        return plans;
    }

    public void apply(List<FolderPlan> plans, PrincipalDirectory principals, ApplyTally tally) {
        Map<String, String> createdIds = new HashMap<>();
        for (FolderPlan plan : plans) {
            if (!plan.hasWork()) {
                continue;
            }
            String containerId = plan.containerId();
            if (plan.isCreate()) {
                String parentId = plan.parentId() != null ? plan.parentId() : createdIds.get(plan.parentName());
                if (parentId == null) {
                    LOG.error("Folder '{}' not created: parent '{}' does not exist", plan.name(), plan.parentName());
                    tally.failure("Folder '" + plan.name() + "': parent '" + plan.parentName() + "' does not exist");
                    continue;
                }
                try {
                    ContainerInfo created = client.createContainer(plan.name(), parentId);
                    containerId = created.id();
                    createdIds.put(plan.name(), containerId);
                    tally.success();
                    LOG.info("Created folder '{}' (id={}) under '{}'", plan.name(), containerId, plan.parentName());
                } catch (RuntimeException ex) {
                    LOG.error("Failed to create folder '{}': {}", plan.name(), ex.getMessage());
                    tally.failure("Folder '" + plan.name() + "': " + ex.getMessage());
                    continue;
                }
            }
            try {
                accessReconciler.reconcile(containerId, plan.desired(), principals, tally);
            } catch (RuntimeException ex) {
                LOG.error("Failed to reconcile access of folder '{}': {}", plan.name(), ex.getMessage());
                tally.failure("Folder '" + plan.name() + "': " + ex.getMessage());
            }
        }
    }

    private FolderPlan planFolder(
        FolderSpec spec,
        PrincipalDirectory principals,
        Map<String, String> existingIds,
        Set<String> pendingCreates
    ) {
        if (ROOT_FOLDER_NAME.equals(spec.name()) && isRoot(spec.parent())) {
            ContainerInfo root = client
                .getContainer(ROOT_FOLDER_ID)
                .orElse(new ContainerInfo(ROOT_FOLDER_ID, ROOT_FOLDER_NAME, null, false));
            return existing(spec, null, root, principals);
        }
        String parentName = parentName(spec);
        if (pendingCreates.contains(parentName)) {
            return new FolderPlan(
                spec.name(),
                parentName,
                null,
                null,
                true,
                accessReconciler.planNew(null, spec.name(), spec.access(), principals),
                spec.access()
            );
        }
        String parentId = resolveParentId(parentName, existingIds);
        if (parentId == null) {
            return null;
        }
        Optional<ContainerInfo> existing = client.findChildContainer(parentId, spec.name());
        if (existing.isPresent()) {
            return existing(spec, parentId, existing.get(), principals);
        }
        return new FolderPlan(
            spec.name(),
            parentName,
            parentId,
            null,
            true,
            accessReconciler.planNew(parentId, spec.name(), spec.access(), principals),
            spec.access()
        );
    }

    private FolderPlan existing(FolderSpec spec, String parentId, ContainerInfo container, PrincipalDirectory principals) {
        return new FolderPlan(
            spec.name(),
            parentId == null ? null : parentName(spec),
            parentId,
            container.id(),
            container.inherits(),
            accessReconciler.plan(container, spec.access(), principals),
            spec.access()
        );
    }

    private String resolveParentId(String parentName, Map<String, String> existingIds) {
        if (isRoot(parentName)) {
            return ROOT_FOLDER_ID;
        }
        if (EMBED_ROOT_FOLDER_NAME.equals(parentName)) {
            return EMBED_ROOT_FOLDER_ID;
        }
        String known = existingIds.get(parentName);
        if (known != null) {
            return known;
        }
        return client.searchContainer(parentName).map(ContainerInfo::id).orElse(null);
    }

    public static String parentName(FolderSpec spec) {
        return StringUtils.isBlank(spec.parent()) ? ROOT_FOLDER_NAME : spec.parent();
    }

    private static boolean isRoot(String name) {
        return StringUtils.isBlank(name) || ROOT_FOLDER_NAME.equals(name);
    }
}
