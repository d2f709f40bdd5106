package com.yuzhi.dts.iac.service;

import com.yuzhi.dts.iac.config.IacProperties;
import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.DiffItem;
import com.yuzhi.dts.iac.domain.FieldChange;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.access.FolderPlan;
import com.yuzhi.dts.iac.service.access.FolderReconciler;
import com.yuzhi.dts.iac.service.config.DesiredConfig;
import com.yuzhi.dts.iac.service.config.OidcSpec;
import com.yuzhi.dts.iac.service.config.ProjectSpec;
import com.yuzhi.dts.iac.service.diff.ResourceDiffer;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import com.yuzhi.dts.iac.service.directory.DirectoryFetchException;
import com.yuzhi.dts.iac.service.directory.DirectoryMutationException;
import com.yuzhi.dts.iac.service.directory.PrincipalDirectory;
import com.yuzhi.dts.iac.service.directory.WorkspaceScope;
import com.yuzhi.dts.iac.service.oidc.OidcGroupMirroring;
import com.yuzhi.dts.iac.service.report.ApplyReport;
import com.yuzhi.dts.iac.service.report.ApplyTally;
import com.yuzhi.dts.iac.service.report.ChangeReportFormatter;
import com.yuzhi.dts.iac.service.report.KindReport;
import com.yuzhi.dts.iac.service.role.RoleSetPlan;
import com.yuzhi.dts.iac.service.role.RoleSetReconciler;
import com.yuzhi.dts.iac.service.role.RoleSetSnapshot;
import com.yuzhi.dts.iac.service.validation.DesiredConfigValidator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Plans and applies a desired config kind by kind: connections, projects and models (inside the development
 * workspace), the role graph, folders, then OIDC, whose group mirroring references roles. A kind whose live state
 * cannot be read is reported and skipped; the others still proceed.
 */
@Service
public class ReconciliationService {

    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationService.class);

    private final DirectoryClient client;
    private final DesiredConfigValidator validator;
    private final ResourceDiffer differ;
    private final RoleSetReconciler roleSetReconciler;
    private final FolderReconciler folderReconciler;
    private final OidcGroupMirroring groupMirroring;
    private final ChangeReportFormatter formatter;
    private final IacProperties properties;

    public ReconciliationService(
        DirectoryClient client,
        DesiredConfigValidator validator,
        ResourceDiffer differ,
        RoleSetReconciler roleSetReconciler,
        FolderReconciler folderReconciler,
        OidcGroupMirroring groupMirroring,
        ChangeReportFormatter formatter,
        IacProperties properties
    ) {
        this.client = client;
        this.validator = validator;
        this.differ = differ;
        this.roleSetReconciler = roleSetReconciler;
        this.folderReconciler = folderReconciler;
        this.groupMirroring = groupMirroring;
        this.formatter = formatter;
        this.properties = properties;
    }

    /**
     * Validate and diff. Never mutates the backend apart from switching and restoring the session workspace.
     *
     * @throws com.yuzhi.dts.iac.service.validation.ConfigValidationException when desired config is inconsistent
     */
    public ReconciliationPlan plan(DesiredConfig config) {
        PrincipalDirectory principals = new PrincipalDirectory(client);
        validator.validate(config, principals);
        ReconciliationPlan plan = new ReconciliationPlan(principals);
        if (!config.connections().isEmpty()) {
            plan.setConnections(planKind(plan, ResourceKind.CONNECTION, config.connections()));
        }
        if (!config.projects().isEmpty()) {
            planProjects(plan, config);
        }
        if (config.hasRoles()) {
            planRoleSets(plan, config);
        }
        if (!config.folders().isEmpty()) {
            KindReport report = new KindReport(ResourceKind.FOLDER);
            List<FolderPlan> folders = folderReconciler.plan(config.folders(), principals, report);
            folders.stream().filter(FolderPlan::hasWork).forEach(folder -> report.addChange(formatter.describe(folder)));
            plan.setFolders(folders);
            plan.putReport(report);
        }
        if (config.hasOidc()) {
            planOidc(plan, config.oidc());
        }
        return plan;
    }

    public ApplyReport apply(ReconciliationPlan plan) {
        ApplyReport report = new ApplyReport();
        applyItems(plan.getConnections(), report);
        if (!plan.getProjects().isEmpty() || !plan.getModels().isEmpty()) {
            try (WorkspaceScope scope = enterDevelopment()) {
                applyItems(plan.getProjects(), report);
                applyItems(plan.getModels(), report);
            } catch (RuntimeException ex) {
                LOG.error("Workspace switch around project changes failed: {}", ex.getMessage());
                report
                    .tally(ResourceKind.PROJECT)
                    .failure("Workspace '" + properties.getWorkspace().getDevelopment() + "': " + ex.getMessage());
            }
        }
        roleSetReconciler.apply(plan.getRoleSets(), report);
        if (plan.getFolders().stream().anyMatch(FolderPlan::hasWork)) {
            folderReconciler.apply(plan.getFolders(), plan.getPrincipals(), report.tally(ResourceKind.FOLDER));
        }
        if (plan.getOidc() != null) {
            applyOidc(plan.getOidc(), plan.getOidcGroups(), report.tally(ResourceKind.OIDC_CONFIG));
        }
        LOG.info("Apply finished: {} succeeded, {} failed", report.totalSucceeded(), report.totalFailed());
        return report;
    }

    private List<DiffItem> planKind(ReconciliationPlan plan, ResourceKind kind, List<DesiredResource> desired) {
        KindReport report = new KindReport(kind);
        List<DiffItem> items = List.of();
        try {
            items = differ.diff(kind, desired, client.listAll(kind));
            items.forEach(item -> report.addChange(formatter.describe(item)));
            plan.putReport(report);
        } catch (DirectoryFetchException ex) {
            LOG.error("Skipping {}: live state unavailable: {}", kind.getDisplayName(), ex.getMessage());
            plan.putReport(KindReport.failed(kind, ex.getMessage()));
        }
        return items;
    }

    private void planProjects(ReconciliationPlan plan, DesiredConfig config) {
        List<DesiredResource> projects = config.projects().stream().map(ProjectSpec::project).toList();
        try (WorkspaceScope scope = enterDevelopment()) {
            plan.setProjects(planKind(plan, ResourceKind.PROJECT, projects));
            plan.setModels(planKind(plan, ResourceKind.LOOKML_MODEL, config.models()));
        } catch (RuntimeException ex) {
            LOG.error("Workspace switch around project planning failed: {}", ex.getMessage());
            for (ResourceKind kind : List.of(ResourceKind.PROJECT, ResourceKind.LOOKML_MODEL)) {
                if (!plan.hasReport(kind)) {
                    plan.putReport(KindReport.failed(kind, ex.getMessage()));
                } else {
                    plan.getReport(kind).addError("Workspace could not be restored: " + ex.getMessage());
                }
            }
        }
    }

    private void planRoleSets(ReconciliationPlan plan, DesiredConfig config) {
        List<ResourceKind> kinds = List.of(ResourceKind.PERMISSION_SET, ResourceKind.MODEL_SET, ResourceKind.ROLE);
        RoleSetPlan roleSets;
        try {
            roleSets = roleSetReconciler.plan(config.roles(), RoleSetSnapshot.fetch(client));
        } catch (DirectoryFetchException ex) {
            LOG.error("Skipping roles and sets: live state unavailable: {}", ex.getMessage());
            kinds.forEach(kind -> plan.putReport(KindReport.failed(kind, ex.getMessage())));
            return;
        }
        Map<ResourceKind, KindReport> reports = new LinkedHashMap<>();
        kinds.forEach(kind -> reports.put(kind, new KindReport(kind)));
        roleSets.items().forEach(item -> reports.get(item.getKind()).addChange(formatter.describe(item)));
        reports.values().forEach(plan::putReport);
        plan.setRoleSets(roleSets);
    }

    private void planOidc(ReconciliationPlan plan, OidcSpec oidc) {
        KindReport report = new KindReport(ResourceKind.OIDC_CONFIG);
        try {
            List<LiveResource> live = client.listAll(ResourceKind.OIDC_CONFIG);
            if (live.isEmpty()) {
                report.addError("OIDC configuration not found on the backend; it is never created");
                plan.putReport(report);
                return;
            }
            LiveResource current = live.get(0);
            List<FieldChange> changes = new ArrayList<>(differ.compare(ResourceKind.OIDC_CONFIG, oidc.settings(), current));
            if (oidc.declaresGroups()) {
                List<MirroredGroup> liveGroups = groupMirroring.readLive(current.field(OidcGroupMirroring.GROUPS_FIELD));
                groupMirroring.compare(oidc.mirroredGroups(), liveGroups, liveRoleIds()).ifPresent(changes::add);
            }
            if (!changes.isEmpty()) {
                DiffItem item = differ.update(ResourceKind.OIDC_CONFIG, oidc.settings(), current.id(), changes);
                plan.setOidc(item, oidc.mirroredGroups());
                report.addChange(formatter.describe(item));
            }
            plan.putReport(report);
        } catch (DirectoryFetchException ex) {
            LOG.error("Skipping OIDC configuration: live state unavailable: {}", ex.getMessage());
            plan.putReport(KindReport.failed(ResourceKind.OIDC_CONFIG, ex.getMessage()));
        }
    }

    private void applyItems(List<DiffItem> items, ApplyReport report) {
        for (DiffItem item : items) {
            ApplyTally tally = report.tally(item.getKind());
            if (item.hasUnresolvedSecrets()) {
                LOG.error("Not applying {}: unresolved secrets {}", item, item.getUnresolvedSecrets());
                tally.failure(item + ": unresolved secrets " + item.getUnresolvedSecrets());
                continue;
            }
            try {
                switch (item.getAction()) {
                    case CREATE -> client.create(item.getKind(), item.getPayload());
                    case UPDATE -> client.update(item.getKind(), item.getId(), item.getPayload());
                    case DELETE -> client.delete(item.getKind(), item.getId());
                }
                tally.success();
                LOG.info("Applied {}", item);
            } catch (RuntimeException ex) {
                LOG.error("Failed to apply {}: {}", item, ex.getMessage());
                tally.failure(item + ": " + ex.getMessage());
            }
        }
    }

    private void applyOidc(DiffItem item, List<MirroredGroup> desiredGroups, ApplyTally tally) {
        if (item.hasUnresolvedSecrets()) {
            LOG.error("Not applying {}: unresolved secrets {}", item, item.getUnresolvedSecrets());
            tally.failure(item + ": unresolved secrets " + item.getUnresolvedSecrets());
            return;
        }
        try {
            Map<String, Object> payload = new LinkedHashMap<>(item.getPayload());
            if (desiredGroups != null) {
                LiveResource current = client
                    .get(ResourceKind.OIDC_CONFIG, item.getId())
                    .orElseThrow(() -> new DirectoryMutationException("OIDC configuration disappeared"));
                List<MirroredGroup> liveGroups = groupMirroring.readLive(current.field(OidcGroupMirroring.GROUPS_FIELD));
                payload.put(OidcGroupMirroring.GROUPS_FIELD, groupMirroring.resolve(desiredGroups, liveGroups, liveRoleIds()));
            }
            client.update(ResourceKind.OIDC_CONFIG, item.getId(), payload);
            tally.success();
            LOG.info("Applied {}", item);
        } catch (RuntimeException ex) {
            LOG.error("Failed to apply {}: {}", item, ex.getMessage());
            tally.failure(item + ": " + ex.getMessage());
        }
    }

    private WorkspaceScope enterDevelopment() {
        return WorkspaceScope.enter(client, properties.getWorkspace().getDevelopment(), properties.getWorkspace().getProduction());
    }

    private Map<String, String> liveRoleIds() {
        Map<String, String> ids = new LinkedHashMap<>();
        client.listAll(ResourceKind.ROLE).forEach(role -> ids.put(role.name(), role.id()));
        return ids;
    }
}
