package com.yuzhi.dts.iac.service.role;

import com.yuzhi.dts.iac.domain.DesiredResource;
import com.yuzhi.dts.iac.domain.DiffAction;
import com.yuzhi.dts.iac.domain.DiffItem;
import com.yuzhi.dts.iac.domain.FieldChange;
import com.yuzhi.dts.iac.domain.LiveResource;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.config.RoleSection;
import com.yuzhi.dts.iac.service.diff.ResourceDiffer;
import com.yuzhi.dts.iac.service.directory.DirectoryClient;
import com.yuzhi.dts.iac.service.directory.DirectoryFetchException;
import com.yuzhi.dts.iac.service.protection.ProtectionPolicy;
import com.yuzhi.dts.iac.service.report.ApplyReport;
import com.yuzhi.dts.iac.service.report.ApplyTally;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles the role graph: roles reference one permission set and one model set by name. Roles carry set names in
 * their plan payload and are bound to ids only when applied, because the sets may be created in the same pass.
 */
@Component
public class RoleSetReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(RoleSetReconciler.class);

    public static final String PERMISSION_SET_FIELD = "permission_set";
    public static final String MODEL_SET_FIELD = "model_set";
    public static final String PERMISSION_SET_ID_FIELD = "permission_set_id";
    public static final String MODEL_SET_ID_FIELD = "model_set_id";

    private final DirectoryClient client;
    private final ResourceDiffer differ;
    private final ProtectionPolicy protectionPolicy;

    public RoleSetReconciler(DirectoryClient client, ResourceDiffer differ, ProtectionPolicy protectionPolicy) {
        this.client = client;
        this.differ = differ;
        this.protectionPolicy = protectionPolicy;
    }

    public RoleSetPlan plan(RoleSection desired, RoleSetSnapshot snapshot) {
        RoleSetPlan plan = new RoleSetPlan();
        planDeletes(plan, RoleSetStage.DELETE_ROLES, ResourceKind.ROLE, desired, snapshot.getRoles());
        planDeletes(plan, RoleSetStage.DELETE_PERMISSION_SETS, ResourceKind.PERMISSION_SET, desired, snapshot.getPermissionSets());
        planDeletes(plan, RoleSetStage.DELETE_MODEL_SETS, ResourceKind.MODEL_SET, desired, snapshot.getModelSets());

        differ
            .diff(ResourceKind.PERMISSION_SET, desired.permissionSets(), snapshot.getPermissionSets())
            .forEach(item -> plan.add(RoleSetStage.UPSERT_PERMISSION_SETS, item));
        differ
            .diff(ResourceKind.MODEL_SET, desired.modelSets(), snapshot.getModelSets())
            .forEach(item -> plan.add(RoleSetStage.UPSERT_MODEL_SETS, item));

        Map<String, LiveResource> liveRoles = byName(snapshot.getRoles());
        for (DesiredResource role : desired.roles()) {
            LiveResource existing = liveRoles.get(role.name());
            if (existing == null) {
                plan.add(RoleSetStage.UPSERT_ROLES, DiffItem.create(ResourceKind.ROLE, role.name(), role.fields(), List.of()));
                continue;
            }
            List<FieldChange> changes = compareBindings(role, existing, snapshot);
            if (changes.isEmpty()) {
                continue;
            }
            if (protectionPolicy.isProtected(ResourceKind.ROLE, role.name(), DiffAction.UPDATE)) {
                LOG.info("ProtectionViolationSuppressed: update of Role '{}' skipped ({})", role.name(), describe(changes));
                continue;
            }
            plan.add(RoleSetStage.UPSERT_ROLES, DiffItem.update(ResourceKind.ROLE, role.name(), existing.id(), changes, role.fields()));
        }
        return plan;
    }

    /**
     * Execute the plan stage by stage against a freshly read snapshot. One failed item never stops the others.
     */
    public void apply(RoleSetPlan plan, ApplyReport report) {
        if (plan.isEmpty()) {
            return;
        }
        RoleSetSnapshot snapshot;
        try {
            snapshot = RoleSetSnapshot.fetch(client);
        } catch (DirectoryFetchException ex) {
            LOG.error("Cannot apply role changes, live state unavailable: {}", ex.getMessage());
            for (DiffItem item : plan.items()) {
                report.tally(item.getKind()).failure(item + ": " + ex.getMessage());
            }
            return;
        }
        for (RoleSetStage stage : RoleSetStage.values()) {
            for (DiffItem item : plan.stage(stage)) {
                ApplyTally tally = report.tally(item.getKind());
                try {
                    applyItem(stage, item, snapshot);
                    tally.success();
                    LOG.info("Applied {}", item);
                } catch (RuntimeException ex) {
                    LOG.error("Failed to apply {}: {}", item, ex.getMessage());
                    tally.failure(item + ": " + ex.getMessage());
                }
            }
        }
    }

    private void applyItem(RoleSetStage stage, DiffItem item, RoleSetSnapshot snapshot) {
        switch (stage) {
            case DELETE_ROLES -> client.delete(ResourceKind.ROLE, item.getId());
            case DELETE_PERMISSION_SETS, DELETE_MODEL_SETS -> {
                client.delete(item.getKind(), item.getId());
                snapshot.forgetSet(item.getKind(), item.getName());
            }
            case UPSERT_PERMISSION_SETS, UPSERT_MODEL_SETS -> {
                if (item.getAction() == DiffAction.CREATE) {
                    String id = client.create(item.getKind(), item.getPayload());
                    snapshot.recordSet(item.getKind(), item.getName(), id);
                } else {
                    client.update(item.getKind(), item.getId(), item.getPayload());
                }
            }
            case UPSERT_ROLES -> {
                Map<String, Object> payload = bindRole(item, snapshot);
                if (item.getAction() == DiffAction.CREATE) {
                    client.create(ResourceKind.ROLE, payload);
                } else {
                    client.update(ResourceKind.ROLE, item.getId(), payload);
                }
            }
        }
    }

    private Map<String, Object> bindRole(DiffItem item, RoleSetSnapshot snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>(item.getPayload());
        String permissionSet = Objects.toString(payload.remove(PERMISSION_SET_FIELD), null);
        String modelSet = Objects.toString(payload.remove(MODEL_SET_FIELD), null);
        String permissionSetId = snapshot.permissionSetId(permissionSet);
        if (permissionSetId == null) {
            throw new UnresolvedDependencyException(
                "Role '" + item.getName() + "' references Permission Set '" + permissionSet + "' which does not exist"
            );
        }
        String modelSetId = snapshot.modelSetId(modelSet);
        if (modelSetId == null) {
            throw new UnresolvedDependencyException(
                "Role '" + item.getName() + "' references Model Set '" + modelSet + "' which does not exist"
            );
        }
        payload.put(PERMISSION_SET_ID_FIELD, permissionSetId);
        payload.put(MODEL_SET_ID_FIELD, modelSetId);
        return payload;
    }

    private List<FieldChange> compareBindings(DesiredResource role, LiveResource existing, RoleSetSnapshot snapshot) {
        List<FieldChange> changes = new ArrayList<>();
        String currentPermissionSet = snapshot.permissionSetName(existing.field(PERMISSION_SET_ID_FIELD));
        String currentModelSet = snapshot.modelSetName(existing.field(MODEL_SET_ID_FIELD));
        Object desiredPermissionSet = role.field(PERMISSION_SET_FIELD);
        Object desiredModelSet = role.field(MODEL_SET_FIELD);
        if (!Objects.equals(currentPermissionSet, desiredPermissionSet)) {
            changes.add(new FieldChange(PERMISSION_SET_FIELD, currentPermissionSet, desiredPermissionSet));
        }
        if (!Objects.equals(currentModelSet, desiredModelSet)) {
            changes.add(new FieldChange(MODEL_SET_FIELD, currentModelSet, desiredModelSet));
        }
        return changes;
    }

    private void planDeletes(RoleSetPlan plan, RoleSetStage stage, ResourceKind kind, RoleSection desired, List<LiveResource> live) {
        if (!desired.declares(kind)) {
            return;
        }
        Set<String> wanted = desired.resources(kind).stream().map(DesiredResource::name).collect(Collectors.toSet());
        for (LiveResource resource : live) {
            if (wanted.contains(resource.name())) {
                continue;
            }
            if (protectionPolicy.isProtected(kind, resource.name(), DiffAction.DELETE)) {
                LOG.info("ProtectionViolationSuppressed: delete of {} '{}' skipped", kind.getDisplayName(), resource.name());
                continue;
            }
            plan.add(stage, DiffItem.delete(kind, resource.name(), resource.id()));
        }
    }

    private static Map<String, LiveResource> byName(List<LiveResource> resources) {
        Map<String, LiveResource> map = new LinkedHashMap<>();
        resources.forEach(resource -> map.putIfAbsent(resource.name(), resource));
        return map;
    }

    private static String describe(List<FieldChange> changes) {
        return changes.stream().map(FieldChange::describe).collect(Collectors.joining(", "));
    }
}
