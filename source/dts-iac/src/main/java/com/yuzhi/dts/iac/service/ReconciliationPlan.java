package com.yuzhi.dts.iac.service;

import com.yuzhi.dts.iac.domain.DiffItem;
import com.yuzhi.dts.iac.domain.MirroredGroup;
import com.yuzhi.dts.iac.domain.ResourceKind;
import com.yuzhi.dts.iac.service.access.FolderPlan;
import com.yuzhi.dts.iac.service.directory.PrincipalDirectory;
import com.yuzhi.dts.iac.service.report.KindReport;
import com.yuzhi.dts.iac.service.role.RoleSetPlan;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of planning one run: typed work per kind plus the per-kind reports shown to the operator.
 */
public class ReconciliationPlan {

    private final PrincipalDirectory principals;
    private final Map<ResourceKind, KindReport> reports = new EnumMap<>(ResourceKind.class);
    private List<DiffItem> connections = List.of();
    private List<DiffItem> projects = List.of();
    private List<DiffItem> models = List.of();
    private RoleSetPlan roleSets = new RoleSetPlan();
    private List<FolderPlan> folders = List.of();
    private DiffItem oidc;
    private List<MirroredGroup> oidcGroups;

    public ReconciliationPlan(PrincipalDirectory principals) {
        this.principals = principals;
    }

    void putReport(KindReport report) {
        reports.put(report.getKind(), report);
    }

    boolean hasReport(ResourceKind kind) {
        return reports.containsKey(kind);
    }

    public Collection<KindReport> getReports() {
        return reports.values();
    }

    public KindReport getReport(ResourceKind kind) {
        return reports.get(kind);
    }

    public boolean hasProblems() {
        return reports.values().stream().anyMatch(KindReport::hasProblems);
    }

    /** True when applying would not touch the backend. */
    public boolean isEmpty() {
        return (
            connections.isEmpty() &&
            projects.isEmpty() &&
            models.isEmpty() &&
            roleSets.isEmpty() &&
            folders.stream().noneMatch(FolderPlan::hasWork) &&
            oidc == null
        );
    }

    public PrincipalDirectory getPrincipals() {
        return principals;
    }

    public List<DiffItem> getConnections() {
        return connections;
    }

    void setConnections(List<DiffItem> connections) {
        this.connections = List.copyOf(connections);
    }

    public List<DiffItem> getProjects() {
        return projects;
    }

    void setProjects(List<DiffItem> projects) {
        this.projects = List.copyOf(projects);
    }

    public List<DiffItem> getModels() {
        return models;
    }

    void setModels(List<DiffItem> models) {
        this.models = List.copyOf(models);
    }

    public RoleSetPlan getRoleSets() {
        return roleSets;
    }

    void setRoleSets(RoleSetPlan roleSets) {
        this.roleSets = roleSets;
    }

    public List<FolderPlan> getFolders() {
        return folders;
    }

    void setFolders(List<FolderPlan> folders) {
        this.folders = List.copyOf(folders);
    }

    public DiffItem getOidc() {
        return oidc;
    }

    public List<MirroredGroup> getOidcGroups() {
        return oidcGroups;
    }

    void setOidc(DiffItem oidc, List<MirroredGroup> oidcGroups) {
        this.oidc = oidc;
        this.oidcGroups = oidcGroups;
    }
}
