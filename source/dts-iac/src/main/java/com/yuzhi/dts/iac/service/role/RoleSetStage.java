package com.yuzhi.dts.iac.service.role;

/**
 * Apply stages of the role / permission set / model set graph, declared in execution order. Roles are deleted first
 * so the sets they reference are free to go; sets are written before roles so new roles can bind to them.
 */
public enum RoleSetStage {
    DELETE_ROLES,
    DELETE_PERMISSION_SETS,
    DELETE_MODEL_SETS,
    UPSERT_PERMISSION_SETS,
    UPSERT_MODEL_SETS,
    UPSERT_ROLES
}
