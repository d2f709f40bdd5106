package com.yuzhi.dts.iac.domain;

/**
 * Entity kinds managed by the reconciler, in the order they are processed.
 */
public enum ResourceKind {
    CONNECTION("Connection"),
    PROJECT("Project"),
    LOOKML_MODEL("Model"),
    PERMISSION_SET("Permission Set"),
    MODEL_SET("Model Set"),
    ROLE("Role"),
    FOLDER("Folder"),
    OIDC_CONFIG("OIDC Config");

    private final String displayName;

    ResourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
