package com.yuzhi.dts.iac.domain;

/**
 * Access entry as stored by the backend on a container.
 */
public record AccessEntry(String entryId, String containerId, PrincipalType principalType, String principalId, String permission) {
    public AccessKey key() {
        return new AccessKey(principalType, principalId);
    }
}
