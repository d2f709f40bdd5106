package com.yuzhi.dts.iac.domain;

/**
 * Identity of an access entry within one container: at most one entry per key.
 */
public record AccessKey(PrincipalType principalType, String principalId) {
    @Override
    public String toString() {
        return principalType.label() + " " + principalId;
    }
}
