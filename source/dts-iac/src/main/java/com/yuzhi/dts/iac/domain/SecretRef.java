package com.yuzhi.dts.iac.domain;

/**
 * Pointer to a secret held outside the desired configuration, e.g. an environment variable name.
 */
public record SecretRef(String variable) {
    public SecretRef {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException("Secret reference requires a variable name");
        }
        variable = variable.trim();
    }

    @Override
    public String toString() {
        return "${" + variable + "}";
    }
}
