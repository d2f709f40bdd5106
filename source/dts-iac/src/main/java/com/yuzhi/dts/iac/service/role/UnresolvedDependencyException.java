package com.yuzhi.dts.iac.service.role;

/**
 * A name reference could not be turned into a backend id at apply time, even after the referenced kinds were applied.
 */
public class UnresolvedDependencyException extends RuntimeException {

    public UnresolvedDependencyException(String message) {
        super(message);
    }

    public UnresolvedDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
