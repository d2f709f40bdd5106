package com.yuzhi.dts.iac.service.directory;

/**
 * A single backend mutation was rejected.
 */
public class DirectoryMutationException extends RuntimeException {

    public DirectoryMutationException(String message) {
        super(message);
    }

    public DirectoryMutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
