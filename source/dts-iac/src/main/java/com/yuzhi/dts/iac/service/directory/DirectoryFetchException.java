package com.yuzhi.dts.iac.service.directory;

/**
 * Reading live state from the backend failed.
 */
public class DirectoryFetchException extends RuntimeException {

    public DirectoryFetchException(String message) {
        super(message);
    }

    public DirectoryFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
