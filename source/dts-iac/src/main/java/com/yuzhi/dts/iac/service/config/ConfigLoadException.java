package com.yuzhi.dts.iac.service.config;

/**
 * A desired config file exists but cannot be read or does not have the expected shape.
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
