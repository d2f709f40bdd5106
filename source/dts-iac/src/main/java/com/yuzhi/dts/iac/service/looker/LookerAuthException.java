package com.yuzhi.dts.iac.service.looker;

public class LookerAuthException extends RuntimeException {

    public LookerAuthException(String message) {
        super(message);
    }

    public LookerAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
