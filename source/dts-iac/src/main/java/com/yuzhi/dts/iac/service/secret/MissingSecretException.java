package com.yuzhi.dts.iac.service.secret;

import com.yuzhi.dts.iac.domain.SecretRef;

public class MissingSecretException extends RuntimeException {

    private final transient SecretRef ref;

    public MissingSecretException(SecretRef ref) {
        super("Secret variable '" + ref.variable() + "' is not set");
        this.ref = ref;
    }

    public SecretRef getRef() {
        return ref;
    }
}
