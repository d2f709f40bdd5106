package com.yuzhi.dts.iac.service.secret;

import com.yuzhi.dts.iac.domain.SecretRef;

/**
 * Turns a secret pointer into its value. Only called while building a payload that is about to be written, never
 * while comparing desired and live state.
 */
public interface SecretResolver {

    /**
     * @throws MissingSecretException when the pointer has no value
     */
    String resolve(SecretRef ref);
}
