package com.yuzhi.dts.iac.service.secret;

import com.yuzhi.dts.iac.domain.SecretRef;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads secrets from the Spring {@link Environment}: OS environment variables first, then system properties and any
 * other configured property source.
 */
@Component
public class EnvironmentSecretResolver implements SecretResolver {

    private final Environment environment;

    public EnvironmentSecretResolver(Environment environment) {
        this.environment = environment;
    }

    @Override
    public String resolve(SecretRef ref) {
        String value = environment.getProperty(ref.variable());
        if (!StringUtils.hasText(value)) {
            throw new MissingSecretException(ref);
        }
        return value;
    }
}
