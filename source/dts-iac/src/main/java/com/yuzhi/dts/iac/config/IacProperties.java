package com.yuzhi.dts.iac.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dts.iac")
public class IacProperties {

    private String configDir = "config";
    private final Backend backend = new Backend();
    private final Workspace workspace = new Workspace();
    private final Validation validation = new Validation();

    public String getConfigDir() {
        return configDir;
    }

    public void setConfigDir(String configDir) {
        this.configDir = configDir;
    }

    public Backend getBackend() {
        return backend;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public Validation getValidation() {
        return validation;
    }

    public static class Backend {

        /** {@code rest} talks to the directory API, {@code in-memory} runs against an empty local backend. */
        private String mode = "rest";
        private String baseUrl = "";
        private String clientId = "";
        private String clientSecret = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Workspace {

        private String development = "dev";

        /** Restored after development work when the session does not report its workspace. */
        private String production = "production";

        public String getDevelopment() {
            return development;
        }

        public void setDevelopment(String development) {
            this.development = development;
        }

        public String getProduction() {
            return production;
        }

        public void setProduction(String production) {
            this.production = production;
        }
    }

    public static class Validation {

        /** When off, unresolvable access principals are skipped with a warning instead of failing validation. */
        private boolean strictPrincipals = true;

        public boolean isStrictPrincipals() {
            return strictPrincipals;
        }

        public void setStrictPrincipals(boolean strictPrincipals) {
            this.strictPrincipals = strictPrincipals;
        }
    }
}
