package com.yuzhi.dts.iac.service.looker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yuzhi.dts.iac.config.IacProperties;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * API login with client credentials. The bearer token is cached until shortly before it expires.
 */
@Service
@ConditionalOnProperty(prefix = "dts.iac.backend", name = "mode", havingValue = "rest", matchIfMissing = true)
public class LookerAuthService {

    private static final Logger LOG = LoggerFactory.getLogger(LookerAuthService.class);
    private static final long EXPIRY_MARGIN_SECONDS = 30;

    private final RestTemplate restTemplate;
    private final URI loginEndpoint;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    private String cachedToken;
    private Instant expiresAt = Instant.EPOCH;

    public LookerAuthService(IacProperties properties, RestTemplateBuilder restTemplateBuilder) {
        this(properties, restTemplateBuilder, Clock.systemUTC());
    }

    LookerAuthService(IacProperties properties, RestTemplateBuilder restTemplateBuilder, Clock clock) {
        IacProperties.Backend backend = properties.getBackend();
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(backend.getConnectTimeout())
            .setReadTimeout(backend.getReadTimeout())
            .build();
        this.loginEndpoint = UriComponentsBuilder
            .fromUriString(LookerDirectoryRestClient.apiBase(backend.getBaseUrl()))
            .path("/login")
            .build()
            .toUri();
        this.clientId = backend.getClientId();
        this.clientSecret = backend.getClientSecret() == null ? "" : backend.getClientSecret();
        this.clock = clock;
    }

    public synchronized String accessToken() {
        Instant now = clock.instant();
        if (cachedToken != null && now.isBefore(expiresAt)) {
            return cachedToken;
        }
        TokenResponse token = login();
        cachedToken = token.accessToken();
        expiresAt = now.plusSeconds(Math.max(0, token.expiresIn() - EXPIRY_MARGIN_SECONDS));
        LOG.debug("Obtained API token valid for {}s", token.expiresIn());
        return cachedToken;
    }

    public synchronized void invalidate() {
        cachedToken = null;
        expiresAt = Instant.EPOCH;
    }

    private TokenResponse login() {
        if (StringUtils.isBlank(clientId) || StringUtils.isBlank(clientSecret)) {
            throw new LookerAuthException("API client id and secret must be configured (dts.iac.backend.client-id / client-secret)");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<TokenResponse> response = restTemplate.exchange(
                loginEndpoint,
                HttpMethod.POST,
                new HttpEntity<>(form, headers),
                TokenResponse.class
            );
            TokenResponse body = response.getBody();
            if (body == null || StringUtils.isBlank(body.accessToken())) {
                throw new LookerAuthException("Login response missing access_token");
            }
            return body;
        } catch (RestClientException ex) {
            throw new LookerAuthException("API login at " + loginEndpoint + " failed: " + ex.getMessage(), ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn
    ) {}
}
