package com.yuzhi.dts.iac.service.looker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.twice;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import com.yuzhi.dts.iac.config.IacProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

class LookerAuthServiceTest {

    private static final String LOGIN = "https://bi.example.com/api/4.0/login";
    private static final String TOKEN = "{\"access_token\":\"t1\",\"token_type\":\"Bearer\",\"expires_in\":3600}";

    private final IacProperties properties = new IacProperties();
    private final MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
    private final MutableClock clock = new MutableClock();
    private LookerAuthService authService;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        properties.getBackend().setBaseUrl("https://bi.example.com");
        properties.getBackend().setClientId("api-client");
        properties.getBackend().setClientSecret("api-secret");
        authService = new LookerAuthService(properties, new RestTemplateBuilder(customizer), clock);
        server = customizer.getServer();
    }

    @Test
    void logsInWithClientCredentialsAndCachesTheToken() {
        server
            .expect(once(), requestTo(LOGIN))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().formDataContains(Map.of("client_id", "api-client", "client_secret", "api-secret")))
            .andRespond(withSuccess(TOKEN, MediaType.APPLICATION_JSON));

        assertThat(authService.accessToken()).isEqualTo("t1");
        clock.advance(Duration.ofMinutes(30));
        assertThat(authService.accessToken()).isEqualTo("t1");
        server.verify();
    }

    @Test
    void logsInAgainWithinTheExpiryMargin() {
        server.expect(twice(), requestTo(LOGIN)).andRespond(withSuccess(TOKEN, MediaType.APPLICATION_JSON));

        authService.accessToken();
        clock.advance(Duration.ofSeconds(3600 - 20));
        authService.accessToken();

        server.verify();
    }

    @Test
    void invalidateForcesANewLogin() {
        server.expect(twice(), requestTo(LOGIN)).andRespond(withSuccess(TOKEN, MediaType.APPLICATION_JSON));

        authService.accessToken();
        authService.invalidate();
        authService.accessToken();

        server.verify();
    }

    @Test
    void rejectedLoginIsAnAuthError() {
        server.expect(requestTo(LOGIN)).andRespond(withUnauthorizedRequest());

        assertThatThrownBy(() -> authService.accessToken()).isInstanceOf(LookerAuthException.class).hasMessageContaining(LOGIN);
    }

    @Test
    void missingCredentialsFailWithoutCallingTheApi() {
        properties.getBackend().setClientSecret(null);
        LookerAuthService unconfigured = new LookerAuthService(properties, new RestTemplateBuilder(), clock);

        assertThatThrownBy(unconfigured::accessToken).isInstanceOf(LookerAuthException.class).hasMessageContaining("client-secret");
    }

    private static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
