package com.clinical.icdlookup.service.auth;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.error.RegistryAuthException;
import com.clinical.icdlookup.error.RegistryConfigException;
import com.clinical.icdlookup.support.MutableClock;
import com.clinical.icdlookup.support.StubExchange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.clinical.icdlookup.support.StubExchange.json;
import static com.clinical.icdlookup.support.StubExchange.token;
import static org.assertj.core.api.Assertions.assertThat;

class TokenManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private RegistryProperties props;

    private MutableClock clock;

    private StubExchange exchange;

    @BeforeEach
    void setUp() {
        props = new RegistryProperties();
        props.getCredentials().setClientId("client");
        props.getCredentials().setClientSecret("secret");
        clock = new MutableClock(T0);
        exchange = new StubExchange();
    }

    private TokenManager tokenManager() {
        return new TokenManager(exchange.webClient(), new CredentialStore(props), props, clock);
    }

    @Test
    void cachedCredentialIsReusedWithoutCallingTheTokenEndpoint() {
        exchange.thenJson(HttpStatus.OK, token("tok-1", 3600));
        TokenManager tm = tokenManager();

        Credential first = tm.getValidCredential().block();
        Credential second = tm.getValidCredential().block();

        assertThat(second).isSameAs(first);
        assertThat(first.bearerToken()).isEqualTo("tok-1");
        assertThat(exchange.requests()).hasSize(1);
        assertThat(exchange.requests().get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(exchange.requests().get(0).url().toString()).isEqualTo(props.getTokenUrl());
    }

    @Test
    void expiryIsShortenedBySafetyMargin() {
        exchange.thenJson(HttpStatus.OK, token("tok-1", 3600));

        Credential credential = tokenManager().getValidCredential().block();

        assertThat(credential.expiresAt()).isEqualTo(T0.plusSeconds(3600 - 60));
    }

    @Test
    void credentialCloseToExpiryIsRefreshed() {
        exchange.thenJson(HttpStatus.OK, token("tok-1", 3600))
                .thenJson(HttpStatus.OK, token("tok-2", 3600));
        TokenManager tm = tokenManager();
        tm.getValidCredential().block();

        clock.advance(Duration.ofSeconds(3479));
        assertThat(tm.getValidCredential().block().bearerToken()).isEqualTo("tok-1");

        clock.advance(Duration.ofSeconds(2));
        assertThat(tm.getValidCredential().block().bearerToken()).isEqualTo("tok-2");
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void concurrentCallersShareOneTokenRequest() {
        exchange.always(req -> Mono.delay(Duration.ofMillis(100))
                .map(tick -> json(HttpStatus.OK, token("shared", 3600))));
        TokenManager tm = tokenManager();

        List<Credential> credentials = Flux.range(0, 16)
                .flatMap(i -> tm.getValidCredential())
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(credentials).hasSize(16).allSatisfy(c -> assertThat(c.bearerToken()).isEqualTo("shared"));
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void callersOnSeparateThreadsShareOneTokenRequest() throws Exception {
        exchange.always(req -> Mono.delay(Duration.ofMillis(200))
                .map(tick -> json(HttpStatus.OK, token("shared", 3600))));
        TokenManager tm = tokenManager();
        int callers = 8;
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Credential>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return tm.getValidCredential().block(Duration.ofSeconds(5));
                }));
            }
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            go.countDown();

            for (Future<Credential> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS).bearerToken()).isEqualTo("shared");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void tokenShorterThanSafetyMarginIsNeverHandedOut() {
        exchange.thenJson(HttpStatus.OK, token("too-short", 30))
                .thenJson(HttpStatus.OK, token("long-enough", 3600));
        TokenManager tm = tokenManager();

        StepVerifier.create(tm.getValidCredential())
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(RegistryAuthException.class)
                        .hasMessageContaining("too short"))
                .verify();

        assertThat(tm.getValidCredential().block().bearerToken()).isEqualTo("long-enough");
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void failedRefreshIsNotCached() {
        exchange.thenStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                .thenJson(HttpStatus.OK, token("tok-after-failure", 3600));
        TokenManager tm = tokenManager();

        StepVerifier.create(tm.getValidCredential())
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(RegistryAuthException.class)
                        .hasMessageContaining("HTTP 500"))
                .verify();

        assertThat(tm.getValidCredential().block().bearerToken()).isEqualTo("tok-after-failure");
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void transportFailureBecomesAuthError() {
        exchange.thenError(new java.net.ConnectException("connection refused"));

        StepVerifier.create(tokenManager().getValidCredential())
                .expectError(RegistryAuthException.class)
                .verify();
    }

    @Test
    void tokenWithoutLifetimeIsRejected() {
        exchange.thenJson(HttpStatus.OK, "{\"access_token\":\"tok\",\"token_type\":\"Bearer\"}");

        StepVerifier.create(tokenManager().getValidCredential())
                .expectError(RegistryAuthException.class)
                .verify();
    }

    @Test
    void missingCredentialsFailWithoutNetworkCall() {
        props.getCredentials().setClientSecret("  ");

        StepVerifier.create(tokenManager().getValidCredential())
                .expectError(RegistryConfigException.class)
                .verify();
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void invalidatingTheRejectedCredentialForcesRefresh() {
        exchange.thenJson(HttpStatus.OK, token("tok-1", 3600))
                .thenJson(HttpStatus.OK, token("tok-2", 3600));
        TokenManager tm = tokenManager();
        Credential first = tm.getValidCredential().block();

        tm.invalidate(new Credential("someone-else", first.expiresAt().plusSeconds(1)));
        assertThat(tm.getValidCredential().block()).isSameAs(first);

        tm.invalidate(first);
        assertThat(tm.getValidCredential().block().bearerToken()).isEqualTo("tok-2");
        assertThat(exchange.requests()).hasSize(2);
    }

    @Test
    void unconditionalInvalidateDropsCredential() {
        exchange.thenJson(HttpStatus.OK, token("tok-1", 3600))
                .thenJson(HttpStatus.OK, token("tok-2", 3600));
        TokenManager tm = tokenManager();
        tm.getValidCredential().block();

        tm.invalidate();

        assertThat(tm.getValidCredential().block().bearerToken()).isEqualTo("tok-2");
    }

    @Test
    void toStringNeverExposesSecrets() {
        assertThat(new Credential("bearer-secret", T0).toString()).doesNotContain("bearer-secret");
        assertThat(new RegistryCredentials("id", "client-secret", "scope").toString())
                .doesNotContain("client-secret");
    }
}
