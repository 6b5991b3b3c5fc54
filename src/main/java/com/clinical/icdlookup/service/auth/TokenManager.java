package com.clinical.icdlookup.service.auth;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.TokenResponse;
import com.clinical.icdlookup.error.RegistryAuthException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <h2>OAuth2 bearer token owner</h2>
 *
 * <p>Holds at most one {@link Credential} for the ICD-11 registry and hands it
 * out while it still has more than the safety margin left. Otherwise one
 * client-credentials request is sent to the token endpoint.</p>
 *
 * <p>Highlights:</p>
 * <ul>
 *   <li>Single flight: the refresh is a cached {@link Mono} kept in one slot;
 *       concurrent callers subscribe to the same Mono, so N simultaneous
 *       callers cause exactly one token request.</li>
 *   <li>All mutable state ({@link #current}, {@link #inFlight}) is guarded by
 *       one lock and never leaves this class.</li>
 *   <li>The slot is cleared before the refresh result reaches any caller; a
 *       failed refresh is never cached and the next caller starts a new one.</li>
 * </ul>
 */
@Slf4j
@Component
public class TokenManager {

    private static final String GRANT_TYPE = "client_credentials";

    private final WebClient webClient;

    private final CredentialStore credentialStore;

    private final RegistryProperties props;

    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    /** Last obtained credential. Guarded by {@link #lock}. */
    private Credential current;

    /** Refresh currently running, shared by all waiting callers. Guarded by {@link #lock}. */
    private Mono<Credential> inFlight;

    @Autowired
    public TokenManager(@Qualifier("registryWebClient") final WebClient webClient,
                        final CredentialStore credentialStore,
                        final RegistryProperties props) {
        this(webClient, credentialStore, props, Clock.systemUTC());
    }

    TokenManager(final WebClient webClient,
                 final CredentialStore credentialStore,
                 final RegistryProperties props,
                 final Clock clock) {
        this.webClient = webClient;
        this.credentialStore = credentialStore;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Returns a credential that stays valid for at least the safety margin,
     * refreshing it first when necessary.
     *
     * @return Mono emitting the credential, or erroring with
     *         {@link RegistryAuthException} (including its configuration subclass)
     */
    public Mono<Credential> getValidCredential() {
        return Mono.defer(this::currentOrRefresh);
    }

    /**
     * Drops the cached credential so that the next {@link #getValidCredential()}
     * refreshes it.
     */
    public void invalidate() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the cached credential only if it is still the one the registry
     * rejected. A credential already replaced by a concurrent refresh is kept.
     *
     * @param rejected credential the registry answered 401 to
     */
    public void invalidate(final Credential rejected) {
        lock.lock();
        try {
            if (current != null && current.equals(rejected)) {
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private Mono<Credential> currentOrRefresh() {
        lock.lock();
        try {
            if (current != null && current.isUsableAt(clock.instant(), margin())) {
                return Mono.just(current);
            }
            if (inFlight == null) {
                inFlight = startRefresh();
            }
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    private Mono<Credential> startRefresh() {
        AtomicReference<Mono<Credential>> self = new AtomicReference<>();
        Mono<Credential> refresh = requestToken()
                .doOnNext(this::store)
                .doOnTerminate(() -> release(self.get()))
                .cache();
        self.set(refresh);
        return refresh;
    }

    private void store(final Credential credential) {
        lock.lock();
        try {
            current = credential;
        } finally {
            lock.unlock();
        }
    }

    private void release(final Mono<Credential> finished) {
        lock.lock();
        try {
            if (inFlight == finished) {
                inFlight = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private Mono<Credential> requestToken() {
        return Mono.fromCallable(credentialStore::load)
                .flatMap(creds -> webClient.post()
                        .uri(URI.create(props.getTokenUrl()))
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .accept(MediaType.APPLICATION_JSON)
                        .body(BodyInserters.fromFormData(form(creds)))
                        .exchangeToMono(this::readToken)
                        .timeout(props.getTimeout()))
                .map(this::toCredential)
                .onErrorMap(e -> !(e instanceof RegistryAuthException),
                        e -> new RegistryAuthException("ICD-11 token request failed: " + e, e))
                .doOnError(e -> log.warn("ICD-11 token refresh failed: {}", e.getMessage()));
    }

    private static MultiValueMap<String, String> form(final RegistryCredentials creds) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", GRANT_TYPE);
        form.add("client_id", creds.clientId());
        form.add("client_secret", creds.clientSecret());
        form.add("scope", creds.scope());
        return form;
    }

    private Mono<TokenResponse> readToken(final ClientResponse response) {
        if (!response.statusCode().is2xxSuccessful()) {
            int status = response.statusCode().value();
            return response.releaseBody()
                    .then(Mono.error(new RegistryAuthException(
                            "ICD-11 token endpoint answered HTTP " + status)));
        }
        return response.bodyToMono(TokenResponse.class)
                .switchIfEmpty(Mono.error(new RegistryAuthException(
                        "ICD-11 token endpoint returned an empty body")));
    }

    private Credential toCredential(final TokenResponse token) {
        if (StringUtils.isBlank(token.accessToken()) || token.expiresIn() <= 0) {
            throw new RegistryAuthException("ICD-11 token response is missing access_token or expires_in");
        }
        Instant expiresAt = clock.instant()
                .plusSeconds(token.expiresIn())
                .minus(margin());
        Credential credential = new Credential(token.accessToken(), expiresAt);
        if (!credential.isUsableAt(clock.instant(), margin())) {
            throw new RegistryAuthException("ICD-11 token lifetime of " + token.expiresIn()
                    + "s is too short for the safety margin of " + margin().toSeconds() + "s");
        }
        log.info("Obtained ICD-11 bearer token, lifetime {}s, usable until {}", token.expiresIn(), expiresAt);
        return credential;
    }

    private Duration margin() {
        return props.getTokenSafetyMargin();
    }
}
