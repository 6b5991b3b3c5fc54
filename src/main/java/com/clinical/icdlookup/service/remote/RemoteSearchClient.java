package com.clinical.icdlookup.service.remote;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.SearchResult;
import com.clinical.icdlookup.error.LookupException;
import com.clinical.icdlookup.error.RegistryAuthException;
import com.clinical.icdlookup.error.RegistryNetworkException;
import com.clinical.icdlookup.error.RegistryParseException;
import com.clinical.icdlookup.parser.SearchResultParser;
import com.clinical.icdlookup.service.auth.Credential;
import com.clinical.icdlookup.service.auth.TokenManager;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * <h2>ICD-11 registry search client</h2>
 *
 * <p>Issues authenticated flat searches against
 * <code>{base-url}/icd/release/11/{release}/mms/search</code> and turns the
 * answer into {@link SearchResult} values.</p>
 *
 * <p>Behaviour:</p>
 * <ul>
 *   <li>Input shorter than {@code icd.registry.min-query-length} after
 *       trimming yields an empty list without asking for a token or touching
 *       the network.</li>
 *   <li>A 401 invalidates the credential, fetches a new one and repeats the
 *       same request exactly once; a retry that is not 2xx surfaces as
 *       {@link RegistryAuthException}.</li>
 *   <li>Every outbound request waits for a permit from the registry
 *       {@link RateLimiter}; the whole search runs inside the registry
 *       {@link CircuitBreaker}.</li>
 *   <li>All failures leave as a {@link LookupException} subclass.</li>
 * </ul>
 */
@Slf4j
@Service
public class RemoteSearchClient {

    /** Nanoseconds per millisecond, for timing logs. */
    private static final long NANOS_PER_MILLI = 1_000_000L;

    private static final String API_VERSION_HEADER = "API-Version";

    private final WebClient webClient;

    private final TokenManager tokenManager;

    private final SearchResultParser parser;

    private final ObjectMapper mapper;

    private final RegistryProperties props;

    private final CircuitBreaker circuitBreaker;

    private final RateLimiter rateLimiter;

    public RemoteSearchClient(@Qualifier("registryWebClient") final WebClient webClient,
                              final TokenManager tokenManager,
                              @Qualifier("icdSearchParser") final SearchResultParser parser,
                              @Qualifier("registryObjectMapper") final ObjectMapper mapper,
                              final RegistryProperties props,
                              final CircuitBreaker registryCircuitBreaker,
                              final RateLimiter registryRateLimiter) {
        this.webClient = webClient;
        this.tokenManager = tokenManager;
        this.parser = parser;
        this.mapper = mapper;
        this.props = props;
        this.circuitBreaker = registryCircuitBreaker;
        this.rateLimiter = registryRateLimiter;
    }

    /**
     * Searches the registry.
     *
     * @param text     free text typed by the user
     * @param offset   zero-based offset of the first result
     * @param limit    maximum number of results
     * @param language language tag for titles, sent as {@code Accept-Language}
     * @return Mono emitting the parsed results (possibly empty), or erroring with
     *         {@link RegistryNetworkException}, {@link RegistryAuthException} or
     *         {@link RegistryParseException}
     */
    public Mono<List<SearchResult>> search(final String text, final int offset, final int limit,
                                           final String language) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.length() < props.getMinQueryLength()) {
            return Mono.just(List.of());
        }
        URI uri = searchUri(trimmed, offset, limit);

        return Mono.defer(() -> {
                    long t0 = System.nanoTime();
                    return tokenManager.getValidCredential()
                            .flatMap(credential -> execute(uri, credential, language)
                                    .flatMap(reply -> reply.unauthorized()
                                            ? retryOnce(uri, credential, language)
                                            : Mono.just(reply)))
                            .map(reply -> {
                                long t1 = System.nanoTime();
                                List<SearchResult> results = parser.parse(reply.body());
                                log.info("ICD-11 search '{}' → {} result(s)  NET+PARSE={} ms",
                                        trimmed, results.size(), (System.nanoTime() - t0) / NANOS_PER_MILLI);
                                log.debug("ICD-11 parse took {} ms", (System.nanoTime() - t1) / NANOS_PER_MILLI);
                                return results;
                            });
                })
                // classified before the breaker sees it: only network failures count against the circuit
                .onErrorMap(e -> !(e instanceof LookupException), RemoteSearchClient::classify)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorMap(e -> !(e instanceof LookupException), RemoteSearchClient::classify);
    }

    private Mono<RegistryReply> retryOnce(final URI uri, final Credential rejected, final String language) {
        log.info("ICD-11 registry rejected the bearer token; refreshing and retrying once");
        tokenManager.invalidate(rejected);
        return tokenManager.getValidCredential()
                .flatMap(fresh -> execute(uri, fresh, language))
                .flatMap(reply -> reply.unauthorized()
                        ? Mono.error(new RegistryAuthException(
                                "ICD-11 registry rejected a freshly issued token"))
                        : Mono.just(reply))
                .onErrorMap(RegistryNetworkException.class, e -> e.statusCode().isPresent()
                        ? new RegistryAuthException("ICD-11 retry after token refresh failed: "
                                + e.getMessage(), e)
                        : e);
    }

    private Mono<RegistryReply> execute(final URI uri, final Credential credential, final String language) {
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential.bearerToken())
                .header(API_VERSION_HEADER, props.getApiVersion())
                .header(HttpHeaders.ACCEPT_LANGUAGE, language)
                .exchangeToMono(this::readReply)
                .timeout(props.getTimeout())
                .transformDeferred(RateLimiterOperator.of(rateLimiter));
    }

    private Mono<RegistryReply> readReply(final ClientResponse response) {
        int status = response.statusCode().value();
        if (status == HttpStatus.UNAUTHORIZED.value()) {
            return response.releaseBody().thenReturn(RegistryReply.UNAUTHORIZED);
        }
        if (!response.statusCode().is2xxSuccessful()) {
            return response.releaseBody().then(Mono.error(new RegistryNetworkException(status)));
        }
        return response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(this::toJson)
                .map(RegistryReply::ok);
    }

    private JsonNode toJson(final byte[] bytes) {
        if (bytes.length == 0) {
            throw new RegistryParseException("ICD-11 registry returned an empty body");
        }
        try {
            return mapper.readTree(bytes);
        } catch (IOException ex) {
            throw new RegistryParseException("ICD-11 registry returned malformed JSON: " + ex.getMessage(), ex);
        }
    }

    private URI searchUri(@NonNull final String text, final int offset, final int limit) {
        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("q", text);
        q.add("flatResults", "true");
        q.add("offset", String.valueOf(Math.max(offset, 0)));
        q.add("limit", String.valueOf(limit > 0 ? limit : props.getDefaultLimit()));

        return UriComponentsBuilder.fromUriString(props.getBaseUrl())
                .path(props.searchPath())
                .queryParams(q)
                .encode()
                .build()
                .toUri();
    }

    private static LookupException classify(final Throwable e) {
        if (e instanceof CallNotPermittedException) {
            return new RegistryNetworkException("ICD-11 registry circuit is open", e);
        }
        if (e instanceof RequestNotPermitted) {
            return new RegistryNetworkException("ICD-11 registry rate limit exceeded", e);
        }
        if (e instanceof TimeoutException) {
            return new RegistryNetworkException("ICD-11 registry timed out", e);
        }
        return new RegistryNetworkException("ICD-11 registry unreachable: " + e.getMessage(), e);
    }

    /**
     * Outcome of one HTTP exchange: either a 401 or a parsed 2xx body.
     */
    private record RegistryReply(boolean unauthorized, JsonNode body) {

        static final RegistryReply UNAUTHORIZED = new RegistryReply(true, null);

        static RegistryReply ok(final JsonNode body) {
            return new RegistryReply(false, body);
        }
    }
}
