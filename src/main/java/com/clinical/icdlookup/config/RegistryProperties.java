package com.clinical.icdlookup.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the WHO ICD-11 registry integration.
 *
 * <p>Values are bound from properties prefixed with {@code icd.registry}. The
 * client credentials are expected to come from the untracked {@code .env}
 * file through {@link DotenvEnvironmentPostProcessor}.</p>
 *
 * <p>Example application.yml snippet:
 * <pre>
 * icd:
 *   registry:
 *     token-url: https://icdaccessmanagement.who.int/connect/token
 *     base-url: https://id.who.int
 *     release: 2024-01
 *     credentials:
 *       client-id: ${ICD_CLIENT_ID:}
 *       client-secret: ${ICD_CLIENT_SECRET:}
 * </pre>
 * </p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "icd.registry")
public class RegistryProperties {

    /** OAuth2 token endpoint (client-credentials grant). */
    @NotBlank
    private String tokenUrl = "https://icdaccessmanagement.who.int/connect/token";

    /** Base URL of the registry API; the release path is appended to it. */
    @NotBlank
    private String baseUrl = "https://id.who.int";

    /** MMS linearization release to query, e.g. "2024-01". */
    @NotBlank
    private String release = "2024-01";

    /** OAuth2 scope requested with the token. */
    @NotBlank
    private String scope = "icdapi_access";

    /** Value of the {@code API-Version} header. */
    @NotBlank
    private String apiVersion = "v2";

    /** Language used when the caller does not name one. */
    @NotBlank
    private String defaultLanguage = "es";

    /** Page size used when the caller does not name one. */
    @Min(1)
    private int defaultLimit = 25;

    /** Queries shorter than this (after trimming) never reach the registry. */
    @Min(1)
    private int minQueryLength = 3;

    /**
     * Margin subtracted from the declared token lifetime; a credential is
     * refreshed once it gets this close to its stored expiry.
     */
    @NotNull
    private Duration tokenSafetyMargin = Duration.ofSeconds(60);

    /** Blocking budget for one registry round-trip. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /** Quiet period before a typed query is actually searched. */
    @NotNull
    private Duration debounce = Duration.ofMillis(400);

    /** Client credentials, normally sourced from {@code .env}. */
    @Valid
    private Credentials credentials = new Credentials();

    /** Simple client-side rate limiting. */
    @Valid
    private RateLimit rateLimit = new RateLimit();

    /**
     * Path of the flat MMS search endpoint for the configured release.
     *
     * @return e.g. {@code /icd/release/11/2024-01/mms/search}
     */
    public String searchPath() {
        return "/icd/release/11/" + release + "/mms/search";
    }

    @Data
    public static class Credentials {

        /** OAuth2 client id issued by the WHO ICD API portal. */
        private String clientId;

        /** OAuth2 client secret issued by the WHO ICD API portal. */
        private String clientSecret;
    }

    @Data
    public static class RateLimit {

        /** Allowed number of HTTP requests per second */
        @Min(1)
        private int permitsPerSecond = 5;

        /** Max burst capacity */
        @Min(1)
        private int burst = 5;

        /** How long a caller may wait for a permit before giving up. */
        @NotNull
        private Duration acquireTimeout = Duration.ofSeconds(2);
    }
}
