package com.clinical.icdlookup.controller;

import com.clinical.icdlookup.dto.CatalogStatus;
import com.clinical.icdlookup.dto.LookupResponse;
import com.clinical.icdlookup.error.LookupException;
import com.clinical.icdlookup.service.LookupFacade;
import com.clinical.icdlookup.service.offline.OfflineCatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST controller exposing the diagnostic code search to form front ends.
 * <p>
 * Example request:
 * <pre>{@code
 * GET /api/icd/search?q=depresion&limit=10
 * }</pre>
 * The response carries {@code degraded=true} when the answer came from the
 * offline catalog. When neither the registry nor the offline catalog can
 * answer, the endpoint replies {@code 503} with the failure kind.
 */
@Slf4j
@RestController
@RequestMapping("/api/icd")
@RequiredArgsConstructor
public class DiagnosisLookupController {

    private final LookupFacade facade;

    private final OfflineCatalogStore catalogStore;

    /**
     * Search ICD-11 MMS entities by free text.
     *
     * @param q      text typed by the user
     * @param offset zero-based page offset
     * @param limit  page size; {@code 0} uses the configured default
     * @param lang   language tag; blank uses the configured default
     * @return matches with their source
     */
    @GetMapping(value = "/search", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LookupResponse> search(
            @RequestParam("q") final String q,
            @RequestParam(value = "offset", defaultValue = "0") final int offset,
            @RequestParam(value = "limit", defaultValue = "0") final int limit,
            @RequestParam(value = "lang", required = false) final String lang) {

        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must not be negative");
        }
        return facade.lookup(q, offset, limit, lang).map(LookupResponse::from);
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        facade.clearCache();
        return ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/catalog", produces = MediaType.APPLICATION_JSON_VALUE)
    public CatalogStatus catalog() {
        return new CatalogStatus(catalogStore.countEntries(), catalogStore.isSeedComplete());
    }

    @ExceptionHandler(LookupException.class)
    public ResponseEntity<Map<String, String>> onLookupFailure(final LookupException ex) {
        log.warn("ICD-11 lookup failed ({}): {}", ex.kind(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", String.valueOf(ex.getMessage()), "kind", ex.kind().name()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onBadRequest(final IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
