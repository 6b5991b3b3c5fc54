package com.clinical.icdlookup.service.offline;

import com.clinical.icdlookup.config.OfflineCatalogProperties;
import com.clinical.icdlookup.error.CatalogSeedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Kicks off the offline catalog import once the application is ready.
 * <p>
 * The import runs on a bounded-elastic worker so the first interactive search
 * is never held up; searches falling back to the catalog meanwhile see the
 * batches committed so far. A failed import is logged and otherwise ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogSeedRunner {

    private final CatalogSeeder seeder;

    private final OfflineCatalogProperties props;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        seedInBackground().subscribe();
    }

    /**
     * @return Mono emitting the number of imported rows; never errors
     */
    Mono<Long> seedInBackground() {
        if (!props.isEnabled()) {
            log.info("Offline ICD-11 catalog import disabled (icd.offline.enabled=false)");
            return Mono.just(0L);
        }
        return Mono.fromCallable(() -> seeder.seedIfNeeded(props.getDataset()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(CatalogSeedException.class, ex -> {
                    log.error("Offline ICD-11 catalog import failed; offline search will be incomplete", ex);
                    return Mono.just(0L);
                })
                .onErrorResume(DataAccessException.class, ex -> {
                    log.error("Offline ICD-11 catalog unavailable: {}", ex.getMessage());
                    return Mono.just(0L);
                });
    }
}
