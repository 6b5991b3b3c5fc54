package com.clinical.icdlookup.service.offline;

import com.clinical.icdlookup.config.OfflineCatalogProperties;
import com.clinical.icdlookup.error.CatalogSeedException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <h2>One-time offline catalog import</h2>
 *
 * <p>Streams the bundled JSON array (tens of thousands of rows) into
 * {@link OfflineCatalogStore}, committing every {@code icd.offline.batch-size}
 * rows so memory stays bounded and a crash loses at most the uncommitted tail.</p>
 *
 * <p>Completion is recorded with an explicit marker written after the last
 * batch:</p>
 * <ol>
 *   <li>marker present → nothing to do;</li>
 *   <li>dataset missing → nothing to do, offline search stays as it is;</li>
 *   <li>rows present without marker → the previous import was interrupted, its
 *       rows are removed and the import starts over;</li>
 *   <li>otherwise import, then write the marker.</li>
 * </ol>
 * <p>Within a run the target is empty, so rows are inserted without per-row
 * existence checks. The check and the import run under one lock, so concurrent
 * callers import at most once and never see another caller's batches as
 * leftovers.</p>
 */
@Slf4j
@Service
public class CatalogSeeder {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final OfflineCatalogStore store;

    private final ObjectMapper mapper;

    private final int batchSize;

    private final ReentrantLock seedLock = new ReentrantLock();

    public CatalogSeeder(final OfflineCatalogStore store,
                         @Qualifier("registryObjectMapper") final ObjectMapper mapper,
                         final OfflineCatalogProperties props) {
        this.store = store;
        this.mapper = mapper;
        this.batchSize = props.getBatchSize();
    }

    /**
     * Imports the dataset unless a previous import already completed.
     *
     * @param dataset bundled JSON array of {@code {code, title, uri, classKind, chapterCode}};
     *                may be {@code null} or point at a missing resource
     * @return number of rows inserted by this call
     * @throws CatalogSeedException if the dataset cannot be read or decoded, or a batch cannot be written
     */
    public long seedIfNeeded(@Nullable final Resource dataset) {
        seedLock.lock();
        try {
            if (store.isSeedComplete()) {
                log.debug("Offline ICD-11 catalog already seeded");
                return 0L;
            }
            if (dataset == null || !dataset.exists()) {
                log.warn("Offline ICD-11 dataset {} not found; offline search will stay empty", dataset);
                return 0L;
            }
            long leftovers = store.countEntries();
            if (leftovers > 0) {
                log.warn("Found {} offline catalog rows from an interrupted import; re-importing", leftovers);
                store.deleteAllEntries();
            }
            return importDataset(dataset);
        } catch (DataAccessException ex) {
            throw new CatalogSeedException("Offline catalog could not be written: " + ex.getMessage(), ex);
        } finally {
            seedLock.unlock();
        }
    }

    private long importDataset(final Resource dataset) {
        long t0 = System.nanoTime();
        long inserted = 0;
        int skipped = 0;
        int commits = 0;

        try (InputStream in = dataset.getInputStream();
             MappingIterator<SeedRow> rows = mapper.readerFor(SeedRow.class).readValues(in)) {

            List<CatalogEntry> batch = new ArrayList<>(batchSize);
            while (rows.hasNextValue()) {
                Optional<CatalogEntry> entry = rows.nextValue().toEntry();
                if (entry.isEmpty()) {
                    skipped++;
                    continue;
                }
                batch.add(entry.get());
                if (batch.size() == batchSize) {
                    inserted += store.insertBatch(batch);
                    commits++;
                    batch = new ArrayList<>(batchSize);
                }
            }
            if (!batch.isEmpty()) {
                inserted += store.insertBatch(batch);
                commits++;
            }
        } catch (IOException | RuntimeJsonMappingException ex) {
            throw new CatalogSeedException("Offline ICD-11 dataset " + dataset.getDescription()
                    + " is unreadable after " + inserted + " rows: " + ex.getMessage(), ex);
        }

        store.markSeedComplete(inserted);
        if (skipped > 0) {
            log.warn("Skipped {} dataset rows without title, uri or a known classKind", skipped);
        }
        log.info("Seeded offline ICD-11 catalog: {} rows in {} commits, {} ms",
                inserted, commits, (System.nanoTime() - t0) / NANOS_PER_MILLI);
        return inserted;
    }
}
