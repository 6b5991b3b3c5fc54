package com.clinical.icdlookup.service.offline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Local table of catalog entries, readable without network access.
 * <p>
 * This repository is the only writer of {@code icd_catalog_entry}. Each
 * {@link #insertBatch(List)} call is one transaction, so readers only ever see
 * whole committed batches.
 */
@Slf4j
@Repository
public class OfflineCatalogStore {

    private static final int SEED_MARKER_ID = 1;

    private static final String INSERT_ENTRY = """
            INSERT INTO icd_catalog_entry (id, code, title, title_folded, uri, class_kind, chapter_code)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_BY_TITLE = """
            SELECT id, code, title, uri, class_kind, chapter_code
            FROM icd_catalog_entry
            WHERE class_kind IN (%s)
              AND title_folded LIKE ? ESCAPE '\\'
            ORDER BY code, title, id
            LIMIT ?
            """;

    private static final RowMapper<CatalogEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> new CatalogEntry(
            rs.getObject("id", UUID.class),
            rs.getString("code"),
            rs.getString("title"),
            rs.getString("uri"),
            ClassKind.fromWireName(rs.getString("class_kind")).orElse(ClassKind.CATEGORY),
            rs.getString("chapter_code"));

    private final JdbcTemplate jdbc;

    private final TransactionTemplate tx;

    public OfflineCatalogStore(final JdbcTemplate jdbc, final PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.tx = new TransactionTemplate(transactionManager);
    }

    public long countEntries() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM icd_catalog_entry", Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Inserts the rows and commits them together.
     *
     * @param batch rows to insert
     * @return number of rows committed
     */
    public int insertBatch(final List<CatalogEntry> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        tx.executeWithoutResult(status -> jdbc.batchUpdate(INSERT_ENTRY, batch, batch.size(), (ps, e) -> {
            ps.setObject(1, e.id());
            ps.setString(2, e.code());
            ps.setString(3, e.title());
            ps.setString(4, TitleFolding.fold(e.title()));
            ps.setString(5, e.uri());
            ps.setString(6, e.classKind().wireName());
            ps.setString(7, e.chapterCode());
        }));
        return batch.size();
    }

    /**
     * Entries of an assignable kind whose folded title contains {@code foldedText}.
     *
     * @param foldedText text already passed through {@link TitleFolding#fold(String)}
     * @param limit      maximum rows
     * @return matches ordered by code, title and id
     */
    public List<CatalogEntry> findAssignableByTitle(final String foldedText, final int limit) {
        Set<ClassKind> kinds = ClassKind.assignableKinds();
        List<Object> args = new ArrayList<>(kinds.size() + 2);
        kinds.forEach(k -> args.add(k.wireName()));
        args.add("%" + escapeLike(foldedText) + "%");
        args.add(limit);

        String placeholders = String.join(", ", Collections.nCopies(kinds.size(), "?"));
        return jdbc.query(SELECT_BY_TITLE.formatted(placeholders), ENTRY_ROW_MAPPER, args.toArray());
    }

    public boolean isSeedComplete() {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM icd_catalog_seed WHERE id = ?", Integer.class, SEED_MARKER_ID);
        return count != null && count > 0;
    }

    public void markSeedComplete(final long rowCount) {
        tx.executeWithoutResult(status -> {
            jdbc.update("DELETE FROM icd_catalog_seed WHERE id = ?", SEED_MARKER_ID);
            jdbc.update("INSERT INTO icd_catalog_seed (id, row_count, completed_at) VALUES (?, ?, ?)",
                    SEED_MARKER_ID, rowCount, Timestamp.from(Instant.now()));
        });
    }

    /**
     * Removes every entry and the completion marker; used before re-importing
     * after an interrupted run.
     */
    public void deleteAllEntries() {
        tx.executeWithoutResult(status -> {
            jdbc.update("DELETE FROM icd_catalog_seed");
            int removed = jdbc.update("DELETE FROM icd_catalog_entry");
            log.info("Removed {} offline catalog entries", removed);
        });
    }

    private static String escapeLike(final String text) {
        return text.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
