package com.clinical.icdlookup.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code icd.offline} section: where the bundled seed dataset lives
 * and how it is imported.
 *
 * <pre>
 * icd:
 *   offline:
 *     enabled: true
 *     dataset: classpath:icd11_mms_es.json
 *     batch-size: 1000
 * </pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "icd.offline")
public class OfflineCatalogProperties {

    /** Whether the startup import should run at all. */
    private boolean enabled = true;

    /** Bundled JSON array of catalog rows; may point at a missing resource. */
    private Resource dataset;

    /** Rows per commit during the import. */
    @Min(1)
    private int batchSize = 1_000;
}
