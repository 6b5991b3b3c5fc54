package com.clinical.icdlookup.service;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.LookupOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

import java.util.function.Consumer;

/**
 * Creates one {@link SearchInputDebouncer} per input field, using the
 * configured debounce window ({@code icd.registry.debounce}) and minimum
 * query length.
 */
@Component
@RequiredArgsConstructor
public class SearchInputDebouncerFactory {

    private final LookupFacade facade;

    private final RegistryProperties props;

    /**
     * @param onOutcome receives every outcome of the latest input, including
     *                  the immediate empty outcome for too-short input
     * @param onFailure receives the failure of the latest input when no source
     *                  could answer it
     * @return a new debouncer; dispose it when the field goes away
     */
    public SearchInputDebouncer create(final Consumer<LookupOutcome> onOutcome,
                                       final Consumer<Throwable> onFailure) {
        return new SearchInputDebouncer(facade, props.getDebounce(), props.getMinQueryLength(),
                Schedulers.parallel(), onOutcome, onFailure);
    }
}
