package com.clinical.icdlookup.service;

import com.clinical.icdlookup.dto.LookupOutcome;
import com.clinical.icdlookup.dto.SearchQuery;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Debounced, last-intent-wins search for one input field.
 * <p>
 * Each {@link #submit(String)} bumps a generation counter and cancels the
 * pending debounce timer; a lookup starts only after the input has been
 * stable for the debounce window. A lookup that is already in flight when a
 * newer input arrives is left to finish (its result still lands in the result
 * cache) but its outcome is discarded because its generation is stale.
 * <p>
 * Instances are created per field with {@link SearchInputDebouncerFactory}.
 */
@Slf4j
public final class SearchInputDebouncer implements Disposable {

    private final LookupFacade facade;

    private final Duration window;

    private final int minQueryLength;

    private final Scheduler scheduler;

    private final Consumer<LookupOutcome> onOutcome;

    private final Consumer<Throwable> onFailure;

    private final AtomicLong generation = new AtomicLong();

    private final Disposable.Swap pendingTimer = Disposables.swap();

    private final AtomicBoolean disposed = new AtomicBoolean();

    SearchInputDebouncer(final LookupFacade facade,
                         final Duration window,
                         final int minQueryLength,
                         final Scheduler scheduler,
                         final Consumer<LookupOutcome> onOutcome,
                         final Consumer<Throwable> onFailure) {
        this.facade = facade;
        this.window = window;
        this.minQueryLength = minQueryLength;
        this.scheduler = scheduler;
        this.onOutcome = onOutcome;
        this.onFailure = onFailure;
    }

    /**
     * Records the latest content of the input field.
     *
     * @param input current text of the field
     */
    public void submit(final String input) {
        if (disposed.get()) {
            return;
        }
        long gen = generation.incrementAndGet();
        String trimmed = input == null ? "" : input.trim();

        if (trimmed.length() < minQueryLength) {
            pendingTimer.update(Disposables.disposed());
            onOutcome.accept(LookupOutcome.empty(SearchQuery.of(trimmed, 0, 0, "")));
            return;
        }
        // update() disposes the previous timer, which is the debounce
        pendingTimer.update(Mono.delay(window, scheduler)
                .subscribe(tick -> launch(gen, trimmed)));
    }

    private void launch(final long gen, final String text) {
        if (!isCurrent(gen)) {
            return;
        }
        facade.lookup(text).subscribe(
                outcome -> {
                    if (isCurrent(gen)) {
                        onOutcome.accept(outcome);
                    } else {
                        log.debug("Discarding superseded lookup result for '{}'", text);
                    }
                },
                error -> {
                    if (isCurrent(gen)) {
                        onFailure.accept(error);
                    } else {
                        log.debug("Discarding superseded lookup failure for '{}': {}", text, error.toString());
                    }
                });
    }

    private boolean isCurrent(final long gen) {
        return !disposed.get() && generation.get() == gen;
    }

    @Override
    public void dispose() {
        if (disposed.compareAndSet(false, true)) {
            pendingTimer.dispose();
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }
}
