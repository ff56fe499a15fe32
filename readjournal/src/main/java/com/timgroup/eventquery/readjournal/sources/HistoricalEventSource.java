package com.timgroup.eventquery.readjournal.sources;

import com.codahale.metrics.Timer;
import com.timgroup.eventquery.api.Cursor;
import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.EventStorage;
import com.timgroup.eventquery.api.HistoricalScope;
import com.timgroup.eventquery.api.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Reads persisted events page by page through a storage cursor.
 * <p>
 * The cursor is opened on subscription, so a storage failure to open it fails the stream before any event.
 * One page is read ahead of demand. The latest cursor is discarded exactly once, whether the stream completes,
 * is cancelled or fails.
 */
@ParametersAreNonnullByDefault
public final class HistoricalEventSource {
    private static final Logger LOG = LoggerFactory.getLogger(HistoricalEventSource.class);

    private final EventStorage storage;
    private final int pageSize;
    private final Optional<Timer> pageFetchTimer;

    public HistoricalEventSource(EventStorage storage, int pageSize, Optional<Timer> pageFetchTimer) {
        checkArgument(pageSize > 0, "page size must be positive. Got %s", pageSize);
        this.storage = requireNonNull(storage);
        this.pageSize = pageSize;
        this.pageFetchTimer = requireNonNull(pageFetchTimer);
    }

    public HistoricalEventSource(EventStorage storage, int pageSize) {
        this(storage, pageSize, Optional.empty());
    }

    @Nonnull
    @CheckReturnValue
    public Flux<Event> events(HistoricalScope scope) {
        requireNonNull(scope);
        return Flux.defer(() -> {
            AtomicReference<Cursor> current = new AtomicReference<>();
            return Flux.<List<Event>, Cursor>generate(
                    () -> {
                        Cursor cursor = storage.openCursor(scope);
                        current.set(cursor);
                        return cursor;
                    },
                    (cursor, sink) -> {
                        Page page = fetch(cursor);
                        current.set(page.cursor());
                        sink.next(page.events());
                        if (page.isExhausted()) {
                            sink.complete();
                        }
                        return page.cursor();
                    })
                    .<Event>concatMapIterable(events -> events, 1)
                    .doFinally(signal -> release(scope, current.getAndSet(null)));
        });
    }

    private Page fetch(Cursor cursor) {
        try (Timer.Context c = pageFetchTimer.map(Timer::time).orElseGet(() -> new Timer().time())) {
            return storage.nextPage(cursor, pageSize);
        }
    }

    private void release(HistoricalScope scope, @Nullable Cursor cursor) {
        if (cursor == null) {
            return;
        }
        try {
            storage.discard(cursor);
        } catch (RuntimeException e) {
            LOG.warn("Failed to discard cursor " + cursor + " for " + scope, e);
        }
    }

    @Override
    public String toString() {
        return "HistoricalEventSource{" +
                "storage=" + storage +
                ", pageSize=" + pageSize +
                '}';
    }
}
