package com.timgroup.eventquery.readjournal;

import com.codahale.metrics.MetricRegistry;
import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.EventEnvelope;
import com.timgroup.eventquery.api.EventStorage;
import com.timgroup.eventquery.api.HistoricalScope;
import com.timgroup.eventquery.api.LiveEventNotifier;
import com.timgroup.eventquery.api.ReadJournal;
import com.timgroup.eventquery.readjournal.merging.ReplayToLiveMerge;
import com.timgroup.eventquery.readjournal.sources.HistoricalEventSource;
import com.timgroup.eventquery.readjournal.sources.LiveEventFeed;
import com.timgroup.eventquery.readjournal.stages.DuplicateSuppressor;
import com.timgroup.eventquery.readjournal.stages.SequenceTruncator;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * {@link ReadJournal} over an {@link EventStorage} for history and a {@link LiveEventNotifier} for new events.
 * <p>
 * The storage and notifier are owned by the caller; this class holds no per-query state.
 */
public final class ReactiveReadJournal implements ReadJournal {
    public static final String PAGE_FETCH_TIMER = "tg-eventquery.historical.page-fetch";
    public static final String LIVE_DROPPED_COUNTER = "tg-eventquery.live.dropped";

    private final HistoricalEventSource historicalSource;
    private final LiveEventFeed liveFeed;
    private final ReadJournalSettings settings;

    public ReactiveReadJournal(EventStorage storage, LiveEventNotifier notifier, ReadJournalSettings settings, Optional<MetricRegistry> metricRegistry) {
        requireNonNull(storage);
        requireNonNull(notifier);
        this.settings = requireNonNull(settings);
        this.historicalSource = new HistoricalEventSource(storage, settings.historicalPageSize(), metricRegistry.map(r -> r.timer(PAGE_FETCH_TIMER)));
        this.liveFeed = new LiveEventFeed(notifier, settings.liveBufferSize(), metricRegistry.map(r -> r.counter(LIVE_DROPPED_COUNTER)));
    }

    public ReactiveReadJournal(EventStorage storage, LiveEventNotifier notifier, ReadJournalSettings settings) {
        this(storage, notifier, settings, Optional.empty());
    }

    public ReactiveReadJournal(EventStorage storage, LiveEventNotifier notifier) {
        this(storage, notifier, ReadJournalSettings.defaults());
    }

    @Override
    public Flux<EventEnvelope> currentEventsForEntity(String persistenceId, long fromSequenceNr, long toSequenceNr) {
        HistoricalScope scope = entityScope(persistenceId, fromSequenceNr, toSequenceNr);
        return historicalSource.events(scope)
                .filter(scope::includes)
                .map(EnvelopeConstructor.bySequenceNr());
    }

    @Override
    public Flux<EventEnvelope> currentAllEvents(long fromOffset) {
        HistoricalScope scope = allEventsScope(fromOffset);
        return historicalSource.events(scope)
                .map(EnvelopeConstructor.byTimestamp());
    }

    @Override
    public Flux<EventEnvelope> eventsForEntity(String persistenceId, long fromSequenceNr, long toSequenceNr) {
        HistoricalScope scope = entityScope(persistenceId, fromSequenceNr, toSequenceNr);
        return Flux.from(ReplayToLiveMerge.of(scope, historicalSource, liveFeed, settings.maxPendingEvents()))
                .filter(scope::includes)
                .transform(SequenceTruncator.stopAt(toSequenceNr))
                .transform(DuplicateSuppressor.suppressDuplicateEvents())
                .map(EnvelopeConstructor.bySequenceNr());
    }

    @Override
    public Flux<EventEnvelope> allEvents(long fromOffset) {
        HistoricalScope scope = allEventsScope(fromOffset);
        return Flux.from(ReplayToLiveMerge.of(scope, historicalSource, liveFeed, settings.maxPendingEvents()))
                .transform(DuplicateSuppressor.suppressDuplicateEvents())
                .map(EnvelopeConstructor.byTimestamp());
    }

    @Override
    public Flux<String> currentDistinctEntityIds() {
        return historicalSource.events(HistoricalScope.allEvents(0L))
                .map(Event::persistenceId)
                .transform(DuplicateSuppressor.<String>suppressRepeats());
    }

    /**
     * Ids from the persisted history first, then ids of newly appended events. The live registration is made
     * before the history is read, so no entity created in between is missed; live ids seen meanwhile are kept
     * until the history is exhausted.
     */
    @Override
    public Flux<String> allDistinctEntityIds() {
        return Flux.defer(() -> {
            Sinks.Many<String> liveIds = Sinks.many().unicast().onBackpressureBuffer();
            Disposable registration = liveFeed.events(event -> true)
                    .subscribe(event -> liveIds.tryEmitNext(event.persistenceId()), liveIds::tryEmitError, liveIds::tryEmitComplete);
            return Flux.concat(
                    historicalSource.events(HistoricalScope.allEvents(0L)).map(Event::persistenceId),
                    liveIds.asFlux())
                    .doFinally(signal -> registration.dispose());
        }).transform(DuplicateSuppressor.<String>suppressRepeats());
    }

    private static HistoricalScope entityScope(String persistenceId, long fromSequenceNr, long toSequenceNr) {
        checkArgument(persistenceId != null, "persistence id is required");
        checkArgument(fromSequenceNr >= 0, "from sequence number cannot be negative. Got %s", fromSequenceNr);
        checkArgument(toSequenceNr >= fromSequenceNr, "to sequence number %s is before from sequence number %s", toSequenceNr, fromSequenceNr);
        return HistoricalScope.entity(persistenceId, fromSequenceNr, toSequenceNr);
    }

    private static HistoricalScope allEventsScope(long fromOffset) {
        checkArgument(fromOffset >= 0, "offset cannot be negative. Got %s", fromOffset);
        return HistoricalScope.allEvents(fromOffset);
    }

    @Override
    public String toString() {
        return "ReactiveReadJournal{" +
                "historicalSource=" + historicalSource +
                ", liveFeed=" + liveFeed +
                ", settings=" + settings +
                '}';
    }
}
