package com.timgroup.eventquery.api;

import reactor.core.publisher.Flux;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Queries over the event journal.
 * <p>
 * Each returned {@link Flux} is cold: every subscription runs an independent query with its own state.
 * The {@code current*} queries complete once the persisted history is exhausted; the others continue
 * with live events until cancelled. Invalid arguments are rejected with {@link IllegalArgumentException}
 * before any I/O.
 */
@ParametersAreNonnullByDefault
public interface ReadJournal {
    @Nonnull
    @CheckReturnValue
    Flux<EventEnvelope> currentEventsForEntity(String persistenceId, long fromSequenceNr, long toSequenceNr);

    @Nonnull
    @CheckReturnValue
    default Flux<EventEnvelope> currentAllEvents() {
        return currentAllEvents(0L);
    }

    @Nonnull
    @CheckReturnValue
    Flux<EventEnvelope> currentAllEvents(long fromOffset);

    @Nonnull
    @CheckReturnValue
    Flux<EventEnvelope> eventsForEntity(String persistenceId, long fromSequenceNr, long toSequenceNr);

    @Nonnull
    @CheckReturnValue
    default Flux<EventEnvelope> allEvents() {
        return allEvents(0L);
    }

    @Nonnull
    @CheckReturnValue
    Flux<EventEnvelope> allEvents(long fromOffset);

    @Nonnull
    @CheckReturnValue
    Flux<String> currentDistinctEntityIds();

    @Nonnull
    @CheckReturnValue
    Flux<String> allDistinctEntityIds();
}
