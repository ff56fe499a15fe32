package com.timgroup.eventquery.readjournal.stages;

import com.timgroup.eventquery.api.Event;
import reactor.core.publisher.Flux;

import java.util.function.Function;

/**
 * Completes a stream right after the event carrying the target sequence number, cancelling upstream.
 * <p>
 * A stream that never reaches the target ends only when its source does.
 */
public final class SequenceTruncator implements Function<Flux<Event>, Flux<Event>> {
    private final long toSequenceNr;

    private SequenceTruncator(long toSequenceNr) {
        this.toSequenceNr = toSequenceNr;
    }

    public static SequenceTruncator stopAt(long toSequenceNr) {
        return new SequenceTruncator(toSequenceNr);
    }

    @Override
    public Flux<Event> apply(Flux<Event> events) {
        return events.takeUntil(event -> event.sequenceNr() == toSequenceNr);
    }

    @Override
    public String toString() {
        return "SequenceTruncator{toSequenceNr=" + toSequenceNr + '}';
    }
}
