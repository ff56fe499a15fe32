package com.timgroup.eventquery.readjournal;

import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.EventEnvelope;

import java.util.function.Function;
import java.util.function.ToLongFunction;

import static java.util.Objects.requireNonNull;

/**
 * Wraps events leaving a query, choosing what the envelope offset is.
 */
public final class EnvelopeConstructor implements Function<Event, EventEnvelope> {
    private static final EnvelopeConstructor BY_SEQUENCE_NR = new EnvelopeConstructor("sequenceNr", Event::sequenceNr);
    private static final EnvelopeConstructor BY_TIMESTAMP = new EnvelopeConstructor("timestamp", Event::timestamp);

    private final String name;
    private final ToLongFunction<Event> offset;

    private EnvelopeConstructor(String name, ToLongFunction<Event> offset) {
        this.name = requireNonNull(name);
        this.offset = requireNonNull(offset);
    }

    public static EnvelopeConstructor bySequenceNr() {
        return BY_SEQUENCE_NR;
    }

    /**
     * Offsets usable as the starting offset of a later all-events query.
     */
    public static EnvelopeConstructor byTimestamp() {
        return BY_TIMESTAMP;
    }

    @Override
    public EventEnvelope apply(Event event) {
        return event.toEnvelope(offset.applyAsLong(event));
    }

    @Override
    public String toString() {
        return "EnvelopeConstructor{offset=" + name + '}';
    }
}
