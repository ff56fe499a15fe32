package com.timgroup.eventquery.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

public final class Event {
    private final String persistenceId;
    private final long sequenceNr;
    private final long timestamp;
    private final Object payload;

    private Event(String persistenceId, long sequenceNr, long timestamp, Object payload) {
        this.persistenceId = requireNonNull(persistenceId);
        if (sequenceNr < 0) {
            throw new IllegalArgumentException("Sequence number cannot be negative. Got " + sequenceNr);
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("Timestamp cannot be negative. Got " + timestamp);
        }
        this.sequenceNr = sequenceNr;
        this.timestamp = timestamp;
        this.payload = requireNonNull(payload);
    }

    public static Event event(String persistenceId, long sequenceNr, long timestamp, Object payload) {
        return new Event(persistenceId, sequenceNr, timestamp, payload);
    }

    public EventEnvelope toEnvelope(long offset) {
        return EventEnvelope.eventEnvelope(persistenceId, sequenceNr, offset, payload);
    }

    @Nonnull
    public String locator() {
        return String.format("<%s/%s>@%s", persistenceId, sequenceNr, timestamp);
    }

    @Nonnull
    public String persistenceId() {
        return persistenceId;
    }

    public long sequenceNr() {
        return sequenceNr;
    }

    public long timestamp() {
        return timestamp;
    }

    @Nonnull
    public Object payload() {
        return payload;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event that = (Event) o;
        return sequenceNr == that.sequenceNr &&
                timestamp == that.timestamp &&
                persistenceId.equals(that.persistenceId) &&
                payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistenceId, sequenceNr, timestamp, payload);
    }

    @Override
    public String toString() {
        return "Event{" +
                "persistenceId='" + persistenceId + '\'' +
                ", sequenceNr=" + sequenceNr +
                ", timestamp=" + timestamp +
                ", payload=" + payload +
                '}';
    }
}
