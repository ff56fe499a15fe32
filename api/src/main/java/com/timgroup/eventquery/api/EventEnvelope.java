package com.timgroup.eventquery.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An event as handed to a query's subscriber.
 * <p>
 * The offset is assigned when the envelope is emitted and is not a durable commit point:
 * running the same query again may assign different offsets.
 */
public final class EventEnvelope {
    private final String persistenceId;
    private final long sequenceNr;
    private final long offset;
    private final Object payload;

    private EventEnvelope(String persistenceId, long sequenceNr, long offset, Object payload) {
        this.persistenceId = requireNonNull(persistenceId);
        this.sequenceNr = sequenceNr;
        this.offset = offset;
        this.payload = requireNonNull(payload);
    }

    public static EventEnvelope eventEnvelope(String persistenceId, long sequenceNr, long offset, Object payload) {
        return new EventEnvelope(persistenceId, sequenceNr, offset, payload);
    }

    @Nonnull
    public String persistenceId() {
        return persistenceId;
    }

    public long sequenceNr() {
        return sequenceNr;
    }

    public long offset() {
        return offset;
    }

    @Nonnull
    public Object payload() {
        return payload;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventEnvelope that = (EventEnvelope) o;
        return sequenceNr == that.sequenceNr &&
                offset == that.offset &&
                persistenceId.equals(that.persistenceId) &&
                payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistenceId, sequenceNr, offset, payload);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
                "persistenceId='" + persistenceId + '\'' +
                ", sequenceNr=" + sequenceNr +
                ", offset=" + offset +
                ", payload=" + payload +
                '}';
    }
}
