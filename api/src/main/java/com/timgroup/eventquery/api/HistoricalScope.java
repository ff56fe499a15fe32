package com.timgroup.eventquery.api;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * What a historical scan covers: either the whole journal from an offset, or one
 * entity's events between two inclusive sequence numbers.
 */
public final class HistoricalScope {
    private final String persistenceId;
    private final long from;
    private final long to;

    private HistoricalScope(@Nullable String persistenceId, long from, long to) {
        this.persistenceId = persistenceId;
        this.from = from;
        this.to = to;
    }

    public static HistoricalScope allEvents(long fromOffset) {
        return new HistoricalScope(null, fromOffset, Long.MAX_VALUE);
    }

    public static HistoricalScope entity(String persistenceId, long fromSequenceNr, long toSequenceNr) {
        return new HistoricalScope(requireNonNull(persistenceId), fromSequenceNr, toSequenceNr);
    }

    public boolean isAllEvents() {
        return persistenceId == null;
    }

    public Optional<String> persistenceId() {
        return Optional.ofNullable(persistenceId);
    }

    /**
     * Lower bound: a timestamp offset for the whole journal, a sequence number for an entity.
     */
    public long from() {
        return from;
    }

    public long to() {
        return to;
    }

    public boolean includes(Event event) {
        if (persistenceId == null) {
            return event.timestamp() >= from;
        }
        return persistenceId.equals(event.persistenceId())
                && event.sequenceNr() >= from
                && event.sequenceNr() <= to;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HistoricalScope that = (HistoricalScope) o;
        return from == that.from &&
                to == that.to &&
                Objects.equals(persistenceId, that.persistenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistenceId, from, to);
    }

    @Override
    public String toString() {
        if (persistenceId == null) {
            return "HistoricalScope{all events from offset " + from + "}";
        }
        return "HistoricalScope{" +
                "persistenceId='" + persistenceId + '\'' +
                ", from=" + from +
                ", to=" + to +
                '}';
    }
}
