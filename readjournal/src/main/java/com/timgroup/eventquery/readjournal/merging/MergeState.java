package com.timgroup.eventquery.readjournal.merging;

import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.MissingEventsException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static com.google.common.base.Preconditions.checkState;

/**
 * State of one replay-to-live merge. Owned by a single drain loop; not thread-safe.
 * <p>
 * While replaying, historical events are released in arrival order (lowest sequence number first
 * within an entity) and live arrivals are held back. Once live, an event is released only when its
 * sequence number is the next one expected for its entity.
 */
final class MergeState {
    enum Phase { REPLAYING_PAST, LIVE, TERMINATED }

    private final int maxPendingEvents;
    private final Map<String, Long> nextExpectedSequenceNr = new HashMap<>();
    private final List<Event> pending = new ArrayList<>();
    private final List<Event> heldLive = new ArrayList<>();

    private Phase phase = Phase.REPLAYING_PAST;

    MergeState(int maxPendingEvents) {
        this.maxPendingEvents = maxPendingEvents;
    }

    Phase phase() {
        return phase;
    }

    void receiveHistorical(Event event) {
        checkState(phase == Phase.REPLAYING_PAST, "historical event %s received while %s", event, phase);
        pending.add(event);
    }

    void receiveLive(Event event) {
        if (phase == Phase.REPLAYING_PAST) {
            heldLive.add(event);
        } else if (phase == Phase.LIVE) {
            pending.add(event);
        }
    }

    void switchToLive() {
        checkState(phase == Phase.REPLAYING_PAST, "cannot go live from %s", phase);
        pending.addAll(heldLive);
        heldLive.clear();
        phase = Phase.LIVE;
    }

    void terminate() {
        pending.clear();
        heldLive.clear();
        phase = Phase.TERMINATED;
    }

    /**
     * Removes and returns the next event that may be delivered, or null if there is none yet.
     */
    @Nullable
    Event nextDeliverable() {
        int index = deliverableIndex();
        return index < 0 ? null : deliver(index);
    }

    boolean hasDeliverable() {
        return deliverableIndex() >= 0;
    }

    /**
     * Fails if more events are held back than allowed: live arrivals waiting for replay to end,
     * or events waiting on a gap once live.
     */
    void checkPendingWithinLimit() {
        if (phase == Phase.TERMINATED || pendingCount() <= maxPendingEvents) {
            return;
        }
        Event oldest = phase == Phase.LIVE || heldLive.isEmpty() ? pending.get(0) : heldLive.get(0);
        long awaited = nextExpectedSequenceNr.getOrDefault(oldest.persistenceId(), oldest.sequenceNr());
        throw new MissingEventsException(oldest.persistenceId(), awaited, pendingCount());
    }

    int pendingCount() {
        return pending.size() + heldLive.size();
    }

    // events already received that are eligible for delivery in the current phase
    int bufferedCount() {
        return pending.size();
    }

    OptionalLong nextExpectedSequenceNr(String persistenceId) {
        Long next = nextExpectedSequenceNr.get(persistenceId);
        return next == null ? OptionalLong.empty() : OptionalLong.of(next);
    }

    private int deliverableIndex() {
        switch (phase) {
            case REPLAYING_PAST:
                return pending.isEmpty() ? -1 : lowestPendingIndexFor(pending.get(0).persistenceId());
            case LIVE:
                return contiguousIndex();
            default:
                return -1;
        }
    }

    // drops events at or below what was already delivered for their entity
    private int contiguousIndex() {
        int index = 0;
        while (index < pending.size()) {
            Event candidate = pending.get(index);
            Long expected = nextExpectedSequenceNr.get(candidate.persistenceId());
            if (expected == null) {
                return lowestPendingIndexFor(candidate.persistenceId());
            }
            if (candidate.sequenceNr() < expected) {
                pending.remove(index);
            } else if (candidate.sequenceNr() == expected) {
                return index;
            } else {
                index++;
            }
        }
        return -1;
    }

    private Event deliver(int index) {
        Event event = pending.remove(index);
        nextExpectedSequenceNr.put(event.persistenceId(), event.sequenceNr() + 1);
        return event;
    }

    private int lowestPendingIndexFor(String persistenceId) {
        int lowest = -1;
        for (int i = 0; i < pending.size(); i++) {
            Event event = pending.get(i);
            if (event.persistenceId().equals(persistenceId)
                    && (lowest == -1 || event.sequenceNr() < pending.get(lowest).sequenceNr())) {
                lowest = i;
            }
        }
        return lowest;
    }

    @Override
    public String toString() {
        return "MergeState{" +
                "phase=" + phase +
                ", pending=" + pending.size() +
                ", heldLive=" + heldLive.size() +
                ", entities=" + nextExpectedSequenceNr.size() +
                '}';
    }
}
