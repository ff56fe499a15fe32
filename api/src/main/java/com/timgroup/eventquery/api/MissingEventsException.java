package com.timgroup.eventquery.api;

/**
 * Raised when a live query has held back more events than allowed, either while the history is still being
 * replayed or while waiting for a sequence number that never arrived.
 */
public class MissingEventsException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public MissingEventsException(String persistenceId, long awaitedSequenceNr, int heldEvents) {
        super("gave up waiting for " + persistenceId + " sequence number " + awaitedSequenceNr + " with " + heldEvents + " events held");
    }
}
