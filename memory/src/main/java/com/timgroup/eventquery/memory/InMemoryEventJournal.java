package com.timgroup.eventquery.memory;

import com.google.common.collect.ImmutableList;
import com.timgroup.eventquery.api.Cursor;
import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.EventStorage;
import com.timgroup.eventquery.api.HistoricalScope;
import com.timgroup.eventquery.api.LiveEventListener;
import com.timgroup.eventquery.api.LiveEventNotifier;
import com.timgroup.eventquery.api.LiveSubscription;
import com.timgroup.eventquery.api.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static com.timgroup.eventquery.api.Event.event;
import static java.util.Objects.requireNonNull;

/**
 * Journal held in memory, serving both as event storage and as live notifier.
 * <p>
 * Sequence numbers start at 1 for each entity. Timestamps are strictly increasing across the
 * whole journal, taken from the clock where it has moved on and bumped by one otherwise.
 * Listeners are called synchronously on the appending thread.
 */
@ParametersAreNonnullByDefault
public class InMemoryEventJournal implements EventStorage, LiveEventNotifier {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventJournal.class);

    public static final long EmptyEntityVersion = 0L;

    private final List<Event> events = new CopyOnWriteArrayList<>();
    private final Map<InMemoryLiveSubscription, LiveEventListener> listeners = new ConcurrentHashMap<>();
    private final Set<Scan> openScans = ConcurrentHashMap.newKeySet();
    private final Clock clock;

    private long lastTimestamp = 0L;

    public InMemoryEventJournal(Clock clock) {
        this.clock = requireNonNull(clock);
    }

    public InMemoryEventJournal() {
        this(Clock.systemUTC());
    }

    public List<Event> append(String persistenceId, Object... payloads) {
        return append(persistenceId, Arrays.asList(payloads));
    }

    public synchronized List<Event> append(String persistenceId, Collection<?> payloads) {
        requireNonNull(persistenceId);
        long currentVersion = currentVersionOf(persistenceId);

        ImmutableList.Builder<Event> written = ImmutableList.builder();
        long sequenceNr = currentVersion;
        for (Object payload : payloads) {
            Event event = event(persistenceId, ++sequenceNr, nextTimestamp(), payload);
            events.add(event);
            written.add(event);
        }

        List<Event> appended = written.build();
        appended.forEach(this::broadcast);
        return appended;
    }

    /**
     * Sends an already written event to live listeners again, as an at-least-once notification channel may.
     */
    public synchronized void redeliver(Event event) {
        if (!events.contains(event)) {
            throw new IllegalArgumentException("not in journal: " + event.locator());
        }
        broadcast(event);
    }

    /**
     * Reports a notification failure to every live listener.
     */
    public synchronized void failLiveListeners(Throwable failure) {
        listeners.values().forEach(listener -> listener.onFailure(failure));
    }

    public synchronized long currentVersionOf(String persistenceId) {
        return events.stream()
                .filter(e -> e.persistenceId().equals(persistenceId))
                .mapToLong(Event::sequenceNr)
                .max()
                .orElse(EmptyEntityVersion);
    }

    @Override
    @Nonnull
    @CheckReturnValue
    public Cursor openCursor(HistoricalScope scope) {
        List<Event> matching = events.stream().filter(scope::includes).collect(Collectors.toList());
        Scan scan = new Scan(scope, ImmutableList.copyOf(matching));
        openScans.add(scan);
        return new InMemoryCursor(scan, 0);
    }

    @Override
    @Nonnull
    @CheckReturnValue
    public Page nextPage(Cursor cursor, int atMost) {
        if (atMost <= 0) {
            throw new IllegalArgumentException("page size must be positive. Got " + atMost);
        }
        InMemoryCursor inMemoryCursor = (InMemoryCursor) cursor;
        if (!openScans.contains(inMemoryCursor.scan)) {
            throw new IllegalStateException("cursor has been discarded: " + cursor);
        }

        List<Event> snapshot = inMemoryCursor.scan.events;
        int end = (int) Math.min((long) inMemoryCursor.index + atMost, snapshot.size());
        List<Event> page = snapshot.subList(inMemoryCursor.index, end);
        InMemoryCursor next = new InMemoryCursor(inMemoryCursor.scan, end);

        return end == snapshot.size() ? Page.lastPage(page, next) : Page.page(page, next);
    }

    @Override
    public void discard(Cursor cursor) {
        openScans.remove(((InMemoryCursor) cursor).scan);
    }

    @Override
    @Nonnull
    public LiveSubscription subscribe(LiveEventListener listener) {
        InMemoryLiveSubscription subscription = new InMemoryLiveSubscription();
        listeners.put(subscription, requireNonNull(listener));
        return subscription;
    }

    @Override
    public void unsubscribe(LiveSubscription subscription) {
        listeners.remove(subscription);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public int openCursorCount() {
        return openScans.size();
    }

    private long nextTimestamp() {
        lastTimestamp = Math.max(lastTimestamp + 1, clock.millis());
        return lastTimestamp;
    }

    private void broadcast(Event event) {
        for (LiveEventListener listener : listeners.values()) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Live listener failed to accept " + event.locator(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "InMemoryEventJournal{" +
                "events.size=" + events.size() +
                ", listeners=" + listeners.size() +
                ", clock=" + clock +
                '}';
    }

    private static final class Scan {
        private final HistoricalScope scope;
        private final List<Event> events;

        private Scan(HistoricalScope scope, List<Event> events) {
            this.scope = scope;
            this.events = events;
        }
    }

    private static final class InMemoryCursor implements Cursor {
        private final Scan scan;
        private final int index;

        private InMemoryCursor(Scan scan, int index) {
            this.scan = scan;
            this.index = index;
        }

        @Override
        public String toString() {
            return scan.scope + "@" + index;
        }
    }

    private static final class InMemoryLiveSubscription implements LiveSubscription {
        @Override
        public String toString() {
            return "InMemoryLiveSubscription@" + Integer.toHexString(System.identityHashCode(this));
        }
    }
}
