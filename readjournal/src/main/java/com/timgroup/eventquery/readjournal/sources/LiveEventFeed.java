package com.timgroup.eventquery.readjournal.sources;

import com.codahale.metrics.Counter;
import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.LiveEventListener;
import com.timgroup.eventquery.api.LiveEventNotifier;
import com.timgroup.eventquery.api.LiveSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;
import java.util.Optional;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Relays newly appended events from the notifier for as long as the stream is subscribed.
 * <p>
 * Each subscriber gets its own registration and a bounded buffer: when the subscriber falls behind,
 * the oldest undelivered events are dropped so the appending side is never held up.
 * The registration is removed whenever the stream ends, however it ends.
 */
@ParametersAreNonnullByDefault
public final class LiveEventFeed {
    private static final Logger LOG = LoggerFactory.getLogger(LiveEventFeed.class);

    private final LiveEventNotifier notifier;
    private final int bufferSize;
    private final Optional<Counter> droppedEvents;

    public LiveEventFeed(LiveEventNotifier notifier, int bufferSize, Optional<Counter> droppedEvents) {
        checkArgument(bufferSize > 0, "buffer size must be positive. Got %s", bufferSize);
        this.notifier = requireNonNull(notifier);
        this.bufferSize = bufferSize;
        this.droppedEvents = requireNonNull(droppedEvents);
    }

    public LiveEventFeed(LiveEventNotifier notifier, int bufferSize) {
        this(notifier, bufferSize, Optional.empty());
    }

    @Nonnull
    @CheckReturnValue
    public Flux<Event> events(Predicate<? super Event> interest) {
        requireNonNull(interest);
        return Flux.<Event>create(sink -> register(sink, interest))
                .onBackpressureBuffer(bufferSize, this::dropped, BufferOverflowStrategy.DROP_OLDEST);
    }

    private void register(FluxSink<Event> sink, Predicate<? super Event> interest) {
        LiveSubscription subscription = notifier.subscribe(new LiveEventListener() {
            @Override
            public void onEvent(Event event) {
                if (interest.test(event)) {
                    sink.next(event);
                }
            }

            @Override
            public void onFailure(Throwable failure) {
                sink.error(failure);
            }
        });
        LOG.debug("Registered live subscription {}", subscription);

        sink.onDispose(() -> {
            notifier.unsubscribe(subscription);
            LOG.debug("Removed live subscription {}", subscription);
        });
    }

    private void dropped(Event event) {
        LOG.debug("Live buffer full, dropped {}", event.locator());
        droppedEvents.ifPresent(Counter::inc);
    }

    @Override
    public String toString() {
        return "LiveEventFeed{" +
                "notifier=" + notifier +
                ", bufferSize=" + bufferSize +
                '}';
    }
}
