package com.timgroup.eventquery.readjournal.merging;

import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.HistoricalScope;
import com.timgroup.eventquery.api.MissingEventsException;
import com.timgroup.eventquery.readjournal.sources.HistoricalEventSource;
import com.timgroup.eventquery.readjournal.sources.LiveEventFeed;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Replays persisted events and then carries on with live ones, without losing or repeating events at the seam.
 * <p>
 * Each subscriber gets its own {@link MergeState}. The live source is subscribed before the historical one
 * and drained without bound from the start, so events appended during replay are held by the merge rather than
 * left to the live source's buffer. Historical events are requested as downstream demand allows. At most
 * {@code maxPendingEvents} events may be held back at once. Upstream signals are queued and applied by a single
 * drain loop.
 */
public final class ReplayToLiveMerge implements Publisher<Event> {
    private static final Logger LOG = LoggerFactory.getLogger(ReplayToLiveMerge.class);

    private final String description;
    private final Publisher<Event> historical;
    private final Publisher<Event> live;
    private final int maxPendingEvents;

    public ReplayToLiveMerge(String description, Publisher<Event> historical, Publisher<Event> live, int maxPendingEvents) {
        checkArgument(maxPendingEvents > 0, "max pending events must be positive. Got %s", maxPendingEvents);
        this.description = requireNonNull(description);
        this.historical = requireNonNull(historical);
        this.live = requireNonNull(live);
        this.maxPendingEvents = maxPendingEvents;
    }

    public static ReplayToLiveMerge of(HistoricalScope scope, HistoricalEventSource historicalSource, LiveEventFeed liveFeed, int maxPendingEvents) {
        return new ReplayToLiveMerge(scope.toString(), historicalSource.events(scope), liveFeed.events(scope::includes), maxPendingEvents);
    }

    @Override
    public void subscribe(Subscriber<? super Event> subscriber) {
        requireNonNull(subscriber);
        MergeSubscription subscription = new MergeSubscription(subscriber);
        subscriber.onSubscribe(subscription);
        subscription.start();
    }

    @Override
    public String toString() {
        return "ReplayToLiveMerge{" + description + '}';
    }

    private enum Origin { HISTORICAL, LIVE, DOWNSTREAM }

    private enum Kind { SUBSCRIBED, NEXT, COMPLETE, FAILURE }

    private static final class Signal {
        private final Origin origin;
        private final Kind kind;
        @Nullable private final Event event;
        @Nullable private final Throwable failure;

        private Signal(Origin origin, Kind kind, @Nullable Event event, @Nullable Throwable failure) {
            this.origin = origin;
            this.kind = kind;
            this.event = event;
            this.failure = failure;
        }
    }

    private final class MergeSubscription implements Subscription {
        private final Subscriber<? super Event> downstream;
        private final MergeState state = new MergeState(maxPendingEvents);
        private final Queue<Signal> mailbox = new ConcurrentLinkedQueue<>();
        private final AtomicInteger wip = new AtomicInteger();
        private final AtomicLong requested = new AtomicLong();
        private final Upstream historicalUpstream = new Upstream(Origin.HISTORICAL);
        private final Upstream liveUpstream = new Upstream(Origin.LIVE);
        private volatile boolean cancelled;

        // owned by the drain loop
        private long historicalOutstanding;
        private boolean liveCompleted;
        private boolean terminated;

        private MergeSubscription(Subscriber<? super Event> downstream) {
            this.downstream = downstream;
        }

        void start() {
            if (cancelled) {
                return;
            }
            live.subscribe(liveUpstream);
            historical.subscribe(historicalUpstream);
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                mailbox.offer(new Signal(Origin.DOWNSTREAM, Kind.FAILURE, null,
                        new IllegalArgumentException("demand must be positive. Got " + n)));
            } else {
                addCap(requested, n);
            }
            drain();
        }

        @Override
        public void cancel() {
            cancelled = true;
            drain();
        }

        private void drain() {
            if (wip.getAndIncrement() != 0) {
                return;
            }
            int missed = 1;
            do {
                if (cancelled && !terminated) {
                    terminate();
                    LOG.debug("Cancelled {} in {}", description, state);
                }

                Signal signal;
                while ((signal = mailbox.poll()) != null) {
                    if (terminated) {
                        if (signal.kind == Kind.SUBSCRIBED) {
                            upstream(signal.origin).cancel();
                        }
                    } else {
                        apply(signal);
                    }
                }

                if (!terminated) {
                    emit();
                }
                if (!terminated) {
                    requestHistory();
                }

                missed = wip.addAndGet(-missed);
            } while (missed != 0);
        }

        private void apply(Signal signal) {
            switch (signal.kind) {
                case SUBSCRIBED:
                    if (signal.origin == Origin.LIVE) {
                        liveUpstream.request(Long.MAX_VALUE);
                    }
                    break;
                case NEXT:
                    if (signal.origin == Origin.HISTORICAL) {
                        historicalOutstanding = decrement(historicalOutstanding);
                        state.receiveHistorical(signal.event);
                    } else {
                        state.receiveLive(signal.event);
                    }
                    break;
                case COMPLETE:
                    if (signal.origin == Origin.HISTORICAL) {
                        state.switchToLive();
                        LOG.debug("Past events of {} completed, continuing live with {} events pending", description, state.pendingCount());
                    } else {
                        liveCompleted = true;
                    }
                    break;
                case FAILURE:
                    fail(signal.origin, signal.failure);
                    break;
                default:
                    throw new IllegalStateException("unexpected signal " + signal.kind);
            }
        }

        private void emit() {
            long demand = requested.get();
            long emitted = 0;
            while (emitted != demand && !cancelled) {
                Event next = state.nextDeliverable();
                if (next == null) {
                    break;
                }
                downstream.onNext(next);
                emitted++;
            }
            if (emitted != 0 && demand != Long.MAX_VALUE) {
                requested.addAndGet(-emitted);
            }
            if (cancelled) {
                return;
            }

            try {
                state.checkPendingWithinLimit();
            } catch (MissingEventsException e) {
                fail(Origin.LIVE, e);
                return;
            }

            if (liveCompleted && state.phase() == MergeState.Phase.LIVE && !state.hasDeliverable()) {
                if (state.pendingCount() > 0) {
                    LOG.warn("Live events of {} completed, dropping {} events that were still waiting for a gap to close", description, state.pendingCount());
                }
                terminate();
                downstream.onComplete();
            }
        }

        private void requestHistory() {
            if (state.phase() != MergeState.Phase.REPLAYING_PAST
                    || historicalOutstanding == Long.MAX_VALUE
                    || !historicalUpstream.isSubscribed()) {
                return;
            }
            long demand = requested.get();
            long wanted = demand == Long.MAX_VALUE ? Long.MAX_VALUE : demand - state.bufferedCount() - historicalOutstanding;
            if (wanted > 0) {
                historicalOutstanding = addCap(historicalOutstanding, wanted);
                historicalUpstream.request(wanted);
            }
        }

        private void fail(Origin origin, @Nullable Throwable failure) {
            Throwable cause = failure == null ? new IllegalStateException(origin + " failed without a cause") : failure;
            terminate();
            LOG.error("[{}] {} failed, stopping stream", origin, description, cause);
            downstream.onError(cause);
        }

        private void terminate() {
            terminated = true;
            state.terminate();
            historicalUpstream.cancel();
            liveUpstream.cancel();
        }

        private Upstream upstream(Origin origin) {
            return origin == Origin.HISTORICAL ? historicalUpstream : liveUpstream;
        }

        private final class Upstream implements Subscriber<Event> {
            private final Origin origin;
            private volatile Subscription subscription;

            private Upstream(Origin origin) {
                this.origin = origin;
            }

            boolean isSubscribed() {
                return subscription != null;
            }

            void request(long n) {
                subscription.request(n);
            }

            void cancel() {
                Subscription current = subscription;
                if (current != null) {
                    current.cancel();
                }
            }

            @Override
            public void onSubscribe(Subscription s) {
                this.subscription = requireNonNull(s);
                signal(Kind.SUBSCRIBED, null, null);
            }

            @Override
            public void onNext(Event event) {
                signal(Kind.NEXT, requireNonNull(event), null);
            }

            @Override
            public void onError(Throwable failure) {
                signal(Kind.FAILURE, null, failure);
            }

            @Override
            public void onComplete() {
                signal(Kind.COMPLETE, null, null);
            }

            private void signal(Kind kind, @Nullable Event event, @Nullable Throwable failure) {
                mailbox.offer(new Signal(origin, kind, event, failure));
                drain();
            }
        }
    }

    private static long decrement(long outstanding) {
        return outstanding == Long.MAX_VALUE || outstanding == 0 ? outstanding : outstanding - 1;
    }

    private static long addCap(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static void addCap(AtomicLong requested, long n) {
        while (true) {
            long current = requested.get();
            if (current == Long.MAX_VALUE || requested.compareAndSet(current, addCap(current, n))) {
                return;
            }
        }
    }
}
