package com.timgroup.eventquery.readjournal.stages;

import com.timgroup.eventquery.api.Event;
import reactor.core.publisher.Flux;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Drops elements whose key has already been forwarded, unless the element supersedes the last one
 * forwarded for that key.
 * <p>
 * Instances hold state for a single stream and are not thread-safe; use {@link #perSubscription}
 * to get fresh state for every subscriber. Tracked keys are never evicted.
 */
public final class DuplicateSuppressor<T, K> {
    private final Function<? super T, ? extends K> keyExtractor;
    private final BiPredicate<? super T, ? super T> supersedes;
    private final Map<K, T> lastForwarded = new HashMap<>();

    public DuplicateSuppressor(Function<? super T, ? extends K> keyExtractor, BiPredicate<? super T, ? super T> supersedes) {
        this.keyExtractor = requireNonNull(keyExtractor);
        this.supersedes = requireNonNull(supersedes);
    }

    /**
     * Forwards an event only if its sequence number is above the last one forwarded for its entity.
     */
    public static DuplicateSuppressor<Event, String> perEntity() {
        return new DuplicateSuppressor<>(Event::persistenceId, (last, candidate) -> candidate.sequenceNr() > last.sequenceNr());
    }

    /**
     * Forwards each distinct element once, the first time it is seen.
     */
    public static <T> DuplicateSuppressor<T, T> identity() {
        return new DuplicateSuppressor<>(Function.identity(), (last, candidate) -> false);
    }

    public static Function<Flux<Event>, Flux<Event>> suppressDuplicateEvents() {
        return perSubscription(DuplicateSuppressor::perEntity);
    }

    public static <T> Function<Flux<T>, Flux<T>> suppressRepeats() {
        return perSubscription(DuplicateSuppressor::<T>identity);
    }

    public static <T> Function<Flux<T>, Flux<T>> perSubscription(Supplier<? extends DuplicateSuppressor<T, ?>> factory) {
        requireNonNull(factory);
        return elements -> Flux.defer(() -> {
            DuplicateSuppressor<T, ?> suppressor = factory.get();
            return elements.filter(suppressor::admit);
        });
    }

    public boolean admit(T element) {
        K key = keyExtractor.apply(element);
        T previous = lastForwarded.get(key);
        if (previous == null || supersedes.test(previous, element)) {
            lastForwarded.put(key, element);
            return true;
        }
        return false;
    }

    int trackedKeys() {
        return lastForwarded.size();
    }
}
