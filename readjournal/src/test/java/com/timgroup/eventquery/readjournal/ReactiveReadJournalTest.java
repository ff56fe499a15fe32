package com.timgroup.eventquery.readjournal;

import com.codahale.metrics.MetricRegistry;
import com.timgroup.eventquery.api.Event;
import com.timgroup.eventquery.api.EventEnvelope;
import com.timgroup.eventquery.api.EventStorage;
import com.timgroup.eventquery.api.LiveEventNotifier;
import com.timgroup.eventquery.memory.InMemoryEventJournal;
import org.junit.Test;
import reactor.test.StepVerifier;

import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.stream.LongStream;

import static com.timgroup.eventquery.api.EventEnvelope.eventEnvelope;
import static java.time.ZoneOffset.UTC;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class ReactiveReadJournalTest {

    private final InMemoryEventJournal journal = new InMemoryEventJournal(Clock.fixed(Instant.EPOCH, UTC));
    private final ReadJournalSettings settings = new ReadJournalSettings(100, 2, 1000);
    private final ReactiveReadJournal readJournal = new ReactiveReadJournal(journal, journal, settings);

    @Test
    public void live_entity_query_continues_history_with_new_events_exactly_once() {
        List<Event> history = journal.append("acct-1", "opened", "deposited", "deposited", "withdrew", "deposited");
        Event fifth = history.get(4);

        StepVerifier.create(readJournal.eventsForEntity("acct-1", 0, Long.MAX_VALUE).map(EventEnvelope::sequenceNr))
                .expectNext(1L, 2L, 3L, 4L, 5L)
                .then(() -> journal.append("acct-1", "closed"))
                .then(() -> journal.redeliver(fifth))
                .expectNext(6L)
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify();

        assertNoLeaks();
    }

    @Test
    public void live_entity_query_completes_at_its_upper_bound() {
        journal.append("acct-1", "opened", "deposited", "deposited");

        StepVerifier.create(readJournal.eventsForEntity("acct-1", 2, 4))
                .expectNext(eventEnvelope("acct-1", 2, 2, "deposited"))
                .expectNext(eventEnvelope("acct-1", 3, 3, "deposited"))
                .then(() -> journal.append("acct-1", "withdrew", "closed"))
                .expectNext(eventEnvelope("acct-1", 4, 4, "withdrew"))
                .verifyComplete();

        assertNoLeaks();
    }

    @Test
    public void live_entity_query_ignores_other_entities() {
        journal.append("acct-1", "opened");

        StepVerifier.create(readJournal.eventsForEntity("acct-1", 0, Long.MAX_VALUE).map(EventEnvelope::payload))
                .expectNext("opened")
                .then(() -> journal.append("acct-2", "opened elsewhere"))
                .then(() -> journal.append("acct-1", "deposited"))
                .expectNext("deposited")
                .thenCancel()
                .verify();
    }

    @Test
    public void current_entity_query_returns_inclusive_range_and_completes() {
        journal.append("acct-1", "e1", "e2", "e3", "e4", "e5");
        journal.append("acct-2", "other");

        StepVerifier.create(readJournal.currentEventsForEntity("acct-1", 2, 4).map(EventEnvelope::sequenceNr))
                .expectNext(2L, 3L, 4L)
                .verifyComplete();

        assertNoLeaks();
    }

    @Test
    public void current_entity_query_does_not_see_later_appends() {
        journal.append("acct-1", "e1", "e2");

        StepVerifier.create(readJournal.currentEventsForEntity("acct-1", 0, Long.MAX_VALUE).map(EventEnvelope::sequenceNr), 1)
                .expectNext(1L)
                .then(() -> journal.append("acct-1", "e3"))
                .thenRequest(5)
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    public void current_all_events_uses_timestamps_as_offsets() {
        journal.append("a", "a1");
        journal.append("b", "b1");
        journal.append("a", "a2");

        StepVerifier.create(readJournal.currentAllEvents())
                .expectNext(eventEnvelope("a", 1, 1, "a1"))
                .expectNext(eventEnvelope("b", 1, 2, "b1"))
                .expectNext(eventEnvelope("a", 2, 3, "a2"))
                .verifyComplete();
    }

    @Test
    public void all_events_can_resume_from_a_previous_offset() {
        journal.append("a", "a1");
        journal.append("b", "b1");
        journal.append("a", "a2");

        StepVerifier.create(readJournal.currentAllEvents(2).map(EventEnvelope::payload))
                .expectNext("b1", "a2")
                .verifyComplete();
    }

    @Test
    public void live_all_events_continues_past_history() {
        journal.append("a", "a1");
        journal.append("b", "b1");

        StepVerifier.create(readJournal.allEvents().map(EventEnvelope::payload))
                .expectNext("a1", "b1")
                .then(() -> journal.append("c", "c1"))
                .then(() -> journal.append("a", "a2"))
                .expectNext("c1", "a2")
                .thenCancel()
                .verify();

        assertNoLeaks();
    }

    @Test
    public void live_all_events_skips_events_before_the_offset() {
        journal.append("a", "a1");
        journal.append("a", "a2");

        StepVerifier.create(readJournal.allEvents(2).map(EventEnvelope::offset))
                .expectNext(2L)
                .then(() -> journal.append("b", "b1"))
                .expectNext(3L)
                .thenCancel()
                .verify();
    }

    @Test
    public void current_distinct_entity_ids_yields_each_id_once_in_first_seen_order() {
        journal.append("a", "a1");
        journal.append("b", "b1");
        journal.append("a", "a2");
        journal.append("b", "b2");

        StepVerifier.create(readJournal.currentDistinctEntityIds())
                .expectNext("a", "b")
                .verifyComplete();
    }

    @Test
    public void live_distinct_entity_ids_adds_newly_created_entities() {
        journal.append("a", "a1");
        journal.append("b", "b1");

        StepVerifier.create(readJournal.allDistinctEntityIds())
                .expectNext("a", "b")
                .then(() -> journal.append("a", "a2"))
                .then(() -> journal.append("c", "c1"))
                .expectNext("c")
                .thenCancel()
                .verify();

        assertNoLeaks();
    }

    @Test
    public void live_entity_query_keeps_events_appended_while_history_is_still_being_read() {
        ReactiveReadJournal paging = new ReactiveReadJournal(journal, journal, new ReadJournalSettings(100, 1, 1000));
        journal.append("acct-1", "e1", "e2", "e3", "e4", "e5");

        StepVerifier.create(paging.eventsForEntity("acct-1", 0, Long.MAX_VALUE).map(EventEnvelope::sequenceNr), 1)
                .expectNext(1L)
                .then(() -> journal.append("acct-1", Collections.nCopies(150, "tick")))
                .thenRequest(Long.MAX_VALUE)
                .expectNextSequence(LongStream.rangeClosed(2, 155).boxed().collect(toList()))
                .thenCancel()
                .verify();

        assertNoLeaks();
    }

    @Test
    public void live_distinct_entity_ids_keep_flowing_after_a_burst_of_appends_to_a_known_entity() {
        ReactiveReadJournal tight = new ReactiveReadJournal(journal, journal, new ReadJournalSettings(2, 2, 5));
        journal.append("a", "a1");

        StepVerifier.create(tight.allDistinctEntityIds(), 1)
                .expectNext("a")
                .then(() -> journal.append("a", "a2", "a3", "a4"))
                .then(() -> journal.append("a", Collections.nCopies(7, "more")))
                .then(() -> journal.append("b", "b1"))
                .thenRequest(1)
                .expectNext("b")
                .thenCancel()
                .verify();

        assertNoLeaks();
    }

    @Test
    public void current_all_events_releases_its_cursor_when_read_a_few_events_at_a_time() {
        journal.append("a", "a1", "a2", "a3");

        StepVerifier.create(readJournal.currentAllEvents(), 1)
                .expectNextCount(1)
                .thenRequest(2)
                .expectNextCount(2)
                .verifyComplete();

        assertNoLeaks();
    }

    @Test
    public void a_timeout_ends_a_live_query_and_releases_its_resources() {
        journal.append("acct-1", "opened");

        StepVerifier.create(readJournal.eventsForEntity("acct-1", 0, Long.MAX_VALUE).timeout(Duration.ofMillis(100)))
                .expectNextCount(1)
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertNoLeaks();
    }

    @Test
    public void each_subscription_runs_an_independent_query() {
        journal.append("a", "a1", "a2");
        Flux<EventEnvelope> query = readJournal.currentEventsForEntity("a", 0, Long.MAX_VALUE);

        StepVerifier.create(query).expectNextCount(2).verifyComplete();
        journal.append("a", "a3");
        StepVerifier.create(query).expectNextCount(3).verifyComplete();
    }

    @Test
    public void rejects_invalid_arguments_before_touching_storage() {
        EventStorage storage = mock(EventStorage.class);
        LiveEventNotifier notifier = mock(LiveEventNotifier.class);
        ReactiveReadJournal strict = new ReactiveReadJournal(storage, notifier, settings);

        assertThrows(IllegalArgumentException.class, () -> strict.eventsForEntity(null, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> strict.eventsForEntity("a", -1, 10));
        assertThrows(IllegalArgumentException.class, () -> strict.currentEventsForEntity("a", 5, 4));
        assertThrows(IllegalArgumentException.class, () -> strict.allEvents(-1));
        assertThrows(IllegalArgumentException.class, () -> strict.currentAllEvents(-1));

        verifyNoInteractions(storage, notifier);
    }

    @Test
    public void failures_are_reported_as_errors_not_completion() {
        journal.append("a", "a1");

        StepVerifier.create(readJournal.eventsForEntity("a", 0, Long.MAX_VALUE).map(EventEnvelope::payload))
                .expectNext("a1")
                .then(() -> journal.failLiveListeners(new IllegalStateException("notifier stopped")))
                .expectErrorMessage("notifier stopped")
                .verify();

        assertNoLeaks();
    }

    @Test
    public void records_page_fetches_when_given_a_metric_registry() {
        MetricRegistry registry = new MetricRegistry();
        ReactiveReadJournal measured = new ReactiveReadJournal(journal, journal, settings, Optional.of(registry));
        journal.append("a", "a1", "a2", "a3");

        StepVerifier.create(measured.currentAllEvents()).expectNextCount(3).verifyComplete();

        assertThat(registry.timer(ReactiveReadJournal.PAGE_FETCH_TIMER).getCount(), greaterThan(0L));
    }

    private void assertNoLeaks() {
        assertThat(journal.subscriberCount(), is(0));
        assertThat(journal.openCursorCount(), is(0));
    }
}
