package com.timgroup.eventquery.api;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

import static java.util.Objects.requireNonNull;

public final class Page {
    private final List<Event> events;
    private final Cursor cursor;
    private final boolean exhausted;

    private Page(List<Event> events, Cursor cursor, boolean exhausted) {
        this.events = ImmutableList.copyOf(events);
        this.cursor = requireNonNull(cursor);
        this.exhausted = exhausted;
    }

    public static Page page(List<Event> events, Cursor continueFrom) {
        return new Page(events, continueFrom, false);
    }

    public static Page lastPage(List<Event> events, Cursor cursor) {
        return new Page(events, cursor, true);
    }

    @Nonnull
    public List<Event> events() {
        return events;
    }

    /**
     * The cursor to read the following page from, or the final cursor of an exhausted scan.
     */
    @Nonnull
    public Cursor cursor() {
        return cursor;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public String toString() {
        return "Page{" +
                "events.size=" + events.size() +
                ", cursor=" + cursor +
                ", exhausted=" + exhausted +
                '}';
    }
}
