package com.timgroup.eventquery.api;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Pull-based access to persisted events.
 * <p>
 * Entity scans return events in ascending sequence number; whole-journal scans in ascending write order.
 * Every cursor returned by {@link #openCursor} or carried by a {@link Page} must eventually be passed to
 * {@link #discard}.
 */
@ParametersAreNonnullByDefault
public interface EventStorage {
    @Nonnull
    @CheckReturnValue
    Cursor openCursor(HistoricalScope scope);

    @Nonnull
    @CheckReturnValue
    Page nextPage(Cursor cursor, int atMost);

    void discard(Cursor cursor);
}
