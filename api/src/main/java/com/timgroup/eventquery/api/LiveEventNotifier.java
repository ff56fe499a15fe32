package com.timgroup.eventquery.api;

import javax.annotation.Nonnull;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Push-based broadcast of newly appended events.
 * <p>
 * Listeners are called on the notifier's own threads. Order across entities is unspecified;
 * for a single entity events arrive in non-decreasing sequence number.
 */
@ParametersAreNonnullByDefault
public interface LiveEventNotifier {
    @Nonnull
    LiveSubscription subscribe(LiveEventListener listener);

    void unsubscribe(LiveSubscription subscription);
}
