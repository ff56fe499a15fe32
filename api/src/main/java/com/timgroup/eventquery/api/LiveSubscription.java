package com.timgroup.eventquery.api;

/**
 * Handle for a listener registered with a {@link LiveEventNotifier}.
 */
public interface LiveSubscription {
}
