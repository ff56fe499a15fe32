package com.timgroup.eventquery.api;

@FunctionalInterface
public interface LiveEventListener {
    void onEvent(Event event);

    default void onFailure(Throwable failure) {
    }
}
