package com.timgroup.eventquery.api;

/**
 * Position of a historical scan, meaningful only to the {@link EventStorage} that issued it.
 */
public interface Cursor {
}
