package com.timgroup.eventquery.readjournal;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import static com.google.common.base.Preconditions.checkArgument;

public final class ReadJournalSettings {
    public static final String CONFIG_PATH = "tg-eventquery";

    private final int liveBufferSize;
    private final int historicalPageSize;
    private final int maxPendingEvents;

    public ReadJournalSettings(int liveBufferSize, int historicalPageSize, int maxPendingEvents) {
        checkArgument(liveBufferSize > 0, "live buffer size must be positive. Got %s", liveBufferSize);
        checkArgument(historicalPageSize > 0, "historical page size must be positive. Got %s", historicalPageSize);
        checkArgument(maxPendingEvents > 0, "max pending events must be positive. Got %s", maxPendingEvents);
        this.liveBufferSize = liveBufferSize;
        this.historicalPageSize = historicalPageSize;
        this.maxPendingEvents = maxPendingEvents;
    }

    /**
     * Reads the {@value #CONFIG_PATH} block of the given config, which must already include the reference defaults.
     */
    public static ReadJournalSettings fromConfig(Config config) {
        Config settings = config.getConfig(CONFIG_PATH);
        return new ReadJournalSettings(
                settings.getInt("live-buffer-size"),
                settings.getInt("historical-page-size"),
                settings.getInt("max-pending-events")
        );
    }

    public static ReadJournalSettings defaults() {
        return fromConfig(ConfigFactory.load());
    }

    public int liveBufferSize() {
        return liveBufferSize;
    }

    public int historicalPageSize() {
        return historicalPageSize;
    }

    public int maxPendingEvents() {
        return maxPendingEvents;
    }

    public ReadJournalSettings withLiveBufferSize(int liveBufferSize) {
        return new ReadJournalSettings(liveBufferSize, historicalPageSize, maxPendingEvents);
    }

    public ReadJournalSettings withHistoricalPageSize(int historicalPageSize) {
        return new ReadJournalSettings(liveBufferSize, historicalPageSize, maxPendingEvents);
    }

    public ReadJournalSettings withMaxPendingEvents(int maxPendingEvents) {
        return new ReadJournalSettings(liveBufferSize, historicalPageSize, maxPendingEvents);
    }

    @Override
    public String toString() {
        return "ReadJournalSettings{" +
                "liveBufferSize=" + liveBufferSize +
                ", historicalPageSize=" + historicalPageSize +
                ", maxPendingEvents=" + maxPendingEvents +
                '}';
    }
}
