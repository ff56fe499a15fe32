package com.timgroup.eventquery.readjournal;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ReadJournalSettingsTest {

    @Test
    public void defaults_come_from_reference_config() {
        ReadJournalSettings settings = ReadJournalSettings.defaults();

        assertThat(settings.liveBufferSize(), is(100));
        assertThat(settings.historicalPageSize(), is(500));
        assertThat(settings.maxPendingEvents(), is(10000));
    }

    @Test
    public void overrides_fall_back_to_reference_values() {
        Config config = ConfigFactory.parseString("tg-eventquery.live-buffer-size = 7")
                .withFallback(ConfigFactory.defaultReference());

        ReadJournalSettings settings = ReadJournalSettings.fromConfig(config);

        assertThat(settings.liveBufferSize(), is(7));
        assertThat(settings.historicalPageSize(), is(500));
    }

    @Test
    public void copies_with_a_single_value_changed() {
        ReadJournalSettings settings = new ReadJournalSettings(1, 2, 3).withHistoricalPageSize(20);

        assertThat(settings.liveBufferSize(), is(1));
        assertThat(settings.historicalPageSize(), is(20));
        assertThat(settings.maxPendingEvents(), is(3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejects_non_positive_live_buffer() {
        new ReadJournalSettings(0, 500, 10000);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejects_non_positive_configured_page_size() {
        ReadJournalSettings.fromConfig(ConfigFactory.parseString("tg-eventquery.historical-page-size = -1")
                .withFallback(ConfigFactory.defaultReference()));
    }
}
