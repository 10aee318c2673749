package com.propertyintel.ingest.support;

import com.propertyintel.ingest.service.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records requested sleeps and advances the clock instead of blocking. */
public class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Duration> sleeps = new ArrayList<>();

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> sleeps() {
        return sleeps;
    }
}
