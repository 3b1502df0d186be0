package com.pulsewatch.agent.baseline;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * How a timestamp maps onto a recurring seasonal bucket. Buckets are computed in UTC.
 */
public enum SeasonalGranularity {
    HOUR_OF_DAY {
        @Override
        public int bucketOf(Instant timestamp) {
            return timestamp.atZone(ZoneOffset.UTC).getHour();
        }
    },
    HOUR_OF_WEEK {
        @Override
        public int bucketOf(Instant timestamp) {
            ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
            return (utc.getDayOfWeek().getValue() - 1) * 24 + utc.getHour();
        }
    };

    public abstract int bucketOf(Instant timestamp);
}
