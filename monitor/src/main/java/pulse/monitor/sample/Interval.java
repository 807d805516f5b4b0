package pulse.monitor.sample;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar aligned bucket sizes. Bucket keys are derived from the calendar fields of a timestamp in a given zone.
 */
public enum Interval {

    HOUR("hour", DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH")),
    DAY("day", DateTimeFormatter.ofPattern("yyyy-MM-dd")),
    WEEK("week", DateTimeFormatter.ofPattern("yyyy-MM-dd")),
    MONTH("month", DateTimeFormatter.ofPattern("yyyy-MM"));

    private final String name;
    private final DateTimeFormatter keyFormat;

    Interval(String name, DateTimeFormatter keyFormat) {
        this.name = name;
        this.keyFormat = keyFormat;
    }

    public String getName() {
        return name;
    }

    public String bucketKey(Instant timestamp, ZoneId zone) {
        ZonedDateTime dateTime = timestamp.atZone(zone);
        if (this == WEEK) {
            // weeks start on Sunday
            dateTime = dateTime.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        }
        return keyFormat.format(dateTime);
    }

    public static Interval fromName(String name) {
        for (Interval i : values()) {
            if (i.name.equalsIgnoreCase(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown interval: " + name);
    }
}
