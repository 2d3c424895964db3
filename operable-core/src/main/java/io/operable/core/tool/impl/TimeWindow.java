package io.operable.core.tool.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

record TimeWindow(Instant start, Instant end) {

    static TimeWindow lastHours(Clock clock, double hours) {
        Instant end = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return new TimeWindow(end.minus(Duration.ofSeconds((long) (hours * 3600))), end);
    }

    String startText() {
        return DateTimeFormatter.ISO_INSTANT.format(start);
    }

    String endText() {
        return DateTimeFormatter.ISO_INSTANT.format(end);
    }

    // Cloud Logging filter clause bounding entries to the window.
    String loggingClause() {
        return "timestamp >= \"" + startText() + "\" AND timestamp <= \"" + endText() + "\"";
    }
}
