package io.operable.core.render;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class Timestamps {
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    // RFC3339 in, "yyyy-MM-dd HH:mm:ss" in the value's own offset out. Unparseable input is returned verbatim.
    public static String format(String rfc3339) {
        if (rfc3339 == null || rfc3339.isBlank()) {
            return rfc3339 == null ? "" : rfc3339;
        }
        try {
            return OffsetDateTime.parse(rfc3339.trim()).format(DISPLAY);
        } catch (DateTimeParseException e) {
            return rfc3339;
        }
    }
}
