package net.spookly.gsdk.protocol;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Parses scheduled maintenance timestamps ({@code yyyy-MM-ddTHH:mm:ssZ}, UTC).
 */
public final class MaintenanceTimes {
    /**
     * Value substituted for timestamps that do not parse.
     */
    public static final Instant FAR_PAST = Instant.parse("2000-01-01T00:00:00Z");

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'");

    private MaintenanceTimes() {
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return FAR_PAST;
        }
        try {
            return LocalDateTime.parse(value.trim(), FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return FAR_PAST;
        }
    }

    /**
     * Compare at second granularity.
     */
    public static boolean sameSecond(Instant first, Instant second) {
        if (first == null || second == null) {
            return first == second;
        }
        return first.truncatedTo(ChronoUnit.SECONDS).equals(second.truncatedTo(ChronoUnit.SECONDS));
    }
}
