package io.rstkit.core;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP-date codec (RFC 1123 form, UTC, second precision).
 */
public final class HttpDates {
    private HttpDates() {}

    /** Latest instant an HTTP-date can express. */
    public static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    /** Earliest instant an HTTP-date can express. */
    public static final Instant EARLIEST = Instant.parse("0001-01-01T00:00:00Z");

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    /**
     * Formats an instant, clamped to the four-digit years an HTTP-date allows.
     */
    public static String format(Instant instant) {
        return FORMAT.format(clamp(instant));
    }

    /**
     * {@code base + amount}, clamped to {@link #EARLIEST} and {@link #LATEST} instead of overflowing.
     */
    public static Instant offset(Instant base, Duration amount) {
        Instant from = clamp(base);
        if (amount.compareTo(Duration.between(from, LATEST)) >= 0) return LATEST;
        if (amount.compareTo(Duration.between(from, EARLIEST)) <= 0) return EARLIEST;
        return from.plus(amount);
    }

    private static Instant clamp(Instant instant) {
        if (instant.isAfter(LATEST)) return LATEST;
        if (instant.isBefore(EARLIEST)) return EARLIEST;
        return instant;
    }

    /**
     * Parses an HTTP-date.
     *
     * @param raw header value, may be null
     * @return the instant, or empty when absent or malformed
     */
    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(ZonedDateTime.parse(raw.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Drops the sub-second part so instants compare the way HTTP dates do. */
    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS);
    }
}
