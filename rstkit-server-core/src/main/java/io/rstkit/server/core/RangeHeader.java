package io.rstkit.server.core;

import io.rstkit.server.spi.RangeRequest;

import java.util.Optional;

/**
 * Parser for single-span {@code Range} headers ({@code unit=from-to}, {@code unit=from-},
 * {@code unit=-suffix}).
 *
 * <p>Multiple spans are not supported and parse as absent.
 */
public final class RangeHeader {

    private RangeHeader() {}

    public static Optional<RangeRequest> parse(String raw) {
        if (raw == null) return Optional.empty();
        String value = raw.trim();
        int eq = value.indexOf('=');
        if (eq <= 0) return Optional.empty();

        String unit = value.substring(0, eq).trim();
        String span = value.substring(eq + 1).trim();
        if (unit.isEmpty() || span.indexOf(',') >= 0) return Optional.empty();

        int dash = span.indexOf('-');
        if (dash < 0 || dash != span.lastIndexOf('-')) return Optional.empty();

        long from = parseBound(span.substring(0, dash).trim());
        long to = parseBound(span.substring(dash + 1).trim());
        if (from == INVALID || to == INVALID) return Optional.empty();
        if (from == RangeRequest.UNSPECIFIED && to == RangeRequest.UNSPECIFIED) return Optional.empty();
        return Optional.of(new RangeRequest(unit, from, to));
    }

    private static final long INVALID = -2;

    private static long parseBound(String s) {
        if (s.isEmpty()) return RangeRequest.UNSPECIFIED;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return INVALID;
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return INVALID;
        }
    }
}
