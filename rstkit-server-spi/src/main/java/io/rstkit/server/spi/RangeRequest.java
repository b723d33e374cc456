package io.rstkit.server.spi;

import io.rstkit.core.RestException;

import java.util.Objects;

/**
 * A single span requested through the {@code Range} header.
 *
 * <p>Three forms exist before {@link #adjust adjustment}:
 * <ul>
 *   <li>{@code from-to}: both bounds set, inclusive</li>
 *   <li>{@code from-}: {@link #to()} is {@link #UNSPECIFIED}, up to the last unit</li>
 *   <li>{@code -n}: {@link #from()} is {@link #UNSPECIFIED}, {@link #to()} holds the suffix length</li>
 * </ul>
 * An adjusted range always has both bounds set inside the resource.
 */
public record RangeRequest(String unit, long from, long to) {

    public static final long UNSPECIFIED = -1;

    public RangeRequest {
        Objects.requireNonNull(unit, "unit");
        if (from < UNSPECIFIED || to < UNSPECIFIED) {
            throw new IllegalArgumentException("range bounds must be non-negative");
        }
        if (from == UNSPECIFIED && to == UNSPECIFIED) {
            throw new IllegalArgumentException("range needs at least one bound");
        }
    }

    public static RangeRequest closed(String unit, long from, long to) {
        return new RangeRequest(unit, from, to);
    }

    public static RangeRequest from(String unit, long from) {
        return new RangeRequest(unit, from, UNSPECIFIED);
    }

    public static RangeRequest suffix(String unit, long length) {
        return new RangeRequest(unit, UNSPECIFIED, length);
    }

    public boolean isSuffix() {
        return from == UNSPECIFIED;
    }

    public boolean isOpenEnded() {
        return to == UNSPECIFIED;
    }

    /**
     * Checks the range against what a resource supports, without looking at its size.
     *
     * @return false for an unknown unit, an inverted span or an empty suffix
     */
    public boolean isValidFor(Ranger ranger) {
        if (!ranger.units().contains(unit)) return false;
        if (isSuffix()) return to > 0;
        if (isOpenEnded()) return true;
        return from <= to;
    }

    /**
     * Resolves open forms against the number of units available and clamps the end.
     *
     * @throws RestException.RangeNotSatisfiable if the span starts past the last unit
     */
    public RangeRequest adjust(long count) {
        if (count <= 0) throw new RestException.RangeNotSatisfiable(unit, Math.max(count, 0));
        if (isSuffix()) {
            long length = Math.min(to, count);
            return new RangeRequest(unit, count - length, count - 1);
        }
        if (from >= count) throw new RestException.RangeNotSatisfiable(unit, count);
        long end = isOpenEnded() ? count - 1 : Math.min(to, count - 1);
        return new RangeRequest(unit, from, end);
    }

    @Override
    public String toString() {
        return unit + "=" + (isSuffix() ? "" : Long.toString(from)) + "-" + (isOpenEnded() ? "" : Long.toString(to));
    }
}
