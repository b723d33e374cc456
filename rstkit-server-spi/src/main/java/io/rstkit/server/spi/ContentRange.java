package io.rstkit.server.spi;

import java.util.Objects;

/**
 * Span actually returned in a partial response, rendered as the {@code Content-Range} header.
 *
 * @param unit range unit
 * @param from first unit served
 * @param to last unit served, inclusive
 * @param total units available, or {@link #UNKNOWN_TOTAL}
 */
public record ContentRange(String unit, long from, long to, long total) {

    public static final long UNKNOWN_TOTAL = -1;

    public ContentRange {
        Objects.requireNonNull(unit, "unit");
        if (from < 0 || to < from) throw new IllegalArgumentException("invalid span " + from + "-" + to);
        if (total < UNKNOWN_TOTAL) throw new IllegalArgumentException("invalid total " + total);
    }

    /**
     * Content range for an adjusted request.
     */
    public ContentRange(RangeRequest range, long total) {
        this(range.unit(), range.from(), range.to(), total);
    }

    /**
     * True when the span covers every unit, in which case no {@code Content-Range} is sent.
     */
    public boolean isComplete() {
        return from == 0 && to == total - 1;
    }

    @Override
    public String toString() {
        return unit + " " + from + "-" + to + "/" + (total == UNKNOWN_TOTAL ? "*" : Long.toString(total));
    }
}
