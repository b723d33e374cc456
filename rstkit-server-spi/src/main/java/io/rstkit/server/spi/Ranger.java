package io.rstkit.server.spi;

import java.util.List;
import java.util.Objects;

/**
 * Implemented by resources that support partial responses.
 *
 * <p>{@link #range} is only called for a valid {@code Range} header whose preconditions hold;
 * otherwise the request is served as a normal GET.
 *
 * <pre>{@code
 * public List<String> units() { return List.of("bytes"); }
 * public long count() { return data.length; }
 * public Slice range(RangeRequest rg) {
 *     byte[] part = Arrays.copyOfRange(data, (int) rg.from(), (int) rg.to() + 1);
 *     return new Slice(new ContentRange(rg, count()), new Document(part, etag(), lastModified()));
 * }
 * }</pre>
 */
public interface Ranger {

    /** Supported range units, advertised in {@code Accept-Ranges}. */
    List<String> units();

    /** Total number of units available. */
    long count();

    /**
     * Returns the part of the resource selected by an adjusted, closed range.
     *
     * @param range range with both bounds inside {@code [0, count() - 1]}
     */
    Slice range(RangeRequest range) throws Exception;

    /**
     * The span actually served and the resource holding it.
     */
    record Slice(ContentRange contentRange, Resource partial) {
        public Slice {
            Objects.requireNonNull(contentRange, "contentRange");
            Objects.requireNonNull(partial, "partial");
        }
    }
}
