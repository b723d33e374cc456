package io.rstkit.core;

/**
 * Header names and well-known values emitted or read by the pipeline.
 */
public final class HttpHeaders {
    private HttpHeaders() {}

    // Validators and caching
    public static final String ETAG = "ETag";
    public static final String LAST_MODIFIED = "Last-Modified";
    public static final String EXPIRES = "Expires";
    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String VARY = "Vary";

    // Conditional requests
    public static final String IF_MATCH = "If-Match";
    public static final String IF_NONE_MATCH = "If-None-Match";
    public static final String IF_MODIFIED_SINCE = "If-Modified-Since";
    public static final String IF_UNMODIFIED_SINCE = "If-Unmodified-Since";
    public static final String IF_RANGE = "If-Range";

    // Ranges
    public static final String RANGE = "Range";
    public static final String ACCEPT_RANGES = "Accept-Ranges";
    public static final String CONTENT_RANGE = "Content-Range";

    // Negotiation
    public static final String ACCEPT = "Accept";
    public static final String ACCEPT_ENCODING = "Accept-Encoding";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_ENCODING = "Content-Encoding";
    public static final String CONTENT_LENGTH = "Content-Length";

    // Dispatch
    public static final String ALLOW = "Allow";
    public static final String LOCATION = "Location";

    public static final String CT_TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String CT_OCTET_STREAM = "application/octet-stream";
}
