package io.rstkit.core;

import java.util.List;
import java.util.Objects;

/**
 * Base class for failures that end a request with an HTTP error status.
 *
 * <p>Each subclass maps to exactly one status code. Endpoint operations throw these to reject a
 * request; the endpoint handler turns them into a response carrying a description of the error.
 * The message is the description shown to the client.
 */
public abstract class RestException extends RuntimeException {

    private final int status;
    private final String reason;

    protected RestException(int status, String reason, String message) {
        super(message);
        this.status = status;
        this.reason = reason;
    }

    protected RestException(int status, String reason, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.reason = reason;
    }

    /** HTTP status code of the error response. */
    public int status() {
        return status;
    }

    /** Reason phrase, e.g. {@code Not Found}. */
    public String reason() {
        return reason;
    }

    /**
     * Raised when the request itself cannot be understood.
     */
    public static class BadRequest extends RestException {
        public BadRequest(String message) {
            super(400, "Bad Request", message);
        }
    }

    public static class Unauthorized extends RestException {
        public Unauthorized(String message) {
            super(401, "Unauthorized", message);
        }
    }

    public static class Forbidden extends RestException {
        public Forbidden(String message) {
            super(403, "Forbidden", message);
        }
    }

    /**
     * Raised when no resource or operation matches the request.
     */
    public static class NotFound extends RestException {
        public NotFound() {
            this("The requested resource could not be found.");
        }

        public NotFound(String message) {
            super(404, "Not Found", message);
        }
    }

    /**
     * Raised when the endpoint exists but does not implement the request method.
     */
    public static class MethodNotAllowed extends RestException {
        private final List<HttpMethod> allowed;

        public MethodNotAllowed(String method, List<HttpMethod> allowed) {
            super(405, "Method Not Allowed", "Method " + method + " is not allowed on this resource.");
            this.allowed = List.copyOf(allowed);
        }

        /** Methods to advertise in the {@code Allow} header. */
        public List<HttpMethod> allowed() {
            return allowed;
        }
    }

    /**
     * Raised when no acceptable representation or encoding can be produced.
     */
    public static class NotAcceptable extends RestException {
        private final List<String> alternatives;

        public NotAcceptable(List<String> alternatives) {
            super(406, "Not Acceptable", "No acceptable representation; available: " + String.join(", ", alternatives) + ".");
            this.alternatives = List.copyOf(alternatives);
        }

        public List<String> alternatives() {
            return alternatives;
        }
    }

    /**
     * Raised when a write would overwrite a version the client has not seen.
     */
    public static class Conflict extends RestException {
        public Conflict() {
            this("The request conflicts with the current state of the resource.");
        }

        public Conflict(String message) {
            super(409, "Conflict", message);
        }
    }

    public static class PreconditionFailed extends RestException {
        public PreconditionFailed() {
            this("A precondition of the request did not hold.");
        }

        public PreconditionFailed(String message) {
            super(412, "Precondition Failed", message);
        }
    }

    public static class UnsupportedMediaType extends RestException {
        private final List<String> supported;

        public UnsupportedMediaType(List<String> supported) {
            super(415, "Unsupported Media Type", "Request body must be one of: " + String.join(", ", supported) + ".");
            this.supported = List.copyOf(supported);
        }

        public List<String> supported() {
            return supported;
        }
    }

    /**
     * Raised when a well-formed range selects nothing inside the resource.
     */
    public static class RangeNotSatisfiable extends RestException {
        private final String unit;
        private final long count;

        public RangeNotSatisfiable(String unit, long count) {
            super(416, "Requested Range Not Satisfiable", "The requested range lies outside the " + count + " " + unit + " available.");
            this.unit = Objects.requireNonNull(unit, "unit");
            this.count = count;
        }

        public String unit() {
            return unit;
        }

        public long count() {
            return count;
        }
    }

    public static class InternalServerError extends RestException {
        public InternalServerError(String message) {
            super(500, "Internal Server Error", message);
        }

        public InternalServerError(String message, Throwable cause) {
            super(500, "Internal Server Error", message, cause);
        }
    }
}
