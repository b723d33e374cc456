package io.rstkit.server.core;

/**
 * Body of every error response.
 *
 * @param status HTTP status code
 * @param reason reason phrase
 * @param description what went wrong, for the client
 */
public record ErrorDocument(int status, String reason, String description) {

    @Override
    public String toString() {
        return status + " " + reason + ": " + description;
    }
}
