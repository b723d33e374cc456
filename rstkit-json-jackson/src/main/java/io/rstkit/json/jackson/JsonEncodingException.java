package io.rstkit.json.jackson;

/**
 * Raised when a value cannot be written as JSON.
 */
public class JsonEncodingException extends Exception {
    public JsonEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
