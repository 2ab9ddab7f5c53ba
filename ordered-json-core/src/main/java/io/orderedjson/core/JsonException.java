package io.orderedjson.core;

/**
 * Base exception for JSON encoding and decoding errors.
 *
 * <p>Specific conditions are reported through the nested subclasses so callers can
 * tell malformed input apart from values that cannot be written. Plain {@code JsonException}
 * is used for I/O failures of a caller-supplied source or sink.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public JsonException(Throwable cause) {
        super(cause);
    }

    /**
     * Raised when the input is not a well-formed JSON object: missing or mismatched braces,
     * an unexpected closing delimiter, trailing content, excessive nesting or a tokenizer failure.
     */
    public static class Malformed extends JsonException {
        public Malformed(String message) {
            super(message);
        }

        public Malformed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when an object member name is not a JSON string.
     */
    public static class NonStringKey extends Malformed {
        public NonStringKey(String message) {
            super(message);
        }

        public NonStringKey(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a value cannot be represented in JSON text (non-finite numbers,
     * nesting beyond the configured depth, self-containing maps).
     */
    public static class Unencodable extends JsonException {
        public Unencodable(String message) {
            super(message);
        }
    }
}
