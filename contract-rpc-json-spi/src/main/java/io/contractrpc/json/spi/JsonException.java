package io.contractrpc.json.spi;

/**
 * A value could not be written as JSON, or input could not be read as JSON.
 */
public class JsonException extends Exception {

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
