package com.kapi.error;

/**
 * Base type for every failure raised while executing a request or persisting a result.
 *
 * <p>Configuration mistakes are reported earlier, when the builder method is called, as
 * {@link InvalidArgumentException} or {@link PayloadTooLargeException}.</p>
 */
public class KapiException extends Exception {

    public KapiException(String message) {
        super(message);
    }

    public KapiException(String message, Throwable cause) {
        super(message, cause);
    }
}
