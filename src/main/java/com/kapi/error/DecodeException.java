package com.kapi.error;

/**
 * The response body was empty, malformed, or lacked a field the result requires.
 */
public class DecodeException extends KapiException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
