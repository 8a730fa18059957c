package com.kapi.error;

/**
 * The HTTP request could not be assembled (bad base URL, missing or already consumed source).
 */
public class RequestBuildException extends KapiException {

    public RequestBuildException(String message) {
        super(message);
    }

    public RequestBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
