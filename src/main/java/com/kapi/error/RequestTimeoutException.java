package com.kapi.error;

/** Connect or read deadline expired. */
public class RequestTimeoutException extends TransportException {

    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
