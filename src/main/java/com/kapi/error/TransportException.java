package com.kapi.error;

/**
 * The request never produced a complete HTTP response: DNS failure, refused connection,
 * broken stream.
 */
public class TransportException extends KapiException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
