package com.kapi.error;

/**
 * The server answered with a non-2xx status. The raw body is kept since the API reports
 * its own error code and message there.
 */
public class ApiErrorException extends KapiException {

    private final int statusCode;
    private final String body;

    public ApiErrorException(int statusCode, String body) {
        super("HTTP %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
