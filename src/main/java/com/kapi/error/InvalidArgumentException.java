package com.kapi.error;

/**
 * A builder was given a value outside its accepted range. The builder keeps its previous value.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
