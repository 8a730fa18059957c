package com.kapi.error;

/**
 * A result cannot be persisted under the requested file extension.
 */
public class UnsupportedFormatException extends KapiException {

    private final String extension;

    public UnsupportedFormatException(String extension) {
        super("Unsupported output format: '" + extension + "'");
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
