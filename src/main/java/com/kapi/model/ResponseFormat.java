package com.kapi.model;

import com.kapi.error.InvalidArgumentException;

import java.util.Locale;
import java.util.Optional;

/** Wire and file encodings. */
public enum ResponseFormat {
    JSON("json"),
    XML("xml");

    private final String extension;

    ResponseFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static Optional<ResponseFormat> fromExtension(String ext) {
        for (ResponseFormat f : values()) {
            if (f.extension.equalsIgnoreCase(ext)) return Optional.of(f);
        }
        return Optional.empty();
    }

    /**
     * @throws InvalidArgumentException unless {@code name} is json or xml (any case)
     */
    public static ResponseFormat parse(String name) {
        if (name == null) {
            throw new InvalidArgumentException("format must be one of: json, xml");
        }
        return fromExtension(name.trim().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new InvalidArgumentException(
                        "format must be one of: json, xml (got '" + name + "')"));
    }
}
