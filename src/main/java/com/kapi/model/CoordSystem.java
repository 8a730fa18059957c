package com.kapi.model;

import com.kapi.error.InvalidArgumentException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Coordinate systems accepted by the coordinate-to-district lookup.
 */
public enum CoordSystem {
    WGS84,
    WCONGNAMUL,
    CONGNAMUL,
    WTM,
    TM;

    private static final String OPTIONS = Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));

    /**
     * Exact, case-sensitive match on the system name.
     *
     * @throws InvalidArgumentException for anything else
     */
    public static CoordSystem parse(String name) {
        for (CoordSystem c : values()) {
            if (c.name().equals(name)) return c;
        }
        throw new InvalidArgumentException(
                "coordinate system must be one of: " + OPTIONS + " (got '" + name + "')");
    }
}
