package com.kapi.util;

/**
 * Builds the value of the {@code Authorization} header.
 */
public final class AuthKey {

    private AuthKey() {}

    public static final String HEADER = "Authorization";

    /**
     * Returns {@code prefix + " " + secret.trim()}; a null or blank secret leaves only the prefix.
     */
    public static String format(String prefix, String secret) {
        return prefix + " " + (secret == null ? "" : secret.trim());
    }
}
