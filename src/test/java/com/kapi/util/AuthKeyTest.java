package com.kapi.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AuthKeyTest {

    @Test
    void format_prefixesTrimmedSecret() {
        assertEquals("KakaoAK abc123", AuthKey.format("KakaoAK", "  abc123 \n"));
    }

    @Test
    void format_emptySecretKeepsPrefix() {
        assertEquals("KakaoAK ", AuthKey.format("KakaoAK", ""));
    }

    @Test
    void format_nullSecretKeepsPrefix() {
        assertEquals("KakaoAK ", AuthKey.format("KakaoAK", null));
    }

    @Test
    void format_usesGivenScheme() {
        assertEquals("Bearer t", AuthKey.format("Bearer", "t"));
    }
}
