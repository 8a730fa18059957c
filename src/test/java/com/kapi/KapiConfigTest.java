package com.kapi;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KapiConfigTest {

    private static Properties props() {
        Properties p = new Properties();
        p.setProperty(KapiConfig.KEY_PREFIX, "KakaoAK");
        p.setProperty(KapiConfig.POSE_BASE_URL, "https://pose.example");
        p.setProperty(KapiConfig.LOCAL_BASE_URL, "https://local.example");
        p.setProperty(KapiConfig.VISION_BASE_URL, "https://vision.example");
        p.setProperty(KapiConfig.CONNECT_TIMEOUT_MS, "1500");
        p.setProperty(KapiConfig.READ_TIMEOUT_MS, " 3000 ");
        return p;
    }

    @Test
    void defaults_loadedFromClasspath() {
        KapiConfig config = KapiConfig.defaults();

        assertEquals("KakaoAK", config.keyPrefix());
        assertTrue(config.localBaseUrl().startsWith("https://"));
        assertTrue(config.visionBaseUrl().startsWith("https://"));
        assertTrue(config.poseBaseUrl().startsWith("https://"));
        assertSame(config, KapiConfig.defaults());
    }

    @Test
    void fromProperties_parsesTimeouts() {
        KapiConfig config = KapiConfig.fromProperties(props());

        assertEquals(Duration.ofMillis(1500), config.connectTimeout());
        assertEquals(Duration.ofMillis(3000), config.readTimeout());
        assertEquals("https://vision.example", config.visionBaseUrl());
    }

    @Test
    void fromProperties_systemPropertyWins() {
        System.setProperty(KapiConfig.KEY_PREFIX, "Bearer");
        try {
            assertEquals("Bearer", KapiConfig.fromProperties(props()).keyPrefix());
        } finally {
            System.clearProperty(KapiConfig.KEY_PREFIX);
        }
    }

    @Test
    void fromProperties_missingKeyFails() {
        Properties p = props();
        p.remove(KapiConfig.POSE_BASE_URL);

        assertThrows(IllegalStateException.class, () -> KapiConfig.fromProperties(p));
    }

    @Test
    void withBaseUrl_pointsEveryApiAtOneOrigin() {
        KapiConfig config = KapiConfig.fromProperties(props()).withBaseUrl("http://localhost:8080/");

        assertEquals("http://localhost:8080/", config.poseBaseUrl());
        assertEquals("http://localhost:8080/", config.localBaseUrl());
        assertEquals("http://localhost:8080/", config.visionBaseUrl());
        assertEquals("KakaoAK", config.keyPrefix());
    }

    @Test
    void keyPrefix_flowsIntoBuilders() {
        Kapi kapi = new Kapi(KapiConfig.fromProperties(props()).withKeyPrefix("Custom"));

        assertEquals("Custom k", kapi.coordToDistrict(1, 2).authorizeWith("k").authorization());
    }
}
