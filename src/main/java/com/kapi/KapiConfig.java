package com.kapi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings threaded into every request builder.
 *
 * @param keyPrefix      scheme written before the secret in the Authorization header
 * @param poseBaseUrl    origin and path prefix of the pose analysis API
 * @param localBaseUrl   origin and path prefix of the local (geo) API
 * @param visionBaseUrl  origin and path prefix of the vision API
 * @param connectTimeout TCP connect deadline
 * @param readTimeout    deadline between bytes of the response
 */
public record KapiConfig(
        String keyPrefix,
        String poseBaseUrl,
        String localBaseUrl,
        String visionBaseUrl,
        Duration connectTimeout,
        Duration readTimeout
) {

    private static final Logger log = LoggerFactory.getLogger(KapiConfig.class);

    static final String RESOURCE = "kapi-defaults.properties";

    static final String KEY_PREFIX = "kapi.key-prefix";
    static final String POSE_BASE_URL = "kapi.pose.base-url";
    static final String LOCAL_BASE_URL = "kapi.local.base-url";
    static final String VISION_BASE_URL = "kapi.vision.base-url";
    static final String CONNECT_TIMEOUT_MS = "kapi.connect-timeout-ms";
    static final String READ_TIMEOUT_MS = "kapi.read-timeout-ms";

    /**
     * Defaults from {@value #RESOURCE} on the classpath, each overridable by a system property
     * of the same name. Resolved once per JVM.
     */
    public static KapiConfig defaults() {
        return Defaults.INSTANCE;
    }

    /** Same settings with every API pointed at {@code baseUrl}. */
    public KapiConfig withBaseUrl(String baseUrl) {
        return new KapiConfig(keyPrefix, baseUrl, baseUrl, baseUrl, connectTimeout, readTimeout);
    }

    public KapiConfig withKeyPrefix(String prefix) {
        return new KapiConfig(prefix, poseBaseUrl, localBaseUrl, visionBaseUrl, connectTimeout, readTimeout);
    }

    public KapiConfig withTimeouts(Duration connect, Duration read) {
        return new KapiConfig(keyPrefix, poseBaseUrl, localBaseUrl, visionBaseUrl, connect, read);
    }

    static KapiConfig fromProperties(Properties props) {
        return new KapiConfig(
                resolve(props, KEY_PREFIX),
                resolve(props, POSE_BASE_URL),
                resolve(props, LOCAL_BASE_URL),
                resolve(props, VISION_BASE_URL),
                Duration.ofMillis(Long.parseLong(resolve(props, CONNECT_TIMEOUT_MS))),
                Duration.ofMillis(Long.parseLong(resolve(props, READ_TIMEOUT_MS)))
        );
    }

    private static String resolve(Properties props, String key) {
        String override = System.getProperty(key);
        if (override != null) {
            log.debug("Using system property override for {}", key);
            return override.trim();
        }
        String value = props.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("Missing configuration key " + key + " in " + RESOURCE);
        }
        return value.trim();
    }

    private static final class Defaults {
        static final KapiConfig INSTANCE = load();

        private static KapiConfig load() {
            Properties props = new Properties();
            try (InputStream in = KapiConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException(RESOURCE + " not found on classpath");
                }
                props.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + RESOURCE, e);
            }
            return fromProperties(props);
        }
    }
}
