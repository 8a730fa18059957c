package com.kapi;

import com.kapi.client.AnalyzeVideoRequest;
import com.kapi.client.CoordToDistrictRequest;
import com.kapi.client.KapiHttpClient;
import com.kapi.client.ThumbnailDetectRequest;

import java.io.IOException;

/**
 * Entry point: creates one request builder per capability.
 *
 * <pre>{@code
 * Kapi kapi = Kapi.create();
 *
 * CoordToDistrictResult districts = kapi.coordToDistrict(127.1, 37.4)
 *     .authorizeWith(secret)
 *     .formatAs("xml")
 *     .collect();
 *
 * AnalyzeVideoResult job = kapi.analyzeVideo()
 *     .authorizeWith(secret)
 *     .withFile(Path.of("dance.mp4"))
 *     .smoothing(false)
 *     .collect();
 * }</pre>
 *
 * <p>A {@code Kapi} instance is thread-safe and should be shared; the builders it returns
 * are not and belong to the thread that created them.</p>
 */
public final class Kapi {

    private final KapiConfig config;
    private final KapiHttpClient http;

    public Kapi(KapiConfig config) {
        this(config, new KapiHttpClient(config));
    }

    public Kapi(KapiConfig config, KapiHttpClient http) {
        this.config = config;
        this.http = http;
    }

    public static Kapi create() {
        return new Kapi(KapiConfig.defaults());
    }

    public KapiConfig config() {
        return config;
    }

    /** Detect people in each frame of a video and extract their key points. */
    public AnalyzeVideoRequest analyzeVideo() {
        return new AnalyzeVideoRequest(config, http);
    }

    /** Administrative and legal districts containing the point ({@code x}, {@code y}). */
    public CoordToDistrictRequest coordToDistrict(double x, double y) {
        return new CoordToDistrictRequest(config, http, x, y);
    }

    /**
     * Detect the representative area of an image given as an http(s) URL or a local path.
     *
     * @throws IOException if {@code source} is a local path that cannot be opened
     */
    public ThumbnailDetectRequest thumbnailDetect(String source) throws IOException {
        return new ThumbnailDetectRequest(config, http, source);
    }
}
