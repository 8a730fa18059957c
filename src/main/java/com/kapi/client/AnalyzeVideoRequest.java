package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.DecodeException;
import com.kapi.error.InvalidArgumentException;
import com.kapi.error.PayloadTooLargeException;
import com.kapi.error.RequestBuildException;
import com.kapi.model.AnalyzeVideoResult;
import com.kapi.model.Source;
import com.kapi.util.ResultCodec;
import com.kapi.util.Sources;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Submits a video to the pose analysis service, which detects people in each frame and
 * extracts their key points. The call returns as soon as the job is accepted.
 */
public class AnalyzeVideoRequest extends UploadRequest<AnalyzeVideoRequest, AnalyzeVideoResult> {

    /** Largest local video accepted by the service. */
    public static final long MAX_VIDEO_BYTES = 50L * 1024 * 1024;

    private boolean smoothing = true;
    private String callbackUrl;

    public AnalyzeVideoRequest(KapiConfig config, KapiHttpClient http) {
        super(config, http);
    }

    /**
     * Analyse the video at {@code videoUrl}; replaces any file selected before.
     *
     * @throws InvalidArgumentException unless {@code videoUrl} is an http(s) URL
     */
    public AnalyzeVideoRequest withUrl(String videoUrl) {
        if (!Sources.isRemoteUrl(videoUrl)) {
            throw new InvalidArgumentException("video URL must be an http(s) URL (got '" + videoUrl + "')");
        }
        select(new Source.RemoteUrl(videoUrl.trim()));
        return this;
    }

    /**
     * Upload the local video {@code file}; replaces any source selected before.
     *
     * @throws PayloadTooLargeException if the file exceeds {@link #MAX_VIDEO_BYTES}
     * @throws IOException if the file cannot be opened
     */
    public AnalyzeVideoRequest withFile(Path file) throws IOException {
        selectFile(file);
        return this;
    }

    public AnalyzeVideoRequest withFile(String file) throws IOException {
        return withFile(Path.of(file));
    }

    /**
     * Whether key point positions are smoothed between detected frames. On by default.
     */
    public AnalyzeVideoRequest smoothing(boolean enabled) {
        this.smoothing = enabled;
        return this;
    }

    /**
     * URL notified when the analysis completes. An empty string clears it.
     *
     * @throws InvalidArgumentException if non-empty and not an http(s) URL
     */
    public AnalyzeVideoRequest callbackTo(String url) {
        if (url == null || url.isEmpty()) {
            this.callbackUrl = null;
            return this;
        }
        if (!Sources.isRemoteUrl(url)) {
            throw new InvalidArgumentException("callback URL must be an http(s) URL (got '" + url + "')");
        }
        this.callbackUrl = url.trim();
        return this;
    }

    public boolean isSmoothing() {
        return smoothing;
    }

    public String callbackUrl() {
        return callbackUrl;
    }

    @Override
    protected String urlParameter() {
        return "video_url";
    }

    @Override
    protected String filePart() {
        return "file";
    }

    @Override
    protected long maxFileBytes() {
        return MAX_VIDEO_BYTES;
    }

    @Override
    protected HttpUrl.Builder endpoint() throws RequestBuildException {
        return endpoint(config.poseBaseUrl(), "job");
    }

    @Override
    protected Map<String, String> parameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("smoothing", String.valueOf(smoothing));
        if (callbackUrl != null) {
            params.put("callback_url", callbackUrl);
        }
        return params;
    }

    @Override
    protected AnalyzeVideoResult decode(String body) throws DecodeException {
        AnalyzeVideoResult result = ResultCodec.fromJson(body, AnalyzeVideoResult.class);
        if (result.jobId() == null || result.jobId().isBlank()) {
            throw new DecodeException("Response has no job_id");
        }
        return result;
    }
}
