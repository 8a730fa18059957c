package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.DecodeException;
import com.kapi.error.InvalidArgumentException;
import com.kapi.error.RequestBuildException;
import com.kapi.model.ThumbnailDetectResult;
import com.kapi.util.ResultCodec;
import com.kapi.util.Sources;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detects the representative area of an image, to be cropped into a thumbnail of the
 * requested aspect ratio.
 */
public class ThumbnailDetectRequest extends UploadRequest<ThumbnailDetectRequest, ThumbnailDetectResult> {

    /** Largest local image accepted by the service. */
    public static final long MAX_IMAGE_BYTES = 2L * 1024 * 1024;

    private Integer width;
    private Integer height;

    /**
     * @param source an http(s) image URL or a local image path
     * @throws IOException if {@code source} is a local path that cannot be opened
     */
    public ThumbnailDetectRequest(KapiConfig config, KapiHttpClient http, String source) throws IOException {
        super(config, http);
        select(Sources.classify(source, MAX_IMAGE_BYTES));
    }

    /**
     * Width part of the thumbnail aspect ratio.
     *
     * @throws InvalidArgumentException unless {@code ratio} is positive
     */
    public ThumbnailDetectRequest widthTo(int ratio) {
        this.width = positive("width", ratio);
        return this;
    }

    /**
     * Height part of the thumbnail aspect ratio.
     *
     * @throws InvalidArgumentException unless {@code ratio} is positive
     */
    public ThumbnailDetectRequest heightTo(int ratio) {
        this.height = positive("height", ratio);
        return this;
    }

    public Integer width() {
        return width;
    }

    public Integer height() {
        return height;
    }

    @Override
    protected String urlParameter() {
        return "image_url";
    }

    @Override
    protected String filePart() {
        return "image";
    }

    @Override
    protected long maxFileBytes() {
        return MAX_IMAGE_BYTES;
    }

    @Override
    protected HttpUrl.Builder endpoint() throws RequestBuildException {
        return endpoint(config.visionBaseUrl(), "thumbnail/detect");
    }

    @Override
    protected Map<String, String> parameters() {
        Map<String, String> params = new LinkedHashMap<>();
        if (width != null) params.put("width", width.toString());
        if (height != null) params.put("height", height.toString());
        return params;
    }

    @Override
    protected ThumbnailDetectResult decode(String body) throws DecodeException {
        ThumbnailDetectResult result = ResultCodec.fromJson(body, ThumbnailDetectResult.class);
        if (result.result() == null) {
            throw new DecodeException("Response has no result");
        }
        return result;
    }

    private static int positive(String name, int ratio) {
        if (ratio <= 0) {
            throw new InvalidArgumentException(name + " ratio must be positive (got " + ratio + ")");
        }
        return ratio;
    }
}
