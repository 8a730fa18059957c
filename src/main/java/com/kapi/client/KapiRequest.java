package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.DecodeException;
import com.kapi.error.KapiException;
import com.kapi.error.RequestBuildException;
import com.kapi.util.AuthKey;
import okhttp3.HttpUrl;
import okhttp3.Request;

/**
 * Shared lifecycle of the request builders: chained setters, then one blocking
 * {@link #collect()} that sends the request and decodes the response.
 *
 * @param <T> the concrete builder type for method chaining
 * @param <R> the decoded result type
 */
public abstract class KapiRequest<T extends KapiRequest<T, R>, R> {

    protected final KapiConfig config;
    private final KapiHttpClient http;
    private String authorization;

    protected KapiRequest(KapiConfig config, KapiHttpClient http) {
        this.config = config;
        this.http = http;
        this.authorization = AuthKey.format(config.keyPrefix(), "");
    }

    /**
     * Sets the secret sent in the Authorization header. Surrounding whitespace is dropped.
     */
    public T authorizeWith(String key) {
        this.authorization = AuthKey.format(config.keyPrefix(), key);
        return self();
    }

    public String authorization() {
        return authorization;
    }

    /**
     * Sends the request and decodes the response. Any local file attached to the builder is
     * closed before this method returns, whatever the outcome.
     *
     * @throws RequestBuildException if the request cannot be assembled
     * @throws com.kapi.error.TransportException if no response was received
     * @throws com.kapi.error.ApiErrorException on a non-2xx status
     * @throws DecodeException if the body does not match the result type
     * @throws com.kapi.error.PayloadTooLargeException if an attached file grew past its limit
     */
    public R collect() throws KapiException {
        try {
            Request request = newRequest();
            String body = http.execute(request);
            return decode(body);
        } finally {
            release();
        }
    }

    protected abstract Request newRequest() throws RequestBuildException;

    protected abstract R decode(String body) throws DecodeException;

    /** Frees resources held by the builder. Called once per {@link #collect()}. */
    protected void release() {}

    protected Request.Builder newRequestBuilder(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header(AuthKey.HEADER, authorization)
                .header("Connection", "close");
    }

    /**
     * Parses {@code baseUrl} and appends {@code path}, which may hold several segments.
     */
    protected static HttpUrl.Builder endpoint(String baseUrl, String path) throws RequestBuildException {
        HttpUrl base = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new RequestBuildException("Invalid base URL: " + baseUrl);
        }
        return base.newBuilder().addPathSegments(path);
    }

    @SuppressWarnings("unchecked")
    protected T self() {
        return (T) this;
    }
}
