package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.ApiErrorException;
import com.kapi.error.RequestTimeoutException;
import com.kapi.error.TransportException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Sends one request and returns the body of a successful response.
 *
 * <p>Connection failures are not retried: a multipart body streamed from a file can only be
 * sent once.</p>
 */
public class KapiHttpClient {

    private static final Logger log = LoggerFactory.getLogger(KapiHttpClient.class);

    private final OkHttpClient client;

    public KapiHttpClient(KapiConfig config) {
        this(new OkHttpClient.Builder()
                .connectTimeout(config.connectTimeout())
                .readTimeout(config.readTimeout())
                .writeTimeout(config.readTimeout())
                .retryOnConnectionFailure(false)
                .build());
    }

    public KapiHttpClient(OkHttpClient client) {
        this.client = client;
    }

    /**
     * @return the response body as text, empty if the server sent none
     * @throws ApiErrorException on a non-2xx status
     * @throws TransportException if no complete response was received
     */
    public String execute(Request request) throws TransportException, ApiErrorException {
        log.debug("{} {}", request.method(), request.url().redact());

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();

            if (!response.isSuccessful()) {
                log.warn("{} {} returned HTTP {}", request.method(), request.url().redact(), response.code());
                throw new ApiErrorException(response.code(), text);
            }
            log.debug("HTTP {} with {} chars", response.code(), text.length());
            return text;
        } catch (InterruptedIOException e) {
            throw new RequestTimeoutException("Timed out calling " + request.url().redact(), e);
        } catch (IOException e) {
            throw new TransportException("Failed to call " + request.url().redact() + ": " + e.getMessage(), e);
        }
    }
}
