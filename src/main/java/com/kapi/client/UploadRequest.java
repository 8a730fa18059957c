package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.PayloadTooLargeException;
import com.kapi.error.RequestBuildException;
import com.kapi.model.Source;
import com.kapi.util.FileUtils;
import com.kapi.util.Sources;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MultipartBody;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * A request whose input is either a remote URL or a local file.
 *
 * <p>A remote URL goes in the query string next to the other parameters. A local file is
 * streamed as a multipart part named {@link #filePart()}, and the other parameters become
 * form fields of the same body.</p>
 */
public abstract class UploadRequest<T extends UploadRequest<T, R>, R> extends KapiRequest<T, R> {

    private static final Logger log = LoggerFactory.getLogger(UploadRequest.class);

    private Source source;

    protected UploadRequest(KapiConfig config, KapiHttpClient http) {
        super(config, http);
    }

    public Source source() {
        return source;
    }

    /** Query parameter carrying a remote URL source. */
    protected abstract String urlParameter();

    /** Multipart field carrying a local file source. */
    protected abstract String filePart();

    /** Upload limit for local files, in bytes. */
    protected abstract long maxFileBytes();

    /** Endpoint of the capability. */
    protected abstract HttpUrl.Builder endpoint() throws RequestBuildException;

    /** Parameters sent alongside the source, in order. */
    protected abstract Map<String, String> parameters();

    /**
     * Replaces the current source; a previously attached file is closed.
     */
    protected void select(Source next) {
        release();
        this.source = next;
    }

    protected void selectFile(Path file) throws IOException {
        Source.LocalFile local = Sources.openLocal(file, maxFileBytes());
        select(local);
        log.debug("Attached {} ({})", file.getFileName(), FileUtils.formatSize(local.size()));
    }

    @Override
    protected Request newRequest() throws RequestBuildException {
        if (source == null) {
            throw new RequestBuildException("No source selected");
        }
        HttpUrl.Builder url = endpoint();

        if (source instanceof Source.RemoteUrl remote) {
            url.addQueryParameter(urlParameter(), remote.url());
            parameters().forEach(url::addQueryParameter);
            return newRequestBuilder(url.build())
                    .post(new FormBody.Builder().build())
                    .build();
        }

        Source.LocalFile file = (Source.LocalFile) source;
        if (!file.isOpen()) {
            throw new RequestBuildException("File " + file.path() + " was already sent; select it again");
        }

        long length;
        try {
            length = file.size();
        } catch (IOException e) {
            throw new RequestBuildException("Cannot read size of " + file.path(), e);
        }
        if (length > maxFileBytes()) {
            throw new PayloadTooLargeException(file.path(), length, maxFileBytes());
        }

        MultipartBody.Builder body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart(filePart(), String.valueOf(file.path().getFileName()),
                        new FileChannelRequestBody(file.channel(), FileUtils.mediaTypeOf(file.path()), length));
        parameters().forEach(body::addFormDataPart);

        return newRequestBuilder(url.build())
                .post(body.build())
                .build();
    }

    @Override
    protected void release() {
        if (source instanceof Source.LocalFile file) {
            try {
                file.close();
            } catch (IOException e) {
                log.warn("Failed to close {}", file.path(), e);
            }
        }
    }
}
