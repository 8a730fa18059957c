package com.kapi.model;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Where the image or video of an upload request comes from: a remote URL the API fetches
 * itself, or a local file streamed in a multipart body.
 */
public sealed interface Source {

    record RemoteUrl(String url) implements Source {}

    /**
     * An open, read-only file. Owned by the request that selected it, which closes it once the
     * body has been sent or the call has failed.
     */
    record LocalFile(Path path, FileChannel channel) implements Source, Closeable {

        public boolean isOpen() {
            return channel.isOpen();
        }

        public long size() throws IOException {
            return channel.size();
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
