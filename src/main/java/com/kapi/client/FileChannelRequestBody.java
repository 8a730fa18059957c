package com.kapi.client;

import okhttp3.MediaType;
import okhttp3.RequestBody;
import okio.BufferedSink;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * Streams a file into a request without loading it in memory. The channel is left open; the
 * request that owns it closes it.
 */
final class FileChannelRequestBody extends RequestBody {

    private static final int CHUNK = 64 * 1024;

    private final FileChannel channel;
    private final MediaType contentType;
    private final long length;

    FileChannelRequestBody(FileChannel channel, MediaType contentType, long length) {
        this.channel = channel;
        this.contentType = contentType;
        this.length = length;
    }

    @Override
    public MediaType contentType() {
        return contentType;
    }

    @Override
    public long contentLength() {
        return length;
    }

    @Override
    public boolean isOneShot() {
        return true;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(CHUNK);
        long position = 0;
        while (position < length) {
            buffer.limit((int) Math.min(CHUNK, length - position));
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new IOException("File shrank while uploading: " + position + " of " + length + " bytes sent");
            }
            buffer.flip();
            while (buffer.hasRemaining()) {
                sink.write(buffer);
            }
            buffer.clear();
            position += read;
        }
    }
}
