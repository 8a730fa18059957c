package com.kapi.error;

import com.kapi.util.FileUtils;

import java.nio.file.Path;

/**
 * A local file exceeds the upload limit of the capability it was attached to.
 */
public class PayloadTooLargeException extends IllegalArgumentException {

    private final long sizeBytes;
    private final long limitBytes;

    public PayloadTooLargeException(Path file, long sizeBytes, long limitBytes) {
        super("File %s is %s, exceeds %s limit".formatted(
                file.getFileName(), FileUtils.formatSize(sizeBytes), FileUtils.formatSize(limitBytes)));
        this.sizeBytes = sizeBytes;
        this.limitBytes = limitBytes;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public long limitBytes() {
        return limitBytes;
    }
}
