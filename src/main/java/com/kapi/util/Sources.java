package com.kapi.util;

import com.kapi.error.InvalidArgumentException;
import com.kapi.error.PayloadTooLargeException;
import com.kapi.model.Source;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Decides whether a source string names a remote URL or a local file.
 */
public final class Sources {

    private Sources() {}

    /**
     * Classify without a size limit.
     *
     * @throws IOException if the string is a local path that cannot be opened
     */
    public static Source classify(String source) throws IOException {
        return classify(source, Long.MAX_VALUE);
    }

    /**
     * Classify {@code source}. Remote URLs are returned as-is; anything else is treated as a
     * local path and opened for reading at offset 0.
     *
     * @throws IOException if the string is a local path that cannot be opened
     * @throws PayloadTooLargeException if the local file is larger than {@code maxBytes}
     * @throws InvalidArgumentException if {@code source} is null or blank
     */
    public static Source classify(String source, long maxBytes) throws IOException {
        if (source == null || source.isBlank()) {
            throw new InvalidArgumentException("source must not be blank");
        }
        if (isRemoteUrl(source)) {
            return new Source.RemoteUrl(source.trim());
        }
        Path file;
        try {
            file = Path.of(source);
        } catch (InvalidPathException e) {
            throw new NoSuchFileException(source, null, e.getMessage());
        }
        return openLocal(file, maxBytes);
    }

    /**
     * Open {@code file} for reading once its size has been checked against {@code maxBytes}.
     */
    public static Source.LocalFile openLocal(Path file, long maxBytes) throws IOException {
        if (Files.isDirectory(file)) {
            throw new FileSystemException(file.toString(), null, "Is a directory");
        }
        long size = Files.size(file);
        if (size > maxBytes) {
            throw new PayloadTooLargeException(file, size, maxBytes);
        }
        return new Source.LocalFile(file, FileChannel.open(file, StandardOpenOption.READ));
    }

    /**
     * True for absolute http(s) URLs with a host.
     */
    public static boolean isRemoteUrl(String source) {
        if (source == null || source.isBlank()) return false;
        try {
            URI uri = new URI(source.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
