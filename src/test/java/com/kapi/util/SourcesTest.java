package com.kapi.util;

import com.kapi.error.InvalidArgumentException;
import com.kapi.error.PayloadTooLargeException;
import com.kapi.model.Source;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SourcesTest {

    @TempDir
    Path tempDir;

    // ── classify ────────────────────────────────────────────────

    @Test
    void classify_remoteUrl() throws IOException {
        Source source = Sources.classify("https://example.com/a.jpg");

        var remote = assertInstanceOf(Source.RemoteUrl.class, source);
        assertEquals("https://example.com/a.jpg", remote.url());
    }

    @Test
    void classify_localFileIsOpenAtOffsetZero() throws IOException {
        Path file = tempDir.resolve("a.jpg");
        Files.writeString(file, "JPEGDATA");

        Source source = Sources.classify(file.toString());

        var local = assertInstanceOf(Source.LocalFile.class, source);
        try (local) {
            assertTrue(local.isOpen());
            assertEquals(0, local.channel().position());
            ByteBuffer buf = ByteBuffer.allocate(4);
            local.channel().read(buf);
            assertEquals("JPEG", new String(buf.array(), StandardCharsets.US_ASCII));
        }
        assertFalse(local.isOpen());
    }

    @Test
    void classify_missingFileThrows() {
        assertThrows(NoSuchFileException.class,
                () -> Sources.classify(tempDir.resolve("missing.jpg").toString()));
    }

    @Test
    void classify_invalidPathIsIoFailure() {
        assertThrows(NoSuchFileException.class, () -> Sources.classify("a\u0000b.jpg"));
    }

    @Test
    void classify_directoryThrows() {
        assertThrows(IOException.class, () -> Sources.classify(tempDir.toString()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    void classify_blankRejected(String source) {
        assertThrows(InvalidArgumentException.class, () -> Sources.classify(source));
    }

    @Test
    void classify_rejectsFileOverLimit() throws IOException {
        Path file = tempDir.resolve("big.png");
        Files.write(file, new byte[101]);

        var e = assertThrows(PayloadTooLargeException.class,
                () -> Sources.classify(file.toString(), 100));
        assertEquals(101, e.sizeBytes());
        assertEquals(100, e.limitBytes());
    }

    @Test
    void openLocal_acceptsFileAtLimit() throws IOException {
        Path file = tempDir.resolve("ok.png");
        Files.write(file, new byte[100]);

        try (var local = Sources.openLocal(file, 100)) {
            assertEquals(100, local.size());
        }
    }

    // ── isRemoteUrl ─────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {
            "http://example.com/v.mp4",
            "https://example.com/a.jpg?x=1",
            "HTTPS://EXAMPLE.COM/A.JPG",
            "  https://example.com/padded.jpg  ",
    })
    void isRemoteUrl_true(String s) {
        assertTrue(Sources.isRemoteUrl(s));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "/tmp/a.jpg",
            "a.jpg",
            "file:///tmp/a.jpg",
            "ftp://example.com/a.jpg",
            "https:///nohost",
            "C:\\images\\a.jpg",
    })
    void isRemoteUrl_false(String s) {
        assertFalse(Sources.isRemoteUrl(s));
    }
}
