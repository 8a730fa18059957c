package com.kapi.model;

import com.kapi.error.UnsupportedFormatException;
import com.kapi.util.ResultCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Representative area detected in an image.
 *
 * @param rid    request id assigned by the server
 * @param result detected area and the size of the analysed image
 */
public record ThumbnailDetectResult(String rid, ThumbnailResult result) {

    /** Box of the thumbnail, in pixels of the original image. */
    public record Thumbnail(int x, int y, int width, int height) {}

    public record ThumbnailResult(int width, int height, Thumbnail thumbnail) {}

    /**
     * @throws UnsupportedFormatException unless the extension is .json
     */
    public void saveAs(Path file) throws IOException, UnsupportedFormatException {
        ResultCodec.saveAs(this, file, Set.of(ResponseFormat.JSON));
    }

    @Override
    public String toString() {
        return ResultCodec.toJson(this);
    }
}
