package com.kapi.model;

import com.google.gson.annotations.SerializedName;
import com.kapi.error.UnsupportedFormatException;
import com.kapi.util.ResultCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Job accepted by the pose analysis service. The key points are delivered later, to the
 * callback URL or by polling the job.
 *
 * @param jobId identifier of the submitted analysis job
 */
public record AnalyzeVideoResult(@SerializedName("job_id") String jobId) {

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
