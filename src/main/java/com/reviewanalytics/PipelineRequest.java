package com.reviewanalytics;

import java.util.Objects;

/**
 * What the trigger hands to the pipeline: a logical job id, the input file
 * and the processed-output root under which all artifacts are published.
 */
public final class PipelineRequest {

    private final String jobId;
    private final String inputPath;
    private final String outputRoot;

    public PipelineRequest(String jobId, String inputPath, String outputRoot) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath");
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
    }

    public String getJobId() {
        return jobId;
    }

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputRoot() {
        return outputRoot;
    }

    @Override
    public String toString() {
        return "PipelineRequest{jobId=" + jobId + ", input=" + inputPath + ", output=" + outputRoot + "}";
    }
}
