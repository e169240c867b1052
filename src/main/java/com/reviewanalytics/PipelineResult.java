package com.reviewanalytics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one run. A successful result lists every published artifact by
 * name; a failed one carries the failure classification and message.
 */
public final class PipelineResult {

    /** Artifact name of the cleaned dataset in {@link #getArtifacts()}. */
    public static final String CLEANED_ARTIFACT = "cleaned";

    private final String jobId;
    private final boolean success;
    private final Map<String, String> artifacts;
    private final long rawCount;
    private final long cleanedCount;
    private final Map<RejectionReason, Long> rejections;
    private final FailureKind failureKind;
    private final String message;

    private PipelineResult(String jobId, boolean success, Map<String, String> artifacts,
                           long rawCount, long cleanedCount, Map<RejectionReason, Long> rejections,
                           FailureKind failureKind, String message) {
        this.jobId = jobId;
        this.success = success;
        this.artifacts = artifacts;
        this.rawCount = rawCount;
        this.cleanedCount = cleanedCount;
        this.rejections = rejections;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static PipelineResult success(String jobId, Map<String, String> artifacts,
                                         ReviewCleaner.CleaningResult cleaning) {
        Map<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);
        rejections.putAll(cleaning.getRejections());
        return new PipelineResult(jobId, true,
            Collections.unmodifiableMap(new LinkedHashMap<>(artifacts)),
            cleaning.getRawCount(), cleaning.getCleanedCount(),
            Collections.unmodifiableMap(rejections), null, null);
    }

    public static PipelineResult failure(String jobId, FailureKind kind, String message) {
        return new PipelineResult(jobId, false, Collections.emptyMap(), 0, 0,
            Collections.emptyMap(), kind, message);
    }

    public String getJobId() {
        return jobId;
    }

    public boolean isSuccess() {
        return success;
    }

    /** Artifact name to published path, cleaned dataset first. Empty on failure. */
    public Map<String, String> getArtifacts() {
        return artifacts;
    }

    public long getRawCount() {
        return rawCount;
    }

    public long getCleanedCount() {
        return cleanedCount;
    }

    public long getRejectedCount() {
        return rawCount - cleanedCount;
    }

    public Map<RejectionReason, Long> getRejections() {
        return rejections;
    }

    /** Null for a successful run. */
    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (success) {
            return "PipelineResult{jobId=" + jobId + ", success, raw=" + rawCount
                + ", cleaned=" + cleanedCount + ", artifacts=" + artifacts.keySet() + "}";
        }
        return "PipelineResult{jobId=" + jobId + ", failed=" + failureKind + ", message=" + message + "}";
    }
}
