package com.reviewanalytics;

/**
 * Fatal error during a run. Record-level rejections never raise this.
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public PipelineException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
