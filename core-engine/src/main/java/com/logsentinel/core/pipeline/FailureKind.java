package com.logsentinel.core.pipeline;

/**
 * Stage-local failure recorded for a processed line.
 *
 * @since 1.0.0
 */
public enum FailureKind {
    /** Every stage succeeded. */
    NONE,
    /** The timestamp fell back to processing time; otherwise fine. */
    PARSE_DEGRADED,
    /** The model was not ready; the line was stored log-only. */
    MODEL_UNAVAILABLE,
    /** The model call failed; the line was stored log-only. */
    INFERENCE_FAILURE,
    /** Nothing was stored for the line. */
    PERSISTENCE_FAILURE
}
