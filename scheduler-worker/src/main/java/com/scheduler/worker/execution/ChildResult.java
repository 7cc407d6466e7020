package com.scheduler.worker.execution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result file written by {@link TaskProcessMain}.
 */
record ChildResult(
    boolean completed,
    JsonNode result,
    String errorCode,
    String traceback
) {
    static ChildResult completed(JsonNode result) {
        return new ChildResult(true, result, null, null);
    }

    static ChildResult failed(String errorCode, String traceback) {
        return new ChildResult(false, null, errorCode, traceback);
    }

    @JsonIgnore
    int exitCode() {
        return completed ? 0 : 1;
    }
}
