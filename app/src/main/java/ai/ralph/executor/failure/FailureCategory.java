package ai.ralph.executor.failure;

import com.fasterxml.jackson.annotation.JsonValue;

/** Stable failure tags reported to the job queue. The tags are part of the wire contract; do not rename them. */
public enum FailureCategory {
    TOOL_NOT_INSTALLED("tool_not_installed"),
    NOT_AUTHENTICATED("not_authenticated"),
    OUT_OF_QUOTA("out_of_quota"),
    RATE_LIMITED("rate_limited"),
    PERMISSION_DENIED("permission_denied"),
    EXECUTION_TIMEOUT("execution_timeout"),
    NETWORK_ERROR("network_error"),
    EXECUTION_ERROR("execution_error"),
    UNKNOWN("unknown");

    private final String tag;

    FailureCategory(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
