package com.purchasingpower.ptcaudit.model.call;

/**
 * Lifecycle state of a single tool call as stored in {@code tool_call_results.status}.
 *
 * <p>State Transitions:
 * <pre>
 * PENDING → EXECUTING → COMPLETED
 *               ↓
 *            FAILED
 * </pre>
 *
 * <p>Billing rules only trust the exact stored values. Older writers also used
 * {@code finish}, {@code success}, {@code error}, {@code running} and
 * {@code in_progress}; those are understood by {@link #forDisplay(String)} for
 * status icons and nothing else.
 */
public enum CallStatus {

    /**
     * Call recorded but not yet started.
     */
    PENDING,

    /**
     * Call is running.
     */
    EXECUTING,

    /**
     * Call finished successfully.
     * Terminal state.
     */
    COMPLETED,

    /**
     * Call finished with an error.
     * Terminal state.
     */
    FAILED,

    /**
     * Stored value not recognised.
     */
    UNKNOWN;

    /**
     * Parse the raw column value exactly as written by the current writer.
     *
     * @param raw column value, may be null
     * @return parsed status, {@link #UNKNOWN} for null, aliases and anything else
     */
    public static CallStatus fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        return switch (raw) {
            case "pending" -> PENDING;
            case "executing" -> EXECUTING;
            case "completed" -> COMPLETED;
            case "failed" -> FAILED;
            default -> UNKNOWN;
        };
    }

    /**
     * Lenient parse for rendering: also maps the aliases of older rows.
     *
     * @param raw column value, may be null
     * @return status to show, {@link #UNKNOWN} when unrecognised
     */
    public static CallStatus forDisplay(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        return switch (raw) {
            case "completed", "finish", "success" -> COMPLETED;
            case "failed", "error" -> FAILED;
            case "executing", "running", "in_progress" -> EXECUTING;
            case "pending" -> PENDING;
            default -> UNKNOWN;
        };
    }
}
