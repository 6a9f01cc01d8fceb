package io.carelink.a2a.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Defines the lifecycle states of a {@link Task}.
 * <p>
 * States are either transitional or terminal. A task in a terminal state never moves to
 * another state.
 * <p>
 * <b>Transitional States:</b>
 * <ul>
 *   <li><b>submitted:</b> the task has been received and is queued for processing</li>
 *   <li><b>working:</b> the agent is processing the task and may report progress</li>
 *   <li><b>input-required:</b> the agent needs more input to continue</li>
 *   <li><b>auth-required:</b> the agent needs authentication before proceeding</li>
 * </ul>
 * <p>
 * <b>Terminal States:</b>
 * <ul>
 *   <li><b>completed:</b> the task finished successfully</li>
 *   <li><b>canceled:</b> the task was canceled</li>
 *   <li><b>failed:</b> the task failed, the reason is in the status message</li>
 *   <li><b>rejected:</b> the agent refused the task</li>
 *   <li><b>unknown:</b> the state cannot be determined</li>
 * </ul>
 *
 * @see TaskStatus
 * @see Task
 */
public enum TaskState {
    /** Task has been received and is queued for processing (transitional state). */
    SUBMITTED("submitted", false),

    /** Agent is actively processing the task (transitional state). */
    WORKING("working", false),

    /** Agent requires additional input from the user to continue (transitional state). */
    INPUT_REQUIRED("input-required", false),

    /** Task completed successfully (terminal state). */
    COMPLETED("completed", true),

    /** Task was canceled by user or system (terminal state). */
    CANCELED("canceled", true),

    /** Task failed due to an error (terminal state). */
    FAILED("failed", true),

    /** Task was rejected by the agent (terminal state). */
    REJECTED("rejected", true),

    /** Agent requires authentication or authorization to proceed (transitional state). */
    AUTH_REQUIRED("auth-required", false),

    /** Task state is unknown or cannot be determined (terminal state). */
    UNKNOWN("unknown", true);

    private final String state;
    private final boolean isFinal;

    TaskState(String state, boolean isFinal) {
        this.state = state;
        this.isFinal = isFinal;
    }

    @JsonValue
    public String asString() {
        return state;
    }

    /**
     * Determines whether this state is a terminal (final) state.
     *
     * @return {@code true} if this is a terminal state, {@code false} else.
     */
    public boolean isFinal() {
        return isFinal;
    }

    /**
     * Maps a wire value to a state. Values this version does not know map to {@link #UNKNOWN}.
     *
     * @param state the wire value
     * @return the matching state
     */
    @JsonCreator
    public static TaskState fromString(String state) {
        for (TaskState taskState : values()) {
            if (taskState.state.equals(state)) {
                return taskState;
            }
        }
        return UNKNOWN;
    }
}
