package io.carelink.a2a.coordinator;

import java.time.Duration;

import io.carelink.a2a.util.Assert;

/**
 * One call of a coordinator workflow.
 *
 * @param name short name used in logs and failure texts
 * @param description the progress text reported for the step, such as {@code Booking appointment...}
 * @param resultKey key of the step's result in the aggregated reply
 * @param agentUrl RPC endpoint of the downstream agent
 * @param promptTemplate text sent downstream; {@value #INPUT_PLACEHOLDER} is replaced with the inbound text
 * @param timeout how long to wait for the downstream answer
 */
public record WorkflowStep(String name, String description, String resultKey, String agentUrl,
                           String promptTemplate, Duration timeout) {

    public static final String INPUT_PLACEHOLDER = "{input}";

    public WorkflowStep {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("description", description);
        Assert.checkNotNullParam("resultKey", resultKey);
        Assert.checkNotNullParam("agentUrl", agentUrl);
        Assert.checkNotNullParam("promptTemplate", promptTemplate);
        Assert.checkNotNullParam("timeout", timeout);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Step " + name + " needs a positive timeout, got " + timeout);
        }
    }

    /**
     * Builds the text sent to the downstream agent.
     *
     * @param input the text of the coordinator's inbound message
     * @return the prompt
     */
    public String prompt(String input) {
        return promptTemplate.replace(INPUT_PLACEHOLDER, input);
    }
}
