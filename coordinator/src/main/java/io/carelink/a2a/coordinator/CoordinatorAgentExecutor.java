package io.carelink.a2a.coordinator;

import static io.carelink.a2a.util.Utils.OBJECT_MAPPER;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.type.TypeReference;
import io.carelink.a2a.server.agentexecution.AgentExecutionException;
import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.server.util.MessageUtils;
import io.carelink.a2a.spec.A2AClientException;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.spec.TaskState;
import io.carelink.a2a.spec.TextPart;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed list of {@link WorkflowStep}s, one downstream {@code message/send} per step,
 * strictly in order. Every step receives the text of the coordinator's own inbound message.
 * <p>
 * The first step that times out, cannot reach its agent, gets an error envelope back or gets a
 * task that ended in any terminal state other than {@code completed} stops the workflow: the
 * remaining steps are never sent, and the coordinator's task fails with the results gathered so
 * far attached. Nothing is retried.
 */
public class CoordinatorAgentExecutor implements AgentExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoordinatorAgentExecutor.class);

    public static final String WORKFLOW_STEPS = "workflow_steps";
    public static final String STATUS = "status";
    public static final String FAILED_STEP = "failed_step";
    public static final String ERROR = "error";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final List<WorkflowStep> steps;
    private final DownstreamAgentClient client;
    private final String successText;
    private final String failurePrefix;

    /**
     * @param steps the workflow, in execution order
     * @param client sends the downstream requests
     * @param successText reply text once every step completed
     * @param failurePrefix prepended to the failure description when a step fails
     */
    public CoordinatorAgentExecutor(List<WorkflowStep> steps, DownstreamAgentClient client,
                                    String successText, String failurePrefix) {
        Assert.checkNotNullParam("steps", steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A workflow needs at least one step");
        }
        Set<String> keys = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!keys.add(step.resultKey())) {
                throw new IllegalArgumentException("Duplicate result key: " + step.resultKey());
            }
        }
        this.steps = List.copyOf(steps);
        this.client = Assert.checkNotNullParam("client", client);
        this.successText = Assert.checkNotNullParam("successText", successText);
        this.failurePrefix = Assert.checkNotNullParam("failurePrefix", failurePrefix);
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    @Override
    public Message execute(RequestContext context) throws AgentExecutionException {
        String input = context.getUserInput();
        List<String> performed = new ArrayList<>();
        Map<String, Object> results = new LinkedHashMap<>();

        for (WorkflowStep step : steps) {
            performed.add(step.description());
            LOGGER.info("Task {}: {}", context.getTaskId(), step.description());
            Task downstream = call(step, context, input, performed, results);
            results.put(step.resultKey(), OBJECT_MAPPER.convertValue(downstream, MAP_TYPE));
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(WORKFLOW_STEPS, List.copyOf(performed));
        data.putAll(results);
        data.put(STATUS, TaskState.COMPLETED.asString());
        LOGGER.debug("Task {}: workflow of {} steps completed", context.getTaskId(), steps.size());
        return MessageUtils.reply(context, successText, data);
    }

    private Task call(WorkflowStep step, RequestContext context, String input,
                      List<String> performed, Map<String, Object> results) throws AgentExecutionException {
        Message outbound = Message.builder()
                .role(Message.Role.USER)
                .parts(new TextPart(step.prompt(input)))
                .contextId(context.getContextId())
                .build();

        CompletableFuture<Task> future;
        try {
            future = client.send(step.agentUrl(), outbound);
        } catch (RuntimeException e) {
            throw stepFailed(step, describe(e), e, performed, results);
        }

        Task downstream;
        try {
            downstream = future.get(step.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw stepFailed(step, "no answer from " + step.agentUrl() + " within "
                    + step.timeout().toMillis() + " ms", e, performed, results);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw stepFailed(step, describe(cause), cause, performed, results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw stepFailed(step, "interrupted while waiting for " + step.agentUrl(), e, performed, results);
        }

        TaskState state = downstream.status().state();
        if (state.isFinal() && state != TaskState.COMPLETED) {
            StringBuilder reason = new StringBuilder("downstream task ")
                    .append(downstream.id()).append(" ended in state ").append(state.asString());
            Message statusMessage = downstream.status().message();
            if (statusMessage != null) {
                List<String> texts = MessageUtils.getTextParts(statusMessage.parts());
                if (!texts.isEmpty()) {
                    reason.append(": ").append(String.join(" ", texts));
                }
            }
            throw stepFailed(step, reason.toString(), null, performed, results);
        }
        return downstream;
    }

    private AgentExecutionException stepFailed(WorkflowStep step, String reason, @Nullable Throwable cause,
                                               List<String> performed, Map<String, Object> results) {
        LOGGER.warn("Workflow step {} failed after {} of {} steps: {}", step.name(), performed.size(), steps.size(), reason);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(WORKFLOW_STEPS, List.copyOf(performed));
        details.putAll(results);
        details.put(FAILED_STEP, step.description());
        details.put(ERROR, reason);
        details.put(STATUS, TaskState.FAILED.asString());

        String text = failurePrefix + step.name() + " step failed: " + reason;
        return cause == null
                ? new AgentExecutionException(text, details)
                : new AgentExecutionException(text, details, cause);
    }

    private static String describe(Throwable failure) {
        if (failure instanceof A2AClientException clientException && clientException.getError() != null) {
            A2AError error = clientException.getError();
            return "agent answered with error " + error.getCode() + ": " + error.getMessage();
        }
        if (failure instanceof A2AError error) {
            return "agent answered with error " + error.getCode() + ": " + error.getMessage();
        }
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }
}
