package io.carelink.a2a.server.requesthandlers;

import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.server.agentexecution.AgentExecutionException;
import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.server.streaming.StagedStatusPublisher;
import io.carelink.a2a.server.streaming.StreamingStages;
import io.carelink.a2a.server.tasks.TaskManager;
import io.carelink.a2a.server.tasks.TaskStore;
import io.carelink.a2a.spec.InternalError;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.MessageSendParams;
import io.carelink.a2a.spec.MethodNotFoundError;
import io.carelink.a2a.spec.StreamingEventKind;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds one {@link AgentExecutor} to a task store. Every request gets its own task; the
 * executor's reply completes it and any failure of the executor fails it. On
 * {@code message/send} the task goes straight from {@code submitted} to its terminal state.
 */
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    private final AgentExecutor agentExecutor;
    private final TaskManager taskManager;
    private final Executor executor;
    @Nullable
    private final StreamingStages streamingStages;

    public DefaultRequestHandler(AgentExecutor agentExecutor, TaskStore taskStore, Executor executor) {
        this(agentExecutor, taskStore, executor, null);
    }

    /**
     * @param agentExecutor the agent
     * @param taskStore where tasks are kept
     * @param executor runs streamed requests
     * @param streamingStages the stages reported by {@code message/stream}, or {@code null} if the
     *                        agent does not stream
     */
    public DefaultRequestHandler(AgentExecutor agentExecutor, TaskStore taskStore, Executor executor,
                                 @Nullable StreamingStages streamingStages) {
        this.agentExecutor = Assert.checkNotNullParam("agentExecutor", agentExecutor);
        this.taskManager = new TaskManager(Assert.checkNotNullParam("taskStore", taskStore));
        this.executor = Assert.checkNotNullParam("executor", executor);
        this.streamingStages = streamingStages;
    }

    @Override
    public Task onMessageSend(MessageSendParams params, ServerCallContext context) {
        LOGGER.debug("onMessageSend - messageId {}", params.message().messageId());
        Task task = taskManager.createTask(params.message());
        return runAgent(task, context);
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onMessageSendStream(MessageSendParams params, ServerCallContext context) {
        if (streamingStages == null) {
            throw new MethodNotFoundError();
        }
        LOGGER.debug("onMessageSendStream - messageId {}", params.message().messageId());
        return new StagedStatusPublisher(taskManager, streamingStages, params.message(),
                task -> runAgent(task, context), executor);
    }

    public boolean isStreaming() {
        return streamingStages != null;
    }

    private Task runAgent(Task task, ServerCallContext context) {
        Message inbound = task.history().get(0);
        try {
            Message reply = agentExecutor.execute(new RequestContext(inbound, task, context));
            return taskManager.completeTask(task, reply);
        } catch (AgentExecutionException e) {
            LOGGER.warn("Agent failed task {}: {}", task.id(), e.getMessage(), e);
            return taskManager.failTask(task, failureText(e), e.getDetails());
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error while executing task {}", task.id(), e);
            return taskManager.failTask(task, InternalError.MESSAGE_PREFIX + e.getMessage());
        }
    }

    private static String failureText(AgentExecutionException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
