package io.carelink.a2a.server.agentexecution;

import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.server.util.MessageUtils;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.util.Assert;

/**
 * What an {@link AgentExecutor} gets to see of a request.
 */
public class RequestContext {

    private final Message message;
    private final Task task;
    private final ServerCallContext callContext;

    public RequestContext(Message message, Task task, ServerCallContext callContext) {
        this.message = Assert.checkNotNullParam("message", message);
        this.task = Assert.checkNotNullParam("task", task);
        this.callContext = Assert.checkNotNullParam("callContext", callContext);
    }

    public Message getMessage() {
        return message;
    }

    public Task getTask() {
        return task;
    }

    public String getTaskId() {
        return task.id();
    }

    public String getContextId() {
        return task.contextId();
    }

    public ServerCallContext getCallContext() {
        return callContext;
    }

    /**
     * Returns the text parts of the inbound message joined by new lines.
     *
     * @return the text, empty if the message has no text parts
     */
    public String getUserInput() {
        return getUserInput("\n");
    }

    public String getUserInput(String delimiter) {
        return String.join(delimiter, MessageUtils.getTextParts(message.parts()));
    }
}
