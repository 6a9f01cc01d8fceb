package io.carelink.a2a.server.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Map;

import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.DataPart;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Part;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.spec.TaskState;
import io.carelink.a2a.spec.TaskStatus;
import io.carelink.a2a.spec.TextPart;
import org.junit.jupiter.api.Test;

class MessageUtilsTest {

    @Test
    void testReplyIsBoundToTask() {
        // Given
        Message inbound = Message.builder()
                .role(Message.Role.USER)
                .parts(new TextPart("book appointment: Dr. Smith"))
                .build();
        Task task = Task.builder()
                .id("task-1")
                .contextId("ctx-1")
                .status(new TaskStatus(TaskState.WORKING))
                .history(List.of(inbound))
                .build();
        RequestContext context = new RequestContext(inbound, task, ServerCallContext.empty());

        // When
        Message reply = MessageUtils.reply(context, "Appointment booked successfully!", Map.of("appointment_id", "APT000001"));

        // Then
        assertEquals(Message.Role.AGENT, reply.role());
        assertEquals("task-1", reply.taskId());
        assertEquals("ctx-1", reply.contextId());
        assertEquals("Appointment booked successfully!", ((TextPart) reply.parts().get(0)).text());
        assertEquals(Map.of("appointment_id", "APT000001"), MessageUtils.getFirstData(reply));
    }

    @Test
    void testTextPartsSkipData() {
        // Given
        List<Part<?>> parts = List.of(new TextPart("first"), new DataPart(Map.of("k", "v")), new TextPart("second"));

        // When
        List<String> texts = MessageUtils.getTextParts(parts);

        // Then
        assertEquals(List.of("first", "second"), texts);
    }

    @Test
    void testNoDataPart() {
        Message message = MessageUtils.newAgentTextMessage("hello", null, null);

        assertNull(MessageUtils.getFirstData(message));
        assertNull(message.taskId());
    }
}
