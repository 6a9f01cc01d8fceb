package io.carelink.a2a.spec;

import static io.carelink.a2a.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

public class TaskDeserializationTest {

    @Test
    void testTaskWithMissingHistoryAndArtifacts() throws Exception {
        // Remote agents commonly omit both arrays
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "completed"
                },
                "kind": "task"
            }
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertNotNull(task.history(), "history should not be null");
        assertNotNull(task.artifacts(), "artifacts should not be null");
        assertTrue(task.history().isEmpty());
        assertTrue(task.artifacts().isEmpty());
        assertNotNull(task.status().timestamp(), "timestamp should default when absent");
    }

    @Test
    void testTaskWithExplicitNullValues() throws Exception {
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "failed"
                },
                "history": null,
                "artifacts": null,
                "kind": "task"
            }
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertTrue(task.history().isEmpty());
        assertTrue(task.artifacts().isEmpty());
        assertEquals(TaskState.FAILED, task.status().state());
    }

    @Test
    void testTaskWithPopulatedHistoryAndStatusMessage() throws Exception {
        String json = """
            {
                "id": "task-123",
                "contextId": "context-456",
                "status": {
                    "state": "completed",
                    "timestamp": "2024-01-15T10:00:00Z",
                    "message": {
                        "role": "agent",
                        "parts": [
                            {"kind": "text", "text": "Patient found!"},
                            {"kind": "data", "data": {"patient_id": "MR000001", "name": "Jane Doe"}}
                        ],
                        "messageId": "msg-2",
                        "kind": "message"
                    }
                },
                "history": [
                    {
                        "role": "user",
                        "parts": [{"kind": "text", "text": "lookup patient jane@example.com"}],
                        "messageId": "msg-1",
                        "kind": "message"
                    }
                ],
                "kind": "task"
            }
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertEquals(1, task.history().size());
        assertEquals(Message.Role.USER, task.history().get(0).role());
        Message reply = task.status().message();
        assertNotNull(reply);
        assertEquals(Message.Role.AGENT, reply.role());
        assertInstanceOf(TextPart.class, reply.parts().get(0));
        DataPart data = assertInstanceOf(DataPart.class, reply.parts().get(1));
        assertEquals("MR000001", data.data().get("patient_id"));
    }

    @Test
    void testUnknownStateMapsToUnknown() throws Exception {
        String json = """
            {"id": "t", "contextId": "c", "status": {"state": "paused"}, "kind": "task"}
            """;

        Task task = OBJECT_MAPPER.readValue(json, Task.class);

        assertEquals(TaskState.UNKNOWN, task.status().state());
        assertTrue(task.status().state().isFinal());
    }

    @Test
    void testMessageWithoutPartsIsRejected() {
        String json = """
            {"role": "user", "parts": [], "messageId": "m-1", "kind": "message"}
            """;

        assertThrows(JsonProcessingException.class, () -> OBJECT_MAPPER.readValue(json, Message.class));
    }

    @Test
    void testStreamingEventKindSelectsConcreteType() throws Exception {
        String json = """
            {
                "taskId": "task-1",
                "contextId": "ctx-1",
                "status": {"state": "working"},
                "final": false,
                "kind": "status-update"
            }
            """;

        StreamingEventKind event = OBJECT_MAPPER.readValue(json, StreamingEventKind.class);

        TaskStatusUpdateEvent update = assertInstanceOf(TaskStatusUpdateEvent.class, event);
        assertEquals("task-1", update.taskId());
        assertEquals(TaskState.WORKING, update.status().state());
        assertEquals(false, update.isFinal());
    }
}
