package io.carelink.a2a.jsonrpc.common.json;

import static io.carelink.a2a.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import io.carelink.a2a.jsonrpc.common.wrappers.A2AErrorResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.A2ARequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageRequest;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.MethodNotFoundError;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.spec.TaskState;
import io.carelink.a2a.spec.TaskStatus;
import io.carelink.a2a.spec.TextPart;
import org.junit.jupiter.api.Test;

public class JSONRPCUtilsTest {

    private static final String SEND_MESSAGE = """
            {
              "jsonrpc": "2.0",
              "id": "req-42",
              "method": "message/send",
              "params": {
                "message": {
                  "role": "user",
                  "parts": [{"kind": "text", "text": "find doctors for cardiology"}],
                  "messageId": "msg-1",
                  "kind": "message"
                }
              }
            }
            """;

    @Test
    public void testParseSendMessage() {
        A2ARequest<?> request = JSONRPCUtils.parseRequestBody(SEND_MESSAGE);

        SendMessageRequest send = assertInstanceOf(SendMessageRequest.class, request);
        assertEquals("req-42", send.getId());
        assertEquals("2.0", send.getJsonrpc());
        TextPart part = assertInstanceOf(TextPart.class, send.getParams().message().parts().get(0));
        assertEquals("find doctors for cardiology", part.text());
    }

    @Test
    public void testParseStreamingWithNumericId() {
        A2ARequest<?> request = JSONRPCUtils.parseRequestBody(SEND_MESSAGE
                .replace("\"req-42\"", "7")
                .replace("message/send", "message/stream"));

        assertInstanceOf(SendStreamingMessageRequest.class, request);
        assertEquals(7, ((Number) request.getId()).intValue());
    }

    @Test
    public void testUnknownMethodKeepsId() {
        MethodNotFoundJsonMappingException e = assertThrows(MethodNotFoundJsonMappingException.class,
                () -> JSONRPCUtils.parseRequestBody(SEND_MESSAGE.replace("message/send", "message/delete")));

        assertEquals("req-42", e.getId());
        assertEquals("message/delete", e.getMethod());
        assertEquals(-32601, e.toError().getCode());
    }

    @Test
    public void testMalformedJsonHasNoId() {
        JsonMappingException e = assertThrows(JsonMappingException.class, () -> JSONRPCUtils.parseRequestBody("{not json"));

        assertNull(e.getId());
        A2AError error = e.toError();
        assertEquals(-32603, error.getCode());
        assertTrue(error.getMessage().startsWith("Internal error: "));
    }

    @Test
    public void testMissingIdOrMethodIsInternalError() {
        JsonMappingException noId = assertThrows(JsonMappingException.class,
                () -> JSONRPCUtils.parseRequestBody("{\"jsonrpc\":\"2.0\",\"method\":\"message/send\",\"params\":{}}"));
        JsonMappingException noMethod = assertThrows(JsonMappingException.class,
                () -> JSONRPCUtils.parseRequestBody("{\"jsonrpc\":\"2.0\",\"id\":3,\"params\":{}}"));
        JsonMappingException objectId = assertThrows(JsonMappingException.class,
                () -> JSONRPCUtils.parseRequestBody("{\"id\":{\"a\":1},\"method\":\"message/send\",\"params\":{}}"));

        assertEquals(-32603, noId.toError().getCode());
        assertNull(noId.getId());
        assertEquals(-32603, noMethod.toError().getCode());
        assertEquals(3, ((Number) noMethod.getId()).intValue());
        assertNull(objectId.getId());
    }

    @Test
    public void testInvalidParamsIsInternalError() {
        String emptyParts = SEND_MESSAGE.replace("[{\"kind\": \"text\", \"text\": \"find doctors for cardiology\"}]", "[]");

        InvalidParamsJsonMappingException e = assertThrows(InvalidParamsJsonMappingException.class,
                () -> JSONRPCUtils.parseRequestBody(emptyParts));

        assertEquals("req-42", e.getId());
        assertEquals(-32603, e.toError().getCode());
    }

    @Test
    public void testErrorResponseAlwaysWritesId() throws Exception {
        JsonNode node = OBJECT_MAPPER.readTree(JSONRPCUtils.toJson(new A2AErrorResponse(new MethodNotFoundError())));

        assertTrue(node.has("id"));
        assertTrue(node.get("id").isNull());
        assertEquals(-32601, node.get("error").get("code").asInt());
        assertTrue(!node.has("result"));
    }

    @Test
    public void testResponseRequiresExactlyOneOfResultAndError() {
        Task task = Task.builder().id("t").contextId("c").status(new TaskStatus(TaskState.COMPLETED)).build();

        assertThrows(IllegalArgumentException.class, () -> new SendMessageResponse(null, "1", task, new MethodNotFoundError()));
        assertThrows(IllegalArgumentException.class, () -> new SendMessageResponse(null, "1", null, null));
    }

    @Test
    public void testSseFrame() {
        Task task = Task.builder().id("t").contextId("c").status(new TaskStatus(TaskState.WORKING)).build();

        String frame = JSONRPCUtils.formatAsSse(new SendMessageResponse("1", task), 4);

        assertTrue(frame.startsWith("id: 4\ndata: {"));
        assertTrue(frame.endsWith("}\n\n"));
        assertEquals(1, frame.split("\n\n", -1).length - 1);
    }
}
