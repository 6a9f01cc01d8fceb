package io.carelink.a2a.jsonrpc.common.json;

import static io.carelink.a2a.util.Utils.OBJECT_MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.carelink.a2a.jsonrpc.common.wrappers.A2ARequest;
import io.carelink.a2a.jsonrpc.common.wrappers.A2AResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.JSONRPCMessage;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageRequest;
import io.carelink.a2a.spec.MessageSendParams;
import io.carelink.a2a.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoding of request envelopes and encoding of response envelopes.
 * <p>
 * Decoding is split in two so that callers can look at the request id before deciding
 * whether to bind the rest of the envelope:
 * <pre>{@code
 * JsonNode tree = JSONRPCUtils.readTree(body);
 * Object id = JSONRPCUtils.peekId(tree);
 * // run request interceptors here
 * A2ARequest<?> request = JSONRPCUtils.parseRequest(tree);
 * }</pre>
 * All decoding failures are {@link JsonMappingException}s carrying the id that could be read.
 */
public final class JSONRPCUtils {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCUtils.class);

    private JSONRPCUtils() {
    }

    /**
     * Decodes a complete request body in one go.
     *
     * @param body the request body
     * @return the request
     * @throws JsonMappingException if the body is not a request this agent understands
     */
    public static A2ARequest<?> parseRequestBody(String body) {
        return parseRequest(readTree(body));
    }

    /**
     * Parses the body into a JSON object.
     *
     * @param body the request body
     * @return the parsed object
     * @throws JsonMappingException if the body is not JSON or not a JSON object
     */
    public static JsonNode readTree(String body) {
        JsonNode tree;
        try {
            tree = OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new JsonMappingException("Invalid JSON payload", null, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new JsonMappingException("Request must be a JSON object", null);
        }
        return tree;
    }

    /**
     * Reads the request id, if there is a usable one. Only strings and numbers are ids.
     *
     * @param tree the parsed request
     * @return the id as a {@link String} or {@link Number}, or {@code null}
     */
    public static @Nullable Object peekId(JsonNode tree) {
        JsonNode id = tree.get("id");
        if (id == null) {
            return null;
        }
        if (id.isTextual()) {
            return id.asText();
        }
        if (id.isNumber()) {
            return id.numberValue();
        }
        return null;
    }

    /**
     * Binds a parsed request to its envelope type.
     *
     * @param tree the parsed request, see {@link #readTree(String)}
     * @return the request
     * @throws MethodNotFoundJsonMappingException if the method is not offered
     * @throws InvalidParamsJsonMappingException if the params do not fit the method
     * @throws JsonMappingException if the id or method is missing or malformed
     */
    public static A2ARequest<?> parseRequest(JsonNode tree) {
        Object id = peekId(tree);
        if (id == null) {
            throw new JsonMappingException("Request 'id' must be a string or a number", null);
        }
        JsonNode methodNode = tree.get("method");
        if (methodNode == null || !methodNode.isTextual() || methodNode.asText().isBlank()) {
            throw new JsonMappingException("Request 'method' is missing", id);
        }
        String method = methodNode.asText();
        String jsonrpc = tree.hasNonNull("jsonrpc") ? tree.get("jsonrpc").asText() : null;
        if (jsonrpc != null && !JSONRPCMessage.JSONRPC_VERSION.equals(jsonrpc)) {
            throw new JsonMappingException("Unsupported JSON-RPC version '" + jsonrpc + "'", id);
        }

        switch (method) {
            case SendMessageRequest.METHOD:
                return new SendMessageRequest(jsonrpc, id, bindParams(tree, id));
            case SendStreamingMessageRequest.METHOD:
                return new SendStreamingMessageRequest(jsonrpc, id, bindParams(tree, id));
            default:
                LOGGER.debug("Rejecting request {} for unsupported method {}", id, method);
                throw new MethodNotFoundJsonMappingException(method, id);
        }
    }

    private static MessageSendParams bindParams(JsonNode tree, Object id) {
        JsonNode params = tree.get("params");
        if (params == null || !params.isObject()) {
            throw new JsonMappingException("Request 'params' must be an object", id);
        }
        try {
            return OBJECT_MAPPER.treeToValue(params, MessageSendParams.class);
        } catch (JsonProcessingException e) {
            throw new InvalidParamsJsonMappingException("Invalid params: " + e.getOriginalMessage(), id, e);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsJsonMappingException("Invalid params: " + e.getMessage(), id, e);
        }
    }

    /**
     * Encodes a response envelope.
     *
     * @param response the response
     * @return the JSON text
     */
    public static String toJson(A2AResponse<?> response) {
        return Utils.toJsonString(response);
    }

    /**
     * Formats a response as one server-sent event frame: {@code id: <n>\ndata: <json>\n\n}.
     *
     * @param response the response
     * @param eventId the event id
     * @return the frame
     */
    public static String formatAsSse(A2AResponse<?> response, long eventId) {
        return "id: " + eventId + "\ndata: " + toJson(response) + "\n\n";
    }
}
