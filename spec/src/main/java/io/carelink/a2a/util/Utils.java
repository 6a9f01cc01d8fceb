package io.carelink.a2a.util;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * JSON helpers and the process-wide {@link ObjectMapper}.
 */
public final class Utils {

    /**
     * Mapper used for every envelope, card and task on the wire. Dates are written as
     * ISO-8601 strings and unknown properties are ignored so newer peers stay readable.
     */
    public static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.USE_BASE_TYPE_AS_DEFAULT_IMPL)
            .build();

    private Utils() {
    }

    /**
     * Deserializes JSON into the type described by the reference.
     *
     * @param data the JSON text
     * @param typeRef the target type
     * @param <T> the target type
     * @return the decoded value
     * @throws JsonProcessingException if the text is not valid JSON for the target type
     */
    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    /**
     * Serializes a value, rethrowing mapping problems unchecked. Only use this for types
     * owned by this project, which always serialize.
     *
     * @param value the value
     * @return the JSON text
     */
    public static String toJsonString(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }

    /**
     * Returns a copy of the task whose history has the message appended.
     *
     * @param task the task
     * @param message the message to append
     * @return the new history
     */
    public static List<Message> appendToHistory(Task task, Message message) {
        List<Message> history = new ArrayList<>(task.history());
        history.add(message);
        return history;
    }
}
