package io.carelink.a2a.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/**
 * Base type for content parts within a {@link Message}.
 * <p>
 * A Part is either a {@link TextPart} (human readable text) or a {@link DataPart}
 * (structured JSON data). The concrete type is selected on the wire by the {@code kind}
 * discriminator. Parts are immutable and may carry opaque metadata.
 *
 * @param <T> the type of content contained in this part
 * @see Message
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "kind",
        visible = true
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextPart.class, name = TextPart.TEXT),
        @JsonSubTypes.Type(value = DataPart.class, name = DataPart.DATA)
})
public sealed interface Part<T> permits DataPart, TextPart {

    /**
     * The different types of content parts.
     */
    enum Kind {
        /**
         * Plain text content part.
         */
        TEXT(TextPart.TEXT),

        /**
         * Structured data content part.
         */
        DATA(DataPart.DATA);

        private final String kind;

        Kind(String kind) {
            this.kind = kind;
        }

        /**
         * Returns the string representation of the kind for JSON serialization.
         *
         * @return the kind as a string
         */
        @JsonValue
        public String asString() {
            return this.kind;
        }
    }

    /**
     * Returns the kind of this part.
     *
     * @return the Part.Kind indicating the content type
     */
    @JsonProperty("kind")
    Kind kind();

    /**
     * Returns optional metadata associated with this part.
     *
     * @return map of metadata key-value pairs, or null if no metadata
     */
    @Nullable Map<String, Object> metadata();
}
