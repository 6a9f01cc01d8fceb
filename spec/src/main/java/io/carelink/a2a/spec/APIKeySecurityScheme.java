package io.carelink.a2a.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.carelink.a2a.util.Assert;

/**
 * An API key passed in a header, query parameter or cookie.
 *
 * @param in where the key is carried ({@code header}, {@code query} or {@code cookie})
 * @param name the name of the header, parameter or cookie
 */
@JsonTypeName(APIKeySecurityScheme.API_KEY)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record APIKeySecurityScheme(@JsonProperty("in") String in,
                                   @JsonProperty("name") String name) implements SecurityScheme {

    public static final String API_KEY = "apiKey";

    @JsonCreator
    public APIKeySecurityScheme {
        Assert.checkNotNullParam("in", in);
        Assert.checkNotNullParam("name", name);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return API_KEY;
    }
}
