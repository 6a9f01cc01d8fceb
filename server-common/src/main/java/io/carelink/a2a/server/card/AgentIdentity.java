package io.carelink.a2a.server.card;

import java.util.List;
import java.util.Map;

import io.carelink.a2a.spec.AgentCapabilities;
import io.carelink.a2a.spec.AgentSkill;
import io.carelink.a2a.spec.SecurityScheme;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The static configuration an agent is described by. It is the only input of
 * {@link AgentCardFactory#create(AgentIdentity)}.
 */
public record AgentIdentity(String name,
                            String description,
                            String url,
                            String version,
                            List<AgentSkill> skills,
                            AgentCapabilities capabilities,
                            List<String> defaultInputModes,
                            List<String> defaultOutputModes,
                            @Nullable String documentationUrl,
                            @Nullable Map<String, SecurityScheme> securitySchemes,
                            @Nullable List<Map<String, List<String>>> security) {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final List<String> DEFAULT_MODES = List.of("application/json", "text/plain");

    public AgentIdentity {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotBlankParam("description", description);
        Assert.checkNotBlankParam("url", url);
        Assert.checkNotBlankParam("version", version);
        Assert.checkNotNullParam("skills", skills);
        Assert.checkNotNullParam("capabilities", capabilities);
        Assert.checkNotNullParam("defaultInputModes", defaultInputModes);
        Assert.checkNotNullParam("defaultOutputModes", defaultOutputModes);
        skills = List.copyOf(skills);
        defaultInputModes = List.copyOf(defaultInputModes);
        defaultOutputModes = List.copyOf(defaultOutputModes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable String name;
        private @Nullable String description;
        private @Nullable String url;
        private String version = DEFAULT_VERSION;
        private List<AgentSkill> skills = List.of();
        private AgentCapabilities capabilities = AgentCapabilities.builder().build();
        private List<String> defaultInputModes = DEFAULT_MODES;
        private List<String> defaultOutputModes = DEFAULT_MODES;
        private @Nullable String documentationUrl;
        private @Nullable Map<String, SecurityScheme> securitySchemes;
        private @Nullable List<Map<String, List<String>>> security;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder skills(List<AgentSkill> skills) {
            this.skills = skills;
            return this;
        }

        public Builder capabilities(AgentCapabilities capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder defaultInputModes(List<String> defaultInputModes) {
            this.defaultInputModes = defaultInputModes;
            return this;
        }

        public Builder defaultOutputModes(List<String> defaultOutputModes) {
            this.defaultOutputModes = defaultOutputModes;
            return this;
        }

        public Builder documentationUrl(@Nullable String documentationUrl) {
            this.documentationUrl = documentationUrl;
            return this;
        }

        public Builder securitySchemes(@Nullable Map<String, SecurityScheme> securitySchemes) {
            this.securitySchemes = securitySchemes;
            return this;
        }

        public Builder security(@Nullable List<Map<String, List<String>>> security) {
            this.security = security;
            return this;
        }

        /**
         * Builds the identity.
         *
         * @return the identity
         * @throws IllegalArgumentException if name, description or url is missing
         */
        public AgentIdentity build() {
            return new AgentIdentity(
                    Assert.checkNotBlankParam("name", name),
                    Assert.checkNotBlankParam("description", description),
                    Assert.checkNotBlankParam("url", url),
                    version,
                    skills,
                    capabilities,
                    defaultInputModes,
                    defaultOutputModes,
                    documentationUrl,
                    securitySchemes,
                    security);
        }
    }
}
