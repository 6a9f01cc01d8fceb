package io.carelink.a2a.server.card;

import io.carelink.a2a.spec.AgentCard;
import io.carelink.a2a.util.Assert;

/**
 * Builds the {@link AgentCard} an agent publishes. The card depends on the identity only,
 * so it can be built once at startup and served for the lifetime of the process.
 */
public final class AgentCardFactory {

    private AgentCardFactory() {
    }

    public static AgentCard create(AgentIdentity identity) {
        Assert.checkNotNullParam("identity", identity);
        return AgentCard.builder()
                .name(identity.name())
                .description(identity.description())
                .url(identity.url())
                .version(identity.version())
                .defaultInputModes(identity.defaultInputModes())
                .defaultOutputModes(identity.defaultOutputModes())
                .capabilities(identity.capabilities())
                .skills(identity.skills())
                .documentationUrl(identity.documentationUrl())
                .securitySchemes(identity.securitySchemes())
                .security(identity.security())
                .build();
    }
}
