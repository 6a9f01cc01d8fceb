package io.carelink.a2a.server.streaming;

import java.time.Duration;
import java.util.List;

import io.carelink.a2a.util.Assert;

/**
 * The progress stages reported on a {@code message/stream} before the agent's reply.
 *
 * @param descriptions the text of each stage's progress message, in order
 * @param stageDelay the pause before each stage is reported
 */
public record StreamingStages(List<String> descriptions, Duration stageDelay) {

    public StreamingStages {
        Assert.checkNotNullParam("descriptions", descriptions);
        Assert.checkNotNullParam("stageDelay", stageDelay);
        if (stageDelay.isNegative()) {
            throw new IllegalArgumentException("stageDelay may not be negative");
        }
        descriptions = List.copyOf(descriptions);
    }

    /**
     * Stages for an agent that reports no progress and streams only its task snapshot and its
     * final status.
     *
     * @return the empty stages
     */
    public static StreamingStages none() {
        return new StreamingStages(List.of(), Duration.ZERO);
    }

    public int size() {
        return descriptions.size();
    }
}
