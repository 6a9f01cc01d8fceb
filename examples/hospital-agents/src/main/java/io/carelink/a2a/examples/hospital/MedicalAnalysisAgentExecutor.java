package io.carelink.a2a.examples.hospital;

import static io.carelink.a2a.server.util.MessageUtils.reply;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.Message;

/**
 * Final step of the streaming analysis. The progress stages are reported by the streaming
 * layer before this executor runs; it only produces the closing summary.
 */
public class MedicalAnalysisAgentExecutor implements AgentExecutor {

    public static final List<String> STAGES = List.of(
            "Analyzing patient demographics...",
            "Processing medical history...",
            "Evaluating diagnostic patterns...",
            "Generating risk assessment...",
            "Finalizing recommendations...");

    @Override
    public Message execute(RequestContext context) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("analysis_steps", STAGES);
        data.put("subject", context.getUserInput());
        data.put("status", "completed");
        return reply(context, "Medical analysis completed.", data);
    }
}
