package io.carelink.a2a.examples.hospital;

import static io.carelink.a2a.server.util.MessageUtils.reply;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.Message;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Patient registry for protected health information. Stored identifying fields are masked
 * and every access is written to an audit trail.
 * <p>
 * The masking is reversible and only stands in for real encryption; it must not be used for
 * actual patient data.
 */
public class SecurePatientAgentExecutor implements AgentExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecurePatientAgentExecutor.class);

    static final String MASK_PREFIX = "encrypted_";

    private static final Pattern PATIENT_ID =
            Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
    private static final List<String> FIELDS = List.of("name", "ssn", "dob");

    private final Clock clock;
    private final Map<String, Map<String, String>> records = new ConcurrentHashMap<>();
    private final List<AuditEntry> auditLog = new ArrayList<>();

    public SecurePatientAgentExecutor() {
        this(Clock.systemUTC());
    }

    public SecurePatientAgentExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Message execute(RequestContext context) {
        audit("data_access", "unknown", context.getContextId());

        String input = context.getUserInput();
        String lower = input.toLowerCase(Locale.ROOT);
        if (lower.contains("register")) {
            return register(context, input);
        }
        if (lower.contains("verify") || lower.contains("lookup")) {
            return verify(context, input);
        }
        return reply(context, "Secure HIPAA-compliant patient services available.");
    }

    private Message register(RequestContext context, String input) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String line : input.split("\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            if (FIELDS.contains(key) && !value.isEmpty()) {
                fields.put(key, value);
            }
        }
        if (!fields.containsKey("name")) {
            return reply(context, "Please provide at least the patient name for secure registration.");
        }

        String patientId = UUID.randomUUID().toString();
        Map<String, String> record = new LinkedHashMap<>();
        record.put("id", patientId);
        for (Map.Entry<String, String> field : fields.entrySet()) {
            record.put(field.getKey() + "_encrypted", mask(field.getValue()));
        }
        record.put("created_at", clock.instant().toString());
        records.put(patientId, Map.copyOf(record));
        audit("patient_registration", patientId, context.getContextId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patient_id", patientId);
        data.put("registration_status", "completed_secure");
        data.put("compliance_level", "HIPAA");
        data.put("audit_logged", true);
        return reply(context, "Patient registered securely with HIPAA compliance.", data);
    }

    private Message verify(RequestContext context, String input) {
        Matcher id = PATIENT_ID.matcher(input.toLowerCase(Locale.ROOT));
        Map<String, String> record = id.find() ? records.get(id.group()) : null;
        if (record == null) {
            return reply(context, "Patient not found in secure records.");
        }
        audit("identity_verification", record.get("id"), context.getContextId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patient_id", record.get("id"));
        data.put("name", unmask(record.get("name_encrypted")));
        data.put("verified", true);
        return reply(context, "Patient identity verified.", data);
    }

    private void audit(String action, String patientId, String userContext) {
        AuditEntry entry = new AuditEntry(clock.instant(), action, patientId, userContext, UUID.randomUUID().toString());
        synchronized (auditLog) {
            auditLog.add(entry);
        }
        LOGGER.info("Audit {} patient={} context={}", action, patientId, userContext);
    }

    public List<AuditEntry> getAuditLog() {
        synchronized (auditLog) {
            return List.copyOf(auditLog);
        }
    }

    @Nullable Map<String, String> getRecord(String patientId) {
        return records.get(patientId);
    }

    static String mask(String value) {
        return MASK_PREFIX + new StringBuilder(value).reverse();
    }

    static @Nullable String unmask(@Nullable String masked) {
        if (masked == null || !masked.startsWith(MASK_PREFIX)) {
            return masked;
        }
        return new StringBuilder(masked.substring(MASK_PREFIX.length())).reverse().toString();
    }
}
