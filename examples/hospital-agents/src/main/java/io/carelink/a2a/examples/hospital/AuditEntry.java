package io.carelink.a2a.examples.hospital;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One access to protected patient data.
 *
 * @param timestamp when the access happened
 * @param action what was done, such as {@code patient_registration}
 * @param patientId the patient concerned, {@code unknown} before the request was interpreted
 * @param userContext the conversation the access belongs to
 * @param sessionId unique id of the entry
 */
public record AuditEntry(@JsonProperty("timestamp") Instant timestamp,
                         @JsonProperty("action") String action,
                         @JsonProperty("patient_id") String patientId,
                         @JsonProperty("user_context") String userContext,
                         @JsonProperty("session_id") String sessionId) {
}
