package io.carelink.a2a.examples.hospital;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Appointment(@JsonProperty("id") String id,
                          @JsonProperty("patient_id") String patientId,
                          @JsonProperty("doctor_id") String doctorId,
                          @JsonProperty("datetime_slot") String datetimeSlot,
                          @JsonProperty("department") String department,
                          @JsonProperty("status") String status,
                          @JsonProperty("notes") @Nullable String notes) {

    public static final String SCHEDULED = "scheduled";
    public static final String CANCELLED = "cancelled";

    public Appointment cancel() {
        return new Appointment(id, patientId, doctorId, datetimeSlot, department, CANCELLED, notes);
    }
}
