package io.carelink.a2a.examples.hospital;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Patient(@JsonProperty("id") String id,
                      @JsonProperty("name") String name,
                      @JsonProperty("email") String email,
                      @JsonProperty("phone") String phone,
                      @JsonProperty("medical_record_number") String medicalRecordNumber) {
}
