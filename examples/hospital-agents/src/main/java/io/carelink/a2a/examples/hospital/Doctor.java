package io.carelink.a2a.examples.hospital;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A doctor and the slots still free in their schedule, as ISO local date-times.
 */
public record Doctor(@JsonProperty("id") String id,
                     @JsonProperty("name") String name,
                     @JsonProperty("specialty") String specialty,
                     @JsonProperty("department") String department,
                     @JsonProperty("available_slots") List<String> availableSlots) {

    public Doctor {
        availableSlots = List.copyOf(availableSlots);
    }
}
