package io.carelink.a2a.examples.hospital;

import static io.carelink.a2a.examples.hospital.RequestContexts.data;
import static io.carelink.a2a.examples.hospital.RequestContexts.text;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import io.carelink.a2a.spec.Message;
import org.junit.jupiter.api.Test;

public class AppointmentBookingAgentExecutorTest {

    private final AppointmentBookingAgentExecutor executor =
            new AppointmentBookingAgentExecutor(Clock.fixed(Instant.parse("2024-01-14T08:00:00Z"), ZoneOffset.UTC));

    @Test
    public void testBookingUsesPatientAndDepartmentFromText() {
        Message reply = executor.execute(RequestContexts.of("book appointment: patient MR000001 with cardiology"));

        assertEquals("Appointment booked successfully!", text(reply));
        Map<String, Object> data = data(reply);
        assertEquals("APT000001", data.get("id"));
        assertEquals("MR000001", data.get("patient_id"));
        assertEquals("Cardiology", data.get("department"));
        assertEquals("2024-01-15T10:00:00", data.get("datetime_slot"));
        assertEquals("scheduled", data.get("status"));
    }

    @Test
    public void testBookingDefaults() {
        Map<String, Object> data = data(executor.execute(RequestContexts.of("schedule a checkup")));

        assertEquals("unregistered", data.get("patient_id"));
        assertEquals("General Medicine", data.get("department"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testCancelAndList() {
        executor.execute(RequestContexts.of("book appointment for john@email.com"));
        executor.execute(RequestContexts.of("book appointment for jane@email.com"));

        assertEquals("Appointment APT000002 has been cancelled.",
                text(executor.execute(RequestContexts.of("cancel APT000002"))));
        assertEquals("Please provide a valid appointment ID to cancel.",
                text(executor.execute(RequestContexts.of("cancel APT000042"))));

        Message listed = executor.execute(RequestContexts.of("list appointments"));
        assertEquals("Found 2 appointments:", text(listed));
        List<Map<String, Object>> appointments = (List<Map<String, Object>>) data(listed).get("appointments");
        assertEquals("scheduled", appointments.get(0).get("status"));
        assertEquals("cancelled", appointments.get(1).get("status"));
        assertEquals("jane@email.com", appointments.get(1).get("patient_id"));
    }
}
