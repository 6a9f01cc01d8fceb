package io.carelink.a2a.examples.hospital;

import static io.carelink.a2a.server.util.MessageUtils.reply;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.Message;

/**
 * Answers doctor searches by specialty and reports the next free slots of every doctor. The
 * roster is fixed; each doctor has six slots a day for the seven days after the agent started.
 */
public class DoctorAvailabilityAgentExecutor implements AgentExecutor {

    static final List<String> SPECIALTIES = List.of("cardiology", "dermatology", "pediatrics", "orthopedics", "emergency");

    private static final int DAYS = 7;
    private static final List<Integer> SLOT_HOURS = List.of(9, 10, 11, 14, 15, 16);
    private static final int NEXT_SLOTS = 3;

    private final List<Doctor> doctors;

    public DoctorAvailabilityAgentExecutor() {
        this(Clock.systemDefaultZone());
    }

    public DoctorAvailabilityAgentExecutor(Clock clock) {
        List<String> slots = slots(LocalDate.now(clock));
        this.doctors = List.of(
                doctor("Dr. Sarah Johnson", "Cardiology", "Heart Center", slots),
                doctor("Dr. Michael Chen", "Dermatology", "Skin Care", slots),
                doctor("Dr. Emily Rodriguez", "Pediatrics", "Children's Health", slots),
                doctor("Dr. David Smith", "Orthopedics", "Bone & Joint", slots),
                doctor("Dr. Lisa Wong", "Emergency Medicine", "Emergency Department", slots));
    }

    @Override
    public Message execute(RequestContext context) {
        String lower = context.getUserInput().toLowerCase(Locale.ROOT);
        if (lower.contains("find") || lower.contains("search")) {
            return search(context, lower);
        }
        if (lower.contains("availability") || lower.contains("available")) {
            return availability(context);
        }
        return reply(context, "I can help you search for doctors or check their availability. What would you like to do?");
    }

    private Message search(RequestContext context, String lower) {
        String specialty = null;
        for (String candidate : SPECIALTIES) {
            if (lower.contains(candidate)) {
                specialty = candidate;
                break;
            }
        }

        List<Map<String, Object>> matching = new ArrayList<>();
        for (Doctor doctor : doctors) {
            if (specialty == null || doctor.specialty().toLowerCase(Locale.ROOT).contains(specialty)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", doctor.id());
                entry.put("name", doctor.name());
                entry.put("specialty", doctor.specialty());
                entry.put("department", doctor.department());
                entry.put("available_slots_count", doctor.availableSlots().size());
                matching.add(entry);
            }
        }
        if (matching.isEmpty()) {
            return reply(context, "No doctors found matching your criteria.");
        }
        return reply(context, "Found " + matching.size() + " doctors matching your criteria:", Map.of("doctors", matching));
    }

    private Message availability(RequestContext context) {
        List<Map<String, Object>> availability = new ArrayList<>();
        for (Doctor doctor : doctors) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("doctor_id", doctor.id());
            entry.put("doctor_name", doctor.name());
            entry.put("specialty", doctor.specialty());
            entry.put("next_available_slots",
                    doctor.availableSlots().subList(0, Math.min(NEXT_SLOTS, doctor.availableSlots().size())));
            availability.add(entry);
        }
        return reply(context, "Here's the current availability:", Map.of("availability", availability));
    }

    List<Doctor> getDoctors() {
        return doctors;
    }

    private static Doctor doctor(String name, String specialty, String department, List<String> slots) {
        return new Doctor(UUID.randomUUID().toString(), name, specialty, department, slots);
    }

    private static List<String> slots(LocalDate today) {
        List<String> slots = new ArrayList<>();
        for (int day = 1; day <= DAYS; day++) {
            LocalDate date = today.plusDays(day);
            for (int hour : SLOT_HOURS) {
                slots.add(date.atTime(LocalTime.of(hour, 0)).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            }
        }
        return slots;
    }
}
