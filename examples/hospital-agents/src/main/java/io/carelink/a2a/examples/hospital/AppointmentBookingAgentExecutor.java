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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Books, lists and cancels appointments. Bookings are not checked against the doctor roster;
 * the patient reference and department are taken from the request text when it names them.
 */
public class AppointmentBookingAgentExecutor implements AgentExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppointmentBookingAgentExecutor.class);

    private static final Pattern APPOINTMENT_ID = Pattern.compile("\\bAPT\\d{6}\\b");
    private static final Pattern PATIENT_REFERENCE = Pattern.compile("\\bMR\\d+\\b|[^\\s@]+@[^\\s@]+");
    private static final Map<String, String> DEPARTMENTS = Map.of(
            "cardiology", "Cardiology",
            "dermatology", "Dermatology",
            "pediatrics", "Pediatrics",
            "orthopedics", "Orthopedics",
            "emergency", "Emergency Medicine");
    private static final String DEFAULT_DEPARTMENT = "General Medicine";
    private static final LocalTime DEFAULT_SLOT = LocalTime.of(10, 0);

    private final Clock clock;
    private final Map<String, Appointment> appointments = new LinkedHashMap<>();

    public AppointmentBookingAgentExecutor() {
        this(Clock.systemDefaultZone());
    }

    public AppointmentBookingAgentExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Message execute(RequestContext context) {
        String input = context.getUserInput();
        String lower = input.toLowerCase(Locale.ROOT);
        if (lower.contains("book") || lower.contains("schedule")) {
            return book(context, input, lower);
        }
        if (lower.contains("view") || lower.contains("list")) {
            return list(context);
        }
        if (lower.contains("cancel")) {
            return cancel(context, input);
        }
        return reply(context,
                "I can help you book appointments, view existing appointments, or cancel appointments. What would you like to do?");
    }

    private Message book(RequestContext context, String input, String lower) {
        Matcher patient = PATIENT_REFERENCE.matcher(input);
        String department = DEFAULT_DEPARTMENT;
        for (Map.Entry<String, String> entry : DEPARTMENTS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                department = entry.getValue();
                break;
            }
        }
        String slot = LocalDate.now(clock).plusDays(1).atTime(DEFAULT_SLOT).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);

        Appointment appointment;
        synchronized (appointments) {
            String id = String.format("APT%06d", appointments.size() + 1);
            appointment = new Appointment(id, patient.find() ? patient.group() : "unregistered",
                    "unassigned", slot, department, Appointment.SCHEDULED, input);
            appointments.put(id, appointment);
        }
        LOGGER.info("Booked appointment {} in {}", appointment.id(), department);
        return reply(context, "Appointment booked successfully!", HospitalData.toMap(appointment));
    }

    private Message list(RequestContext context) {
        List<Map<String, Object>> listed = new ArrayList<>();
        synchronized (appointments) {
            for (Appointment appointment : appointments.values()) {
                listed.add(HospitalData.toMap(appointment));
            }
        }
        return reply(context, "Found " + listed.size() + " appointments:", Map.of("appointments", listed));
    }

    private Message cancel(RequestContext context, String input) {
        Matcher id = APPOINTMENT_ID.matcher(input);
        if (id.find()) {
            synchronized (appointments) {
                Appointment appointment = appointments.get(id.group());
                if (appointment != null) {
                    appointments.put(appointment.id(), appointment.cancel());
                    LOGGER.info("Cancelled appointment {}", appointment.id());
                    return reply(context, "Appointment " + appointment.id() + " has been cancelled.");
                }
            }
        }
        return reply(context, "Please provide a valid appointment ID to cancel.");
    }
}
