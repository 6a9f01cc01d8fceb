package io.carelink.a2a.examples.hospital;

import static io.carelink.a2a.server.util.MessageUtils.reply;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers patients and looks them up by email address or medical record number.
 * <p>
 * Registration expects one field per line:
 * <pre>
 * register patient
 * name: John Doe
 * email: john@email.com
 * phone: 123-456-7890
 * </pre>
 */
public class PatientRegistrationAgentExecutor implements AgentExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatientRegistrationAgentExecutor.class);

    private static final Pattern EMAIL = Pattern.compile("[^\\s@]+@[^\\s@]+");
    private static final Pattern MEDICAL_RECORD_NUMBER = Pattern.compile("\\bMR\\d+\\b");

    private final Map<String, Patient> patients = new ConcurrentHashMap<>();
    private final Map<String, String> patientIdByEmail = new ConcurrentHashMap<>();
    private final Map<String, String> patientIdByMrn = new ConcurrentHashMap<>();

    @Override
    public Message execute(RequestContext context) {
        String input = context.getUserInput();
        String lower = input.toLowerCase(Locale.ROOT);
        if (lower.contains("register")) {
            return register(context, input);
        }
        if (lower.contains("lookup") || lower.contains("find")) {
            return lookup(context, input);
        }
        return reply(context, "I can help you with patient registration and lookup. Please specify what you'd like to do.");
    }

    private Message register(RequestContext context, String input) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String line : input.split("\n")) {
            String lower = line.toLowerCase(Locale.ROOT);
            for (String field : new String[] {"name", "email", "phone"}) {
                if (lower.contains(field + ":") && !fields.containsKey(field)) {
                    fields.put(field, line.substring(line.indexOf(':') + 1).trim());
                    break;
                }
            }
        }
        if (fields.size() < 3 || fields.containsValue("")) {
            return reply(context, "Please provide patient name, email, and phone number for registration.");
        }

        Patient patient;
        // numbering has to stay gap free, so registrations are serialized
        synchronized (patients) {
            String mrn = String.format("MR%06d", patients.size() + 1);
            patient = new Patient(UUID.randomUUID().toString(), fields.get("name"), fields.get("email"),
                    fields.get("phone"), mrn);
            patients.put(patient.id(), patient);
            patientIdByEmail.put(patient.email(), patient.id());
            patientIdByMrn.put(mrn, patient.id());
        }
        LOGGER.info("Registered patient {}", patient.medicalRecordNumber());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patient_id", patient.id());
        data.put("medical_record_number", patient.medicalRecordNumber());
        data.put("name", patient.name());
        data.put("status", "registered");
        return reply(context, "Patient registered successfully!", data);
    }

    private Message lookup(RequestContext context, String input) {
        Optional<String> patientId;
        Matcher email = EMAIL.matcher(input);
        Matcher mrn = MEDICAL_RECORD_NUMBER.matcher(input);
        if (email.find()) {
            patientId = Optional.ofNullable(patientIdByEmail.get(email.group()));
        } else if (mrn.find()) {
            patientId = Optional.ofNullable(patientIdByMrn.get(mrn.group()));
        } else {
            return reply(context, "Please provide either an email address or medical record number for lookup.");
        }

        Optional<Patient> patient = patientId.map(patients::get);
        if (patient.isEmpty()) {
            return reply(context, "Patient not found in our records.");
        }
        return reply(context, "Patient found!", HospitalData.toMap(patient.get()));
    }

    int size() {
        return patients.size();
    }
}
