package io.carelink.a2a.examples.hospital;

import java.util.List;
import java.util.Map;

import io.carelink.a2a.server.card.AgentCardFactory;
import io.carelink.a2a.server.card.AgentIdentity;
import io.carelink.a2a.spec.APIKeySecurityScheme;
import io.carelink.a2a.spec.AgentCapabilities;
import io.carelink.a2a.spec.AgentCard;
import io.carelink.a2a.spec.AgentSkill;
import io.carelink.a2a.spec.HTTPAuthSecurityScheme;
import io.carelink.a2a.spec.SecurityScheme;

/**
 * Cards of the hospital agents.
 */
public final class HospitalAgentCards {

    public static final String API_KEY_SCHEME = "apiKey";
    public static final String BEARER_SCHEME = "bearer";

    private HospitalAgentCards() {
    }

    static String rpcUrl(String host, int port) {
        return "http://" + host + ":" + port + "/a2a/v1";
    }

    public static AgentCard coordinator(String host, int port) {
        return AgentCardFactory.create(AgentIdentity.builder()
                .name("Hospital Coordinator Agent")
                .description("Main coordinator that orchestrates appointment booking workflows across all hospital systems")
                .url(rpcUrl(host, port))
                .skills(List.of(AgentSkill.builder()
                        .id("appointment-orchestration")
                        .name("Appointment Orchestration")
                        .description("Coordinate complete appointment booking workflow across all hospital agents")
                        .tags(List.of("orchestration", "workflow", "coordination"))
                        .examples(List.of(
                                "Book appointment for John Doe with cardiology",
                                "Help me schedule a checkup with Dr. Johnson next week"))
                        .build()))
                .build());
    }

    public static AgentCard patient(String host, int port) {
        return AgentCardFactory.create(AgentIdentity.builder()
                .name("Patient Registration Agent")
                .description("Handles patient registration, verification, and lookup services for the hospital system")
                .url(rpcUrl(host, port))
                .skills(List.of(
                        AgentSkill.builder()
                                .id("patient-registration")
                                .name("Patient Registration")
                                .description("Register new patients and validate existing patient information")
                                .tags(List.of("registration", "patient", "verification"))
                                .examples(List.of(
                                        "Register a new patient with name John Doe, email john@email.com, phone 123-456-7890",
                                        "Verify patient information for medical record number MR123456"))
                                .build(),
                        AgentSkill.builder()
                                .id("patient-lookup")
                                .name("Patient Lookup")
                                .description("Look up existing patient records and information")
                                .tags(List.of("lookup", "patient", "records"))
                                .examples(List.of(
                                        "Find patient by email: john@email.com",
                                        "Look up patient by medical record number: MR123456"))
                                .build()))
                .build());
    }

    public static AgentCard doctor(String host, int port) {
        return AgentCardFactory.create(AgentIdentity.builder()
                .name("Doctor Availability Agent")
                .description("Manages doctor schedules and availability for appointment booking")
                .url(rpcUrl(host, port))
                .skills(List.of(
                        AgentSkill.builder()
                                .id("doctor-search")
                                .name("Doctor Search")
                                .description("Search for doctors by specialty, department, or name")
                                .tags(List.of("doctor", "search", "specialty", "department"))
                                .examples(List.of(
                                        "Find cardiologists available this week",
                                        "Search for doctors in Emergency Department",
                                        "Find Dr. Smith's availability"))
                                .build(),
                        AgentSkill.builder()
                                .id("availability-check")
                                .name("Availability Check")
                                .description("Check doctor availability for specific dates and times")
                                .tags(List.of("availability", "schedule", "appointment"))
                                .examples(List.of(
                                        "Check Dr. Johnson's availability for next Monday",
                                        "Find available slots in Cardiology for this week"))
                                .build()))
                .build());
    }

    public static AgentCard booking(String host, int port) {
        return AgentCardFactory.create(AgentIdentity.builder()
                .name("Appointment Booking Agent")
                .description("Handles appointment booking, modification, and cancellation services")
                .url(rpcUrl(host, port))
                .skills(List.of(
                        AgentSkill.builder()
                                .id("book-appointment")
                                .name("Book Appointment")
                                .description("Book new appointments for patients with available doctors")
                                .tags(List.of("booking", "appointment", "schedule"))
                                .examples(List.of(
                                        "Book appointment for patient MR123456 with Dr. Johnson on 2024-01-15 at 10:00",
                                        "Schedule appointment for john@email.com with cardiology department"))
                                .build(),
                        AgentSkill.builder()
                                .id("appointment-management")
                                .name("Appointment Management")
                                .description("View, modify, or cancel existing appointments")
                                .tags(List.of("appointment", "management", "cancel", "modify"))
                                .examples(List.of(
                                        "View appointments for patient MR123456",
                                        "Cancel appointment ID APT123456"))
                                .build()))
                .build());
    }

    /**
     * Card of the protected patient registry. Callers authenticate with an API key or a
     * bearer token; either one is enough.
     */
    public static AgentCard securePatient(String host, int port) {
        Map<String, SecurityScheme> schemes = Map.of(
                API_KEY_SCHEME, new APIKeySecurityScheme("header", HospitalCredentialsInterceptor.API_KEY_HEADER),
                BEARER_SCHEME, new HTTPAuthSecurityScheme("bearer", "JWT"));
        return AgentCardFactory.create(AgentIdentity.builder()
                .name("HIPAA-Compliant Patient Agent")
                .description("Secure patient registration service with HIPAA compliance features")
                .url(rpcUrl(host, port))
                .skills(List.of(AgentSkill.builder()
                        .id("secure-patient-registration")
                        .name("Secure Patient Registration")
                        .description("HIPAA-compliant patient registration with encryption and audit logging")
                        .tags(List.of("registration", "patient", "HIPAA", "secure"))
                        .examples(List.of(
                                "Register new patient with encrypted PHI",
                                "Verify patient identity with secure lookup"))
                        .build()))
                .securitySchemes(schemes)
                .security(List.of(Map.of(API_KEY_SCHEME, List.<String>of()), Map.of(BEARER_SCHEME, List.<String>of())))
                .build());
    }

    public static AgentCard analysis(String host, int port) {
        return AgentCardFactory.create(AgentIdentity.builder()
                .name("Streaming Medical Analysis Agent")
                .description("Provides streaming medical analysis with real-time updates")
                .url(rpcUrl(host, port))
                .capabilities(AgentCapabilities.builder().streaming(true).build())
                .skills(List.of(AgentSkill.builder()
                        .id("long-running-analysis")
                        .name("Long-Running Medical Analysis")
                        .description("Perform complex medical data analysis with streaming updates")
                        .tags(List.of("analysis", "streaming", "medical"))
                        .examples(List.of("Analyze patient medical history with real-time updates"))
                        .build()))
                .build());
    }
}
