package io.carelink.a2a.examples.hospital;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

import io.carelink.a2a.coordinator.CoordinatorAgentExecutor;
import io.carelink.a2a.coordinator.DownstreamAgentClient;
import io.carelink.a2a.coordinator.JSONRPCDownstreamAgentClient;
import io.carelink.a2a.coordinator.WorkflowStep;
import io.carelink.a2a.server.agentexecution.AgentExecutor;
import io.carelink.a2a.server.apps.vertx.A2AServer;
import io.carelink.a2a.server.config.A2AConfigProvider;
import io.carelink.a2a.server.requesthandlers.DefaultRequestHandler;
import io.carelink.a2a.server.streaming.StreamingStages;
import io.carelink.a2a.server.tasks.InMemoryTaskStore;
import io.carelink.a2a.server.util.async.InternalExecutors;
import io.carelink.a2a.spec.AgentCard;
import io.carelink.a2a.transport.jsonrpc.handler.JSONRPCHandler;
import io.carelink.a2a.util.Assert;
import io.vertx.core.Vertx;

/**
 * Wires the hospital agents from configuration. Each agent gets its own task store and its own
 * HTTP worker pool; all of them share one executor pool for streamed work.
 */
public class HospitalAgents implements AutoCloseable {

    public static final String COORDINATOR = "coordinator";
    public static final String PATIENT = "patient";
    public static final String DOCTOR = "doctor";
    public static final String BOOKING = "booking";
    public static final String SECURE_PATIENT = "secure-patient";
    public static final String ANALYSIS = "analysis";

    public static final List<String> NAMES = List.of(PATIENT, DOCTOR, BOOKING, SECURE_PATIENT, ANALYSIS, COORDINATOR);

    static final String HOST = "a2a.server.host";
    static final String WORKER_POOL_SIZE = "a2a.server.worker-pool-size";
    static final String CARD_HOST = "hospital.card.host";
    static final String PATIENT_URL = "hospital.coordinator.patient-url";
    static final String DOCTOR_URL = "hospital.coordinator.doctor-url";
    static final String BOOKING_URL = "hospital.coordinator.booking-url";
    static final String STEP_TIMEOUT_SECONDS = "hospital.coordinator.step-timeout-seconds";
    static final String STAGE_DELAY_MILLIS = "hospital.analysis.stage-delay-millis";

    static final String SUCCESS_TEXT = "Appointment booking workflow completed successfully!";
    static final String FAILURE_PREFIX = "Error in appointment booking workflow: ";

    private final A2AConfigProvider config;
    private final DownstreamAgentClient downstreamClient;
    private final ExecutorService executor;

    public HospitalAgents(A2AConfigProvider config) {
        this(config, new JSONRPCDownstreamAgentClient());
    }

    public HospitalAgents(A2AConfigProvider config, DownstreamAgentClient downstreamClient) {
        this.config = Assert.checkNotNullParam("config", config);
        this.downstreamClient = Assert.checkNotNullParam("downstreamClient", downstreamClient);
        this.executor = InternalExecutors.create("hospital-agents", config);
    }

    public int port(String name) {
        return config.getIntValue("hospital." + checkName(name) + ".port");
    }

    public A2AServer createServer(Vertx vertx, String name) {
        return new A2AServer(vertx, createHandler(name), null, config.getValue(HOST), port(name),
                config.getIntValue(WORKER_POOL_SIZE));
    }

    /**
     * Builds the JSON-RPC handler of one agent.
     *
     * @param name one of {@link #NAMES}
     * @return the handler
     * @throws IllegalArgumentException if the name is unknown
     */
    public JSONRPCHandler createHandler(String name) {
        int port = port(name);
        String cardHost = config.getValue(CARD_HOST);
        switch (name) {
            case COORDINATOR:
                return handler(HospitalAgentCards.coordinator(cardHost, port), createCoordinator());
            case PATIENT:
                return handler(HospitalAgentCards.patient(cardHost, port), new PatientRegistrationAgentExecutor());
            case DOCTOR:
                return handler(HospitalAgentCards.doctor(cardHost, port), new DoctorAvailabilityAgentExecutor());
            case BOOKING:
                return handler(HospitalAgentCards.booking(cardHost, port), new AppointmentBookingAgentExecutor());
            case SECURE_PATIENT: {
                DefaultRequestHandler requestHandler = new DefaultRequestHandler(new SecurePatientAgentExecutor(),
                        new InMemoryTaskStore(config), executor);
                return new JSONRPCHandler(HospitalAgentCards.securePatient(cardHost, port), requestHandler,
                        List.of(new HospitalCredentialsInterceptor(
                                List.of(HospitalAgentCards.API_KEY_SCHEME, HospitalAgentCards.BEARER_SCHEME))));
            }
            case ANALYSIS: {
                StreamingStages stages = new StreamingStages(MedicalAnalysisAgentExecutor.STAGES,
                        Duration.ofMillis(config.getLongValue(STAGE_DELAY_MILLIS)));
                DefaultRequestHandler requestHandler = new DefaultRequestHandler(new MedicalAnalysisAgentExecutor(),
                        new InMemoryTaskStore(config), executor, stages);
                return new JSONRPCHandler(HospitalAgentCards.analysis(cardHost, port), requestHandler);
            }
            default:
                throw new IllegalStateException("No wiring for agent " + name);
        }
    }

    CoordinatorAgentExecutor createCoordinator() {
        Duration timeout = config.getSecondsValue(STEP_TIMEOUT_SECONDS);
        List<WorkflowStep> steps = List.of(
                new WorkflowStep(PATIENT, "Checking patient information...", "patient_info",
                        config.getValue(PATIENT_URL), "lookup patient in: {input}", timeout),
                new WorkflowStep(DOCTOR, "Finding available doctors...", "doctor_availability",
                        config.getValue(DOCTOR_URL), "find doctors for: {input}", timeout),
                new WorkflowStep(BOOKING, "Booking appointment...", "booking_result",
                        config.getValue(BOOKING_URL), "book appointment: {input}", timeout));
        return new CoordinatorAgentExecutor(steps, downstreamClient, SUCCESS_TEXT, FAILURE_PREFIX);
    }

    private JSONRPCHandler handler(AgentCard card, AgentExecutor agentExecutor) {
        return new JSONRPCHandler(card, new DefaultRequestHandler(agentExecutor, new InMemoryTaskStore(config), executor));
    }

    private static String checkName(String name) {
        if (!NAMES.contains(name)) {
            throw new IllegalArgumentException("Unknown agent " + name + ", expected one of " + NAMES);
        }
        return name;
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
