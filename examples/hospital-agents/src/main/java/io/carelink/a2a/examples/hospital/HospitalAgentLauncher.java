package io.carelink.a2a.examples.hospital;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import io.carelink.a2a.server.apps.vertx.A2AServer;
import io.carelink.a2a.server.config.DefaultValuesConfigProvider;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts hospital agents: {@code HospitalAgentLauncher <agent>} runs one of
 * {@link HospitalAgents#NAMES}, {@code HospitalAgentLauncher all} runs every agent in this JVM.
 */
public final class HospitalAgentLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(HospitalAgentLauncher.class);

    static final String ALL = "all";

    private HospitalAgentLauncher() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            LOGGER.error("Usage: HospitalAgentLauncher <{}|{}>", String.join("|", HospitalAgents.NAMES), ALL);
            System.exit(2);
        }
        List<String> names;
        try {
            names = selectAgents(args[0]);
        } catch (IllegalArgumentException e) {
            LOGGER.error(e.getMessage());
            System.exit(2);
            return;
        }

        Vertx vertx = Vertx.vertx();
        HospitalAgents agents = new HospitalAgents(new DefaultValuesConfigProvider());
        List<A2AServer> servers = new ArrayList<>();
        List<CompletableFuture<Integer>> started = new ArrayList<>();
        for (String name : names) {
            A2AServer server = agents.createServer(vertx, name);
            servers.add(server);
            started.add(server.start());
        }
        try {
            CompletableFuture.allOf(started.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            LOGGER.error("Failed to start hospital agents", e.getCause());
            agents.close();
            vertx.close();
            System.exit(1);
            return;
        }
        LOGGER.info("Started {} hospital agent(s)", servers.size());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Stopping hospital agents");
            CompletableFuture.allOf(servers.stream().map(A2AServer::stop).toArray(CompletableFuture[]::new))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOGGER.warn("Failed to stop every agent cleanly", error);
                        }
                        agents.close();
                        vertx.close();
                        stopped.countDown();
                    });
            try {
                if (!stopped.await(10, TimeUnit.SECONDS)) {
                    LOGGER.warn("Agents did not stop within 10 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "hospital-agents-shutdown"));
    }

    static List<String> selectAgents(String name) {
        if (ALL.equals(name)) {
            return HospitalAgents.NAMES;
        }
        if (!HospitalAgents.NAMES.contains(name)) {
            throw new IllegalArgumentException("Unknown agent " + name + ", expected one of " + HospitalAgents.NAMES + " or " + ALL);
        }
        return List.of(name);
    }
}
