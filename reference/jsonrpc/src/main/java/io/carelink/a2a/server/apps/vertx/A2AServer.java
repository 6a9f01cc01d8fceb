package io.carelink.a2a.server.apps.vertx;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import io.carelink.a2a.transport.jsonrpc.handler.JSONRPCHandler;
import io.carelink.a2a.util.Assert;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server exposing one agent over JSON-RPC.
 * <p>
 * Several servers may share one {@link Vertx} instance; a server created without one owns a
 * private instance and closes it on {@link #stop()}. Requests run on a worker pool owned by the
 * server, so an agent blocked on a call to another agent of the same {@link Vertx} instance
 * never holds the threads that agent needs.
 */
public class A2AServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2AServer.class);

    public static final int DEFAULT_WORKER_POOL_SIZE = VertxOptions.DEFAULT_WORKER_POOL_SIZE;

    private static final AtomicInteger SERVER_IDS = new AtomicInteger();

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final A2AServerRoutes routes;
    private final String host;
    private final int port;
    private final String name;
    private final int workerPoolSize;
    private volatile @Nullable HttpServer httpServer;
    private volatile @Nullable WorkerExecutor workerExecutor;

    public A2AServer(JSONRPCHandler handler, String host, int port) {
        this(Vertx.vertx(), true, new A2AServerRoutes(handler), handler.getAgentCard().name(), host, port,
                DEFAULT_WORKER_POOL_SIZE);
    }

    public A2AServer(Vertx vertx, JSONRPCHandler handler, String host, int port) {
        this(vertx, handler, null, host, port, DEFAULT_WORKER_POOL_SIZE);
    }

    /**
     * @param vertx the Vert.x instance to run on
     * @param handler the agent's handler
     * @param callContextFactory builds the call context of each request, {@code null} for the
     *                           default one holding the request headers
     * @param host the interface to bind
     * @param port the port to bind, {@code 0} for any free port
     * @param workerPoolSize the number of threads running this server's requests
     */
    public A2AServer(Vertx vertx, JSONRPCHandler handler, @Nullable CallContextFactory callContextFactory,
                     String host, int port, int workerPoolSize) {
        this(vertx, false, new A2AServerRoutes(handler, callContextFactory), handler.getAgentCard().name(), host, port,
                workerPoolSize);
    }

    private A2AServer(Vertx vertx, boolean ownsVertx, A2AServerRoutes routes, String name, String host, int port,
                      int workerPoolSize) {
        this.vertx = Assert.checkNotNullParam("vertx", vertx);
        this.ownsVertx = ownsVertx;
        this.routes = routes;
        this.name = name;
        this.host = Assert.checkNotBlankParam("host", host);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port);
        }
        this.port = port;
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("Invalid worker pool size " + workerPoolSize);
        }
        this.workerPoolSize = workerPoolSize;
    }

    /**
     * Starts listening.
     *
     * @return completes with the bound port
     */
    public CompletableFuture<Integer> start() {
        String poolName = name.toLowerCase(Locale.ROOT).replace(' ', '-') + "-" + SERVER_IDS.incrementAndGet();
        WorkerExecutor worker = vertx.createSharedWorkerExecutor(poolName, workerPoolSize);
        workerExecutor = worker;
        Router router = Router.router(vertx);
        routes.register(router, worker);
        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port, host)
                .map(server -> {
                    httpServer = server;
                    LOGGER.info("{} listening on http://{}:{}", name, host, server.actualPort());
                    return server.actualPort();
                })
                .toCompletionStage()
                .toCompletableFuture();
    }

    /**
     * Returns the bound port.
     *
     * @return the port
     * @throws IllegalStateException if the server is not started
     */
    public int getPort() {
        HttpServer server = httpServer;
        if (server == null) {
            throw new IllegalStateException(name + " is not started");
        }
        return server.actualPort();
    }

    public CompletableFuture<Void> stop() {
        HttpServer server = httpServer;
        httpServer = null;
        WorkerExecutor worker = workerExecutor;
        workerExecutor = null;
        Future<Void> closed = server == null ? Future.succeededFuture() : server.close();
        if (worker != null) {
            closed = closed.eventually(v -> worker.close());
        }
        if (ownsVertx) {
            closed = closed.eventually(v -> vertx.close());
        }
        return closed
                .onSuccess(v -> LOGGER.info("{} stopped", name))
                .toCompletionStage()
                .toCompletableFuture();
    }
}
