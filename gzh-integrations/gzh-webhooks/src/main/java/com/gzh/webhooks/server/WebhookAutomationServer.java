package com.gzh.webhooks.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gzh.webhooks.config.WebhookServerConfig;
import com.gzh.webhooks.engine.RuleEngine;
import com.gzh.webhooks.metrics.MetricsSnapshot;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.parser.EventParseException;
import com.gzh.webhooks.parser.EventParser;
import com.gzh.webhooks.queue.EventQueue;
import com.gzh.webhooks.queue.WorkerPool;
import com.gzh.webhooks.security.HmacVerifier;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedded Jetty HTTP server that receives webhook deliveries and feeds them
 * to the {@link RuleEngine} through a bounded queue.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code POST {path}} – verify, parse, enqueue; {@code 200} once queued,
 *       {@code 401} bad signature, {@code 400} missing event header or bad
 *       body, {@code 503} queue full.</li>
 *   <li>{@code GET /health} – liveness.</li>
 *   <li>{@code GET /metrics} – engine counters and queue depth.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 *   WebhookServerConfig config = WebhookServerConfig.builder()
 *       .port(8080)
 *       .sharedSecret("super-secret")
 *       .build();
 *
 *   RuleEngine engine = new RuleEngine(registry);
 *   engine.replaceRules(rules);
 *
 *   WebhookAutomationServer server = new WebhookAutomationServer(config, engine);
 *   server.start();
 *   // ... application runs ...
 *   server.stop();
 * </pre>
 */
public class WebhookAutomationServer {

    private static final Logger log = LoggerFactory.getLogger(WebhookAutomationServer.class);

    static final String HEALTH_PATH  = "/health";
    static final String METRICS_PATH = "/metrics";

    private final WebhookServerConfig config;
    private final RuleEngine          engine;
    private final ObjectMapper        mapper;
    private final HmacVerifier        hmacVerifier;
    private final EventParser         parser;
    private final EventQueue          queue;
    private final WorkerPool          workers;

    private Server          jettyServer;
    private ServerConnector connector;

    public WebhookAutomationServer(WebhookServerConfig config, RuleEngine engine) {
        this.config       = config;
        this.engine       = engine;
        this.mapper       = new ObjectMapper().registerModule(new JavaTimeModule());
        this.hmacVerifier = config.isSignatureVerificationEnabled()
                ? new HmacVerifier(config.getSharedSecret())
                : null;
        this.parser       = new EventParser(config.getHeaderPrefix());
        this.queue        = new EventQueue(config.getQueueCapacity());
        this.workers      = new WorkerPool(queue, engine, config.getWorkers());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void start() throws Exception {
        if (hmacVerifier == null) {
            log.warn("No webhook secret configured: signature verification is DISABLED and every sender is trusted");
        }
        workers.start();

        QueuedThreadPool pool = new QueuedThreadPool(config.getMaxThreads(), 2);
        pool.setName("webhook-http");
        jettyServer = new Server(pool);

        connector = new ServerConnector(jettyServer);
        connector.setPort(config.getPort());
        jettyServer.addConnector(connector);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        ctx.addServlet(new ServletHolder(new WebhookServlet()), config.getPath());
        ctx.addServlet(new ServletHolder(new HealthServlet()), HEALTH_PATH);
        ctx.addServlet(new ServletHolder(new MetricsServlet()), METRICS_PATH);
        jettyServer.setHandler(ctx);

        try {
            jettyServer.start();
        } catch (Exception e) {
            workers.stop(config.getShutdownGracePeriod());
            throw e;
        }
        log.info("Webhook automation server listening on port {} at path {} ({} rule(s), {} worker(s))",
                getPort(), config.getPath(), engine.rules().size(), config.getWorkers());
    }

    public void stop() throws Exception {
        try {
            if (jettyServer != null) {
                jettyServer.stop();
            }
        } finally {
            workers.stop(config.getShutdownGracePeriod());
            log.info("Webhook automation server stopped");
        }
    }

    /** Port actually bound, useful when the configured port is 0. */
    public int getPort() {
        return connector == null ? config.getPort() : connector.getLocalPort();
    }

    public int queueSize() {
        return queue.size();
    }

    public RuleEngine engine() {
        return engine;
    }

    // ------------------------------------------------------------------
    // Servlets
    // ------------------------------------------------------------------

    private class WebhookServlet extends HttpServlet {

        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            byte[] body = req.getInputStream().readAllBytes();

            if (hmacVerifier != null && !hmacVerifier.verify(body, req.getHeader(HmacVerifier.SIGNATURE_HEADER))) {
                log.warn("Rejected webhook delivery from {}: invalid or missing signature", req.getRemoteAddr());
                writeError(resp, HttpServletResponse.SC_UNAUTHORIZED, "Invalid signature");
                return;
            }

            String eventType = req.getHeader(config.getEventHeader());
            if (eventType == null || eventType.isBlank()) {
                writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "Missing " + config.getEventHeader() + " header");
                return;
            }

            WebhookEvent event;
            try {
                event = parser.parse(eventType, req.getHeader(config.getDeliveryHeader()), body, headers(req));
            } catch (EventParseException e) {
                log.warn("Failed to parse {} delivery: {}", eventType, e.getMessage());
                writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "Failed to parse event: " + e.getMessage());
                return;
            }

            if (!queue.offer(event)) {
                log.warn("Event queue full ({}), rejecting event {}", queue.capacity(), event.getId());
                writeError(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Event queue is full");
                return;
            }

            log.debug("Queued event {} ({})", event.getId(), event.qualifiedType());
            Map<String, Object> accepted = new LinkedHashMap<>();
            accepted.put("status", "accepted");
            accepted.put("event_id", event.getId());
            writeJson(resp, HttpServletResponse.SC_OK, accepted);
        }
    }

    private class HealthServlet extends HttpServlet {

        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("timestamp", Instant.now().toString());
            writeJson(resp, HttpServletResponse.SC_OK, health);
        }
    }

    private class MetricsServlet extends HttpServlet {

        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            MetricsSnapshot snapshot = engine.metrics().snapshot();
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("events_processed", snapshot.getEventsProcessed());
            metrics.put("rules_evaluated", snapshot.getRulesEvaluated());
            metrics.put("actions_executed", snapshot.getActionsExecuted());
            metrics.put("errors", snapshot.getErrors());
            metrics.put("avg_processing_ms", snapshot.averageProcessingMillis());
            metrics.put("queue_size", queue.size());
            writeJson(resp, HttpServletResponse.SC_OK, metrics);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Map<String, String> headers(HttpServletRequest req) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(req.getHeaderNames())) {
            headers.put(name, req.getHeader(name));
        }
        return headers;
    }

    private void writeError(HttpServletResponse resp, int status, String message) throws IOException {
        writeJson(resp, status, Map.of("error", message));
    }

    private void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setCharacterEncoding("UTF-8");
        mapper.writeValue(resp.getOutputStream(), body);
    }
}
