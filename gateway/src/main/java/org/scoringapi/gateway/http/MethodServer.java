package org.scoringapi.gateway.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.scoringapi.gateway.domain.model.MethodResponse;
import org.scoringapi.gateway.domain.model.RequestContext;
import org.scoringapi.gateway.domain.model.ResponseCode;
import org.scoringapi.gateway.domain.service.MethodDispatcher;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front of the gateway.
 *
 * Endpoints:
 * - POST /method: JSON envelope, answered with {"response", "code"} or {"error", "code"}
 * - GET /health
 *
 * Unparseable or oversized bodies get 400, unknown paths 404 and unexpected failures 500.
 */
public final class MethodServer {

    private static final Logger LOG = Logger.getLogger(MethodServer.class.getName());
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String METHOD_ROUTE = "method";
    static final String HEALTH_ROUTE = "health";
    static final int DEFAULT_MAX_BODY_BYTES = 1024 * 1024;

    private final HttpServer server;
    private final ExecutorService executor;
    private final MethodDispatcher dispatcher;
    private final int maxBodyBytes;

    public MethodServer(String host, int port, int workerThreads, MethodDispatcher dispatcher) throws IOException {
        this(host, port, workerThreads, dispatcher, DEFAULT_MAX_BODY_BYTES);
    }

    /**
     * @param maxBodyBytes bodies longer than this are answered with 400 without being parsed
     */
    public MethodServer(String host, int port, int workerThreads, MethodDispatcher dispatcher,
                        int maxBodyBytes) throws IOException {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        if (maxBodyBytes < 1) {
            throw new IllegalArgumentException("maxBodyBytes must be at least 1");
        }
        this.maxBodyBytes = maxBodyBytes;

        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(workerThreads);
        this.server.setExecutor(executor);
        this.server.createContext("/", this::handle);
        LOG.info(() -> "Method server initialized on " + host + ":" + getPort());
    }

    /**
     * Start the method server.
     */
    public void start() {
        server.start();
        LOG.info("Method server started");
    }

    /**
     * Stop the method server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Method server stopped");
    }

    /**
     * Bound port, useful when created with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String route = exchange.getRequestURI().getPath().replaceAll("^/+|/+$", "");
        String httpMethod = exchange.getRequestMethod();

        if (HEALTH_ROUTE.equals(route) && "GET".equals(httpMethod)) {
            sendJson(exchange, 200, Map.of("status", "UP"));
            return;
        }
        if (!"POST".equals(httpMethod)) {
            sendJson(exchange, 405, Map.of("error", "method not allowed"));
            return;
        }
        handlePost(exchange, route);
    }

    private void handlePost(HttpExchange exchange, String route) throws IOException {
        RequestContext context = RequestContext.withRequestId(
                exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER));

        String rawBody = readBody(exchange);
        Map<String, Object> body = null;
        if (rawBody == null) {
            LOG.warning(() -> "Body over " + maxBodyBytes + " bytes (" + context.getRequestId() + ")");
        } else {
            try {
                body = MAPPER.readValue(rawBody, BODY_TYPE);
            } catch (IOException e) {
                LOG.fine(() -> "Unparseable body (" + context.getRequestId() + "): " + e.getMessage());
            }
        }

        MethodResponse response;
        if (body == null) {
            response = MethodResponse.error(ResponseCode.BAD_REQUEST);
        } else {
            LOG.info(() -> String.format("/%s: %s %s", route, rawBody, context.getRequestId()));
            if (METHOD_ROUTE.equals(route)) {
                response = dispatch(body, context);
            } else {
                response = MethodResponse.error(ResponseCode.NOT_FOUND);
            }
        }

        Map<String, Object> envelope = response.toEnvelope();
        LOG.info(() -> context + " " + envelope);
        sendJson(exchange, response.getCode().getCode(), envelope);
    }

    /**
     * The body as text, or null when it is longer than the limit.
     */
    private String readBody(HttpExchange exchange) throws IOException {
        String declared = exchange.getRequestHeaders().getFirst("Content-Length");
        if (declared != null) {
            try {
                if (Long.parseLong(declared.trim()) > maxBodyBytes) {
                    return null;
                }
            } catch (NumberFormatException e) {
                LOG.fine(() -> "Ignoring invalid Content-Length: " + declared);
            }
        }
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes(maxBodyBytes + 1);
            if (bytes.length > maxBodyBytes) {
                return null;
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private MethodResponse dispatch(Map<String, Object> body, RequestContext context) {
        try {
            return dispatcher.dispatch(body, context);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, e, () -> "Unexpected error (" + context.getRequestId() + ")");
            return MethodResponse.error(ResponseCode.INTERNAL_ERROR);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
