package pl.marcinmilkowski.vocab_tutor.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_tutor.credentials.CredentialProvider;
import pl.marcinmilkowski.vocab_tutor.evaluation.EvaluationResult;
import pl.marcinmilkowski.vocab_tutor.evaluation.TutorEngine;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * REST API server for the tutor.
 *
 * Endpoints:
 * - GET /health - Health check
 * - GET /api/evaluate?word=...&sentence=...[&external=true|false] - Evaluate a sentence
 * - GET /api/credential - Whether an API key is stored
 * - POST /api/credential - Store the request body as API key
 * - DELETE /api/credential - Remove the stored API key
 *
 * When "external" is omitted the external dictionary is used iff an API key is stored.
 */
public class TutorApiServer {

    private static final Logger logger = LoggerFactory.getLogger(TutorApiServer.class);

    private final TutorEngine engine;
    private final CredentialProvider credentials;
    private final int port;
    private final int threads;
    private HttpServer server;
    private ExecutorService workers;

    public TutorApiServer(Builder builder) {
        this.engine = builder.engine;
        this.credentials = builder.credentials;
        this.port = builder.port;
        this.threads = builder.threads;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TutorEngine engine;
        private CredentialProvider credentials;
        private int port = 8080;
        private int threads = 4;

        public Builder withEngine(TutorEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder withCredentials(CredentialProvider credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withThreads(int threads) {
            this.threads = threads;
            return this;
        }

        public TutorApiServer build() {
            if (engine == null || credentials == null) {
                throw new IllegalStateException("Engine and credential provider are required");
            }
            return new TutorApiServer(this);
        }
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", exchange ->
            sendJsonResponse(exchange, 200, JSON.toJSONString(Collections.singletonMap("status", "ok"))));

        server.createContext("/api/evaluate", exchange -> {
            try {
                handleEvaluate(exchange);
            } catch (RuntimeException e) {
                logger.error("Evaluation error", e);
                sendError(exchange, 500, "Evaluation failed: " + e.getMessage());
            }
        });

        server.createContext("/api/credential", exchange -> {
            try {
                handleCredential(exchange);
            } catch (RuntimeException e) {
                logger.error("Credential error", e);
                sendError(exchange, 500, "Credential operation failed: " + e.getMessage());
            }
        });

        workers = Executors.newFixedThreadPool(threads);
        server.setExecutor(workers);
        server.start();
        logger.info("Tutor API server started on port {}", getPort());
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private void handleEvaluate(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }

        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String sentence = params.get("sentence");
        if (sentence == null) {
            sendError(exchange, 400, "Missing required parameter: sentence");
            return;
        }
        String word = params.getOrDefault("word", "");

        String externalParam = params.get("external");
        boolean useExternal = externalParam != null
            ? Boolean.parseBoolean(externalParam)
            : credentials.get().isPresent();

        EvaluationResult result = engine.evaluate(word, sentence, useExternal);
        sendJsonResponse(exchange, 200, TutorResponseWriter.toJson(result));
    }

    private void handleCredential(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase();
        switch (method) {
            case "GET": {
                JSONObject body = new JSONObject();
                body.put("stored", credentials.get().isPresent());
                sendJsonResponse(exchange, 200, body.toJSONString());
                break;
            }
            case "POST": {
                String key = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                if (!credentials.set(key)) {
                    sendError(exchange, 400, "API key must not be empty");
                    return;
                }
                JSONObject body = new JSONObject();
                body.put("stored", true);
                sendJsonResponse(exchange, 200, body.toJSONString());
                break;
            }
            case "DELETE": {
                credentials.clear();
                JSONObject body = new JSONObject();
                body.put("stored", false);
                sendJsonResponse(exchange, 200, body.toJSONString());
                break;
            }
            default:
                sendError(exchange, 405, "Method not allowed");
        }
    }

    /**
     * Parse query parameters from URL.
     */
    static Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }

        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                try {
                    params.put(
                        URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8),
                        URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8));
                } catch (IllegalArgumentException e) {
                    logger.debug("Skipping malformed query parameter '{}'", pair);
                }
            }
        }
        return params;
    }

    private void sendJsonResponse(HttpExchange exchange, int code, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);

        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(code, bytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int code, String message) throws IOException {
        JSONObject error = new JSONObject();
        error.put("error", message);
        sendJsonResponse(exchange, code, error.toJSONString());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }
}
