package org.talentia.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.talentia.engine.api.DtoMapper;
import org.talentia.engine.api.JsonSupport;
import org.talentia.engine.api.dto.AssignmentRequestDto;
import org.talentia.engine.api.dto.PositionSuggestionsResponseDto;
import org.talentia.engine.domain.error.AllocationException;
import org.talentia.engine.domain.model.AssignmentBatchResult;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentRequest;
import org.talentia.engine.domain.model.AssignmentStatus;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.PageResult;
import org.talentia.engine.domain.model.PositionSuggestions;
import org.talentia.engine.domain.service.AssignmentOrchestrator;
import org.talentia.engine.domain.service.Messages;
import org.talentia.engine.domain.service.RedistributionService;
import org.talentia.engine.domain.service.SuggestionService;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON HTTP API of the allocation engine.
 */
public final class ApiServer {

    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());

    static final int DEFAULT_SUGGESTION_LIMIT = 50;
    static final int MAX_SUGGESTION_LIMIT = 200;

    private static final String POSITIONS_PREFIX = "/positions/";
    private static final String SUGGESTIONS_SEGMENT = "suggestions";
    private static final String REDISTRIBUTION_PATH = "/recruiters/redistribution";

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private final AssignmentOrchestrator orchestrator;
    private final SuggestionService suggestionService;
    private final RedistributionService redistributionService;
    private final Messages messages;
    private final int defaultSuggestionCount;

    public ApiServer(int port, int threads, AssignmentOrchestrator orchestrator, SuggestionService suggestionService,
                     RedistributionService redistributionService, Messages messages, int defaultSuggestionCount)
            throws IOException {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.suggestionService = Objects.requireNonNull(suggestionService, "suggestionService must not be null");
        this.redistributionService = Objects.requireNonNull(redistributionService,
                "redistributionService must not be null");
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
        this.defaultSuggestionCount = defaultSuggestionCount;

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(threads);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "API server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/assignments", this::handleAssignments);
        server.createContext(POSITIONS_PREFIX, this::handlePositions);
        server.createContext(REDISTRIBUTION_PATH, this::handleRedistribution);
        server.createContext("/", exchange -> sendError(exchange, 404, messages.get("error.route"), null));
    }

    public void start() {
        server.start();
        LOG.info("API server started");
    }

    public void stop() {
        server.stop(1);
        executor.shutdown();
        LOG.info("API server stopped");
    }

    /**
     * Bound port, useful when the server was created on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, messages.get("error.method"), null);
            return;
        }
        sendResponse(exchange, 200, "{\"status\":\"healthy\"}");
    }

    /**
     * POST /assignments creates assignments, GET /assignments lists them.
     */
    private void handleAssignments(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (!"/assignments".equals(path) && !"/assignments/".equals(path)) {
            sendError(exchange, 404, messages.get("error.route"), null);
            return;
        }
        String method = exchange.getRequestMethod();
        if ("POST".equals(method)) {
            createAssignments(exchange);
        } else if ("GET".equals(method)) {
            listAssignments(exchange);
        } else {
            sendError(exchange, 405, messages.get("error.method"), null);
        }
    }

    private void createAssignments(HttpExchange exchange) throws IOException {
        AssignmentRequestDto body;
        try (InputStream in = exchange.getRequestBody()) {
            body = mapper.readValue(in, AssignmentRequestDto.class);
        } catch (JsonProcessingException e) {
            LOG.fine(() -> "Rejected malformed assignment request: " + e.getOriginalMessage());
            sendError(exchange, 400, messages.get("error.validation.body"), null);
            return;
        }
        if (body == null) {
            sendError(exchange, 400, messages.get("error.validation.body"), null);
            return;
        }

        LOG.info(() -> String.format("Received assignment request: position_id=%s, position_ids=%s, force=%s",
                body.getPositionId(), body.getPositionIds(), body.isForce()));
        try {
            AssignmentBatchResult result = orchestrator.assign(
                    new AssignmentRequest(body.getPositionId(), body.getPositionIds(), body.isForce()));
            sendJson(exchange, 201, DtoMapper.toBatchResponse(result));
        } catch (AllocationException e) {
            LOG.info(() -> String.format("Assignment request rejected (%d): %s", e.getHttpStatus(), e.getMessage()));
            sendError(exchange, e.getHttpStatus(), e.getMessage(), e.getDetails());
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Assignment request failed", e);
            sendError(exchange, 500, messages.get("error.internal"), null);
        }
    }

    private void listAssignments(HttpExchange exchange) throws IOException {
        AssignmentFilter filter;
        try {
            filter = parseFilter(parseQuery(exchange.getRequestURI()));
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, messages.get("error.validation.query"),
                    Collections.<String, Object>singletonMap("reason", e.getMessage()));
            return;
        }

        try {
            PageResult<AssignmentView> page = orchestrator.listAssignments(filter);
            sendJson(exchange, 200, DtoMapper.toListResponse(page));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Listing assignments failed", e);
            sendError(exchange, 500, messages.get("error.list"), null);
        }
    }

    /**
     * GET /positions/suggestions and GET /positions/{id}/suggestions
     */
    private void handlePositions(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, messages.get("error.method"), null);
            return;
        }

        String[] segments = trimSlashes(exchange.getRequestURI().getPath().substring(POSITIONS_PREFIX.length()))
                .split("/");
        Map<String, String> query = parseQuery(exchange.getRequestURI());
        try {
            if (segments.length == 1 && SUGGESTIONS_SEGMENT.equals(segments[0])) {
                int limit = parseInt(query.get("limit"), DEFAULT_SUGGESTION_LIMIT, 1, MAX_SUGGESTION_LIMIT, "limit");
                boolean interleave = "true".equalsIgnoreCase(query.get("interleave"));
                List<PositionSuggestions> suggestions = suggestionService.suggestAll(limit, interleave);
                sendJson(exchange, 200, DtoMapper.toSuggestionsResponse(suggestions));
            } else if (segments.length == 2 && !segments[0].isEmpty() && SUGGESTIONS_SEGMENT.equals(segments[1])) {
                int k = parseInt(query.get("k"), defaultSuggestionCount, 1, MAX_SUGGESTION_LIMIT, "k");
                PositionSuggestionsResponseDto dto = new PositionSuggestionsResponseDto();
                dto.setSuccess(true);
                dto.setData(DtoMapper.toPositionSuggestions(suggestionService.suggestFor(segments[0], k)));
                sendJson(exchange, 200, dto);
            } else {
                sendError(exchange, 404, messages.get("error.route"), null);
            }
        } catch (AllocationException e) {
            sendError(exchange, e.getHttpStatus(), e.getMessage(), e.getDetails());
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, messages.get("error.validation.query"),
                    Collections.<String, Object>singletonMap("reason", e.getMessage()));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Computing suggestions failed", e);
            sendError(exchange, 500, messages.get("error.internal"), null);
        }
    }

    /**
     * GET /recruiters/redistribution
     */
    private void handleRedistribution(HttpExchange exchange) throws IOException {
        if (!REDISTRIBUTION_PATH.equals(trimTrailingSlash(exchange.getRequestURI().getPath()))) {
            sendError(exchange, 404, messages.get("error.route"), null);
            return;
        }
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, messages.get("error.method"), null);
            return;
        }
        try {
            sendJson(exchange, 200, DtoMapper.toRedistributionResponse(redistributionService.propose()));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Computing redistribution failed", e);
            sendError(exchange, 500, messages.get("error.internal"), null);
        }
    }

    static AssignmentFilter parseFilter(Map<String, String> query) {
        String status = blankToNull(query.get("status"));
        return new AssignmentFilter(
                blankToNull(query.get("position_id")),
                blankToNull(query.get("recruiter_id")),
                status != null ? AssignmentStatus.fromValue(status) : null,
                parseInt(query.get("page"), 1, 1, Integer.MAX_VALUE, "page"),
                parseInt(query.get("per_page"), AssignmentFilter.DEFAULT_PER_PAGE, 1, AssignmentFilter.MAX_PER_PAGE,
                        "per_page"));
    }

    private static int parseInt(String raw, int defaultValue, int min, int max, String name) {
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max);
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static String trimSlashes(String path) {
        String result = path;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String trimTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static Map<String, String> parseQuery(URI uri) {
        if (uri == null || uri.getRawQuery() == null || uri.getRawQuery().isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new HashMap<>();
        for (String pair : uri.getRawQuery().split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            result.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8),
                    kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "");
        }
        return result;
    }

    private void sendError(HttpExchange exchange, int statusCode, String message, Map<String, Object> details)
            throws IOException {
        Map<String, Object> copy = details != null ? new LinkedHashMap<>(details) : null;
        sendJson(exchange, statusCode, DtoMapper.toError(message, copy));
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object payload) throws IOException {
        sendBytes(exchange, statusCode, mapper.writeValueAsBytes(payload));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        sendBytes(exchange, statusCode, body.getBytes(StandardCharsets.UTF_8));
    }

    private void sendBytes(HttpExchange exchange, int statusCode, byte[] bytes) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
