package org.talentia.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.talentia.engine.api.JsonSupport;
import org.talentia.engine.domain.model.AssignmentFilter;
import org.talentia.engine.domain.model.AssignmentStatus;
import org.talentia.engine.domain.model.PriorityTier;
import org.talentia.engine.domain.model.ScoringWeights;
import org.talentia.engine.domain.model.Zone;
import org.talentia.engine.domain.service.AssignmentOrchestratorImpl;
import org.talentia.engine.domain.service.FitScorerImpl;
import org.talentia.engine.domain.service.Messages;
import org.talentia.engine.domain.service.PriorityClassifierImpl;
import org.talentia.engine.domain.service.RecommendationRanker;
import org.talentia.engine.domain.service.RecommendationRankerImpl;
import org.talentia.engine.domain.service.RedistributionServiceImpl;
import org.talentia.engine.domain.service.SuggestionServiceImpl;
import org.talentia.engine.repository.jdbc.H2Fixture;
import org.talentia.engine.repository.jdbc.JdbcAssignmentRepository;
import org.talentia.engine.repository.jdbc.JdbcAuditLogRepository;
import org.talentia.engine.repository.jdbc.JdbcCapacityReservationCoordinator;
import org.talentia.engine.repository.jdbc.JdbcPositionRepository;
import org.talentia.engine.repository.jdbc.JdbcRecruiterRepository;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.talentia.engine.domain.model.SampleData.NOW;
import static org.talentia.engine.domain.model.SampleData.position;
import static org.talentia.engine.domain.model.SampleData.recruiter;

class ApiServerTest {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client = new OkHttpClient();
    private final ObjectMapper mapper = JsonSupport.objectMapper();

    private H2Fixture db;
    private ApiServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        db = H2Fixture.create();
        db.insertRecruiter(recruiter("r-a", Zone.LIMA).name("Ana").capacity(3).build());
        db.insertRecruiter(recruiter("r-b", Zone.ICA).name("Bruno").capacity(3).build());
        db.insertPosition(position("p-1", Zone.LIMA, PriorityTier.P1).build());
        db.insertPosition(position("p-2", Zone.ICA, PriorityTier.P3).build());

        Messages messages = new Messages(Locale.ENGLISH);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JdbcRecruiterRepository recruiters = new JdbcRecruiterRepository(db.jdbc());
        JdbcPositionRepository positions = new JdbcPositionRepository(db.jdbc(), db.tx());
        RecommendationRanker ranker = new RecommendationRankerImpl(
                new FitScorerImpl(ScoringWeights.defaults(), messages));

        AssignmentOrchestratorImpl orchestrator = new AssignmentOrchestratorImpl.Builder()
                .recruiterRepository(recruiters)
                .positionRepository(positions)
                .assignmentRepository(new JdbcAssignmentRepository(db.jdbc(), db.tx(), mapper))
                .auditLogRepository(new JdbcAuditLogRepository(db.jdbc(), mapper))
                .ranker(ranker)
                .coordinator(new JdbcCapacityReservationCoordinator(db.jdbc(), db.tx(), clock))
                .messages(messages)
                .clock(clock)
                .build();
        SuggestionServiceImpl suggestions = new SuggestionServiceImpl(positions, recruiters,
                new PriorityClassifierImpl(messages), ranker, messages, 3, clock);

        server = new ApiServer(0, 2, orchestrator, suggestions,
                new RedistributionServiceImpl(recruiters, messages), messages, 3);
        server.start();
        baseUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        db.shutdown();
    }

    @Test
    void health() throws IOException {
        try (Response response = get("/health")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(body(response).get("status").asText()).isEqualTo("healthy");
        }
    }

    @Test
    void createsAssignmentsAndListsThem() throws IOException {
        try (Response response = post("/assignments", "{\"position_ids\":[\"p-1\",\"p-2\"]}")) {
            assertThat(response.code()).isEqualTo(201);
            assertThat(response.header("Content-Type")).startsWith("application/json");
            JsonNode json = body(response);
            assertThat(json.get("success").asBoolean()).isTrue();
            assertThat(json.get("state").asText()).isEqualTo("COMPLETED");
            assertThat(json.get("data").size()).isEqualTo(2);
            assertThat(json.get("data").get(0).get("position_id").asText()).isEqualTo("p-1");
            assertThat(json.get("data").get(0).get("assigned_at").asText()).isEqualTo("2025-03-10T12:00:00Z");
            assertThat(json.get("data").get(0).get("score_breakdown").has("zone")).isTrue();
            assertThat(json.get("stats").get("total_assigned").asInt()).isEqualTo(2);
            assertThat(json.has("warning")).isFalse();
        }

        try (Response response = get("/assignments?per_page=1")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode json = body(response);
            assertThat(json.get("data").size()).isEqualTo(1);
            assertThat(json.get("meta").get("total").asLong()).isEqualTo(2);
            assertThat(json.get("meta").get("per_page").asInt()).isEqualTo(1);
        }
    }

    @Test
    void mapsDomainErrorsToStatusCodes() throws IOException {
        post("/assignments", "{\"position_id\":\"p-1\"}").close();

        try (Response response = post("/assignments", "{\"position_id\":\"p-1\"}")) {
            assertThat(response.code()).isEqualTo(409);
            JsonNode json = body(response);
            assertThat(json.get("success").asBoolean()).isFalse();
            assertThat(json.get("details").get("status").asText()).isEqualTo("in_progress");
        }
        try (Response response = post("/assignments", "{\"position_id\":\"nope\"}")) {
            assertThat(response.code()).isEqualTo(404);
        }
        try (Response response = post("/assignments", "{}")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(body(response).get("error").asText()).isEqualTo("Either position_id or position_ids is required");
        }
    }

    @Test
    void rejectsMalformedRequests() throws IOException {
        try (Response response = post("/assignments", "{not json")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(body(response).get("error").asText()).isEqualTo("Invalid request body");
        }
        try (Response response = post("/assignments", "")) {
            assertThat(response.code()).isEqualTo(400);
        }
        try (Response response = get("/assignments?per_page=500")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(body(response).get("details").has("reason")).isTrue();
        }
        try (Response response = get("/positions/suggestions?limit=abc")) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    void rejectsUnknownMethodsAndRoutes() throws IOException {
        Request delete = new Request.Builder().url(baseUrl + "/assignments").delete().build();
        try (Response response = client.newCall(delete).execute()) {
            assertThat(response.code()).isEqualTo(405);
        }
        try (Response response = get("/unknown")) {
            assertThat(response.code()).isEqualTo(404);
            assertThat(body(response).get("error").asText()).isEqualTo("Resource not found");
        }
        try (Response response = get("/assignments/extra")) {
            assertThat(response.code()).isEqualTo(404);
        }
        try (Response response = get("/positions/p-1/other")) {
            assertThat(response.code()).isEqualTo(404);
        }
    }

    @Test
    void servesSuggestions() throws IOException {
        try (Response response = get("/positions/suggestions?interleave=true")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode json = body(response);
            assertThat(json.get("data").size()).isEqualTo(2);
            assertThat(json.get("queues").has("critical")).isTrue();
            assertThat(json.get("queues").has("technical")).isTrue();
            assertThat(json.get("queues").has("general")).isTrue();
        }
        try (Response response = get("/positions/p-1/suggestions?k=1")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode data = body(response).get("data");
            assertThat(data.get("position_id").asText()).isEqualTo("p-1");
            assertThat(data.get("suggestions").size()).isEqualTo(1);
            assertThat(data.get("suggestions").get(0).get("recruiter_id").asText()).isEqualTo("r-a");
        }
        try (Response response = get("/positions/missing/suggestions")) {
            assertThat(response.code()).isEqualTo(404);
            assertThat(body(response).get("error").asText()).isEqualTo("Position not found");
        }
    }

    @Test
    void servesRedistributionProposal() throws IOException {
        db.jdbc().update("UPDATE recruiters SET capacity = 20, current_load = 14 WHERE id = 'r-a'");
        db.jdbc().update("UPDATE recruiters SET current_load = 1 WHERE id = 'r-b'");

        try (Response response = get("/recruiters/redistribution")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode json = body(response);
            assertThat(json.get("is_balanced").asBoolean()).isFalse();
            assertThat(json.get("total_cases_to_move").asInt()).isEqualTo(4);
            assertThat(json.get("overloaded_count").asInt()).isEqualTo(1);
            JsonNode move = json.get("moves").get(0);
            assertThat(move.get("from_recruiter_id").asText()).isEqualTo("r-a");
            assertThat(move.get("to_recruiter_name").asText()).isEqualTo("Bruno");
            assertThat(move.get("zone_match").asBoolean()).isFalse();
            assertThat(move.get("to_zone").asText()).isEqualTo("ICA");
        }
        assertThat(db.loadOf("r-a")).isEqualTo(14);

        Request post = new Request.Builder().url(baseUrl + "/recruiters/redistribution")
                .post(RequestBody.create("{}", JSON)).build();
        try (Response response = client.newCall(post).execute()) {
            assertThat(response.code()).isEqualTo(405);
        }
        try (Response response = get("/recruiters/redistribution/extra")) {
            assertThat(response.code()).isEqualTo(404);
        }
    }

    @Test
    void parseFilterReadsPagingAndStatus() {
        Map<String, String> query = new HashMap<>();
        query.put("status", "superseded");
        query.put("page", "3");
        query.put("recruiter_id", " ");

        AssignmentFilter filter = ApiServer.parseFilter(query);

        assertThat(filter.getStatus()).isEqualTo(AssignmentStatus.SUPERSEDED);
        assertThat(filter.getPage()).isEqualTo(3);
        assertThat(filter.getPerPage()).isEqualTo(AssignmentFilter.DEFAULT_PER_PAGE);
        assertThat(filter.getRecruiterId()).isNull();

        query.put("status", "unknown");
        assertThatThrownBy(() -> ApiServer.parseFilter(query)).isInstanceOf(IllegalArgumentException.class);
    }

    private Response get(String path) throws IOException {
        return client.newCall(new Request.Builder().url(baseUrl + path).get().build()).execute();
    }

    private Response post(String path, String json) throws IOException {
        return client.newCall(new Request.Builder().url(baseUrl + path).post(RequestBody.create(json, JSON)).build())
                .execute();
    }

    private JsonNode body(Response response) throws IOException {
        return mapper.readTree(response.body().string());
    }
}
