package org.talentia.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.talentia.engine.api.JsonSupport;
import org.talentia.engine.config.EngineConfig;
import org.talentia.engine.domain.model.ScoringWeights;
import org.talentia.engine.domain.service.AssignmentOrchestrator;
import org.talentia.engine.domain.service.AssignmentOrchestratorImpl;
import org.talentia.engine.domain.service.CapacityReservationCoordinator;
import org.talentia.engine.domain.service.FitScorerImpl;
import org.talentia.engine.domain.service.Messages;
import org.talentia.engine.domain.service.PriorityClassifierImpl;
import org.talentia.engine.domain.service.RecommendationRanker;
import org.talentia.engine.domain.service.RecommendationRankerImpl;
import org.talentia.engine.domain.service.RedistributionService;
import org.talentia.engine.domain.service.RedistributionServiceImpl;
import org.talentia.engine.domain.service.SuggestionService;
import org.talentia.engine.domain.service.SuggestionServiceImpl;
import org.talentia.engine.http.ApiServer;
import org.talentia.engine.repository.PositionRepository;
import org.talentia.engine.repository.RecruiterRepository;
import org.talentia.engine.repository.jdbc.DatabaseFactory;
import org.talentia.engine.repository.jdbc.JdbcAssignmentRepository;
import org.talentia.engine.repository.jdbc.JdbcAuditLogRepository;
import org.talentia.engine.repository.jdbc.JdbcCapacityReservationCoordinator;
import org.talentia.engine.repository.jdbc.JdbcPositionRepository;
import org.talentia.engine.repository.jdbc.JdbcRecruiterRepository;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the allocation engine.
 *
 * The engine assigns open positions to recruiters by fit score while keeping
 * every recruiter within capacity, and serves the result over HTTP.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Talentia Allocation Engine ===");

        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        configureLogging(config);

        // Persistence
        DataSource dataSource = DatabaseFactory.dataSource(config.getDbUrl(), config.getDbUser(), config.getDbPassword());
        if (config.isInitSchema()) {
            DatabaseFactory.initSchema(dataSource);
        }
        JdbcTemplate jdbcTemplate = DatabaseFactory.jdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = DatabaseFactory.transactionTemplate(dataSource);
        ObjectMapper objectMapper = JsonSupport.objectMapper();
        Clock clock = Clock.systemUTC();

        RecruiterRepository recruiterRepository =
                new JdbcRecruiterRepository(jdbcTemplate, config.getDefaultRecruiterCapacity());
        PositionRepository positionRepository = new JdbcPositionRepository(jdbcTemplate, transactionTemplate);
        CapacityReservationCoordinator coordinator = new JdbcCapacityReservationCoordinator(
                jdbcTemplate, transactionTemplate, clock, config.getDefaultRecruiterCapacity());

        // Services
        Messages messages = new Messages(config.getLocale());
        RecommendationRanker ranker = new RecommendationRankerImpl(new FitScorerImpl(ScoringWeights.defaults(), messages));
        AssignmentOrchestrator orchestrator = new AssignmentOrchestratorImpl.Builder()
                .recruiterRepository(recruiterRepository)
                .positionRepository(positionRepository)
                .assignmentRepository(new JdbcAssignmentRepository(jdbcTemplate, transactionTemplate, objectMapper))
                .auditLogRepository(new JdbcAuditLogRepository(jdbcTemplate, objectMapper))
                .ranker(ranker)
                .coordinator(coordinator)
                .messages(messages)
                .clock(clock)
                .build();
        SuggestionService suggestionService = new SuggestionServiceImpl(positionRepository, recruiterRepository,
                new PriorityClassifierImpl(messages), ranker, messages, config.getSuggestionCount(), clock);

        RedistributionService redistributionService = new RedistributionServiceImpl(recruiterRepository, messages);

        ApiServer apiServer = new ApiServer(config.getHttpPort(), config.getHttpThreads(),
                orchestrator, suggestionService, redistributionService, messages, config.getSuggestionCount());
        apiServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            apiServer.stop();
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Allocation Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: GET http://localhost:" + apiServer.getPort() + "/health");
        LOG.info(() -> "  - Assign: POST http://localhost:" + apiServer.getPort() + "/assignments");
        LOG.info(() -> "  - List: GET http://localhost:" + apiServer.getPort() + "/assignments");
        LOG.info(() -> "  - Suggestions: GET http://localhost:" + apiServer.getPort() + "/positions/suggestions");
        LOG.info(() -> "  - Redistribution: GET http://localhost:" + apiServer.getPort() + "/recruiters/redistribution");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
