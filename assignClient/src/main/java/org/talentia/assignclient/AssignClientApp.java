package org.talentia.assignclient;

import io.github.cdimascio.dotenv.Dotenv;
import org.talentia.assignclient.api.AllocationApiClient;
import org.talentia.assignclient.api.AllocationApiClientImpl;
import org.talentia.assignclient.api.AllocationApiException;
import org.talentia.engine.api.dto.AssignmentBatchResponseDto;
import org.talentia.engine.api.dto.AssignmentDto;
import org.talentia.engine.api.dto.AssignmentListResponseDto;
import org.talentia.engine.api.dto.PositionSuggestionsDto;
import org.talentia.engine.api.dto.PositionSuggestionsResponseDto;
import org.talentia.engine.api.dto.SuggestedRecruiterDto;
import org.talentia.engine.api.dto.SuggestionsResponseDto;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line client for the allocation engine.
 *
 * <pre>
 * assign &lt;position-id&gt;... [--force]
 * list [--position ID] [--recruiter ID] [--status S] [--page N] [--per-page N]
 * suggest [&lt;position-id&gt;] [--limit N] [--k N] [--interleave]
 * health
 * </pre>
 */
public class AssignClientApp {
    private static final Logger LOG = Logger.getLogger(AssignClientApp.class.getName());

    private static final String API_BASE_URL_KEY = "API_BASE_URL";
    private static final String DEFAULT_API_BASE_URL = "http://localhost:8090";

    static final int EXIT_OK = 0;
    static final int EXIT_API_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final AllocationApiClient api;
    private final PrintStream out;

    AssignClientApp(AllocationApiClient api, PrintStream out) {
        this.api = api;
        this.out = out;
    }

    public static void main(String[] args) {
        String apiBaseUrl = resolveApiBaseUrl();
        LOG.log(Level.FINE, "[AssignClient] Using API={0}", apiBaseUrl);
        int code = new AssignClientApp(new AllocationApiClientImpl(apiBaseUrl), System.out).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        List<String> rest = new ArrayList<>(Arrays.asList(args).subList(1, args.length));
        try {
            switch (args[0]) {
                case "assign":
                    return assign(rest);
                case "list":
                    return list(rest);
                case "suggest":
                    return suggest(rest);
                case "health":
                    return health();
                default:
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            printUsage();
            return EXIT_USAGE;
        } catch (AllocationApiException e) {
            out.println(e.getStatusCode() == AllocationApiException.NO_RESPONSE
                    ? "Error: " + e.getMessage()
                    : "Error (" + e.getStatusCode() + "): " + e.getMessage());
            if (!e.getDetails().isEmpty()) {
                out.println("Details: " + e.getDetails());
            }
            return EXIT_API_ERROR;
        }
    }

    private int assign(List<String> args) {
        boolean force = args.remove("--force");
        for (String arg : args) {
            if (arg.startsWith("--")) {
                throw new IllegalArgumentException("unknown option " + arg);
            }
        }
        if (args.isEmpty()) {
            throw new IllegalArgumentException("assign needs at least one position id");
        }

        AssignmentBatchResponseDto response = api.assign(args, force);
        out.println(response.getMessage());
        for (AssignmentDto assignment : response.getData()) {
            out.println(formatAssignment(assignment));
        }
        if (response.getWarning() != null) {
            out.println("Warning: " + response.getWarning());
        }
        return EXIT_OK;
    }

    private int list(List<String> args) {
        String position = takeOption(args, "--position");
        String recruiter = takeOption(args, "--recruiter");
        String status = takeOption(args, "--status");
        Integer page = parseOptionalInt(takeOption(args, "--page"), "--page");
        Integer perPage = parseOptionalInt(takeOption(args, "--per-page"), "--per-page");
        rejectLeftovers(args);

        AssignmentListResponseDto response = api.listAssignments(position, recruiter, status, page, perPage);
        for (AssignmentDto assignment : response.getData()) {
            out.println(formatAssignment(assignment));
        }
        out.println(String.format(Locale.ROOT, "Page %d, %d of %d assignment(s)",
                response.getMeta().getPage(), response.getData().size(), response.getMeta().getTotal()));
        return EXIT_OK;
    }

    private int suggest(List<String> args) {
        Integer limit = parseOptionalInt(takeOption(args, "--limit"), "--limit");
        Integer k = parseOptionalInt(takeOption(args, "--k"), "--k");
        boolean interleave = args.remove("--interleave");

        if (args.isEmpty()) {
            SuggestionsResponseDto response = api.getSuggestions(limit, interleave);
            for (PositionSuggestionsDto position : response.getData()) {
                printSuggestions(position);
            }
            out.println("Queues: " + response.getQueues());
            return EXIT_OK;
        }
        String positionId = args.remove(0);
        rejectLeftovers(args);
        PositionSuggestionsResponseDto response = api.getSuggestions(positionId, k);
        printSuggestions(response.getData());
        return EXIT_OK;
    }

    private int health() {
        boolean healthy = api.isHealthy();
        out.println(healthy ? "healthy" : "unavailable");
        return healthy ? EXIT_OK : EXIT_API_ERROR;
    }

    private void printSuggestions(PositionSuggestionsDto position) {
        out.println(String.format(Locale.ROOT, "%s %s [%s/%s] priority=%.2f queue=%s",
                position.getPositionId(), position.getTitle(), position.getPriority(), position.getZone(),
                position.getPriorityScore(), position.getQueue()));
        for (SuggestedRecruiterDto recruiter : position.getSuggestions()) {
            out.println(String.format(Locale.ROOT, "  -> %s %s score=%.4f load=%d/%d %s",
                    recruiter.getRecruiterId(), recruiter.getName(), recruiter.getScore(),
                    recruiter.getCurrentLoad(), recruiter.getCapacity(), recruiter.getExplanation()));
        }
    }

    static String formatAssignment(AssignmentDto assignment) {
        return String.format(Locale.ROOT, "%s -> %s (%s) score=%.4f status=%s",
                assignment.getPositionId(), assignment.getRecruiterId(), assignment.getRecruiterName(),
                assignment.getScore(), assignment.getStatus());
    }

    private static String takeOption(List<String> args, String name) {
        int index = args.indexOf(name);
        if (index < 0) {
            return null;
        }
        if (index + 1 >= args.size()) {
            throw new IllegalArgumentException(name + " needs a value");
        }
        String value = args.get(index + 1);
        args.subList(index, index + 2).clear();
        return value;
    }

    private static Integer parseOptionalInt(String value, String name) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    private static void rejectLeftovers(List<String> args) {
        if (!args.isEmpty()) {
            throw new IllegalArgumentException("unexpected argument " + args.get(0));
        }
    }

    private void printUsage() {
        out.println("Usage:");
        out.println("  assign <position-id>... [--force]");
        out.println("  list [--position ID] [--recruiter ID] [--status S] [--page N] [--per-page N]");
        out.println("  suggest [<position-id>] [--limit N] [--k N] [--interleave]");
        out.println("  health");
    }

    private static String resolveApiBaseUrl() {
        String fromEnv = System.getenv(API_BASE_URL_KEY);
        if (fromEnv != null && !fromEnv.trim().isEmpty()) {
            return fromEnv.trim();
        }

        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        String fromDotEnv = dotenv.get(API_BASE_URL_KEY);
        if (fromDotEnv != null && !fromDotEnv.trim().isEmpty()) {
            return fromDotEnv.trim();
        }

        Dotenv parentDotenv = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        String fromParent = parentDotenv.get(API_BASE_URL_KEY);
        if (fromParent != null && !fromParent.trim().isEmpty()) {
            return fromParent.trim();
        }

        return DEFAULT_API_BASE_URL;
    }
}
