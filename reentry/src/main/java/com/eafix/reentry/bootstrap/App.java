package com.eafix.reentry.bootstrap;

import com.eafix.reentry.config.ReentrySettings;
import com.eafix.reentry.config.SettingsLoader;
import com.eafix.reentry.domain.common.InvalidConfigurationException;
import com.eafix.reentry.domain.common.ReentryException;
import com.eafix.reentry.domain.decision.DecisionContext;
import com.eafix.reentry.domain.decision.DecisionResponse;
import com.eafix.reentry.domain.hybrid.HybridId;
import com.eafix.reentry.domain.vocab.ReentryVocabulary;
import com.eafix.reentry.infrastructure.ledger.LedgerValidator;
import com.eafix.reentry.infrastructure.ledger.LedgerViolation;
import com.eafix.reentry.infrastructure.ledger.ValidationReport;
import com.eafix.reentry.service.codec.HybridIdCodec;
import com.eafix.reentry.util.Env;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Command-line entry point (NO Spring).
 *
 * <pre>
 * reentry [--config settings.json] process requests.json
 * reentry verify file-or-directory...
 * reentry [--config settings.json] parse ID
 * reentry [--config settings.json] hash ID
 * reentry [--config settings.json] compose OUTCOME DURATION PROXIMITY CALENDAR DIRECTION GENERATION [SUFFIX]
 * reentry [--config settings.json] vocab
 * </pre>
 *
 * Exit codes: 0 success, 1 validation failure, 2 usage or configuration error.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final String USAGE = """
        Usage:
          reentry [--config settings.json] process requests.json
          reentry verify file-or-directory...
          reentry [--config settings.json] parse ID
          reentry [--config settings.json] hash ID
          reentry [--config settings.json] compose OUTCOME DURATION PROXIMITY CALENDAR DIRECTION GENERATION [SUFFIX]
          reentry [--config settings.json] vocab
        """;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        String configPath = null;
        if (!rest.isEmpty() && "--config".equals(rest.get(0))) {
            if (rest.size() < 2) {
                err.print(USAGE);
                return EXIT_USAGE;
            }
            configPath = rest.get(1);
            rest = rest.subList(2, rest.size());
        }
        if (rest.isEmpty()) {
            err.print(USAGE);
            return EXIT_USAGE;
        }
        String command = rest.get(0);
        List<String> operands = rest.subList(1, rest.size());

        try {
            switch (command) {
                case "process":
                    return operands.size() == 1 ? process(configPath, Paths.get(operands.get(0)), out, err) : usage(err);
                case "verify":
                    return operands.isEmpty() ? usage(err) : verify(operands, out, err);
                case "parse":
                    return operands.size() == 1 ? parse(configPath, operands.get(0), out, err) : usage(err);
                case "hash":
                    return operands.size() == 1 ? hash(configPath, operands.get(0), out) : usage(err);
                case "compose":
                    return operands.size() == 6 || operands.size() == 7 ? compose(configPath, operands, out, err) : usage(err);
                case "vocab":
                    if (!operands.isEmpty()) {
                        return usage(err);
                    }
                    out.print(vocabulary(configPath).summary());
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    return usage(err);
            }
        } catch (InvalidConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            e.getProblems().forEach(p -> err.println("  - " + p));
            return EXIT_USAGE;
        } catch (ReentryException e) {
            err.println("Startup failed (" + e.reason() + "): " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static int usage(PrintStream err) {
        err.print(USAGE);
        return EXIT_USAGE;
    }

    private static int process(String configPath, Path requests, PrintStream out, PrintStream err) {
        List<DecisionContext> contexts;
        try {
            contexts = readRequests(requests);
        } catch (IOException e) {
            err.println("Cannot read requests from " + requests + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        ReentrySettings settings = SettingsLoader.resolve(configPath);
        boolean allAccepted = true;
        List<Object> results = new ArrayList<>();
        try (ReentryContext context = ReentryContext.create(settings)) {
            context.start();
            List<CompletableFuture<DecisionResponse>> futures = new ArrayList<>();
            for (DecisionContext request : contexts) {
                futures.add(context.executor().submit(request));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).join());
                } catch (CompletionException e) {
                    allAccepted = false;
                    results.add(failure(contexts.get(i), e.getCause()));
                }
            }
            if (Env.flag(Env.PRINT_METRICS)) {
                err.print(context.metrics().scrape());
            }
        }
        out.println(toJson(results));
        return allAccepted ? EXIT_OK : EXIT_INVALID;
    }

    private static List<DecisionContext> readRequests(Path requests) throws IOException {
        JsonNode root = MAPPER.readTree(Files.readString(requests));
        if (root.isArray()) {
            return MAPPER.convertValue(root, new TypeReference<List<DecisionContext>>() {});
        }
        return List.of(MAPPER.treeToValue(root, DecisionContext.class));
    }

    private static Map<String, Object> failure(DecisionContext request, Throwable cause) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "rejected");
        result.put("trade_id", request != null ? request.tradeId() : null);
        if (cause instanceof ReentryException) {
            ReentryException error = (ReentryException) cause;
            result.put("reason", error.reason());
            result.put("problems", error.getProblems());
        } else {
            log.error("Decision failed: {}", cause.getMessage(), cause);
            result.put("reason", "internal_error");
            result.put("problems", List.of(String.valueOf(cause.getMessage())));
        }
        return result;
    }

    private static int verify(List<String> paths, PrintStream out, PrintStream err) {
        LedgerValidator validator = new LedgerValidator();
        boolean allPassed = true;
        for (String path : paths) {
            Path target = Paths.get(path);
            if (!Files.exists(target)) {
                err.println("Cannot read " + path + ": no such file or directory");
                return EXIT_USAGE;
            }
            List<ValidationReport> reports;
            try {
                reports = Files.isDirectory(target)
                    ? validator.verifyDirectory(target)
                    : List.of(validator.verify(target));
            } catch (UncheckedIOException e) {
                log.warn("[App] Cannot read {}: {}", path, e.getCause().getMessage());
                err.println("Cannot read " + path + ": " + e.getCause().getMessage());
                allPassed = false;
                continue;
            }
            for (ValidationReport report : reports) {
                out.println(report.summary());
                for (LedgerViolation violation : report.violations()) {
                    out.println("  " + violation);
                }
                if (report.quarantine()) {
                    out.println("  -> quarantine");
                }
                allPassed &= report.passed();
            }
        }
        return allPassed ? EXIT_OK : EXIT_INVALID;
    }

    private static int parse(String configPath, String identifier, PrintStream out, PrintStream err) {
        HybridIdCodec codec = codec(configPath);
        try {
            HybridId id = codec.parse(identifier);
            if (!codec.validate(identifier)) {
                err.println("Identifier is well formed but not legal in the vocabulary: " + identifier);
                return EXIT_INVALID;
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("outcome", id.outcome());
            result.put("duration", id.duration());
            result.put("proximity", id.proximity());
            result.put("calendar", id.calendar());
            result.put("direction", id.direction());
            result.put("generation", id.generation());
            result.put("suffix", id.suffix());
            result.put("chain_position", codec.chainPosition(id.generation()).name());
            result.put("comment_hash", codec.commentHash(id.withoutSuffix()));
            out.println(toJson(result));
            return EXIT_OK;
        } catch (ReentryException e) {
            err.println(e.reason() + ": " + e.getMessage());
            return EXIT_INVALID;
        }
    }

    private static int hash(String configPath, String identifier, PrintStream out) {
        out.println(codec(configPath).commentHash(identifier));
        return EXIT_OK;
    }

    private static int compose(String configPath, List<String> operands, PrintStream out, PrintStream err) {
        int generation;
        try {
            generation = Integer.parseInt(operands.get(5));
        } catch (NumberFormatException e) {
            err.println("GENERATION must be an integer, got " + operands.get(5));
            return EXIT_USAGE;
        }
        String suffix = operands.size() == 7 ? operands.get(6) : null;
        try {
            HybridId id = codec(configPath).compose(operands.get(0), operands.get(1), operands.get(2),
                operands.get(3), operands.get(4), generation, suffix);
            out.println(id.value());
            return EXIT_OK;
        } catch (ReentryException e) {
            err.println(e.reason() + ": " + e.getMessage());
            e.getProblems().forEach(p -> err.println("  - " + p));
            return EXIT_INVALID;
        }
    }

    private static HybridIdCodec codec(String configPath) {
        return new HybridIdCodec(vocabulary(configPath));
    }

    private static ReentryVocabulary vocabulary(String configPath) {
        ReentrySettings settings = SettingsLoader.resolve(configPath);
        return settings.vocabularyFile() != null
            ? ReentryVocabulary.load(Paths.get(settings.vocabularyFile()))
            : ReentryVocabulary.defaults();
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render output", e);
        }
    }

    private App() {}
}
