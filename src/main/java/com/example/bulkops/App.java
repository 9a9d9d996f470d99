package com.example.bulkops;

import com.example.bulkops.checkpoint.Checkpoint;
import com.example.bulkops.checkpoint.CheckpointException;
import com.example.bulkops.checkpoint.CheckpointFilter;
import com.example.bulkops.checkpoint.CheckpointManager;
import com.example.bulkops.checkpoint.CheckpointStatus;
import com.example.bulkops.checkpoint.CheckpointStore;
import com.example.bulkops.checkpoint.CheckpointSummary;
import com.example.bulkops.checkpoint.ErrorRecord;
import com.example.bulkops.checkpoint.OperationConfig;
import com.example.bulkops.checkpoint.OperationType;
import com.example.bulkops.checkpoint.PruneCriteria;
import com.example.bulkops.checkpoint.PruneReport;
import com.example.bulkops.ratelimit.RateGovernor;
import com.example.bulkops.ratelimit.RateLimitSettings;
import com.example.bulkops.remote.EndpointDefinition;
import com.example.bulkops.remote.RemoteItemOperation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_RESUMABLE = 2;
    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  run <config.json> <operation> <input-file> [--output FILE] [--dry-run] [--batch-size N]",
            "  resume <config.json> <checkpoint-id>",
            "  list <config.json> [--type T] [--status S] [--env E]",
            "  details <config.json> <checkpoint-id>",
            "  delete <config.json> <checkpoint-id>",
            "  clean <config.json> (--all|--failed|--completed|--older-than DAYS) [--dry-run]");

    private final PrintStream out;
    private final UnaryOperator<String> environment;
    private final AtomicBoolean shutdownRequested;
    private final ObjectMapper mapper = CheckpointStore.defaultMapper();

    App(PrintStream out, UnaryOperator<String> environment, AtomicBoolean shutdownRequested) {
        this.out = out;
        this.environment = environment;
        this.shutdownRequested = shutdownRequested;
    }

    public static void main(String[] args) {
        AtomicBoolean shutdownRequested = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        // On Ctrl-C, let the engine persist the current batch before the JVM goes down.
        Thread hook = new Thread(() -> {
            shutdownRequested.set(true);
            try {
                finished.await(60, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "bulk-ops-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int exitCode;
        try {
            exitCode = new App(System.out, System::getenv, shutdownRequested).execute(args);
        } finally {
            finished.countDown();
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException alreadyShuttingDown) {
            return;
        }
        System.exit(exitCode);
    }

    int execute(String[] args) {
        if (args.length < 2) {
            LOGGER.error(USAGE);
            return EXIT_ERROR;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(2, args.length);
        try {
            BulkOpsConfig config = new ConfigLoader().load(Path.of(args[1]));
            CheckpointManager manager = new CheckpointManager(config.checkpointDirectory());
            switch (command) {
                case "run":
                    return run(config, manager, rest);
                case "resume":
                    return resume(config, manager, single(rest, "checkpoint-id"));
                case "list":
                    return list(manager, rest);
                case "details":
                    return details(manager, single(rest, "checkpoint-id"));
                case "delete":
                    return delete(manager, single(rest, "checkpoint-id"));
                case "clean":
                    return clean(manager, rest);
                default:
                    LOGGER.error("Unknown command: {}{}{}", command, System.lineSeparator(), USAGE);
                    return EXIT_ERROR;
            }
        } catch (CheckpointException ex) {
            LOGGER.error(ex.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException ex) {
            LOGGER.error("{}{}{}", ex.getMessage(), System.lineSeparator(), USAGE);
            return EXIT_ERROR;
        } catch (IOException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage(), ex);
            return EXIT_ERROR;
        }
    }

    private int run(BulkOpsConfig config, CheckpointManager manager, List<String> args) throws IOException {
        List<String> positional = new ArrayList<>();
        String outputFile = null;
        boolean dryRun = false;
        int batchSize = config.batchSize();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--output":
                    outputFile = valueAfter(args, i++, arg);
                    break;
                case "--dry-run":
                    dryRun = true;
                    break;
                case "--batch-size":
                    batchSize = parsePositive(valueAfter(args, i++, arg), arg);
                    break;
                default:
                    positional.add(arg);
            }
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException("run needs <operation> and <input-file>");
        }
        OperationType type = OperationType.fromValue(positional.get(0));
        Path inputFile = Path.of(positional.get(1));
        List<String> items = InputItems.read(inputFile);
        if (items.isEmpty()) {
            LOGGER.warn("No items found in {}", inputFile);
            return EXIT_OK;
        }
        OperationConfig operationConfig = OperationConfig.forEnvironment(config.environment())
                .withInputFile(inputFile.toString())
                .withOutputFile(outputFile)
                .withDryRun(dryRun)
                .withOperationName(type.value());
        CheckpointManager.requireOutputFile(type, operationConfig);

        LOGGER.info("Starting {} of {} items in {} (batch size {}{})", type.value(), items.size(),
                config.environment(), batchSize, dryRun ? ", dry run" : "");
        if (type.destructive() && !dryRun) {
            LOGGER.warn("{} changes {} records in {} and cannot be undone", type.value(), items.size(),
                    config.environment());
        }
        try (JsonLinesWriter<JsonNode> writer = exportWriter(config, operationConfig)) {
            BatchProcessor processor = processor(config, manager, type, operationConfig, writer);
            return exitCodeFor(processor.run(items, batchSize));
        }
    }

    private int resume(BulkOpsConfig config, CheckpointManager manager, String checkpointId) throws IOException {
        Checkpoint checkpoint = manager.require(checkpointId);
        OperationConfig operationConfig = checkpoint.config();
        try (JsonLinesWriter<JsonNode> writer = exportWriter(config, operationConfig)) {
            BatchProcessor processor = processor(config, manager, checkpoint.operationType(), operationConfig, writer);
            return exitCodeFor(processor.resume(checkpointId));
        }
    }

    private int list(CheckpointManager manager, List<String> args) throws IOException {
        OperationType type = null;
        CheckpointStatus status = null;
        String env = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--type":
                    type = OperationType.fromValue(valueAfter(args, i++, arg));
                    break;
                case "--status":
                    status = CheckpointStatus.fromValue(valueAfter(args, i++, arg));
                    break;
                case "--env":
                    env = valueAfter(args, i++, arg);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option for list: " + arg);
            }
        }
        List<Checkpoint> checkpoints = manager.list(new CheckpointFilter(type, status, env));
        if (checkpoints.isEmpty()) {
            out.println("No checkpoints found.");
            return EXIT_OK;
        }
        for (Checkpoint checkpoint : checkpoints) {
            CheckpointSummary summary = checkpoint.summary();
            out.printf("%s  %-20s %-9s %-6s %6.1f%%  %d/%d%s%n",
                    summary.id(),
                    summary.operationType().value(),
                    summary.status().value(),
                    summary.environment(),
                    summary.completionPercentage(),
                    summary.attemptedItems(),
                    summary.totalItems(),
                    summary.resumable() ? "  (resumable)" : "");
        }
        out.printf("%d checkpoint(s), %d bytes%n", checkpoints.size(), manager.totalSize());
        return EXIT_OK;
    }

    private int details(CheckpointManager manager, String checkpointId) throws IOException {
        Checkpoint checkpoint = manager.require(checkpointId);
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoint.summary()));
        List<ErrorRecord> errors = checkpoint.results().errors();
        if (!errors.isEmpty()) {
            out.println("Errors:");
            for (ErrorRecord error : errors) {
                out.printf("  %s %s%n", error.item() == null ? "(run)" : error.item(), error.message());
            }
        }
        if (checkpoint.resumable()) {
            out.println("Resume with: resume <config.json> " + checkpoint.id());
        }
        return EXIT_OK;
    }

    private int delete(CheckpointManager manager, String checkpointId) throws IOException {
        if (manager.delete(checkpointId)) {
            out.println("Deleted checkpoint " + checkpointId);
            return EXIT_OK;
        }
        out.println("Checkpoint not found: " + checkpointId);
        return EXIT_ERROR;
    }

    private int clean(CheckpointManager manager, List<String> args) throws IOException {
        PruneCriteria criteria = null;
        boolean dryRun = false;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--all":
                    criteria = PruneCriteria.all();
                    break;
                case "--failed":
                    criteria = PruneCriteria.failed();
                    break;
                case "--completed":
                    criteria = PruneCriteria.completed();
                    break;
                case "--older-than":
                    criteria = PruneCriteria.olderThan(parsePositive(valueAfter(args, i++, arg), arg));
                    break;
                case "--dry-run":
                    dryRun = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option for clean: " + arg);
            }
        }
        if (criteria == null) {
            throw new IllegalArgumentException("clean needs one of --all, --failed, --completed, --older-than DAYS");
        }
        PruneReport report = manager.prune(criteria, dryRun);
        if (report.dryRun()) {
            out.printf("Would delete %d checkpoint(s): %s%n", report.count(), String.join(", ", report.matchedIds()));
        } else {
            out.printf("Deleted %d checkpoint(s)%n", report.deletedCount());
        }
        return EXIT_OK;
    }

    private BatchProcessor processor(BulkOpsConfig config,
                                     CheckpointManager manager,
                                     OperationType type,
                                     OperationConfig operationConfig,
                                     JsonLinesWriter<JsonNode> writer) {
        EndpointDefinition endpoint = config.endpointFor(type).orElseThrow(() ->
                new IllegalArgumentException("No endpoint configured for operation " + type.value()));
        URI baseUrl = config.apiBaseUrl().orElseThrow(() ->
                new IllegalArgumentException("api.baseUrl is required to run operations"));
        String token = environment.apply(config.tokenEnvironmentVariable());
        if (token == null || token.isBlank()) {
            LOGGER.warn("Environment variable {} is not set; calling the API without a token",
                    config.tokenEnvironmentVariable());
        }
        HttpClient client = HttpClient.newBuilder().connectTimeout(config.apiTimeout()).build();
        RateLimitSettings settings = config.rateLimit();
        if (type.destructive() && !settings.conservative()) {
            settings = settings.withConservative(true);
        }
        RateGovernor governor = new RateGovernor(settings);
        ItemOperation operation = new RemoteItemOperation(client, baseUrl, token, endpoint, governor,
                operationConfig.dryRun(), config.apiTimeout(), mapper, writer);
        BatchListener progress = new BatchListener() {
            @Override
            public void beforeCheckpointSave(int batchNumber) throws IOException {
                if (writer != null) {
                    writer.flush();
                }
            }

            @Override
            public void batchFinished(int batchNumber, Checkpoint checkpoint) {
                LOGGER.info("Batch {}/{} saved: {}% complete; {}", batchNumber,
                        checkpoint.progress().totalBatches(),
                        String.format("%.1f", checkpoint.completionPercentage()), governor.statusSummary());
            }
        };
        return new BatchProcessor(manager, type, operationConfig, operation, config.itemValidator(),
                ShutdownSignal.when(shutdownRequested::get), progress);
    }

    private JsonLinesWriter<JsonNode> exportWriter(BulkOpsConfig config, OperationConfig operationConfig) {
        return operationConfig.outputFileIfSet()
                .map(file -> new JsonLinesWriter<JsonNode>(mapper, Path.of(file), config.exportBufferThreshold()))
                .orElse(null);
    }

    private static int exitCodeFor(Optional<String> stoppedAt) {
        return stoppedAt.isPresent() ? EXIT_RESUMABLE : EXIT_OK;
    }

    private static String single(List<String> args, String name) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one <" + name + ">");
        }
        return args.get(0);
    }

    private static String valueAfter(List<String> args, int index, String option) {
        if (index + 1 >= args.size()) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args.get(index + 1);
    }

    private static int parsePositive(String value, String option) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException(option + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(option + " must be a number: " + value, ex);
        }
    }
}
