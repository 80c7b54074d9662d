package com.scorebot.app;

import com.scorebot.config.Config;
import com.scorebot.config.PipelineSettings;
import com.scorebot.data.HttpMetricSource;
import com.scorebot.data.MetricSource;
import com.scorebot.db.Database;
import com.scorebot.db.MigrationRunner;
import com.scorebot.db.ScoreRecordDao;
import com.scorebot.db.ScoreStore;
import com.scorebot.db.UniverseDao;
import com.scorebot.model.Symbol;
import com.scorebot.runner.PipelineResult;
import com.scorebot.runner.ScoringPipeline;
import com.scorebot.universe.UniverseLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

public final class ScoreBotApplication {
    private static final Logger LOG = LogManager.getLogger(ScoreBotApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exit = new ScoreBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("scorebot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("scorebot", options);
            return EXIT_OK;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        RunRequest request;
        try {
            request = RunRequest.from(cmd, config);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            installLogRoutingIfNeeded(config);
            PipelineSettings settings = PipelineSettings.from(config);
            return execute(request, config, settings);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Scoring run interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private int execute(RunRequest request, Config config, PipelineSettings settings) throws Exception {
        Database database = null;
        if (!request.dryRun || request.universeFromDb) {
            database = Database.fromConfig(config);
            LOG.info("DB url={}, schema={}", database.maskedJdbcUrl(), database.schema());
            new MigrationRunner().run(database);
        }

        List<Symbol> universe = loadUniverse(request, config, database);
        if (universe.isEmpty()) {
            LOG.warn("Universe is empty, nothing to score");
            return EXIT_OK;
        }
        LOG.info("Universe loaded: symbols={} source={}", universe.size(),
                request.universeFromDb ? "db" : request.universePath);

        MetricSource source = new HttpMetricSource(config);
        ScoreStore store = request.dryRun ? null : new ScoreRecordDao(database);
        int workers = request.workers > 0 ? request.workers : settings.workers;

        PipelineResult result = new ScoringPipeline(settings, source, store).run(universe, request.asOfDate, workers);
        LOG.info("Run telemetry\n{}", result.telemetry.getSummary());
        if (!request.dryRun && result.summary.persistFailed > 0 && result.summary.persisted == 0) {
            LOG.error("No score records were written ({} failed)", result.summary.persistFailed);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private List<Symbol> loadUniverse(RunRequest request, Config config, Database database) throws Exception {
        int limit = Math.max(0, config.getInt("universe.limit", 0));
        List<Symbol> symbols;
        if (request.universeFromDb) {
            symbols = new UniverseDao(database).listActive(limit);
        } else {
            symbols = UniverseLoader.loadCsv(request.universePath);
        }
        if (limit > 0 && symbols.size() > limit) {
            return List.copyOf(symbols.subList(0, limit));
        }
        return symbols;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("universe").hasArg().argName("csv")
                .desc("Universe CSV file (ticker,sector,asset_type); defaults to universe.path").build());
        options.addOption(Option.builder().longOpt("universe-db")
                .desc("Load the universe from the symbols table (active = TRUE)").build());
        options.addOption(Option.builder().longOpt("as-of").hasArg().argName("yyyy-MM-dd")
                .desc("Score date; defaults to today in app.zone").build());
        options.addOption(Option.builder().longOpt("workers").hasArg().argName("n")
                .desc("Fetch workers; defaults to scan.workers, capped by memory").build());
        options.addOption(Option.builder().longOpt("dry-run")
                .desc("Score and log without writing to the database").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (ScoreBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("scorebot.log.dir", logDir.toAbsolutePath().toString());

                // Console appender must bind to the original streams before they are swapped.
                LogManager.getLogger(ScoreBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                LOG.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    /**
     * Parsed command line, resolved against config defaults.
     */
    static final class RunRequest {
        final boolean universeFromDb;
        final Path universePath;
        final LocalDate asOfDate;
        final int workers;
        final boolean dryRun;

        private RunRequest(boolean universeFromDb, Path universePath, LocalDate asOfDate, int workers, boolean dryRun) {
            this.universeFromDb = universeFromDb;
            this.universePath = universePath;
            this.asOfDate = asOfDate;
            this.workers = workers;
            this.dryRun = dryRun;
        }

        /**
         * @throws IllegalArgumentException for conflicting or malformed options
         */
        static RunRequest from(CommandLine cmd, Config config) {
            boolean fromDb = cmd.hasOption("universe-db");
            if (fromDb && cmd.hasOption("universe")) {
                throw new IllegalArgumentException("--universe and --universe-db are mutually exclusive");
            }
            Path path = null;
            if (!fromDb) {
                String raw = cmd.getOptionValue("universe");
                path = raw == null || raw.isBlank()
                        ? config.getPath("universe.path")
                        : config.workingDir().resolve(raw.trim()).normalize();
            }

            LocalDate asOf;
            String rawDate = cmd.getOptionValue("as-of");
            if (rawDate == null || rawDate.isBlank()) {
                asOf = LocalDate.now(ZoneId.of(config.getString("app.zone", "America/New_York")));
            } else {
                try {
                    asOf = LocalDate.parse(rawDate.trim());
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("--as-of must be yyyy-MM-dd, got: " + rawDate, e);
                }
            }

            int workers = 0;
            String rawWorkers = cmd.getOptionValue("workers");
            if (rawWorkers != null && !rawWorkers.isBlank()) {
                try {
                    workers = Integer.parseInt(rawWorkers.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("--workers must be an integer, got: " + rawWorkers, e);
                }
                if (workers < 1) {
                    throw new IllegalArgumentException("--workers must be >= 1");
                }
            }
            return new RunRequest(fromDb, path, asOf, workers, cmd.hasOption("dry-run"));
        }
    }
}
