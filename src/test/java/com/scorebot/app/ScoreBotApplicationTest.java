package com.scorebot.app;

import com.scorebot.config.Config;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreBotApplicationTest {
    private static final Path WORKDIR = Path.of("/tmp/scorebot-test").toAbsolutePath();

    @Test
    void run_shouldReturnZeroForHelp() {
        assertEquals(ScoreBotApplication.EXIT_OK, new ScoreBotApplication().run(new String[]{"--help"}));
    }

    @Test
    void run_shouldReturnUsageForUnknownOption() {
        assertEquals(ScoreBotApplication.EXIT_USAGE, new ScoreBotApplication().run(new String[]{"--bogus"}));
    }

    @Test
    void run_shouldReturnUsageForConflictingUniverseOptions() {
        assertEquals(ScoreBotApplication.EXIT_USAGE,
                new ScoreBotApplication().run(new String[]{"--universe", "u.csv", "--universe-db"}));
    }

    @Test
    void run_shouldReturnUsageForMalformedDateOrWorkers() {
        assertEquals(ScoreBotApplication.EXIT_USAGE,
                new ScoreBotApplication().run(new String[]{"--as-of", "03/02/2026"}));
        assertEquals(ScoreBotApplication.EXIT_USAGE,
                new ScoreBotApplication().run(new String[]{"--workers", "0"}));
        assertEquals(ScoreBotApplication.EXIT_USAGE,
                new ScoreBotApplication().run(new String[]{"--workers", "many"}));
    }

    @Test
    void runRequest_shouldResolveExplicitOptions() throws ParseException {
        CommandLine cmd = parse("--universe", "lists/sp500.csv", "--as-of", "2026-03-02", "--workers", "6", "--dry-run");

        ScoreBotApplication.RunRequest request = ScoreBotApplication.RunRequest.from(cmd, Config.ofOverrides(WORKDIR, Map.of()));

        assertFalse(request.universeFromDb);
        assertEquals(WORKDIR.resolve("lists/sp500.csv").normalize(), request.universePath);
        assertEquals(LocalDate.of(2026, 3, 2), request.asOfDate);
        assertEquals(6, request.workers);
        assertTrue(request.dryRun);
    }

    @Test
    void runRequest_shouldFallBackToConfigDefaults() throws ParseException {
        Config config = Config.ofOverrides(WORKDIR, Map.of("universe.path", "data/universe.csv"));

        ScoreBotApplication.RunRequest request = ScoreBotApplication.RunRequest.from(parse(), config);

        assertEquals(WORKDIR.resolve("data/universe.csv").normalize(), request.universePath);
        assertNotNull(request.asOfDate);
        assertEquals(0, request.workers);
        assertFalse(request.dryRun);
    }

    @Test
    void runRequest_shouldSkipPathWhenUniverseComesFromDatabase() throws ParseException {
        ScoreBotApplication.RunRequest request = ScoreBotApplication.RunRequest.from(
                parse("--universe-db"), Config.ofOverrides(WORKDIR, Map.of()));

        assertTrue(request.universeFromDb);
        assertNull(request.universePath);
    }

    @Test
    void runRequest_shouldRejectConflicts() throws ParseException {
        CommandLine cmd = parse("--universe", "a.csv", "--universe-db");
        assertThrows(IllegalArgumentException.class,
                () -> ScoreBotApplication.RunRequest.from(cmd, Config.ofOverrides(WORKDIR, Map.of())));
    }

    private static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(ScoreBotApplication.buildOptions(), args);
    }
}
