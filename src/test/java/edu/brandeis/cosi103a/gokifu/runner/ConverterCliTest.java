package edu.brandeis.cosi103a.gokifu.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gokifu.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConverterCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void run_noArgs_printsUsage() throws Exception {
        assertEquals(ConverterCli.EXIT_USAGE, run());
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }

    @Test
    void run_convertsAllFiles(@TempDir Path tempDir) throws Exception {
        Path gib = Fixtures.copyTo("handicap.gib", tempDir);

        assertEquals(ConverterCli.EXIT_OK, run(gib.toString()));
        assertTrue(Files.exists(tempDir.resolve("handicap.sgf")));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("1 converted, 0 failed"));
    }

    @Test
    void run_reportsFailuresAndWritesReport(@TempDir Path tempDir) throws Exception {
        Path good = Fixtures.copyTo("handicap.ngf", tempDir);
        Path bad = Files.writeString(tempDir.resolve("broken.ugf"), "[Data]\nDD,B1,1,0\n");
        Path report = tempDir.resolve("reports/run.json");

        int status = run(good.toString(), bad.toString(), "--report", report.toString(), "--threads", "2");

        assertEquals(ConverterCli.EXIT_FAILURES, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Conversion failed for " + bad));
        assertFalse(Files.exists(tempDir.resolve("broken.sgf")));

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals(1, json.get("converted").asInt());
        assertEquals(1, json.get("failed").asInt());
        assertEquals("CONVERTED", json.get("files").get(0).get("status").asText());
        assertEquals("FAILED", json.get("files").get(1).get("status").asText());
        assertTrue(json.get("files").get(1).get("output").isNull());
    }

    @Test
    void parseArgs_optionsAndInputs() {
        ConversionConfig config = ConverterCli.parseArgs(new String[]{
            "a.gib", "--output", "sgf", "b.ngf", "--threads", "3", "--report", "r.json"});

        assertEquals(List.of(Path.of("a.gib"), Path.of("b.ngf")), config.inputs());
        assertEquals(Optional.of(Path.of("sgf")), config.outputDir());
        assertEquals(Optional.of(Path.of("r.json")), config.report());
        assertEquals(3, config.threads());
    }

    @Test
    void parseArgs_defaults() {
        ConversionConfig config = ConverterCli.parseArgs(new String[]{"a.gib"});
        assertEquals(new ConversionConfig(List.of(Path.of("a.gib"))), config);
    }

    @Test
    void parseArgs_unknownOption_throws() {
        assertThrows(IllegalArgumentException.class, () -> ConverterCli.parseArgs(new String[]{"--bogus"}));
    }

    @Test
    void parseArgs_missingValue_throws() {
        assertThrows(IllegalArgumentException.class, () -> ConverterCli.parseArgs(new String[]{"a.gib", "--output"}));
    }

    @Test
    void parseArgs_badThreads_throws() {
        assertThrows(IllegalArgumentException.class,
            () -> ConverterCli.parseArgs(new String[]{"a.gib", "--threads", "many"}));
        assertThrows(IllegalArgumentException.class,
            () -> ConverterCli.parseArgs(new String[]{"a.gib", "--threads", "0"}));
    }

    @Test
    void run_optionsWithoutInputs_throws() {
        assertThrows(IllegalArgumentException.class, () -> run("--threads", "2"));
    }

    @Test
    void execute_badArguments_exitUsage() {
        assertEquals(ConverterCli.EXIT_USAGE, execute("a.gib", "--bogus"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown argument: --bogus"));
    }

    @Test
    void execute_unwritableReport_exitError(@TempDir Path tempDir) throws Exception {
        Path gib = Fixtures.copyTo("handicap.gib", tempDir);
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        int status = execute(gib.toString(), "--report", blocker.resolve("run.json").toString());

        assertEquals(ConverterCli.EXIT_ERROR, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Conversion run failed"));
        assertTrue(Files.exists(tempDir.resolve("handicap.sgf")));
    }

    private int execute(String... args) {
        return ConverterCli.execute(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) throws Exception {
        return ConverterCli.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }
}
