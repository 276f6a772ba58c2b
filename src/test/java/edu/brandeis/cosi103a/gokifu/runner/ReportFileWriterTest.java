package edu.brandeis.cosi103a.gokifu.runner;

import edu.brandeis.cosi103a.gokifu.ParseFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportFileWriterTest {

    @Test
    void write_thenRead_restoresReport(@TempDir Path tempDir) throws Exception {
        ConversionReport report = ConversionReport.of(List.of(
            FileOutcome.converted(Path.of("a.gib"), "GIB", Path.of("a.sgf")),
            FileOutcome.failed(Path.of("b.ngf"), new ParseFailureException("No moves found in NGF record"))));
        Path target = tempDir.resolve("report.json");

        ReportFileWriter writer = new ReportFileWriter();
        writer.write(report, target);

        assertEquals(report, writer.read(target));
        assertFalse(Files.exists(tempDir.resolve("report.json.tmp")));
    }

    @Test
    void write_replacesExistingReport(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("report.json");
        Files.writeString(target, "old");

        new ReportFileWriter().write(ConversionReport.of(List.of()), target);

        String json = Files.readString(target);
        assertTrue(json.contains("\"converted\" : 0"));
        assertTrue(json.contains("\"files\" : [ ]"));
    }

    @Test
    void write_keepsOutcomeFieldOrder(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("report.json");
        new ReportFileWriter().write(ConversionReport.of(List.of(
            FileOutcome.converted(Path.of("a.gib"), "GIB", Path.of("a.sgf")))), target);

        String json = Files.readString(target);
        int input = json.indexOf("\"input\"");
        int status = json.indexOf("\"status\"");
        int format = json.indexOf("\"format\"");
        int output = json.indexOf("\"output\"");
        int error = json.indexOf("\"error\"");
        assertTrue(input < status && status < format && format < output && output < error, json);
        assertTrue(json.contains("\"error\" : null"));
    }

    @Test
    void of_countsOutcomes() {
        ConversionReport report = ConversionReport.of(List.of(
            FileOutcome.converted(Path.of("a.gib"), "GIB", Path.of("a.sgf")),
            FileOutcome.failed(Path.of("b.gib"), new IllegalStateException()),
            FileOutcome.failed(Path.of("c.gib"), new IllegalStateException("boom"))));

        assertEquals(1, report.converted());
        assertEquals(2, report.failed());
        assertEquals("IllegalStateException", report.files().get(1).error().orElseThrow());
    }
}
