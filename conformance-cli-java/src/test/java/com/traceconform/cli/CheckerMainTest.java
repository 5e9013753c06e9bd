package com.traceconform.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.traceconform.cli.io.JsonInputReader;
import com.traceconform.cli.output.ResultModel;
import com.traceconform.cli.request.CheckRequestReader;
import com.traceconform.core.SchemaException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckerMainTest {

    private static Path fixture(String name) throws Exception {
        return Path.of(CheckerMainTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(CheckerMain.UsageException.class, () -> CheckerMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(CheckerMain.UsageException.class, () -> CheckerMain.run(new String[]{"record"}));
    }

    @Test
    void missingRequestFlagThrowsUsageException() {
        assertThrows(CheckerMain.UsageException.class,
                () -> CheckerMain.run(new String[]{"check", "--output", "/tmp/out"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(CheckerMain.UsageException.class,
                () -> CheckerMain.run(new String[]{"check", "--request", "/tmp/r.json"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(CheckerMain.UsageException.class,
                () -> CheckerMain.run(new String[]{"check", "--request"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(CheckerMain.UsageException.class,
                () -> CheckerMain.run(new String[]{"check", "--foo", "bar"}));
    }

    @Test
    void temporalProfileCheckWritesPerCaseResults(@TempDir Path tmp) throws Exception {
        ResultModel.ResultRoot root = CheckerMain.run(new String[]{
                "check", "--request", fixture("request-temporal.json").toString(), "--output", tmp.toString()});

        assertEquals(List.of("c1", "c2", "c3"), root.cases.stream().map(c -> c.caseId).toList());
        assertEquals(List.of(true, false, true), root.cases.stream().map(c -> c.isFit).toList());

        ResultModel.TemporalDeviationEntry d = root.cases.get(1).temporalDeviations.get(0);
        assertEquals("A", d.source);
        assertEquals("B", d.target);
        assertEquals(86400.0, d.observedGap);
        assertEquals((86400.0 - 7200.0) / 1800.0, d.zetaScore, 1e-9);

        JsonObject meta = JsonParser.parseString(Files.readString(tmp.resolve("metadata.json"))).getAsJsonObject();
        assertEquals("temporal_profile", meta.get("check").getAsString());
        assertEquals(3, meta.get("caseCount").getAsInt());
        assertEquals(1, meta.get("deviatingCaseCount").getAsInt());
    }

    @Test
    void logSkeletonCheckWritesViolations(@TempDir Path tmp) throws Exception {
        ResultModel.ResultRoot root = CheckerMain.run(new String[]{
                "check", "--request", fixture("request-skeleton.json").toString(), "--output", tmp.toString()});

        assertEquals(3, root.cases.size());
        assertTrue(root.cases.get(0).isFit);
        assertTrue(root.cases.get(1).isFit);

        ResultModel.CaseResult c3 = root.cases.get(2);
        assertEquals("c3", c3.caseId);
        assertEquals(5, c3.constraintCount);
        assertEquals(List.of("equivalence", "never_together"), c3.violations.stream().map(v -> v.family).toList());
        assertEquals(0.6, c3.fitness, 1e-12);

        String json = Files.readString(tmp.resolve("conformance_result.json"));
        assertTrue(json.contains("\"never_together\""));
        assertFalse(json.contains("temporal_deviations"), "temporal fields are omitted for skeleton checks");
    }

    @Test
    void missingRequestFileFailsWithReadError(@TempDir Path tmp) {
        assertThrows(CheckRequestReader.RequestReadException.class, () -> CheckerMain.run(new String[]{
                "check", "--request", tmp.resolve("absent.json").toString(), "--output", tmp.toString()}));
    }

    @Test
    void customKeysMustExistInTable(@TempDir Path tmp) throws Exception {
        Files.copy(fixture("events.json"), tmp.resolve("events.json"));
        Files.copy(fixture("profile.json"), tmp.resolve("profile.json"));
        Path request = tmp.resolve("request.json");
        Files.writeString(request, """
            {
              "check": "temporal_profile",
              "log": "events.json",
              "temporal_profile": "profile.json",
              "timestamp_key": "time:complete"
            }
            """);

        SchemaException e = assertThrows(SchemaException.class, () -> CheckerMain.run(new String[]{
                "check", "--request", request.toString(), "--output", tmp.resolve("out").toString()}));
        assertEquals("time:complete", e.getField());
        assertFalse(Files.exists(tmp.resolve("out")), "no output on failure");
    }

    @Test
    void skeletonCheckDoesNotParseTimestamps(@TempDir Path tmp) throws Exception {
        Files.copy(fixture("skeleton.json"), tmp.resolve("skeleton.json"));
        Files.writeString(tmp.resolve("events.json"), """
            [
              {"case:concept:name": "c1", "concept:name": "A", "time:timestamp": "yesterday"},
              {"case:concept:name": "c1", "concept:name": "B", "time:timestamp": "today"},
              {"case:concept:name": "c1", "concept:name": "C", "time:timestamp": "today"}
            ]
            """);
        Path request = tmp.resolve("request.json");
        Files.writeString(request, """
            {"check": "log_skeleton", "log": "events.json", "log_skeleton": "skeleton.json"}
            """);

        ResultModel.ResultRoot root = CheckerMain.run(new String[]{
                "check", "--request", request.toString(), "--output", tmp.resolve("out").toString()});

        assertEquals(1, root.cases.size());
        assertTrue(root.cases.get(0).isFit);
    }

    @Test
    void temporalCheckRejectsMalformedTimestamps(@TempDir Path tmp) throws Exception {
        Files.copy(fixture("profile.json"), tmp.resolve("profile.json"));
        Files.writeString(tmp.resolve("events.json"), """
            [{"case:concept:name": "c1", "concept:name": "A", "time:timestamp": "yesterday"}]
            """);
        Path request = tmp.resolve("request.json");
        Files.writeString(request, """
            {"check": "temporal_profile", "log": "events.json", "temporal_profile": "profile.json"}
            """);

        assertThrows(JsonInputReader.InputReadException.class, () -> CheckerMain.run(new String[]{
                "check", "--request", request.toString(), "--output", tmp.resolve("out").toString()}));
    }
}
