package com.traceconform.core;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Trace;
import com.traceconform.core.temporal.TemporalDeviation;
import com.traceconform.core.temporal.TemporalProfile;
import com.traceconform.core.temporal.TemporalProfileAnalyzer;
import com.traceconform.core.temporal.TemporalStatistics;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.traceconform.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TemporalProfileAnalyzerTest {

    private final ConformanceProperties props = ConformanceProperties.defaults();

    private static TemporalProfile abProfile() {
        return TemporalProfile.builder().put("A", "B", 1.5, 0.5).build();
    }

    @Test
    void gapFarOutsideToleranceDeviates() {
        TemporalProfileAnalyzer analyzer = new TemporalProfileAnalyzer(abProfile(), 1.0);

        List<TemporalDeviation> deviations = analyzer.analyzeTrace(timed("A", 0, "B", 24), props);

        assertEquals(1, deviations.size());
        TemporalDeviation d = deviations.get(0);
        assertEquals("A", d.source());
        assertEquals("B", d.target());
        assertEquals(24.0, d.observedGap());
        assertEquals(0.5, d.allowedBound());
        assertEquals(1.5, d.expectedMean());
        assertEquals(45.0, d.zetaScore(), 1e-12);
    }

    @Test
    void gapWithinToleranceIsSilent() {
        TemporalProfileAnalyzer analyzer = new TemporalProfileAnalyzer(abProfile(), 1.0);
        assertTrue(analyzer.analyzeTrace(timed("A", 0, "B", 1.6), props).isEmpty());
    }

    @Test
    void widerZetaToleratesMore() {
        assertFalse(new TemporalProfileAnalyzer(abProfile(), 1.0).analyzeTrace(timed("A", 0, "B", 3.0), props).isEmpty());
        assertFalse(new TemporalProfileAnalyzer(abProfile(), 2.0).analyzeTrace(timed("A", 0, "B", 3.0), props).isEmpty());
        assertTrue(new TemporalProfileAnalyzer(abProfile(), 3.0).analyzeTrace(timed("A", 0, "B", 3.0), props).isEmpty());
    }

    @Test
    void zeroZetaToleratesOnlyTheMean() {
        TemporalProfileAnalyzer analyzer = new TemporalProfileAnalyzer(abProfile(), 0.0);

        List<TemporalDeviation> deviations = analyzer.analyzeTrace(timed("A", 0, "B", 1.6), props);
        assertEquals(1, deviations.size());
        assertEquals(0.0, deviations.get(0).allowedBound());
        assertTrue(analyzer.analyzeTrace(timed("A", 0, "B", 1.5), props).isEmpty());
    }

    @Test
    void gapExactlyOnBoundIsTolerated() {
        assertTrue(new TemporalProfileAnalyzer(abProfile(), 1.0).analyzeTrace(timed("A", 0, "B", 2.0), props).isEmpty());
    }

    @Test
    void nonAdjacentPairsAreChecked() {
        TemporalProfile profile = TemporalProfile.builder().put("A", "C", 10.0, 1.0).build();
        List<TemporalDeviation> deviations = new TemporalProfileAnalyzer(profile, 1.0)
                .analyzeTrace(timed("A", 0, "B", 1, "C", 2), props);

        assertEquals(1, deviations.size());
        assertEquals("C", deviations.get(0).target());
    }

    @Test
    void deviationsAreOrderedByLaterEventThenEarlier() {
        TemporalProfile profile = TemporalProfile.builder()
                .put("A", "B", 100.0, 0.0)
                .put("A", "C", 100.0, 0.0)
                .put("B", "C", 100.0, 0.0)
                .build();
        List<TemporalDeviation> deviations = new TemporalProfileAnalyzer(profile, 1.0)
                .analyzeTrace(timed("A", 0, "B", 1, "C", 2), props);

        assertEquals(List.of("A>B", "A>C", "B>C"),
                deviations.stream().map(d -> d.source() + ">" + d.target()).toList());
    }

    @Test
    void repeatedActivitiesReportEveryOccurrencePair() {
        List<TemporalDeviation> deviations = new TemporalProfileAnalyzer(abProfile(), 1.0)
                .analyzeTrace(timed("A", 0, "A", 5, "B", 10), props);
        assertEquals(2, deviations.size());
        assertEquals(10.0, deviations.get(0).observedGap());
        assertEquals(5.0, deviations.get(1).observedGap());
    }

    @Test
    void zeroStdevDemandsExactMean() {
        TemporalProfile exact = TemporalProfile.builder().put("A", "B", 2.0, 0.0).build();
        TemporalProfileAnalyzer analyzer = new TemporalProfileAnalyzer(exact, 5.0);

        assertTrue(analyzer.analyzeTrace(timed("A", 0, "B", 2), props).isEmpty());
        TemporalDeviation d = analyzer.analyzeTrace(timed("A", 0, "B", 3), props).get(0);
        assertEquals(Double.POSITIVE_INFINITY, d.zetaScore());
    }

    @Test
    void pairsWithoutProfileEntryAreIgnored() {
        assertTrue(new TemporalProfileAnalyzer(abProfile(), 0.0)
                .analyzeTrace(timed("B", 0, "A", 100), props).isEmpty());
    }

    @Test
    void instantsAreComparedInSeconds() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        TemporalProfile hour = TemporalProfile.builder().put("A", "B", 3600.0, 60.0).build();
        TemporalProfileAnalyzer analyzer = new TemporalProfileAnalyzer(hour, 1.0);

        assertTrue(analyzer.analyzeTrace(timed("A", start, "B", start.plusSeconds(3630)), props).isEmpty());
        assertEquals(1, analyzer.analyzeTrace(timed("A", start, "B", start.plusSeconds(7200)), props).size());
    }

    @Test
    void oneResultPerCaseInOrder() {
        EventLog log = EventLog.of(timed("A", 0, "B", 24), timed("A", 0, "B", 2), timed("C", 0));
        List<List<TemporalDeviation>> result = new TemporalProfileAnalyzer(abProfile(), 1.0).analyze(log, props);

        assertEquals(3, result.size());
        assertEquals(1, result.get(0).size());
        assertTrue(result.get(1).isEmpty());
        assertTrue(result.get(2).isEmpty());
    }

    @Test
    void missingTimestampIsSchemaError() {
        Trace untimed = trace("A", "B");
        SchemaException e = assertThrows(SchemaException.class,
                () -> new TemporalProfileAnalyzer(abProfile(), 1.0).analyzeTrace(untimed, props));
        assertEquals(TS, e.getField());
    }

    @Test
    void invalidZetaIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TemporalProfileAnalyzer(abProfile(), -0.1));
        assertThrows(IllegalArgumentException.class, () -> new TemporalProfileAnalyzer(abProfile(), Double.NaN));
    }

    @Test
    void negativeStdevIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TemporalStatistics(1.0, -1.0));
    }
}
