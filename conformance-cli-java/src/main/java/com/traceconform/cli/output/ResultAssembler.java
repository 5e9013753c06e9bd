package com.traceconform.cli.output;

import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Trace;
import com.traceconform.core.skeleton.SkeletonConformanceResult;
import com.traceconform.core.skeleton.SkeletonViolation;
import com.traceconform.core.temporal.TemporalDeviation;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs per-case analysis results with the case ids of the log they were computed on.
 */
public final class ResultAssembler {

    private ResultAssembler() {}

    public static List<ResultModel.CaseResult> temporal(EventLog cases, String caseIdKey,
                                                        List<List<TemporalDeviation>> deviations) {
        requireSameSize(cases, deviations);
        List<ResultModel.CaseResult> out = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            List<ResultModel.TemporalDeviationEntry> entries = new ArrayList<>();
            for (TemporalDeviation d : deviations.get(i)) {
                ResultModel.TemporalDeviationEntry e = new ResultModel.TemporalDeviationEntry();
                e.source = d.source();
                e.target = d.target();
                e.observedGap = d.observedGap();
                e.expectedMean = d.expectedMean();
                e.expectedStdev = d.expectedStdev();
                e.allowedBound = d.allowedBound();
                e.zetaScore = d.zetaScore();
                entries.add(e);
            }
            ResultModel.CaseResult c = newCase(cases.get(i), caseIdKey, entries.size());
            c.temporalDeviations = entries;
            out.add(c);
        }
        return out;
    }

    public static List<ResultModel.CaseResult> skeleton(EventLog cases, String caseIdKey,
                                                        List<SkeletonConformanceResult> results) {
        requireSameSize(cases, results);
        List<ResultModel.CaseResult> out = new ArrayList<>(cases.size());
        for (int i = 0; i < cases.size(); i++) {
            SkeletonConformanceResult r = results.get(i);
            List<ResultModel.ViolationEntry> violations = new ArrayList<>();
            for (SkeletonViolation v : r.violations()) {
                ResultModel.ViolationEntry e = new ResultModel.ViolationEntry();
                e.family = v.family().key();
                e.activities = v.activities();
                violations.add(e);
            }
            ResultModel.CaseResult c = newCase(cases.get(i), caseIdKey, r.deviationCount());
            c.constraintCount = r.constraintCount();
            c.fitness = r.fitness();
            c.violations = violations;
            out.add(c);
        }
        return out;
    }

    private static ResultModel.CaseResult newCase(Trace trace, String caseIdKey, int deviationCount) {
        ResultModel.CaseResult c = new ResultModel.CaseResult();
        Object caseId = trace.attributes().get(caseIdKey);
        c.caseId = caseId != null ? String.valueOf(caseId) : null;
        c.deviationCount = deviationCount;
        c.isFit = deviationCount == 0;
        return c;
    }

    private static void requireSameSize(EventLog cases, List<?> results) {
        if (cases.size() != results.size()) {
            throw new IllegalStateException(results.size() + " results for " + cases.size() + " cases");
        }
    }
}
