package com.traceconform.cli;

import com.traceconform.cli.io.JsonInputReader;
import com.traceconform.cli.output.ResultAssembler;
import com.traceconform.cli.output.ResultModel;
import com.traceconform.cli.output.ResultSerializer;
import com.traceconform.cli.request.CheckRequest;
import com.traceconform.cli.request.CheckRequestReader;
import com.traceconform.core.ConformanceChecker;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.EventTable;
import com.traceconform.core.log.Logs;
import com.traceconform.core.skeleton.LogSkeleton;
import com.traceconform.core.skeleton.SkeletonConformanceResult;
import com.traceconform.core.temporal.TemporalDeviation;
import com.traceconform.core.temporal.TemporalProfile;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point for the engine-free checks (temporal profile and log skeleton).
 *
 * Usage:
 *   java -jar conformance-cli-java.jar check \
 *     --request <path-to-request.json> \
 *     --output  <output-dir>
 */
public class CheckerMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[conformance-cli] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar conformance-cli-java.jar check --request <path> --output <dir>");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[conformance-cli] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static ResultModel.ResultRoot run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("check")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String requestPath = null;
        String outputDir = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--request" -> requestPath = requireNext(args, i++, "--request");
                case "--output"  -> outputDir   = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (requestPath == null) throw new UsageException("--request is required");
        if (outputDir == null)   throw new UsageException("--output is required");

        Path requestFile = Paths.get(requestPath).toAbsolutePath();
        Path output = Paths.get(outputDir);

        System.err.println("[conformance-cli] Reading request: " + requestFile);
        CheckRequest request = new CheckRequestReader().read(requestFile);
        Path baseDir = requestFile.getParent();

        JsonInputReader inputs = new JsonInputReader();
        // Only the temporal check reads timestamps; skeleton checks keep the column as raw strings.
        String parsedTimestampKey = CheckRequest.TEMPORAL_PROFILE.equals(request.getCheck())
                ? request.getTimestampKey() : null;
        EventTable table = inputs.readEventTable(baseDir.resolve(request.getLog()), parsedTimestampKey);
        System.err.println("[conformance-cli] Loaded " + table.rows().size() + " events");

        ConformanceChecker checker = new ConformanceChecker(ConformanceEngines.none())
                .withKeys(request.getActivityKey(), request.getTimestampKey(), request.getCaseIdKey());

        ResultModel.ResultRoot root = new ResultModel.ResultRoot();
        root.check = request.getCheck();
        root.activityKey = request.getActivityKey();
        root.caseIdKey = request.getCaseIdKey();

        Path modelFile = baseDir.resolve(request.getModelFile());
        if (CheckRequest.TEMPORAL_PROFILE.equals(request.getCheck())) {
            TemporalProfile profile = inputs.readTemporalProfile(modelFile);
            System.err.println("[conformance-cli] Checking " + profile.size() + " activity pairs, zeta="
                    + request.getZeta());
            List<List<TemporalDeviation>> deviations =
                    checker.temporalProfileConformance(table, profile, request.getZeta());
            root.zeta = request.getZeta();
            root.cases = ResultAssembler.temporal(cases(table, request), request.getCaseIdKey(), deviations);
        } else {
            LogSkeleton skeleton = inputs.readLogSkeleton(modelFile);
            System.err.println("[conformance-cli] Checking " + skeleton.constraintCount() + " skeleton constraints");
            List<SkeletonConformanceResult> results = checker.logSkeletonConformance(table, skeleton);
            root.cases = ResultAssembler.skeleton(cases(table, request), request.getCaseIdKey(), results);
        }

        System.err.println("[conformance-cli] Writing output to: " + output);
        new ResultSerializer().write(root, output);
        System.err.println("[conformance-cli] Done.");
        return root;
    }

    /** The table grouped the same way the checker groups it, for case ids. */
    private static EventLog cases(EventTable table, CheckRequest request) {
        return Logs.toEventLog(table, request.getCaseIdKey());
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
