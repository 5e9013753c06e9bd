package com.traceconform.cli.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes a check result to conformance_result.json, plus metadata.json describing the run.
 * Cases keep log order, so identical inputs give identical result files.
 */
public class ResultSerializer {

    public static final String RESULT_FILE = "conformance_result.json";
    public static final String METADATA_FILE = "metadata.json";
    public static final String TOOL_VERSION = "0.1.0";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param root      result to write
     * @param outputDir directory to write into (created if absent)
     */
    public void write(ResultModel.ResultRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        Path resultPath = outputDir.resolve(RESULT_FILE);
        writeJson(root, resultPath);
        System.err.println("[conformance-cli] " + RESULT_FILE + " written: " + resultPath);

        long deviating = root.cases.stream().filter(c -> !c.isFit).count();
        var meta = new Metadata(root.check, root.cases.size(), deviating, TOOL_VERSION, Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        writeJson(meta, metaPath);
        System.err.println("[conformance-cli] " + METADATA_FILE + " written: " + metaPath);
    }

    private static void writeJson(Object value, Path path) {
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(value, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String check,
            int caseCount,
            long deviatingCaseCount,
            String toolVersion,
            String timestamp
    ) {}
}
