package com.traceconform.cli.request;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class CheckRequestReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates a request file.
     *
     * @throws RequestReadException if the file is missing, malformed, names an unknown check or lacks
     *                              the inputs its check needs
     */
    public CheckRequest read(Path requestPath) {
        if (!Files.exists(requestPath)) {
            throw new RequestReadException("Request file not found: " + requestPath);
        }
        CheckRequest request;
        try (Reader reader = Files.newBufferedReader(requestPath, StandardCharsets.UTF_8)) {
            request = GSON.fromJson(reader, CheckRequest.class);
        } catch (NoSuchFileException e) {
            throw new RequestReadException("Request file not found: " + requestPath, e);
        } catch (IOException | JsonParseException e) {
            throw new RequestReadException("Failed to read request: " + requestPath + ": " + e.getMessage(), e);
        }
        if (request == null) {
            throw new RequestReadException("Request file is empty or invalid JSON: " + requestPath);
        }
        validate(request, requestPath);
        return request;
    }

    private static void validate(CheckRequest request, Path requestPath) {
        String check = request.getCheck();
        if (check == null) {
            throw new RequestReadException("Request has no \"check\": " + requestPath);
        }
        if (!check.equals(CheckRequest.TEMPORAL_PROFILE) && !check.equals(CheckRequest.LOG_SKELETON)) {
            throw new RequestReadException("Unknown check \"" + check + "\" (expected "
                    + CheckRequest.TEMPORAL_PROFILE + " or " + CheckRequest.LOG_SKELETON + ")");
        }
        if (request.getLog() == null) {
            throw new RequestReadException("Request has no \"log\": " + requestPath);
        }
        if (request.getModelFile() == null) {
            throw new RequestReadException("Check " + check + " needs \"" + check + "\" in " + requestPath);
        }
    }

    public static class RequestReadException extends RuntimeException {
        public RequestReadException(String message) { super(message); }
        public RequestReadException(String message, Throwable cause) { super(message, cause); }
    }
}
