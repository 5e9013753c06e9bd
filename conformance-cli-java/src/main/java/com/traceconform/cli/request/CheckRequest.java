package com.traceconform.cli.request;

import com.google.gson.annotations.SerializedName;
import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.temporal.TemporalProfileAnalyzer;

/**
 * Deserialized form of the request file passed with {@code --request}.
 * Paths are resolved against the directory holding the request file.
 */
public class CheckRequest {

    public static final String TEMPORAL_PROFILE = "temporal_profile";
    public static final String LOG_SKELETON = "log_skeleton";

    @SerializedName("check")
    private String check;

    @SerializedName("log")
    private String log;

    @SerializedName("temporal_profile")
    private String temporalProfile;

    @SerializedName("log_skeleton")
    private String logSkeleton;

    /** Tolerance multiplier for temporal profile checks (default: 1.0). */
    @SerializedName("zeta")
    private Double zeta;

    @SerializedName("activity_key")
    private String activityKey;

    @SerializedName("timestamp_key")
    private String timestampKey;

    @SerializedName("case_id_key")
    private String caseIdKey;

    public String getCheck()           { return check; }
    public String getLog()             { return log; }
    public String getTemporalProfile() { return temporalProfile; }
    public String getLogSkeleton()     { return logSkeleton; }
    public double getZeta()            { return zeta != null ? zeta : TemporalProfileAnalyzer.DEFAULT_ZETA; }
    public String getActivityKey() {
        return activityKey != null ? activityKey : ConformanceProperties.DEFAULT_ACTIVITY_KEY;
    }
    public String getTimestampKey() {
        return timestampKey != null ? timestampKey : ConformanceProperties.DEFAULT_TIMESTAMP_KEY;
    }
    public String getCaseIdKey() {
        return caseIdKey != null ? caseIdKey : ConformanceProperties.DEFAULT_CASE_ID_KEY;
    }

    /** Path of the model file the selected check needs. */
    public String getModelFile() {
        return TEMPORAL_PROFILE.equals(check) ? temporalProfile : logSkeleton;
    }
}
