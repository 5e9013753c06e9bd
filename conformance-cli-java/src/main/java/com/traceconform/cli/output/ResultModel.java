package com.traceconform.cli.output;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs written to conformance_result.json.
 * Fields that do not apply to the selected check stay null and are omitted.
 */
public final class ResultModel {

    private ResultModel() {}

    public static class ResultRoot {
        @SerializedName("check")        public String check;
        @SerializedName("activity_key") public String activityKey;
        @SerializedName("case_id_key")  public String caseIdKey;
        @SerializedName("zeta")         public Double zeta;
        @SerializedName("cases")        public List<CaseResult> cases;
    }

    public static class CaseResult {
        @SerializedName("case_id")             public String caseId;
        @SerializedName("is_fit")              public boolean isFit;
        @SerializedName("deviation_count")     public int deviationCount;
        @SerializedName("temporal_deviations") public List<TemporalDeviationEntry> temporalDeviations;
        @SerializedName("constraint_count")    public Integer constraintCount;
        @SerializedName("fitness")             public Double fitness;
        @SerializedName("violations")          public List<ViolationEntry> violations;
    }

    public static class TemporalDeviationEntry {
        @SerializedName("source")         public String source;
        @SerializedName("target")         public String target;
        @SerializedName("observed_gap")   public double observedGap;
        @SerializedName("expected_mean")  public double expectedMean;
        @SerializedName("expected_stdev") public double expectedStdev;
        @SerializedName("allowed_bound")  public double allowedBound;
        @SerializedName("zeta_score")     public double zetaScore;  // Infinity when stdev is 0
    }

    public static class ViolationEntry {
        @SerializedName("family")     public String family;
        @SerializedName("activities") public List<String> activities;
    }
}
