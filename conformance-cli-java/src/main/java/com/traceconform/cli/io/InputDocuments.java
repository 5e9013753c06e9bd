package com.traceconform.cli.io;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJOs for the temporal profile and log skeleton input files.
 */
public final class InputDocuments {

    private InputDocuments() {}

    public static class ProfileEntry {
        @SerializedName("source") public String source;
        @SerializedName("target") public String target;
        @SerializedName("mean")   public Double mean;
        @SerializedName("stdev")  public Double stdev;
    }

    public static class SkeletonDocument {
        @SerializedName("directly_follows")  public List<DirectlyFollowsEntry> directlyFollows;
        @SerializedName("always_before")     public List<List<String>> alwaysBefore;
        @SerializedName("always_after")      public List<List<String>> alwaysAfter;
        @SerializedName("equivalence")       public List<List<String>> equivalence;
        @SerializedName("never_together")    public List<List<String>> neverTogether;
        @SerializedName("activ_occurrences") public Map<String, List<Integer>> activOccurrences;
    }

    public static class DirectlyFollowsEntry {
        @SerializedName("source") public String source;
        @SerializedName("target") public String target;
        @SerializedName("min")    public Integer min;
        @SerializedName("max")    public Integer max;
    }
}
