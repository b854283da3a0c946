package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of job the collector accepts. Each type binds its own parameter shape.
 */
public enum JobType {

    FETCH_COMMENTS("fetch_comments", FetchCommentsParameters.class),
    PROCESS_GROUPS("process_groups", ProcessGroupsParameters.class),
    ANALYZE_POSTS("analyze_posts", AnalyzePostsParameters.class);

    private final String wireName;
    private final Class<? extends JobParameters> parametersType;

    JobType(String wireName, Class<? extends JobParameters> parametersType) {
        this.wireName = wireName;
        this.parametersType = parametersType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends JobParameters> parametersType() {
        return parametersType;
    }

    /** Accepts either the wire name ({@code fetch_comments}) or the constant name. */
    @JsonCreator
    public static JobType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Job type is required");
        }
        String normalised = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(normalised) || t.name().equalsIgnoreCase(normalised))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job type: " + value));
    }
}
