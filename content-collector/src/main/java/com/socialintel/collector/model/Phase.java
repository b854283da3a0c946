package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three sequential stages of a job. Later phases consume identifiers found by earlier ones.
 */
public enum Phase {
    GROUPS,
    POSTS,
    COMMENTS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
