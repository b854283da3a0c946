package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Answer to a status query: bounded percentage plus the raw counters behind it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(
        String jobId,
        JobType type,
        JobStatus status,
        Phase phase,
        int percentage,
        Metrics counters,
        String error,
        List<String> warnings,
        JobResult result
) {}
