package com.socialintel.collector.model;

import java.time.Instant;

/**
 * One entry of a job's error log: the phase and item that failed, and why.
 */
public record JobError(Phase phase, String item, String message, Instant timestamp) {}
