package com.socialintel.collector.model;

/**
 * Typed job parameters. There is exactly one implementation per {@link JobType};
 * {@link #type()} is the tag that ties a parameter record to its job type.
 */
public interface JobParameters {

    JobType type();

    /** Number of group identifiers the job starts from, used to seed progress estimates. */
    int seedGroupCount();

    /** Per-job cap on collected comments, or {@code null} when uncapped. */
    Integer maxComments();
}
