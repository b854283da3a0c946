package com.socialintel.collector.model;

import lombok.Builder;

/**
 * Summary handed to the result store when a job reaches a terminal state.
 */
@Builder
public record JobResult(
        long groupsCollected,
        long postsCollected,
        long commentsCollected,
        int failedItems,
        long durationMs
) {}
