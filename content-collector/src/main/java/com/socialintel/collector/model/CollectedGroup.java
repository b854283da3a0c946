package com.socialintel.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Group row as persisted for a job. Keyed by the external id within the owning job.
 */
@Value
@Builder
public class CollectedGroup {

    String jobId;
    long groupId;
    String name;
    String screenName;
    String description;
    boolean closed;
    Long membersCount;
    Instant collectedAt;

    public static CollectedGroup from(String jobId, VkGroup group, Instant collectedAt) {
        return CollectedGroup.builder()
                .jobId(jobId)
                .groupId(Math.abs(group.getId()))
                .name(group.getName())
                .screenName(group.getScreenName())
                .description(group.getDescription())
                .closed(group.getIsClosed() != null && group.getIsClosed() != 0)
                .membersCount(group.getMembersCount())
                .collectedAt(collectedAt)
                .build();
    }

    /** Owner id of the group's wall; the external API addresses group walls with negative ids. */
    public long wallOwnerId() {
        return -groupId;
    }
}
