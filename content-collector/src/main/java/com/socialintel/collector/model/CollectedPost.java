package com.socialintel.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Post row as persisted for a job.
 */
@Value
@Builder
public class CollectedPost {

    String jobId;
    long ownerId;
    long postId;
    String text;
    Instant publishedAt;
    long likes;
    /** Comment count reported by the API when the post was listed. */
    long commentCount;
    Instant collectedAt;

    public static CollectedPost from(String jobId, long ownerId, VkPost post, Instant collectedAt) {
        return CollectedPost.builder()
                .jobId(jobId)
                .ownerId(ownerId)
                .postId(post.getId())
                .text(post.getText() == null ? "" : post.getText())
                .publishedAt(post.getDate() == null ? null : Instant.ofEpochSecond(post.getDate()))
                .likes(post.likeCount())
                .commentCount(post.commentCount())
                .collectedAt(collectedAt)
                .build();
    }

    public String key() {
        return ownerId + "_" + postId;
    }
}
