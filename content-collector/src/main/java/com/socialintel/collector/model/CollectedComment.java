package com.socialintel.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Comment row as persisted for a job.
 */
@Value
@Builder
public class CollectedComment {

    String jobId;
    long ownerId;
    long postId;
    long commentId;
    Long authorId;
    String text;
    Instant publishedAt;
    long likes;
    Instant collectedAt;

    public static CollectedComment from(String jobId, long ownerId, long postId, VkComment comment,
                                        Instant collectedAt) {
        return CollectedComment.builder()
                .jobId(jobId)
                .ownerId(ownerId)
                .postId(postId)
                .commentId(comment.getId())
                .authorId(comment.getFromId())
                .text(comment.getText() == null ? "" : comment.getText())
                .publishedAt(comment.getDate() == null ? null : Instant.ofEpochSecond(comment.getDate()))
                .likes(comment.likeCount())
                .collectedAt(collectedAt)
                .build();
    }

    public String key() {
        return ownerId + "_" + postId + "_" + commentId;
    }
}
