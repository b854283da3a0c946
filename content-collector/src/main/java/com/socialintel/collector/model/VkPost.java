package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching a {@code wall.get} item.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VkPost {

    private Long id;

    @JsonProperty("owner_id")
    private Long ownerId;

    @JsonProperty("from_id")
    private Long fromId;

    /** Unix seconds. */
    private Long date;

    private String text;

    private Counter likes;

    private Counter comments;

    public long commentCount() {
        return comments != null && comments.getCount() != null ? comments.getCount() : 0;
    }

    public long likeCount() {
        return likes != null && likes.getCount() != null ? likes.getCount() : 0;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Counter {
        private Long count;
    }
}
