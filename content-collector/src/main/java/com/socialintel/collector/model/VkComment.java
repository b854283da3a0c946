package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching a {@code wall.getComments} item.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VkComment {

    private Long id;

    @JsonProperty("from_id")
    private Long fromId;

    @JsonProperty("post_id")
    private Long postId;

    /** Unix seconds. */
    private Long date;

    private String text;

    private VkPost.Counter likes;

    @JsonProperty("reply_to_comment")
    private Long replyToComment;

    public long likeCount() {
        return likes != null && likes.getCount() != null ? likes.getCount() : 0;
    }
}
