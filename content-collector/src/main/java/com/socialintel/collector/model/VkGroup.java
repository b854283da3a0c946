package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the {@code groups.getById} item structure.
 * Kept separate from the stored model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VkGroup {

    private Long id;

    private String name;

    @JsonProperty("screen_name")
    private String screenName;

    private String description;

    private String type;

    @JsonProperty("is_closed")
    private Integer isClosed;

    @JsonProperty("members_count")
    private Long membersCount;

    /** Present when the group is banned or deleted. */
    private String deactivated;
}
