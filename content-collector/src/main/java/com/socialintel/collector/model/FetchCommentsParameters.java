package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collect posts and their comments from a set of groups.
 *
 * @param groupIds      external group ids (positive)
 * @param postsPerGroup how many of the latest posts to read per group; default applies when null
 * @param maxComments   optional cap on comments collected by the whole job
 * @param filterWords   optional; when present only comments containing one of the words are kept
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchCommentsParameters(
        List<Long> groupIds,
        Integer postsPerGroup,
        Integer maxComments,
        List<String> filterWords
) implements JobParameters {

    public static final int DEFAULT_POSTS_PER_GROUP = 10;

    public FetchCommentsParameters {
        // null elements survive binding so validation can name them
        groupIds = groupIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(groupIds));
        filterWords = filterWords == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(filterWords));
    }

    @Override
    public JobType type() {
        return JobType.FETCH_COMMENTS;
    }

    @Override
    public int seedGroupCount() {
        return groupIds.size();
    }

    @JsonIgnore
    public int effectivePostsPerGroup() {
        return postsPerGroup != null ? postsPerGroup : DEFAULT_POSTS_PER_GROUP;
    }
}
