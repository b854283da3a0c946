package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collect the comments of explicitly referenced posts so they can be analysed downstream.
 * Post URLs carry the owner and post id, e.g. {@code https://vk.com/wall-1_42}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzePostsParameters(
        List<String> postUrls,
        String analysisType,
        Integer maxComments
) implements JobParameters {

    public static final Pattern POST_REFERENCE = Pattern.compile("wall(-?\\d+)_(\\d+)");

    public AnalyzePostsParameters {
        postUrls = postUrls == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(postUrls));
    }

    @Override
    public JobType type() {
        return JobType.ANALYZE_POSTS;
    }

    @Override
    public int seedGroupCount() {
        return (int) postReferences().stream().map(PostReference::ownerId).distinct().count();
    }

    /** Parsed (owner, post) pairs; URLs that do not parse are skipped here and rejected at submission. */
    @JsonIgnore
    public List<PostReference> postReferences() {
        return postUrls.stream()
                .map(AnalyzePostsParameters::parse)
                .filter(ref -> ref != null)
                .distinct()
                .toList();
    }

    public static PostReference parse(String url) {
        if (url == null) {
            return null;
        }
        Matcher m = POST_REFERENCE.matcher(url);
        if (!m.find()) {
            return null;
        }
        try {
            return new PostReference(Long.parseLong(m.group(1)), Long.parseLong(m.group(2)));
        } catch (NumberFormatException e) {
            // id too large for a long
            return null;
        }
    }

    public record PostReference(long ownerId, long postId) {}
}
