package com.socialintel.collector.service;

import com.socialintel.collector.model.AnalyzePostsParameters;
import com.socialintel.collector.model.FetchCommentsParameters;
import com.socialintel.collector.model.JobParameters;
import com.socialintel.collector.model.ProcessGroupsParameters;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-type checks on submitted parameters. Collects every violation instead of stopping at the first.
 */
@Component
public class JobParametersValidator {

    static final int MAX_GROUPS_PER_JOB = 1000;
    static final int MAX_IDENTIFIERS_PER_JOB = 10_000;
    static final int MAX_POSTS_PER_GROUP = 1000;
    static final int MAX_POST_URLS = 500;

    private static final Pattern SCREEN_NAME = Pattern.compile("[A-Za-z0-9_.]{1,64}");
    private static final Set<String> SOURCES = Set.of("file", "manual");
    private static final Set<String> ANALYSIS_TYPES = Set.of("sentiment", "keywords", "engagement");

    public void validate(JobParameters parameters) {
        List<String> violations = switch (parameters.type()) {
            case FETCH_COMMENTS -> validateFetchComments((FetchCommentsParameters) parameters);
            case PROCESS_GROUPS -> validateProcessGroups((ProcessGroupsParameters) parameters);
            case ANALYZE_POSTS -> validateAnalyzePosts((AnalyzePostsParameters) parameters);
        };
        if (!violations.isEmpty()) {
            throw new JobValidationException(violations);
        }
    }

    private List<String> validateFetchComments(FetchCommentsParameters p) {
        List<String> violations = new ArrayList<>();
        if (p.groupIds().isEmpty()) {
            violations.add("groupIds must not be empty");
        } else if (p.groupIds().size() > MAX_GROUPS_PER_JOB) {
            violations.add("groupIds must contain at most " + MAX_GROUPS_PER_JOB + " entries");
        }
        for (Long id : p.groupIds()) {
            if (id == null || id == 0) {
                violations.add("groupIds contains an empty id");
            }
        }
        if (p.postsPerGroup() != null && (p.postsPerGroup() < 1 || p.postsPerGroup() > MAX_POSTS_PER_GROUP)) {
            violations.add("postsPerGroup must be between 1 and " + MAX_POSTS_PER_GROUP);
        }
        checkCap(p.maxComments(), violations);
        if (p.filterWords().stream().anyMatch(w -> w == null || w.isBlank())) {
            violations.add("filterWords must not contain blank words");
        }
        return violations;
    }

    private List<String> validateProcessGroups(ProcessGroupsParameters p) {
        List<String> violations = new ArrayList<>();
        if (p.groupIdentifiers().isEmpty()) {
            violations.add("groupIdentifiers must not be empty");
        } else if (p.groupIdentifiers().size() > MAX_IDENTIFIERS_PER_JOB) {
            violations.add("groupIdentifiers must contain at most " + MAX_IDENTIFIERS_PER_JOB + " entries");
        }
        for (String identifier : p.groupIdentifiers()) {
            String normalised = ProcessGroupsParameters.normalise(identifier);
            if (normalised == null || !SCREEN_NAME.matcher(normalised).matches()) {
                violations.add("groupIdentifiers contains an invalid identifier: '" + identifier + "'");
            }
        }
        if (!SOURCES.contains(p.source())) {
            violations.add("source must be one of " + SOURCES);
        }
        return violations;
    }

    private List<String> validateAnalyzePosts(AnalyzePostsParameters p) {
        List<String> violations = new ArrayList<>();
        if (p.postUrls().isEmpty()) {
            violations.add("postUrls must not be empty");
        } else if (p.postUrls().size() > MAX_POST_URLS) {
            violations.add("postUrls must contain at most " + MAX_POST_URLS + " entries");
        }
        for (String url : p.postUrls()) {
            if (AnalyzePostsParameters.parse(url) == null) {
                violations.add("postUrls contains a value that is not a post reference: '" + url + "'");
            }
        }
        if (p.analysisType() == null || !ANALYSIS_TYPES.contains(p.analysisType())) {
            violations.add("analysisType must be one of " + ANALYSIS_TYPES);
        }
        checkCap(p.maxComments(), violations);
        return violations;
    }

    private static void checkCap(Integer maxComments, List<String> violations) {
        if (maxComments != null && maxComments < 1) {
            violations.add("maxComments must be positive when given");
        }
    }
}
