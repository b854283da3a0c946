package com.socialintel.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolve and store group metadata for a list of identifiers (numeric ids or screen names),
 * typically uploaded from a file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessGroupsParameters(
        List<String> groupIdentifiers,
        String source,
        String originalFileName
) implements JobParameters {

    public ProcessGroupsParameters {
        groupIdentifiers = groupIdentifiers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(groupIdentifiers));
        source = source == null ? "manual" : source;
    }

    @Override
    public JobType type() {
        return JobType.PROCESS_GROUPS;
    }

    @Override
    public int seedGroupCount() {
        return groupIdentifiers.size();
    }

    @Override
    public Integer maxComments() {
        return null;
    }

    /** Identifiers as the API expects them, duplicates and unparseable lines removed. */
    @JsonIgnore
    public List<String> normalisedIdentifiers() {
        return groupIdentifiers.stream()
                .map(ProcessGroupsParameters::normalise)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    /**
     * Reduces a line from an upload to a bare identifier: {@code https://vk.com/club123} → {@code 123},
     * {@code vk.com/somegroup} → {@code somegroup}, {@code -123} → {@code 123}.
     *
     * @return the identifier, or null for a blank line
     */
    public static String normalise(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        int slash = value.lastIndexOf('/');
        if (slash >= 0) {
            value = value.substring(slash + 1);
        }
        Matcher numeric = NUMERIC_ALIAS.matcher(value);
        if (numeric.matches()) {
            return numeric.group(1);
        }
        return value;
    }

    private static final Pattern NUMERIC_ALIAS = Pattern.compile("(?:club|public|event|-)?(\\d+)");
}
