package com.socialintel.collector.output;

import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.config.CollectorProperties.Output.OutputMode;
import com.socialintel.collector.model.CollectedComment;
import com.socialintel.collector.model.CollectedGroup;
import com.socialintel.collector.model.CollectedPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes collected content to the configured sink(s): JDBC, CSV, or BOTH.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final JdbcContentWriter jdbcWriter;
    private final CsvContentWriter csvWriter;
    private final CollectorProperties properties;

    public void writeGroups(String jobId, List<CollectedGroup> groups) {
        switch (properties.getOutput().getMode()) {
            case JDBC -> jdbcWriter.writeGroups(groups);
            case CSV -> csvWriter.writeGroups(jobId, groups);
            case BOTH -> {
                jdbcWriter.writeGroups(groups);
                csvWriter.writeGroups(jobId, groups);
            }
        }
    }

    public void writePosts(String jobId, List<CollectedPost> posts) {
        switch (properties.getOutput().getMode()) {
            case JDBC -> jdbcWriter.writePosts(posts);
            case CSV -> csvWriter.writePosts(jobId, posts);
            case BOTH -> {
                jdbcWriter.writePosts(posts);
                csvWriter.writePosts(jobId, posts);
            }
        }
    }

    public void writeComments(String jobId, List<CollectedComment> comments) {
        switch (properties.getOutput().getMode()) {
            case JDBC -> jdbcWriter.writeComments(comments);
            case CSV -> csvWriter.writeComments(jobId, comments);
            case BOTH -> {
                jdbcWriter.writeComments(comments);
                csvWriter.writeComments(jobId, comments);
            }
        }
    }

    /** Creates the content tables unless output goes to CSV only. */
    public void ensureSchema() {
        if (properties.getOutput().getMode() == OutputMode.CSV) {
            log.info("Output mode is CSV; skipping content schema");
            return;
        }
        jdbcWriter.ensureSchema();
    }
}
