package com.socialintel.collector.output;

import com.opencsv.CSVWriter;
import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.CollectedComment;
import com.socialintel.collector.model.CollectedGroup;
import com.socialintel.collector.model.CollectedPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

/**
 * Writes collected content to CSV files.
 *
 * Output path pattern: {outputDir}/{jobId}_{kind}.csv
 * e.g. /data/output/0b6f..._comments.csv
 *
 * Files are appended to, so a job can flush the same kind more than once; the header is written
 * only when the file is created.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvContentWriter {

    static final String[] GROUP_HEADERS = {
            "job_id", "group_id", "name", "screen_name", "description",
            "is_closed", "members_count", "collected_at"
    };

    static final String[] POST_HEADERS = {
            "job_id", "owner_id", "post_id", "text", "published_at",
            "likes", "comment_count", "collected_at"
    };

    static final String[] COMMENT_HEADERS = {
            "job_id", "owner_id", "post_id", "comment_id", "author_id",
            "text", "published_at", "likes", "collected_at"
    };

    private final CollectorProperties properties;

    public void writeGroups(String jobId, List<CollectedGroup> groups) {
        write(jobId, "groups", GROUP_HEADERS, groups, g -> new String[]{
                g.getJobId(),
                str(g.getGroupId()),
                str(g.getName()),
                str(g.getScreenName()),
                str(g.getDescription()),
                str(g.isClosed()),
                str(g.getMembersCount()),
                str(g.getCollectedAt())
        });
    }

    public void writePosts(String jobId, List<CollectedPost> posts) {
        write(jobId, "posts", POST_HEADERS, posts, p -> new String[]{
                p.getJobId(),
                str(p.getOwnerId()),
                str(p.getPostId()),
                str(p.getText()),
                str(p.getPublishedAt()),
                str(p.getLikes()),
                str(p.getCommentCount()),
                str(p.getCollectedAt())
        });
    }

    public void writeComments(String jobId, List<CollectedComment> comments) {
        write(jobId, "comments", COMMENT_HEADERS, comments, c -> new String[]{
                c.getJobId(),
                str(c.getOwnerId()),
                str(c.getPostId()),
                str(c.getCommentId()),
                str(c.getAuthorId()),
                str(c.getText()),
                str(c.getPublishedAt()),
                str(c.getLikes()),
                str(c.getCollectedAt())
        });
    }

    public Path pathFor(String jobId, String kind) {
        return Paths.get(properties.getOutput().getCsv().getOutputDir())
                .resolve(String.format("%s_%s.csv", jobId, kind));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> void write(String jobId, String kind, String[] headers, List<T> rows, Function<T, String[]> toRow) {
        if (rows.isEmpty()) return;

        Path outputPath = pathFor(jobId, kind);
        ensureDirectory(outputPath.getParent());
        boolean newFile = !Files.exists(outputPath);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }
            for (T row : rows) {
                writer.writeNext(toRow.apply(row));
            }

            log.info("Written {} {} to CSV: {}", rows.size(), kind, outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private static void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
