package com.socialintel.collector.output;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.opencsv.CSVReader;
import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.CollectedComment;
import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies per-job CSV files, header handling and appending across flushes.
 */
class CsvContentWriterTest {

    @TempDir
    Path tempDir;

    private CollectorProperties properties;
    private CsvContentWriter writer;

    @BeforeEach
    void setUp() {
        properties = new CollectorProperties();
        properties.getOutput().getCsv().setOutputDir(tempDir.resolve("out").toString());
        writer = new CsvContentWriter(properties);
    }

    @Test
    void writeComments_createsFileWithHeaderAndAppendsLaterFlushes() throws Exception {
        writer.writeComments("job-1", List.of(comment("job-1", 1, "first, with comma")));
        writer.writeComments("job-1", List.of(comment("job-1", 2, "second \"quoted\"")));

        List<String[]> rows = read(writer.pathFor("job-1", "comments"));
        assertEquals(3, rows.size());
        assertArrayEquals(CsvContentWriter.COMMENT_HEADERS, rows.get(0));
        assertEquals("first, with comma", rows.get(1)[5]);
        assertEquals("second \"quoted\"", rows.get(2)[5]);
        assertEquals("2", rows.get(2)[3]);
    }

    @Test
    void writeComments_withoutHeaderWhenDisabled() throws Exception {
        properties.getOutput().getCsv().setIncludeHeader(false);

        writer.writeComments("job-2", List.of(comment("job-2", 1, "x")));

        List<String[]> rows = read(writer.pathFor("job-2", "comments"));
        assertEquals(1, rows.size());
        assertEquals("job-2", rows.get(0)[0]);
    }

    @Test
    void writeComments_emptyBatchCreatesNoFile() {
        writer.writeComments("job-3", List.of());

        assertFalse(Files.exists(writer.pathFor("job-3", "comments")));
    }

    private static CollectedComment comment(String jobId, long id, String text) {
        return CollectedComment.builder()
                .jobId(jobId)
                .ownerId(-1)
                .postId(10)
                .commentId(id)
                .authorId(100L)
                .text(text)
                .publishedAt(Instant.parse("2024-04-01T00:00:00Z"))
                .likes(3)
                .collectedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    private static List<String[]> read(Path path) throws Exception {
        try (CSVReader reader = new CSVReader(new FileReader(path.toFile(), StandardCharsets.UTF_8))) {
            return reader.readAll();
        }
    }
}
