package com.socialintel.collector.output;

import com.socialintel.collector.model.CollectedComment;
import com.socialintel.collector.model.CollectedGroup;
import com.socialintel.collector.model.CollectedPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Writes collected content to relational tables, one row per external id and job.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcContentWriter {

    private static final int BATCH_SIZE = 1000;
    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring content schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collected_groups
            (
                job_id          VARCHAR(36)   NOT NULL,
                group_id        BIGINT        NOT NULL,
                name            VARCHAR(512),
                screen_name     VARCHAR(128),
                description     CLOB,
                is_closed       BOOLEAN       NOT NULL,
                members_count   BIGINT,
                collected_at    TIMESTAMP     NOT NULL,
                PRIMARY KEY (job_id, group_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collected_posts
            (
                job_id          VARCHAR(36)   NOT NULL,
                owner_id        BIGINT        NOT NULL,
                post_id         BIGINT        NOT NULL,
                text            CLOB,
                published_at    TIMESTAMP,
                likes           BIGINT        NOT NULL,
                comment_count   BIGINT        NOT NULL,
                collected_at    TIMESTAMP     NOT NULL,
                PRIMARY KEY (job_id, owner_id, post_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS collected_comments
            (
                job_id          VARCHAR(36)   NOT NULL,
                owner_id        BIGINT        NOT NULL,
                post_id         BIGINT        NOT NULL,
                comment_id      BIGINT        NOT NULL,
                author_id       BIGINT,
                text            CLOB,
                published_at    TIMESTAMP,
                likes           BIGINT        NOT NULL,
                collected_at    TIMESTAMP     NOT NULL,
                PRIMARY KEY (job_id, owner_id, post_id, comment_id)
            )
        """);

        log.info("Content schema ready.");
    }

    public void writeGroups(List<CollectedGroup> groups) {
        if (groups.isEmpty()) return;
        jdbcTemplate.batchUpdate("""
                INSERT INTO collected_groups
                (job_id, group_id, name, screen_name, description, is_closed, members_count, collected_at)
                VALUES (?,?,?,?,?,?,?,?)
                """, groups, BATCH_SIZE, (ps, g) -> {
            ps.setString(1, g.getJobId());
            ps.setLong(2, g.getGroupId());
            ps.setString(3, g.getName());
            ps.setString(4, g.getScreenName());
            ps.setString(5, g.getDescription());
            ps.setBoolean(6, g.isClosed());
            ps.setObject(7, g.getMembersCount());
            ps.setTimestamp(8, timestamp(g.getCollectedAt()));
        });
        log.info("Wrote {} groups", groups.size());
    }

    public void writePosts(List<CollectedPost> posts) {
        if (posts.isEmpty()) return;
        jdbcTemplate.batchUpdate("""
                INSERT INTO collected_posts
                (job_id, owner_id, post_id, text, published_at, likes, comment_count, collected_at)
                VALUES (?,?,?,?,?,?,?,?)
                """, posts, BATCH_SIZE, (ps, p) -> {
            ps.setString(1, p.getJobId());
            ps.setLong(2, p.getOwnerId());
            ps.setLong(3, p.getPostId());
            ps.setString(4, p.getText());
            ps.setTimestamp(5, timestamp(p.getPublishedAt()));
            ps.setLong(6, p.getLikes());
            ps.setLong(7, p.getCommentCount());
            ps.setTimestamp(8, timestamp(p.getCollectedAt()));
        });
        log.info("Wrote {} posts", posts.size());
    }

    public void writeComments(List<CollectedComment> comments) {
        if (comments.isEmpty()) return;
        jdbcTemplate.batchUpdate("""
                INSERT INTO collected_comments
                (job_id, owner_id, post_id, comment_id, author_id, text, published_at, likes, collected_at)
                VALUES (?,?,?,?,?,?,?,?,?)
                """, comments, BATCH_SIZE, (ps, c) -> {
            ps.setString(1, c.getJobId());
            ps.setLong(2, c.getOwnerId());
            ps.setLong(3, c.getPostId());
            ps.setLong(4, c.getCommentId());
            ps.setObject(5, c.getAuthorId());
            ps.setString(6, c.getText());
            ps.setTimestamp(7, timestamp(c.getPublishedAt()));
            ps.setLong(8, c.getLikes());
            ps.setTimestamp(9, timestamp(c.getCollectedAt()));
        });
        log.info("Wrote {} comments", comments.size());
    }

    public int countComments(String jobId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM collected_comments WHERE job_id = ?", Integer.class, jobId);
        return count == null ? 0 : count;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
