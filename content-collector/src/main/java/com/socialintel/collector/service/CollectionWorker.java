package com.socialintel.collector.service;

import com.socialintel.collector.client.ApiException;
import com.socialintel.collector.client.VkApiClient;
import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.AnalyzePostsParameters;
import com.socialintel.collector.model.AnalyzePostsParameters.PostReference;
import com.socialintel.collector.model.CollectedComment;
import com.socialintel.collector.model.CollectedGroup;
import com.socialintel.collector.model.CollectedPost;
import com.socialintel.collector.model.FetchCommentsParameters;
import com.socialintel.collector.model.Job;
import com.socialintel.collector.model.JobResult;
import com.socialintel.collector.model.JobStatus;
import com.socialintel.collector.model.Page;
import com.socialintel.collector.model.Phase;
import com.socialintel.collector.model.PhaseCounters;
import com.socialintel.collector.model.ProcessGroupsParameters;
import com.socialintel.collector.model.VkComment;
import com.socialintel.collector.model.VkGroup;
import com.socialintel.collector.model.VkPost;
import com.socialintel.collector.output.OutputRouter;
import com.socialintel.collector.store.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Runs one job through its phases: groups → posts → comments.
 *
 * Phases run strictly in order. Inside a phase the items (group batches, groups, posts) fan out on
 * the shared phase pool and the phase joins them before the next one starts. An item that fails with
 * a classified API error is logged on the job and the phase goes on; the job fails on a systemic
 * error, when too many items of one phase fail, or when no group could be resolved. A cancelled job
 * stops starting work, lets calls in flight finish and keeps what it already collected.
 */
@Service
@Slf4j
public class CollectionWorker {

    private final JobRepository jobRepository;
    private final VkApiClient apiClient;
    private final OutputRouter outputRouter;
    private final ProgressCalculator progressCalculator;
    private final CancellationRegistry cancellations;
    private final CollectorProperties properties;
    private final Clock clock;
    private final ExecutorService phaseExecutor;

    public CollectionWorker(JobRepository jobRepository,
                            VkApiClient apiClient,
                            OutputRouter outputRouter,
                            ProgressCalculator progressCalculator,
                            CancellationRegistry cancellations,
                            CollectorProperties properties,
                            Clock clock,
                            @Qualifier("phaseExecutor") ExecutorService phaseExecutor) {
        this.jobRepository = jobRepository;
        this.apiClient = apiClient;
        this.outputRouter = outputRouter;
        this.progressCalculator = progressCalculator;
        this.cancellations = cancellations;
        this.properties = properties;
        this.clock = clock;
        this.phaseExecutor = phaseExecutor;
    }

    /**
     * Claims and runs a queued job. Jobs that are gone or no longer PENDING are skipped, so a job id
     * delivered twice runs once.
     */
    public void process(String jobId) {
        Optional<Job> loaded = jobRepository.findById(jobId);
        if (loaded.isEmpty()) {
            log.warn("Job {} not found, skipping", jobId);
            return;
        }
        Job job = loaded.get();
        if (job.getStatus() != JobStatus.PENDING) {
            log.info("Job {} is {}, skipping", jobId, job.getStatus());
            return;
        }

        Duration deadline = properties.getWorker().getJobDeadline();
        CancellationToken token = new CancellationToken(clock,
                deadline == null ? null : clock.instant().plus(deadline));
        // registered before the claim so a cancel arriving in between still reaches the run
        cancellations.register(jobId, token);
        try {
            Instant now = clock.instant();
            if (!jobRepository.compareAndSetStatus(jobId, JobStatus.PENDING, JobStatus.PROCESSING, now)) {
                log.info("Job {} was claimed or cancelled before it started, skipping", jobId);
                return;
            }
            job.transitionTo(JobStatus.PROCESSING, now);
            run(new JobRun(job, token));
        } finally {
            cancellations.remove(jobId);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void run(JobRun run) {
        Job job = run.job;
        log.info("Starting {} job {} (priority {})", job.getType().wireName(), job.getId(), job.getPriority());

        PhaseCounters counters = job.getCounters();
        counters.setEstimatedCommentsPerPost(progressCalculator.getAvgCommentsPerPost());
        counters.setTotal(Phase.COMMENTS, progressCalculator.estimateTotal(job.getParameters()));
        publishProgress(job);

        JobStatus outcome;
        try {
            switch (job.getType()) {
                case FETCH_COMMENTS -> fetchComments(run, (FetchCommentsParameters) job.getParameters());
                case PROCESS_GROUPS -> processGroups(run, (ProcessGroupsParameters) job.getParameters());
                case ANALYZE_POSTS -> analyzePosts(run, (AnalyzePostsParameters) job.getParameters());
            }
            outcome = run.token.isCancelled() ? JobStatus.CANCELLED : JobStatus.COMPLETED;
        } catch (JobFailedException e) {
            log.error("Job {} failed: {}", job.getId(), e.getMessage(), e);
            job.fail(e.getMessage());
            outcome = JobStatus.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.token.cancel("worker interrupted");
            outcome = JobStatus.CANCELLED;
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly: {}", job.getId(), e.getMessage(), e);
            job.fail("Unexpected error: " + e.getMessage());
            outcome = JobStatus.FAILED;
        }

        finish(run, outcome);
    }

    private void fetchComments(JobRun run, FetchCommentsParameters params) throws InterruptedException {
        List<String> ids = params.groupIds().stream().map(id -> String.valueOf(Math.abs(id))).distinct().toList();
        runGroupsPhase(run, ids);
        if (stopped(run)) return;
        requireResolvedGroups(run);

        runPostsPhase(run, params.effectivePostsPerGroup());
        if (stopped(run)) return;

        List<CollectedPost> withComments = run.content.posts().stream()
                .filter(p -> p.getCommentCount() > 0)
                .toList();
        runCommentsPhase(run, withComments, params.filterWords());
    }

    private void processGroups(JobRun run, ProcessGroupsParameters params) throws InterruptedException {
        runGroupsPhase(run, params.normalisedIdentifiers());
        if (stopped(run)) return;
        requireResolvedGroups(run);
    }

    private void analyzePosts(JobRun run, AnalyzePostsParameters params) throws InterruptedException {
        List<PostReference> refs = params.postReferences();
        List<String> groupIds = refs.stream()
                .map(PostReference::ownerId)
                .filter(owner -> owner < 0)
                .map(owner -> String.valueOf(-owner))
                .distinct()
                .toList();
        runGroupsPhase(run, groupIds);
        if (stopped(run)) return;

        // the referenced posts are known up front; nothing to page through
        Job job = run.job;
        job.enterPhase(Phase.POSTS);
        job.getCounters().setTotal(Phase.POSTS, refs.size());
        job.getCounters().addProcessed(Phase.POSTS, refs.size());
        publishProgress(job);

        Instant now = clock.instant();
        List<CollectedPost> posts = refs.stream()
                .map(ref -> CollectedPost.builder()
                        .jobId(job.getId())
                        .ownerId(ref.ownerId())
                        .postId(ref.postId())
                        .text("")
                        .collectedAt(now)
                        .build())
                .toList();
        runCommentsPhase(run, posts, List.of());
    }

    /**
     * Resolves identifiers in API-sized batches. Missing, deactivated and closed groups are noted on
     * the job; closed groups are stored but their walls are not read.
     */
    private void runGroupsPhase(JobRun run, List<String> identifiers) throws InterruptedException {
        Job job = run.job;
        job.enterPhase(Phase.GROUPS);
        job.getCounters().setTotal(Phase.GROUPS, identifiers.size());
        publishProgress(job);

        int batchSize = properties.getApi().getGroupsBatchSize();
        PhaseTaskGroup tasks = newTaskGroup(run, Phase.GROUPS);
        for (int i = 0; i < identifiers.size(); i += batchSize) {
            List<String> batch = identifiers.subList(i, Math.min(i + batchSize, identifiers.size()));
            tasks.fork(batchLabel(batch), () -> {
                try {
                    resolveBatch(run, tasks, batch);
                } finally {
                    job.getCounters().addProcessed(Phase.GROUPS, batch.size());
                    publishProgress(job);
                }
            });
        }
        endPhase(run, tasks.join());
        outputRouter.writeGroups(job.getId(), run.content.drainGroups());
    }

    private void resolveBatch(JobRun run, PhaseTaskGroup tasks, List<String> batch) {
        Job job = run.job;
        List<VkGroup> found = apiClient.listGroups(batch, tasks::isStopping);
        Instant now = clock.instant();
        for (String requested : batch) {
            if (found.stream().noneMatch(g -> matches(g, requested))) {
                job.recordError(Phase.GROUPS, requested, "Group not found", now);
            }
        }
        for (VkGroup group : found) {
            if (group.getDeactivated() != null) {
                job.recordError(Phase.GROUPS, String.valueOf(group.getId()),
                        "Group is " + group.getDeactivated(), now);
                continue;
            }
            CollectedGroup collected = CollectedGroup.from(job.getId(), group, now);
            run.content.addGroup(collected);
            if (collected.isClosed()) {
                job.recordError(Phase.GROUPS, String.valueOf(collected.getGroupId()),
                        "Group is closed; wall not readable", now);
            }
        }
    }

    private void runPostsPhase(JobRun run, int postsPerGroup) throws InterruptedException {
        Job job = run.job;
        List<CollectedGroup> open = run.content.groups().stream()
                .filter(g -> !g.isClosed())
                .toList();
        job.enterPhase(Phase.POSTS);
        job.getCounters().setTotal(Phase.POSTS, (long) open.size() * postsPerGroup);
        publishProgress(job);

        PhaseTaskGroup tasks = newTaskGroup(run, Phase.POSTS);
        for (CollectedGroup group : open) {
            tasks.fork("group " + group.getGroupId(), () -> readWall(run, tasks, group, postsPerGroup));
        }
        endPhase(run, tasks.join());
        outputRouter.writePosts(job.getId(), run.content.drainPosts());

        // real comment counts replace the a-priori estimate
        List<CollectedPost> posts = run.content.posts();
        long comments = posts.stream().mapToLong(CollectedPost::getCommentCount).sum();
        Integer cap = job.getParameters().maxComments();
        job.getCounters().setTotal(Phase.COMMENTS, cap != null && cap > 0 ? Math.min(comments, cap) : comments);
        if (!posts.isEmpty()) {
            job.getCounters().setEstimatedCommentsPerPost((int) Math.round((double) comments / posts.size()));
        }
        publishProgress(job);
    }

    private void readWall(JobRun run, PhaseTaskGroup tasks, CollectedGroup group, int limit) {
        Job job = run.job;
        long fetched = 0;
        try {
            Integer offset = 0;
            while (offset != null && fetched < limit && !tasks.isStopping()) {
                Page<VkPost> page = apiClient.listPosts(group.wallOwnerId(), offset, tasks::isStopping);
                Instant now = clock.instant();
                List<VkPost> items = page.items().subList(0, (int) Math.min(page.items().size(), limit - fetched));
                for (VkPost post : items) {
                    run.content.addPost(CollectedPost.from(job.getId(), group.wallOwnerId(), post, now));
                }
                fetched += items.size();
                job.getCounters().addProcessed(Phase.POSTS, items.size());
                publishProgress(job);
                offset = page.nextOffset();
            }
        } finally {
            // seeded with the full quota; a shorter wall or a stop lowers it
            job.getCounters().addToTotal(Phase.POSTS, fetched - limit);
            publishProgress(job);
        }
    }

    private void runCommentsPhase(JobRun run, List<CollectedPost> posts, List<String> filterWords)
            throws InterruptedException {
        Job job = run.job;
        job.enterPhase(Phase.COMMENTS);
        publishProgress(job);

        List<String> words = filterWords.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> w.toLowerCase(Locale.ROOT))
                .toList();
        PhaseTaskGroup tasks = newTaskGroup(run, Phase.COMMENTS);
        for (CollectedPost post : posts) {
            tasks.fork("post " + post.key(), () -> readComments(run, tasks, post, words));
        }
        endPhase(run, tasks.join());
        outputRouter.writeComments(job.getId(), run.content.drainComments());
    }

    private void readComments(JobRun run, PhaseTaskGroup tasks, CollectedPost post, List<String> words) {
        Job job = run.job;
        Integer offset = 0;
        while (offset != null && !tasks.isStopping() && run.commentBudget.get() > 0) {
            Page<VkComment> page = apiClient.listComments(post.getOwnerId(), post.getPostId(), offset, tasks::isStopping);
            int granted = run.reserveComments(page.items().size());
            Instant now = clock.instant();
            for (VkComment comment : page.items().subList(0, granted)) {
                if (matchesFilter(comment, words)) {
                    run.content.addComment(CollectedComment.from(job.getId(), post.getOwnerId(), post.getPostId(), comment, now));
                }
            }
            job.getCounters().addProcessed(Phase.COMMENTS, granted);
            publishProgress(job);
            if (granted < page.items().size()) {
                break;
            }
            offset = page.nextOffset();
        }
    }

    private PhaseTaskGroup newTaskGroup(JobRun run, Phase phase) {
        return new PhaseTaskGroup(phase, phaseExecutor, run.token, (item, e) -> onItemFailure(run, phase, item, e));
    }

    private void onItemFailure(JobRun run, Phase phase, String item, ApiException e) {
        log.warn("Job {} {} phase: {} failed: {}", run.job.getId(), phase.wireName(), item, e.getMessage());
        run.job.recordError(phase, item, e.getMessage(), clock.instant());
        run.failedItems.incrementAndGet();
    }

    private void endPhase(JobRun run, PhaseTaskGroup.Outcome outcome) {
        String phase = outcome.phase().wireName();
        log.info("Job {} {} phase done: {} attempted, {} failed, {} skipped",
                run.job.getId(), phase, outcome.attempted(), outcome.failed(), outcome.skipped());

        if (outcome.systemicFailure() != null) {
            throw new JobFailedException(phase + " phase aborted: " + outcome.systemicFailure().getMessage(),
                    outcome.systemicFailure());
        }
        CollectorProperties.Worker worker = properties.getWorker();
        if (outcome.attempted() >= worker.getMinItemsForErrorRate()
                && outcome.failureRate() > worker.getErrorRateThreshold()) {
            throw new JobFailedException(String.format("%s phase: %d of %d items failed (threshold %.0f%%)",
                    phase, outcome.failed(), outcome.attempted(), worker.getErrorRateThreshold() * 100));
        }
    }

    private boolean stopped(JobRun run) {
        if (run.token.isCancelled()) {
            log.info("Job {} cancelled: {}", run.job.getId(), run.token.reason());
            return true;
        }
        return false;
    }

    private void requireResolvedGroups(JobRun run) {
        if (run.content.groupCount() == 0) {
            throw new JobFailedException("No groups could be resolved");
        }
    }

    private void finish(JobRun run, JobStatus outcome) {
        Job job = run.job;
        try {
            outputRouter.writeGroups(job.getId(), run.content.drainGroups());
            outputRouter.writePosts(job.getId(), run.content.drainPosts());
            outputRouter.writeComments(job.getId(), run.content.drainComments());
        } catch (RuntimeException e) {
            log.error("Job {}: writing collected content failed: {}", job.getId(), e.getMessage(), e);
            job.fail("Output write failed: " + e.getMessage());
            if (outcome == JobStatus.COMPLETED) {
                outcome = JobStatus.FAILED;
            }
        }

        Instant now = clock.instant();
        job.complete(JobResult.builder()
                .groupsCollected(run.content.groupCount())
                .postsCollected(run.content.postCount())
                .commentsCollected(run.content.commentCount())
                .failedItems(run.failedItems.get())
                .durationMs(Duration.between(job.getStartedAt(), now).toMillis())
                .build());
        if (outcome == JobStatus.CANCELLED && job.getLastError() == null) {
            job.fail("Cancelled: " + run.token.reason());
        }

        synchronized (job) {
            job.transitionTo(outcome, now);
            jobRepository.save(job);
        }
        log.info("Job {} {}: {} groups, {} posts, {} comments, {} failed items",
                job.getId(), outcome, run.content.groupCount(), run.content.postCount(),
                run.content.commentCount(), run.failedItems.get());
    }

    /** Snapshot and write under the job's lock so stored counters never go backwards. */
    private void publishProgress(Job job) {
        synchronized (job) {
            jobRepository.updateProgress(job.getId(), job.metrics(), job.getCurrentPhase());
        }
    }

    private static boolean matches(VkGroup group, String requested) {
        return String.valueOf(group.getId()).equals(requested)
                || String.valueOf(-group.getId()).equals(requested)
                || requested.equalsIgnoreCase(group.getScreenName());
    }

    private static boolean matchesFilter(VkComment comment, List<String> words) {
        if (words.isEmpty()) {
            return true;
        }
        String text = comment.getText() == null ? "" : comment.getText().toLowerCase(Locale.ROOT);
        return words.stream().anyMatch(text::contains);
    }

    private static String batchLabel(List<String> batch) {
        if (batch.size() <= 3) {
            return "groups " + String.join(",", batch);
        }
        return "groups " + batch.stream().limit(3).collect(Collectors.joining(","))
                + " (+" + (batch.size() - 3) + " more)";
    }

    /** Mutable state of one run, shared by the items of its phases. */
    private static final class JobRun {

        final Job job;
        final CancellationToken token;
        final CollectedContent content = new CollectedContent();
        final AtomicInteger failedItems = new AtomicInteger();
        final AtomicLong commentBudget;

        JobRun(Job job, CancellationToken token) {
            this.job = job;
            this.token = token;
            Integer cap = job.getParameters().maxComments();
            this.commentBudget = new AtomicLong(cap != null && cap > 0 ? cap : Long.MAX_VALUE);
        }

        /** Takes up to {@code wanted} comments from the job's budget. */
        int reserveComments(int wanted) {
            long before = commentBudget.getAndUpdate(remaining -> Math.max(0, remaining - wanted));
            return (int) Math.min(wanted, before);
        }
    }
}
