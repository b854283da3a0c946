package com.socialintel.collector.config;

import com.socialintel.collector.model.Job;
import com.socialintel.collector.model.JobStatusView;
import com.socialintel.collector.model.JobSubmission;
import com.socialintel.collector.service.JobNotFoundException;
import com.socialintel.collector.service.JobService;
import com.socialintel.collector.service.JobValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/jobs")
@Slf4j
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    /**
     * Submit a job.
     *
     * POST /jobs {"type": "fetch_comments", "parameters": {"groupIds": [1]}, "priority": 5}
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody JobSubmission submission) {
        try {
            Job job = jobService.submit(submission);
            return ResponseEntity.accepted().body(Map.of(
                    "jobId", job.getId(),
                    "status", job.getStatus().wireName()));
        } catch (JobValidationException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "invalid job",
                    "violations", e.getViolations()));
        } catch (Exception e) {
            log.error("Job submission failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> status(@PathVariable String jobId) {
        try {
            JobStatusView view = jobService.status(jobId);
            return ResponseEntity.ok(view);
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Status query failed for job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        try {
            jobService.cancel(jobId);
            return ResponseEntity.accepted().body(Map.of("jobId", jobId, "status", "cancelling"));
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Cancel failed for job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Re-run a finished job. The original record is left as it is.
     */
    @PostMapping("/{jobId}/requeue")
    public ResponseEntity<?> requeue(@PathVariable String jobId) {
        try {
            Job copy = jobService.requeue(jobId);
            return ResponseEntity.accepted().body(Map.of(
                    "jobId", copy.getId(),
                    "requeuedFrom", jobId,
                    "status", copy.getStatus().wireName()));
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Requeue failed for job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
