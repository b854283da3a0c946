package com.socialintel.collector.store;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process priority queue. Higher priority first; equal priorities in submission order.
 * Jobs lost with the process are re-enqueued from the job table at startup.
 */
@Component
public class PriorityJobQueue implements JobQueue {

    private record Entry(String jobId, int priority, long sequence) {}

    private final AtomicLong sequence = new AtomicLong();
    private final PriorityBlockingQueue<Entry> entries = new PriorityBlockingQueue<>(64,
            Comparator.comparingInt(Entry::priority).reversed().thenComparingLong(Entry::sequence));

    @Override
    public void enqueue(String jobId, int priority) {
        entries.add(new Entry(jobId, priority, sequence.incrementAndGet()));
    }

    @Override
    public Optional<String> poll() {
        return Optional.ofNullable(entries.poll()).map(Entry::jobId);
    }

    @Override
    public boolean remove(String jobId) {
        return entries.removeIf(e -> e.jobId().equals(jobId));
    }

    @Override
    public int size() {
        return entries.size();
    }
}
