package com.socialintel.collector.service;

import com.socialintel.collector.model.CollectedComment;
import com.socialintel.collector.model.CollectedGroup;
import com.socialintel.collector.model.CollectedPost;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Content gathered by one job, deduplicated by external id. Rows not yet handed to the output are
 * queued separately so a job can flush after each phase and again when it ends.
 */
class CollectedContent {

    private final Map<Long, CollectedGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, CollectedPost> posts = new ConcurrentHashMap<>();
    private final Map<String, CollectedComment> comments = new ConcurrentHashMap<>();

    private final Queue<CollectedGroup> unflushedGroups = new ConcurrentLinkedQueue<>();
    private final Queue<CollectedPost> unflushedPosts = new ConcurrentLinkedQueue<>();
    private final Queue<CollectedComment> unflushedComments = new ConcurrentLinkedQueue<>();

    /** @return false if the group was already collected */
    boolean addGroup(CollectedGroup group) {
        if (groups.putIfAbsent(group.getGroupId(), group) != null) {
            return false;
        }
        unflushedGroups.add(group);
        return true;
    }

    boolean addPost(CollectedPost post) {
        if (posts.putIfAbsent(post.key(), post) != null) {
            return false;
        }
        unflushedPosts.add(post);
        return true;
    }

    boolean addComment(CollectedComment comment) {
        if (comments.putIfAbsent(comment.key(), comment) != null) {
            return false;
        }
        unflushedComments.add(comment);
        return true;
    }

    List<CollectedGroup> groups() {
        return List.copyOf(groups.values());
    }

    List<CollectedPost> posts() {
        return List.copyOf(posts.values());
    }

    int groupCount() {
        return groups.size();
    }

    int postCount() {
        return posts.size();
    }

    int commentCount() {
        return comments.size();
    }

    List<CollectedGroup> drainGroups() {
        return drain(unflushedGroups);
    }

    List<CollectedPost> drainPosts() {
        return drain(unflushedPosts);
    }

    List<CollectedComment> drainComments() {
        return drain(unflushedComments);
    }

    private static <T> List<T> drain(Queue<T> queue) {
        List<T> drained = new ArrayList<>();
        T next;
        while ((next = queue.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }
}
