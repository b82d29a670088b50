package com.customer.identity.sync;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps submitted review tasks in memory.
 */
public class InMemoryReviewTaskSink implements ReviewTaskSink {

    private final List<ReviewTask> tasks = new CopyOnWriteArrayList<>();

    @Override
    public void submit(ReviewTask task) {
        tasks.add(task);
    }

    public List<ReviewTask> getTasks() {
        return List.copyOf(tasks);
    }

    public int size() {
        return tasks.size();
    }

    public void clear() {
        tasks.clear();
    }
}
