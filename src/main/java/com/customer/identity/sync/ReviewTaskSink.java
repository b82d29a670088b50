package com.customer.identity.sync;

/**
 * Hands ambiguous matches to the task queue. The core only decides that a review is needed;
 * enqueueing belongs to the implementation.
 */
public interface ReviewTaskSink {

    void submit(ReviewTask task);
}
