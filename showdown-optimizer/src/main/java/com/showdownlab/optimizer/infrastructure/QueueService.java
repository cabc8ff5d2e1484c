package com.showdownlab.optimizer.infrastructure;

/**
 * FIFO queue of analysis job ids shared by all workers.
 */
public interface QueueService {

    void push(Long jobId);

    /**
     * @return the next job id, or null if none arrived within the poll timeout
     */
    Long pop();
}
