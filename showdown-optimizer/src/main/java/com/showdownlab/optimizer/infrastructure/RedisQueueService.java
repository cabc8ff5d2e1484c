package com.showdownlab.optimizer.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Redis list backed job queue. RPUSH and blocking LPOP are atomic, so any
 * number of workers can poll it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisQueueService implements QueueService {

    static final String QUEUE_NAME = "analysis-jobs";
    private static final long POP_TIMEOUT_SECONDS = 1;

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void push(Long jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }

        try {
            Long queueSize = redisTemplate.opsForList().rightPush(QUEUE_NAME, jobId);
            log.debug("Pushed job {} to {}. Queue size: {}", jobId, QUEUE_NAME, queueSize);
        } catch (DataAccessException e) {
            log.error("Redis error while pushing job {} to queue: {}", jobId, e.getMessage(), e);
            throw new RuntimeException("Failed to enqueue job due to Redis error", e);
        }
    }

    @Override
    public Long pop() {
        try {
            Object value = redisTemplate.opsForList().leftPop(QUEUE_NAME, POP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (value == null) {
                return null;
            }
            if (!(value instanceof Number)) {
                log.error("Discarding non-numeric queue entry: {}", value);
                return null;
            }

            Long jobId = ((Number) value).longValue();
            log.debug("Popped job {} from {}", jobId, QUEUE_NAME);
            return jobId;
        } catch (DataAccessException e) {
            log.error("Redis error while popping from queue: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to dequeue job due to Redis error", e);
        }
    }
}
