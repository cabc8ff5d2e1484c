package com.showdownlab.optimizer.infrastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisQueueServiceTest {

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ListOperations<String, Object> listOperations;

    private RedisQueueService queueService;

    @BeforeEach
    void setUp() {
        queueService = new RedisQueueService(redisTemplate);
    }

    @Test
    void testPush_AppendsToQueue() {
        // Arrange
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush(RedisQueueService.QUEUE_NAME, 7L)).thenReturn(1L);

        // Act
        queueService.push(7L);

        // Assert
        verify(listOperations).rightPush(RedisQueueService.QUEUE_NAME, 7L);
    }

    @Test
    void testPush_NullId_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> queueService.push(null));
        verifyNoInteractions(redisTemplate);
    }

    @Test
    void testPush_RedisDown_Throws() {
        // Arrange
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.rightPush(any(), any())).thenThrow(new RedisConnectionFailureException("down"));

        // Act & Assert
        RuntimeException e = assertThrows(RuntimeException.class, () -> queueService.push(7L));
        assertEquals("Failed to enqueue job due to Redis error", e.getMessage());
    }

    @Test
    void testPop_ConvertsNumericEntries() {
        // Arrange
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.leftPop(eq(RedisQueueService.QUEUE_NAME), anyLong(), eq(TimeUnit.SECONDS)))
                .thenReturn(12)
                .thenReturn(null)
                .thenReturn("garbage");

        // Act & Assert
        assertEquals(12L, queueService.pop());
        assertNull(queueService.pop());
        assertNull(queueService.pop());
    }
}
