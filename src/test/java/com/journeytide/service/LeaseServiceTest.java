package com.journeytide.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaseServiceTest {

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOps;

    @InjectMocks
    private LeaseService leaseService;

    @Test
    @DisplayName("Free key is acquired and returns the owner token")
    void freeKey_acquired() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("journeys:sweep:lock"), anyString(), eq(Duration.ofSeconds(600)))).thenReturn(true);

        Optional<String> token = leaseService.acquire(LeaseService.SWEEP_LOCK_KEY, Duration.ofSeconds(600));

        assertTrue(token.isPresent());
    }

    @Test
    @DisplayName("Held key is not acquired")
    void heldKey_notAcquired() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertTrue(leaseService.acquire("journeys:enroll:j:c", Duration.ofSeconds(30)).isEmpty());
    }

    @Test
    @DisplayName("Unreachable Redis counts as not acquired")
    void redisDown_notAcquired() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertTrue(leaseService.acquire(LeaseService.SWEEP_LOCK_KEY, Duration.ofSeconds(600)).isEmpty());
    }

    @Test
    @DisplayName("Release only deletes a lease still holding our token")
    void release_onlyOwnToken() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("journeys:sweep:lock")).thenReturn("someone-else");

        leaseService.release(LeaseService.SWEEP_LOCK_KEY, "mine");

        verify(redisTemplate, never()).delete(anyString());
    }

    @Test
    @DisplayName("Enrollment lease key names journey and customer")
    void enrollmentKey_format() {
        assertEquals("journeys:enroll:j-1:cust-1", LeaseService.enrollmentKey("j-1", "cust-1"));
    }

    @Test
    @DisplayName("Walk lease key names the enrollment")
    void walkKey_format() {
        assertEquals("journeys:walk:e-1", LeaseService.walkKey("e-1"));
    }
}
