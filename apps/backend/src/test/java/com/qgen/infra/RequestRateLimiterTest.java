package com.qgen.infra;

import com.qgen.config.RateLimitProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RequestRateLimiterTest {

    /** 可拨动的测试时钟 */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2025-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final MutableClock clock = new MutableClock();

    private RequestRateLimiter limiter(int max, boolean enabled) {
        RateLimitProperties props = new RateLimitProperties();
        props.setMaxRequests(max);
        props.setEnabled(enabled);
        props.setWindow(Duration.ofSeconds(60));
        return new RequestRateLimiter(props, clock);
    }

    @Test
    void sixthRequestInWindowIsRejected() {
        RequestRateLimiter limiter = limiter(5, true);
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.tryAcquire("10.0.0.1").allowed());
            clock.advance(Duration.ofSeconds(1));
        }

        RequestRateLimiter.Decision d = limiter.tryAcquire("10.0.0.1");
        assertFalse(d.allowed());
        assertEquals(55.0, d.retryAfterSeconds(), 0.001);
        assertEquals("Rate limit exceeded. Try again in 55.0 seconds.", d.message());
    }

    @Test
    void windowSlides() {
        RequestRateLimiter limiter = limiter(2, true);
        assertTrue(limiter.tryAcquire("c").allowed());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire("c").allowed());
        assertFalse(limiter.tryAcquire("c").allowed());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire("c").allowed());
        assertFalse(limiter.tryAcquire("c").allowed());
    }

    @Test
    void rejectedRequestsDoNotExtendTheWait() {
        RequestRateLimiter limiter = limiter(1, true);
        assertTrue(limiter.tryAcquire("c").allowed());
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(5));
            assertFalse(limiter.tryAcquire("c").allowed());
        }
        clock.advance(Duration.ofSeconds(10));
        assertTrue(limiter.tryAcquire("c").allowed());
    }

    @Test
    void clientsAreIndependent() {
        RequestRateLimiter limiter = limiter(1, true);
        assertTrue(limiter.tryAcquire("a").allowed());
        assertTrue(limiter.tryAcquire("b").allowed());
        assertFalse(limiter.tryAcquire("a").allowed());
    }

    @Test
    void disabledLimiterAllowsEverything() {
        RequestRateLimiter limiter = limiter(1, false);
        for (int i = 0; i < 20; i++) {
            assertTrue(limiter.tryAcquire("a").allowed());
        }
    }
}
