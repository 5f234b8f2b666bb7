package com.qgen.infra;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.qgen.config.RateLimitProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * 按客户端地址的滑动窗口限流：
 *  - 窗口内最多 maxRequests 次被接受的请求
 *  - 被拒绝的请求不计入窗口
 *  - 等待时间 = 最早一次请求 + 窗口 - 当前时间
 * 久未访问的客户端由 Caffeine 自动淘汰。
 */
@Slf4j
@Component
public class RequestRateLimiter {

    private final RateLimitProperties props;
    private final Clock clock;
    private final Cache<String, Deque<Long>> history;

    public RequestRateLimiter(RateLimitProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
        this.history = Caffeine.newBuilder()
                .expireAfterAccess(props.getWindow())
                .maximumSize(Math.max(64, props.getMaxClients()))
                .build();
    }

    public Decision tryAcquire(String client) {
        if (!props.isEnabled()) return Decision.ALLOWED;

        long now = clock.millis();
        long windowMs = props.getWindow().toMillis();
        Deque<Long> stamps = history.get(client == null ? "unknown" : client, k -> new ArrayDeque<>());
        synchronized (stamps) {
            while (!stamps.isEmpty() && stamps.peekFirst() <= now - windowMs) {
                stamps.pollFirst();
            }
            if (stamps.size() >= props.getMaxRequests()) {
                double waitSeconds = (stamps.peekFirst() + windowMs - now) / 1000.0;
                log.warn("Rate limit hit client={} wait={}s", client, String.format(Locale.ROOT, "%.1f", waitSeconds));
                return new Decision(false, waitSeconds);
            }
            stamps.addLast(now);
            return Decision.ALLOWED;
        }
    }

    public record Decision(boolean allowed, double retryAfterSeconds) {
        static final Decision ALLOWED = new Decision(true, 0);

        public String message() {
            return String.format(Locale.ROOT, "Rate limit exceeded. Try again in %.1f seconds.", retryAfterSeconds);
        }
    }
}
