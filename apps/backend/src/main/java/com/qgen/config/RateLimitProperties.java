package com.qgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "qgen.rate-limit")
public class RateLimitProperties {
    private boolean enabled = true;
    private int maxRequests = 5;
    private Duration window = Duration.ofSeconds(60);
    private int maxClients = 10_000;
}
