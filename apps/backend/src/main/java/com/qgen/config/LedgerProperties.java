package com.qgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "qgen.ledger")
public class LedgerProperties {
    private String storage = "in-memory";   // in-memory | database
    private String name = "default";
    private int maxAppendRetries = 3;
}
