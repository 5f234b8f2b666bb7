package com.qgen.config;

import com.qgen.ledger.CommitmentLedger;
import com.qgen.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class LedgerConfig {

    @Bean
    public CommitmentLedger commitmentLedger(LedgerStore store, LedgerProperties props, Clock clock) {
        log.info("Commitment ledger '{}' on {} storage ({})", props.getName(), props.getStorage(),
                store.getClass().getSimpleName());
        return new CommitmentLedger(props.getName(), store, clock, props.getMaxAppendRetries());
    }
}
