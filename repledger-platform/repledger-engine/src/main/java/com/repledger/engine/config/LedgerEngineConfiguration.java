package com.repledger.engine.config;

import com.repledger.core.ledger.InMemoryStateStore;
import com.repledger.core.ledger.StateCodec;
import com.repledger.core.ledger.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the engine services.
 */
@Configuration(proxyBeanMethods = false)
public class LedgerEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LedgerEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public StateCodec stateCodec() {
        return new StateCodec();
    }

    @Bean
    @ConditionalOnProperty(prefix = "repledger.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public StateStore inMemoryStateStore() {
        log.info("Using in-memory state store; ledger state will not survive a restart");
        return new InMemoryStateStore();
    }
}
