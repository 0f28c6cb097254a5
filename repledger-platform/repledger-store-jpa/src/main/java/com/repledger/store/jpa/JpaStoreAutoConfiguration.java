package com.repledger.store.jpa;

import com.repledger.core.ledger.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Registers {@link JpaStateStore} when {@code repledger.store.type=jpa}.
 */
@AutoConfiguration(after = HibernateJpaAutoConfiguration.class)
@ConditionalOnProperty(prefix = "repledger.store", name = "type", havingValue = "jpa")
@EntityScan(basePackageClasses = LedgerEntry.class)
@EnableJpaRepositories(basePackageClasses = LedgerEntryRepository.class)
public class JpaStoreAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JpaStoreAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    public StateStore jpaStateStore(LedgerEntryRepository repository, PlatformTransactionManager transactionManager) {
        log.info("Using JPA state store (table ledger_state)");
        return new JpaStateStore(repository, new TransactionTemplate(transactionManager), Clock.systemUTC());
    }
}
