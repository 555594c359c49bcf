package com.concord.core.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Provides the {@link KnowledgeStore} bean.
 * <p>
 * When a {@link DataSource} is available a {@link JdbcKnowledgeStore} is created and
 * its tables ensured. Otherwise an {@link InMemoryKnowledgeStore} is used, which does
 * not survive restarts.
 */
@Configuration
public class KnowledgeStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public KnowledgeStore jdbcKnowledgeStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC knowledge store");
        var store = new JdbcKnowledgeStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(KnowledgeStore.class)
    public KnowledgeStore inMemoryKnowledgeStore() {
        log.info("No DataSource available; using in-memory knowledge store (history will not persist across restarts)");
        return new InMemoryKnowledgeStore();
    }
}
