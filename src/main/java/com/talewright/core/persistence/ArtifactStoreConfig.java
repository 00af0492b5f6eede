package com.talewright.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link ArtifactStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), a
 * {@link JdbcArtifactStore} is created. Otherwise an {@link InMemoryArtifactStore} is used,
 * which does not survive a restart.
 */
@Configuration
public class ArtifactStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public ArtifactStore jdbcArtifactStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC artifact store (PostgreSQL)");
        var store = new JdbcArtifactStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ArtifactStore.class)
    public ArtifactStore memoryArtifactStore() {
        log.info("No DataSource available; using in-memory artifact store (snapshots will not persist across restarts)");
        return new InMemoryArtifactStore();
    }
}
