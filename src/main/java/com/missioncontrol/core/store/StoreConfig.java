package com.missioncontrol.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} wiring the record store.
 * <p>
 * The schema is brought up to date before the {@link TaskStore} bean is handed out, so
 * nothing can read or write tasks against a half-migrated database.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public SchemaMigrator schemaMigrator(DataSource dataSource) {
        var migrator = new SchemaMigrator(dataSource);
        migrator.migrate();
        return migrator;
    }

    @Bean
    public TaskStore taskStore(DataSource dataSource, ObjectMapper objectMapper, SchemaMigrator schemaMigrator) {
        log.info("Configuring JDBC task store ({} migrations applied)", schemaMigrator.appliedIds().size());
        return new JdbcTaskStore(dataSource, objectMapper);
    }
}
