package com.missioncontrol.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases in PostgreSQL mode, one per call.
 */
public final class H2Databases {

    private H2Databases() {}

    public static DataSource newDataSource() {
        var dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:mc-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    /** A migrated database behind a {@link JdbcTaskStore}. */
    public static JdbcTaskStore newMigratedStore() {
        DataSource dataSource = newDataSource();
        new SchemaMigrator(dataSource).migrate();
        return new JdbcTaskStore(dataSource, objectMapper());
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }
}
