package org.talentia.engine.repository.jdbc;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Builds the JDBC plumbing shared by the repositories.
 */
public final class DatabaseFactory {

    private static final Logger LOG = Logger.getLogger(DatabaseFactory.class.getName());

    public static final String SCHEMA_LOCATION = "db/schema.sql";

    private DatabaseFactory() {
    }

    public static DataSource dataSource(String url, String user, String password) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(url, user, password);
        LOG.info(() -> "Using datasource " + url);
        return dataSource;
    }

    /**
     * Run the bundled DDL. Every statement is idempotent.
     */
    public static void initSchema(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.execute(dataSource);
        LOG.info("Database schema initialized");
    }

    public static JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    public static TransactionTemplate transactionTemplate(DataSource dataSource) {
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }
}
