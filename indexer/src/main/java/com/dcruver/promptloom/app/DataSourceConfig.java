package com.dcruver.promptloom.app;

import com.dcruver.promptloom.config.TagIndexProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for the SQLite tag index data source.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(TagIndexProperties properties) throws IOException {
        return sqliteDataSource(properties.getDatabasePath());
    }

    /**
     * Data source opening a new connection to {@code dbPath} per request, with foreign keys enforced.
     */
    public static DriverManagerDataSource sqliteDataSource(Path dbPath) throws IOException {
        // Ensure parent directory exists
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        // Set per connection; the pragma is ignored once a transaction is open
        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("foreign_keys", "true");

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(connectionProperties);
        return dataSource;
    }
}
