package com.flamingo.ai.scriptrag.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Read-only JDBC access to the script database used by search.
 *
 * <p>SQLite fixes the access mode when a connection is opened, so search gets its own data source
 * whose connections are opened read-only instead of sharing the pooled read-write one.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

  @Bean(name = "readOnlyJdbcTemplate")
  public JdbcTemplate readOnlyJdbcTemplate(DataSourceProperties dataSourceProperties) {
    SQLiteConfig config = new SQLiteConfig();
    config.setReadOnly(true);
    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl(dataSourceProperties.determineUrl());
    log.info("Search reads from {} in read-only mode", dataSource.getUrl());
    return new JdbcTemplate(dataSource);
  }
}
