package com.shopfloor.backend.config;

import java.nio.file.Path;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;

import com.shopfloor.backend.util.SharedBackendPaths;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

@Configuration
public class SqliteDataSourceConfig {
  private static final Logger logger = LoggerFactory.getLogger(SqliteDataSourceConfig.class);

  @Bean
  @Primary
  public DataSource dataSource(Environment env) {
    String configured = env.getProperty("app.db.path");
    if (configured == null || configured.isBlank()) {
      configured = System.getenv("APP_DB_PATH");
    }
    Path db = SharedBackendPaths.dbFile(configured);
    String busyTimeout = env.getProperty("app.sqlite.busy-timeout-ms", "10000");

    HikariConfig cfg = new HikariConfig();
    cfg.setJdbcUrl("jdbc:sqlite:" + db + "?busy_timeout=" + busyTimeout);
    cfg.setDriverClassName("org.sqlite.JDBC");
    cfg.setPoolName("shopfloor-sqlite");
    // SQLite has a single writer
    cfg.setMaximumPoolSize(1);

    logger.info("Using SQLite database {}", db);
    return new HikariDataSource(cfg);
  }
}
