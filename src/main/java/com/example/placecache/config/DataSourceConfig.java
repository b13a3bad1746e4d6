package com.example.placecache.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@Slf4j
public class DataSourceConfig {
  @Bean
  @Primary
  public DataSource dataSource(@Value("${spring.datasource.url}") String url,
                               @Value("${spring.datasource.driver-class-name}") String driver,
                               @Value("${spring.datasource.hikari.maximum-pool-size:1}") int maxPoolSize) {
    ensureSqliteDir(url);
    HikariDataSource ds = new HikariDataSource();
    ds.setJdbcUrl(url);
    ds.setDriverClassName(driver);
    // SQLite allows a single writer
    ds.setMaximumPoolSize(Math.max(1, maxPoolSize));
    return ds;
  }

  static Path sqliteDirectory(String url) {
    if (url == null || !url.startsWith("jdbc:sqlite:")) {
      return null;
    }
    String path = url.substring("jdbc:sqlite:".length());
    if (path.isBlank() || path.startsWith(":memory:") || path.startsWith("file::memory:")) {
      return null;
    }
    if (path.startsWith("./")) {
      path = path.substring(2);
    }
    return Path.of(path).toAbsolutePath().getParent();
  }

  private void ensureSqliteDir(String url) {
    Path parent = sqliteDirectory(url);
    if (parent == null) {
      return;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      log.warn("Could not create SQLite directory {}: {}", parent, ex.getMessage());
    }
  }
}
