package com.example.placecache.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConfigTest {

  @Test
  @DisplayName("File databases resolve to their parent directory")
  void fileDatabase() {
    Path dir = DataSourceConfig.sqliteDirectory("jdbc:sqlite:./data/place-cache.db");
    assertEquals(Path.of("data").toAbsolutePath(), dir);
  }

  @Test
  @DisplayName("In-memory and non-SQLite urls need no directory")
  void noDirectory() {
    assertNull(DataSourceConfig.sqliteDirectory("jdbc:sqlite::memory:"));
    assertNull(DataSourceConfig.sqliteDirectory("jdbc:postgresql://localhost/db"));
    assertNull(DataSourceConfig.sqliteDirectory(null));
  }
}
