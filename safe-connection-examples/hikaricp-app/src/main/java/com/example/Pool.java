package com.example;

import com.example.safeconnection.core.LivenessProbe;
import com.example.safeconnection.core.Retry;
import com.example.safeconnection.core.SafeDataSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class Pool {

  /** Builds a HikariCP pool for a PostgreSQL database. */
  public static HikariDataSource hikari(
      final String jdbcUrl, final String username, final String password) {
    final var config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(username);
    config.setPassword(password);
    config.setMaximumPoolSize(10);
    return new HikariDataSource(config);
  }

  /**
   * Wraps a HikariCP pool so every borrowed connection is a long-lived {@code SafeConnection} that
   * takes a fresh pooled connection whenever its current one stops answering.
   */
  public static SafeDataSource safe(final HikariDataSource hikari) {
    return SafeDataSource.builder()
        .dataSource(hikari)
        .retryPolicy(Retry.Policy.exponential(5, 200L))
        .livenessProbe(LivenessProbe.query("SELECT 1", 2))
        .build();
  }
}
