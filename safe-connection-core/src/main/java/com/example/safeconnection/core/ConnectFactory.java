package com.example.safeconnection.core;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import javax.sql.DataSource;

/**
 * Produces a new live physical {@link Connection}. Called by the reconnection engine every time the
 * current physical connection has to be replaced.
 *
 * <p>Implementations may pick a different host or replica on each call.
 */
@FunctionalInterface
public interface ConnectFactory {

  /**
   * Opens a new physical connection.
   *
   * @return a new live connection
   * @throws SQLException if the connection cannot be established
   */
  Connection connect() throws SQLException;

  /**
   * Creates a factory that connects through {@link DriverManager} with a user and password.
   *
   * @param url JDBC URL
   * @param user database user, may be null
   * @param password database password, may be null
   * @return factory over {@link DriverManager#getConnection(String, String, String)}
   */
  static ConnectFactory fromUrl(final String url, final String user, final String password) {
    Objects.requireNonNull(url, "url");
    return () -> DriverManager.getConnection(url, user, password);
  }

  /**
   * Creates a factory that connects through {@link DriverManager} with driver properties.
   *
   * @param url JDBC URL
   * @param info driver properties, copied at creation time
   * @return factory over {@link DriverManager#getConnection(String, Properties)}
   */
  static ConnectFactory fromUrl(final String url, final Properties info) {
    Objects.requireNonNull(url, "url");
    final var copy = new Properties();
    if (info != null) copy.putAll(info);
    return () -> DriverManager.getConnection(url, copy);
  }

  /**
   * Creates a factory that borrows connections from a {@link DataSource}.
   *
   * @param dataSource source of physical connections
   * @return factory over {@link DataSource#getConnection()}
   */
  static ConnectFactory fromDataSource(final DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}
