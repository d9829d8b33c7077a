package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.io.PrintWriter;
import java.lang.System.Logger;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import javax.sql.DataSource;

/**
 * DataSource wrapper whose connections are {@link SafeConnection}s.
 *
 * <p>Every {@link #getConnection()} returns a new logical connection with its own state. The
 * wrapped DataSource is only used as the connect factory of those logical connections; this class
 * does no pooling of its own.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var safeDs = SafeDataSource.builder()
 *     .dataSource(new HikariDataSource(config))
 *     .build();
 *
 * try (var conn = safeDs.getConnection()) {
 *     // conn reconnects on its own if its physical connection dies
 * }
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * var safeDs = SafeDataSource.builder()
 *     .dataSource(hikari)
 *     .retryPolicy(Retry.Policy.exponential(5, 200L))
 *     .livenessProbe(LivenessProbe.query("SELECT 1", 2))
 *     .reconnectPeriod(Duration.ofMinutes(30))
 *     .build();
 * }</pre>
 */
public final class SafeDataSource implements DataSource {

  private static final Logger logger = System.getLogger(SafeDataSource.class.getName());

  private final DataSource delegate;
  private final Retry.Policy retryPolicy;
  private final StalenessPolicy stalenessPolicy;
  private final Duration reconnectPeriod;
  private final LivenessProbe livenessProbe;

  private SafeDataSource(final Builder builder) {
    this.delegate = builder.dataSource;
    this.retryPolicy = builder.retryPolicy;
    this.stalenessPolicy = builder.stalenessPolicy;
    this.reconnectPeriod = builder.reconnectPeriod;
    this.livenessProbe = builder.livenessProbe;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link SafeDataSource} instances. */
  public static class Builder {
    private DataSource dataSource;
    private Retry.Policy retryPolicy = Retry.Policy.once();
    private StalenessPolicy stalenessPolicy = StalenessPolicy.never();
    private Duration reconnectPeriod;
    private LivenessProbe livenessProbe = LivenessProbe.validating(5);

    private Builder() {}

    /**
     * Sets the DataSource physical connections are taken from (required).
     *
     * @param dataSource the wrapped DataSource
     * @return this builder
     */
    public Builder dataSource(final DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Sets the retry policy of every connection handed out.
     *
     * <p>Default: {@link Retry.Policy#once()}
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the staleness policy of every connection handed out.
     *
     * <p>Default: {@link StalenessPolicy#never()}
     *
     * @param stalenessPolicy the staleness policy
     * @return this builder
     */
    public Builder stalenessPolicy(final StalenessPolicy stalenessPolicy) {
      this.stalenessPolicy = stalenessPolicy;
      return this;
    }

    /**
     * Sets the maximum physical connection age of every connection handed out.
     *
     * <p>Default: null (disabled)
     *
     * @param reconnectPeriod maximum age
     * @return this builder
     */
    public Builder reconnectPeriod(final Duration reconnectPeriod) {
      this.reconnectPeriod = reconnectPeriod;
      return this;
    }

    /**
     * Sets the liveness probe of every connection handed out.
     *
     * <p>Default: {@link LivenessProbe#validating(int) validating(5)}
     *
     * @param livenessProbe the probe
     * @return this builder
     */
    public Builder livenessProbe(final LivenessProbe livenessProbe) {
      this.livenessProbe = livenessProbe;
      return this;
    }

    /**
     * Builds the SafeDataSource instance.
     *
     * @return configured SafeDataSource
     * @throws IllegalStateException if required fields are not set
     */
    public SafeDataSource build() {
      if (dataSource == null) throw new IllegalStateException("dataSource is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (stalenessPolicy == null)
        throw new IllegalStateException("stalenessPolicy cannot be null");
      if (livenessProbe == null) throw new IllegalStateException("livenessProbe cannot be null");
      if (reconnectPeriod != null && (reconnectPeriod.isNegative() || reconnectPeriod.isZero()))
        throw new IllegalArgumentException("reconnectPeriod must be positive");
      return new SafeDataSource(this);
    }
  }

  @Override
  public SafeConnection getConnection() {
    logger.log(DEBUG, "Creating safe connection");
    return configure(
            SafeConnection.builder().connectFactory(ConnectFactory.fromDataSource(delegate)))
        .build();
  }

  @Override
  public SafeConnection getConnection(final String username, final String password) {
    return configure(
            SafeConnection.builder()
                .connectFactory(() -> delegate.getConnection(username, password)))
        .build();
  }

  /** Closes the wrapped DataSource if it is closeable. */
  public void shutdown() {
    if (delegate instanceof AutoCloseable ac) {
      try {
        ac.close();
        logger.log(INFO, "Closed wrapped DataSource");
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close DataSource", e);
      }
    }
  }

  @Override
  public PrintWriter getLogWriter() throws SQLException {
    return delegate.getLogWriter();
  }

  @Override
  public void setLogWriter(final PrintWriter out) throws SQLException {
    delegate.setLogWriter(out);
  }

  @Override
  public void setLoginTimeout(final int seconds) throws SQLException {
    delegate.setLoginTimeout(seconds);
  }

  @Override
  public int getLoginTimeout() throws SQLException {
    return delegate.getLoginTimeout();
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    return delegate.getParentLogger();
  }

  @Override
  public <T> T unwrap(final Class<T> clazz) throws SQLException {
    if (clazz.isInstance(this)) return clazz.cast(this);
    return delegate.unwrap(clazz);
  }

  @Override
  public boolean isWrapperFor(final Class<?> iface) throws SQLException {
    return iface.isInstance(this) || delegate.isWrapperFor(iface);
  }

  private SafeConnection.Builder configure(final SafeConnection.Builder builder) {
    return builder
        .retryPolicy(retryPolicy)
        .stalenessPolicy(stalenessPolicy)
        .reconnectPeriod(reconnectPeriod)
        .livenessProbe(livenessProbe);
  }
}
