package com.example.safeconnection.core;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Connection that keeps itself connected.
 *
 * <p>A {@code SafeConnection} behaves like any other {@link Connection}. Before each operation it
 * checks the physical connection underneath and replaces it when it was dropped, when the caller
 * runs in a different thread or process than the one that opened it, or when a staleness policy
 * says so. A replacement never happens silently inside a transaction: the operation fails with
 * {@link TransactionViolationException} instead.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var conn = SafeConnection.builder()
 *     .dsn("jdbc:postgresql://localhost:5432/app", "app", "secret")
 *     .build();
 *
 * try (var stmt = conn.createStatement()) {
 *     // reconnects transparently if the server dropped the session
 * }
 * }</pre>
 *
 * <h2>Custom Connect Logic and Retries</h2>
 *
 * <pre>{@code
 * var conn = SafeConnection.builder()
 *     .connectFactory(() -> replicas.next().getConnection())
 *     .retryPolicy(Retry.Policy.exponential(5, 200L))
 *     .reconnectPeriod(Duration.ofMinutes(30))
 *     .build();
 * }</pre>
 *
 * <h2>Transactions</h2>
 *
 * <pre>{@code
 * conn.beginTransaction();      // or conn.setAutoCommit(false)
 * try {
 *     // ...
 *     conn.commit();
 * } catch (SQLException e) {
 *     conn.rollback();
 *     throw e;
 * }
 * }</pre>
 *
 * <p>Instances are safe to share between threads, but each thread gets its own physical connection:
 * a call from a thread other than the one that opened the current physical connection reconnects.
 */
public interface SafeConnection extends Connection {

  /**
   * Returns the physical connection currently in use, connecting or reconnecting first if needed.
   *
   * @return live physical connection
   * @throws SQLException as for any forwarded operation
   */
  Connection getPhysicalConnection() throws SQLException;

  /**
   * Opens a transaction. Nested transactions are not supported.
   *
   * @throws TransactionViolationException if a transaction is already open
   * @throws SQLException if connecting fails
   */
  void beginTransaction() throws SQLException;

  /**
   * Reads an attribute. {@code x_safe_*}, {@code Active}, {@code AutoCommit}, {@code PrintError}
   * and {@code RaiseError} are answered locally; other names are read from the physical connection
   * through its JDBC getter or, failing that, its client info.
   *
   * @param name attribute name
   * @return attribute value, or null
   * @throws SQLException if reading a remote attribute fails
   */
  Object getAttribute(String name) throws SQLException;

  /**
   * Writes an attribute, with the same local/remote split as {@link #getAttribute(String)}.
   *
   * @param name attribute name
   * @param value new value
   * @throws SQLException if writing a remote attribute fails
   */
  void setAttribute(String name, Object value) throws SQLException;

  /**
   * Invokes a {@link Connection} method by name on the live physical connection.
   *
   * @param operation method name, for example {@code "getCatalog"}
   * @param args method arguments
   * @return the method's result
   * @throws java.sql.SQLFeatureNotSupportedException if no method matches
   * @throws SQLException whatever the physical connection throws
   */
  Object forward(String operation, Object... args) throws SQLException;

  /**
   * Replaces the physical connection now. Inside a transaction the transaction is lost and the
   * following commit or rollback fails with {@link
   * TransactionViolationException.Kind#DISCONNECTED_DURING_TRANSACTION}.
   *
   * @return the new physical connection
   * @throws SQLException if the connection is closed or no connection could be made
   */
  Connection reconnect() throws SQLException;

  /**
   * Returns a copy of the connection's bookkeeping.
   *
   * @return state snapshot
   */
  ConnectionState.Snapshot getState();

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link SafeConnection} instances.
   *
   * <h3>Example: Minimal Configuration</h3>
   *
   * <pre>{@code
   * var conn = SafeConnection.builder()
   *     .connectFactory(() -> DriverManager.getConnection(url, user, password))
   *     .build();
   * }</pre>
   *
   * <h3>Example: Production Configuration</h3>
   *
   * <pre>{@code
   * var conn = SafeConnection.builder()
   *     .connectFactory(ConnectFactory.fromDataSource(hikari))
   *     .retryPolicy(Retry.Policy.exponential(7, 250L))
   *     .livenessProbe(LivenessProbe.query("SELECT 1", 2))
   *     .reconnectPeriod(Duration.ofHours(1))
   *     .build();
   * }</pre>
   */
  final class Builder {
    private ConnectFactory connectFactory;
    private String dsnUrl;
    private String dsnUser;
    private String dsnPassword;
    private Properties dsnProperties;
    private Retry.Policy retryPolicy = Retry.Policy.once();
    private StalenessPolicy stalenessPolicy = StalenessPolicy.never();
    private Duration reconnectPeriod;
    private LivenessProbe livenessProbe = LivenessProbe.validating(5);
    private OwnerIdentity.Source identitySource = OwnerIdentity.Source.jvm();
    private Clock clock = Clock.systemUTC();
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Sets the factory that opens physical connections. Required unless {@code dsn} is given.
     *
     * @param connectFactory factory called on every (re)connect
     * @return this builder
     */
    public Builder connectFactory(final ConnectFactory connectFactory) {
      this.connectFactory = connectFactory;
      return this;
    }

    /**
     * Connects through {@link java.sql.DriverManager} with a URL, user and password.
     *
     * @param url JDBC URL
     * @param user database user
     * @param password database password
     * @return this builder
     */
    public Builder dsn(final String url, final String user, final String password) {
      this.dsnUrl = url;
      this.dsnUser = user;
      this.dsnPassword = password;
      this.dsnProperties = null;
      return this;
    }

    /**
     * Connects through {@link java.sql.DriverManager} with a URL and driver properties.
     *
     * @param url JDBC URL
     * @param info driver properties
     * @return this builder
     */
    public Builder dsn(final String url, final Properties info) {
      this.dsnUrl = url;
      this.dsnUser = null;
      this.dsnPassword = null;
      this.dsnProperties = info == null ? new Properties() : info;
      return this;
    }

    /**
     * Sets the retry policy for reconnects.
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
     * Sets a policy that forces reconnects independently of liveness.
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
     * Reconnects once the physical connection is older than {@code reconnectPeriod}. Evaluated in
     * addition to the staleness policy.
     *
     * <p>Default: null (disabled)
     *
     * @param reconnectPeriod maximum physical connection age
     * @return this builder
     */
    public Builder reconnectPeriod(final Duration reconnectPeriod) {
      this.reconnectPeriod = reconnectPeriod;
      return this;
    }

    /**
     * Sets the probe used to detect dead physical connections.
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
     * Sets the source of the caller's process and thread identity.
     *
     * <p>Default: {@link OwnerIdentity.Source#jvm()}
     *
     * @param identitySource identity source
     * @return this builder
     */
    public Builder ownerIdentitySource(final OwnerIdentity.Source identitySource) {
      this.identitySource = identitySource;
      return this;
    }

    /**
     * Sets the clock used for connect, reconnect and transaction timestamps.
     *
     * <p>Default: {@link Clock#systemUTC()}
     *
     * @param clock time source
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets an initial local attribute ({@code x_safe_*}, {@code PrintError} or {@code RaiseError}).
     *
     * @param name attribute name
     * @param value attribute value
     * @return this builder
     */
    public Builder attribute(final String name, final Object value) {
      this.attributes.put(name, value);
      return this;
    }

    /**
     * Builds the SafeConnection. No physical connection is opened until first use.
     *
     * @return configured SafeConnection
     * @throws IllegalStateException if no way to connect is configured or a policy is null
     * @throws IllegalArgumentException if the reconnect period or an attribute is invalid
     */
    public SafeConnection build() {
      if (connectFactory == null && (dsnUrl == null || dsnUrl.isBlank()))
        throw new IllegalStateException("connectFactory or dsn is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (stalenessPolicy == null)
        throw new IllegalStateException("stalenessPolicy cannot be null");
      if (livenessProbe == null) throw new IllegalStateException("livenessProbe cannot be null");
      if (identitySource == null)
        throw new IllegalStateException("ownerIdentitySource cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (reconnectPeriod != null && (reconnectPeriod.isNegative() || reconnectPeriod.isZero()))
        throw new IllegalArgumentException("reconnectPeriod must be positive");
      for (final var name : attributes.keySet()) {
        if (AttributeRouter.route(name) != AttributeRouter.Route.LOCAL
            || AttributeRouter.ACTIVE.equals(name)
            || AttributeRouter.AUTO_COMMIT.equals(name))
          throw new IllegalArgumentException("Not a settable local attribute: " + name);
      }

      final var factory =
          connectFactory != null
              ? connectFactory
              : dsnProperties != null
                  ? ConnectFactory.fromUrl(dsnUrl, dsnProperties)
                  : ConnectFactory.fromUrl(dsnUrl, dsnUser, dsnPassword);
      final var periodPolicy =
          reconnectPeriod == null ? null : StalenessPolicy.maxAge(reconnectPeriod, clock);

      return SafeConnectionHandler.newConnection(
          factory,
          retryPolicy,
          stalenessPolicy,
          periodPolicy,
          livenessProbe,
          identitySource,
          clock,
          new LinkedHashMap<>(attributes));
    }
  }
}
