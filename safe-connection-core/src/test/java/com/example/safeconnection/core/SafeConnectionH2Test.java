package com.example.safeconnection.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.safeconnection.core.TransactionViolationException.Kind;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.*;

/** Runs SafeConnection against an in-memory H2 database. */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SafeConnectionH2Test {

  private String url;
  private SafeConnection conn;

  @BeforeEach
  void setUp() throws SQLException {
    final var name = UUID.randomUUID().toString().replace("-", "");
    url = "jdbc:h2:mem:safe_" + name + ";DB_CLOSE_DELAY=-1";
    conn = SafeConnection.builder().dsn(url, "sa", "").build();
    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE accounts (id INT PRIMARY KEY, owner VARCHAR(64))");
    }
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
    try (var admin = DriverManager.getConnection(url, "sa", "");
        var stmt = admin.createStatement()) {
      stmt.execute("SHUTDOWN");
    }
  }

  private int count() throws SQLException {
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery("SELECT COUNT(*) FROM accounts")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private int countFromOutside() throws SQLException {
    try (var other = DriverManager.getConnection(url, "sa", "");
        var stmt = other.createStatement();
        var rs = stmt.executeQuery("SELECT COUNT(*) FROM accounts")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private void insert(final int id, final String owner) throws SQLException {
    try (var ps = conn.prepareStatement("INSERT INTO accounts (id, owner) VALUES (?, ?)")) {
      ps.setInt(1, id);
      ps.setString(2, owner);
      ps.executeUpdate();
    }
  }

  @Nested
  @DisplayName("Reconnect")
  class Reconnect {

    @Test
    @DisplayName("Should reconnect after the physical connection was closed underneath")
    void shouldReconnectAfterPhysicalClose() throws SQLException {
      insert(1, "alice");
      final var first = conn.getPhysicalConnection();

      first.close();

      assertEquals(1, count());
      assertNotSame(first, conn.getPhysicalConnection());
      assertEquals(2, conn.getState().reconnectCount());
    }

    @Test
    @DisplayName("Should open a separate physical connection per thread")
    void shouldUseSeparateConnectionPerThread() throws Exception {
      final var mine = conn.getPhysicalConnection();

      final Connection theirs =
          CompletableFuture.supplyAsync(
                  () -> {
                    try {
                      conn.createStatement().close();
                      return conn.getPhysicalConnection();
                    } catch (final SQLException e) {
                      throw new IllegalStateException(e);
                    }
                  })
              .get(10, TimeUnit.SECONDS);

      assertNotSame(mine, theirs);
      assertTrue(mine.isClosed());
    }

    @Test
    @DisplayName("Should connect with driver properties")
    void shouldConnectWithProperties() throws SQLException {
      final var info = new Properties();
      info.setProperty("user", "sa");
      info.setProperty("password", "");

      try (var withProps =
          SafeConnection.builder()
              .dsn(url, info)
              .livenessProbe(LivenessProbe.query("SELECT 1", 1))
              .build()) {
        try (var stmt = withProps.createStatement();
            var rs = stmt.executeQuery("SELECT COUNT(*) FROM accounts")) {
          assertTrue(rs.next());
        }
      }
    }

    @Test
    @DisplayName("Should fail with exhaustion when no driver accepts the URL")
    void shouldFailWithoutDriver() throws SQLException {
      try (var broken =
          SafeConnection.builder()
              .dsn("jdbc:nosuchdriver:orders", "sa", "")
              .retryPolicy(Retry.Policy.attempts(2))
              .build()) {
        final var e = assertThrows(ConnectionExhaustedException.class, broken::createStatement);
        assertEquals(2, e.attempts());
        assertInstanceOf(SQLException.class, e.getCause());
      }
    }
  }

  @Nested
  @DisplayName("Transactions")
  class Transactions {

    @Test
    @DisplayName("Should commit work done inside a transaction")
    void shouldCommit() throws SQLException {
      conn.beginTransaction();
      insert(1, "alice");
      insert(2, "bob");
      assertEquals(0, countFromOutside());

      conn.commit();

      assertEquals(2, countFromOutside());
      assertTrue(conn.getPhysicalConnection().getAutoCommit());
    }

    @Test
    @DisplayName("Should roll back work done inside a transaction")
    void shouldRollback() throws SQLException {
      insert(1, "alice");
      conn.setAutoCommit(false);
      insert(2, "bob");

      conn.rollback();

      assertEquals(1, count());
      assertTrue(conn.getAutoCommit());
    }

    @Test
    @DisplayName("Should not silently reconnect when the connection dies in a transaction")
    void shouldRefuseSilentReconnect() throws SQLException {
      conn.beginTransaction();
      insert(1, "alice");
      conn.getPhysicalConnection().close();

      final var inFlight =
          assertThrows(TransactionViolationException.class, () -> insert(2, "bob"));
      assertEquals(Kind.RECONNECT_IN_TRANSACTION, inFlight.kind());

      final var end = assertThrows(TransactionViolationException.class, conn::commit);
      assertEquals(Kind.DISCONNECTED_DURING_TRANSACTION, end.kind());

      assertEquals(0, count());
      insert(3, "carol");
      assertEquals(1, countFromOutside());
    }

    @Test
    @DisplayName("Should report a forced reconnect at rollback")
    void shouldReportForcedReconnectAtRollback() throws SQLException {
      conn.beginTransaction();
      insert(1, "alice");

      conn.reconnect();

      final var e = assertThrows(TransactionViolationException.class, conn::rollback);
      assertEquals(Kind.DISCONNECTED_DURING_TRANSACTION, e.kind());
      assertEquals(0, countFromOutside());
    }
  }
}
