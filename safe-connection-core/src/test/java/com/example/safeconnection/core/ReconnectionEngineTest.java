package com.example.safeconnection.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.safeconnection.core.TestConnections.Fixture;
import com.example.safeconnection.core.TransactionViolationException.Kind;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ReconnectionEngineTest {

  private Fixture fx;

  @BeforeEach
  void setUp() {
    fx = new Fixture();
  }

  @Nested
  @DisplayName("Lazy Connect")
  class LazyConnect {

    @Test
    @DisplayName("Should not connect before first use")
    void shouldNotConnectBeforeFirstUse() {
      assertEquals(0, fx.factory.calls.get());
      assertFalse(fx.state.hasPhysical());
    }

    @Test
    @DisplayName("Should connect on first use and record ownership")
    void shouldConnectOnFirstUse() throws SQLException {
      final var conn = fx.engine.ensureConnected();

      assertSame(fx.factory.last(), conn);
      assertEquals(fx.identity.current(), fx.state.getOwner().orElseThrow());
      assertEquals(fx.clock.instant(), fx.state.getLastConnectedAt().orElseThrow());
      assertEquals(fx.clock.instant(), fx.state.getLastReconnectAt().orElseThrow());
      assertEquals(1, fx.state.getReconnectCount());
    }
  }

  @Nested
  @DisplayName("Reconnect Triggers")
  class ReconnectTriggers {

    @Test
    @DisplayName("Should return the same connection while it stays alive")
    void shouldReturnSameConnectionWhileAlive() throws SQLException {
      final var first = fx.engine.ensureConnected();
      for (int i = 0; i < 5; i++) assertSame(first, fx.engine.ensureConnected());
      assertEquals(1, fx.factory.calls.get());
    }

    @Test
    @DisplayName("Should reconnect when the probe reports the connection dead")
    void shouldReconnectWhenProbeFails() throws SQLException {
      final var first = fx.engine.ensureConnected();
      fx.alive.set(false);

      final var second = fx.engine.ensureConnected();

      assertNotSame(first, second);
      verify(first).close();
    }

    @Test
    @DisplayName("Should reconnect when the staleness policy fires")
    void shouldReconnectWhenStale() throws SQLException {
      final var first = fx.engine.ensureConnected();
      fx.stale.set(true);

      assertNotSame(first, fx.engine.ensureConnected());
    }

    @Test
    @DisplayName("Should reconnect once the reconnect period elapsed")
    void shouldReconnectAfterPeriod() throws SQLException {
      fx = new Fixture(Retry.Policy.once(), Duration.ofMinutes(10));
      final var first = fx.engine.ensureConnected();

      fx.clock.advance(Duration.ofMinutes(10));
      assertSame(first, fx.engine.ensureConnected());

      fx.clock.advance(Duration.ofSeconds(1));
      final var second = fx.engine.ensureConnected();
      assertNotSame(first, second);
      assertEquals(fx.clock.instant(), fx.state.getLastConnectedAt().orElseThrow());
    }

    @Test
    @DisplayName("Should reconnect when used from another thread")
    void shouldReconnectFromAnotherThread() throws Exception {
      final var first = fx.engine.ensureConnected();
      final var executor = Executors.newSingleThreadExecutor();
      try {
        final var fromWorker =
            executor.submit(() -> fx.engine.ensureConnected()).get(5, TimeUnit.SECONDS);
        assertNotSame(first, fromWorker);
        verify(first).close();
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    @DisplayName("Should set aside a connection inherited from another process without closing it")
    void shouldNotCloseConnectionAfterProcessChange() throws SQLException {
      final var parent = fx.engine.ensureConnected();
      fx.identity.fork();

      final var child = fx.engine.ensureConnected();

      assertNotSame(parent, child);
      verify(parent, never()).close();
      assertEquals(fx.identity.current(), fx.state.getOwner().orElseThrow());
    }

    @Test
    @DisplayName("Should give each process its own connection back after a fork")
    void shouldKeepParentConnectionAcrossFork() throws SQLException {
      final var parentPid = fx.identity.current().processId();
      assertEquals("1", fx.tag());

      fx.identity.fork();
      final var childPid = fx.identity.current().processId();
      assertEquals("2", fx.tag());

      fx.identity.switchTo(parentPid);
      assertEquals("1", fx.tag());
      assertEquals(parentPid, fx.state.getOwner().orElseThrow().processId());

      fx.identity.switchTo(childPid);
      assertEquals("2", fx.tag());

      assertEquals(2, fx.factory.count());
      for (final var conn : fx.factory.created) verify(conn, never()).close();
    }

    @Test
    @DisplayName("Should not hand a parked connection back after shutdown")
    void shouldForgetParkedConnectionsOnShutdown() throws SQLException {
      final var parentPid = fx.identity.current().processId();
      final var parent = fx.engine.ensureConnected();
      fx.identity.fork();
      fx.engine.ensureConnected();

      fx.engine.shutdown();
      fx.identity.switchTo(parentPid);

      assertThrows(SQLException.class, fx.engine::ensureConnected);
      verify(parent, never()).close();
      verify(fx.factory.last()).close();
    }

    @Test
    @DisplayName("Should not probe when the thread already changed")
    void shouldCheckOwnershipBeforeProbing() throws Exception {
      final var probes = new AtomicInteger();
      final var factory = new TestConnections.TaggingFactory();
      final var engine =
          new ReconnectionEngine(
              new ConnectionState(),
              factory,
              Retry.Policy.once(),
              StalenessPolicy.never(),
              null,
              conn -> {
                probes.incrementAndGet();
                return true;
              },
              OwnerIdentity.Source.jvm(),
              fx.clock,
              new ReentrantLock());
      engine.ensureConnected();

      CompletableFuture.runAsync(
              () -> {
                try {
                  engine.ensureConnected();
                } catch (final SQLException e) {
                  throw new RuntimeException(e);
                }
              })
          .get(5, TimeUnit.SECONDS);

      assertEquals(0, probes.get());
      assertEquals(2, factory.count());
    }
  }

  @Nested
  @DisplayName("Transaction Guard")
  class TransactionGuard {

    @Test
    @DisplayName("Should refuse to reconnect inside a transaction")
    void shouldRefuseReconnectInTransaction() throws SQLException {
      final var physical = fx.engine.ensureConnected();
      fx.tracker.begin();
      fx.alive.set(false);

      final var e = assertThrows(TransactionViolationException.class, fx.engine::ensureConnected);

      assertEquals(Kind.RECONNECT_IN_TRANSACTION, e.kind());
      assertEquals("25000", e.getSQLState());
      assertTrue(fx.state.hasPhysical());
      assertSame(physical, fx.state.physical());
      assertEquals(1, fx.factory.calls.get());
      verify(physical, never()).close();
    }

    @Test
    @DisplayName("Should refuse a thread change inside a transaction")
    void shouldRefuseThreadChangeInTransaction() throws Exception {
      fx.tracker.begin();

      final var failure =
          CompletableFuture.supplyAsync(
                  () -> {
                    try {
                      fx.engine.ensureConnected();
                      return null;
                    } catch (final SQLException e) {
                      return e;
                    }
                  })
              .get(5, TimeUnit.SECONDS);

      assertInstanceOf(TransactionViolationException.class, failure);
      assertEquals(1, fx.factory.count());
    }
  }

  @Nested
  @DisplayName("Retry Loop")
  class RetryLoop {

    @Test
    @DisplayName("Should give up after one failed attempt by default")
    void shouldGiveUpAfterOneAttempt() {
      final var cause = new SQLException("connection refused", "08001");
      fx.factory.failingWith(cause);

      final var e = assertThrows(ConnectionExhaustedException.class, fx.engine::ensureConnected);

      assertSame(cause, e.getCause());
      assertEquals(1, e.attempts());
      assertTrue(e.getMessage().contains("connection refused"));
      assertSame(e, fx.state.getLastError().orElseThrow());
      assertFalse(fx.state.hasPhysical());
    }

    @Test
    @DisplayName("Should raise exhaustion when the policy permits no attempt")
    void shouldRaiseWhenPolicyDeclines() {
      fx = new Fixture(attempt -> false, null);

      final var e = assertThrows(ConnectionExhaustedException.class, fx.engine::ensureConnected);

      assertEquals(0, e.attempts());
      assertEquals(0, fx.factory.calls.get());
      assertTrue(fx.state.getLastError().isPresent());
    }

    @Test
    @DisplayName("Should keep trying while the policy permits")
    void shouldRetryUntilSuccess() throws SQLException {
      fx = new Fixture(Retry.Policy.attempts(3), null);
      fx.factory.failingWith(new SQLException("refused"), new SQLException("refused again"));

      final var conn = fx.engine.ensureConnected();

      assertSame(fx.factory.last(), conn);
      assertEquals(3, fx.factory.calls.get());
      assertEquals("refused again", fx.state.getLastError().orElseThrow().getMessage());
    }

    @Test
    @DisplayName("Should treat runtime failures and null connections as failed attempts")
    void shouldTreatRuntimeFailuresAsAttempts() throws SQLException {
      final var calls = new AtomicInteger();
      final var physical = mock(Connection.class);
      final var engine =
          new ReconnectionEngine(
              new ConnectionState(),
              () ->
                  switch (calls.incrementAndGet()) {
                    case 1 -> throw new IllegalStateException("driver blew up");
                    case 2 -> null;
                    default -> physical;
                  },
              Retry.Policy.attempts(3),
              StalenessPolicy.never(),
              null,
              conn -> true,
              OwnerIdentity.Source.jvm(),
              fx.clock,
              new ReentrantLock());

      assertSame(physical, engine.ensureConnected());
      assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Should pass increasing attempt numbers to the policy")
    void shouldPassAttemptNumbers() {
      final var seen = new ArrayList<Integer>();
      fx = new Fixture(attempt -> seen.add(attempt) && attempt <= 2, null);
      fx.factory.failingWith(new SQLException("a"), new SQLException("b"));

      assertThrows(ConnectionExhaustedException.class, fx.engine::ensureConnected);
      assertEquals(List.of(1, 2, 3), seen);
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Should close the physical connection on shutdown")
    void shouldCloseOnShutdown() throws SQLException {
      final var physical = fx.engine.ensureConnected();

      fx.engine.shutdown();

      verify(physical).close();
      assertFalse(fx.state.isActive());
      final var e = assertThrows(SQLException.class, fx.engine::ensureConnected);
      assertEquals("08003", e.getSQLState());
    }

    @Test
    @DisplayName("Should not close a connection of another process on shutdown")
    void shouldNotCloseInheritedConnectionOnShutdown() throws SQLException {
      final var physical = fx.engine.ensureConnected();
      fx.identity.fork();

      fx.engine.shutdown();

      verify(physical, never()).close();
    }

    @Test
    @DisplayName("Should ignore close failures of replaced connections")
    void shouldIgnoreCloseFailures() throws SQLException {
      final var first = fx.engine.ensureConnected();
      doThrow(new SQLException("already gone")).when(first).close();
      fx.alive.set(false);

      assertNotSame(first, fx.engine.ensureConnected());
    }

    @Test
    @DisplayName("Should replace the connection on forced reconnect")
    void shouldReplaceOnForcedReconnect() throws SQLException {
      final var first = fx.engine.ensureConnected();
      fx.clock.advance(Duration.ofSeconds(5));

      final var second = fx.engine.reconnect();

      assertNotSame(first, second);
      verify(first).close();
      assertEquals(fx.clock.instant(), fx.state.getLastReconnectAt().orElseThrow());
    }
  }
}
