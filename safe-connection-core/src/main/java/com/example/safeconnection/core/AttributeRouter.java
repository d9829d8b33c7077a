package com.example.safeconnection.core;

import java.sql.SQLException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Separates attributes kept on the logical connection from attributes of the physical connection.
 *
 * <p>Local attributes are the {@code x_safe_*} bookkeeping keys and {@code Active}, {@code
 * AutoCommit}, {@code PrintError} and {@code RaiseError}. They survive reconnects and reading them
 * never opens a physical connection. Every other name is remote: the physical connection is
 * made usable first, then the matching JDBC accessor ({@code getReadOnly}/{@code isReadOnly},
 * {@code setCatalog}, ...) is called, falling back to the connection's client info.
 */
final class AttributeRouter {

  /** Where an attribute lives. */
  enum Route {
    LOCAL,
    REMOTE
  }

  static final String LOCAL_PREFIX = "x_safe_";
  static final String ACTIVE = "Active";
  static final String AUTO_COMMIT = "AutoCommit";
  static final String PRINT_ERROR = "PrintError";
  static final String RAISE_ERROR = "RaiseError";

  private static final Set<String> LOCAL_NAMES =
      Set.of(ACTIVE, AUTO_COMMIT, PRINT_ERROR, RAISE_ERROR);

  private final ReconnectionEngine engine;
  private final TransactionTracker tracker;
  private final CallForwarder forwarder;
  private final Map<String, Object> locals = new ConcurrentHashMap<>();

  AttributeRouter(
      final ReconnectionEngine engine,
      final TransactionTracker tracker,
      final CallForwarder forwarder,
      final Map<String, Object> initial) {
    this.engine = engine;
    this.tracker = tracker;
    this.forwarder = forwarder;
    locals.put(RAISE_ERROR, Boolean.TRUE);
    initial.forEach(this::putLocal);
  }

  static Route route(final String name) {
    if (name.startsWith(LOCAL_PREFIX) || LOCAL_NAMES.contains(name)) return Route.LOCAL;
    return Route.REMOTE;
  }

  Object read(final String name) throws SQLException {
    if (route(name) == Route.REMOTE) return readRemote(name);

    return switch (name) {
      case ACTIVE -> engine.state().isActive();
      case AUTO_COMMIT -> engine.state().isAutoCommit();
      case PRINT_ERROR -> forwarder.isPrintError();
      default -> locals.get(name);
    };
  }

  void write(final String name, final Object value) throws SQLException {
    if (route(name) == Route.REMOTE) {
      writeRemote(name, value);
      return;
    }

    switch (name) {
      case ACTIVE -> {
        if (!toBoolean(name, value)) engine.shutdown();
        else if (!engine.state().isActive())
          throw new SQLException("A closed connection cannot be reactivated", "08003");
      }
      case AUTO_COMMIT -> tracker.setAutoCommit(toBoolean(name, value));
      default -> putLocal(name, value);
    }
  }

  private void putLocal(final String name, final Object value) {
    if (PRINT_ERROR.equals(name)) {
      forwarder.setPrintError(
          value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value)));
    } else if (value == null) {
      locals.remove(name);
    } else {
      locals.put(name, value);
    }
  }

  private Object readRemote(final String name) throws SQLException {
    final var getter = forwarder.resolve("get" + name, new Object[0]);
    if (getter.isPresent()) return forwarder.forward(getter.get(), null);

    final var predicate = forwarder.resolve("is" + name, new Object[0]);
    if (predicate.isPresent()) return forwarder.forward(predicate.get(), null);

    return forwarder.forward("getClientInfo", name);
  }

  private void writeRemote(final String name, final Object value) throws SQLException {
    final var args = new Object[] {value};
    final var setter = forwarder.resolve("set" + name, args);
    if (setter.isPresent()) {
      forwarder.forward(setter.get(), args);
      return;
    }
    forwarder.forward("setClientInfo", name, value == null ? null : String.valueOf(value));
  }

  private static boolean toBoolean(final String name, final Object value) throws SQLException {
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) return Boolean.parseBoolean(s);
    if (value instanceof Number n) return n.intValue() != 0;
    throw new SQLException(name + " expects a boolean, got " + value);
  }
}
