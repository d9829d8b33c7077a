package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.DEBUG;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Invocation handler behind every {@link SafeConnection}.
 *
 * <p>Transaction control goes to the {@link TransactionTracker}, attribute access to the {@link
 * AttributeRouter}, lifecycle and identity methods are answered locally, and everything else is
 * forwarded to the live physical connection by the {@link CallForwarder}.
 */
final class SafeConnectionHandler implements InvocationHandler {

  private static final System.Logger LOGGER =
      System.getLogger(SafeConnectionHandler.class.getName());

  private final ReconnectionEngine engine;
  private final TransactionTracker tracker;
  private final CallForwarder forwarder;
  private final AttributeRouter router;

  private SafeConnectionHandler(
      final ReconnectionEngine engine, final Map<String, Object> attributes) {
    this.engine = engine;
    this.tracker = new TransactionTracker(engine);
    this.forwarder = new CallForwarder(engine);
    this.router = new AttributeRouter(engine, tracker, forwarder, attributes);
  }

  static SafeConnection newConnection(
      final ConnectFactory connectFactory,
      final Retry.Policy retryPolicy,
      final StalenessPolicy stalenessPolicy,
      final StalenessPolicy periodPolicy,
      final LivenessProbe livenessProbe,
      final OwnerIdentity.Source identitySource,
      final Clock clock,
      final Map<String, Object> attributes) {
    final var engine =
        new ReconnectionEngine(
            new ConnectionState(),
            connectFactory,
            retryPolicy,
            stalenessPolicy,
            periodPolicy,
            livenessProbe,
            identitySource,
            clock,
            new ReentrantLock());
    return (SafeConnection)
        Proxy.newProxyInstance(
            SafeConnection.class.getClassLoader(),
            new Class<?>[] {SafeConnection.class},
            new SafeConnectionHandler(engine, attributes));
  }

  @Override
  public Object invoke(final Object proxy, final Method method, final Object[] args)
      throws Throwable {
    final var arity = method.getParameterCount();
    switch (method.getName()) {
      case "equals":
        if (arity == 1) return proxy == args[0];
        break;
      case "hashCode":
        if (arity == 0) return System.identityHashCode(proxy);
        break;
      case "toString":
        if (arity == 0) return describe(proxy);
        break;
      case "close":
        if (arity == 0) {
          engine.shutdown();
          return null;
        }
        break;
      case "abort":
        if (arity == 1) {
          engine.shutdown();
          return null;
        }
        break;
      case "isClosed":
        if (arity == 0) return !engine.state().isActive();
        break;
      case "isValid":
        if (arity == 1) return isValid((Integer) args[0]);
        break;
      case "getAutoCommit":
        if (arity == 0) return engine.state().isAutoCommit();
        break;
      case "setAutoCommit":
        if (arity == 1) {
          tracker.setAutoCommit((Boolean) args[0]);
          return null;
        }
        break;
      case "beginTransaction":
        tracker.begin();
        return null;
      case "commit":
        if (arity == 0) {
          tracker.commit();
          return null;
        }
        break;
      case "rollback":
        if (arity == 0) {
          tracker.rollback();
          return null;
        }
        break;
      case "getPhysicalConnection":
        return engine.ensureConnected();
      case "reconnect":
        return engine.reconnect();
      case "getAttribute":
        return router.read((String) args[0]);
      case "setAttribute":
        router.write((String) args[0], args[1]);
        return null;
      case "forward":
        return forwarder.forward((String) args[0], (Object[]) args[1]);
      case "getState":
        return snapshot();
      case "unwrap":
        if (arity == 1 && ((Class<?>) args[0]).isInstance(proxy))
          return ((Class<?>) args[0]).cast(proxy);
        break;
      case "isWrapperFor":
        if (arity == 1 && ((Class<?>) args[0]).isInstance(proxy)) return true;
        break;
      default:
        break;
    }
    return forwarder.forward(method, args);
  }

  private boolean isValid(final int timeoutSeconds) throws SQLException {
    if (timeoutSeconds < 0) throw new SQLException("timeout must be >= 0");
    if (!engine.state().isActive()) return false;
    try {
      final Connection physical = engine.ensureConnected();
      return physical.isValid(timeoutSeconds);
    } catch (final SQLException e) {
      LOGGER.log(DEBUG, "isValid: {0}", e.getMessage());
      return false;
    }
  }

  private ConnectionState.Snapshot snapshot() {
    final var lock = engine.lock();
    lock.lock();
    try {
      return engine.state().snapshot();
    } finally {
      lock.unlock();
    }
  }

  private String describe(final Object proxy) {
    final var state = snapshot();
    return "SafeConnection@"
        + Integer.toHexString(System.identityHashCode(proxy))
        + "[active="
        + state.active()
        + ", connected="
        + state.connected()
        + ", transactionDepth="
        + state.transactionDepth()
        + "]";
  }
}
