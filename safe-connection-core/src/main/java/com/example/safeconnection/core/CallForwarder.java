package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.WARNING;

import java.lang.invoke.MethodType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards an operation to the live physical connection, reconnecting first when needed.
 *
 * <p>Operations addressed by name are resolved against the public methods of {@link Connection}
 * and the binding is cached per name and argument types. Results and exceptions of the physical
 * connection are returned to the caller unchanged.
 */
final class CallForwarder {

  private static final System.Logger LOGGER = System.getLogger(CallForwarder.class.getName());

  private static final Method[] CONNECTION_METHODS = Connection.class.getMethods();

  private final ReconnectionEngine engine;
  private final ConcurrentHashMap<Signature, Optional<Method>> bindings = new ConcurrentHashMap<>();
  private volatile boolean printError = true;

  CallForwarder(final ReconnectionEngine engine) {
    this.engine = engine;
  }

  void setPrintError(final boolean printError) {
    this.printError = printError;
  }

  boolean isPrintError() {
    return printError;
  }

  /**
   * Forwards an operation addressed by name.
   *
   * @param name name of a {@link Connection} method
   * @param args arguments, may be null for none
   * @return the physical connection's result
   * @throws SQLFeatureNotSupportedException if no method matches the name and arguments
   * @throws SQLException whatever the engine or the physical connection throws
   */
  Object forward(final String name, final Object... args) throws SQLException {
    final var actual = args == null ? new Object[0] : args;
    final var method =
        resolve(name, actual)
            .orElseThrow(
                () ->
                    new SQLFeatureNotSupportedException(
                        "No connection operation " + name + " accepting " + describe(actual)));
    return forward(method, actual);
  }

  /**
   * Forwards an already resolved method.
   *
   * @param method a {@link Connection} method
   * @param args arguments, may be null for none
   * @return the physical connection's result
   * @throws SQLException whatever the engine or the physical connection throws
   */
  Object forward(final Method method, final Object[] args) throws SQLException {
    final var physical = engine.ensureConnected();
    try {
      return method.invoke(physical, args);
    } catch (final InvocationTargetException e) {
      final var cause = e.getCause();
      if (printError)
        LOGGER.log(WARNING, "{0} failed: {1}", method.getName(), String.valueOf(cause));
      if (cause instanceof SQLException sql) throw sql;
      if (cause instanceof RuntimeException runtime) throw runtime;
      if (cause instanceof Error error) throw error;
      throw new SQLException(cause);
    } catch (final IllegalAccessException e) {
      throw new SQLException("Cannot invoke " + method.getName(), e);
    }
  }

  /**
   * Finds the {@link Connection} method matching a name and arguments.
   *
   * @param name method name
   * @param args arguments
   * @return the method, or empty if none matches
   */
  Optional<Method> resolve(final String name, final Object[] args) {
    return bindings.computeIfAbsent(Signature.of(name, args), signature -> lookup(name, args));
  }

  int cachedBindings() {
    return bindings.size();
  }

  private static Optional<Method> lookup(final String name, final Object[] args) {
    return Arrays.stream(CONNECTION_METHODS)
        .filter(m -> m.getName().equals(name))
        .filter(m -> m.getParameterCount() == args.length)
        .filter(m -> accepts(m.getParameterTypes(), args))
        .findFirst();
  }

  private static boolean accepts(final Class<?>[] parameterTypes, final Object[] args) {
    for (int i = 0; i < parameterTypes.length; i++) {
      final var type = parameterTypes[i];
      if (args[i] == null) {
        if (type.isPrimitive()) return false;
        continue;
      }
      final var boxed = type.isPrimitive() ? MethodType.methodType(type).wrap().returnType() : type;
      if (!boxed.isInstance(args[i])) return false;
    }
    return true;
  }

  private static String describe(final Object[] args) {
    return Arrays.stream(args)
        .map(a -> a == null ? "null" : a.getClass().getSimpleName())
        .toList()
        .toString();
  }

  private record Signature(String name, List<Class<?>> argumentTypes) {
    static Signature of(final String name, final Object[] args) {
      final var types = new ArrayList<Class<?>>(args.length);
      for (final var arg : args) types.add(arg == null ? Void.class : arg.getClass());
      return new Signature(name, types);
    }
  }
}
