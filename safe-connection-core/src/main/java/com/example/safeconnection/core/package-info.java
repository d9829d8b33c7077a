/**
 * Root package for the safe-connection library.
 *
 * <p>This package contains a small set of focused classes that keep a single logical JDBC {@link
 * java.sql.Connection Connection} usable across dropped sessions, thread hand-offs and process
 * identity changes, without ever reconnecting silently inside a transaction.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.safeconnection.core.SafeConnection} – the caller-facing connection and
 *       its builder.
 *   <li>{@link com.example.safeconnection.core.SafeDataSource} – DataSource handing out safe
 *       connections over a wrapped DataSource.
 *   <li>{@link com.example.safeconnection.core.ConnectFactory} – opens physical connections.
 *   <li>{@link com.example.safeconnection.core.Retry} – retry policies for the reconnect loop.
 *   <li>{@link com.example.safeconnection.core.StalenessPolicy} – forced reconnect triggers.
 *   <li>{@link com.example.safeconnection.core.LivenessProbe} – dead connection detection.
 *   <li>{@link com.example.safeconnection.core.ConnectionState} – per-connection bookkeeping.
 *   <li>{@link com.example.safeconnection.core.TransactionViolationException} and {@link
 *       com.example.safeconnection.core.ConnectionExhaustedException} – failures reported to
 *       callers.
 * </ul>
 */
package com.example.safeconnection.core;
