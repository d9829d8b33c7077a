package com.example.safeconnection.core;

/**
 * Process and thread that opened a physical connection.
 *
 * <p>Captured when a physical connection is created and compared with the caller's identity on
 * every use. A different thread means the connection migrated; a different process means the
 * transport was inherited by another process image and must not be closed from this side.
 *
 * @param processId operating system process id
 * @param threadId id of the opening thread
 */
public record OwnerIdentity(long processId, long threadId) {

  /**
   * Identity of the calling thread in this JVM.
   *
   * @return current identity
   */
  public static OwnerIdentity current() {
    return new OwnerIdentity(ProcessHandle.current().pid(), Thread.currentThread().getId());
  }

  /**
   * Whether this identity and {@code other} belong to the same process.
   *
   * @param other identity to compare with
   * @return true if the process ids match
   */
  public boolean sameProcess(final OwnerIdentity other) {
    return processId == other.processId;
  }

  /**
   * Whether this identity and {@code other} belong to the same thread.
   *
   * @param other identity to compare with
   * @return true if the thread ids match
   */
  public boolean sameThread(final OwnerIdentity other) {
    return threadId == other.threadId;
  }

  /** Source of the caller's identity. Replaceable so tests can simulate a changed process. */
  @FunctionalInterface
  public interface Source {

    /**
     * Returns the identity of the caller.
     *
     * @return caller identity
     */
    OwnerIdentity current();

    /**
     * The JVM process id and the current thread id.
     *
     * @return default identity source
     */
    static Source jvm() {
      return OwnerIdentity::current;
    }
  }
}
