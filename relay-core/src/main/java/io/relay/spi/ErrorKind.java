package io.relay.spi;

/**
 * Classifies collaborator failures so callers can decide whether to retry.
 */
public enum ErrorKind {
  /** Timeouts, refused connections, garbled frames. Worth retrying. */
  TRANSIENT,
  /** The target is known to be down or busy. Retrying now is pointless, later may work. */
  UNAVAILABLE,
  /** Misconfiguration or a protocol mismatch. Retrying cannot help. */
  FATAL
}
