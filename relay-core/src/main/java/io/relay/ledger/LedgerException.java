package io.relay.ledger;

/**
 * Thrown when a ledger record cannot be loaded or persisted. The in-memory record is left
 * untouched, so the same reading can be applied again later.
 */
public class LedgerException extends RuntimeException {

  public LedgerException(String message, Throwable cause) {
    super(message, cause);
  }
}
