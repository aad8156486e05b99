package io.relay;

/**
 * Fatal configuration error detected while building the relay. Thrown at startup only; a
 * running relay never throws it.
 */
public class RelayConfigException extends RuntimeException {

  public RelayConfigException(String message) {
    super(message);
  }

  public RelayConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
