package io.relay.spi;

/**
 * Opaque handle to an open sink connection, owned by the publisher's dispatch thread.
 */
public interface SinkConnection {

  /**
   * @return {@code false} once the transport knows the connection is dead
   */
  default boolean isOpen() {
    return true;
  }
}
