package io.relay.spi;

import java.util.List;

/**
 * Downstream transport. Called only from the publisher's single dispatch thread.
 */
public interface Sink {

  /**
   * Opens a connection.
   *
   * @throws SinkException if the sink cannot be reached
   */
  SinkConnection connect() throws SinkException;

  /**
   * Sends a batch in order. Returns normally only when every message was accepted.
   *
   * @throws SinkException on failure, with the number of leading messages accepted
   */
  void send(SinkConnection connection, List<byte[]> payloads) throws SinkException;

  /**
   * Closes a connection. Must not throw for an already broken connection.
   */
  void close(SinkConnection connection);
}
