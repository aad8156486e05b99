package io.relay.spi;

import io.relay.poll.DeviceConfig;
import java.time.Duration;
import java.util.List;

/**
 * Reads the current counters of one device. The wire protocol lives behind this interface.
 *
 * <p>Implementations must be safe for concurrent use on different devices; the coordinator
 * never reads the same device from two threads at once. They should honour the timeout and
 * respond to thread interruption.
 */
@FunctionalInterface
public interface DeviceClient {

  /**
   * @param device  connection parameters
   * @param timeout per-call timeout
   * @return readings, one per channel (may be empty)
   * @throws DeviceReadException if the device could not be read
   * @throws InterruptedException if the calling thread was interrupted
   */
  List<Reading> read(DeviceConfig device, Duration timeout)
      throws DeviceReadException, InterruptedException;
}
