package io.relay.poll;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one {@link PollingCoordinator#runCycle} call.
 *
 * @param startedAt the instant the cycle was run for
 * @param elapsed   wall time of the cycle
 * @param outcomes  one outcome per configured device, in configuration order
 */
public record CycleResult(Instant startedAt, Duration elapsed, List<DeviceOutcome> outcomes) {

  public CycleResult {
    outcomes = List.copyOf(outcomes);
  }

  public int succeeded() {
    return count(DeviceOutcome.Succeeded.class);
  }

  public int skipped() {
    return count(DeviceOutcome.Skipped.class);
  }

  public int failed() {
    return count(DeviceOutcome.Failed.class);
  }

  public int ledgerFailures() {
    int total = 0;
    for (DeviceOutcome outcome : outcomes) {
      if (outcome instanceof DeviceOutcome.Succeeded s) {
        total += s.ledgerFailures();
      }
    }
    return total;
  }

  public int publishRejections() {
    int total = 0;
    for (DeviceOutcome outcome : outcomes) {
      if (outcome instanceof DeviceOutcome.Succeeded s) {
        total += s.rejectedEnvelopes();
      }
    }
    return total;
  }

  public Optional<DeviceOutcome> outcome(String deviceId) {
    for (DeviceOutcome outcome : outcomes) {
      if (outcome.deviceId().equals(deviceId)) {
        return Optional.of(outcome);
      }
    }
    return Optional.empty();
  }

  private int count(Class<? extends DeviceOutcome> type) {
    int n = 0;
    for (DeviceOutcome outcome : outcomes) {
      if (type.isInstance(outcome)) {
        n++;
      }
    }
    return n;
  }

  @Override
  public String toString() {
    return "CycleResult{succeeded=" + succeeded()
        + ", skipped=" + skipped()
        + ", failed=" + failed()
        + ", elapsed=" + elapsed.toMillis() + "ms}";
  }
}
