package io.relay.publish;

/**
 * Counters of a {@link PersistentPublisher} since it was built.
 *
 * @param queued            current queue depth
 * @param enqueued          envelopes accepted by {@code publish}
 * @param sent              envelopes acknowledged by the sink
 * @param evicted           NORMAL envelopes dropped to make room for newer ones
 * @param rejected          envelopes refused by {@code publish}
 * @param lost              envelopes discarded after reaching the send attempt limit
 * @param reconnectAttempts sink connect attempts
 * @param batchesSent       batches fully acknowledged by the sink
 * @param sendFailures      failed batch sends
 */
public record PublisherStats(
    int queued,
    long enqueued,
    long sent,
    long evicted,
    long rejected,
    long lost,
    long reconnectAttempts,
    long batchesSent,
    long sendFailures) {

  /**
   * Envelopes that will never be delivered: evicted, rejected or lost.
   */
  public long dropped() {
    return evicted + rejected + lost;
  }
}
