package io.relay.publish;

/**
 * Delivery priority of an {@link Envelope}. HIGH envelopes are sent ahead of NORMAL ones and
 * are never evicted to make room.
 */
public enum Priority {
  NORMAL,
  HIGH
}
