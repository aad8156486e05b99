package io.relay.publish;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded two-lane FIFO of {@link Envelope}s.
 *
 * <p>HIGH envelopes are handed out before NORMAL ones; within a lane order is preserved.
 * The combined size never exceeds the capacity. When full, an offer evicts the oldest NORMAL
 * envelope, or is rejected if only HIGH envelopes are queued.
 *
 * <p>Envelopes stay queued while a batch is being sent. {@link #peekBatch(int)} does not
 * remove anything; the sender calls {@link #remove(List)} after the sink acknowledged them.
 * Thread-safe; producers may offer concurrently with the single consumer.
 */
public final class OutboundQueue {
  private final int capacity;
  private final ArrayDeque<Envelope> high = new ArrayDeque<>();
  private final ArrayDeque<Envelope> normal = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition empty = lock.newCondition();

  public OutboundQueue(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Result of {@link #offer(Envelope)}.
   *
   * @param accepted whether the envelope was queued
   * @param evicted  the NORMAL envelope dropped to make room, or {@code null}
   */
  public record Offer(boolean accepted, Envelope evicted) {
  }

  public Offer offer(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    lock.lock();
    try {
      Envelope evicted = null;
      if (sizeLocked() >= capacity) {
        evicted = normal.pollFirst();
        if (evicted == null) {
          return new Offer(false, null);
        }
      }
      lane(envelope).addLast(envelope);
      notEmpty.signalAll();
      return new Offer(true, evicted);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns up to {@code max} envelopes in send order without removing them.
   */
  public List<Envelope> peekBatch(int max) {
    if (max <= 0) {
      throw new IllegalArgumentException("max must be > 0, got: " + max);
    }
    lock.lock();
    try {
      List<Envelope> batch = new ArrayList<>(Math.min(max, sizeLocked()));
      fill(batch, high, max);
      fill(batch, normal, max);
      return batch;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the given envelopes if they are still queued (an envelope may have been evicted
   * while its batch was in flight).
   *
   * @return number of envelopes actually removed
   */
  public int remove(List<Envelope> envelopes) {
    lock.lock();
    try {
      int removed = 0;
      for (Envelope envelope : envelopes) {
        if (removeLocked(envelope)) {
          removed++;
        }
      }
      signalIfEmpty();
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Increments the attempt counter of every envelope that is still queued. Envelopes whose
   * counter reaches {@code maxAttempts} are removed and returned.
   *
   * @return envelopes given up on, in send order
   */
  public List<Envelope> recordFailedAttempt(List<Envelope> envelopes, int maxAttempts) {
    lock.lock();
    try {
      List<Envelope> exhausted = new ArrayList<>();
      for (Envelope envelope : envelopes) {
        if (!contains(envelope)) {
          continue;
        }
        if (envelope.incrementAttempts() >= maxAttempts) {
          removeLocked(envelope);
          exhausted.add(envelope);
        }
      }
      signalIfEmpty();
      return exhausted.isEmpty() ? Collections.emptyList() : exhausted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until at least one envelope is queued.
   *
   * @return {@code true} if the queue is non-empty
   */
  public boolean awaitNotEmpty(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (sizeLocked() == 0) {
        if (nanos <= 0) {
          return false;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until the queue has been drained.
   *
   * @return {@code true} if the queue is empty
   */
  public boolean awaitEmpty(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (sizeLocked() > 0) {
        if (nanos <= 0) {
          return false;
        }
        nanos = empty.awaitNanos(nanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return sizeLocked();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Returns every queued envelope in send order.
   */
  public List<Envelope> snapshot() {
    lock.lock();
    try {
      List<Envelope> all = new ArrayList<>(high);
      all.addAll(normal);
      return all;
    } finally {
      lock.unlock();
    }
  }

  private ArrayDeque<Envelope> lane(Envelope envelope) {
    return envelope.priority() == Priority.HIGH ? high : normal;
  }

  private int sizeLocked() {
    return high.size() + normal.size();
  }

  private boolean contains(Envelope envelope) {
    for (Envelope queued : lane(envelope)) {
      if (queued == envelope) {
        return true;
      }
    }
    return false;
  }

  private boolean removeLocked(Envelope envelope) {
    ArrayDeque<Envelope> lane = lane(envelope);
    if (lane.peekFirst() == envelope) {
      lane.pollFirst();
      return true;
    }
    Iterator<Envelope> it = lane.iterator();
    while (it.hasNext()) {
      if (it.next() == envelope) {
        it.remove();
        return true;
      }
    }
    return false;
  }

  private void signalIfEmpty() {
    if (sizeLocked() == 0) {
      empty.signalAll();
    }
  }

  private static void fill(List<Envelope> batch, ArrayDeque<Envelope> lane, int max) {
    Iterator<Envelope> it = lane.iterator();
    while (batch.size() < max && it.hasNext()) {
      batch.add(it.next());
    }
  }
}
