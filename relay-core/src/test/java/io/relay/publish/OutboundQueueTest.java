package io.relay.publish;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundQueueTest {

  private static Envelope normal(String payload) {
    return Envelope.ofText("d", payload);
  }

  private static Envelope high(String payload) {
    return Envelope.builder("d").payload(payload.getBytes()).priority(Priority.HIGH).build();
  }

  private static List<String> payloads(List<Envelope> envelopes) {
    List<String> result = new ArrayList<>();
    for (Envelope envelope : envelopes) {
      result.add(envelope.payloadText());
    }
    return result;
  }

  @Test
  void fullQueueEvictsOldestNormal() {
    OutboundQueue queue = new OutboundQueue(3);
    Envelope first = normal("1");
    queue.offer(first);
    queue.offer(normal("2"));
    queue.offer(normal("3"));

    OutboundQueue.Offer offer = queue.offer(normal("4"));

    assertTrue(offer.accepted());
    assertSame(first, offer.evicted());
    assertEquals(List.of("2", "3", "4"), payloads(queue.snapshot()));
  }

  @Test
  void highEnvelopeEvictsNormalWhenFull() {
    OutboundQueue queue = new OutboundQueue(2);
    queue.offer(normal("n1"));
    queue.offer(high("h1"));

    OutboundQueue.Offer offer = queue.offer(high("h2"));

    assertTrue(offer.accepted());
    assertEquals("n1", offer.evicted().payloadText());
    assertEquals(List.of("h1", "h2"), payloads(queue.snapshot()));
  }

  @Test
  void rejectsWhenOnlyHighEnvelopesQueued() {
    OutboundQueue queue = new OutboundQueue(2);
    queue.offer(high("h1"));
    queue.offer(high("h2"));

    OutboundQueue.Offer normalOffer = queue.offer(normal("n"));
    OutboundQueue.Offer highOffer = queue.offer(high("h3"));

    assertFalse(normalOffer.accepted());
    assertNull(normalOffer.evicted());
    assertFalse(highOffer.accepted());
    assertEquals(List.of("h1", "h2"), payloads(queue.snapshot()));
  }

  @Test
  void highLaneIsServedFirstWithoutReorderingWithinLanes() {
    OutboundQueue queue = new OutboundQueue(10);
    queue.offer(normal("n1"));
    queue.offer(high("h1"));
    queue.offer(normal("n2"));
    queue.offer(high("h2"));

    assertEquals(List.of("h1", "h2", "n1"), payloads(queue.peekBatch(3)));
    assertEquals(4, queue.size(), "peek does not remove");
  }

  @Test
  void removeIsByIdentityAndSkipsMissing() {
    OutboundQueue queue = new OutboundQueue(2);
    Envelope a = normal("same");
    Envelope b = normal("same");
    queue.offer(a);
    queue.offer(b);
    List<Envelope> batch = queue.peekBatch(1);
    queue.offer(normal("c")); // evicts a

    assertEquals(0, queue.remove(batch));
    assertEquals(List.of(b), queue.peekBatch(1));
  }

  @Test
  void failedAttemptsIncrementAndExhaust() {
    OutboundQueue queue = new OutboundQueue(5);
    Envelope a = normal("a");
    Envelope b = normal("b");
    queue.offer(a);
    queue.offer(b);
    a.incrementAttempts();

    List<Envelope> exhausted = queue.recordFailedAttempt(List.of(a, b), 2);

    assertEquals(List.of(a), exhausted);
    assertEquals(1, b.attempts());
    assertEquals(List.of(b), queue.snapshot());
  }

  @Test
  void awaitEmptyWakesWhenDrained() throws Exception {
    OutboundQueue queue = new OutboundQueue(5);
    Envelope a = normal("a");
    queue.offer(a);
    CountDownLatch waiting = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      var drained = executor.submit(() -> {
        waiting.countDown();
        return queue.awaitEmpty(5, TimeUnit.SECONDS);
      });
      assertTrue(waiting.await(5, TimeUnit.SECONDS));
      queue.remove(List.of(a));

      assertTrue(drained.get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void awaitsTimeOut() throws Exception {
    OutboundQueue queue = new OutboundQueue(1);

    assertFalse(queue.awaitNotEmpty(10, TimeUnit.MILLISECONDS));
    queue.offer(normal("x"));
    assertTrue(queue.awaitNotEmpty(10, TimeUnit.MILLISECONDS));
    assertFalse(queue.awaitEmpty(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void sizeNeverExceedsCapacityUnderConcurrentOffers() throws Exception {
    int capacity = 16;
    OutboundQueue queue = new OutboundQueue(capacity);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch done = new CountDownLatch(4);
    try {
      for (int t = 0; t < 4; t++) {
        executor.execute(() -> {
          for (int i = 0; i < 500; i++) {
            queue.offer(ThreadLocalRandom.current().nextInt(4) == 0 ? high("h") : normal("n"));
            assertTrue(queue.size() <= capacity);
          }
          done.countDown();
        });
      }
      assertTrue(done.await(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
    assertEquals(capacity, queue.size());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new OutboundQueue(0));
    assertThrows(IllegalArgumentException.class, () -> new OutboundQueue(1).peekBatch(0));
    assertThrows(NullPointerException.class, () -> new OutboundQueue(1).offer(null));
  }
}
