package com.mk.fx.qa.load.generator.events;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, best-effort hand-off of {@link RequestEvent}s from workers to an optional consumer.
 *
 * <p>Publishing never blocks: when the queue is full the event is dropped and only counted. A slow
 * or absent consumer therefore never slows the workers down.
 */
public class RequestEventChannel {

  public static final int DEFAULT_CAPACITY = 10_000;

  private final BlockingQueue<RequestEvent> queue;
  private final AtomicLong published = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final int capacity;

  public RequestEventChannel() {
    this(DEFAULT_CAPACITY);
  }

  public RequestEventChannel(int capacity) {
    Preconditions.checkArgument(capacity > 0, "Event channel capacity must be positive: %s", capacity);
    this.capacity = capacity;
    this.queue = new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Offers an event without blocking.
   *
   * @return {@code false} if the channel was full and the event was dropped
   */
  public boolean tryPublish(RequestEvent event) {
    if (event != null && queue.offer(event)) {
      published.incrementAndGet();
      return true;
    }
    dropped.incrementAndGet();
    return false;
  }

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @return the event, or {@code null} if none arrived in time
   */
  public RequestEvent poll(Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** Moves every queued event into {@code sink}; returns how many were moved. */
  public int drainTo(Collection<? super RequestEvent> sink) {
    return queue.drainTo(sink);
  }

  /** Throws away unread events; returns how many were discarded. */
  public int discard() {
    int remaining = queue.size();
    queue.clear();
    return remaining;
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }

  public long published() {
    return published.get();
  }

  public long dropped() {
    return dropped.get();
  }
}
