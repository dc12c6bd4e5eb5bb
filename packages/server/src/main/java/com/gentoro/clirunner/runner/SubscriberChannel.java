package com.gentoro.clirunner.runner;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded outbound queue for one stream reader. Offers never block: when the queue is full the
 * event is dropped for this subscriber only. Once closed, queued events can still be drained.
 */
final class SubscriberChannel {
  private final int capacity;
  private final ArrayDeque<JobEvent> queue;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private boolean closed;
  private long dropped;

  SubscriberChannel(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
    }
    this.capacity = capacity;
    this.queue = new ArrayDeque<>(capacity);
  }

  /** Returns {@code false} when the event was dropped because the channel is full or closed. */
  boolean offer(JobEvent event) {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      if (queue.size() >= capacity) {
        dropped++;
        return false;
      }
      queue.addLast(event);
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Wait up to {@code timeout} for the next event. Returns {@code null} on timeout or when the
   * channel is closed and empty; use {@link #isDrained()} to tell the two apart.
   */
  JobEvent poll(Duration timeout) throws InterruptedException {
    long nanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !closed) {
        if (nanos <= 0) {
          return null;
        }
        nanos = changed.awaitNanos(nanos);
      }
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  void close() {
    lock.lock();
    try {
      closed = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  boolean isDrained() {
    lock.lock();
    try {
      return closed && queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  long droppedCount() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }
}
