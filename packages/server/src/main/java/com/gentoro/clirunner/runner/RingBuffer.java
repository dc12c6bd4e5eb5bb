package com.gentoro.clirunner.runner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-capacity circular buffer keeping the most recent {@code capacity} items. When full, a push
 * overwrites the oldest item. Safe for concurrent readers and writers.
 */
public final class RingBuffer<T> {
  private final Object[] data;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private int head; // next write position
  private int count;

  public RingBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
    }
    this.data = new Object[capacity];
  }

  public void push(T item) {
    lock.writeLock().lock();
    try {
      data[head] = item;
      head = (head + 1) % data.length;
      if (count < data.length) {
        count++;
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Point-in-time copy of the held items, oldest first. */
  @SuppressWarnings("unchecked")
  public List<T> snapshot() {
    lock.readLock().lock();
    try {
      List<T> result = new ArrayList<>(count);
      int start = count < data.length ? 0 : head;
      for (int i = 0; i < count; i++) {
        result.add((T) data[(start + i) % data.length]);
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return count;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int capacity() {
    return data.length;
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      head = 0;
      count = 0;
      Arrays.fill(data, null);
    } finally {
      lock.writeLock().unlock();
    }
  }
}
