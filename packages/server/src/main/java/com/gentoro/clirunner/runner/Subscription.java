package com.gentoro.clirunner.runner;

import java.time.Duration;

/**
 * A live registration on a {@link Job}'s event fan-out. Closing the subscription unsubscribes it;
 * the channel is also closed by the job itself once the job has published its {@code done} event.
 */
public final class Subscription implements AutoCloseable {
  private final Job job;
  private final String subscriberId;
  private final SubscriberChannel channel;

  Subscription(Job job, String subscriberId, SubscriberChannel channel) {
    this.job = job;
    this.subscriberId = subscriberId;
    this.channel = channel;
  }

  public String subscriberId() {
    return subscriberId;
  }

  /**
   * Next event, waiting up to {@code timeout}. Returns {@code null} if nothing arrived in time or
   * the stream has ended.
   */
  public JobEvent poll(Duration timeout) throws InterruptedException {
    return channel.poll(timeout);
  }

  /** True once the job closed this channel and every queued event has been consumed. */
  public boolean isDrained() {
    return channel.isDrained();
  }

  /** Number of events dropped because this subscriber was not keeping up. */
  public long droppedCount() {
    return channel.droppedCount();
  }

  @Override
  public void close() {
    job.unsubscribe(subscriberId);
  }
}
