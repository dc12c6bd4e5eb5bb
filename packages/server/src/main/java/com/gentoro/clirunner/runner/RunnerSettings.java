package com.gentoro.clirunner.runner;

import com.gentoro.clirunner.exception.ConfigException;
import com.gentoro.clirunner.utility.DurationUtility;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of the job engine, read from the {@code process.*} configuration keys.
 *
 * @param defaultTimeout wall-clock deadline of a single run
 * @param maxConcurrent maximum number of pending or running jobs
 * @param cleanupDelay how long a terminal job is kept before the sweep evicts it
 * @param cleanupInterval period of the eviction sweep; never larger than {@code cleanupDelay}
 * @param bufferSize number of events kept per job for replay
 * @param subscriberCapacity queue capacity of each live subscriber
 * @param resultCacheTtl lifetime of a cached {@code result} payload
 */
public record RunnerSettings(
    Duration defaultTimeout,
    int maxConcurrent,
    Duration cleanupDelay,
    Duration cleanupInterval,
    int bufferSize,
    int subscriberCapacity,
    Duration resultCacheTtl) {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);
  public static final int DEFAULT_MAX_CONCURRENT = 10;
  public static final Duration DEFAULT_CLEANUP_DELAY = Duration.ofMinutes(5);
  public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofSeconds(1);
  public static final int DEFAULT_BUFFER_SIZE = 8192;
  public static final int DEFAULT_SUBSCRIBER_CAPACITY = 100;
  public static final Duration DEFAULT_RESULT_CACHE_TTL = Duration.ofMinutes(10);

  public RunnerSettings {
    requirePositive("process.defaultTimeout", defaultTimeout);
    requirePositive("process.cleanupDelay", cleanupDelay);
    requirePositive("process.cleanupInterval", cleanupInterval);
    requirePositive("process.resultCacheTtl", resultCacheTtl);
    if (maxConcurrent <= 0) {
      throw new ConfigException("process.maxConcurrent must be positive, got: " + maxConcurrent);
    }
    if (bufferSize <= 0) {
      throw new ConfigException("process.bufferSize must be positive, got: " + bufferSize);
    }
    if (subscriberCapacity <= 0) {
      throw new ConfigException(
          "process.subscriberCapacity must be positive, got: " + subscriberCapacity);
    }
    if (cleanupInterval.compareTo(cleanupDelay) > 0) {
      cleanupInterval = cleanupDelay;
    }
  }

  public static RunnerSettings defaults() {
    return new RunnerSettings(
        DEFAULT_TIMEOUT,
        DEFAULT_MAX_CONCURRENT,
        DEFAULT_CLEANUP_DELAY,
        DEFAULT_CLEANUP_INTERVAL,
        DEFAULT_BUFFER_SIZE,
        DEFAULT_SUBSCRIBER_CAPACITY,
        DEFAULT_RESULT_CACHE_TTL);
  }

  public static RunnerSettings from(Configuration config) {
    try {
      return new RunnerSettings(
          duration(config, "process.defaultTimeout", DEFAULT_TIMEOUT),
          config.getInt("process.maxConcurrent", DEFAULT_MAX_CONCURRENT),
          duration(config, "process.cleanupDelay", DEFAULT_CLEANUP_DELAY),
          duration(config, "process.cleanupInterval", DEFAULT_CLEANUP_INTERVAL),
          config.getInt("process.bufferSize", DEFAULT_BUFFER_SIZE),
          config.getInt("process.subscriberCapacity", DEFAULT_SUBSCRIBER_CAPACITY),
          duration(config, "process.resultCacheTtl", DEFAULT_RESULT_CACHE_TTL));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve process configuration", e);
    }
  }

  public RunnerSettings withMaxConcurrent(int value) {
    return new RunnerSettings(
        defaultTimeout,
        value,
        cleanupDelay,
        cleanupInterval,
        bufferSize,
        subscriberCapacity,
        resultCacheTtl);
  }

  public RunnerSettings withDefaultTimeout(Duration value) {
    return new RunnerSettings(
        value,
        maxConcurrent,
        cleanupDelay,
        cleanupInterval,
        bufferSize,
        subscriberCapacity,
        resultCacheTtl);
  }

  public RunnerSettings withCleanup(Duration delay, Duration interval) {
    return new RunnerSettings(
        defaultTimeout,
        maxConcurrent,
        delay,
        interval,
        bufferSize,
        subscriberCapacity,
        resultCacheTtl);
  }

  public RunnerSettings withBuffers(int bufferSize, int subscriberCapacity) {
    return new RunnerSettings(
        defaultTimeout,
        maxConcurrent,
        cleanupDelay,
        cleanupInterval,
        bufferSize,
        subscriberCapacity,
        resultCacheTtl);
  }

  private static Duration duration(Configuration config, String key, Duration fallback) {
    String raw = config.getString(key, null);
    return raw == null ? fallback : DurationUtility.parse(raw);
  }

  private static void requirePositive(String key, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new ConfigException(key + " must be a positive duration, got: " + value);
    }
  }
}
