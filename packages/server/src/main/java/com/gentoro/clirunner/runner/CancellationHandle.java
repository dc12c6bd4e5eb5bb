package com.gentoro.clirunner.runner;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between a {@link Job} and its supervising task.
 *
 * <p>The deadline is a separate timer future feeding the signal, so that a run which ends on its
 * own can {@link #disarm()} it: the pending timer is released and the signal never reports a
 * timeout for a finished job.
 */
public final class CancellationHandle {

  /** Why a run was cancelled. */
  public enum Reason {
    STOPPED,
    TIMED_OUT
  }

  private final CompletableFuture<Reason> signal = new CompletableFuture<>();
  private CompletableFuture<Reason> deadline;

  /** Returns {@code true} if this call fired the signal, {@code false} if it was already fired. */
  public boolean cancel(Reason reason) {
    return signal.complete(reason);
  }

  /** Fire {@link Reason#TIMED_OUT} after {@code timeout} unless cancelled or disarmed earlier. */
  public void armDeadline(Duration timeout) {
    CompletableFuture<Reason> timer =
        new CompletableFuture<Reason>()
            .completeOnTimeout(Reason.TIMED_OUT, timeout.toMillis(), TimeUnit.MILLISECONDS);
    synchronized (this) {
      if (deadline != null) {
        deadline.cancel(false);
      }
      deadline = timer;
    }
    timer.thenAccept(signal::complete);
  }

  /** Cancel a pending deadline. Has no effect on a signal that already fired. */
  public void disarm() {
    CompletableFuture<Reason> timer;
    synchronized (this) {
      timer = deadline;
      deadline = null;
    }
    if (timer != null) {
      // Completing the timer future also removes its task from the shared delay scheduler.
      timer.cancel(false);
    }
  }

  public boolean isCancelled() {
    return signal.isDone();
  }

  public Optional<Reason> reason() {
    return Optional.ofNullable(signal.getNow(null));
  }

  CompletableFuture<Reason> future() {
    return signal;
  }
}
