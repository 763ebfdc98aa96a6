package com.github.statechart;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wall clock time. Timers of all machines share a single daemon thread that does nothing but hand
 * expired timers over to the owning machine's loop.
 */
public final class SystemClock implements Clock {
  private static final SystemClock instance = new SystemClock();

  public static SystemClock getInstance() {
    return instance;
  }

  @Override
  public Instant now() {
    return Instant.now();
  }

  @Override
  public Cancellable schedule(final Duration delay, final Runnable task) {
    final long delayNanos = Math.max(0L, delay.toNanos());
    final ScheduledFuture<?> future =
        TimerHolder.timer.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
    return new Cancellable() {
      @Override
      public void cancel() {
        future.cancel(false);
      }

      @Override
      public boolean isCancelled() {
        return future.isCancelled();
      }
    };
  }

  @Override
  public String toString() {
    return "SystemClock";
  }

  private SystemClock() {}

  // lazily fired up on first use
  private static final class TimerHolder {
    private static final ScheduledExecutorService timer = newTimer();

    private static ScheduledExecutorService newTimer() {
      final ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
        final Thread thread = new Thread(runnable, "statechart-timer");
        thread.setDaemon(true);
        return thread;
      });
      timer.setRemoveOnCancelPolicy(true);
      return timer;
    }
  }
}
