package com.github.statechart;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Virtual time. Nothing happens until {@link #advance(Duration)} is called, which moves the clock
 * forward and runs every timer that became due, earliest deadline first, on the calling thread.
 */
public final class ManualClock implements Clock {
  private final PriorityQueue<Timer> timers = new PriorityQueue<>();
  private Instant now;
  private long sequence;

  public ManualClock() {
    this(Instant.EPOCH);
  }

  public ManualClock(final Instant start) {
    this.now = start;
  }

  @Override
  public synchronized Instant now() {
    return now;
  }

  @Override
  public synchronized Cancellable schedule(final Duration delay, final Runnable task) {
    final Duration effectiveDelay = delay.isNegative() ? Duration.ZERO : delay;
    final Timer timer = new Timer(now.plus(effectiveDelay), sequence++, task);
    timers.add(timer);
    return timer;
  }

  /**
   * Move time forward and fire all timers due at the new instant.
   */
  public void advance(final Duration duration) {
    final List<Timer> due = new ArrayList<>();
    synchronized (this) {
      now = now.plus(duration);
      while (!timers.isEmpty() && !timers.peek().deadline.isAfter(now)) {
        due.add(timers.poll());
      }
    }
    for (final Timer timer : due) {
      if (!timer.isCancelled()) {
        timer.task.run();
      }
    }
  }

  /**
   * Number of timers that are scheduled and not cancelled.
   */
  public synchronized int pendingTimers() {
    int pending = 0;
    final Iterator<Timer> iterator = timers.iterator();
    while (iterator.hasNext()) {
      if (!iterator.next().isCancelled()) {
        pending++;
      }
    }
    return pending;
  }

  @Override
  public String toString() {
    return "ManualClock [now=" + now() + "]";
  }

  private static final class Timer implements Cancellable, Comparable<Timer> {
    private final Instant deadline;
    private final long sequence;
    private final Runnable task;
    private volatile boolean cancelled;

    private Timer(final Instant deadline, final long sequence, final Runnable task) {
      this.deadline = deadline;
      this.sequence = sequence;
      this.task = task;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }

    @Override
    public int compareTo(final Timer other) {
      final int byDeadline = deadline.compareTo(other.deadline);
      return byDeadline != 0 ? byDeadline : Long.compare(sequence, other.sequence);
    }
  }
}
