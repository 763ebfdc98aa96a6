package com.github.statechart;

/**
 * Handle to a scheduled piece of work. Cancellation is cooperative: once {@link #cancel()} returned,
 * the work will not start, work already running completes but its outcome is discarded.
 */
public interface Cancellable {

  void cancel();

  boolean isCancelled();
}
