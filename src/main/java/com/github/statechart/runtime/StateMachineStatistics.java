package com.github.statechart.runtime;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Holder of running counters for one machine. Counters are bumped on the machine's loop and may be
 * read from any thread.
 */
public final class StateMachineStatistics {
  private final String stateMachineId;
  private final long startTstampMillis = System.currentTimeMillis();
  private final AtomicLong steps = new AtomicLong();
  private final AtomicLong eventsDispatched = new AtomicLong();
  private final AtomicLong eventsCompleted = new AtomicLong();
  private final AtomicLong eventsIncomplete = new AtomicLong();
  private final AtomicLong eventsDeferred = new AtomicLong();
  private final AtomicLong transitionsFired = new AtomicLong();
  private final AtomicLong failedSteps = new AtomicLong();

  StateMachineStatistics(final String stateMachineId) {
    this.stateMachineId = stateMachineId;
  }

  public String getMachineId() {
    return stateMachineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getSteps() {
    return steps.get();
  }

  public long getEventsDispatched() {
    return eventsDispatched.get();
  }

  public long getEventsCompleted() {
    return eventsCompleted.get();
  }

  public long getEventsIncomplete() {
    return eventsIncomplete.get();
  }

  public long getEventsDeferred() {
    return eventsDeferred.get();
  }

  public long getTransitionsFired() {
    return transitionsFired.get();
  }

  public long getFailedSteps() {
    return failedSteps.get();
  }

  void stepStarted() {
    steps.incrementAndGet();
  }

  void stepFailed() {
    failedSteps.incrementAndGet();
  }

  void eventDispatched() {
    eventsDispatched.incrementAndGet();
  }

  void eventCompleted() {
    eventsCompleted.incrementAndGet();
  }

  void eventIncomplete() {
    eventsIncomplete.incrementAndGet();
  }

  void eventDeferred() {
    eventsDeferred.incrementAndGet();
  }

  void transitionFired() {
    transitionsFired.incrementAndGet();
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [stateMachineId=" + stateMachineId + ", startTstampMillis="
        + startTstampMillis + ", steps=" + steps + ", failedSteps=" + failedSteps
        + ", eventsDispatched=" + eventsDispatched + ", eventsCompleted=" + eventsCompleted
        + ", eventsIncomplete=" + eventsIncomplete + ", eventsDeferred=" + eventsDeferred
        + ", transitionsFired=" + transitionsFired + "]";
  }
}
