package com.github.statechart.structure;

import java.time.Duration;
import java.time.Instant;

import com.github.statechart.model.EventKind;

/**
 * Either relative to the moment its source state is entered, or absolute.
 */
public final class TimeEvent extends EventDeclaration {
  private final Duration delay;
  private final Instant deadline;

  TimeEvent(final int id, final String name, final String qualifiedName, final Duration delay,
      final Instant deadline) {
    super(id, name, qualifiedName, EventKind.TIME);
    this.delay = delay;
    this.deadline = deadline;
  }

  public Duration getDelay() {
    return delay;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public boolean isRelative() {
    return delay != null;
  }

  /**
   * Time left until the event fires when armed at the given instant, never negative.
   */
  public Duration delayFrom(final Instant now) {
    final Duration left = isRelative() ? delay : Duration.between(now, deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }
}
