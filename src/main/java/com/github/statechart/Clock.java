package com.github.statechart;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and timer facility used by time events. Injected through
 * {@link StateMachineConfiguration} so that machines can run against wall clock time
 * ({@link SystemClock}) or against virtual time ({@link ManualClock}).
 *
 * Timer tasks may run on any thread, the interpreter hops back onto its own loop before touching
 * machine state.
 */
public interface Clock {

  Instant now();

  Cancellable schedule(final Duration delay, final Runnable task);
}
