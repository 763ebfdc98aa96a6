package com.github.statechart.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.Cancellable;
import com.github.statechart.Clock;
import com.github.statechart.Event;
import com.github.statechart.structure.ChangeEvent;
import com.github.statechart.structure.CompletionEvent;
import com.github.statechart.structure.EventDeclaration;
import com.github.statechart.structure.State;
import com.github.statechart.structure.TimeEvent;
import com.github.statechart.structure.Transition;

/**
 * Produces the events nobody sends: timeouts, satisfied change expressions and completions. A
 * waiter is armed for every such trigger of a transition when its source state is entered, and
 * cancelled when the state exits. A cancelled waiter never fires.
 *
 * Called on the machine's loop only. Timers may expire on any thread, they hop back onto the loop
 * before touching the machine.
 */
final class EventScheduler {
  private static final Logger logger = LogManager.getLogger(EventScheduler.class.getSimpleName());

  private final Interpreter interpreter;
  private final ActiveConfiguration active;
  private final Clock clock;
  private final ScheduledExecutorService loop;
  private final long changePollMillis;

  EventScheduler(final Interpreter interpreter, final ActiveConfiguration active, final Clock clock,
      final ScheduledExecutorService loop, final long changePollMillis) {
    this.interpreter = interpreter;
    this.active = active;
    this.clock = clock;
    this.loop = loop;
    this.changePollMillis = changePollMillis;
  }

  void arm(final Transition transition) {
    final List<Cancellable> armed = new ArrayList<>();
    for (final EventDeclaration trigger : transition.getTriggers()) {
      switch (trigger.getEventKind()) {
        case TIME:
          armed.add(armTime((TimeEvent) trigger));
          break;
        case CHANGE:
          armed.add(armChange((ChangeEvent) trigger));
          break;
        case COMPLETION:
          armed.add(armCompletion((CompletionEvent) trigger));
          break;
        default:
          // signals and calls are sent by callers
          break;
      }
    }
    active.arm(transition, armed);
  }

  void disarm(final Transition transition) {
    active.disarm(transition);
  }

  private Cancellable armTime(final TimeEvent timeEvent) {
    final Waiter waiter = new Waiter();
    final Duration delay = timeEvent.delayFrom(clock.now());
    if (logger.isDebugEnabled()) {
      logger.debug(Interpreter.prefix(interpreter.getMachineId(), timeEvent)
          + "Arming timer to fire in " + delay);
    }
    waiter.timer = clock.schedule(delay, () -> interpreter.runOnLoop(() -> {
      if (!waiter.isCancelled()) {
        interpreter.enqueue(Event.occurrenceOf(timeEvent, clock.now()), null);
      }
    }));
    return waiter;
  }

  private Cancellable armChange(final ChangeEvent changeEvent) {
    final Waiter waiter = new Waiter();
    final Runnable poll = new Runnable() {
      @Override
      public void run() {
        if (waiter.isCancelled()) {
          return;
        }
        final boolean satisfied;
        try {
          satisfied = changeEvent.getExpression().getAsBoolean();
        } catch (RuntimeException problem) {
          interpreter.recordFailure(changeEvent, problem);
          return;
        }
        if (satisfied) {
          interpreter.enqueue(Event.occurrenceOf(changeEvent, null), null);
          return;
        }
        try {
          waiter.poll = loop.schedule(() -> interpreter.runOnLoop(this), changePollMillis,
              TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException rejected) {
          waiter.cancel();
        }
      }
    };
    poll.run();
    return waiter;
  }

  /**
   * Waits for the state's own activity and for the activities of its active descendants. When
   * all of them are already done the completion is marked right away, within the current step.
   */
  private Cancellable armCompletion(final CompletionEvent completion) {
    final Waiter waiter = new Waiter();
    final State state = completion.getState();
    final CompletableFuture<Object> own = active.activityOf(state);
    final List<CompletableFuture<?>> pending = new ArrayList<>();
    if (own != null) {
      pending.add(own.handle((value, error) -> null));
    }
    for (final State descendant : active.activeStatesBelow(state)) {
      final CompletableFuture<Object> activity = active.activityOf(descendant);
      if (activity != null) {
        pending.add(activity.handle((value, error) -> null));
      }
    }
    final CompletableFuture<Void> all =
        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]));
    final Runnable mark = () -> {
      if (waiter.isCancelled() || (own != null && own.isCompletedExceptionally())) {
        return;
      }
      interpreter.markCompletion(completion, own == null ? null : own.getNow(null));
    };
    if (all.isDone()) {
      mark.run();
    } else {
      all.whenComplete((value, error) -> interpreter.runOnLoop(mark));
    }
    return waiter;
  }

  private static final class Waiter implements Cancellable {
    private volatile boolean cancelled;
    private volatile Cancellable timer;
    private volatile Future<?> poll;

    @Override
    public void cancel() {
      cancelled = true;
      final Cancellable timer = this.timer;
      if (timer != null) {
        timer.cancel();
      }
      final Future<?> poll = this.poll;
      if (poll != null) {
        poll.cancel(false);
      }
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
