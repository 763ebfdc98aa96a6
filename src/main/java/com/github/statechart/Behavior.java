package com.github.statechart;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * User code bound to a state's entry, exit or do-activity, or to a transition's effect.
 *
 * Implementations may complete synchronously by returning an already completed stage or run
 * asynchronously on any thread; the interpreter resumes its own loop once the returned stage
 * completes. An exception thrown here, or a stage completed exceptionally, propagates to the caller
 * that awaited the step which ran the behavior.
 */
@FunctionalInterface
public interface Behavior {

  CompletionStage<?> execute(final Event event) throws Exception;

  /**
   * Synchronous behavior.
   */
  static Behavior of(final Action action) {
    return event -> {
      action.run(event);
      return CompletableFuture.completedFuture(null);
    };
  }

  /**
   * Synchronous behavior whose result becomes the value of a completion event.
   */
  static Behavior returning(final Function<Event, ?> function) {
    return event -> CompletableFuture.completedFuture(function.apply(event));
  }

  static Behavior noop() {
    return Noop.INSTANCE;
  }

  @FunctionalInterface
  interface Action {
    void run(final Event event) throws Exception;
  }

  final class Noop implements Behavior {
    private static final Noop INSTANCE = new Noop();

    private Noop() {}

    @Override
    public CompletionStage<?> execute(final Event event) {
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public String toString() {
      return "Behavior [noop]";
    }
  }
}
