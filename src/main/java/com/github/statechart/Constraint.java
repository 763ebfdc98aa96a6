package com.github.statechart;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * A transition guard. Evaluated when the transition is checked against an event; may be
 * asynchronous.
 */
@FunctionalInterface
public interface Constraint {

  CompletionStage<Boolean> evaluate(final Event event) throws Exception;

  static Constraint of(final Predicate<Event> predicate) {
    return event -> CompletableFuture.completedFuture(predicate.test(event));
  }
}
