package com.github.statechart;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * The operation wrapped by a call event. Invoked through {@link StateMachine#call(String, Object...)}.
 */
@FunctionalInterface
public interface CallOperation {

  CompletionStage<?> invoke(final Object... arguments) throws Exception;

  static CallOperation of(final Function<Object[], ?> function) {
    return arguments -> CompletableFuture.completedFuture(function.apply(arguments));
  }
}
