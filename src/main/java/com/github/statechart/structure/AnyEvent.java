package com.github.statechart.structure;

import com.github.statechart.Event;
import com.github.statechart.model.EventKind;

/**
 * Matches every event except completion occurrences, which only ever trigger their own state's
 * transitions.
 */
public final class AnyEvent extends EventDeclaration {

  AnyEvent(final int id, final String name, final String qualifiedName) {
    super(id, name, qualifiedName, EventKind.ANY);
  }

  @Override
  public boolean matches(final Event event) {
    return !(event.getOrigin() instanceof CompletionEvent);
  }
}
