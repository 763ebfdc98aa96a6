package com.github.statechart.structure;

import com.github.statechart.Event;
import com.github.statechart.model.EventKind;

/**
 * Matches caller sent events of a type, and of a name if one is set.
 */
public final class SignalEvent extends EventDeclaration {
  private final Class<? extends Event> type;
  private final String signal;

  SignalEvent(final int id, final String name, final String qualifiedName,
      final Class<? extends Event> type, final String signal) {
    super(id, name, qualifiedName, EventKind.SIGNAL);
    this.type = type;
    this.signal = signal;
  }

  public Class<? extends Event> getType() {
    return type;
  }

  public String getSignal() {
    return signal;
  }

  @Override
  public boolean matches(final Event event) {
    return event.getOrigin() == null && type.isInstance(event)
        && (signal == null || signal.equals(event.getName()));
  }
}
