package com.github.statechart.structure;

import com.github.statechart.Event;
import com.github.statechart.model.EventKind;
import com.github.statechart.model.NodeKind;

/**
 * A declared event a transition can be triggered by, or a state can defer.
 */
public abstract class EventDeclaration extends Element {
  private final EventKind eventKind;

  protected EventDeclaration(final int id, final String name, final String qualifiedName,
      final EventKind eventKind) {
    super(id, name, qualifiedName, NodeKind.EVENT);
    this.eventKind = eventKind;
  }

  public EventKind getEventKind() {
    return eventKind;
  }

  /**
   * Whether a dispatched occurrence is an occurrence of this declaration.
   */
  public boolean matches(final Event event) {
    return event.getOrigin() == this;
  }
}
