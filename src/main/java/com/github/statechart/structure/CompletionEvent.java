package com.github.statechart.structure;

import com.github.statechart.model.EventKind;

/**
 * Implicit trigger of the transitions of a state that declare none.
 */
public final class CompletionEvent extends EventDeclaration {
  private final State state;

  CompletionEvent(final int id, final State state) {
    super(id, "completion", state.getQualifiedName() + ".completion", EventKind.COMPLETION);
    this.state = state;
  }

  public State getState() {
    return state;
  }
}
