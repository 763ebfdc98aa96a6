package com.github.statechart.structure;

import com.github.statechart.CallOperation;
import com.github.statechart.model.EventKind;

public final class CallEvent extends EventDeclaration {
  private final CallOperation operation;

  CallEvent(final int id, final String name, final String qualifiedName,
      final CallOperation operation) {
    super(id, name, qualifiedName, EventKind.CALL);
    this.operation = operation;
  }

  public CallOperation getOperation() {
    return operation;
  }
}
