package com.github.statechart.structure;

import java.util.function.BooleanSupplier;

import com.github.statechart.model.EventKind;

public final class ChangeEvent extends EventDeclaration {
  private final BooleanSupplier expression;

  ChangeEvent(final int id, final String name, final String qualifiedName,
      final BooleanSupplier expression) {
    super(id, name, qualifiedName, EventKind.CHANGE);
    this.expression = expression;
  }

  public BooleanSupplier getExpression() {
    return expression;
  }
}
