package com.github.statechart.structure;

import com.github.statechart.model.NodeKind;
import com.github.statechart.model.PseudostateKind;

public final class Pseudostate extends Vertex {
  private final PseudostateKind pseudostateKind;

  Pseudostate(final int id, final String name, final String qualifiedName,
      final PseudostateKind pseudostateKind) {
    super(id, name, qualifiedName, NodeKind.PSEUDOSTATE);
    this.pseudostateKind = pseudostateKind;
  }

  public PseudostateKind getPseudostateKind() {
    return pseudostateKind;
  }

  @Override
  public String toString() {
    return "Pseudostate [" + getQualifiedName() + ", " + pseudostateKind + "]";
  }
}
