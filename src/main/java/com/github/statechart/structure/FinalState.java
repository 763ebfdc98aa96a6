package com.github.statechart.structure;

import com.github.statechart.Behavior;
import com.github.statechart.model.NodeKind;

/**
 * Entering a final state completes its region.
 */
public final class FinalState extends Vertex {
  // kept only so that the validator can reject it
  private Behavior exit;

  FinalState(final int id, final String name, final String qualifiedName) {
    super(id, name, qualifiedName, NodeKind.FINAL_STATE);
  }

  public Behavior getExit() {
    return exit;
  }

  void setExit(final Behavior exit) {
    this.exit = exit;
  }
}
