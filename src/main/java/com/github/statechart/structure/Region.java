package com.github.statechart.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.statechart.model.NodeKind;

/**
 * Container of vertices. Owned either by a state or by a state machine, never both.
 */
public final class Region extends Element {
  private final List<Vertex> subvertex = new ArrayList<>();
  private final boolean synthesized;
  private State state;
  private Statechart stateMachine;
  private Pseudostate initial;

  Region(final int id, final String name, final String qualifiedName, final boolean synthesized) {
    super(id, name, qualifiedName, NodeKind.REGION);
    this.synthesized = synthesized;
  }

  public List<Vertex> getSubvertex() {
    return Collections.unmodifiableList(subvertex);
  }

  /**
   * True if the compiler created this region for vertices owned directly by a state or machine.
   */
  public boolean isSynthesized() {
    return synthesized;
  }

  public State getState() {
    return state;
  }

  public Statechart getStateMachine() {
    return stateMachine;
  }

  public Pseudostate getInitial() {
    return initial;
  }

  /**
   * The owning state, or the submachine state for a region of a submachine. Null at the top level.
   */
  public State getOwnerState() {
    if (state != null) {
      return state;
    }
    return stateMachine != null ? stateMachine.getSubmachineState() : null;
  }

  void addSubvertex(final Vertex vertex) {
    subvertex.add(vertex);
    vertex.setContainer(this);
  }

  void setState(final State state) {
    this.state = state;
  }

  void setStateMachine(final Statechart stateMachine) {
    this.stateMachine = stateMachine;
  }

  void setInitial(final Pseudostate initial) {
    this.initial = initial;
  }
}
