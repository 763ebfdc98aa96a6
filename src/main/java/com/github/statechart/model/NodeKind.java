package com.github.statechart.model;

/**
 * Tag of every node of the authoring graph, and of every element compiled from it. Algorithms over
 * the graph switch on this tag.
 */
public enum NodeKind {
  STATE_MACHINE,
  STATE,
  FINAL_STATE,
  PSEUDOSTATE,
  REGION,
  TRANSITION,
  EVENT,
  CONSTRAINT,
  BEHAVIOR;

  public boolean isVertex() {
    return this == STATE || this == FINAL_STATE || this == PSEUDOSTATE;
  }
}
