package com.github.statechart.model;

/**
 * Kinds of transient vertices.
 */
public enum PseudostateKind {
  INITIAL,
  CHOICE,
  JOIN,
  FORK,
  ENTRY_POINT,
  EXIT_POINT,
  JUNCTION,
  DEEP_HISTORY,
  SHALLOW_HISTORY,
  TERMINATE;

  public boolean isHistory() {
    return this == DEEP_HISTORY || this == SHALLOW_HISTORY;
  }
}
