package com.github.statechart.structure;

import java.util.Collections;
import java.util.List;

/**
 * Exact vertex sequences of a transition: what to exit, innermost first, and what to enter,
 * outermost first.
 */
public final class TransitionPath {
  private final List<Vertex> leave;
  private final List<Vertex> enter;

  TransitionPath(final List<Vertex> leave, final List<Vertex> enter) {
    this.leave = Collections.unmodifiableList(leave);
    this.enter = Collections.unmodifiableList(enter);
  }

  public List<Vertex> getLeave() {
    return leave;
  }

  public List<Vertex> getEnter() {
    return enter;
  }

  @Override
  public String toString() {
    return "TransitionPath [leave=" + leave + ", enter=" + enter + "]";
  }
}
