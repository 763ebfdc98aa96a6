package com.github.statechart.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.statechart.model.NodeKind;

/**
 * A node of the state graph that transitions connect: a state, a final state or a pseudostate.
 */
public abstract class Vertex extends Element {
  private Region container;
  private final List<Transition> outgoing = new ArrayList<>();
  private final List<Transition> incoming = new ArrayList<>();

  protected Vertex(final int id, final String name, final String qualifiedName,
      final NodeKind kind) {
    super(id, name, qualifiedName, kind);
  }

  public Region getContainer() {
    return container;
  }

  void setContainer(final Region container) {
    this.container = container;
  }

  /**
   * Outgoing transitions in declaration order, the order they are tried in.
   */
  public List<Transition> getOutgoing() {
    return Collections.unmodifiableList(outgoing);
  }

  public List<Transition> getIncoming() {
    return Collections.unmodifiableList(incoming);
  }

  void addOutgoing(final Transition transition) {
    outgoing.add(transition);
  }

  void addIncoming(final Transition transition) {
    incoming.add(transition);
  }

  /**
   * The state enclosing this vertex, crossing submachine boundaries. Null at the top level.
   */
  public State getOwnerState() {
    return container == null ? null : container.getOwnerState();
  }

  /**
   * True if the given region or state encloses this vertex, at any depth.
   */
  public boolean isDescendantOf(final Element ancestor) {
    Region region = container;
    while (region != null) {
      if (region == ancestor) {
        return true;
      }
      final State state = region.getOwnerState();
      if (state == null) {
        return false;
      }
      if (state == ancestor) {
        return true;
      }
      region = state.getContainer();
    }
    return false;
  }
}
