package com.github.statechart.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.statechart.StateMachineException;
import com.github.statechart.model.ModelNode;
import com.github.statechart.model.NodeKind;

/**
 * A compiled, validated and immutable state machine. Safe to share between any number of machine
 * instances and threads.
 *
 * The top level chart indexes every element compiled with it, submachines included.
 */
public final class Statechart extends Element {
  private final List<Region> regions = new ArrayList<>();
  private final List<EventDeclaration> pool = new ArrayList<>();
  private final List<Element> elements = new ArrayList<>();
  private final Map<Integer, Element> elementsById = new HashMap<>();
  private State submachineState;

  Statechart(final int id, final String name, final String qualifiedName) {
    super(id, name, qualifiedName, NodeKind.STATE_MACHINE);
  }

  public List<Region> getRegions() {
    return Collections.unmodifiableList(regions);
  }

  /**
   * The state this chart backs when used as a submachine, null otherwise.
   */
  public State getSubmachineState() {
    return submachineState;
  }

  /**
   * Declared events, completion events first.
   */
  public List<EventDeclaration> getPool() {
    return Collections.unmodifiableList(pool);
  }

  /**
   * All elements in compilation order.
   */
  public List<Element> getElements() {
    return Collections.unmodifiableList(elements);
  }

  public Element getElement(final int id) {
    return elementsById.get(id);
  }

  /**
   * The element compiled from the given model node, null if there is none.
   */
  public <T extends Element> T getElement(final ModelNode node, final Class<T> type) {
    return type.cast(elementsById.get(node.getId()));
  }

  public List<Vertex> getVertices() {
    return elementsOf(Vertex.class);
  }

  public List<Transition> getTransitions() {
    return elementsOf(Transition.class);
  }

  private <T extends Element> List<T> elementsOf(final Class<T> type) {
    final List<T> found = new ArrayList<>();
    for (final Element element : elements) {
      if (type.isInstance(element)) {
        found.add(type.cast(element));
      }
    }
    return found;
  }

  /**
   * Lookup a vertex by simple or qualified name. A simple name has to be unique.
   */
  public Vertex findVertex(final String name) throws StateMachineException {
    Vertex found = null;
    for (final Vertex vertex : getVertices()) {
      if (name.equals(vertex.getQualifiedName())) {
        return vertex;
      }
      if (name.equals(vertex.getName())) {
        if (found != null) {
          throw new StateMachineException(StateMachineException.Code.UNKNOWN_ELEMENT,
              "Vertex name " + name + " is ambiguous, use a qualified name");
        }
        found = vertex;
      }
    }
    if (found == null) {
      throw new StateMachineException(StateMachineException.Code.UNKNOWN_ELEMENT,
          "No vertex named " + name + " in " + getQualifiedName());
    }
    return found;
  }

  /**
   * Null if no call event has the name.
   */
  public CallEvent findCallEvent(final String name) {
    for (final Element element : elements) {
      if (element instanceof CallEvent && element.getName().equals(name)) {
        return (CallEvent) element;
      }
    }
    return null;
  }

  void addRegion(final Region region) {
    regions.add(region);
    region.setStateMachine(this);
  }

  void addToPool(final EventDeclaration declaration) {
    pool.add(declaration);
  }

  void index(final Element element) {
    elements.add(element);
    elementsById.put(element.getId(), element);
  }

  void setSubmachineState(final State submachineState) {
    this.submachineState = submachineState;
  }
}
