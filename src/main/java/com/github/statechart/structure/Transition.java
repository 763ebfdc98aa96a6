package com.github.statechart.structure;

import java.util.Collections;
import java.util.List;

import com.github.statechart.Behavior;
import com.github.statechart.Constraint;
import com.github.statechart.Event;
import com.github.statechart.model.NodeKind;

public final class Transition extends Element {
  private final Vertex source;
  private final Vertex target;
  private final List<EventDeclaration> triggers;
  private final Constraint guard;
  private final Behavior effect;
  private final TransitionKind transitionKind;
  private final Region container;
  private TransitionPath path;

  Transition(final int id, final String name, final String qualifiedName, final Vertex source,
      final Vertex target, final List<EventDeclaration> triggers, final Constraint guard,
      final Behavior effect, final TransitionKind transitionKind, final Region container) {
    super(id, name, qualifiedName, NodeKind.TRANSITION);
    this.source = source;
    this.target = target;
    this.triggers = Collections.unmodifiableList(triggers);
    this.guard = guard;
    this.effect = effect;
    this.transitionKind = transitionKind;
    this.container = container;
  }

  public Vertex getSource() {
    return source;
  }

  /**
   * Null for internal transitions.
   */
  public Vertex getTarget() {
    return target;
  }

  public List<EventDeclaration> getTriggers() {
    return triggers;
  }

  /**
   * Null when unguarded.
   */
  public Constraint getGuard() {
    return guard;
  }

  public Behavior getEffect() {
    return effect;
  }

  public TransitionKind getTransitionKind() {
    return transitionKind;
  }

  /**
   * Least common ancestor region of source and target.
   */
  public Region getContainer() {
    return container;
  }

  public TransitionPath getPath() {
    return path;
  }

  void setPath(final TransitionPath path) {
    this.path = path;
  }

  public boolean matches(final Event event) {
    for (final EventDeclaration trigger : triggers) {
      if (trigger.matches(event)) {
        return true;
      }
    }
    return false;
  }

  public boolean isCompletionTriggered() {
    return triggers.size() == 1 && triggers.get(0) instanceof CompletionEvent;
  }

  @Override
  public String toString() {
    return "Transition [" + getQualifiedName() + ", " + transitionKind + "]";
  }
}
