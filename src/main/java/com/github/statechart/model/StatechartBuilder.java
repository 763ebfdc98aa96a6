package com.github.statechart.model;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import com.github.statechart.Behavior;
import com.github.statechart.CallOperation;
import com.github.statechart.Constraint;
import com.github.statechart.Event;
import com.github.statechart.StateMachineException;
import com.github.statechart.structure.Statechart;
import com.github.statechart.structure.StatechartCompiler;

/**
 * Fluent authoring API that fills a {@link ModelGraph} with a state machine.
 *
 * Vertices added directly to a state or to the machine, without a declared region, end up in a
 * region synthesized by the compiler. Use {@link #region(ModelNode, String)} to model orthogonal
 * regions explicitly.
 *
 * <pre>
 * StatechartBuilder builder = StatechartBuilder.newBuilder("door");
 * ModelNode closed = builder.state("closed");
 * ModelNode open = builder.state("open");
 * builder.initial(closed);
 * builder.transition(closed, open).on("open");
 * builder.transition(open, closed).on("close").effect(Behavior.of(event -> log(event)));
 * Statechart chart = builder.build();
 * </pre>
 */
public final class StatechartBuilder {
  private final ModelGraph graph;
  private final ModelNode root;

  public static StatechartBuilder newBuilder(final String name) {
    return new StatechartBuilder(new ModelGraph(), name);
  }

  /**
   * Add another machine root to an existing graph, eg. to author a submachine.
   */
  public static StatechartBuilder newBuilder(final ModelGraph graph, final String name) {
    return new StatechartBuilder(graph, name);
  }

  public ModelGraph getGraph() {
    return graph;
  }

  public ModelNode getRoot() {
    return root;
  }

  ///// Vertices and regions /////
  public ModelNode state(final String name) {
    return state(root, name);
  }

  public ModelNode state(final ModelNode owner, final String name) {
    return graph.add(NodeKind.STATE, name, owner);
  }

  public ModelNode finalState(final String name) {
    return finalState(root, name);
  }

  public ModelNode finalState(final ModelNode owner, final String name) {
    return graph.add(NodeKind.FINAL_STATE, name, owner);
  }

  public ModelNode region(final ModelNode owner, final String name) {
    return graph.add(NodeKind.REGION, name, owner);
  }

  public ModelNode pseudostate(final ModelNode owner, final String name,
      final PseudostateKind kind) {
    return graph.add(NodeKind.PSEUDOSTATE, name, owner).setAttribute(ModelNode.PSEUDOSTATE_KIND,
        kind);
  }

  /**
   * Initial pseudostate next to the target, with its single transition to the target.
   */
  public ModelNode initial(final ModelNode target) {
    return initial(graph.ownerOf(target), target, null);
  }

  public ModelNode initial(final ModelNode owner, final ModelNode target, final Behavior effect) {
    final ModelNode initial = pseudostate(owner, "initial", PseudostateKind.INITIAL);
    final TransitionBuilder transition = transition(initial, target);
    if (effect != null) {
      transition.effect(effect);
    }
    return initial;
  }

  public ModelNode choice(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.CHOICE);
  }

  public ModelNode junction(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.JUNCTION);
  }

  public ModelNode join(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.JOIN);
  }

  public ModelNode fork(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.FORK);
  }

  public ModelNode entryPoint(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.ENTRY_POINT);
  }

  public ModelNode exitPoint(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.EXIT_POINT);
  }

  public ModelNode shallowHistory(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.SHALLOW_HISTORY);
  }

  public ModelNode deepHistory(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.DEEP_HISTORY);
  }

  public ModelNode terminate(final ModelNode owner, final String name) {
    return pseudostate(owner, name, PseudostateKind.TERMINATE);
  }

  ///// Submachines /////
  /**
   * A new machine root in the same graph, to be referenced by a submachine state.
   */
  public StatechartBuilder submachine(final String name) {
    return new StatechartBuilder(graph, name);
  }

  public ModelNode submachineState(final ModelNode owner, final String name,
      final StatechartBuilder submachine) {
    return state(owner, name).setReference(ModelNode.SUBMACHINE, submachine.getRoot());
  }

  ///// State behaviors /////
  public StatechartBuilder entry(final ModelNode state, final Behavior behavior) {
    return behavior(state, "entry", behavior);
  }

  public StatechartBuilder exit(final ModelNode state, final Behavior behavior) {
    return behavior(state, "exit", behavior);
  }

  public StatechartBuilder activity(final ModelNode state, final Behavior behavior) {
    return behavior(state, "activity", behavior);
  }

  private StatechartBuilder behavior(final ModelNode owner, final String role,
      final Behavior behavior) {
    final ModelNode node = graph.findChild(owner, NodeKind.BEHAVIOR, role)
        .orElseGet(() -> graph.add(NodeKind.BEHAVIOR, role, owner));
    node.setAttribute(ModelNode.BEHAVIOR, behavior);
    return this;
  }

  /**
   * Events with this name are kept for a later step while the state is active and no transition
   * consumes them.
   */
  public StatechartBuilder defer(final ModelNode state, final String signal) {
    signalEvent(state, signal, Event.class).setAttribute(ModelNode.DEFERRED, Boolean.TRUE);
    return this;
  }

  public StatechartBuilder defer(final ModelNode state, final Class<? extends Event> type) {
    signalEvent(state, null, type).setAttribute(ModelNode.DEFERRED, Boolean.TRUE);
    return this;
  }

  ///// Events /////
  /**
   * A call event owned by the machine, fired through {@code StateMachine.call(name, args)}.
   */
  public ModelNode callEvent(final String name, final CallOperation operation) {
    return graph.add(NodeKind.EVENT, name, root).setAttribute(ModelNode.EVENT_KIND, EventKind.CALL)
        .setAttribute(ModelNode.OPERATION, operation);
  }

  private ModelNode signalEvent(final ModelNode owner, final String signal,
      final Class<? extends Event> type) {
    return graph.add(NodeKind.EVENT, signal != null ? signal : type.getSimpleName(), owner)
        .setAttribute(ModelNode.EVENT_KIND, EventKind.SIGNAL).setAttribute(ModelNode.SIGNAL, signal)
        .setAttribute(ModelNode.EVENT_TYPE, type);
  }

  ///// Transitions /////
  public TransitionBuilder transition(final ModelNode source, final ModelNode target) {
    final ModelNode owner = graph.ownerOf(source);
    final ModelNode transition =
        graph.add(NodeKind.TRANSITION, transitionName(source, target), owner != null ? owner : root);
    transition.setReference(ModelNode.SOURCE, source);
    if (target != null) {
      transition.setReference(ModelNode.TARGET, target);
    }
    return new TransitionBuilder(transition);
  }

  /**
   * Internal transition, runs its effect without leaving the source state.
   */
  public TransitionBuilder internal(final ModelNode source) {
    return transition(source, null);
  }

  private static String transitionName(final ModelNode source, final ModelNode target) {
    return source.getName() + "->" + (target != null ? target.getName() : "");
  }

  /**
   * Compile and validate the machine.
   */
  public Statechart build() throws StateMachineException {
    return StatechartCompiler.compile(graph, root);
  }

  public final class TransitionBuilder {
    private final ModelNode transition;
    private int triggers;

    private TransitionBuilder(final ModelNode transition) {
      this.transition = transition;
    }

    public ModelNode node() {
      return transition;
    }

    /**
     * Triggered by events with the given name.
     */
    public TransitionBuilder on(final String signal) {
      signalEvent(transition, signal, Event.class);
      return this;
    }

    /**
     * Triggered by events of the given type or its sub-types.
     */
    public TransitionBuilder on(final Class<? extends Event> type) {
      signalEvent(transition, null, type);
      return this;
    }

    /**
     * Triggered by a shared event node, eg. a call event.
     */
    public TransitionBuilder on(final ModelNode event) {
      transition.setReference(ModelNode.TRIGGER + triggers++, event);
      return this;
    }

    public TransitionBuilder onAny() {
      graph.add(NodeKind.EVENT, "any", transition).setAttribute(ModelNode.EVENT_KIND,
          EventKind.ANY);
      return this;
    }

    public TransitionBuilder after(final Duration delay) {
      graph.add(NodeKind.EVENT, "after", transition)
          .setAttribute(ModelNode.EVENT_KIND, EventKind.TIME).setAttribute(ModelNode.DELAY, delay);
      return this;
    }

    public TransitionBuilder at(final Instant deadline) {
      graph.add(NodeKind.EVENT, "at", transition).setAttribute(ModelNode.EVENT_KIND, EventKind.TIME)
          .setAttribute(ModelNode.DEADLINE, deadline);
      return this;
    }

    public TransitionBuilder when(final BooleanSupplier expression) {
      graph.add(NodeKind.EVENT, "when", transition)
          .setAttribute(ModelNode.EVENT_KIND, EventKind.CHANGE)
          .setAttribute(ModelNode.EXPRESSION, expression);
      return this;
    }

    /**
     * Guard that may complete asynchronously.
     */
    public TransitionBuilder guardAsync(final Constraint guard) {
      final ModelNode node = graph.findChild(transition, NodeKind.CONSTRAINT, "guard")
          .orElseGet(() -> graph.add(NodeKind.CONSTRAINT, "guard", transition));
      node.setAttribute(ModelNode.CONDITION, guard);
      return this;
    }

    public TransitionBuilder guard(final Predicate<Event> guard) {
      return guardAsync(Constraint.of(guard));
    }

    public TransitionBuilder effect(final Behavior effect) {
      behavior(transition, "effect", effect);
      return this;
    }
  }

  private StatechartBuilder(final ModelGraph graph, final String name) {
    this.graph = graph;
    this.root = graph.add(NodeKind.STATE_MACHINE, name, null);
  }
}
