package com.github.statechart.structure;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.Behavior;
import com.github.statechart.CallOperation;
import com.github.statechart.Constraint;
import com.github.statechart.Event;
import com.github.statechart.StateMachineException;
import com.github.statechart.StateMachineException.Code;
import com.github.statechart.model.EventKind;
import com.github.statechart.model.ModelGraph;
import com.github.statechart.model.ModelNode;
import com.github.statechart.model.NodeKind;
import com.github.statechart.model.PseudostateKind;

/**
 * Derives the immutable runtime structure of a state machine from its authoring graph: vertex
 * containment, transition kinds, least common ancestors and the exact vertex sequences every
 * transition leaves and enters.
 *
 * Compilation never mutates the graph and is deterministic: compiling the same graph twice yields
 * the same ids, kinds and paths. Elements compiled from a model node keep the node's id, elements
 * synthesized by the compiler (regions for vertices owned directly by a state or machine,
 * completion events) are numbered after the last node of the graph.
 */
public final class StatechartCompiler {
  private static final Logger logger =
      LogManager.getLogger(StatechartCompiler.class.getSimpleName());

  private final ModelGraph graph;
  private final Map<Integer, Element> compiled = new HashMap<>();
  private final List<Element> order = new ArrayList<>();
  private final Map<Statechart, List<Element>> elementsByMachine = new LinkedHashMap<>();
  private final Map<Statechart, ModelNode> machineNodes = new LinkedHashMap<>();
  private final Set<Integer> usedMachines = new HashSet<>();
  private final Map<Transition, List<Vertex>> retainedByJoinSegments = new HashMap<>();
  private Statechart currentMachine;
  private int nextSyntheticId;

  /**
   * Compile and validate the machine rooted at the given node.
   */
  public static Statechart compile(final ModelGraph graph, final ModelNode root)
      throws StateMachineException {
    final Statechart chart = new StatechartCompiler(graph).compileTop(root);
    StatechartValidator.validate(chart);
    return chart;
  }

  private StatechartCompiler(final ModelGraph graph) {
    this.graph = graph;
    this.nextSyntheticId = graph.size();
  }

  private Statechart compileTop(final ModelNode root) throws StateMachineException {
    if (root == null || root.getKind() != NodeKind.STATE_MACHINE) {
      throw new StateMachineException(Code.INVALID_STRUCTURE,
          "Root " + root + " is not a state machine");
    }
    final Statechart chart = compileMachine(root, null);

    final List<Transition> transitions = new ArrayList<>();
    for (final Map.Entry<Statechart, ModelNode> machine : machineNodes.entrySet()) {
      currentMachine = machine.getKey();
      for (final ModelNode node : graph.findDescendants(machine.getValue(),
          candidate -> candidate.getKind() == NodeKind.TRANSITION)) {
        transitions.add(compileTransition(node));
      }
    }
    currentMachine = null;

    for (final Transition transition : transitions) {
      transition.setPath(computePath(transition));
    }
    for (final Transition transition : transitions) {
      if (isPseudostate(transition.getSource(), PseudostateKind.JOIN)) {
        transition.setPath(joinOutgoingPath(transition));
      }
    }

    for (final Map.Entry<Statechart, List<Element>> machine : elementsByMachine.entrySet()) {
      final Statechart statechart = machine.getKey();
      final List<Element> elements = statechart == chart ? order : machine.getValue();
      for (final Element element : elements) {
        statechart.index(element);
      }
      fillPool(statechart, elements);
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Compiled %s into %d elements, %d transitions",
          chart.getQualifiedName(), order.size(), transitions.size()));
    }
    return chart;
  }

  private static void fillPool(final Statechart statechart, final List<Element> elements) {
    for (final Element element : elements) {
      if (element instanceof CompletionEvent) {
        statechart.addToPool((EventDeclaration) element);
      }
    }
    for (final Element element : elements) {
      if (element instanceof EventDeclaration && !(element instanceof CompletionEvent)) {
        statechart.addToPool((EventDeclaration) element);
      }
    }
  }

  ///// Containment /////
  private Statechart compileMachine(final ModelNode node, final State submachineState)
      throws StateMachineException {
    if (!usedMachines.add(node.getId())) {
      throw new StateMachineException(Code.INVALID_STRUCTURE, "State machine "
          + qualifiedName(node) + " is already used by this statechart, a submachine can back"
          + " at most one state");
    }
    final Statechart machine = new Statechart(node.getId(), node.getName(), qualifiedName(node));
    machine.setSubmachineState(submachineState);
    final Statechart enclosing = currentMachine;
    currentMachine = machine;
    elementsByMachine.put(machine, new ArrayList<>());
    machineNodes.put(machine, node);
    register(machine);

    for (final Region region : compileRegions(node)) {
      machine.addRegion(region);
    }
    for (final ModelNode event : graph.childrenOf(node, NodeKind.EVENT)) {
      compileEvent(event);
    }
    currentMachine = enclosing;
    return machine;
  }

  /**
   * Vertices owned directly by the node go to a synthesized region placed before the declared
   * ones.
   */
  private List<Region> compileRegions(final ModelNode owner) throws StateMachineException {
    final List<Region> regions = new ArrayList<>();
    final List<ModelNode> declared = graph.childrenOf(owner, NodeKind.REGION);
    final List<ModelNode> raw = vertexChildren(owner);
    if (!raw.isEmpty()) {
      final String name = "region_" + declared.size();
      final Region region =
          new Region(nextSyntheticId++, name, qualifiedName(owner) + "." + name, true);
      register(region);
      fillRegion(region, raw, null);
      regions.add(region);
    }
    for (final ModelNode node : declared) {
      final Region region = new Region(node.getId(), node.getName(), qualifiedName(node), false);
      register(region);
      fillRegion(region, vertexChildren(node), node);
      regions.add(region);
    }
    return regions;
  }

  private List<ModelNode> vertexChildren(final ModelNode owner) {
    final List<ModelNode> vertices = new ArrayList<>();
    for (final ModelNode child : graph.childrenOf(owner)) {
      if (child.getKind().isVertex()) {
        vertices.add(child);
      }
    }
    return vertices;
  }

  private void fillRegion(final Region region, final List<ModelNode> vertices,
      final ModelNode regionNode) throws StateMachineException {
    for (final ModelNode node : vertices) {
      region.addSubvertex(compileVertex(node));
    }
    final ModelNode initialNode =
        regionNode == null ? null : graph.resolve(regionNode, ModelNode.INITIAL);
    if (initialNode != null) {
      final Element initial = compiled.get(initialNode.getId());
      if (!(initial instanceof Pseudostate) || ((Pseudostate) initial).getContainer() != region) {
        throw new StateMachineException(Code.INVALID_STRUCTURE, "Initial "
            + qualifiedName(initialNode) + " of region " + region.getQualifiedName()
            + " is not a pseudostate of that region");
      }
      region.setInitial((Pseudostate) initial);
      return;
    }
    for (final Vertex vertex : region.getSubvertex()) {
      if (isPseudostate(vertex, PseudostateKind.INITIAL)) {
        region.setInitial((Pseudostate) vertex);
        return;
      }
    }
  }

  private Vertex compileVertex(final ModelNode node) throws StateMachineException {
    switch (node.getKind()) {
      case STATE:
        return compileState(node);
      case FINAL_STATE: {
        final FinalState finalState =
            new FinalState(node.getId(), node.getName(), qualifiedName(node));
        register(finalState);
        finalState.setExit(behavior(node, "exit"));
        return finalState;
      }
      case PSEUDOSTATE: {
        final PseudostateKind kind =
            node.getAttribute(ModelNode.PSEUDOSTATE_KIND, PseudostateKind.class);
        if (kind == null) {
          throw new StateMachineException(Code.INVALID_STRUCTURE,
              "Pseudostate " + qualifiedName(node) + " has no pseudostate kind");
        }
        final Pseudostate pseudostate =
            new Pseudostate(node.getId(), node.getName(), qualifiedName(node), kind);
        register(pseudostate);
        return pseudostate;
      }
      default:
        throw new StateMachineException(Code.INVALID_STRUCTURE,
            "Node " + qualifiedName(node) + " is not a vertex");
    }
  }

  private State compileState(final ModelNode node) throws StateMachineException {
    final State state = new State(node.getId(), node.getName(), qualifiedName(node));
    register(state);
    final Behavior entry = behavior(node, "entry");
    if (entry != null) {
      state.setEntry(entry);
    }
    final Behavior exit = behavior(node, "exit");
    if (exit != null) {
      state.setExit(exit);
    }
    final Behavior activity = behavior(node, "activity");
    if (activity != null) {
      state.setActivity(activity);
    }
    for (final ModelNode event : graph.childrenOf(node, NodeKind.EVENT)) {
      final EventDeclaration declaration = compileEvent(event);
      if (Boolean.TRUE.equals(event.getAttribute(ModelNode.DEFERRED, Boolean.class))) {
        state.addDeferred(declaration);
      }
    }
    for (final Region region : compileRegions(node)) {
      state.addRegion(region);
      region.setState(state);
    }
    final ModelNode submachine = graph.resolve(node, ModelNode.SUBMACHINE);
    if (submachine != null) {
      if (submachine.getKind() != NodeKind.STATE_MACHINE) {
        throw new StateMachineException(Code.INVALID_STRUCTURE, "Submachine of state "
            + state.getQualifiedName() + " is not a state machine");
      }
      state.setSubmachine(compileMachine(submachine, state));
    }
    return state;
  }

  private Behavior behavior(final ModelNode owner, final String role) {
    return graph.findChild(owner, NodeKind.BEHAVIOR, role)
        .map(node -> node.getAttribute(ModelNode.BEHAVIOR, Behavior.class)).orElse(null);
  }

  ///// Events /////
  private EventDeclaration compileEvent(final ModelNode node) throws StateMachineException {
    if (node.getKind() != NodeKind.EVENT) {
      throw new StateMachineException(Code.INVALID_STRUCTURE,
          "Trigger " + qualifiedName(node) + " is not an event");
    }
    final Element existing = compiled.get(node.getId());
    if (existing instanceof EventDeclaration) {
      return (EventDeclaration) existing;
    }
    final String qualifiedName = qualifiedName(node);
    final EventKind kind = node.getAttribute(ModelNode.EVENT_KIND, EventKind.class);
    final EventDeclaration declaration;
    switch (kind == null ? EventKind.SIGNAL : kind) {
      case SIGNAL: {
        final Class<?> declared = node.getAttribute(ModelNode.EVENT_TYPE, Class.class);
        final Class<? extends Event> type =
            declared == null ? null : declared.asSubclass(Event.class);
        String signal = node.getAttribute(ModelNode.SIGNAL, String.class);
        if (type == null && signal == null) {
          signal = node.getName();
        }
        declaration = new SignalEvent(node.getId(), node.getName(), qualifiedName,
            type != null ? type : Event.class, signal);
        break;
      }
      case ANY:
        declaration = new AnyEvent(node.getId(), node.getName(), qualifiedName);
        break;
      case CALL: {
        final CallOperation operation =
            node.getAttribute(ModelNode.OPERATION, CallOperation.class);
        if (operation == null) {
          throw new StateMachineException(Code.INVALID_STRUCTURE,
              "Call event " + qualifiedName + " has no operation");
        }
        declaration = new CallEvent(node.getId(), node.getName(), qualifiedName, operation);
        break;
      }
      case TIME: {
        final Duration delay = node.getAttribute(ModelNode.DELAY, Duration.class);
        final Instant deadline = node.getAttribute(ModelNode.DEADLINE, Instant.class);
        if ((delay == null) == (deadline == null)) {
          throw new StateMachineException(Code.INVALID_STRUCTURE,
              "Time event " + qualifiedName + " needs exactly one of a delay or a deadline");
        }
        declaration = new TimeEvent(node.getId(), node.getName(), qualifiedName, delay, deadline);
        break;
      }
      case CHANGE: {
        final BooleanSupplier expression =
            node.getAttribute(ModelNode.EXPRESSION, BooleanSupplier.class);
        if (expression == null) {
          throw new StateMachineException(Code.INVALID_STRUCTURE,
              "Change event " + qualifiedName + " has no expression");
        }
        declaration = new ChangeEvent(node.getId(), node.getName(), qualifiedName, expression);
        break;
      }
      case COMPLETION: {
        final ModelNode owner = graph.ownerOf(node);
        final Element state = owner == null ? null : compiled.get(owner.getId());
        if (!(state instanceof State)) {
          throw new StateMachineException(Code.INVALID_STRUCTURE,
              "Completion event " + qualifiedName + " is not owned by a state");
        }
        return completionOf((State) state);
      }
      default:
        throw new StateMachineException(Code.INVALID_STRUCTURE,
            "Event " + qualifiedName + " has an unsupported kind " + kind);
    }
    register(declaration);
    return declaration;
  }

  private CompletionEvent completionOf(final State state) {
    if (state.getCompletion() == null) {
      final CompletionEvent completion = new CompletionEvent(nextSyntheticId++, state);
      register(completion);
      state.setCompletion(completion);
    }
    return state.getCompletion();
  }

  ///// Transitions /////
  private Transition compileTransition(final ModelNode node) throws StateMachineException {
    final String qualifiedName = qualifiedName(node);
    ModelNode sourceNode = graph.resolve(node, ModelNode.SOURCE);
    final ModelNode targetNode = graph.resolve(node, ModelNode.TARGET);
    if (sourceNode == null && targetNode == null) {
      throw new StateMachineException(Code.INVALID_STRUCTURE,
          "Transition " + qualifiedName + " has neither source nor target");
    }
    if (sourceNode == null) {
      final ModelNode owner = graph.ownerOf(node);
      if (owner == null || !owner.getKind().isVertex()) {
        throw new StateMachineException(Code.INVALID_STRUCTURE,
            "Transition " + qualifiedName + " has no source and is not owned by a vertex");
      }
      sourceNode = owner;
    }
    final Vertex source = vertexOf(sourceNode, "Source", qualifiedName);
    final Vertex target = targetNode == null ? null : vertexOf(targetNode, "Target", qualifiedName);

    final List<EventDeclaration> triggers = new ArrayList<>();
    for (final ModelNode event : graph.childrenOf(node, NodeKind.EVENT)) {
      triggers.add(compileEvent(event));
    }
    for (final ModelNode event : graph.resolveAll(node, ModelNode.TRIGGER)) {
      triggers.add(compileEvent(event));
    }
    if (triggers.isEmpty() && source instanceof State) {
      triggers.add(completionOf((State) source));
    }

    final Constraint guard = graph.findChild(node, NodeKind.CONSTRAINT, "guard")
        .map(constraint -> constraint.getAttribute(ModelNode.CONDITION, Constraint.class))
        .orElse(null);
    final Behavior effect = graph.childrenOf(node, NodeKind.BEHAVIOR).stream()
        .map(behavior -> behavior.getAttribute(ModelNode.BEHAVIOR, Behavior.class))
        .filter(behavior -> behavior != null).findFirst().orElse(Behavior.noop());

    final TransitionKind kind;
    final Region container;
    if (target == null) {
      kind = TransitionKind.INTERNAL;
      container = source.getContainer();
    } else if (target == source) {
      kind = TransitionKind.SELF;
      container = source.getContainer();
    } else if (source instanceof State && target.isDescendantOf(source)) {
      kind = TransitionKind.LOCAL;
      container = regionBelow(target, (State) source);
    } else {
      kind = TransitionKind.EXTERNAL;
      container = leastCommonAncestor(source, target);
      if (container == null) {
        throw new StateMachineException(Code.INVALID_STRUCTURE, "Source and target of transition "
            + qualifiedName + " have no common ancestor region");
      }
    }

    final Transition transition = new Transition(node.getId(), node.getName(), qualifiedName,
        source, target, triggers, guard, effect, kind, container);
    register(transition);
    source.addOutgoing(transition);
    if (target != null) {
      target.addIncoming(transition);
    }
    return transition;
  }

  private Vertex vertexOf(final ModelNode node, final String role, final String transition)
      throws StateMachineException {
    final Element element = compiled.get(node.getId());
    if (!(element instanceof Vertex)) {
      throw new StateMachineException(Code.INVALID_STRUCTURE, role + " " + qualifiedName(node)
          + " of transition " + transition + " is not a vertex of the compiled statechart");
    }
    return (Vertex) element;
  }

  ///// Paths /////
  private TransitionPath computePath(final Transition transition) {
    final Vertex source = transition.getSource();
    final Vertex target = transition.getTarget();
    final Region container = transition.getContainer();
    switch (transition.getTransitionKind()) {
      case INTERNAL:
        return new TransitionPath(Collections.emptyList(), Collections.emptyList());
      case SELF:
        return new TransitionPath(Collections.singletonList(source),
            Collections.singletonList(target));
      case LOCAL:
        return new TransitionPath(Collections.emptyList(), enterPath(target, container));
      case EXTERNAL:
      default: {
        final List<Vertex> leave = new ArrayList<>();
        leave.add(source);
        final List<Vertex> ancestors = statesBetween(source, container);
        if (isPseudostate(target, PseudostateKind.JOIN)) {
          // siblings stay alive until the join fires, the join's outgoing transition leaves the
          // orthogonal ancestors instead
          final List<Vertex> retained = new ArrayList<>();
          for (final Vertex ancestor : ancestors) {
            if (!retained.isEmpty() || ((State) ancestor).isOrthogonal()) {
              retained.add(ancestor);
            } else {
              leave.add(ancestor);
            }
          }
          retainedByJoinSegments.put(transition, retained);
        } else {
          leave.addAll(ancestors);
        }
        return new TransitionPath(leave, enterPath(target, container));
      }
    }
  }

  private TransitionPath joinOutgoingPath(final Transition transition) {
    final Vertex join = transition.getSource();
    final List<Vertex> leave = new ArrayList<>();
    leave.add(join);
    for (final Transition incoming : join.getIncoming()) {
      final List<Vertex> retained = retainedByJoinSegments.get(incoming);
      if (retained != null) {
        addAbsent(leave, retained);
      }
    }
    if (transition.getTransitionKind() == TransitionKind.EXTERNAL) {
      addAbsent(leave, statesBetween(join, transition.getContainer()));
    }
    return new TransitionPath(leave, transition.getPath().getEnter());
  }

  private static void addAbsent(final List<Vertex> into, final List<Vertex> vertices) {
    for (final Vertex vertex : vertices) {
      if (!into.contains(vertex)) {
        into.add(vertex);
      }
    }
  }

  private static List<Vertex> enterPath(final Vertex target, final Region container) {
    final List<Vertex> enter = new ArrayList<>(statesBetween(target, container));
    Collections.reverse(enter);
    enter.add(target);
    return enter;
  }

  /**
   * States enclosing the vertex strictly below the region, innermost first.
   */
  static List<Vertex> statesBetween(final Vertex vertex, final Region stop) {
    final List<Vertex> states = new ArrayList<>();
    Region region = vertex.getContainer();
    while (region != null && region != stop) {
      final State state = region.getOwnerState();
      if (state == null) {
        break;
      }
      states.add(state);
      region = state.getContainer();
    }
    return states;
  }

  /**
   * Regions enclosing the vertex, innermost first, crossing submachine boundaries.
   */
  static List<Region> regionChain(final Vertex vertex) {
    final List<Region> chain = new ArrayList<>();
    Region region = vertex.getContainer();
    while (region != null) {
      chain.add(region);
      final State state = region.getOwnerState();
      region = state == null ? null : state.getContainer();
    }
    return chain;
  }

  static Region leastCommonAncestor(final Vertex first, final Vertex second) {
    final List<Region> secondChain = regionChain(second);
    for (final Region region : regionChain(first)) {
      if (secondChain.contains(region)) {
        return region;
      }
    }
    return null;
  }

  /**
   * The region of the ancestor state that encloses the vertex.
   */
  private static Region regionBelow(final Vertex vertex, final State ancestor) {
    for (final Region region : regionChain(vertex)) {
      if (region.getOwnerState() == ancestor) {
        return region;
      }
    }
    return null;
  }

  ///// Helpers /////
  static boolean isPseudostate(final Vertex vertex, final PseudostateKind kind) {
    return vertex instanceof Pseudostate && ((Pseudostate) vertex).getPseudostateKind() == kind;
  }

  private void register(final Element element) {
    compiled.put(element.getId(), element);
    order.add(element);
    if (currentMachine != null) {
      elementsByMachine.get(currentMachine).add(element);
    }
  }

  private String qualifiedName(final ModelNode node) {
    return graph.qualifiedNameOf(node);
  }
}
