package com.github.statechart.structure;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StateMachineException;
import com.github.statechart.StateMachineException.Code;

/**
 * Fail-fast well-formedness checks over a compiled statechart. The first violation found aborts
 * validation with an {@link Code#INVALID_STRUCTURE} naming the qualified path of the offending
 * element.
 */
public final class StatechartValidator {
  private static final Logger logger =
      LogManager.getLogger(StatechartValidator.class.getSimpleName());

  public static void validate(final Statechart chart) throws StateMachineException {
    for (final Element element : chart.getElements()) {
      validate(element);
    }
  }

  private static void validate(final Element element) throws StateMachineException {
    switch (element.getKind()) {
      case STATE_MACHINE:
        validateStateMachine((Statechart) element);
        break;
      case REGION:
        validateRegion((Region) element);
        break;
      case STATE:
        validateVertex((Vertex) element);
        validateState((State) element);
        break;
      case FINAL_STATE:
        validateVertex((Vertex) element);
        validateFinalState((FinalState) element);
        break;
      case PSEUDOSTATE:
        validateVertex((Vertex) element);
        validatePseudostate((Pseudostate) element);
        break;
      case TRANSITION:
        validateTransition((Transition) element);
        break;
      case EVENT:
        validateEvent((EventDeclaration) element);
        break;
      default:
        break;
    }
  }

  private static void validateStateMachine(final Statechart machine)
      throws StateMachineException {
    for (final Region region : machine.getRegions()) {
      if (region.getInitial() == null) {
        fail(region, "Region of state machine " + machine.getQualifiedName()
            + " has no initial pseudostate");
      }
    }
  }

  private static void validateRegion(final Region region) throws StateMachineException {
    if (region.getState() != null && region.getStateMachine() != null) {
      fail(region, "Region is owned by both a state and a state machine");
    }
    if (region.getState() == null && region.getStateMachine() == null) {
      fail(region, "Region is owned by neither a state nor a state machine");
    }
  }

  private static void validateVertex(final Vertex vertex) throws StateMachineException {
    if (vertex.getContainer() == null) {
      fail(vertex, "Vertex is not contained in a region");
    }
    if (vertex.getIncoming().isEmpty() && vertex.getOutgoing().isEmpty()) {
      logger.warn("Vertex " + vertex.getQualifiedName() + " is isolated, no transition enters or"
          + " leaves it");
    }
  }

  private static void validateState(final State state) throws StateMachineException {
    if (state.getSubmachine() != null && !state.getRegions().isEmpty()) {
      fail(state, "State references a submachine and also owns regions");
    }
  }

  private static void validateFinalState(final FinalState finalState)
      throws StateMachineException {
    if (finalState.getExit() != null) {
      fail(finalState, "Final state cannot have an exit behavior");
    }
    if (!finalState.getOutgoing().isEmpty()) {
      fail(finalState, "Final state cannot have outgoing transitions");
    }
  }

  private static void validatePseudostate(final Pseudostate pseudostate)
      throws StateMachineException {
    final List<Transition> outgoing = pseudostate.getOutgoing();
    final List<Transition> incoming = pseudostate.getIncoming();
    switch (pseudostate.getPseudostateKind()) {
      case INITIAL:
        if (outgoing.size() != 1) {
          fail(pseudostate, "Initial pseudostate must have exactly one outgoing transition, has "
              + outgoing.size());
        }
        if (!incoming.isEmpty()) {
          fail(pseudostate, "Initial pseudostate cannot have incoming transitions");
        }
        if (outgoing.get(0).getGuard() != null) {
          fail(pseudostate, "Transition out of an initial pseudostate cannot have a guard");
        }
        break;
      case CHOICE:
      case JUNCTION:
        if (outgoing.isEmpty()) {
          fail(pseudostate, pseudostate.getPseudostateKind()
              + " pseudostate must have at least one outgoing transition");
        }
        if (outgoing.get(outgoing.size() - 1).getGuard() != null) {
          fail(pseudostate, "Last outgoing transition of a " + pseudostate.getPseudostateKind()
              + " pseudostate must be unguarded, it is the default branch");
        }
        break;
      case JOIN: {
        if (incoming.size() < 2) {
          fail(pseudostate, "Join must have at least two incoming transitions");
        }
        if (outgoing.size() != 1) {
          fail(pseudostate, "Join must have exactly one outgoing transition");
        }
        final Set<Region> regions = new HashSet<>();
        for (final Transition transition : incoming) {
          if (!regions.add(transition.getSource().getContainer())) {
            fail(pseudostate, "Incoming transitions of a join must originate in distinct regions");
          }
          if (transition.getGuard() != null) {
            fail(pseudostate, "Incoming transition " + transition.getQualifiedName()
                + " of a join cannot have a guard");
          }
          for (final EventDeclaration trigger : transition.getTriggers()) {
            if (!(trigger instanceof CompletionEvent)) {
              fail(pseudostate, "Incoming transition " + transition.getQualifiedName()
                  + " of a join cannot have triggers");
            }
          }
        }
        break;
      }
      case FORK: {
        if (outgoing.isEmpty()) {
          fail(pseudostate, "Fork must have at least one outgoing transition");
        }
        final Set<Region> regions = new HashSet<>();
        for (final Transition transition : outgoing) {
          if (transition.getTarget() == null
              || !regions.add(transition.getTarget().getContainer())) {
            fail(pseudostate, "Outgoing transitions of a fork must target distinct regions");
          }
        }
        break;
      }
      case ENTRY_POINT:
      case EXIT_POINT:
        if (outgoing.isEmpty()) {
          fail(pseudostate, pseudostate.getPseudostateKind()
              + " must have at least one outgoing transition");
        }
        break;
      case SHALLOW_HISTORY:
      case DEEP_HISTORY:
        if (outgoing.size() > 1) {
          fail(pseudostate, "History pseudostate can have at most one default transition");
        }
        break;
      case TERMINATE:
        if (!outgoing.isEmpty()) {
          fail(pseudostate, "Terminate pseudostate cannot have outgoing transitions");
        }
        break;
      default:
        break;
    }
  }

  private static void validateTransition(final Transition transition)
      throws StateMachineException {
    final Vertex source = transition.getSource();
    if (transition.getTransitionKind() == TransitionKind.INTERNAL && !(source instanceof State)) {
      fail(transition, "Internal transition must originate at a state");
    }
    if (source instanceof Pseudostate && !transition.getTriggers().isEmpty()) {
      fail(transition, "Transition out of a pseudostate cannot have triggers");
    }
    if (transition.getTransitionKind() == TransitionKind.EXTERNAL) {
      for (final Vertex ancestor : StatechartCompiler.statesBetween(source,
          transition.getContainer())) {
        if (transition.getTarget().isDescendantOf(ancestor)) {
          fail(transition, "Transition crosses two regions of state "
              + ancestor.getQualifiedName());
        }
      }
    }
  }

  private static void validateEvent(final EventDeclaration event) throws StateMachineException {
    if (event instanceof CompletionEvent && ((CompletionEvent) event).getState() == null) {
      fail(event, "Completion event must be owned by a state");
    }
  }

  private static void fail(final Element element, final String message)
      throws StateMachineException {
    throw new StateMachineException(Code.INVALID_STRUCTURE,
        element.getQualifiedName() + ": " + message);
  }

  private StatechartValidator() {}
}
