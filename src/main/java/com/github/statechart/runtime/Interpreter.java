package com.github.statechart.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.Behavior;
import com.github.statechart.Clock;
import com.github.statechart.Constraint;
import com.github.statechart.Event;
import com.github.statechart.InterpreterStep;
import com.github.statechart.StateMachineException;
import com.github.statechart.StateMachineException.Code;
import com.github.statechart.structure.CallEvent;
import com.github.statechart.structure.CompletionEvent;
import com.github.statechart.structure.Element;
import com.github.statechart.structure.FinalState;
import com.github.statechart.structure.Pseudostate;
import com.github.statechart.structure.Region;
import com.github.statechart.structure.State;
import com.github.statechart.structure.Statechart;
import com.github.statechart.structure.Transition;
import com.github.statechart.structure.Vertex;
import com.github.statechart.model.PseudostateKind;

/**
 * Executes a compiled {@link Statechart}: runs steps over queued events, fires transitions and
 * enters and exits vertices.
 *
 * Every bit of machine state here is confined to the loop executor. Public entry points hop onto
 * the loop; user supplied futures that complete elsewhere are resumed on the loop before the
 * interpreter looks at their results. Concurrent regions are processed by fanning out futures on
 * that same single thread, so their user code may overlap in time but interpreter code never runs
 * in parallel.
 *
 * A step drains the queue together with active completion occurrences and the events deferred by
 * earlier steps. Every time an event fires a transition the candidates are merged again, so
 * completions that became active and events that were deferred get another chance, until every
 * candidate has been tried without firing. Send futures resolve at the end of the step.
 */
final class Interpreter {
  private static final Logger logger = LogManager.getLogger(Interpreter.class.getSimpleName());

  enum Status {
    STOPPED, STARTING, RUNNING, TERMINATING;
  }

  private final String machineId;
  private final Statechart chart;
  private final ScheduledExecutorService loop;
  private final StateMachineStatistics statistics;
  private final ActiveConfiguration active = new ActiveConfiguration();
  private final EventScheduler scheduler;

  // loop confined
  private final Deque<Event> queue = new ArrayDeque<>();
  private final Map<Event, CompletableFuture<InterpreterStep>> sent = new IdentityHashMap<>();
  private final List<CompletableFuture<Void>> idleWaiters = new ArrayList<>();
  private List<Event> deferred = new ArrayList<>();
  private Throwable pendingFailure;
  private boolean stepping;
  private boolean stepScheduled;
  private boolean stepRequested;
  private boolean terminationRequested;
  private CompletableFuture<Void> termination;

  private volatile Status status = Status.STOPPED;

  Interpreter(final String machineId, final Statechart chart, final ScheduledExecutorService loop,
      final Clock clock, final long changePollMillis, final StateMachineStatistics statistics) {
    this.machineId = machineId;
    this.chart = chart;
    this.loop = loop;
    this.statistics = statistics;
    this.scheduler = new EventScheduler(this, active, clock, loop, changePollMillis);
  }

  String getMachineId() {
    return machineId;
  }

  Status getStatus() {
    return status;
  }

  ///// Caller facing operations, any thread /////
  CompletableFuture<Void> start() {
    return onLoop(() -> {
      if (status != Status.STOPPED) {
        return failed(new StateMachineException(Code.ILLEGAL_EVENT,
            "Cannot start an already running state machine"));
      }
      logInfo(machineId, chart, "Starting state machine");
      status = Status.STARTING;
      termination = null;
      terminationRequested = false;
      stepping = true;
      return enterRegions(chart.getRegions(), Event.of("start"), EntryKind.DEFAULT,
          Collections.emptySet()).handle((ignored, error) -> {
            stepping = false;
            if (error != null) {
              logError(machineId, chart, "Failed to enter the initial configuration", error);
              finishTermination(unwrap(error));
              throw new CompletionException(unwrap(error));
            }
            if (status == Status.STARTING) {
              status = Status.RUNNING;
              logInfo(machineId, chart, "Started state machine, active " + active);
            }
            afterStep();
            return null;
          }).thenCompose(ignored -> settledOnLoop());
    });
  }

  CompletableFuture<InterpreterStep> dispatch(final Event event) {
    final CompletableFuture<InterpreterStep> result = new CompletableFuture<>();
    if (event == null) {
      result.completeExceptionally(
          new StateMachineException(Code.ILLEGAL_EVENT, "Event cannot be null"));
      return result;
    }
    try {
      loop.execute(() -> enqueue(event, result));
    } catch (RejectedExecutionException rejected) {
      result.completeExceptionally(new StateMachineException(Code.MACHINE_NOT_ALIVE, rejected));
    }
    return result;
  }

  CompletableFuture<Object> call(final String callEventName, final Object... arguments) {
    final CompletableFuture<Object> result = new CompletableFuture<>();
    final CallEvent callEvent = chart.findCallEvent(callEventName);
    if (callEvent == null) {
      result.completeExceptionally(new StateMachineException(Code.UNKNOWN_CALL_EVENT,
          "No call event named " + callEventName + " in " + chart.getQualifiedName()));
      return result;
    }
    if (!isAlive()) {
      result.completeExceptionally(new StateMachineException(Code.MACHINE_NOT_ALIVE));
      return result;
    }
    final CompletionStage<?> invocation;
    try {
      invocation = callEvent.getOperation().invoke(arguments);
    } catch (Exception problem) {
      result.completeExceptionally(problem);
      return result;
    }
    if (invocation == null) {
      runOnLoop(() -> enqueue(Event.occurrenceOf(callEvent, null), null));
      result.complete(null);
      return result;
    }
    invocation.whenComplete((value, error) -> {
      if (error != null) {
        result.completeExceptionally(unwrap(error));
        return;
      }
      runOnLoop(() -> enqueue(Event.occurrenceOf(callEvent, value), null));
      result.complete(value);
    });
    return result;
  }

  /**
   * Waits for the running step, then exits all regions. Cancelling the returned future stops the
   * machine right away without running the remaining exit behaviors.
   */
  CompletableFuture<Void> terminate() {
    final CompletableFuture<Void> result = onLoop(() -> {
      if (termination != null) {
        return termination;
      }
      if (status == Status.STOPPED) {
        return CompletableFuture.completedFuture(null);
      }
      logInfo(machineId, chart, "Terminating state machine");
      termination = new CompletableFuture<>();
      status = Status.TERMINATING;
      final CompletableFuture<Void> terminating = termination;
      settledOnLoop()
          .thenCompose(
              ignored -> exitRegions(chart.getRegions(), Event.of("terminate")))
          .whenComplete((ignored, error) -> {
            if (status != Status.STOPPED) {
              finishTermination(error == null ? null : unwrap(error));
            }
          });
      return terminating;
    });
    result.whenComplete((ignored, error) -> {
      if (result.isCancelled()) {
        runOnLoop(() -> {
          if (status != Status.STOPPED) {
            logWarning(machineId, chart, "Termination was cancelled, stopping immediately");
            finishTermination(new CancellationException("Termination was cancelled"));
          }
        });
      }
    });
    return result;
  }

  CompletableFuture<Void> settled() {
    return onLoop(this::settledOnLoop);
  }

  boolean isAlive() {
    final Status current = status;
    return current == Status.STARTING || current == Status.RUNNING;
  }

  boolean isActive(final Element... elements) {
    return active.containsAll(elements);
  }

  List<State> leafStates() {
    return active.leafStates();
  }

  ///// Loop plumbing /////
  void runOnLoop(final Runnable task) {
    try {
      loop.execute(() -> {
        try {
          task.run();
        } catch (RuntimeException problem) {
          logError(machineId, chart, "Loop task failed", problem);
        }
      });
    } catch (RejectedExecutionException rejected) {
      logDebug(machineId, chart, "Loop is shut down, dropped a task");
    }
  }

  private <T> CompletableFuture<T> onLoop(final Supplier<CompletableFuture<T>> work) {
    final CompletableFuture<T> result = new CompletableFuture<>();
    try {
      loop.execute(() -> {
        try {
          work.get().whenComplete((value, error) -> {
            if (error != null) {
              result.completeExceptionally(unwrap(error));
            } else {
              result.complete(value);
            }
          });
        } catch (RuntimeException problem) {
          result.completeExceptionally(problem);
        }
      });
    } catch (RejectedExecutionException rejected) {
      result.completeExceptionally(new StateMachineException(Code.MACHINE_NOT_ALIVE, rejected));
    }
    return result;
  }

  /**
   * Copy of the stage that completes on the loop.
   */
  private CompletableFuture<Object> resume(final CompletionStage<?> stage) {
    final CompletableFuture<Object> resumed = new CompletableFuture<>();
    if (stage == null) {
      resumed.complete(null);
      return resumed;
    }
    if (stage instanceof CompletableFuture && ((CompletableFuture<?>) stage).isDone()) {
      try {
        resumed.complete(((CompletableFuture<?>) stage).get());
      } catch (ExecutionException problem) {
        resumed.completeExceptionally(problem.getCause());
      } catch (CancellationException cancelled) {
        resumed.completeExceptionally(cancelled);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        resumed.completeExceptionally(new StateMachineException(Code.INTERRUPTED, interrupted));
      }
      return resumed;
    }
    stage.whenComplete((value, error) -> {
      final Runnable settle = () -> {
        if (error != null) {
          resumed.completeExceptionally(unwrap(error));
        } else {
          resumed.complete(value);
        }
      };
      try {
        loop.execute(settle);
      } catch (RejectedExecutionException rejected) {
        resumed.completeExceptionally(new StateMachineException(Code.MACHINE_NOT_ALIVE, rejected));
      }
    });
    return resumed;
  }

  private CompletableFuture<Object> execBehavior(final Behavior behavior, final Event event) {
    try {
      return resume(behavior.execute(event));
    } catch (Exception problem) {
      return failed(problem);
    }
  }

  private CompletableFuture<Boolean> evaluate(final Constraint guard, final Event event) {
    if (guard == null) {
      return CompletableFuture.completedFuture(Boolean.TRUE);
    }
    try {
      return resume(guard.evaluate(event)).thenApply(Boolean.TRUE::equals);
    } catch (Exception problem) {
      return failed(problem);
    }
  }

  ///// Steps /////
  void enqueue(final Event event, final CompletableFuture<InterpreterStep> result) {
    if (!isAlive()) {
      if (result != null) {
        result.completeExceptionally(new StateMachineException(Code.MACHINE_NOT_ALIVE,
            "Cannot dispatch " + event + ", machine is " + status));
      }
      return;
    }
    if (result != null) {
      if (sent.containsKey(event)) {
        result.completeExceptionally(new StateMachineException(Code.ILLEGAL_EVENT,
            "Event " + event + " is already pending"));
        return;
      }
      sent.put(event, result);
    }
    queue.add(event);
    statistics.eventDispatched();
    requestStep();
  }

  void markCompletion(final CompletionEvent completion, final Object value) {
    if (!active.contains(completion.getState())) {
      return;
    }
    logDebug(machineId, completion.getState(), "Completed");
    active.complete(completion, Event.occurrenceOf(completion, value));
    requestStep();
  }

  /**
   * Failures of background work fail the next step.
   */
  void recordFailure(final Element element, final Throwable problem) {
    logError(machineId, element, "Background task failed", problem);
    if (pendingFailure == null) {
      pendingFailure = problem;
    }
    requestStep();
  }

  private void requestStep() {
    if (!isAlive()) {
      return;
    }
    if (stepping) {
      stepRequested = true;
      return;
    }
    if (stepScheduled) {
      return;
    }
    stepScheduled = true;
    runOnLoop(this::runStep);
  }

  private void runStep() {
    stepScheduled = false;
    if (stepping) {
      stepRequested = true;
      return;
    }
    if (status != Status.RUNNING) {
      notifyIfIdle();
      return;
    }
    stepping = true;
    stepRequested = false;
    CompletableFuture<Void> step;
    try {
      step = step();
    } catch (RuntimeException problem) {
      step = failed(problem);
    }
    step.whenComplete((ignored, error) -> {
      stepping = false;
      if (error != null) {
        statistics.stepFailed();
        logError(machineId, chart, "Step failed", unwrap(error));
      }
      afterStep();
    });
  }

  private void afterStep() {
    if (terminationRequested && status != Status.STOPPED) {
      finishTermination(null);
      return;
    }
    if (stepRequested || !queue.isEmpty()) {
      stepRequested = false;
      requestStep();
    }
    notifyIfIdle();
  }

  private CompletableFuture<Void> step() {
    statistics.stepStarted();
    final StepContext context = new StepContext(deferred);
    if (pendingFailure != null) {
      final Throwable failure = pendingFailure;
      pendingFailure = null;
      context.merge(Collections.emptyList(), queue);
      failSends(context, failure);
      return failed(failure);
    }
    return drain(context).handle((ignored, error) -> {
      deferred = context.deferred;
      if (error != null) {
        final Throwable failure = unwrap(error);
        failSends(context, failure);
        throw new CompletionException(failure);
      }
      for (final Map.Entry<Event, InterpreterStep> outcome : context.outcomes.entrySet()) {
        resolveSend(outcome.getKey(), outcome.getValue());
      }
      return null;
    });
  }

  /**
   * The event whose processing failed gets the failure and is dropped, even if it was deferred
   * by an earlier step. Events that already settled in this step keep their outcome, events still
   * deferred stay pending, and the rest of the drained events fail with the step.
   */
  private void failSends(final StepContext context, final Throwable failure) {
    final Event culprit = context.current;
    if (culprit != null) {
      failSend(culprit, failure);
      removeIdentical(deferred, culprit);
      if (culprit.getOrigin() instanceof CompletionEvent) {
        active.consume((CompletionEvent) culprit.getOrigin());
      }
    }
    for (final Event event : context.drained) {
      final InterpreterStep outcome = context.outcomes.get(event);
      if (outcome != null) {
        resolveSend(event, outcome);
      } else if (!containsEvent(deferred, event)) {
        failSend(event, failure);
      }
    }
  }

  private void resolveSend(final Event event, final InterpreterStep outcome) {
    final CompletableFuture<InterpreterStep> result = sent.remove(event);
    if (result != null) {
      result.complete(outcome);
    }
  }

  private void failSend(final Event event, final Throwable failure) {
    final CompletableFuture<InterpreterStep> result = sent.remove(event);
    if (result != null) {
      result.completeExceptionally(failure);
    }
  }

  private CompletableFuture<Void> drain(final StepContext context) {
    while (true) {
      if (terminationRequested || status != Status.RUNNING) {
        return CompletableFuture.completedFuture(null);
      }
      if (context.pending.isEmpty() || context.remerge) {
        final List<Event> candidates =
            context.merge(active.activeCompletions(chart.getPool()), queue);
        for (final Event candidate : candidates) {
          if (!context.tried.containsKey(candidate)) {
            context.pending.add(candidate);
          }
        }
        if (context.pending.isEmpty()) {
          return CompletableFuture.completedFuture(null);
        }
      }
      final Event event = context.pending.pollFirst();
      context.current = event;
      final CompletableFuture<InterpreterStep> processing = processEvent(event);
      if (processing.isDone() && !processing.isCompletedExceptionally()) {
        settle(context, event, processing.join());
        continue;
      }
      return processing.thenCompose(result -> {
        settle(context, event, result);
        return drain(context);
      });
    }
  }

  private void settle(final StepContext context, final Event event, final InterpreterStep result) {
    if (logger.isDebugEnabled()) {
      logDebug(machineId, event.getOrigin(), event.getName() + " -> " + result);
    }
    context.current = null;
    switch (result) {
      case COMPLETE:
        statistics.eventCompleted();
        removeIdentical(context.deferred, event);
        context.outcomes.put(event, result);
        if (event.getOrigin() instanceof CompletionEvent) {
          active.consume((CompletionEvent) event.getOrigin());
        }
        context.tried.clear();
        context.remerge = true;
        break;
      case DEFERRED:
        statistics.eventDeferred();
        if (!containsEvent(context.deferred, event)) {
          context.deferred.add(event);
        }
        context.tried.put(event, Boolean.TRUE);
        break;
      case INCOMPLETE:
      default:
        statistics.eventIncomplete();
        removeIdentical(context.deferred, event);
        context.outcomes.put(event, result);
        context.tried.put(event, Boolean.TRUE);
        break;
    }
  }

  /**
   * Bookkeeping of one step.
   */
  private static final class StepContext {
    private final List<Event> deferred;
    private final Deque<Event> pending = new ArrayDeque<>();
    private final Map<Event, Boolean> tried = new IdentityHashMap<>();
    private final List<Event> drained = new ArrayList<>();
    private final Map<Event, InterpreterStep> outcomes = new IdentityHashMap<>();
    private Event current;
    private boolean remerge;

    private StepContext(final List<Event> carried) {
      this.deferred = new ArrayList<>(carried);
    }

    /**
     * Completions, deferred, still pending and newly queued events, deduplicated in first-seen
     * order. Empties the queue and the pending list.
     */
    private List<Event> merge(final List<Event> completions, final Deque<Event> queue) {
      final Map<Event, Boolean> seen = new IdentityHashMap<>();
      final List<Event> merged = new ArrayList<>();
      addUnseen(completions, seen, merged);
      addUnseen(deferred, seen, merged);
      addUnseen(pending, seen, merged);
      pending.clear();
      while (!queue.isEmpty()) {
        final Event event = queue.poll();
        drained.add(event);
        addUnseen(Collections.singletonList(event), seen, merged);
      }
      remerge = false;
      return merged;
    }

    private static void addUnseen(final Iterable<Event> events, final Map<Event, Boolean> seen,
        final List<Event> merged) {
      for (final Event event : events) {
        if (seen.put(event, Boolean.TRUE) == null) {
          merged.add(event);
        }
      }
    }
  }

  ///// Event processing /////
  private CompletableFuture<InterpreterStep> processEvent(final Event event) {
    try {
      final List<CompletableFuture<InterpreterStep>> results = new ArrayList<>();
      for (final Region region : chart.getRegions()) {
        results.add(processRegion(region, event));
      }
      return allOf(results).thenApply(ignored -> combine(results));
    } catch (RuntimeException problem) {
      return failed(problem);
    }
  }

  private CompletableFuture<InterpreterStep> processRegion(final Region region, final Event event) {
    if (!active.contains(region)) {
      return CompletableFuture.completedFuture(InterpreterStep.INCOMPLETE);
    }
    final State state = active.activeStateIn(region);
    if (state == null) {
      return CompletableFuture.completedFuture(InterpreterStep.INCOMPLETE);
    }
    return processState(state, event);
  }

  /**
   * Inner regions get the event first, concurrently; the state's own transitions are tried only if
   * none of them fired.
   */
  private CompletableFuture<InterpreterStep> processState(final State state, final Event event) {
    if (!active.contains(state)) {
      return CompletableFuture.completedFuture(InterpreterStep.INCOMPLETE);
    }
    final List<CompletableFuture<InterpreterStep>> results = new ArrayList<>();
    for (final Region region : state.getChildRegions()) {
      results.add(processRegion(region, event));
    }
    return allOf(results).thenApply(ignored -> combine(results)).thenCompose(inner -> {
      if (inner == InterpreterStep.COMPLETE) {
        return CompletableFuture.completedFuture(inner);
      }
      return processOutgoing(state, event, 0).thenApply(own -> {
        if (own == InterpreterStep.COMPLETE) {
          return own;
        }
        if (inner == InterpreterStep.DEFERRED || state.defers(event)) {
          return InterpreterStep.DEFERRED;
        }
        return InterpreterStep.INCOMPLETE;
      });
    });
  }

  /**
   * Complete if any region fired, else deferred if any region deferred.
   */
  private static InterpreterStep combine(final List<CompletableFuture<InterpreterStep>> results) {
    InterpreterStep combined = InterpreterStep.INCOMPLETE;
    for (final CompletableFuture<InterpreterStep> result : results) {
      final InterpreterStep step = result.join();
      if (step == InterpreterStep.COMPLETE) {
        return step;
      }
      if (step == InterpreterStep.DEFERRED) {
        combined = step;
      }
    }
    return combined;
  }

  private CompletableFuture<InterpreterStep> processOutgoing(final Vertex vertex,
      final Event event, final int index) {
    final List<Transition> outgoing = vertex.getOutgoing();
    if (index >= outgoing.size()) {
      return CompletableFuture.completedFuture(InterpreterStep.INCOMPLETE);
    }
    return processTransition(outgoing.get(index), event).thenCompose(result -> {
      if (result == InterpreterStep.COMPLETE) {
        return CompletableFuture.completedFuture(result);
      }
      return processOutgoing(vertex, event, index + 1);
    });
  }

  private CompletableFuture<InterpreterStep> processTransition(final Transition transition,
      final Event event) {
    if (!transition.matches(event)) {
      return CompletableFuture.completedFuture(InterpreterStep.INCOMPLETE);
    }
    return evaluate(transition.getGuard(), event).thenCompose(enabled -> {
      if (!enabled || !active.contains(transition.getSource())) {
        return CompletableFuture.completedFuture(InterpreterStep.INCOMPLETE);
      }
      return execTransition(transition, event).thenApply(ignored -> InterpreterStep.COMPLETE);
    });
  }

  ///// Transitions /////
  private CompletableFuture<Void> execTransition(final Transition transition, final Event event) {
    statistics.transitionFired();
    logDebug(machineId, transition, "Firing");
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (final Vertex vertex : transition.getPath().getLeave()) {
      chain = chain.thenCompose(ignored -> exitVertex(vertex, event));
    }
    final CompletableFuture<Void> effect =
        toVoid(chain.thenCompose(ignored -> execBehavior(transition.getEffect(), event)));
    final List<Vertex> enter = transition.getPath().getEnter();
    if (enter.isEmpty()) {
      return effect;
    }
    return effect.thenCompose(ignored -> enterPaths(Collections.singletonList(enter),
        Collections.singleton(transition.getTarget()), event));
  }

  /**
   * Fork like firing of all outgoing transitions: leave once, run the effects concurrently, then
   * enter all paths concurrently.
   */
  private CompletableFuture<Void> execTransitions(final List<Transition> transitions,
      final Event event) {
    final List<Vertex> leave = new ArrayList<>();
    final List<List<Vertex>> paths = new ArrayList<>();
    final Set<Vertex> targets = Collections.newSetFromMap(new IdentityHashMap<>());
    for (final Transition transition : transitions) {
      statistics.transitionFired();
      logDebug(machineId, transition, "Firing");
      for (final Vertex vertex : transition.getPath().getLeave()) {
        if (!containsVertex(leave, vertex)) {
          leave.add(vertex);
        }
      }
      if (!transition.getPath().getEnter().isEmpty()) {
        paths.add(transition.getPath().getEnter());
        targets.add(transition.getTarget());
      }
    }
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (final Vertex vertex : leave) {
      chain = chain.thenCompose(ignored -> exitVertex(vertex, event));
    }
    return chain.thenCompose(ignored -> {
      final List<CompletableFuture<Object>> effects = new ArrayList<>();
      for (final Transition transition : transitions) {
        effects.add(execBehavior(transition.getEffect(), event));
      }
      return allOf(effects);
    }).thenCompose(ignored -> enterPaths(paths, targets, event));
  }

  /**
   * Enters the paths concurrently. A vertex shared by several paths is entered once, by the first
   * path naming it; the others wait for that entry. The last vertex of a path is entered by
   * default, the ones before it explicitly.
   */
  private CompletableFuture<Void> enterPaths(final List<List<Vertex>> paths,
      final Set<Vertex> targets, final Event event) {
    final Map<Vertex, CompletableFuture<Void>> entered = new IdentityHashMap<>();
    final List<CompletableFuture<Void>> branches = new ArrayList<>();
    for (final List<Vertex> path : paths) {
      CompletableFuture<Void> branch = CompletableFuture.completedFuture(null);
      for (int iter = 0; iter < path.size(); iter++) {
        final Vertex vertex = path.get(iter);
        final CompletableFuture<Void> existing = entered.get(vertex);
        if (existing != null) {
          branch = branch.thenCompose(ignored -> existing);
          continue;
        }
        final EntryKind kind = iter == path.size() - 1 ? EntryKind.DEFAULT : EntryKind.EXPLICIT;
        branch = branch.thenCompose(ignored -> enterVertex(vertex, event, kind, targets));
        entered.put(vertex, branch);
      }
      branches.add(branch);
    }
    return allOf(branches);
  }

  ///// Entry /////
  private CompletableFuture<Void> enterVertex(final Vertex vertex, final Event event,
      final EntryKind kind, final Set<Vertex> targets) {
    if (status == Status.STOPPED) {
      return CompletableFuture.completedFuture(null);
    }
    if (active.contains(vertex)) {
      if (isPseudostate(vertex, PseudostateKind.JOIN)) {
        return fireJoin((Pseudostate) vertex, event);
      }
      logDebug(machineId, vertex, "Already active, not entering again");
      return CompletableFuture.completedFuture(null);
    }
    final Region container = vertex.getContainer();
    CompletableFuture<Void> ready = CompletableFuture.completedFuture(null);
    if (!(vertex instanceof Pseudostate)) {
      // a region holds one state at a time
      for (final Vertex occupant : active.activeVerticesIn(container)) {
        if (!(occupant instanceof Pseudostate)) {
          ready = ready.thenCompose(ignored -> exitVertex(occupant, event));
        }
      }
    }
    return ready.thenCompose(ignored -> {
      active.push(container);
      active.push(vertex);
      logDebug(machineId, vertex, "Entered " + kind);
      switch (vertex.getKind()) {
        case STATE:
          return enterState((State) vertex, event, kind, targets);
        case FINAL_STATE:
          return enterFinalState((FinalState) vertex, event);
        case PSEUDOSTATE:
          return enterPseudostate((Pseudostate) vertex, event);
        default:
          return CompletableFuture.completedFuture(null);
      }
    });
  }

  /**
   * Entry behavior, then the activity is started in the background, then the regions are entered,
   * then the waiters of outgoing transitions are armed.
   */
  private CompletableFuture<Void> enterState(final State state, final Event event,
      final EntryKind kind, final Set<Vertex> targets) {
    return execBehavior(state.getEntry(), event).thenCompose(ignored -> {
      startActivity(state, event);
      return enterRegions(state.getChildRegions(), event, kind, targets);
    }).thenRun(() -> {
      if (active.contains(state)) {
        for (final Transition transition : state.getOutgoing()) {
          scheduler.arm(transition);
        }
      }
    });
  }

  private CompletableFuture<Void> enterRegions(final List<Region> regions, final Event event,
      final EntryKind kind, final Set<Vertex> targets) {
    final List<CompletableFuture<Void>> entries = new ArrayList<>();
    for (final Region region : regions) {
      final boolean explicit = kind == EntryKind.EXPLICIT && holdsTarget(region, targets);
      entries.add(enterRegion(region, event, explicit ? EntryKind.EXPLICIT : EntryKind.DEFAULT));
    }
    return allOf(entries);
  }

  private static boolean holdsTarget(final Region region, final Set<Vertex> targets) {
    for (final Vertex target : targets) {
      if (target != null && target.isDescendantOf(region)) {
        return true;
      }
    }
    return false;
  }

  private CompletableFuture<Void> enterRegion(final Region region, final Event event,
      final EntryKind kind) {
    if (kind == EntryKind.EXPLICIT) {
      active.push(region);
      return CompletableFuture.completedFuture(null);
    }
    final Pseudostate initial = region.getInitial();
    if (initial == null) {
      return CompletableFuture.completedFuture(null);
    }
    active.push(region);
    return enterVertex(initial, event, EntryKind.DEFAULT, Collections.emptySet());
  }

  private void startActivity(final State state, final Event event) {
    CompletionStage<?> stage;
    try {
      stage = state.getActivity().execute(event);
    } catch (Exception problem) {
      stage = failed(problem);
    }
    final CompletionStage<?> running = stage;
    final CompletableFuture<Object> activity = resume(running);
    active.putActivity(state, activity);
    activity.whenComplete((value, error) -> {
      if (activity.isCancelled()) {
        if (running instanceof Future) {
          ((Future<?>) running).cancel(true);
        }
        return;
      }
      if (error != null && !(unwrap(error) instanceof CancellationException)) {
        recordFailure(state, unwrap(error));
      }
    });
  }

  private CompletableFuture<Void> enterFinalState(final FinalState finalState,
      final Event event) {
    final Region region = finalState.getContainer();
    return exitRegion(region, event).thenRun(() -> {
      final Statechart machine = region.getStateMachine();
      if (machine == null) {
        return;
      }
      for (final Region sibling : machine.getRegions()) {
        if (active.contains(sibling)) {
          return;
        }
      }
      if (machine == chart) {
        logInfo(machineId, chart, "Reached final configuration");
        terminationRequested = true;
      } else {
        logDebug(machineId, machine, "Submachine reached its final configuration");
      }
    });
  }

  private CompletableFuture<Void> enterPseudostate(final Pseudostate pseudostate,
      final Event event) {
    switch (pseudostate.getPseudostateKind()) {
      case INITIAL:
        return execTransition(pseudostate.getOutgoing().get(0), event);
      case CHOICE:
      case JUNCTION:
      case EXIT_POINT:
        return fireFirstEnabled(pseudostate, event, 0);
      case JOIN:
        return fireJoin(pseudostate, event);
      case FORK:
      case ENTRY_POINT:
        return execTransitions(pseudostate.getOutgoing(), event);
      case SHALLOW_HISTORY:
      case DEEP_HISTORY:
        return restoreHistory(pseudostate, event);
      case TERMINATE:
        logInfo(machineId, pseudostate, "Terminate pseudostate reached, stopping");
        terminationRequested = true;
        active.clear();
        return CompletableFuture.completedFuture(null);
      default:
        return CompletableFuture.completedFuture(null);
    }
  }

  /**
   * Outgoing transitions are tried in declaration order, the first unguarded or true one fires.
   */
  private CompletableFuture<Void> fireFirstEnabled(final Pseudostate pseudostate,
      final Event event, final int index) {
    final List<Transition> outgoing = pseudostate.getOutgoing();
    if (index >= outgoing.size()) {
      return failed(new StateMachineException(Code.PROTOCOL_VIOLATION,
          pseudostate.getQualifiedName() + ": no outgoing transition is enabled"));
    }
    final Transition transition = outgoing.get(index);
    return evaluate(transition.getGuard(), event).thenCompose(enabled -> enabled
        ? execTransition(transition, event)
        : fireFirstEnabled(pseudostate, event, index + 1));
  }

  /**
   * A branch has arrived once its source is no longer active and its region holds nothing else.
   */
  private CompletableFuture<Void> fireJoin(final Pseudostate join, final Event event) {
    for (final Transition incoming : join.getIncoming()) {
      final Vertex source = incoming.getSource();
      if (active.contains(source)) {
        return CompletableFuture.completedFuture(null);
      }
      for (final Vertex occupant : active.activeVerticesIn(source.getContainer())) {
        if (occupant != join) {
          return CompletableFuture.completedFuture(null);
        }
      }
    }
    logDebug(machineId, join, "All branches arrived");
    return execTransition(join.getOutgoing().get(0), event);
  }

  private CompletableFuture<Void> restoreHistory(final Pseudostate history, final Event event) {
    final Region region = history.getContainer();
    active.pop(history);
    if (history.getPseudostateKind() == PseudostateKind.SHALLOW_HISTORY) {
      final State last = active.shallowHistoryOf(region);
      if (last != null) {
        logDebug(machineId, history, "Restoring " + last.getQualifiedName());
        return enterPaths(Collections.singletonList(Collections.<Vertex>singletonList(last)),
            Collections.<Vertex>singleton(last), event);
      }
    } else {
      final List<State> recorded = active.deepHistoryOf(region);
      if (recorded != null && !recorded.isEmpty()) {
        logDebug(machineId, history, "Restoring " + recorded);
        final List<List<Vertex>> paths = new ArrayList<>();
        final Set<Vertex> leaves = Collections.newSetFromMap(new IdentityHashMap<>());
        for (final State state : recorded) {
          if (!ownsAny(state, recorded)) {
            paths.add(pathFrom(region, state));
            leaves.add(state);
          }
        }
        return enterPaths(paths, leaves, event);
      }
    }
    if (!history.getOutgoing().isEmpty()) {
      return execTransition(history.getOutgoing().get(0), event);
    }
    if (region.getInitial() != null) {
      return enterVertex(region.getInitial(), event, EntryKind.DEFAULT, Collections.emptySet());
    }
    return CompletableFuture.completedFuture(null);
  }

  private static boolean ownsAny(final State state, final List<State> candidates) {
    for (final State candidate : candidates) {
      if (candidate.getOwnerState() == state) {
        return true;
      }
    }
    return false;
  }

  /**
   * States from just below the region down to the vertex, outermost first.
   */
  private static List<Vertex> pathFrom(final Region region, final Vertex vertex) {
    final List<Vertex> path = new ArrayList<>();
    path.add(vertex);
    Region current = vertex.getContainer();
    while (current != null && current != region) {
      final State owner = current.getOwnerState();
      if (owner == null) {
        break;
      }
      path.add(owner);
      current = owner.getContainer();
    }
    Collections.reverse(path);
    return path;
  }

  ///// Exit /////
  private CompletableFuture<Void> exitVertex(final Vertex vertex, final Event event) {
    if (!active.contains(vertex)) {
      return CompletableFuture.completedFuture(null);
    }
    CompletableFuture<Void> exit = CompletableFuture.completedFuture(null);
    if (vertex instanceof State) {
      final State state = (State) vertex;
      for (final Transition transition : state.getOutgoing()) {
        scheduler.disarm(transition);
      }
      if (state.getCompletion() != null) {
        active.consume(state.getCompletion());
      }
      exit = exitState(state, event);
    }
    return exit.thenRun(() -> {
      active.pop(vertex);
      logDebug(machineId, vertex, "Exited");
    });
  }

  /**
   * Child regions concurrently, then the activity is cancelled, then the exit behavior runs.
   */
  private CompletableFuture<Void> exitState(final State state, final Event event) {
    return exitRegions(state.getChildRegions(), event).thenCompose(ignored -> {
      final CompletableFuture<Object> activity = active.removeActivity(state);
      if (activity != null && !activity.isDone()) {
        activity.cancel(false);
      }
      return toVoid(execBehavior(state.getExit(), event));
    });
  }

  private CompletableFuture<Void> exitRegions(final List<Region> regions, final Event event) {
    final List<CompletableFuture<Void>> exits = new ArrayList<>();
    for (final Region region : regions) {
      exits.add(exitRegion(region, event));
    }
    return allOf(exits);
  }

  private CompletableFuture<Void> exitRegion(final Region region, final Event event) {
    if (!active.contains(region)) {
      return CompletableFuture.completedFuture(null);
    }
    active.recordHistory(region);
    final List<Vertex> occupants = active.activeVerticesIn(region);
    Collections.reverse(occupants);
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (final Vertex occupant : occupants) {
      chain = chain.thenCompose(ignored -> exitVertex(occupant, event));
    }
    return chain.thenRun(() -> active.pop(region));
  }

  ///// Lifecycle /////
  private CompletableFuture<Void> settledOnLoop() {
    if (isIdle()) {
      return CompletableFuture.completedFuture(null);
    }
    final CompletableFuture<Void> idle = new CompletableFuture<>();
    idleWaiters.add(idle);
    return idle;
  }

  private boolean isIdle() {
    return !stepping && !stepScheduled && !stepRequested;
  }

  private void notifyIfIdle() {
    if (!isIdle() || idleWaiters.isEmpty()) {
      return;
    }
    final List<CompletableFuture<Void>> waiters = new ArrayList<>(idleWaiters);
    idleWaiters.clear();
    for (final CompletableFuture<Void> waiter : waiters) {
      waiter.complete(null);
    }
  }

  /**
   * Stop without running any behavior. Queued sends fail, deferred sends resolve as deferred.
   */
  private void finishTermination(final Throwable failure) {
    active.clear();
    status = Status.STOPPED;
    terminationRequested = false;
    stepRequested = false;
    pendingFailure = null;
    for (final Event event : deferred) {
      final CompletableFuture<InterpreterStep> result = sent.remove(event);
      if (result != null) {
        result.complete(InterpreterStep.DEFERRED);
      }
    }
    deferred = new ArrayList<>();
    queue.clear();
    for (final CompletableFuture<InterpreterStep> result : sent.values()) {
      result.completeExceptionally(
          new StateMachineException(Code.MACHINE_NOT_ALIVE, "State machine was terminated"));
    }
    sent.clear();
    if (termination == null) {
      termination = new CompletableFuture<>();
    }
    if (failure != null) {
      termination.completeExceptionally(failure);
    } else {
      termination.complete(null);
    }
    logInfo(machineId, chart, "Stopped state machine");
    notifyIfIdle();
  }

  ///// Helpers /////
  private static boolean isPseudostate(final Vertex vertex, final PseudostateKind kind) {
    return vertex instanceof Pseudostate && ((Pseudostate) vertex).getPseudostateKind() == kind;
  }

  private static boolean containsEvent(final List<Event> events, final Event candidate) {
    for (final Event event : events) {
      if (event == candidate) {
        return true;
      }
    }
    return false;
  }

  private static boolean containsVertex(final List<Vertex> vertices, final Vertex candidate) {
    for (final Vertex vertex : vertices) {
      if (vertex == candidate) {
        return true;
      }
    }
    return false;
  }

  private static void removeIdentical(final List<Event> events, final Event candidate) {
    events.removeIf(event -> event == candidate);
  }

  private static CompletableFuture<Void> allOf(final List<? extends CompletableFuture<?>> futures) {
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
  }

  private static CompletableFuture<Void> toVoid(final CompletableFuture<?> future) {
    return future.thenApply(ignored -> null);
  }

  private static <T> CompletableFuture<T> failed(final Throwable problem) {
    final CompletableFuture<T> failed = new CompletableFuture<>();
    failed.completeExceptionally(problem);
    return failed;
  }

  static Throwable unwrap(final Throwable problem) {
    Throwable current = problem;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  static String prefix(final String machineId, final Element element) {
    return new StringBuilder().append("[m:").append(machineId).append("][e:")
        .append(element == null ? null : element.getQualifiedName()).append("] ").toString();
  }

  static void logError(final String machineId, final Element element, final String message,
      final Throwable problem) {
    logger.error(prefix(machineId, element) + message, problem);
  }

  static void logWarning(final String machineId, final Element element, final String message) {
    logger.warn(prefix(machineId, element) + message);
  }

  static void logInfo(final String machineId, final Element element, final String message) {
    logger.info(prefix(machineId, element) + message);
  }

  static void logDebug(final String machineId, final Element element, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(prefix(machineId, element) + message);
    }
  }
}
