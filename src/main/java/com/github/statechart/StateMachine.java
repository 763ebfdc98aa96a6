package com.github.statechart;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.github.statechart.model.ModelGraph;
import com.github.statechart.model.ModelNode;
import com.github.statechart.runtime.StateMachineImpl;
import com.github.statechart.runtime.StateMachineStatistics;
import com.github.statechart.structure.Element;
import com.github.statechart.structure.State;
import com.github.statechart.structure.Statechart;
import com.github.statechart.structure.StatechartCompiler;

/**
 * A hierarchical, concurrent state machine instance executing a compiled {@link Statechart}.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this runtime<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. this instance is thread-safe. All machine state is mutated on a single loop thread, callers
 * on any thread talk to it through futures<br>
 *
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed. Each instance has its own loop, active
 * configuration and scheduled waiters<br>
 *
 * 3. a compiled Statechart is immutable and is meant to be reused. There's no need to recompile the
 * same graph for every machine instance<br>
 *
 * 4. the machine does not expect any thread affinity, meaning the caller does not have to use the
 * same thread to start it, send events to it or terminate it<br>
 *
 * 5. failures of user supplied guards, effects and activities are never swallowed. They surface as
 * the cause of the future returned by the call that awaited them. The machine itself remains
 * consistent enough to be terminated<br>
 */
public interface StateMachine {

  ///// Lifecycle API /////
  /**
   * Enter the top-level regions through their initial pseudostates. Resolves once the initial
   * active configuration is settled.
   */
  CompletableFuture<Void> start();

  /**
   * Enqueue an event. Resolves once that specific event has been processed, with the outcome of
   * processing it.
   */
  CompletableFuture<InterpreterStep> send(final Event event);

  /**
   * Invoke the operation of the named call event. Resolves with the operation's result, after
   * which the call event becomes an occurrence offered to the machine.
   */
  CompletableFuture<Object> call(final String callEventName, final Object... arguments);

  /**
   * Exit all active regions, innermost first, and stop the loop. Idempotent; cancelling the
   * returned future abandons the remaining exit behaviors and stops the machine immediately.
   */
  CompletableFuture<Void> terminate();

  /**
   * Resolves once the machine has no step running or requested.
   */
  CompletableFuture<Void> settled();


  ///// Query API /////
  /**
   * Check whether all the given elements are part of the active configuration.
   */
  boolean isActive(final Element... elements);

  /**
   * Check whether all the vertices with the given names are part of the active configuration.
   */
  boolean isActive(final String... vertexNames) throws StateMachineException;

  /**
   * Report the active leaf states in the order they were entered. Pseudostates are excluded.
   */
  List<State> state();

  Statechart getStatechart();


  ///// Machine housekeeping /////
  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  /**
   * Returns the config that this machine is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this machine.
   */
  StateMachineStatistics getStatistics();

  /**
   * Check if the state machine is running.
   */
  boolean alive();

  /**
   * Terminate the machine, unregister it and release its loop if it owns one. A demolished machine
   * cannot be started again.
   */
  boolean demolish() throws StateMachineException;

  /**
   * A simple builder to let users use fluent APIs to build state machines.
   */
  public final static class StateMachineBuilder {
    private StateMachineConfiguration config;
    private Statechart statechart;
    private ModelGraph graph;
    private ModelNode root;

    public static StateMachineBuilder newBuilder() {
      return new StateMachineBuilder();
    }

    public StateMachineBuilder config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineBuilder statechart(final Statechart statechart) {
      this.statechart = statechart;
      return this;
    }

    /**
     * Compile and validate the machine rooted at the given node while building.
     */
    public StateMachineBuilder model(final ModelGraph graph, final ModelNode root) {
      this.graph = graph;
      this.root = root;
      return this;
    }

    public StateMachine build() throws StateMachineException {
      Statechart chart = statechart;
      if (chart == null) {
        if (graph == null || root == null) {
          throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
              "Either a compiled statechart or a model graph with its root is required");
        }
        chart = StatechartCompiler.compile(graph, root);
      }
      return new StateMachineImpl(config != null ? config : StateMachineConfiguration.defaults(),
          chart);
    }

    private StateMachineBuilder() {}
  }

}
