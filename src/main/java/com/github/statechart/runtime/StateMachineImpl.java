package com.github.statechart.runtime;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.github.statechart.Event;
import com.github.statechart.InterpreterStep;
import com.github.statechart.StateMachine;
import com.github.statechart.StateMachineConfiguration;
import com.github.statechart.StateMachineException;
import com.github.statechart.StateMachineException.Code;
import com.github.statechart.structure.Element;
import com.github.statechart.structure.State;
import com.github.statechart.structure.Statechart;
import com.github.statechart.structure.Vertex;

/**
 * Core implementation of the state machine. Wires a compiled statechart to an {@link Interpreter}
 * running on a loop executor, and takes care of the machine's housekeeping: ids, registration,
 * statistics and demolition.
 */
public final class StateMachineImpl implements StateMachine {
  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineConfiguration config;
  private final Statechart chart;
  private final ScheduledExecutorService loop;
  private final boolean ownsLoop;
  private final StateMachineStatistics machineStats;
  private final Interpreter interpreter;
  private final AtomicBoolean demolished = new AtomicBoolean();

  private final static long demolishTimeoutMillis = TimeUnit.SECONDS.toMillis(10L);

  public StateMachineImpl(final StateMachineConfiguration config, final Statechart chart)
      throws StateMachineException {
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG, "Config cannot be null");
    }
    if (chart == null) {
      throw new StateMachineException(Code.INVALID_STRUCTURE, "Statechart cannot be null");
    }
    this.config = config;
    this.chart = chart;
    Interpreter.logInfo(machineId, chart, "Firing up state machine with " + config);
    if (config.getLoopExecutor() != null) {
      this.loop = config.getLoopExecutor();
      this.ownsLoop = false;
    } else {
      final String loopName = "statechart-loop-" + config.getName();
      this.loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
        final Thread thread = new Thread(runnable, loopName);
        thread.setDaemon(true);
        return thread;
      });
      this.ownsLoop = true;
    }
    this.machineStats = new StateMachineStatistics(machineId);
    this.interpreter = new Interpreter(machineId, chart, loop, config.getClock(),
        config.getChangePollMillis(), machineStats);
    StateMachineRegistry.getInstance().register(this);
    Interpreter.logInfo(machineId, chart, "Successfully fired up state machine");
  }

  @Override
  public CompletableFuture<Void> start() {
    if (demolished.get()) {
      return notAlive();
    }
    return interpreter.start();
  }

  @Override
  public CompletableFuture<InterpreterStep> send(final Event event) {
    if (demolished.get()) {
      return notAlive();
    }
    return interpreter.dispatch(event);
  }

  @Override
  public CompletableFuture<Object> call(final String callEventName, final Object... arguments) {
    if (demolished.get()) {
      return notAlive();
    }
    return interpreter.call(callEventName, arguments);
  }

  @Override
  public CompletableFuture<Void> terminate() {
    return interpreter.terminate();
  }

  @Override
  public CompletableFuture<Void> settled() {
    return interpreter.settled();
  }

  @Override
  public boolean isActive(final Element... elements) {
    return interpreter.isActive(elements);
  }

  @Override
  public boolean isActive(final String... vertexNames) throws StateMachineException {
    final Vertex[] vertices = new Vertex[vertexNames.length];
    for (int iter = 0; iter < vertexNames.length; iter++) {
      vertices[iter] = chart.findVertex(vertexNames[iter]);
    }
    return interpreter.isActive(vertices);
  }

  @Override
  public List<State> state() {
    return interpreter.leafStates();
  }

  @Override
  public Statechart getStatechart() {
    return chart;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public boolean alive() {
    return !demolished.get() && interpreter.isAlive();
  }

  /**
   * Blocks until the machine terminated. Not to be called from a behavior running on this
   * machine's loop.
   */
  @Override
  public boolean demolish() throws StateMachineException {
    if (!demolished.compareAndSet(false, true)) {
      Interpreter.logInfo(machineId, chart, "State machine is already demolished");
      return true;
    }
    Interpreter.logInfo(machineId, chart, "Demolishing state machine");
    final CompletableFuture<Void> termination = interpreter.terminate();
    try {
      termination.get(demolishTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, interrupted);
    } catch (TimeoutException timedOut) {
      Interpreter.logWarning(machineId, chart,
          "Timed out waiting for exit behaviors, stopping immediately");
      termination.cancel(true);
    } catch (ExecutionException problem) {
      Interpreter.logError(machineId, chart, "Exit behaviors failed while demolishing",
          problem.getCause());
    } finally {
      StateMachineRegistry.getInstance().unregister(machineId);
      if (ownsLoop) {
        loop.shutdown();
      }
    }
    Interpreter.logInfo(machineId, chart, machineStats.toString());
    Interpreter.logInfo(machineId, chart, "Successfully shut down state machine");
    return true;
  }

  private static <T> CompletableFuture<T> notAlive() {
    final CompletableFuture<T> failed = new CompletableFuture<>();
    failed.completeExceptionally(
        new StateMachineException(Code.MACHINE_NOT_ALIVE, "State machine is demolished"));
    return failed;
  }

  @Override
  public String toString() {
    return "StateMachineImpl [machineId=" + machineId + ", chart=" + chart.getQualifiedName()
        + ", alive=" + alive() + "]";
  }
}
