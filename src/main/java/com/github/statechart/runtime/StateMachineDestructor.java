package com.github.statechart.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StateMachine;

/**
 * Shuts down every machine still registered when the jvm exits. Running machines are terminated
 * together so their exit behaviors share one deadline, then the registry demolishes them.
 */
final class StateMachineDestructor extends Thread {
  private static final Logger logger =
      LogManager.getLogger(StateMachineDestructor.class.getSimpleName());

  private final StateMachineRegistry registry;
  private final long terminateTimeoutMillis;

  StateMachineDestructor(final StateMachineRegistry registry, final long terminateTimeoutMillis) {
    super("statechart-destructor");
    this.registry = registry;
    this.terminateTimeoutMillis = terminateTimeoutMillis;
  }

  static StateMachineDestructor install(final StateMachineRegistry registry,
      final long terminateTimeoutMillis) {
    final StateMachineDestructor destructor =
        new StateMachineDestructor(registry, terminateTimeoutMillis);
    Runtime.getRuntime().addShutdownHook(destructor);
    logger.info("Fired up state machine destructor");
    return destructor;
  }

  @Override
  public void run() {
    terminateRunning();
    registry.demolish();
  }

  /**
   * Terminate the running machines and wait for their exit behaviors. Returns how many were
   * running.
   */
  int terminateRunning() {
    final List<StateMachine> machines = registry.getStateMachines();
    final List<CompletableFuture<Void>> terminations = new ArrayList<>();
    for (final StateMachine machine : machines) {
      if (machine.alive()) {
        terminations.add(machine.terminate());
      }
    }
    logger.info("Terminating " + terminations.size() + " of " + machines.size()
        + " registered state machines");
    if (terminations.isEmpty()) {
      return 0;
    }
    try {
      CompletableFuture.allOf(terminations.toArray(new CompletableFuture<?>[0]))
          .get(terminateTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } catch (TimeoutException timedOut) {
      logger.warn("Timed out after " + terminateTimeoutMillis
          + " millis waiting for state machines to terminate");
    } catch (ExecutionException problem) {
      logger.error("Exit behaviors failed while terminating state machines", problem.getCause());
    }
    return terminations.size();
  }

}
