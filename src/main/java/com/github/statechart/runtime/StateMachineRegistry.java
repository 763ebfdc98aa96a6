package com.github.statechart.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.Event;
import com.github.statechart.InterpreterStep;
import com.github.statechart.StateMachine;
import com.github.statechart.StateMachineException;

/**
 * Global registry of all state machines that exist within a jvm process. Machines register
 * themselves when they are built and unregister when demolished.
 */
public final class StateMachineRegistry {
  private static final Logger logger =
      LogManager.getLogger(StateMachineRegistry.class.getSimpleName());

  private final AtomicBoolean alive = new AtomicBoolean();
  private final ConcurrentMap<String, StateMachine> allStateMachines = new ConcurrentHashMap<>();

  private GlobalStatsDaemon statsGatherer;
  private final static long statsGathererSleepMillis = 300 * 1000L;
  private final static long destructorTimeoutMillis = 10 * 1000L;

  private static final StateMachineRegistry instance = new StateMachineRegistry();

  public static StateMachineRegistry getInstance() {
    return instance;
  }

  void register(final StateMachine stateMachine) {
    allStateMachines.putIfAbsent(stateMachine.getId(), stateMachine);
  }

  void unregister(final String stateMachineId) {
    allStateMachines.remove(stateMachineId);
  }

  /**
   * Null if no live machine has the id.
   */
  public StateMachine lookup(final String stateMachineId) {
    return allStateMachines.get(stateMachineId);
  }

  public List<StateMachine> getStateMachines() {
    return Collections.unmodifiableList(new ArrayList<>(allStateMachines.values()));
  }

  /**
   * Send the event to every running machine. Since events compare by identity, every machine gets
   * its own occurrence built by the factory.
   */
  public List<CompletableFuture<InterpreterStep>> broadcast(
      final Supplier<Event> eventFactory) {
    final List<CompletableFuture<InterpreterStep>> results = new ArrayList<>();
    for (final StateMachine stateMachine : allStateMachines.values()) {
      if (stateMachine.alive()) {
        results.add(stateMachine.send(eventFactory.get()));
      }
    }
    return results;
  }

  synchronized void demolish() {
    if (!alive.get()) {
      logger.info("Global state machine registry is already shutdown");
      return;
    }
    logger.info("Shutting down global state machine registry");
    try {
      statsGatherer.interrupt();
      statsGatherer.join();
      statsGatherer = null;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
    for (final StateMachine stateMachine : allStateMachines.values()) {
      try {
        logger.info(stateMachine.getStatistics());
        stateMachine.demolish();
      } catch (StateMachineException problem) {
        logger.error(
            "Problem occurred while running demolish() as part of the shutdown hook sequence.",
            problem);
      }
    }
    allStateMachines.clear();
    alive.set(false);
    logger.info("Successfully shut down global state machine registry");
  }

  private StateMachineRegistry() {
    statsGatherer = new GlobalStatsDaemon();
    statsGatherer.start();
    StateMachineDestructor.install(this, destructorTimeoutMillis);
    alive.set(true);
    logger.info("Fired up global state machine registry");
  }

  /**
   * Daemon to periodically wake up and gather all machines' stats and dump them to log.
   */
  private final class GlobalStatsDaemon extends Thread {
    private GlobalStatsDaemon() {
      setName("stats-gatherer");
      setDaemon(true);
      logger.info("Fired up global stats daemon");
    }

    @Override
    public void run() {
      while (!isInterrupted()) {
        if (logger.isDebugEnabled()) {
          logger.debug("Global stats daemon woke up to gather all machines' stats");
        }
        final StringBuilder builder = new StringBuilder("Global state machine statistics");
        for (final StateMachine stateMachine : allStateMachines.values()) {
          builder.append("\n    ").append(stateMachine.getStatistics().toString());
        }
        logger.info(builder.toString());
        try {
          Thread.sleep(statsGathererSleepMillis);
        } catch (InterruptedException exception) {
          Thread.currentThread().interrupt();
        }
      }
      logger.info("Successfully shut down global stats daemon");
    }
  }

}
