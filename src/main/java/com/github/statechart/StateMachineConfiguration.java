package com.github.statechart;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * This class encapsulates all the configuration parameters for a StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If no loop executor is set, every machine fires up and owns a dedicated single threaded loop
 * that is shut down when the machine is demolished. An injected executor is never shut down by the
 * machine and must execute tasks one at a time in submission order, eg.
 * {@code Executors.newSingleThreadScheduledExecutor()}. Several machines may share one loop.<br>
 * 2. If no clock is set, the {@link SystemClock} drives time events.<br>
 * 3. Change events re-test their predicate every changePollMillis on the loop. If this is not set,
 * a default of 5 milliseconds is used.<br>
 */
public final class StateMachineConfiguration {
  private final String name;
  private final Clock clock;
  private final ScheduledExecutorService loopExecutor;
  private final long changePollMillis;

  public String getName() {
    return name;
  }

  public Clock getClock() {
    return clock;
  }

  /**
   * Null when every machine owns its loop.
   */
  public ScheduledExecutorService getLoopExecutor() {
    return loopExecutor;
  }

  public long getChangePollMillis() {
    return changePollMillis;
  }

  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration("statechart", SystemClock.getInstance(), null, 0L);
  }

  public final static class StateMachineConfigurationBuilder {
    private String name = "statechart";
    private Clock clock = SystemClock.getInstance();
    private ScheduledExecutorService loopExecutor;
    private long changePollMillis;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public StateMachineConfigurationBuilder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public StateMachineConfigurationBuilder loopExecutor(
        final ScheduledExecutorService loopExecutor) {
      this.loopExecutor = loopExecutor;
      return this;
    }

    public StateMachineConfigurationBuilder changePollMillis(final long changePollMillis) {
      this.changePollMillis = changePollMillis;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(name, clock, loopExecutor, changePollMillis);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (name == null || name.trim().isEmpty()) {
      messages.append("Name cannot be null or empty. ");
    }
    if (clock == null) {
      messages.append("Clock cannot be null. ");
    }
    if (loopExecutor != null && loopExecutor.isShutdown()) {
      messages.append("Loop executor cannot be shut down. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [name=" + name + ", clock=" + clock + ", ownLoop="
        + (loopExecutor == null) + ", changePollMillis=" + changePollMillis + "]";
  }

  private StateMachineConfiguration(final String name, final Clock clock,
      final ScheduledExecutorService loopExecutor, final long changePollMillis) {
    this.name = name;
    this.clock = clock;
    this.loopExecutor = loopExecutor;
    if (changePollMillis <= 0L) {
      this.changePollMillis = TimeUnit.MILLISECONDS.toMillis(5L);
    } else {
      this.changePollMillis = changePollMillis;
    }
  }

}
