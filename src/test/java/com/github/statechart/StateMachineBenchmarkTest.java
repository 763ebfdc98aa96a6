package com.github.statechart;

import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.openjdk.jmh.annotations.Benchmark;

import com.github.statechart.StateMachine.StateMachineBuilder;
import com.github.statechart.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.statechart.model.ModelNode;
import com.github.statechart.model.StatechartBuilder;

public class StateMachineBenchmarkTest {

  @Benchmark
  public void testStateMachineFlow() throws Exception {
    // 1. prep the statechart, a -> b -> c with c completing back to a
    final StatechartBuilder builder = StatechartBuilder.newBuilder("bench");
    final ModelNode a = builder.state("a");
    final ModelNode b = builder.state("b");
    final ModelNode c = builder.state("c");
    builder.initial(a);
    builder.transition(a, b).on("toB");
    builder.transition(b, c).on("toC");
    builder.transition(c, a);

    // 2. load up the machine
    final StateMachineConfiguration config =
        StateMachineConfigurationBuilder.newBuilder().name("bench").build();
    final StateMachine machine =
        StateMachineBuilder.newBuilder().config(config).statechart(builder.build()).build();

    // 3. start it
    machine.start().get(5L, TimeUnit.SECONDS);

    // 4. run a few rounds
    for (int iter = 0; iter < 10; iter++) {
      machine.send(Event.of("toB")).get(5L, TimeUnit.SECONDS);
      machine.send(Event.of("toC")).get(5L, TimeUnit.SECONDS);
    }
    machine.settled().get(5L, TimeUnit.SECONDS);

    // 5. stop the machine
    machine.demolish();
  }

  @Test
  public void testSingleRound() throws Exception {
    testStateMachineFlow();
  }

  public static void main(String args[]) throws Exception {
    StateMachineBenchmarkTest test = new StateMachineBenchmarkTest();
    test.testStateMachineFlow();
  }

}
