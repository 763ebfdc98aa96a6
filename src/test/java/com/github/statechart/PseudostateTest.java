package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.statechart.StateMachine.StateMachineBuilder;
import com.github.statechart.model.ModelNode;
import com.github.statechart.model.StatechartBuilder;
import com.github.statechart.structure.State;

/**
 * Orthogonal regions, compound transitions through pseudostates, history and submachines.
 */
public class PseudostateTest {
  private static final long TIMEOUT = 5L;

  @Test
  public void testOrthogonalRegions() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("keyboard");
    final ModelNode keyboard = builder.state("keyboard");
    final ModelNode caps = builder.region(keyboard, "caps");
    final ModelNode numbers = builder.region(keyboard, "numbers");
    final ModelNode capsOff = builder.state(caps, "capsOff");
    final ModelNode capsOn = builder.state(caps, "capsOn");
    final ModelNode numOff = builder.state(numbers, "numOff");
    final ModelNode numOn = builder.state(numbers, "numOn");
    builder.initial(keyboard);
    builder.initial(capsOff);
    builder.initial(numOff);
    builder.transition(capsOff, capsOn).on("caps");
    builder.transition(capsOn, capsOff).on("caps");
    builder.transition(numOff, numOn).on("num");
    builder.transition(numOn, numOff).on("num");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("keyboard", "capsOff", "numOff"));
    assertEquals(2, machine.state().size());

    machine.send(Event.of("caps")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("capsOn", "numOff"));
    machine.send(Event.of("num")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("capsOn", "numOn"));
    machine.send(Event.of("caps")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("capsOff", "numOn"));
    machine.demolish();
  }

  @Test
  public void testForkAndJoin() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("parallel");
    final ModelNode idle = builder.state("idle");
    final ModelNode work = builder.state("work");
    final ModelNode left = builder.region(work, "left");
    final ModelNode right = builder.region(work, "right");
    final ModelNode leftStart = builder.state(left, "leftStart");
    final ModelNode leftBusy = builder.state(left, "leftBusy");
    final ModelNode leftDone = builder.state(left, "leftDone");
    final ModelNode rightStart = builder.state(right, "rightStart");
    final ModelNode rightBusy = builder.state(right, "rightBusy");
    final ModelNode rightDone = builder.state(right, "rightDone");
    final ModelNode finished = builder.state("finished");
    final ModelNode fork = builder.fork(builder.getRoot(), "split");
    final ModelNode join = builder.join(builder.getRoot(), "merge");
    builder.initial(idle);
    builder.initial(leftStart);
    builder.initial(rightStart);
    builder.transition(idle, fork).on("begin");
    builder.transition(fork, leftBusy);
    builder.transition(fork, rightBusy);
    builder.transition(leftBusy, leftDone).on("left");
    builder.transition(rightBusy, rightDone).on("right");
    builder.transition(leftDone, join);
    builder.transition(rightDone, join);
    builder.transition(join, finished);

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);

    // 1. the fork enters both regions explicitly, the initials are bypassed
    machine.send(Event.of("begin")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("work", "leftBusy", "rightBusy"));
    assertFalse(machine.isActive("leftStart"));
    assertFalse(machine.isActive("rightStart"));
    assertFalse(machine.isActive("split"));

    // 2. one branch arriving is not enough
    machine.send(Event.of("left")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("work", "rightBusy"));
    assertFalse(machine.isActive("finished"));
    assertFalse(machine.isActive("leftDone"));

    // 3. the second branch fires the join
    machine.send(Event.of("right")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("finished"));
    assertFalse(machine.isActive("work"));
    assertFalse(machine.isActive("merge"));
    final List<State> leaves = machine.state();
    assertEquals(1, leaves.size());
    assertEquals("finished", leaves.get(0).getName());
    machine.demolish();
  }

  @Test
  public void testJoinFiresOnceWhicheverBranchArrivesLast() throws Exception {
    final AtomicInteger merges = new AtomicInteger();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("rendezvous");
    final ModelNode work = builder.state("work");
    final ModelNode left = builder.region(work, "left");
    final ModelNode right = builder.region(work, "right");
    final ModelNode leftBusy = builder.state(left, "leftBusy");
    final ModelNode leftDone = builder.state(left, "leftDone");
    final ModelNode rightBusy = builder.state(right, "rightBusy");
    final ModelNode rightDone = builder.state(right, "rightDone");
    final ModelNode finished = builder.state("finished");
    final ModelNode join = builder.join(builder.getRoot(), "merge");
    builder.initial(work);
    builder.initial(leftBusy);
    builder.initial(rightBusy);
    builder.transition(leftBusy, leftDone).on("left");
    builder.transition(rightBusy, rightDone).on("right");
    builder.transition(leftDone, join);
    builder.transition(rightDone, join);
    builder.transition(join, finished).effect(Behavior.of(event -> merges.incrementAndGet()));

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);

    // 1. right arrives first and waits
    machine.send(Event.of("right")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("work", "leftBusy"));
    assertFalse(machine.isActive("finished"));
    assertEquals(0, merges.get());

    // 2. left completes the rendezvous
    machine.send(Event.of("left")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("finished"));
    assertFalse(machine.isActive("work"));
    assertEquals(1, merges.get());
    machine.demolish();
  }

  @Test
  public void testShallowHistory() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("player");
    final ModelNode stopped = builder.state("stopped");
    final ModelNode playing = builder.state("playing");
    final ModelNode intro = builder.state(playing, "intro");
    final ModelNode chorus = builder.state(playing, "chorus");
    final ModelNode history = builder.shallowHistory(playing, "resume");
    builder.initial(stopped);
    builder.initial(intro);
    builder.transition(stopped, history).on("play");
    builder.transition(intro, chorus).on("next");
    builder.transition(playing, stopped).on("stop");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);

    // 1. nothing recorded yet, the region's initial is used
    machine.send(Event.of("play")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("playing", "intro"));
    assertFalse(machine.isActive("resume"));

    // 2. leave from the second substate and come back to it
    machine.send(Event.of("next")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.send(Event.of("stop")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("stopped"));
    machine.send(Event.of("play")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("playing", "chorus"));
    assertFalse(machine.isActive("intro"));
    machine.demolish();
  }

  @Test
  public void testDeepHistory() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("editor");
    final ModelNode closed = builder.state("closed");
    final ModelNode editing = builder.state("editing");
    final ModelNode browsing = builder.state(editing, "browsing");
    final ModelNode typing = builder.state(editing, "typing");
    final ModelNode insert = builder.state(typing, "insert");
    final ModelNode overwrite = builder.state(typing, "overwrite");
    final ModelNode history = builder.deepHistory(editing, "restore");
    builder.initial(closed);
    builder.initial(browsing);
    builder.initial(insert);
    builder.transition(closed, history).on("open");
    builder.transition(browsing, typing).on("type");
    builder.transition(insert, overwrite).on("toggle");
    builder.transition(editing, closed).on("close");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    machine.send(Event.of("open")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("editing", "browsing"));

    machine.send(Event.of("type")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.send(Event.of("toggle")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("typing", "overwrite"));
    machine.send(Event.of("close")).get(TIMEOUT, TimeUnit.SECONDS);
    assertFalse(machine.isActive("editing"));

    // the whole nested configuration comes back, not the initial of typing
    machine.send(Event.of("open")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("editing", "typing", "overwrite"));
    assertFalse(machine.isActive("insert"));
    assertFalse(machine.isActive("browsing"));
    machine.demolish();
  }

  @Test
  public void testEntryAndExitPoints() throws Exception {
    final Trace trace = new Trace();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("checkout");
    final ModelNode cart = builder.state("cart");
    final ModelNode payment = builder.state("payment");
    final ModelNode card = builder.state(payment, "card");
    final ModelNode voucher = builder.state(payment, "voucher");
    final ModelNode viaVoucher = builder.entryPoint(payment, "viaVoucher");
    final ModelNode abort = builder.exitPoint(payment, "abort");
    final ModelNode cancelled = builder.state("cancelled");
    builder.initial(cart);
    builder.initial(card);
    builder.entry(payment, trace.record("enter payment"));
    builder.exit(payment, trace.record("exit payment"));
    builder.transition(cart, viaVoucher).on("redeem");
    builder.transition(viaVoucher, voucher).effect(trace.record("voucher effect"));
    builder.transition(voucher, abort).on("cancel");
    builder.transition(abort, cancelled).effect(trace.record("abort effect"));

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);

    machine.send(Event.of("redeem")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("payment", "voucher"));
    assertFalse(machine.isActive("card"));
    assertFalse(machine.isActive("viaVoucher"));
    assertEquals(Arrays.asList("enter payment", "voucher effect"), trace.entries());

    trace.clear();
    machine.send(Event.of("cancel")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("cancelled"));
    assertFalse(machine.isActive("payment"));
    assertEquals(Arrays.asList("exit payment", "abort effect"), trace.entries());
    machine.demolish();
  }

  @Test
  public void testSubmachineState() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("factory");
    final StatechartBuilder assembly = builder.submachine("assembly");
    final ModelNode mount = assembly.state("mount");
    final ModelNode screw = assembly.state("screw");
    assembly.initial(mount);
    assembly.transition(mount, screw).on("next");

    final ModelNode line = builder.submachineState(builder.getRoot(), "line", assembly);
    final ModelNode shipped = builder.state("shipped");
    builder.initial(line);
    builder.transition(line, shipped).on("ship");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("line", "mount"));
    assertTrue(machine.isActive("assembly.mount"));

    machine.send(Event.of("next")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("line", "screw"));
    assertEquals("screw", machine.state().get(0).getName());

    machine.send(Event.of("ship")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("shipped"));
    assertFalse(machine.isActive("screw"));
    assertFalse(machine.isActive("line"));
    machine.demolish();
  }

  @Test
  public void testFinalStateTerminatesMachine() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("oneshot");
    final ModelNode running = builder.state("running");
    final ModelNode done = builder.finalState("done");
    builder.initial(running);
    builder.transition(running, done).on("finish");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertEquals(InterpreterStep.COMPLETE,
        machine.send(Event.of("finish")).get(TIMEOUT, TimeUnit.SECONDS));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertFalse(machine.alive());
    assertTrue(machine.state().isEmpty());
    machine.terminate().get(TIMEOUT, TimeUnit.SECONDS);
    machine.demolish();
  }

  @Test
  public void testNestedFinalStateOnlyExitsItsRegion() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("wizard");
    final ModelNode steps = builder.state("steps");
    final ModelNode stepOne = builder.state(steps, "stepOne");
    final ModelNode last = builder.finalState(steps, "last");
    final ModelNode summary = builder.state("summary");
    builder.initial(steps);
    builder.initial(stepOne);
    builder.transition(stepOne, last).on("next");
    builder.transition(steps, summary).on("review");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("steps", "stepOne"));

    machine.send(Event.of("next")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.alive());
    assertTrue(machine.isActive("steps"));
    assertFalse(machine.isActive("stepOne"));
    assertFalse(machine.isActive("last"));

    machine.send(Event.of("review")).get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("summary"));
    machine.demolish();
  }

  @Test
  public void testTerminatePseudostate() throws Exception {
    final Trace trace = new Trace();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("killswitch");
    final ModelNode outer = builder.state("outer");
    final ModelNode inner = builder.state(outer, "inner");
    final ModelNode kill = builder.terminate(outer, "kill");
    builder.initial(outer);
    builder.initial(inner);
    builder.exit(outer, trace.record("exit outer"));
    builder.exit(inner, trace.record("exit inner"));
    builder.transition(inner, kill).on("kill");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    machine.send(Event.of("kill")).get(TIMEOUT, TimeUnit.SECONDS);
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertFalse(machine.alive());
    // the source is left by the transition, its ancestors are not exited
    assertEquals(Arrays.asList("exit inner"), trace.entries());
    assertTrue(machine.state().isEmpty());
    machine.demolish();
  }

}
