package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import com.github.statechart.StateMachine.StateMachineBuilder;
import com.github.statechart.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.statechart.StateMachineException.Code;
import com.github.statechart.model.ModelNode;
import com.github.statechart.model.StatechartBuilder;

/**
 * Time, change, completion, call and deferred events.
 */
public class EventTest {
  private static final long TIMEOUT = 5L;

  @Test
  public void testRelativeTimeEvent() throws Exception {
    final ManualClock clock = new ManualClock();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("timer");
    final ModelNode waiting = builder.state("waiting");
    final ModelNode expired = builder.state("expired");
    builder.initial(waiting);
    builder.transition(waiting, expired).after(Duration.ofSeconds(5L));

    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("timer").clock(clock).build())
        .statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertEquals(1, clock.pendingTimers());

    // 1. not due yet
    clock.advance(Duration.ofSeconds(4L));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("waiting"));

    // 2. due
    clock.advance(Duration.ofSeconds(1L));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("expired"));
    assertEquals(0, clock.pendingTimers());
    machine.demolish();
  }

  @Test
  public void testAbsoluteTimeEvent() throws Exception {
    final Instant start = Instant.parse("2024-01-01T00:00:00Z");
    final ManualClock clock = new ManualClock(start);
    final StatechartBuilder builder = StatechartBuilder.newBuilder("alarm");
    final ModelNode sleeping = builder.state("sleeping");
    final ModelNode awake = builder.state("awake");
    builder.initial(sleeping);
    builder.transition(sleeping, awake).at(start.plus(Duration.ofHours(8L)));

    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("alarm").clock(clock).build())
        .statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    clock.advance(Duration.ofHours(7L));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("sleeping"));
    clock.advance(Duration.ofHours(2L));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("awake"));
    machine.demolish();
  }

  @Test
  public void testExitCancelsTimer() throws Exception {
    final ManualClock clock = new ManualClock();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("session");
    final ModelNode active = builder.state("active");
    final ModelNode timedOut = builder.state("timedOut");
    final ModelNode loggedOut = builder.state("loggedOut");
    builder.initial(active);
    builder.transition(active, timedOut).after(Duration.ofMinutes(30L));
    builder.transition(active, loggedOut).on("logout");

    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("session").clock(clock).build())
        .statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    machine.send(Event.of("logout")).get(TIMEOUT, TimeUnit.SECONDS);
    assertEquals(0, clock.pendingTimers());

    clock.advance(Duration.ofHours(1L));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("loggedOut"));
    assertFalse(machine.isActive("timedOut"));
    machine.demolish();
  }

  @Test
  public void testTimeEventOnSystemClock() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("blink");
    final ModelNode on = builder.state("on");
    final ModelNode off = builder.state("off");
    builder.initial(on);
    builder.transition(on, off).after(Duration.ofMillis(50L));

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(Trace.await(() -> isActive(machine, "off"), 2000L));
    machine.demolish();
  }

  @Test
  public void testChangeEvent() throws Exception {
    final AtomicBoolean doorOpen = new AtomicBoolean();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("alarm");
    final ModelNode armed = builder.state("armed");
    final ModelNode ringing = builder.state("ringing");
    builder.initial(armed);
    builder.transition(armed, ringing).when(doorOpen::get);

    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("alarm").changePollMillis(2L)
            .build())
        .statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    Thread.sleep(20L);
    assertTrue(machine.isActive("armed"));

    doorOpen.set(true);
    assertTrue(Trace.await(() -> isActive(machine, "ringing"), 2000L));
    machine.demolish();
  }

  @Test
  public void testCompletionAfterActivity() throws Exception {
    final AtomicReference<Object> result = new AtomicReference<>();
    final Executor later = CompletableFuture.delayedExecutor(300L, TimeUnit.MILLISECONDS);
    final StatechartBuilder builder = StatechartBuilder.newBuilder("download");
    final ModelNode fetching = builder.state("fetching");
    final ModelNode saved = builder.state("saved");
    builder.initial(fetching);
    builder.activity(fetching, event -> CompletableFuture.supplyAsync(() -> "payload", later));
    builder.transition(fetching, saved).effect(Behavior.of(event -> result.set(event.getPayload())));

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    // the activity is still running
    assertTrue(machine.isActive("fetching"));

    assertTrue(Trace.await(() -> isActive(machine, "saved"), 3000L));
    assertEquals("payload", result.get());
    machine.demolish();
  }

  @Test
  public void testCompletionWithoutActivity() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("pipeline");
    final ModelNode first = builder.state("first");
    final ModelNode second = builder.state("second");
    final ModelNode third = builder.state("third");
    builder.initial(first);
    builder.transition(first, second).on("go");
    builder.transition(second, third);

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertEquals(InterpreterStep.COMPLETE,
        machine.send(Event.of("go")).get(TIMEOUT, TimeUnit.SECONDS));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("third"));
    machine.demolish();
  }

  @Test
  public void testCallEvent() throws Exception {
    final AtomicReference<Object> charged = new AtomicReference<>();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("billing");
    final ModelNode open = builder.state("open");
    final ModelNode paid = builder.state("paid");
    final ModelNode charge =
        builder.callEvent("charge", CallOperation.of(arguments -> (Integer) arguments[0] * 2));
    builder.initial(open);
    builder.transition(open, paid).on(charge)
        .effect(Behavior.of(event -> charged.set(event.getPayload())));

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    assertEquals(Integer.valueOf(42), machine.call("charge", 21).get(TIMEOUT, TimeUnit.SECONDS));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertTrue(machine.isActive("paid"));
    assertEquals(Integer.valueOf(42), charged.get());

    // only declared call events can be invoked
    try {
      machine.call("refund").get(TIMEOUT, TimeUnit.SECONDS);
      fail("Expected an unknown call event to be rejected");
    } catch (ExecutionException expected) {
      assertEquals(Code.UNKNOWN_CALL_EVENT,
          ((StateMachineException) expected.getCause()).getCode());
    }
    machine.demolish();
  }

  @Test
  public void testDeferredEvent() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("printer");
    final ModelNode warmingUp = builder.state("warmingUp");
    final ModelNode ready = builder.state("ready");
    final ModelNode printing = builder.state("printing");
    builder.initial(warmingUp);
    builder.defer(warmingUp, "print");
    builder.transition(warmingUp, ready).on("warm");
    builder.transition(ready, printing).on("print");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);

    // 1. deferred while warming up, the sender keeps waiting
    final Event print = Event.of("print");
    final CompletableFuture<InterpreterStep> printed = machine.send(print);
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertFalse(printed.isDone());
    assertTrue(machine.isActive("warmingUp"));
    assertEquals(1L, machine.getStatistics().getEventsDeferred());

    // 2. the same occurrence cannot be sent while pending
    try {
      machine.send(print).get(TIMEOUT, TimeUnit.SECONDS);
      fail("Expected a pending event to be rejected");
    } catch (ExecutionException expected) {
      assertEquals(Code.ILLEGAL_EVENT, ((StateMachineException) expected.getCause()).getCode());
    }

    // 3. once ready the deferred event is processed in the same step
    assertEquals(InterpreterStep.COMPLETE,
        machine.send(Event.of("warm")).get(TIMEOUT, TimeUnit.SECONDS));
    assertEquals(InterpreterStep.COMPLETE, printed.get(TIMEOUT, TimeUnit.SECONDS));
    assertTrue(machine.isActive("printing"));
    machine.demolish();
  }

  @Test
  public void testDeferredEventFailureReachesItsSender() throws Exception {
    final IllegalStateException boom = new IllegalStateException("boom");
    final StatechartBuilder builder = StatechartBuilder.newBuilder("jammed");
    final ModelNode warmingUp = builder.state("warmingUp");
    final ModelNode ready = builder.state("ready");
    final ModelNode printing = builder.state("printing");
    builder.initial(warmingUp);
    builder.defer(warmingUp, "print");
    builder.transition(warmingUp, ready).on("warm");
    builder.transition(ready, printing).on("print").guard(event -> {
      throw boom;
    });

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    final CompletableFuture<InterpreterStep> printed = machine.send(Event.of("print"));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertFalse(printed.isDone());

    // 1. warm fired its transition, so its sender sees the outcome and not the guard failure
    assertEquals(InterpreterStep.COMPLETE,
        machine.send(Event.of("warm")).get(TIMEOUT, TimeUnit.SECONDS));

    // 2. the deferred event that broke the step gets the failure
    try {
      printed.get(TIMEOUT, TimeUnit.SECONDS);
      fail("Expected the guard failure to reach the sender of the deferred event");
    } catch (ExecutionException expected) {
      assertSame(boom, expected.getCause());
    }
    assertTrue(machine.isActive("ready"));
    assertEquals(1L, machine.getStatistics().getFailedSteps());

    // 3. and it is not retried by later steps
    assertEquals(InterpreterStep.INCOMPLETE,
        machine.send(Event.of("ping")).get(TIMEOUT, TimeUnit.SECONDS));
    assertEquals(1L, machine.getStatistics().getFailedSteps());
    machine.demolish();
  }

  @Test
  public void testTimerRoundTrip() throws Exception {
    final ManualClock clock = new ManualClock();
    final StatechartBuilder builder = StatechartBuilder.newBuilder("blinker");
    final ModelNode s0 = builder.state("s0");
    final ModelNode s1 = builder.state("s1");
    builder.initial(s0);
    builder.transition(s0, s1).on("e1");
    builder.transition(s1, s0).after(Duration.ofSeconds(2L));

    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("blinker").clock(clock).build())
        .statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);

    for (int round = 0; round < 2; round++) {
      machine.send(Event.of("e1")).get(TIMEOUT, TimeUnit.SECONDS);
      assertEquals(1, machine.state().size());
      assertEquals("s1", machine.state().get(0).getName());
      assertEquals(1, clock.pendingTimers());

      clock.advance(Duration.ofSeconds(2L));
      machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
      assertEquals(1, machine.state().size());
      assertEquals("s0", machine.state().get(0).getName());
      assertEquals(0, clock.pendingTimers());
    }
    machine.demolish();
  }

  @Test
  public void testTerminateResolvesDeferredEvents() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("queue");
    final ModelNode busy = builder.state("busy");
    builder.initial(busy);
    builder.defer(busy, "job");

    final StateMachine machine = StateMachineBuilder.newBuilder().statechart(builder.build()).build();
    machine.start().get(TIMEOUT, TimeUnit.SECONDS);
    final CompletableFuture<InterpreterStep> job = machine.send(Event.of("job"));
    machine.settled().get(TIMEOUT, TimeUnit.SECONDS);
    assertFalse(job.isDone());

    machine.terminate().get(TIMEOUT, TimeUnit.SECONDS);
    assertEquals(InterpreterStep.DEFERRED, job.get(TIMEOUT, TimeUnit.SECONDS));
    machine.demolish();
  }

  private static boolean isActive(final StateMachine machine, final String vertex) {
    try {
      return machine.isActive(vertex);
    } catch (StateMachineException problem) {
      throw new IllegalStateException(problem);
    }
  }

}
