package com.github.statechart.runtime;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import com.github.statechart.Cancellable;
import com.github.statechart.Event;
import com.github.statechart.model.ModelNode;
import com.github.statechart.model.StatechartBuilder;
import com.github.statechart.structure.Region;
import com.github.statechart.structure.State;
import com.github.statechart.structure.Statechart;
import com.github.statechart.structure.Transition;

public class ActiveConfigurationTest {
  private Statechart chart;
  private State outer;
  private State inner;
  private State other;
  private Region top;
  private Region nested;
  private Transition completing;

  @Before
  public void prep() throws Exception {
    final StatechartBuilder builder = StatechartBuilder.newBuilder("config");
    final ModelNode outerNode = builder.state("outer");
    final ModelNode innerNode = builder.state(outerNode, "inner");
    final ModelNode otherNode = builder.state(outerNode, "other");
    builder.initial(outerNode);
    builder.initial(innerNode);
    final ModelNode transition = builder.transition(innerNode, otherNode).node();
    chart = builder.build();
    outer = chart.getElement(outerNode, State.class);
    inner = chart.getElement(innerNode, State.class);
    other = chart.getElement(otherNode, State.class);
    top = chart.getRegions().get(0);
    nested = outer.getRegions().get(0);
    completing = chart.getElement(transition, Transition.class);
  }

  @Test
  public void testActiveElements() {
    final ActiveConfiguration active = new ActiveConfiguration();
    assertTrue(active.isEmpty());
    assertTrue(active.push(top));
    assertTrue(active.push(outer));
    assertTrue(active.push(nested));
    assertTrue(active.push(inner));
    assertFalse(active.push(inner));

    assertTrue(active.containsAll(outer, inner));
    assertSame(outer, active.activeStateIn(top));
    assertSame(inner, active.activeStateIn(nested));
    assertEquals(Arrays.asList(inner), active.activeStatesBelow(outer));
    assertEquals(Arrays.asList(inner), active.leafStates());
    assertEquals(4, active.snapshot().size());

    assertTrue(active.pop(inner));
    assertNull(active.activeStateIn(nested));
    assertEquals(Arrays.asList(outer), active.leafStates());
    active.clear();
    assertTrue(active.isEmpty());
  }

  @Test
  public void testHistory() {
    final ActiveConfiguration active = new ActiveConfiguration();
    active.push(top);
    active.push(outer);
    active.push(nested);
    active.push(other);
    active.recordHistory(nested);
    assertSame(other, active.shallowHistoryOf(nested));
    assertEquals(Arrays.asList(other), active.deepHistoryOf(nested));

    // an empty region forgets what it recorded
    active.pop(other);
    active.recordHistory(nested);
    assertNull(active.shallowHistoryOf(nested));
    assertNull(active.deepHistoryOf(nested));
  }

  @Test
  public void testCompletionsAndWaiters() {
    final ActiveConfiguration active = new ActiveConfiguration();
    final Event occurrence = Event.occurrenceOf(inner.getCompletion(), "done");
    active.complete(inner.getCompletion(), occurrence);
    assertEquals(Collections.singletonList(occurrence), active.activeCompletions(chart.getPool()));
    active.consume(inner.getCompletion());
    assertTrue(active.activeCompletions(chart.getPool()).isEmpty());

    final boolean[] cancelled = new boolean[1];
    final Cancellable waiter = new Cancellable() {
      @Override
      public void cancel() {
        cancelled[0] = true;
      }

      @Override
      public boolean isCancelled() {
        return cancelled[0];
      }
    };
    active.arm(completing, Collections.singletonList(waiter));
    assertEquals(1, active.armedWaiters());
    active.disarm(completing);
    assertTrue(waiter.isCancelled());
    assertEquals(0, active.armedWaiters());
  }

}
