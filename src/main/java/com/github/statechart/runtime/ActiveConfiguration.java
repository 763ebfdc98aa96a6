package com.github.statechart.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.github.statechart.Cancellable;
import com.github.statechart.Event;
import com.github.statechart.structure.CompletionEvent;
import com.github.statechart.structure.Element;
import com.github.statechart.structure.EventDeclaration;
import com.github.statechart.structure.Region;
import com.github.statechart.structure.State;
import com.github.statechart.structure.Transition;
import com.github.statechart.structure.Vertex;

/**
 * Everything a running machine knows about itself: active vertices and regions in entry order,
 * running activities, armed waiters, active completion occurrences and recorded history.
 *
 * Mutated only on the machine's loop. Callers on other threads read it under the read lock.
 */
final class ActiveConfiguration {
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Set<Element> elements = new LinkedHashSet<>();
  private final Map<State, CompletableFuture<Object>> activities = new HashMap<>();
  private final Map<Transition, List<Cancellable>> waiters = new HashMap<>();
  private final Map<CompletionEvent, Event> completions = new LinkedHashMap<>();
  private final Map<Region, State> shallowHistory = new HashMap<>();
  private final Map<Region, List<State>> deepHistory = new HashMap<>();

  ///// active elements /////
  boolean push(final Element element) {
    lock.writeLock().lock();
    try {
      return elements.add(element);
    } finally {
      lock.writeLock().unlock();
    }
  }

  boolean pop(final Element element) {
    lock.writeLock().lock();
    try {
      return elements.remove(element);
    } finally {
      lock.writeLock().unlock();
    }
  }

  boolean contains(final Element element) {
    lock.readLock().lock();
    try {
      return elements.contains(element);
    } finally {
      lock.readLock().unlock();
    }
  }

  boolean containsAll(final Element... candidates) {
    lock.readLock().lock();
    try {
      for (final Element candidate : candidates) {
        if (!elements.contains(candidate)) {
          return false;
        }
      }
      return true;
    } finally {
      lock.readLock().unlock();
    }
  }

  boolean isEmpty() {
    lock.readLock().lock();
    try {
      return elements.isEmpty();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Active vertices of the region, in entry order.
   */
  List<Vertex> activeVerticesIn(final Region region) {
    lock.readLock().lock();
    try {
      final List<Vertex> vertices = new ArrayList<>();
      for (final Element element : elements) {
        if (element instanceof Vertex && ((Vertex) element).getContainer() == region) {
          vertices.add((Vertex) element);
        }
      }
      return vertices;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * The active state of the region, null if only pseudostates or nothing is active in it.
   */
  State activeStateIn(final Region region) {
    for (final Vertex vertex : activeVerticesIn(region)) {
      if (vertex instanceof State) {
        return (State) vertex;
      }
    }
    return null;
  }

  /**
   * Active states below the ancestor, in entry order.
   */
  List<State> activeStatesBelow(final Element ancestor) {
    lock.readLock().lock();
    try {
      final List<State> states = new ArrayList<>();
      for (final Element element : elements) {
        if (element instanceof State && ((State) element).isDescendantOf(ancestor)) {
          states.add((State) element);
        }
      }
      return states;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Active states with no active state below them, in entry order.
   */
  List<State> leafStates() {
    lock.readLock().lock();
    try {
      final List<State> leaves = new ArrayList<>();
      for (final Element element : elements) {
        if (element instanceof State && !hasActiveSubstate((State) element)) {
          leaves.add((State) element);
        }
      }
      return leaves;
    } finally {
      lock.readLock().unlock();
    }
  }

  private boolean hasActiveSubstate(final State state) {
    for (final Element element : elements) {
      if (element instanceof State && ((State) element).getOwnerState() == state) {
        return true;
      }
    }
    return false;
  }

  List<Element> snapshot() {
    lock.readLock().lock();
    try {
      return new ArrayList<>(elements);
    } finally {
      lock.readLock().unlock();
    }
  }

  ///// activities /////
  void putActivity(final State state, final CompletableFuture<Object> activity) {
    activities.put(state, activity);
  }

  CompletableFuture<Object> activityOf(final State state) {
    return activities.get(state);
  }

  CompletableFuture<Object> removeActivity(final State state) {
    return activities.remove(state);
  }

  ///// waiters /////
  void arm(final Transition transition, final List<Cancellable> armed) {
    if (!armed.isEmpty()) {
      waiters.put(transition, armed);
    }
  }

  void disarm(final Transition transition) {
    final List<Cancellable> armed = waiters.remove(transition);
    if (armed != null) {
      for (final Cancellable waiter : armed) {
        waiter.cancel();
      }
    }
  }

  int armedWaiters() {
    return waiters.size();
  }

  ///// completions /////
  void complete(final CompletionEvent completion, final Event occurrence) {
    completions.put(completion, occurrence);
  }

  void consume(final CompletionEvent completion) {
    completions.remove(completion);
  }

  /**
   * Active completion occurrences, in pool order.
   */
  List<Event> activeCompletions(final List<EventDeclaration> pool) {
    if (completions.isEmpty()) {
      return Collections.emptyList();
    }
    final List<Event> active = new ArrayList<>();
    for (final EventDeclaration declaration : pool) {
      final Event occurrence = completions.get(declaration);
      if (occurrence != null) {
        active.add(occurrence);
      }
    }
    return active;
  }

  ///// history /////
  void recordHistory(final Region region) {
    final State shallow = activeStateIn(region);
    if (shallow == null) {
      shallowHistory.remove(region);
      deepHistory.remove(region);
      return;
    }
    shallowHistory.put(region, shallow);
    deepHistory.put(region, activeStatesBelow(region));
  }

  State shallowHistoryOf(final Region region) {
    return shallowHistory.get(region);
  }

  List<State> deepHistoryOf(final Region region) {
    return deepHistory.get(region);
  }

  /**
   * Forget everything, without running any behavior.
   */
  void clear() {
    lock.writeLock().lock();
    try {
      elements.clear();
    } finally {
      lock.writeLock().unlock();
    }
    for (final CompletableFuture<Object> activity : activities.values()) {
      activity.cancel(false);
    }
    activities.clear();
    for (final List<Cancellable> armed : waiters.values()) {
      for (final Cancellable waiter : armed) {
        waiter.cancel();
      }
    }
    waiters.clear();
    completions.clear();
  }

  @Override
  public String toString() {
    return "ActiveConfiguration " + snapshot();
  }
}
