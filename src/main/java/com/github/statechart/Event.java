package com.github.statechart;

import com.github.statechart.structure.EventDeclaration;

/**
 * An event occurrence dispatched to a state machine.
 *
 * Events compare by identity: two occurrences with the same name are two different events and each
 * one resolves its own send future. Signal events may be modelled either by name ({@link #of}) or
 * by sub-classing this type. Occurrences synthesized by the runtime for time, change, call and
 * completion events carry the declaration that produced them, see {@link #getOrigin()}.
 */
public class Event {
  private final String name;
  private final Object payload;
  private final EventDeclaration origin;

  /**
   * The event is named after its concrete class.
   */
  protected Event() {
    this(null, null, null);
  }

  public Event(final String name) {
    this(name, null, null);
  }

  public Event(final String name, final Object payload) {
    this(name, payload, null);
  }

  private Event(final String name, final Object payload, final EventDeclaration origin) {
    this.name = name != null ? name : getClass().getSimpleName();
    this.payload = payload;
    this.origin = origin;
  }

  public static Event of(final String name) {
    return new Event(name);
  }

  public static Event of(final String name, final Object payload) {
    return new Event(name, payload);
  }

  /**
   * Creates an occurrence of a runtime declared event, eg. a timeout or a completion.
   */
  public static Event occurrenceOf(final EventDeclaration origin, final Object payload) {
    return new Event(origin.getName(), payload, origin);
  }

  public String getName() {
    return name;
  }

  public Object getPayload() {
    return payload;
  }

  /**
   * The declaration that synthesized this occurrence, null for events sent by callers.
   */
  public EventDeclaration getOrigin() {
    return origin;
  }

  @Override
  public String toString() {
    return "Event [name=" + name + ", payload=" + payload + "]";
  }
}
