package com.github.statechart;

/**
 * Outcome of offering one event to the active configuration of a machine.
 */
public enum InterpreterStep {
  // a transition fired
  COMPLETE,
  // no enabled transition matched the event, it is dropped
  INCOMPLETE,
  // an active state defers the event, it is offered again during the next step
  DEFERRED;
}
