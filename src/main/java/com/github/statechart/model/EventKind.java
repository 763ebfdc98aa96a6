package com.github.statechart.model;

/**
 * Kinds of declared events a transition can be triggered by.
 */
public enum EventKind {
  // an event sent by callers, matched by type and optionally by name
  SIGNAL,
  // matches every dispatched event
  ANY,
  // fired when a wrapped operation is invoked through the machine
  CALL,
  // fired after a relative delay or at an absolute instant
  TIME,
  // fired once a predicate turns true
  CHANGE,
  // fired once a state's activity and its nested activities finished
  COMPLETION;
}
