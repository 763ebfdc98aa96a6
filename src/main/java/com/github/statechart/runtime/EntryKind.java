package com.github.statechart.runtime;

/**
 * How a vertex is entered. A state entered by default also enters its regions through their
 * initial pseudostates; an explicitly entered state leaves the regions holding the transition's
 * targets to the rest of the entry path.
 */
enum EntryKind {
  DEFAULT,
  EXPLICIT;
}
