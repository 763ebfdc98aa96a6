package com.github.statechart.structure;

public enum TransitionKind {
  // no target, neither exits nor enters
  INTERNAL,
  // target nested in the source, the source is not exited
  LOCAL,
  // leaves the source up to the least common ancestor region
  EXTERNAL,
  // exits and re-enters the source
  SELF;
}
