package com.github.statechart.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.statechart.Behavior;
import com.github.statechart.Event;
import com.github.statechart.model.NodeKind;

/**
 * A simple, composite (one region), orthogonal (several regions) or submachine state.
 */
public final class State extends Vertex {
  private final List<Region> regions = new ArrayList<>();
  private final List<EventDeclaration> deferred = new ArrayList<>();
  private Behavior entry = Behavior.noop();
  private Behavior exit = Behavior.noop();
  private Behavior activity = Behavior.noop();
  private CompletionEvent completion;
  private Statechart submachine;

  State(final int id, final String name, final String qualifiedName) {
    super(id, name, qualifiedName, NodeKind.STATE);
  }

  public List<Region> getRegions() {
    return Collections.unmodifiableList(regions);
  }

  /**
   * Own regions, or the regions of the submachine for a submachine state.
   */
  public List<Region> getChildRegions() {
    return submachine != null ? submachine.getRegions() : getRegions();
  }

  public boolean isComposite() {
    return !getChildRegions().isEmpty();
  }

  public boolean isOrthogonal() {
    return getChildRegions().size() > 1;
  }

  public boolean isSubmachineState() {
    return submachine != null;
  }

  public Statechart getSubmachine() {
    return submachine;
  }

  public Behavior getEntry() {
    return entry;
  }

  public Behavior getExit() {
    return exit;
  }

  public Behavior getActivity() {
    return activity;
  }

  /**
   * Null until a transition out of this state without triggers asked for it.
   */
  public CompletionEvent getCompletion() {
    return completion;
  }

  public List<EventDeclaration> getDeferred() {
    return Collections.unmodifiableList(deferred);
  }

  public boolean defers(final Event event) {
    for (final EventDeclaration declaration : deferred) {
      if (declaration.matches(event)) {
        return true;
      }
    }
    return false;
  }

  void addRegion(final Region region) {
    regions.add(region);
  }

  void addDeferred(final EventDeclaration declaration) {
    deferred.add(declaration);
  }

  void setEntry(final Behavior entry) {
    this.entry = entry;
  }

  void setExit(final Behavior exit) {
    this.exit = exit;
  }

  void setActivity(final Behavior activity) {
    this.activity = activity;
  }

  void setCompletion(final CompletionEvent completion) {
    this.completion = completion;
  }

  void setSubmachine(final Statechart submachine) {
    this.submachine = submachine;
  }
}
