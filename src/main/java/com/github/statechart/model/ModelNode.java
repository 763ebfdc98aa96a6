package com.github.statechart.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the authoring graph. Nodes never hold object pointers to each other: the owner, the
 * owned children and every named reference are stable integer ids into the owning
 * {@link ModelGraph}.
 */
public final class ModelNode {
  // attribute names
  public static final String PSEUDOSTATE_KIND = "pseudostateKind";
  public static final String EVENT_KIND = "eventKind";
  public static final String EVENT_TYPE = "eventType";
  public static final String SIGNAL = "signal";
  public static final String DELAY = "delay";
  public static final String DEADLINE = "deadline";
  public static final String EXPRESSION = "expression";
  public static final String OPERATION = "operation";
  public static final String BEHAVIOR = "behavior";
  public static final String CONDITION = "condition";
  public static final String DEFERRED = "deferred";

  // reference names
  public static final String SOURCE = "source";
  public static final String TARGET = "target";
  public static final String INITIAL = "initial";
  public static final String SUBMACHINE = "submachine";
  public static final String TRIGGER = "trigger.";

  public static final int NO_OWNER = -1;

  private final int id;
  private final NodeKind kind;
  private final String name;
  private final int ownerId;
  private final List<Integer> childIds = new ArrayList<>();
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private final Map<String, Integer> references = new LinkedHashMap<>();

  ModelNode(final int id, final NodeKind kind, final String name, final int ownerId) {
    this.id = id;
    this.kind = kind;
    this.name = name;
    this.ownerId = ownerId;
  }

  public int getId() {
    return id;
  }

  public NodeKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public int getOwnerId() {
    return ownerId;
  }

  public boolean isRoot() {
    return ownerId == NO_OWNER;
  }

  public List<Integer> getChildIds() {
    return Collections.unmodifiableList(childIds);
  }

  void addChild(final int childId) {
    childIds.add(childId);
  }

  public ModelNode setAttribute(final String attribute, final Object value) {
    attributes.put(attribute, value);
    return this;
  }

  public Object getAttribute(final String attribute) {
    return attributes.get(attribute);
  }

  public <T> T getAttribute(final String attribute, final Class<T> type) {
    final Object value = attributes.get(attribute);
    return value == null ? null : type.cast(value);
  }

  public ModelNode setReference(final String reference, final ModelNode target) {
    references.put(reference, target.getId());
    return this;
  }

  /**
   * Id of the referenced node or null if the reference is not set.
   */
  public Integer getReference(final String reference) {
    return references.get(reference);
  }

  public Map<String, Integer> getReferences() {
    return Collections.unmodifiableMap(references);
  }

  @Override
  public String toString() {
    return "ModelNode [id=" + id + ", kind=" + kind + ", name=" + name + ", ownerId=" + ownerId
        + "]";
  }
}
