package com.github.statechart.structure;

import com.github.statechart.model.NodeKind;

/**
 * Base of every compiled element. Ids are the ids of the model nodes the elements were compiled
 * from; elements synthesized by the compiler get ids past the end of the graph. Elements compare by
 * identity.
 */
public abstract class Element {
  private final int id;
  private final String name;
  private final String qualifiedName;
  private final NodeKind kind;

  protected Element(final int id, final String name, final String qualifiedName,
      final NodeKind kind) {
    this.id = id;
    this.name = name;
    this.qualifiedName = qualifiedName;
    this.kind = kind;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getQualifiedName() {
    return qualifiedName;
  }

  public NodeKind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [" + qualifiedName + "]";
  }
}
