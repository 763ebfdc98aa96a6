package com.github.statechart.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Arena of {@link ModelNode}s. Node ids are their insertion index, so ids are stable and dense.
 * Nodes are only ever added, never removed or re-parented, which keeps ownership a tree.
 *
 * Not thread-safe, a graph is meant to be authored on one thread and then compiled.
 */
public final class ModelGraph {
  private final List<ModelNode> nodes = new ArrayList<>();

  /**
   * Add a node owned by the given owner, or a root node if the owner is null.
   */
  public ModelNode add(final NodeKind kind, final String name, final ModelNode owner) {
    if (kind == null) {
      throw new IllegalArgumentException("Node kind cannot be null");
    }
    if (owner != null && get(owner.getId()) != owner) {
      throw new IllegalArgumentException("Owner " + owner + " does not belong to this graph");
    }
    final ModelNode node =
        new ModelNode(nodes.size(), kind, name, owner == null ? ModelNode.NO_OWNER : owner.getId());
    nodes.add(node);
    if (owner != null) {
      owner.addChild(node.getId());
    }
    return node;
  }

  public ModelNode get(final int id) {
    if (id < 0 || id >= nodes.size()) {
      throw new IllegalArgumentException("No node with id " + id);
    }
    return nodes.get(id);
  }

  public int size() {
    return nodes.size();
  }

  public List<ModelNode> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<ModelNode> roots() {
    final List<ModelNode> roots = new ArrayList<>();
    for (final ModelNode node : nodes) {
      if (node.isRoot()) {
        roots.add(node);
      }
    }
    return roots;
  }

  /**
   * Owner of the node, null for roots.
   */
  public ModelNode ownerOf(final ModelNode node) {
    return node.isRoot() ? null : get(node.getOwnerId());
  }

  public List<ModelNode> childrenOf(final ModelNode node) {
    final List<ModelNode> children = new ArrayList<>();
    for (final int childId : node.getChildIds()) {
      children.add(get(childId));
    }
    return children;
  }

  public List<ModelNode> childrenOf(final ModelNode node, final NodeKind kind) {
    final List<ModelNode> children = new ArrayList<>();
    for (final int childId : node.getChildIds()) {
      final ModelNode child = get(childId);
      if (child.getKind() == kind) {
        children.add(child);
      }
    }
    return children;
  }

  public Optional<ModelNode> findChild(final ModelNode node, final NodeKind kind,
      final String name) {
    for (final ModelNode child : childrenOf(node, kind)) {
      if (name == null ? child.getName() == null : name.equals(child.getName())) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  /**
   * Depth-first, pre-order search below the given node, children visited in insertion order.
   */
  public List<ModelNode> findDescendants(final ModelNode node, final Predicate<ModelNode> filter) {
    final List<ModelNode> found = new ArrayList<>();
    final Deque<ModelNode> stack = new ArrayDeque<>();
    pushChildren(node, stack);
    while (!stack.isEmpty()) {
      final ModelNode current = stack.pop();
      if (filter.test(current)) {
        found.add(current);
      }
      pushChildren(current, stack);
    }
    return found;
  }

  private void pushChildren(final ModelNode node, final Deque<ModelNode> stack) {
    final List<Integer> childIds = node.getChildIds();
    for (int iter = childIds.size() - 1; iter >= 0; iter--) {
      stack.push(get(childIds.get(iter)));
    }
  }

  /**
   * Nearest strict ancestor matching the filter.
   */
  public Optional<ModelNode> findAncestor(final ModelNode node, final Predicate<ModelNode> filter) {
    ModelNode current = ownerOf(node);
    while (current != null) {
      if (filter.test(current)) {
        return Optional.of(current);
      }
      current = ownerOf(current);
    }
    return Optional.empty();
  }

  public boolean isDescendantOf(final ModelNode node, final ModelNode ancestor) {
    return findAncestor(node, candidate -> candidate == ancestor).isPresent();
  }

  /**
   * Node named by the reference, null if the reference is not set.
   */
  public ModelNode resolve(final ModelNode node, final String reference) {
    final Integer id = node.getReference(reference);
    return id == null ? null : get(id);
  }

  /**
   * All nodes referenced under names starting with the prefix, in the order they were set.
   */
  public List<ModelNode> resolveAll(final ModelNode node, final String prefix) {
    final List<ModelNode> resolved = new ArrayList<>();
    for (final Map.Entry<String, Integer> reference : node.getReferences().entrySet()) {
      if (reference.getKey().startsWith(prefix)) {
        resolved.add(get(reference.getValue()));
      }
    }
    return resolved;
  }

  /**
   * Dot separated names from the root down to the node, eg. {@code machine.parent.child}.
   */
  public String qualifiedNameOf(final ModelNode node) {
    final Deque<String> names = new ArrayDeque<>();
    ModelNode current = node;
    while (current != null) {
      names.push(current.getName() != null ? current.getName() : "#" + current.getId());
      current = ownerOf(current);
    }
    return String.join(".", names);
  }

  @Override
  public String toString() {
    return "ModelGraph [nodes=" + nodes.size() + ", roots=" + roots().size() + "]";
  }
}
