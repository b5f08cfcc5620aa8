package org.replikativ.sorted_tree;

import java.util.*;

/**
 * Position in one particular tree. A NIL node is the end position.
 *
 * An index is only meaningful for the tree that produced it. Ordering two
 * indices of different trees throws, and so does handing an index to a
 * facade that no longer holds its tree (for instance after that facade
 * copied a shared tree). equals and hashCode never throw: indices of
 * different trees are simply unequal.
 */
@SuppressWarnings("unchecked")
public final class Index implements Comparable<Index> {
  public final RedBlackTree _tree;
  public final int _node;

  public Index(RedBlackTree tree, int node) {
    _tree = tree;
    _node = node;
  }

  public boolean isEnd() {
    return _node == Links.NIL;
  }

  public boolean belongsTo(RedBlackTree tree) {
    return _tree == tree;
  }

  public void checkTree(RedBlackTree tree) {
    if (_tree != tree) {
      throw new IllegalArgumentException("Index " + this + " was not produced by this tree");
    }
  }

  @Override
  public int compareTo(Index other) {
    other.checkTree(_tree);
    return _tree.compareNodes(_node, other._node);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Index)) return false;
    Index other = (Index) o;
    return _tree == other._tree && _node == other._node;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(_tree) + _node;
  }

  @Override
  public String toString() {
    return isEnd() ? "Index{end}" : "Index{" + _node + "}";
  }
}
