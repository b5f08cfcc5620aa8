package org.replikativ.sorted_tree;

import clojure.lang.*;

/**
 * Clojure seq over tree positions, ascending or descending.
 *
 * Facades hand out seqs over a tree they have shared, so the tree is never
 * edited in place underneath a seq.
 */
@SuppressWarnings("unchecked")
public class Seq extends ASeq {
  final RedBlackTree _tree;
  final int _node;
  final boolean _asc;

  Seq(IPersistentMap meta, RedBlackTree tree, int node, boolean asc) {
    super(meta);
    assert node != Links.NIL;
    _tree = tree;
    _node = node;
    _asc  = asc;
  }

  static Seq create(RedBlackTree tree, boolean asc) {
    int start = asc ? tree._first : tree._last;
    return start == Links.NIL ? null : new Seq(null, tree, start, asc);
  }

  static Object element(RedBlackTree tree, int node) {
    if (tree.hasValues()) {
      return MapEntry.create(tree.key(node), tree.value(node));
    }
    return tree.key(node);
  }

  // ISeq
  public Object first() {
    return element(_tree, _node);
  }

  public ISeq next() {
    int next = _asc ? _tree.successor(_node) : _tree.predecessor(_node);
    return next == Links.NIL ? null : new Seq(meta(), _tree, next, _asc);
  }

  // IObj
  public Seq withMeta(IPersistentMap meta) {
    if (meta() == meta) {
      return this;
    }
    return new Seq(meta, _tree, _node, _asc);
  }
}
