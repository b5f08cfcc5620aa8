package org.replikativ.sorted_tree;

import java.util.*;
import clojure.lang.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.replikativ.sorted_tree.Links.NIL;

/**
 * Copy-on-write handle on a {@link RedBlackTree}.
 *
 * Several facades may hold the same tree. {@code copy()} only bumps the
 * tree's owner count; the first mutation through a facade whose tree is
 * shared deep-copies it, and indices passed to that same call are moved
 * over to the copy. Indices the caller kept from before the copy are not
 * moved: they keep pointing into the old tree and this facade rejects them.
 */
@SuppressWarnings("unchecked")
public abstract class ACowCollection<Key, Value, Element> implements Iterable<Element>, Seqable, Reversible, Counted, IHashEq {
  private static final Logger log = LoggerFactory.getLogger(ACowCollection.class);

  public RedBlackTree<Key, Value> _tree;

  protected ACowCollection(RedBlackTree<Key, Value> tree) {
    _tree = tree;
  }

  protected abstract Element element(RedBlackTree<Key, Value> tree, int node);

  public Comparator<Key> comparator() {
    return _tree._cmp;
  }

  public Settings settings() {
    return _tree._settings;
  }

  // Copy-on-write

  protected RedBlackTree<Key, Value> sharedTree() {
    if (_tree._settings.copyPolicy() == CopyPolicy.EAGER) {
      return _tree.copy();
    }
    return _tree.share();
  }

  protected boolean ensureUnique() {
    if (!_tree.isShared()) {
      return false;
    }
    log.debug("Tree has {} owners, copying before mutation", _tree._owners);
    replaceTree(_tree.copy());
    return true;
  }

  // Returns position's node in the tree this facade will mutate
  protected int ensureUnique(Index position) {
    checkIndex(position);
    RedBlackTree<Key, Value> before = _tree;
    if (!ensureUnique()) {
      return position._node;
    }
    int node = _tree.equivalentOf(position._node, before);
    log.debug("Re-targeted {} to node {} of the copy", position, node);
    return node;
  }

  protected void replaceTree(RedBlackTree<Key, Value> tree) {
    _tree.unshare();
    _tree = tree;
  }

  protected RedBlackTree<Key, Value> emptyTree() {
    return new RedBlackTree<>(_tree._cmp, _tree._settings, _tree.hasValues());
  }

  protected boolean sameOrder(ACowCollection<Key, ?, ?> other) {
    return _tree._cmp == other._tree._cmp || _tree._cmp.equals(other._tree._cmp);
  }

  // Indices

  protected void checkIndex(Index position) {
    position.checkTree(_tree);
  }

  protected int checkNode(Index position) {
    checkIndex(position);
    if (position.isEnd()) {
      throw new NoSuchElementException("End position has no element");
    }
    return position._node;
  }

  protected Index index(int node) {
    return new Index(_tree, node);
  }

  public Index startIndex() {
    return index(_tree._first);
  }

  public Index endIndex() {
    return index(NIL);
  }

  public Index indexAfter(Index position) {
    return index(_tree.successor(checkNode(position)));
  }

  public Index indexBefore(Index position) {
    checkIndex(position);
    if (position._node == _tree._first) {
      throw new NoSuchElementException("No position before the start");
    }
    return index(_tree.before(position._node));
  }

  public Element at(Index position) {
    return element(_tree, checkNode(position));
  }

  public Index lowerBound(Key key) {
    return index(_tree.lowerBound(key));
  }

  public Index upperBound(Key key) {
    return index(_tree.upperBound(key));
  }

  public Optional<Index> find(Key key) {
    int node = _tree.find(key);
    return node == NIL ? Optional.empty() : Optional.of(index(node));
  }

  public Optional<Index> find(Key key, Index hint) {
    checkIndex(hint);
    int node = _tree.find(key, hint._node);
    return node == NIL ? Optional.empty() : Optional.of(index(node));
  }

  // Counted
  public int count() {
    return _tree._count;
  }

  public boolean isEmpty() {
    return _tree._count == 0;
  }

  public Optional<Element> first() {
    return _tree._first == NIL ? Optional.empty() : Optional.of(element(_tree, _tree._first));
  }

  public Optional<Element> last() {
    return _tree._last == NIL ? Optional.empty() : Optional.of(element(_tree, _tree._last));
  }

  // Removal

  public Element remove(Index position) {
    checkNode(position);
    int node = ensureUnique(position);
    Element element = element(_tree, node);
    _tree.deleteAt(node);
    return element;
  }

  public Element removeFirst() {
    if (isEmpty()) {
      throw new NoSuchElementException("removeFirst on an empty collection");
    }
    return remove(startIndex());
  }

  public Element removeLast() {
    if (isEmpty()) {
      throw new NoSuchElementException("removeLast on an empty collection");
    }
    return remove(index(_tree._last));
  }

  public Optional<Element> pollFirst() {
    return isEmpty() ? Optional.empty() : Optional.of(remove(startIndex()));
  }

  public Optional<Element> pollLast() {
    return isEmpty() ? Optional.empty() : Optional.of(remove(index(_tree._last)));
  }

  public void clear() {
    replaceTree(emptyTree());
  }

  // Iterable
  public Iterator<Element> iterator() {
    return new TreeIterator(true);
  }

  public Iterator<Element> descendingIterator() {
    return new TreeIterator(false);
  }

  class TreeIterator implements Iterator<Element> {
    final RedBlackTree<Key, Value> _iterTree = _tree;
    final int _version = _tree._version;
    final boolean _asc;
    int _next;

    TreeIterator(boolean asc) {
      _asc  = asc;
      _next = asc ? _iterTree._first : _iterTree._last;
    }

    public boolean hasNext() {
      return _next != NIL;
    }

    public Element next() {
      if (_iterTree._version != _version) {
        throw new ConcurrentModificationException();
      }
      if (_next == NIL) {
        throw new NoSuchElementException();
      }
      Element element = element(_iterTree, _next);
      _next = _asc ? _iterTree.successor(_next) : _iterTree.predecessor(_next);
      return element;
    }
  }

  // Seqable
  public ISeq seq() {
    if (isEmpty()) return null;
    return Seq.create(_tree.share(), true);
  }

  // Reversible
  public ISeq rseq() {
    if (isEmpty()) return null;
    return Seq.create(_tree.share(), false);
  }

  // IHashEq, matching Clojure's equiv rather than equals
  public int hasheq() {
    return Murmur3.hashOrdered(this);
  }

  // java.util.List rule over the ascending elements, matching equals
  @Override
  public int hashCode() {
    int hash = 1;
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      hash = 31 * hash + Objects.hashCode(_tree.key(x));
      if (_tree.hasValues()) {
        hash = 31 * hash + Objects.hashCode(_tree.value(x));
      }
    }
    return hash;
  }

  public void checkInvariants() {
    _tree.checkInvariants();
  }

  public abstract List<Object> flatten();
}
