package org.replikativ.sorted_tree;

import java.util.*;
import java.util.function.*;
import clojure.lang.*;

import static org.replikativ.sorted_tree.Links.NIL;

/**
 * Sorted set with value semantics.
 *
 * <p>{@link #copy()} is O(1): the copy shares the tree until either side
 * mutates. Set algebra between two sets ordered by the same comparator is a
 * linear merge walk; the {@code Iterable} overloads probe element by element.
 *
 * <p>Time costs: {@code contains}, {@code insert}, {@code remove},
 * {@code lowerBound} and {@code upperBound} take O(log n). Hinted insert and
 * find take O(1) amortized when the hint is adjacent to the key.
 * {@code union}, {@code intersection}, {@code symmetricDifference},
 * {@code subtract} and the subset tests take O(m + n) for another
 * {@code CowSortedSet}, O(m log n) for any other {@code Iterable}.
 */
@SuppressWarnings("unchecked")
public class CowSortedSet<Key> extends ACowCollection<Key, Void, Key> implements Comparable<CowSortedSet<Key>> {

  public CowSortedSet() {
    this((Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  public CowSortedSet(Comparator<Key> cmp) {
    this(cmp, Settings.DEFAULT);
  }

  public CowSortedSet(Comparator<Key> cmp, Settings settings) {
    super(new RedBlackTree<>(cmp, settings, false));
  }

  protected CowSortedSet(RedBlackTree<Key, Void> tree) {
    super(tree);
  }

  @SafeVarargs
  public static <Key> CowSortedSet<Key> of(Key... keys) {
    return from(Arrays.asList(keys));
  }

  // Of equal keys, the first one wins
  public static <Key> CowSortedSet<Key> from(Iterable<? extends Key> keys) {
    return from(keys, (Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  public static <Key> CowSortedSet<Key> from(Iterable<? extends Key> keys, Comparator<Key> cmp) {
    CowSortedSet<Key> set = new CowSortedSet<>(cmp);
    for (Key key: keys) {
      set._tree.insert(key, null);
    }
    return set;
  }

  /**
   * A second set holding the same tree. Neither set sees the other's later
   * changes.
   */
  public CowSortedSet<Key> copy() {
    return new CowSortedSet<>(sharedTree());
  }

  @Override
  protected Key element(RedBlackTree<Key, Void> tree, int node) {
    return tree.key(node);
  }

  public boolean contains(Key key) {
    return _tree.find(key) != NIL;
  }

  // Insertion

  public Inserted<Key> insert(Key key) {
    ensureUnique();
    return inserted(_tree.insert(key, null));
  }

  public Inserted<Key> insert(Key key, Index hint) {
    int node = ensureUnique(hint);
    return inserted(_tree.insert(key, null, node));
  }

  private Inserted<Key> inserted(int result) {
    int node = RedBlackTree.position(result);
    return new Inserted<>(RedBlackTree.inserted(result), _tree.key(node), index(node));
  }

  /**
   * Inserts key, replacing an equal member if there is one.
   *
   * @return the replaced member, empty if key was not present
   */
  public Optional<Key> update(Key key) {
    ensureUnique();
    return replaced(_tree.insert(key, null), key);
  }

  public Optional<Key> update(Key key, Index hint) {
    int node = ensureUnique(hint);
    return replaced(_tree.insert(key, null, node), key);
  }

  private Optional<Key> replaced(int result, Key key) {
    if (RedBlackTree.inserted(result)) {
      return Optional.empty();
    }
    int node = RedBlackTree.position(result);
    Key old = _tree.key(node);
    _tree.setKey(node, key);
    return Optional.of(old);
  }

  // Removal

  // Returns the stored member equal to key
  public Optional<Key> remove(Key key) {
    if (_tree.find(key) == NIL) {
      return Optional.empty();
    }
    ensureUnique();
    return Optional.of(_tree.delete(key));
  }

  public CowSortedSet<Key> filter(Predicate<? super Key> pred) {
    RedBlackTree<Key, Void> result = emptyTree();
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      if (pred.test(_tree.key(x))) {
        result.insertLargest(_tree.key(x), null);
      }
    }
    return new CowSortedSet<>(result);
  }

  // Set algebra, merge walks

  public CowSortedSet<Key> union(CowSortedSet<Key> other) {
    CowSortedSet<Key> result = copy();
    result.formUnion(other);
    return result;
  }

  public void formUnion(CowSortedSet<Key> other) {
    if (other._tree == _tree) return;
    if (!sameOrder(other)) {
      formUnion((Iterable<Key>) other);
      return;
    }
    ensureUnique();
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    while (x != NIL && y != NIL) {
      int d = t.compare(t.key(x), o.key(y));
      if (d < 0) {
        x = t.successor(x);
      } else if (d > 0) {
        // everything before x is already < y, so y goes right before x
        t.insert(o.key(y), null, x);
        y = o.successor(y);
      } else {
        x = t.successor(x);
        y = o.successor(y);
      }
    }
    for (; y != NIL; y = o.successor(y)) {
      t.insertLargest(o.key(y), null);
    }
  }

  public CowSortedSet<Key> intersection(CowSortedSet<Key> other) {
    if (other._tree == _tree) return copy();
    if (!sameOrder(other)) return intersection((Iterable<Key>) other);
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    RedBlackTree<Key, Void> result = emptyTree();
    int x = t._first, y = o._first;
    while (x != NIL && y != NIL) {
      int d = t.compare(t.key(x), o.key(y));
      if (d < 0) {
        x = t.successor(x);
      } else if (d > 0) {
        y = o.successor(y);
      } else {
        result.insertLargest(t.key(x), null);
        x = t.successor(x);
        y = o.successor(y);
      }
    }
    return new CowSortedSet<>(result);
  }

  public void formIntersection(CowSortedSet<Key> other) {
    if (other._tree == _tree) return;
    CowSortedSet<Key> result = intersection(other);
    if (result.count() != count()) {
      replaceTree(result._tree);
    }
  }

  public CowSortedSet<Key> symmetricDifference(CowSortedSet<Key> other) {
    if (other._tree == _tree) return new CowSortedSet<>(emptyTree());
    if (!sameOrder(other)) return symmetricDifference((Iterable<Key>) other);
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    RedBlackTree<Key, Void> result = emptyTree();
    int x = t._first, y = o._first;
    while (x != NIL && y != NIL) {
      int d = t.compare(t.key(x), o.key(y));
      if (d < 0) {
        result.insertLargest(t.key(x), null);
        x = t.successor(x);
      } else if (d > 0) {
        result.insertLargest(o.key(y), null);
        y = o.successor(y);
      } else {
        x = t.successor(x);
        y = o.successor(y);
      }
    }
    for (; x != NIL; x = t.successor(x)) {
      result.insertLargest(t.key(x), null);
    }
    for (; y != NIL; y = o.successor(y)) {
      result.insertLargest(o.key(y), null);
    }
    return new CowSortedSet<>(result);
  }

  public void formSymmetricDifference(CowSortedSet<Key> other) {
    replaceTree(symmetricDifference(other)._tree);
  }

  public CowSortedSet<Key> subtracting(CowSortedSet<Key> other) {
    CowSortedSet<Key> result = copy();
    result.subtract(other);
    return result;
  }

  public void subtract(CowSortedSet<Key> other) {
    if (other._tree == _tree) {
      clear();
      return;
    }
    if (!sameOrder(other)) {
      subtract((Iterable<Key>) other);
      return;
    }
    ensureUnique();
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    while (x != NIL && y != NIL) {
      int d = t.compare(t.key(x), o.key(y));
      if (d < 0) {
        x = t.successor(x);
      } else if (d > 0) {
        y = o.successor(y);
      } else {
        // x's handle dies with it, its successor's does not
        int next = t.successor(x);
        y = o.successor(y);
        t.deleteAt(x);
        x = next;
      }
    }
  }

  public boolean isDisjoint(CowSortedSet<Key> other) {
    if (other._tree == _tree) return isEmpty();
    if (!sameOrder(other)) return isDisjoint((Iterable<Key>) other);
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    while (x != NIL && y != NIL) {
      int d = t.compare(t.key(x), o.key(y));
      if (d < 0) {
        x = t.successor(x);
      } else if (d > 0) {
        y = o.successor(y);
      } else {
        return false;
      }
    }
    return true;
  }

  public boolean isSuperset(CowSortedSet<Key> other) {
    return includes(other);
  }

  public boolean isSubset(CowSortedSet<Key> other) {
    return other.includes(this);
  }

  public boolean isStrictSuperset(CowSortedSet<Key> other) {
    return count() > other.count() && includes(other);
  }

  public boolean isStrictSubset(CowSortedSet<Key> other) {
    return other.count() > count() && other.includes(this);
  }

  boolean includes(CowSortedSet<Key> other) {
    if (other._tree == _tree) return true;
    if (count() < other.count()) return false;
    if (!sameOrder(other)) return isSuperset((Iterable<Key>) other);
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    while (y != NIL) {
      if (x == NIL) return false;
      int d = t.compare(t.key(x), o.key(y));
      if (d > 0) return false;
      if (d == 0) y = o.successor(y);
      x = t.successor(x);
    }
    return true;
  }

  // Set algebra, arbitrary sequences

  public CowSortedSet<Key> union(Iterable<? extends Key> other) {
    CowSortedSet<Key> result = copy();
    result.formUnion(other);
    return result;
  }

  public void formUnion(Iterable<? extends Key> other) {
    ensureUnique();
    for (Key key: other) {
      _tree.insert(key, null);
    }
  }

  public CowSortedSet<Key> intersection(Iterable<? extends Key> other) {
    RedBlackTree<Key, Void> result = emptyTree();
    for (Key key: other) {
      int x = _tree.find(key);
      if (x != NIL) {
        result.insert(_tree.key(x), null);
      }
    }
    return new CowSortedSet<>(result);
  }

  public void formIntersection(Iterable<? extends Key> other) {
    CowSortedSet<Key> result = intersection(other);
    if (result.count() != count()) {
      replaceTree(result._tree);
    }
  }

  // Duplicates in other count once
  public CowSortedSet<Key> symmetricDifference(Iterable<? extends Key> other) {
    return symmetricDifference(from(other, comparator()));
  }

  public void formSymmetricDifference(Iterable<? extends Key> other) {
    formSymmetricDifference(from(other, comparator()));
  }

  public CowSortedSet<Key> subtracting(Iterable<? extends Key> other) {
    CowSortedSet<Key> result = copy();
    result.subtract(other);
    return result;
  }

  public void subtract(Iterable<? extends Key> other) {
    ensureUnique();
    for (Key key: other) {
      _tree.delete(key);
    }
  }

  public boolean isDisjoint(Iterable<? extends Key> other) {
    for (Key key: other) {
      if (contains(key)) return false;
    }
    return true;
  }

  public boolean isSuperset(Iterable<? extends Key> other) {
    for (Key key: other) {
      if (!contains(key)) return false;
    }
    return true;
  }

  public boolean isSubset(Iterable<? extends Key> other) {
    return isSubset(from(other, comparator()));
  }

  public boolean isStrictSuperset(Iterable<? extends Key> other) {
    return isStrictSuperset(from(other, comparator()));
  }

  public boolean isStrictSubset(Iterable<? extends Key> other) {
    return isStrictSubset(from(other, comparator()));
  }

  // Flattening

  public List<Object> flatten() {
    List<Object> flat = new ArrayList<>(count());
    for (Key key: this) {
      flat.add(key);
    }
    return flat;
  }

  public static <Key> CowSortedSet<Key> unflatten(Iterable<?> flat) throws DecodeException {
    return unflatten(flat, (Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  /**
   * Rebuilds a set from {@link #flatten()} output. The elements must be in
   * strictly ascending order under cmp.
   */
  public static <Key> CowSortedSet<Key> unflatten(Iterable<?> flat, Comparator<Key> cmp) throws DecodeException {
    RedBlackTree<Key, Void> tree = new RedBlackTree<>(cmp, Settings.DEFAULT, false);
    int position = 0;
    for (Object element: flat) {
      Key key;
      try {
        key = (Key) element;
        if (tree._last != NIL && cmp.compare(tree.key(tree._last), key) >= 0) {
          throw new DecodeException(position, "Element " + key + " is out of order or duplicated");
        }
      } catch (ClassCastException e) {
        throw new DecodeException(position, "Element " + element + " cannot be compared", e);
      }
      tree.insertLargest(key, null);
      position += 1;
    }
    return new CowSortedSet<>(tree);
  }

  // Equality and ordering

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CowSortedSet)) return false;
    CowSortedSet<?> other = (CowSortedSet<?>) o;
    if (other._tree == _tree) return true;
    if (other.count() != count()) return false;
    Iterator<?> it = other.iterator();
    for (Key key: this) {
      if (!Objects.equals(key, it.next())) return false;
    }
    return true;
  }

  // Lexicographic over the ascending elements
  @Override
  public int compareTo(CowSortedSet<Key> other) {
    if (other._tree == _tree) return 0;
    RedBlackTree<Key, Void> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    for (; x != NIL && y != NIL; x = t.successor(x), y = o.successor(y)) {
      int d = t.compare(t.key(x), o.key(y));
      if (d != 0) return d;
    }
    return Integer.compare(t._count, o._count);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("#{");
    for (Key key: this) {
      sb.append(key).append(" ");
    }
    if (sb.charAt(sb.length() - 1) == ' ') {
      sb.delete(sb.length() - 1, sb.length());
    }
    sb.append("}");
    return sb.toString();
  }
}
