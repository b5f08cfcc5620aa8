package org.replikativ.sorted_tree;

import java.util.*;
import java.util.function.*;
import clojure.lang.*;

import static org.replikativ.sorted_tree.Links.NIL;

/**
 * Sorted map with value semantics. Iterates {@link Map.Entry} pairs in key
 * order; the entries are immutable {@link MapEntry} instances.
 *
 * <p>Values may not be null, so {@code Optional.empty()} always means "no
 * entry". Updating through a function follows the same rule: a function
 * returning {@code Optional.empty()} removes the entry.
 *
 * <p>Like {@link CowSortedSet}, {@link #copy()} is O(1) and the copy stays
 * independent of this map.
 */
@SuppressWarnings("unchecked")
public class CowSortedMap<Key, Value> extends ACowCollection<Key, Value, Map.Entry<Key, Value>> implements Comparable<CowSortedMap<Key, Value>> {

  public CowSortedMap() {
    this((Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  public CowSortedMap(Comparator<Key> cmp) {
    this(cmp, Settings.DEFAULT);
  }

  public CowSortedMap(Comparator<Key> cmp, Settings settings) {
    super(new RedBlackTree<>(cmp, settings, true));
  }

  protected CowSortedMap(RedBlackTree<Key, Value> tree) {
    super(tree);
  }

  // Construction

  /**
   * @throws IllegalArgumentException if two entries have equal keys
   */
  public static <Key, Value> CowSortedMap<Key, Value> uniqueKeys(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries) {
    return uniqueKeys(entries, (Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  public static <Key, Value> CowSortedMap<Key, Value> uniqueKeys(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, Comparator<Key> cmp) {
    CowSortedMap<Key, Value> map = new CowSortedMap<>(cmp);
    for (Map.Entry<? extends Key, ? extends Value> e: entries) {
      int result = map._tree.insert(e.getKey(), checkValue(e.getValue()));
      if (!RedBlackTree.inserted(result)) {
        throw new IllegalArgumentException("Duplicate key: " + e.getKey());
      }
    }
    return map;
  }

  public static <Key, Value> CowSortedMap<Key, Value> from(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, BinaryOperator<Value> combine) {
    return from(entries, combine, (Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  public static <Key, Value> CowSortedMap<Key, Value> from(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, BinaryOperator<Value> combine, Comparator<Key> cmp) {
    CowSortedMap<Key, Value> map = new CowSortedMap<>(cmp);
    map.merge(entries, combine);
    return map;
  }

  public static <Key, Value> CowSortedMap<Key, Value> from(Map<? extends Key, ? extends Value> source) {
    CowSortedMap<Key, Value> map = new CowSortedMap<>();
    for (Map.Entry<? extends Key, ? extends Value> e: source.entrySet()) {
      map._tree.insert(e.getKey(), checkValue(e.getValue()));
    }
    return map;
  }

  /**
   * Buckets values by keyFn. Each bucket keeps its values in encounter
   * order, as an immutable {@link PersistentVector}.
   */
  public static <Key, V> CowSortedMap<Key, List<V>> grouping(Iterable<? extends V> values, Function<? super V, ? extends Key> keyFn) {
    return grouping(values, keyFn, (Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  public static <Key, V> CowSortedMap<Key, List<V>> grouping(Iterable<? extends V> values, Function<? super V, ? extends Key> keyFn, Comparator<Key> cmp) {
    RedBlackTree<Key, List<V>> tree = new RedBlackTree<>(cmp, Settings.DEFAULT, true);
    for (V value: values) {
      int node = RedBlackTree.position(tree.insert(keyFn.apply(value), PersistentVector.EMPTY));
      PersistentVector group = (PersistentVector) tree.value(node);
      tree.setValue(node, group.cons(value));
    }
    return new CowSortedMap<>(tree);
  }

  // Duplicate policies for from(...) and merge(...)

  public static <Value> BinaryOperator<Value> keepingFirst() {
    return (existing, incoming) -> existing;
  }

  public static <Value> BinaryOperator<Value> keepingLast() {
    return (existing, incoming) -> incoming;
  }

  public CowSortedMap<Key, Value> copy() {
    return new CowSortedMap<>(sharedTree());
  }

  @Override
  protected Map.Entry<Key, Value> element(RedBlackTree<Key, Value> tree, int node) {
    return MapEntry.create(tree.key(node), tree.value(node));
  }

  private static <Value> Value checkValue(Value value) {
    return Objects.requireNonNull(value, "CowSortedMap values may not be null");
  }

  // Lookup

  public boolean containsKey(Key key) {
    return _tree.find(key) != NIL;
  }

  public Optional<Value> get(Key key) {
    int node = _tree.find(key);
    return node == NIL ? Optional.empty() : Optional.of(_tree.value(node));
  }

  public Optional<Value> get(Key key, Index hint) {
    checkIndex(hint);
    int node = _tree.find(key, hint._node);
    return node == NIL ? Optional.empty() : Optional.of(_tree.value(node));
  }

  public Value getOrDefault(Key key, Value defaultValue) {
    int node = _tree.find(key);
    return node == NIL ? defaultValue : _tree.value(node);
  }

  public Key key(Index position) {
    return _tree.key(checkNode(position));
  }

  public Value value(Index position) {
    return _tree.value(checkNode(position));
  }

  // Updates

  /**
   * Sets the value under key.
   *
   * @return the previous value, if any
   */
  public Optional<Value> put(Key key, Value value) {
    checkValue(value);
    ensureUnique();
    int node = _tree.lowerBound(key);
    if (node != NIL && _tree.compare(key, _tree.key(node)) == 0) {
      Value old = _tree.value(node);
      _tree.setValue(node, value);
      return Optional.of(old);
    }
    _tree.insert(key, value, node);
    return Optional.empty();
  }

  // Replaces the value at position and returns the old one
  public Value putAt(Index position, Value value) {
    checkValue(value);
    checkNode(position);
    int node = ensureUnique(position);
    Value old = _tree.value(node);
    _tree.setValue(node, value);
    return old;
  }

  /**
   * Reads the entry under key (empty if absent) and stores what fn returns:
   * a value inserts or replaces, {@code Optional.empty()} removes.
   *
   * @return what fn returned
   */
  public Optional<Value> update(Key key, Function<? super Optional<Value>, Optional<Value>> fn) {
    ensureUnique();
    int node = _tree.lowerBound(key);
    if (node != NIL && _tree.compare(key, _tree.key(node)) == 0) {
      return store(node, fn.apply(Optional.of(_tree.value(node))));
    }
    Optional<Value> result = fn.apply(Optional.empty());
    if (result.isPresent()) {
      _tree.insert(key, checkValue(result.get()), node);
    }
    return result;
  }

  public Optional<Value> update(Key key, Index hint, Function<? super Optional<Value>, Optional<Value>> fn) {
    int near = ensureUnique(hint);
    int node = _tree.find(key, near);
    if (node != NIL) {
      return store(node, fn.apply(Optional.of(_tree.value(node))));
    }
    Optional<Value> result = fn.apply(Optional.empty());
    if (result.isPresent()) {
      _tree.insert(key, checkValue(result.get()), near);
    }
    return result;
  }

  private Optional<Value> store(int node, Optional<Value> result) {
    if (result.isPresent()) {
      _tree.setValue(node, checkValue(result.get()));
    } else {
      _tree.takeValue(node);
      _tree.deleteKey(node);
    }
    return result;
  }

  /**
   * Applies fn to the value under key, starting from defaultValue when the
   * key is absent, and stores the result. fn may read this map but must not
   * modify it.
   *
   * @return the stored value
   */
  public Value modify(Key key, Supplier<? extends Value> defaultValue, UnaryOperator<Value> fn) {
    ensureUnique();
    int node = _tree.find(key);
    if (node != NIL) {
      Value next = checkValue(fn.apply(_tree.value(node)));
      _tree.setValue(node, next);
      return next;
    }
    Value next = checkValue(fn.apply(checkValue(defaultValue.get())));
    _tree.insert(key, next);
    return next;
  }

  public Optional<Value> removeValue(Key key) {
    int node = _tree.find(key);
    if (node == NIL) {
      return Optional.empty();
    }
    int target = ensureUnique(index(node));
    Value old = _tree.takeValue(target);
    _tree.deleteKey(target);
    return Optional.of(old);
  }

  // Merging

  /**
   * Adds other's entries; for keys present in both, stores
   * combine(ours, theirs). Linear when other has the same ordering.
   */
  public void merge(CowSortedMap<Key, Value> other, BinaryOperator<Value> combine) {
    if (!sameOrder(other)) {
      merge((Iterable<Map.Entry<Key, Value>>) other, combine);
      return;
    }
    ensureUnique();
    RedBlackTree<Key, Value> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    while (x != NIL && y != NIL) {
      int d = t.compare(t.key(x), o.key(y));
      if (d < 0) {
        x = t.successor(x);
      } else if (d > 0) {
        t.insert(o.key(y), o.value(y), x);
        y = o.successor(y);
      } else {
        t.setValue(x, checkValue(combine.apply(t.value(x), o.value(y))));
        x = t.successor(x);
        y = o.successor(y);
      }
    }
    for (; y != NIL; y = o.successor(y)) {
      t.insertLargest(o.key(y), o.value(y));
    }
  }

  public void merge(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, BinaryOperator<Value> combine) {
    ensureUnique();
    for (Map.Entry<? extends Key, ? extends Value> e: entries) {
      Value value = checkValue(e.getValue());
      int result = _tree.insert(e.getKey(), value);
      if (!RedBlackTree.inserted(result)) {
        int node = RedBlackTree.position(result);
        _tree.setValue(node, checkValue(combine.apply(_tree.value(node), value)));
      }
    }
  }

  public CowSortedMap<Key, Value> merging(CowSortedMap<Key, Value> other, BinaryOperator<Value> combine) {
    CowSortedMap<Key, Value> result = copy();
    result.merge(other, combine);
    return result;
  }

  public CowSortedMap<Key, Value> merging(Iterable<? extends Map.Entry<? extends Key, ? extends Value>> entries, BinaryOperator<Value> combine) {
    CowSortedMap<Key, Value> result = copy();
    result.merge(entries, combine);
    return result;
  }

  // Transformations

  // Same keys, same tree shape
  public <T> CowSortedMap<Key, T> mapValues(Function<? super Value, ? extends T> fn) {
    return new CowSortedMap<>(_tree.<T>mapValues(v -> checkValue(fn.apply(v))));
  }

  public <T> CowSortedMap<Key, T> compactMapValues(Function<? super Value, Optional<T>> fn) {
    RedBlackTree<Key, T> result = new RedBlackTree<>(_tree._cmp, _tree._settings, true);
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      Optional<T> mapped = fn.apply(_tree.value(x));
      if (mapped.isPresent()) {
        result.insertLargest(_tree.key(x), mapped.get());
      }
    }
    return new CowSortedMap<>(result);
  }

  public CowSortedMap<Key, Value> filter(BiPredicate<? super Key, ? super Value> pred) {
    RedBlackTree<Key, Value> result = emptyTree();
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      if (pred.test(_tree.key(x), _tree.value(x))) {
        result.insertLargest(_tree.key(x), _tree.value(x));
      }
    }
    return new CowSortedMap<>(result);
  }

  public CowSortedSet<Key> keys() {
    return new CowSortedSet<>(_tree.keysOnly());
  }

  public List<Value> values() {
    ITransientCollection values = PersistentVector.EMPTY.asTransient();
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      values = values.conj(_tree.value(x));
    }
    return (List<Value>) values.persistent();
  }

  // Flattening

  // key0, value0, key1, value1, ...
  public List<Object> flatten() {
    List<Object> flat = new ArrayList<>(count() * 2);
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      flat.add(_tree.key(x));
      flat.add(_tree.value(x));
    }
    return flat;
  }

  public static <Key, Value> CowSortedMap<Key, Value> unflatten(Iterable<?> flat) throws DecodeException {
    return unflatten(flat, (Comparator<Key>) RT.DEFAULT_COMPARATOR);
  }

  /**
   * Rebuilds a map from {@link #flatten()} output: an even number of
   * elements, keys strictly ascending under cmp, no null values.
   */
  public static <Key, Value> CowSortedMap<Key, Value> unflatten(Iterable<?> flat, Comparator<Key> cmp) throws DecodeException {
    if (flat instanceof Collection && ((Collection<?>) flat).size() % 2 != 0) {
      throw new DecodeException(((Collection<?>) flat).size() - 1, "Missing key or value");
    }
    RedBlackTree<Key, Value> tree = new RedBlackTree<>(cmp, Settings.DEFAULT, true);
    Iterator<?> it = flat.iterator();
    int position = 0;
    while (it.hasNext()) {
      Object key = it.next();
      if (!it.hasNext()) {
        throw new DecodeException(position, "Unexpected end of data after key " + key);
      }
      Object value = it.next();
      if (value == null) {
        throw new DecodeException(position + 1, "Null value for key " + key);
      }
      try {
        if (tree._last != NIL && cmp.compare(tree.key(tree._last), (Key) key) >= 0) {
          throw new DecodeException(position, "Key " + key + " is out of order or duplicated");
        }
      } catch (ClassCastException e) {
        throw new DecodeException(position, "Key " + key + " cannot be compared", e);
      }
      tree.insertLargest((Key) key, (Value) value);
      position += 2;
    }
    return new CowSortedMap<>(tree);
  }

  // Equality and ordering

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CowSortedMap)) return false;
    CowSortedMap<?, ?> other = (CowSortedMap<?, ?>) o;
    if (other._tree == _tree) return true;
    if (other.count() != count()) return false;
    RedBlackTree<?, ?> t = _tree, u = other._tree;
    for (int x = t._first, y = u._first; x != NIL; x = t.successor(x), y = u.successor(y)) {
      if (!Objects.equals(t.key(x), u.key(y)) || !Objects.equals(t.value(x), u.value(y))) {
        return false;
      }
    }
    return true;
  }

  // Lexicographic over entries: keys by the map's comparator, then values
  @Override
  public int compareTo(CowSortedMap<Key, Value> other) {
    if (other._tree == _tree) return 0;
    RedBlackTree<Key, Value> t = _tree, o = other._tree;
    int x = t._first, y = o._first;
    for (; x != NIL && y != NIL; x = t.successor(x), y = o.successor(y)) {
      int d = t.compare(t.key(x), o.key(y));
      if (d != 0) return d;
      d = Util.compare(t.value(x), o.value(y));
      if (d != 0) return d;
    }
    return Integer.compare(t._count, o._count);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int x = _tree._first; x != NIL; x = _tree.successor(x)) {
      if (x != _tree._first) sb.append(", ");
      sb.append(_tree.key(x)).append(" ").append(_tree.value(x));
    }
    sb.append("}");
    return sb.toString();
  }
}
