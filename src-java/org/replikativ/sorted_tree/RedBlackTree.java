package org.replikativ.sorted_tree;

import java.util.*;
import java.util.function.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Red-black tree over a node arena. Keys are ordered by _cmp; _values is
 * null for key-only trees (sets) and parallel to _keys otherwise (maps).
 *
 * The tree is the only mutable storage behind the facades. _owners counts
 * the facades (and seqs) referencing it; a facade may mutate the tree in
 * place only while it is the sole owner.
 */
@SuppressWarnings("unchecked")
public class RedBlackTree<Key, Value> extends Links {
  private static final Logger log = LoggerFactory.getLogger(RedBlackTree.class);

  public final Comparator<Key> _cmp;
  public final Settings _settings;

  // Only valid for allocated, non-free slots
  public Object[] _keys;
  // Nullable, null == key-only tree
  public Object[] _values;

  public int _count;
  public int _version;
  public int _owners = 1;

  public RedBlackTree(Comparator<Key> cmp, Settings settings, boolean withValues) {
    this(cmp, settings, withValues, settings.initialCapacity());
  }

  public RedBlackTree(Comparator<Key> cmp, Settings settings, boolean withValues, int capacity) {
    super(Math.max(capacity, 1));
    _cmp      = cmp;
    _settings = settings;
    _keys     = new Object[capacity()];
    _values   = withValues ? new Object[capacity()] : null;
  }

  public boolean hasValues() {
    return _values != null;
  }

  @Override
  protected void resize(int capacity) {
    log.trace("Growing node arena from {} to {} slots", capacity(), capacity);
    super.resize(capacity);
    _keys = Arrays.copyOf(_keys, capacity);
    if (_values != null) {
      _values = Arrays.copyOf(_values, capacity);
    }
  }

  @Override
  public void free(int x) {
    _keys[x] = null;
    if (_values != null) {
      _values[x] = null;
    }
    super.free(x);
  }

  // Ownership

  public RedBlackTree<Key, Value> share() {
    _owners += 1;
    return this;
  }

  public void unshare() {
    assert _owners > 0;
    _owners -= 1;
  }

  public boolean isShared() {
    return _owners > 1;
  }

  // Payload

  public Key key(int x) {
    return (Key) _keys[x];
  }

  public Value value(int x) {
    return (Value) _values[x];
  }

  public void setKey(int x, Key key) {
    _keys[x] = key;
  }

  public void setValue(int x, Value value) {
    _values[x] = value;
  }

  // Moves the value out of its slot, leaving the slot empty for deleteKey.
  public Value takeValue(int x) {
    Value value = (Value) _values[x];
    _values[x] = null;
    return value;
  }

  public int compare(Key a, Key b) {
    return _cmp.compare(a, b);
  }

  public int compareNodes(int a, int b) {
    if (a == b) return 0;
    if (a == NIL) return 1;
    if (b == NIL) return -1;
    return _cmp.compare(key(a), key(b));
  }

  // Predecessor where NIL means end, so the step back from end is _last
  public int before(int x) {
    return x == NIL ? _last : predecessor(x);
  }

  // Search

  public int find(Key key) {
    int x = _root;
    while (x != NIL) {
      int d = _cmp.compare(key, key(x));
      if (d < 0) {
        x = _left[x];
      } else if (d > 0) {
        x = _right[x];
      } else {
        return x;
      }
    }
    return NIL;
  }

  /**
   * Looks at hint, its successor and its predecessor only. NIL on a miss.
   */
  public int findNear(Key key, int hint) {
    if (_count == 0) return NIL;

    if (hint != NIL) {
      if (_cmp.compare(key, key(hint)) == 0) {
        return hint;
      }
      int next = successor(hint);
      if (next != NIL && _cmp.compare(key, key(next)) == 0) {
        return next;
      }
    }

    if (hint != _first) {
      int prev = before(hint);
      if (prev != NIL && _cmp.compare(key, key(prev)) == 0) {
        return prev;
      }
    }

    return NIL;
  }

  public int find(Key key, int hint) {
    int x = findNear(key, hint);
    return x != NIL ? x : find(key);
  }

  // First node with key >= given, NIL if none
  public int lowerBound(Key key) {
    int bound = NIL;
    int x = _root;
    while (x != NIL) {
      if (_cmp.compare(key(x), key) >= 0) {
        bound = x;
        x = _left[x];
      } else {
        x = _right[x];
      }
    }
    return bound;
  }

  // First node with key > given, NIL if none
  public int upperBound(Key key) {
    int bound = NIL;
    int x = _root;
    while (x != NIL) {
      if (_cmp.compare(key, key(x)) < 0) {
        bound = x;
        x = _left[x];
      } else {
        x = _right[x];
      }
    }
    return bound;
  }

  // Insertion
  //
  // insert(...) returns the new node (>= 0) when it inserted, and
  // -existing - 1 when an equal key is already present.

  public static boolean inserted(int result) {
    return result >= 0;
  }

  public static int position(int result) {
    return result >= 0 ? result : -result - 1;
  }

  public int insertAt(Key key, Value value, int parent, boolean toLeft) {
    int z = alloc();
    _keys[z] = key;
    if (_values != null) {
      _values[z] = value;
    }
    _parent[z] = parent;

    if (parent == NIL) {
      assert _root == NIL;
      _root  = z;
      _first = z;
      _last  = z;
    } else if (toLeft) {
      assert _left[parent] == NIL;
      _left[parent] = z;
      if (_first == parent) _first = z;
    } else {
      assert _right[parent] == NIL;
      _right[parent] = z;
      if (_last == parent) _last = z;
    }

    rebalanceAfterInsertion(z);
    _count += 1;
    _version += 1;
    if (_settings.checkInvariants()) checkInvariants();
    return z;
  }

  public int insert(Key key, Value value) {
    int parent = NIL;
    boolean toLeft = false;
    int x = _root;
    while (x != NIL) {
      parent = x;
      toLeft = _cmp.compare(key, key(x)) < 0;
      x = toLeft ? _left[x] : _right[x];
    }

    // parent is the last node with key <= given, or its successor when
    // we went left; an equal key can only sit there or right before it
    int candidate = parent;
    if (toLeft) {
      if (parent == _first) {
        return insertAt(key, value, parent, true);
      }
      candidate = predecessor(parent);
    }

    if (candidate != NIL && _cmp.compare(key(candidate), key) >= 0) {
      return -candidate - 1;
    }
    return insertAt(key, value, parent, toLeft);
  }

  /**
   * Inserts next to hint without descending from the root when key belongs
   * immediately before or after hint. Falls back to insert(key, value).
   */
  public int insert(Key key, Value value, int hint) {
    if (hint == NIL || _cmp.compare(key, key(hint)) < 0) {
      int prev = hint == _first ? NIL : before(hint);
      if (prev == NIL || _cmp.compare(key(prev), key) < 0) {
        // prev < key < hint
        if (hint != NIL && _left[hint] == NIL) {
          return insertAt(key, value, hint, true);
        }
        // hint has a left child (or is end), prev is its rightmost descendant
        return insertAt(key, value, prev, false);
      } else if (_cmp.compare(key, key(prev)) == 0) {
        return -prev - 1;
      }
      return insert(key, value);
    }

    int d = _cmp.compare(key(hint), key);
    if (d < 0) {
      int next = successor(hint);
      if (next == NIL || _cmp.compare(key, key(next)) < 0) {
        // hint < key < next
        if (_right[hint] == NIL) {
          return insertAt(key, value, hint, false);
        }
        return insertAt(key, value, next, true);
      } else if (_cmp.compare(key(next), key) == 0) {
        return -next - 1;
      }
      return insert(key, value);
    }

    return -hint - 1;
  }

  public int insertLargest(Key key, Value value) {
    if (_last != NIL && _cmp.compare(key(_last), key) >= 0) {
      throw new IllegalArgumentException("Key " + key + " is not greater than current maximum " + key(_last));
    }
    return insertAt(key, value, _last, false);
  }

  // Deletion

  public Key delete(Key key) {
    int x = find(key);
    if (x == NIL) return null;
    return deleteAt(x);
  }

  public Key deleteAt(int x) {
    if (x == NIL) {
      throw new NoSuchElementException("Cannot delete at end position");
    }
    Key key = key(x);
    unlink(x);
    free(x);
    return key;
  }

  // For maps whose value was already moved out with takeValue
  public void deleteKey(int x) {
    if (x == NIL) {
      throw new NoSuchElementException("Cannot delete at end position");
    }
    assert _values != null : "deleteKey on a key-only tree";
    assert _values[x] == null : "Value still present at " + x;
    unlink(x);
    free(x);
  }

  private void unlink(int x) {
    splice(x);
    _count -= 1;
    _version += 1;
    if (_settings.checkInvariants()) checkInvariants();
  }

  // Copying

  public RedBlackTree<Key, Value> copy() {
    log.debug("Copying tree of {} nodes", _count);
    RedBlackTree<Key, Value> result = new RedBlackTree<>(_cmp, _settings, _values != null, Math.max(_count, 1));
    copyInto(result, Function.<Object>identity());
    return result;
  }

  public RedBlackTree<Key, Void> keysOnly() {
    RedBlackTree<Key, Void> result = new RedBlackTree<>(_cmp, _settings, false, Math.max(_count, 1));
    copyInto(result, null);
    return result;
  }

  public <T> RedBlackTree<Key, T> mapValues(Function<? super Value, ? extends T> fn) {
    assert _values != null;
    RedBlackTree<Key, T> result = new RedBlackTree<>(_cmp, _settings, true, Math.max(_count, 1));
    copyInto(result, (Function) fn);
    return result;
  }

  private void copyInto(RedBlackTree target, Function<Object, Object> valueFn) {
    target._root  = copyNode(target, _root, NIL, valueFn);
    target._first = target.minimum(target._root);
    target._last  = target.maximum(target._root);
    target._count = _count;
  }

  // Preorder, so the copy's handles differ from ours unless the arena was never edited
  private int copyNode(RedBlackTree target, int x, int parent, Function<Object, Object> valueFn) {
    if (x == NIL) return NIL;
    int n = target.alloc();
    target._keys[n]   = _keys[x];
    target._black[n]  = _black[x];
    target._parent[n] = parent;
    if (target._values != null) {
      target._values[n] = valueFn.apply(_values[x]);
    }
    target._left[n]  = copyNode(target, _left[x], n, valueFn);
    target._right[n] = copyNode(target, _right[x], n, valueFn);
    return n;
  }

  // Validation

  /**
   * Walks the whole tree and throws IllegalStateException on the first
   * broken invariant.
   */
  public void checkInvariants() {
    if (_root != NIL) {
      if (!_black[_root]) fail("root is red");
      if (_parent[_root] != NIL) fail("root has a parent");
    }
    int[] reached = new int[1];
    blackHeight(_root, reached);
    if (reached[0] != _count) fail("count is " + _count + " but " + reached[0] + " nodes are reachable");
    if (_first != minimum(_root)) fail("cached first " + _first + " is not the minimum " + minimum(_root));
    if (_last != maximum(_root)) fail("cached last " + _last + " is not the maximum " + maximum(_root));

    int prev = NIL;
    for (int x = _first; x != NIL; x = successor(x)) {
      if (prev != NIL && _cmp.compare(key(prev), key(x)) >= 0) {
        fail("keys out of order: " + key(prev) + " before " + key(x));
      }
      prev = x;
    }
  }

  private int blackHeight(int x, int[] reached) {
    if (x == NIL) return 1;
    reached[0] += 1;
    int l = _left[x], r = _right[x];
    if (l != NIL && _parent[l] != x) fail("broken parent link at " + l);
    if (r != NIL && _parent[r] != x) fail("broken parent link at " + r);
    if (!_black[x] && (isRed(l) || isRed(r))) fail("red node " + key(x) + " has a red child");
    int lh = blackHeight(l, reached);
    int rh = blackHeight(r, reached);
    if (lh != rh) fail("black height differs under " + key(x) + ": " + lh + " vs " + rh);
    return lh + (_black[x] ? 1 : 0);
  }

  private static void fail(String message) {
    throw new IllegalStateException("Red-black invariant violated: " + message);
  }
}
