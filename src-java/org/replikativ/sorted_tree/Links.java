package org.replikativ.sorted_tree;

import java.util.*;

/**
 * Node arena plus the structural red-black algorithms.
 *
 * Nodes are int handles into parallel arrays. NIL (-1) is the absent node:
 * a missing child, the root's parent, or the end position.
 *
 *   _parent[x], _left[x], _right[x] :: handle | NIL
 *   _black[x]                       :: color, NIL counts as black
 *
 * Freed slots are chained through _right and reused by alloc().
 * Only slots in [0 ... _allocated) have ever been handed out.
 *
 * Rebalancing follows Introduction to Algorithms (Cormen, Leiserson,
 * Rivest, Stein), 3rd edition, chapter 13.
 */
public class Links {
  public static final int NIL = -1;

  public int[] _parent;
  public int[] _left;
  public int[] _right;
  public boolean[] _black;

  public int _root  = NIL;
  public int _first = NIL;
  public int _last  = NIL;

  public int _allocated;
  public int _free = NIL;

  public Links(int capacity) {
    assert capacity > 0;
    _parent = new int[capacity];
    _left   = new int[capacity];
    _right  = new int[capacity];
    _black  = new boolean[capacity];
  }

  public int capacity() {
    return _parent.length;
  }

  // Arena

  public int alloc() {
    int x;
    if (_free != NIL) {
      x = _free;
      _free = _right[x];
    } else {
      if (_allocated == capacity()) {
        resize(capacity() + (capacity() >>> 1) + 1);
      }
      x = _allocated++;
    }
    _parent[x] = NIL;
    _left[x]   = NIL;
    _right[x]  = NIL;
    _black[x]  = false;
    return x;
  }

  public void free(int x) {
    assert x != NIL;
    _parent[x] = NIL;
    _left[x]   = NIL;
    _right[x]  = _free;
    _black[x]  = true;
    _free = x;
  }

  protected void resize(int capacity) {
    _parent = Arrays.copyOf(_parent, capacity);
    _left   = Arrays.copyOf(_left, capacity);
    _right  = Arrays.copyOf(_right, capacity);
    _black  = Arrays.copyOf(_black, capacity);
  }

  // Navigation

  public boolean isBlack(int x) {
    return x == NIL || _black[x];
  }

  public boolean isRed(int x) {
    return x != NIL && !_black[x];
  }

  public int minimum(int x) {
    if (x == NIL) return NIL;
    while (_left[x] != NIL) {
      x = _left[x];
    }
    return x;
  }

  public int maximum(int x) {
    if (x == NIL) return NIL;
    while (_right[x] != NIL) {
      x = _right[x];
    }
    return x;
  }

  public int successor(int x) {
    if (x == NIL) return NIL;
    if (_right[x] != NIL) {
      return minimum(_right[x]);
    }
    int p = _parent[x];
    while (p != NIL && x == _right[p]) {
      x = p;
      p = _parent[p];
    }
    return p;
  }

  public int predecessor(int x) {
    if (x == NIL) return NIL;
    if (_left[x] != NIL) {
      return maximum(_left[x]);
    }
    int p = _parent[x];
    while (p != NIL && x == _left[p]) {
      x = p;
      p = _parent[p];
    }
    return p;
  }

  // Restructuring

  public void rotateLeft(int x) {
    int y = _right[x];
    assert y != NIL;
    _right[x] = _left[y];
    if (_left[y] != NIL) {
      _parent[_left[y]] = x;
    }
    _parent[y] = _parent[x];
    if (_parent[x] == NIL) {
      _root = y;
    } else if (x == _left[_parent[x]]) {
      _left[_parent[x]] = y;
    } else {
      _right[_parent[x]] = y;
    }
    _left[y] = x;
    _parent[x] = y;
  }

  public void rotateRight(int x) {
    int y = _left[x];
    assert y != NIL;
    _left[x] = _right[y];
    if (_right[y] != NIL) {
      _parent[_right[y]] = x;
    }
    _parent[y] = _parent[x];
    if (_parent[x] == NIL) {
      _root = y;
    } else if (x == _right[_parent[x]]) {
      _right[_parent[x]] = y;
    } else {
      _left[_parent[x]] = y;
    }
    _right[y] = x;
    _parent[x] = y;
  }

  // Replaces subtree u with subtree v in u's parent. v may be NIL.
  public void transplant(int u, int v) {
    int p = _parent[u];
    if (p == NIL) {
      _root = v;
    } else if (u == _left[p]) {
      _left[p] = v;
    } else {
      _right[p] = v;
    }
    if (v != NIL) {
      _parent[v] = p;
    }
  }

  public void rebalanceAfterInsertion(int z) {
    while (isRed(_parent[z])) {
      int p = _parent[z];
      int g = _parent[p];
      // a red parent is never the root
      assert g != NIL;
      if (p == _left[g]) {
        int uncle = _right[g];
        if (isRed(uncle)) {
          _black[p] = true;
          _black[uncle] = true;
          _black[g] = false;
          z = g;
        } else {
          if (z == _right[p]) {
            z = p;
            rotateLeft(z);
            p = _parent[z];
          }
          _black[p] = true;
          _black[g] = false;
          rotateRight(g);
        }
      } else {
        int uncle = _left[g];
        if (isRed(uncle)) {
          _black[p] = true;
          _black[uncle] = true;
          _black[g] = false;
          z = g;
        } else {
          if (z == _left[p]) {
            z = p;
            rotateRight(z);
            p = _parent[z];
          }
          _black[p] = true;
          _black[g] = false;
          rotateLeft(g);
        }
      }
    }
    _black[_root] = true;
  }

  // x carries an extra black. x may be NIL, then parent says where it hangs.
  public void rebalanceAfterDeletion(int x, int parent) {
    while (x != _root && isBlack(x)) {
      if (x == _left[parent]) {
        int w = _right[parent];
        if (isRed(w)) {
          _black[w] = true;
          _black[parent] = false;
          rotateLeft(parent);
          w = _right[parent];
        }
        if (isBlack(_left[w]) && isBlack(_right[w])) {
          _black[w] = false;
          x = parent;
          parent = _parent[x];
        } else {
          if (isBlack(_right[w])) {
            _black[_left[w]] = true;
            _black[w] = false;
            rotateRight(w);
            w = _right[parent];
          }
          _black[w] = _black[parent];
          _black[parent] = true;
          _black[_right[w]] = true;
          rotateLeft(parent);
          x = _root;
        }
      } else {
        int w = _left[parent];
        if (isRed(w)) {
          _black[w] = true;
          _black[parent] = false;
          rotateRight(parent);
          w = _left[parent];
        }
        if (isBlack(_right[w]) && isBlack(_left[w])) {
          _black[w] = false;
          x = parent;
          parent = _parent[x];
        } else {
          if (isBlack(_left[w])) {
            _black[_right[w]] = true;
            _black[w] = false;
            rotateLeft(w);
            w = _left[parent];
          }
          _black[w] = _black[parent];
          _black[parent] = true;
          _black[_left[w]] = true;
          rotateRight(parent);
          x = _root;
        }
      }
    }
    if (x != NIL) {
      _black[x] = true;
    }
  }

  /**
   * Unlinks z from the tree without freeing its slot.
   *
   * With two children, z's inorder successor is moved into z's place and
   * takes over z's color; the successor keeps its handle, so a handle to it
   * captured before the call is still valid afterwards.
   */
  protected void splice(int z) {
    assert z != NIL;
    if (_first == _last) {
      _first = NIL;
      _last  = NIL;
    } else {
      if (z == _first) _first = successor(z);
      if (z == _last)  _last  = predecessor(z);
    }

    int y = z;
    boolean yWasBlack = _black[y];
    int x, xParent;

    if (_left[z] == NIL) {
      x = _right[z];
      xParent = _parent[z];
      transplant(z, x);
    } else if (_right[z] == NIL) {
      x = _left[z];
      xParent = _parent[z];
      transplant(z, x);
    } else {
      y = minimum(_right[z]);
      yWasBlack = _black[y];
      x = _right[y];
      if (_parent[y] == z) {
        xParent = y;
      } else {
        xParent = _parent[y];
        transplant(y, _right[y]);
        _right[y] = _right[z];
        _parent[_right[y]] = y;
      }
      transplant(z, y);
      _left[y] = _left[z];
      _parent[_left[y]] = y;
      _black[y] = _black[z];
    }

    if (yWasBlack) {
      rebalanceAfterDeletion(x, xParent);
    }

    _parent[z] = NIL;
    _left[z]   = NIL;
    _right[z]  = NIL;
  }

  // Paths

  /**
   * Root-to-node directions, true meaning "go left".
   */
  public boolean[] path(int x) {
    int depth = 0;
    for (int n = x; _parent[n] != NIL; n = _parent[n]) {
      ++depth;
    }
    boolean[] path = new boolean[depth];
    for (int n = x; _parent[n] != NIL; n = _parent[n]) {
      path[--depth] = _left[_parent[n]] == n;
    }
    return path;
  }

  public int follow(boolean[] path) {
    int x = _root;
    for (boolean left: path) {
      x = left ? _left[x] : _right[x];
      assert x != NIL : "Path does not exist in this tree";
    }
    return x;
  }

  /**
   * Node of this arena sitting where node x sits in source. Both arenas
   * must have the same shape, which holds right after a copy.
   */
  public int equivalentOf(int x, Links source) {
    if (x == NIL) return NIL;
    if (source == this) return x;
    return follow(source.path(x));
  }
}
