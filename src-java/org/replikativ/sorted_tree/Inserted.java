package org.replikativ.sorted_tree;

/**
 * Outcome of an insertion: whether a new member was added, the member now
 * stored under that key, and its position.
 */
public final class Inserted<Key> {
  public final boolean _inserted;
  public final Key _member;
  public final Index _index;

  public Inserted(boolean inserted, Key member, Index index) {
    _inserted = inserted;
    _member = member;
    _index = index;
  }

  public boolean inserted() {
    return _inserted;
  }

  public Key member() {
    return _member;
  }

  public Index index() {
    return _index;
  }

  @Override
  public String toString() {
    return "Inserted{inserted=" + _inserted + ", member=" + _member + "}";
  }
}
