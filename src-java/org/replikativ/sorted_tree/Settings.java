package org.replikativ.sorted_tree;

public class Settings {
  public static final Settings DEFAULT = new Settings();

  public final int _initialCapacity;
  public final CopyPolicy _copyPolicy;
  public final boolean _checkInvariants;

  public Settings() {
    this(0, null, false);
  }

  public Settings(int initialCapacity) {
    this(initialCapacity, null, false);
  }

  public Settings(int initialCapacity, CopyPolicy copyPolicy) {
    this(initialCapacity, copyPolicy, false);
  }

  public Settings(int initialCapacity, CopyPolicy copyPolicy, boolean checkInvariants) {
    if (initialCapacity <= 0) {
      initialCapacity = 16;
    }
    if (null == copyPolicy) {
      copyPolicy = CopyPolicy.LAZY;
    }
    _initialCapacity = initialCapacity;
    _copyPolicy = copyPolicy;
    _checkInvariants = checkInvariants;
  }

  public int initialCapacity() {
    return _initialCapacity;
  }

  public CopyPolicy copyPolicy() {
    return _copyPolicy;
  }

  // Full red-black validation after every structural mutation. O(n) each time.
  public boolean checkInvariants() {
    return _checkInvariants;
  }

  public Settings withCopyPolicy(CopyPolicy copyPolicy) {
    return new Settings(_initialCapacity, copyPolicy, _checkInvariants);
  }

  public Settings withCheckInvariants(boolean value) {
    return new Settings(_initialCapacity, _copyPolicy, value);
  }

  @Override
  public String toString() {
    return "Settings{initialCapacity=" + _initialCapacity + ", copyPolicy=" + _copyPolicy + ", checkInvariants=" + _checkInvariants + "}";
  }
}
