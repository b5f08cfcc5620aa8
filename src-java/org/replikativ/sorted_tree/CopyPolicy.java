package org.replikativ.sorted_tree;

/**
 * When a shared tree gets its private copy.
 *
 * LAZY defers the deep copy until the first mutation through a facade that
 * does not own the tree alone. EAGER copies at {@code copy()} time.
 */
public enum CopyPolicy {
  LAZY,
  EAGER
}
