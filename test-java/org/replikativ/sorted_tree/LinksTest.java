package org.replikativ.sorted_tree;

import java.util.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import static org.replikativ.sorted_tree.Links.NIL;

class LinksTest {

  // b at the root, a on its left, c on its right
  private static int[] threeNodes(Links links) {
    int b = links.alloc(), a = links.alloc(), c = links.alloc();
    links._root = b;
    links._left[b] = a;
    links._right[b] = c;
    links._parent[a] = b;
    links._parent[c] = b;
    links._first = a;
    links._last = c;
    return new int[] {a, b, c};
  }

  @Test
  void allocGrowsAndReusesFreedSlots() {
    Links links = new Links(1);
    int x = links.alloc(), y = links.alloc(), z = links.alloc();
    assertEquals(Arrays.asList(0, 1, 2), Arrays.asList(x, y, z));
    assertTrue(links.capacity() >= 3);

    links.free(y);
    assertEquals(y, links.alloc());
    assertEquals(3, links.alloc());
  }

  @Test
  void navigation() {
    Links links = new Links(4);
    int[] n = threeNodes(links);
    int a = n[0], b = n[1], c = n[2];

    assertEquals(b, links.successor(a));
    assertEquals(c, links.successor(b));
    assertEquals(NIL, links.successor(c));
    assertEquals(NIL, links.predecessor(a));
    assertEquals(b, links.predecessor(c));
    assertEquals(a, links.minimum(b));
    assertEquals(c, links.maximum(b));
    assertEquals(NIL, links.successor(NIL));
    assertEquals(NIL, links.minimum(NIL));
    assertTrue(links.isBlack(NIL));
    assertFalse(links.isRed(NIL));
  }

  @Test
  void rotationsKeepInorder() {
    Links links = new Links(4);
    int[] n = threeNodes(links);
    int a = n[0], b = n[1], c = n[2];

    links.rotateLeft(b);
    assertEquals(c, links._root);
    assertEquals(NIL, links._parent[c]);
    assertEquals(b, links._left[c]);
    assertEquals(a, links._left[b]);
    assertEquals(NIL, links._right[b]);
    assertEquals(c, links._parent[b]);
    assertEquals(b, links.successor(a));
    assertEquals(c, links.successor(b));

    links.rotateRight(c);
    assertEquals(b, links._root);
    assertEquals(a, links._left[b]);
    assertEquals(c, links._right[b]);
    assertEquals(b, links._parent[c]);
  }

  @Test
  void transplantReplacesSubtree() {
    Links links = new Links(4);
    int[] n = threeNodes(links);
    links.transplant(n[0], NIL);
    assertEquals(NIL, links._left[n[1]]);
    links.transplant(n[1], n[2]);
    assertEquals(n[2], links._root);
    assertEquals(NIL, links._parent[n[2]]);
  }

  @Test
  void pathAndFollow() {
    Links links = new Links(4);
    int[] n = threeNodes(links);
    links.rotateLeft(n[1]);

    boolean[] path = links.path(n[0]);
    assertArrayEquals(new boolean[] {true, true}, path);
    assertEquals(n[0], links.follow(path));
    assertEquals(0, links.path(links._root).length);
    assertEquals(links._root, links.follow(new boolean[0]));
  }

  @Test
  void equivalentOfFindsTheSameKeyInACopy() {
    RedBlackTree<Integer, Void> tree = new RedBlackTree<>(Comparator.<Integer>naturalOrder(), Settings.DEFAULT, false);
    for (int i = 0; i < 40; ++i) {
      tree.insert(i, null);
    }
    for (int i = 0; i < 40; i += 3) {
      tree.delete(i);
    }
    RedBlackTree<Integer, Void> copy = tree.copy();

    for (int x = tree._first; x != NIL; x = tree.successor(x)) {
      assertEquals(tree.key(x), copy.key(copy.equivalentOf(x, tree)));
    }
    assertEquals(NIL, copy.equivalentOf(NIL, tree));
    assertEquals(tree._root, tree.equivalentOf(tree._root, tree));
  }
}
