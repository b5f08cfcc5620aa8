package org.replikativ.sorted_tree;

import java.util.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class IndexTest {

  @Test
  void walkForwardAndBackward() {
    CowSortedSet<Integer> set = CowSortedSet.of(3, 1, 2);
    List<Integer> forward = new ArrayList<>();
    for (Index i = set.startIndex(); !i.isEnd(); i = set.indexAfter(i)) {
      forward.add(set.at(i));
    }
    assertEquals(Arrays.asList(1, 2, 3), forward);

    List<Integer> backward = new ArrayList<>();
    for (Index i = set.endIndex(); !i.equals(set.startIndex()); ) {
      i = set.indexBefore(i);
      backward.add(set.at(i));
    }
    assertEquals(Arrays.asList(3, 2, 1), backward);
  }

  @Test
  void emptyCollectionStartsAtEnd() {
    CowSortedSet<Integer> set = new CowSortedSet<>();
    assertTrue(set.startIndex().isEnd());
    assertEquals(set.startIndex(), set.endIndex());
    assertThrows(NoSuchElementException.class, () -> set.indexBefore(set.endIndex()));
  }

  @Test
  void endHasNoElement() {
    CowSortedSet<Integer> set = CowSortedSet.of(1, 2);
    assertThrows(NoSuchElementException.class, () -> set.at(set.endIndex()));
    assertThrows(NoSuchElementException.class, () -> set.indexAfter(set.endIndex()));
    assertThrows(NoSuchElementException.class, () -> set.indexBefore(set.startIndex()));
    assertThrows(NoSuchElementException.class, () -> set.remove(set.endIndex()));
  }

  @Test
  void ordering() {
    CowSortedSet<Integer> set = CowSortedSet.of(10, 20, 30);
    Index a = set.find(10).get(), b = set.find(20).get(), end = set.endIndex();
    assertTrue(a.compareTo(b) < 0);
    assertTrue(b.compareTo(a) > 0);
    assertTrue(b.compareTo(end) < 0);
    assertTrue(end.compareTo(a) > 0);
    assertEquals(0, end.compareTo(set.endIndex()));
    assertEquals(0, a.compareTo(set.startIndex()));
    assertEquals(set.lowerBound(15), b);
    assertEquals(set.upperBound(30), end);
  }

  @Test
  void indicesOfDifferentTrees() {
    CowSortedSet<Integer> one = CowSortedSet.of(1, 2, 3);
    CowSortedSet<Integer> two = CowSortedSet.of(1, 2, 3);
    Index i = one.startIndex(), j = two.startIndex();

    assertNotEquals(i, j);
    assertNotEquals(one.endIndex(), two.endIndex());
    assertThrows(IllegalArgumentException.class, () -> i.compareTo(j));
    assertThrows(IllegalArgumentException.class, () -> two.at(i));
    assertThrows(IllegalArgumentException.class, () -> two.find(1, i));
    assertTrue(i.belongsTo(one._tree));
    assertFalse(i.belongsTo(two._tree));
  }

  @Test
  void equalIndicesHashAlike() {
    CowSortedSet<Integer> set = CowSortedSet.of(1, 2, 3);
    Set<Index> seen = new HashSet<>();
    seen.add(set.find(2).get());
    assertTrue(seen.contains(set.lowerBound(2)));
    assertFalse(seen.contains(set.lowerBound(3)));
  }

  @Test
  void indexHeldAcrossCopyOnWriteIsStale() {
    CowSortedSet<String> a = CowSortedSet.of("a", "b", "c");
    CowSortedSet<String> b = a.copy();
    Index kept = a.find("b").get();

    a.insert("d");

    assertThrows(IllegalArgumentException.class, () -> a.at(kept));
    assertThrows(IllegalArgumentException.class, () -> a.remove(kept));
    // the sibling still holds the tree the index came from
    assertEquals("b", b.at(kept));
    assertEquals("c", b.at(b.indexAfter(kept)));
  }

  @Test
  void indexPassedIntoTheMutatingCallIsRetargeted() {
    CowSortedSet<String> a = CowSortedSet.of("a", "b", "c", "e");
    CowSortedSet<String> b = a.copy();

    Inserted<String> inserted = a.insert("d", a.find("e").get());
    assertTrue(inserted.inserted());
    assertEquals("d", a.at(inserted.index()));
    assertEquals("e", a.at(a.indexAfter(inserted.index())));
    assertEquals(Arrays.asList("a", "b", "c", "d", "e"), a.flatten());
    assertEquals(Arrays.asList("a", "b", "c", "e"), b.flatten());

    CowSortedSet<String> c = a.copy();
    assertEquals("b", c.remove(c.find("b").get()));
    assertEquals(Arrays.asList("a", "c", "d", "e"), c.flatten());
    assertEquals(5, a.count());
  }
}
