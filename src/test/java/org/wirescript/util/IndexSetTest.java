/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wirescript.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.BitSet;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class IndexSetTest {

  /**
   * Node ids used by {@link #addAndRemove}; chosen to straddle word boundaries, and unsorted so
   * that the builder has to grow more than once.
   */
  private static final int[] ELEMENTS = new int[] {130, 5, 0, 63, 64, 1, 127, 128, 2};

  private static IntPredicate includedInIteration(int iteration) {
    return j -> (iteration & (1 << j)) != 0;
  }

  /** Returns {@code [i, includedInIteration(i)]} for a sample of subsets of ELEMENTS. */
  private static Object[] elementSubsets() {
    return IntStream.of(0, 1, 3, 7, 24, 85, 170, 255, 256, 300, 511)
        .mapToObj(i -> new Object[] {i, includedInIteration(i)})
        .toArray();
  }

  @Test
  @Parameters(method = "elementSubsets")
  @TestCaseName("addAndRemove_{0}")
  public void addAndRemove(Integer iteration, IntPredicate included) {
    IndexSet.Builder builder = new IndexSet.Builder();
    BitSet expected = new BitSet();
    IntStream.range(0, ELEMENTS.length)
        .filter(included)
        .forEach(
            j -> {
              assertTrue(builder.add(ELEMENTS[j]));
              assertFalse(builder.add(ELEMENTS[j]));
              expected.set(ELEMENTS[j]);
            });
    IndexSet set = builder.build();
    assertEquals(expected.cardinality(), set.count());
    assertThat(set.stream().toArray()).isEqualTo(expected.stream().toArray());
    assertEquals(expected.isEmpty(), set.isEmpty());
    assertEquals(expected.isEmpty() ? -1 : expected.nextSetBit(0), set.min());
    for (int i = 0; i <= 200; i++) {
      assertEquals(expected.get(i), set.test(i));
    }
    // Removing everything again leaves an empty set that equals EMPTY
    Arrays.stream(ELEMENTS).forEach(builder::remove);
    assertSame(IndexSet.EMPTY, builder.build());
  }

  private static Object[] setPairs() {
    return new Object[] {
      new Object[] {new int[] {}, new int[] {}},
      new Object[] {new int[] {1, 2, 3}, new int[] {}},
      new Object[] {new int[] {1, 64}, new int[] {64, 200}},
      new Object[] {new int[] {0, 63, 127}, new int[] {0, 63, 127}},
      new Object[] {new int[] {300}, new int[] {1, 2, 299}},
    };
  }

  @Test
  @Parameters(method = "setPairs")
  public void unionAndMinus(int[] a, int[] b) {
    IndexSet setA = IndexSet.of(a);
    IndexSet setB = IndexSet.of(b);
    BitSet bitsA = new BitSet();
    Arrays.stream(a).forEach(bitsA::set);
    BitSet bitsB = new BitSet();
    Arrays.stream(b).forEach(bitsB::set);

    BitSet union = (BitSet) bitsA.clone();
    union.or(bitsB);
    assertThat(setA.union(setB).stream().toArray()).isEqualTo(union.stream().toArray());
    assertEquals(setA.union(setB), setB.union(setA));

    BitSet minus = (BitSet) bitsA.clone();
    minus.andNot(bitsB);
    IndexSet difference = setA.minus(setB);
    assertThat(difference.stream().toArray()).isEqualTo(minus.stream().toArray());
    // Trailing empty words are trimmed, so equal sets compare equal however they were built
    assertEquals(IndexSet.of(minus.stream().toArray()), difference);
    assertEquals(IndexSet.of(minus.stream().toArray()).hashCode(), difference.hashCode());
  }

  @Test
  public void builderStartingFromSet() {
    IndexSet initial = IndexSet.of(3, 70);
    IndexSet.Builder builder = new IndexSet.Builder(initial);
    assertTrue(builder.contains(70));
    builder.add(4);
    builder.addAll(IndexSet.of(200));
    assertEquals(IndexSet.of(3, 4, 70, 200), builder.build());
    // The original is unchanged
    assertEquals(IndexSet.of(3, 70), initial);
  }

  @Test
  public void fromPredicate() {
    IndexSet evens = IndexSet.fromPredicate(10, i -> i % 2 == 0);
    assertEquals(IndexSet.of(0, 2, 4, 6, 8, 10), evens);
    assertEquals(6, evens.count());
    assertEquals(4, evens.nextSetBit(3));
    assertEquals(-1, evens.nextSetBit(11));
  }

  @Test
  public void iteration() {
    IndexSet set = IndexSet.of(65, 0, 7);
    StringBuilder sb = new StringBuilder();
    for (int i : set) {
      sb.append(i).append(' ');
    }
    assertEquals("0 7 65 ", sb.toString());
  }

  @Test
  public void printsRuns() {
    assertEquals("{}", IndexSet.EMPTY.toString());
    assertEquals("{1, 2}", IndexSet.of(1, 2).toString());
    assertEquals("{0..3, 7, 63..65}", IndexSet.of(0, 1, 2, 3, 7, 63, 64, 65).toString());
  }

  @Test
  public void negativeElements() {
    assertThrows(IllegalArgumentException.class, () -> IndexSet.of(-1));
    assertThrows(IllegalArgumentException.class, () -> IndexSet.EMPTY.test(-1));
  }
}
