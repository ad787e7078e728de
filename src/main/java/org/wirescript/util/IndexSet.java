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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;

/**
 * An IndexSet represents an immutable, finite set of non-negative integers, usually the indices of
 * nodes in a graph.
 *
 * <p>IndexSets are intended for the bookkeeping done by graph traversals (visited sets, root sets);
 * mutation goes through a {@link Builder}, which can be reused after each {@link Builder#build}.
 */
public final class IndexSet implements IntPredicate, Iterable<Integer> {

  private static final long[] NO_WORDS = new long[0];

  /** An IndexSet containing no integers. */
  public static final IndexSet EMPTY = new IndexSet(NO_WORDS);

  /** Never modified after construction; the last word is always non-zero. */
  private final long[] words;

  private IndexSet(long[] words) {
    this.words = words;
  }

  /** Returns an IndexSet containing each of the given (non-negative) integers. */
  public static IndexSet of(int... elements) {
    Builder builder = new Builder();
    for (int i : elements) {
      builder.add(i);
    }
    return builder.build();
  }

  /** Returns an IndexSet of the integers from 0 to {@code max} that satisfy the predicate. */
  public static IndexSet fromPredicate(int max, IntPredicate include) {
    Builder builder = new Builder();
    for (int i = 0; i <= max; i++) {
      if (include.test(i)) {
        builder.add(i);
      }
    }
    return builder.build();
  }

  /** Returns true if this IndexSet contains no integers. */
  public boolean isEmpty() {
    return words.length == 0;
  }

  /** Returns true if this IndexSet contains {@code i}. */
  @Override
  public boolean test(int i) {
    Preconditions.checkArgument(i >= 0);
    int word = i >> 6;
    return word < words.length && (words[word] & (1L << i)) != 0;
  }

  /** Equivalent to {@link #test}. */
  public boolean contains(int i) {
    return test(i);
  }

  /** Returns the number of integers in this set. */
  public int count() {
    int result = 0;
    for (long w : words) {
      result += Long.bitCount(w);
    }
    return result;
  }

  /** Returns the smallest integer in this set, or -1 if it is empty. */
  public int min() {
    return nextSetBit(0);
  }

  /** Returns the smallest element greater than or equal to {@code from}, or -1 if there is none. */
  public int nextSetBit(int from) {
    int word = from >> 6;
    if (word >= words.length) {
      return -1;
    }
    long w = words[word] & (-1L << from);
    for (; ; ) {
      if (w != 0) {
        return (word << 6) + Long.numberOfTrailingZeros(w);
      } else if (++word == words.length) {
        return -1;
      }
      w = words[word];
    }
  }

  /** Returns a set containing each element that is in this set or in {@code other}. */
  public IndexSet union(IndexSet other) {
    if (other.words.length > words.length) {
      return other.union(this);
    } else if (other.isEmpty()) {
      return this;
    }
    long[] result = words.clone();
    for (int i = 0; i < other.words.length; i++) {
      result[i] |= other.words[i];
    }
    return new IndexSet(result);
  }

  /** Returns a set containing each element of this set that is not in {@code other}. */
  public IndexSet minus(IndexSet other) {
    long[] result = words.clone();
    int n = Math.min(words.length, other.words.length);
    for (int i = 0; i < n; i++) {
      result[i] &= ~other.words[i];
    }
    return fromWords(result);
  }

  public IntStream stream() {
    return IntStream.iterate(min(), i -> i >= 0, i -> nextSetBit(i + 1));
  }

  @Override
  public PrimitiveIterator.OfInt iterator() {
    return new PrimitiveIterator.OfInt() {
      int next = min();

      @Override
      public boolean hasNext() {
        return next >= 0;
      }

      @Override
      public int nextInt() {
        if (next < 0) {
          throw new NoSuchElementException();
        }
        int result = next;
        next = nextSetBit(next + 1);
        return result;
      }
    };
  }

  private static IndexSet fromWords(long[] words) {
    int n = words.length;
    while (n > 0 && words[n - 1] == 0) {
      n--;
    }
    if (n == 0) {
      return EMPTY;
    }
    return new IndexSet(n == words.length ? words : Arrays.copyOf(words, n));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof IndexSet other && Arrays.equals(words, other.words);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(words);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = min(); i >= 0; i = nextSetBit(i + 1)) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      // Print runs of three or more as a range
      int end = i;
      while (test(end + 1)) {
        end++;
      }
      if (end >= i + 2) {
        sb.append(i).append("..").append(end);
        i = end;
      } else {
        sb.append(i);
      }
    }
    return sb.append("}").toString();
  }

  /** A mutable set of integers that can be used to construct an IndexSet. */
  public static final class Builder {
    private long[] words = NO_WORDS;

    public Builder() {}

    /** Returns a Builder initialized with the contents of {@code initial}. */
    public Builder(IndexSet initial) {
      words = initial.words.clone();
    }

    private void ensureWord(int word) {
      if (word >= words.length) {
        words = Arrays.copyOf(words, Math.max(word + 1, words.length * 2));
      }
    }

    /** Adds {@code i} to this set; returns true if it was not already present. */
    @CanIgnoreReturnValue
    public boolean add(int i) {
      Preconditions.checkArgument(i >= 0);
      int word = i >> 6;
      ensureWord(word);
      long bit = 1L << i;
      boolean wasAbsent = (words[word] & bit) == 0;
      words[word] |= bit;
      return wasAbsent;
    }

    /** Removes {@code i} from this set. */
    @CanIgnoreReturnValue
    public Builder remove(int i) {
      int word = i >> 6;
      if (word < words.length) {
        words[word] &= ~(1L << i);
      }
      return this;
    }

    /** Returns true if {@code i} has been added to this set. */
    public boolean contains(int i) {
      int word = i >> 6;
      return word < words.length && (words[word] & (1L << i)) != 0;
    }

    /** Adds each element of {@code other} to this set. */
    @CanIgnoreReturnValue
    public Builder addAll(IndexSet other) {
      ensureWord(other.words.length - 1);
      for (int i = 0; i < other.words.length; i++) {
        words[i] |= other.words[i];
      }
      return this;
    }

    /** Returns the current contents as an IndexSet; the builder may continue to be used. */
    public IndexSet build() {
      return fromWords(words.clone());
    }
  }
}
