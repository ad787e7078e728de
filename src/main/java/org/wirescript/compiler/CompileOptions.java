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

package org.wirescript.compiler;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import java.util.function.BooleanSupplier;

/** Settings that control a single compilation. CompileOptions are immutable. */
public final class CompileOptions {

  /** How much of the pipeline runs. */
  public enum CompileType {
    /** Produce only the external call signature of each function. */
    SKELETON_ONLY,
    /** Produce signatures and bodies. */
    FULL
  }

  /** Prefix of the keys recognized by {@link #fromProperties}. */
  public static final String PROPERTY_PREFIX = "wirescript.";

  public static final int DEFAULT_MAX_EXPANSION_ITERATIONS = 64;
  public static final int DEFAULT_MAX_NODE_COUNT = 100_000;

  public static final CompileOptions DEFAULT = builder().build();

  public final CompileType compileType;

  /**
   * If true, macro boundaries are marked with TunnelBoundary nodes and each non-pure node is
   * preceded by a wire-trace statement, so that execution can be traced back to authored nodes.
   */
  public final boolean instrumentation;

  /** If true, each node's statements are preceded by a comment naming the node. */
  public final boolean emitNodeComments;

  /** If true, comment nodes are kept through pruning so intermediate graphs can be inspected. */
  public final boolean saveIntermediateProducts;

  /**
   * If true, event graph locals are stored in the event graph's persistent frame rather than as
   * hidden properties of the class.
   */
  public final boolean persistentEventFrame;

  /** The number of expansion rounds after which expansion is assumed to be recursive. */
  public final int maxExpansionIterations;

  /** The number of nodes a function graph may grow to during expansion. */
  public final int maxNodeCount;

  /** If true, a textual listing of each compiled function is kept for debugging. */
  public final boolean verbose;

  /** Polled at phase boundaries; a compilation is abandoned once this returns true. */
  public final BooleanSupplier cancelled;

  private CompileOptions(Builder builder) {
    this.compileType = builder.compileType;
    this.instrumentation = builder.instrumentation;
    this.emitNodeComments = builder.emitNodeComments;
    this.saveIntermediateProducts = builder.saveIntermediateProducts;
    this.persistentEventFrame = builder.persistentEventFrame;
    this.maxExpansionIterations = builder.maxExpansionIterations;
    this.maxNodeCount = builder.maxNodeCount;
    this.verbose = builder.verbose;
    this.cancelled = builder.cancelled;
  }

  public boolean isFullCompile() {
    return compileType == CompileType.FULL;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a Builder initialized with these options. */
  public Builder toBuilder() {
    return new Builder()
        .compileType(compileType)
        .instrumentation(instrumentation)
        .emitNodeComments(emitNodeComments)
        .saveIntermediateProducts(saveIntermediateProducts)
        .persistentEventFrame(persistentEventFrame)
        .maxExpansionIterations(maxExpansionIterations)
        .maxNodeCount(maxNodeCount)
        .verbose(verbose)
        .cancelled(cancelled);
  }

  /**
   * Returns options read from {@code wirescript.*} keys; missing keys take their default values.
   * Recognized keys are {@code compileType} ({@code full} or {@code skeleton_only}), {@code
   * instrumentation}, {@code emitNodeComments}, {@code saveIntermediateProducts}, {@code
   * persistentEventFrame}, {@code maxExpansionIterations}, {@code maxNodeCount} and {@code
   * verbose}.
   */
  public static CompileOptions fromProperties(Map<String, String> properties) {
    Builder builder = builder();
    String type = properties.get(PROPERTY_PREFIX + "compileType");
    if (type != null) {
      builder.compileType(CompileType.valueOf(Ascii.toUpperCase(type.trim())));
    }
    builder.instrumentation(flag(properties, "instrumentation", false));
    builder.emitNodeComments(flag(properties, "emitNodeComments", false));
    builder.saveIntermediateProducts(flag(properties, "saveIntermediateProducts", false));
    builder.persistentEventFrame(flag(properties, "persistentEventFrame", false));
    builder.verbose(flag(properties, "verbose", false));
    builder.maxExpansionIterations(
        number(properties, "maxExpansionIterations", DEFAULT_MAX_EXPANSION_ITERATIONS));
    builder.maxNodeCount(number(properties, "maxNodeCount", DEFAULT_MAX_NODE_COUNT));
    return builder.build();
  }

  private static boolean flag(Map<String, String> properties, String key, boolean defaultValue) {
    String value = properties.get(PROPERTY_PREFIX + key);
    if (value == null) {
      return defaultValue;
    }
    value = Ascii.toLowerCase(value.trim());
    Preconditions.checkArgument(
        value.equals("true") || value.equals("false"),
        "%s%s: expected true or false",
        PROPERTY_PREFIX,
        key);
    return value.equals("true");
  }

  private static int number(Map<String, String> properties, String key, int defaultValue) {
    String value = properties.get(PROPERTY_PREFIX + key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(PROPERTY_PREFIX + key + ": expected an integer", e);
    }
  }

  /** Builds CompileOptions; every setting starts with its default. */
  public static final class Builder {
    private CompileType compileType = CompileType.FULL;
    private boolean instrumentation;
    private boolean emitNodeComments;
    private boolean saveIntermediateProducts;
    private boolean persistentEventFrame;
    private int maxExpansionIterations = DEFAULT_MAX_EXPANSION_ITERATIONS;
    private int maxNodeCount = DEFAULT_MAX_NODE_COUNT;
    private boolean verbose;
    private BooleanSupplier cancelled = () -> false;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder compileType(CompileType compileType) {
      this.compileType = compileType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder instrumentation(boolean instrumentation) {
      this.instrumentation = instrumentation;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder emitNodeComments(boolean emitNodeComments) {
      this.emitNodeComments = emitNodeComments;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder saveIntermediateProducts(boolean saveIntermediateProducts) {
      this.saveIntermediateProducts = saveIntermediateProducts;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder persistentEventFrame(boolean persistentEventFrame) {
      this.persistentEventFrame = persistentEventFrame;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxExpansionIterations(int maxExpansionIterations) {
      Preconditions.checkArgument(maxExpansionIterations > 0);
      this.maxExpansionIterations = maxExpansionIterations;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxNodeCount(int maxNodeCount) {
      Preconditions.checkArgument(maxNodeCount > 0);
      this.maxNodeCount = maxNodeCount;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder cancelled(BooleanSupplier cancelled) {
      this.cancelled = cancelled;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
