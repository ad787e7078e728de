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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.List;
import java.util.concurrent.CountedCompleter;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.jspecify.annotations.Nullable;
import org.wirescript.backend.Backend;

/**
 * Compiles independent classes concurrently. Each class gets its own {@link ClassCompiler}; the
 * only state they share is the handler registry, which is immutable, and the backend, which must
 * therefore be thread-safe.
 */
public final class BatchCompiler<T> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final HandlerRegistry handlers;
  private final CompileOptions options;
  private final @Nullable Backend<T> backend;
  private final ForkJoinPool pool;

  public BatchCompiler(
      HandlerRegistry handlers,
      CompileOptions options,
      @Nullable Backend<T> backend,
      ForkJoinPool pool) {
    this.handlers = handlers;
    this.options = options;
    this.backend = backend;
    this.pool = pool;
  }

  /** Returns a BatchCompiler that runs on the common pool. */
  public static <T> BatchCompiler<T> create(
      HandlerRegistry handlers, CompileOptions options, @Nullable Backend<T> backend) {
    return new BatchCompiler<>(handlers, options, backend, ForkJoinPool.commonPool());
  }

  /**
   * Compiles each of {@code units} and returns their results in the same order. If any
   * compilation is cancelled (or fails unexpectedly) the exception is rethrown from here.
   */
  public ImmutableList<CompilationResult<T>> compile(List<ScriptClass> units) {
    AtomicReferenceArray<CompilationResult<T>> results = new AtomicReferenceArray<>(units.size());
    Batch batch = new Batch(units, results);
    pool.invoke(batch);
    ImmutableList.Builder<CompilationResult<T>> builder =
        ImmutableList.builderWithExpectedSize(units.size());
    for (int i = 0; i < units.size(); i++) {
      builder.add(results.get(i));
    }
    return builder.build();
  }

  /**
   * The base task of a batch. It forks a subtask for each unit and completes when all of them
   * have.
   */
  private class Batch extends CountedCompleter<Void> {
    private final List<ScriptClass> units;
    private final AtomicReferenceArray<CompilationResult<T>> results;

    Batch(List<ScriptClass> units, AtomicReferenceArray<CompilationResult<T>> results) {
      this.units = units;
      this.results = results;
    }

    @Override
    public void compute() {
      for (int i = 0; i < units.size(); i++) {
        int index = i;
        addSubTask(() -> results.set(index, compileOne(units.get(index))));
      }
      tryComplete();
    }

    /** Adds a step that must complete before the batch does. */
    void addSubTask(Runnable runnable) {
      addToPendingCount(1);
      new CountedCompleter<Void>(this) {
        @Override
        public void compute() {
          runnable.run();
          tryComplete();
        }
      }.fork();
    }
  }

  private CompilationResult<T> compileOne(ScriptClass unit) {
    CompilationResult<T> result = new ClassCompiler(unit, handlers, options).compile(backend);
    logger.atFine().log(
        "Compiled %s: %d errors, %d warnings",
        unit.name,
        result.errors().size(),
        result.warnings().size());
    return result;
  }
}
