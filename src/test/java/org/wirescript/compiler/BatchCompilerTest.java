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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.wirescript.compiler.TestGraphs.call;
import static org.wirescript.compiler.TestGraphs.entry;
import static org.wirescript.compiler.TestGraphs.then;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirescript.backend.ListingBackend;
import org.wirescript.graph.Graph;
import org.wirescript.nodes.StandardHandlers;

@RunWith(JUnit4.class)
public class BatchCompilerTest {

  private final ForkJoinPool pool = new ForkJoinPool(4);

  @After
  public void shutdown() {
    pool.shutdownNow();
  }

  private static ScriptClass unit(int i) {
    Graph graph = TestGraphs.function("F");
    then(entry(graph), call(graph, "Step" + i));
    return ScriptClass.builder("Unit" + i).addFunction(graph).build();
  }

  @Test
  public void resultsAreInInputOrder() {
    List<ScriptClass> units = IntStream.range(0, 20).mapToObj(BatchCompilerTest::unit).toList();
    BatchCompiler<String> batch =
        new BatchCompiler<>(
            StandardHandlers.registry(), CompileOptions.DEFAULT, new ListingBackend(), pool);

    ImmutableList<CompilationResult<String>> results = batch.compile(units);

    assertThat(results).hasSize(20);
    for (int i = 0; i < 20; i++) {
      CompilationResult<String> result = results.get(i);
      assertThat(result.isSuccess()).isTrue();
      assertThat(result.compiledClass.name).isEqualTo("Unit" + i);
      assertThat(TestGraphs.statements(result, "F"))
          .containsExactly("Step" + i + "()", "end")
          .inOrder();
      assertThat(result.output).startsWith("class Unit" + i + "\n");
    }
  }

  @Test
  public void emptyBatch() {
    BatchCompiler<Void> batch =
        BatchCompiler.create(StandardHandlers.registry(), CompileOptions.DEFAULT, null);

    assertThat(batch.compile(ImmutableList.of())).isEmpty();
  }

  @Test
  public void cancellationIsRethrown() {
    CompileOptions options = CompileOptions.builder().cancelled(() -> true).build();
    BatchCompiler<Void> batch =
        new BatchCompiler<>(StandardHandlers.registry(), options, null, pool);

    assertThrows(
        CancellationException.class, () -> batch.compile(ImmutableList.of(unit(0), unit(1))));
  }
}
