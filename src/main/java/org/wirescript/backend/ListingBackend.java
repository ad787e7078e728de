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

package org.wirescript.backend;

import com.google.common.base.Joiner;
import com.google.common.flogger.FluentLogger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.wirescript.compiler.CompiledClass;
import org.wirescript.compiler.CompiledFunction;
import org.wirescript.compiler.Statement;
import org.wirescript.compiler.Term;

/**
 * A backend that renders a compiled class as text: its properties and default values, and then
 * each function's signature, storage and numbered statements.
 *
 * <p>Each statement that is the target of a jump is marked with "=" if some jump to it is
 * backward, or "-" if all jumps to it are forward.
 */
public final class ListingBackend implements Backend<String> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Override
  public String generate(CompiledClass compiledClass, boolean stubsOnly) {
    StringBuilder sb = new StringBuilder();
    sb.append("class ").append(compiledClass.name);
    if (compiledClass.parent != null) {
      sb.append(" extends ").append(compiledClass.parent.name);
    }
    if (stubsOnly) {
      sb.append(" (stubs only)");
    }
    sb.append('\n');
    for (CompiledClass.Property property : compiledClass.properties) {
      sb.append("  ").append(property.hidden() ? "hidden " : "").append(property.type());
      sb.append(' ').append(property.name());
      Object value = compiledClass.defaultObject.get(property.name());
      if (value != null) {
        sb.append(" = ").append(value instanceof String ? "\"" + value + "\"" : value);
      }
      sb.append('\n');
    }
    for (CompiledFunction function : compiledClass.functions) {
      sb.append('\n');
      appendFunction(sb, function, stubsOnly);
    }
    logger.atFine().log("Generated listing of %s (%d chars)", compiledClass.name, sb.length());
    return sb.toString();
  }

  private static void appendFunction(
      StringBuilder sb, CompiledFunction function, boolean stubsOnly) {
    sb.append(function.signature);
    if (function.overrides != null) {
      sb.append(" overrides ").append(function.overrides.name);
    }
    if (function.isStub) {
      sb.append(" (stub)");
    } else if (function.isSimpleStub) {
      sb.append(" (simple stub)");
    }
    sb.append('\n');
    appendTerms(sb, "params", function.parameters);
    if (!stubsOnly) {
      appendTerms(sb, "locals", function.locals);
      for (Map.Entry<String, String> entry : function.localDefaults.entrySet()) {
        sb.append("  default ").append(entry.getKey()).append(" = ").append(entry.getValue());
        sb.append('\n');
      }
    }
    appendStatements(sb, function.statements);
  }

  private static void appendTerms(StringBuilder sb, String label, List<Term> terms) {
    if (terms.isEmpty()) {
      return;
    }
    sb.append("  ").append(label).append(": ");
    Joiner.on(", ")
        .appendTo(
            sb,
            terms.stream()
                .map(t -> t.name() + "@" + t.storage() + (t.slot() >= 0 ? ":" + t.slot() : ""))
                .iterator());
    sb.append('\n');
  }

  static void appendStatements(StringBuilder sb, List<Statement> statements) {
    int n = statements.size();
    char[] marks = new char[n];
    Arrays.fill(marks, ' ');
    for (int i = 0; i < n; i++) {
      Statement s = statements.get(i);
      int target = s.isJump() ? s.target : -1;
      if (target >= 0 && target < n) {
        if (target <= i) {
          marks[target] = '=';
        } else if (marks[target] == ' ') {
          marks[target] = '-';
        }
      }
    }
    String format = "%" + Integer.toString(Math.max(n - 1, 0)).length() + "d";
    for (int i = 0; i < n; i++) {
      sb.append(' ').append(marks[i]).append(String.format(format, i)).append(": ");
      sb.append(statements.get(i)).append('\n');
    }
  }
}
