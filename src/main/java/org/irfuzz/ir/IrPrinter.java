/*
 * Copyright 2025 The Irfuzz Authors
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

package org.irfuzz.ir;

/**
 * Renders a module as text, one instruction per line:
 *
 * <pre>
 * %1 = TYPE_VOID
 * FUNCTION %3 %1 %2
 * %4:
 *   RETURN
 * END
 * </pre>
 *
 * <p>Two modules print identically if and only if they have the same globals, functions, blocks
 * and instructions in the same order.
 */
public class IrPrinter {

  private IrPrinter() {}

  public static String print(Module module) {
    StringBuilder sb = new StringBuilder();
    for (Instruction global : module.globals()) {
      sb.append(global).append('\n');
    }
    for (Function function : module.functions()) {
      print(function, sb);
    }
    return sb.toString();
  }

  public static String print(Function function) {
    StringBuilder sb = new StringBuilder();
    print(function, sb);
    return sb.toString();
  }

  private static void print(Function function, StringBuilder sb) {
    sb.append("FUNCTION %")
        .append(function.id())
        .append(" %")
        .append(function.returnTypeId())
        .append(" %")
        .append(function.functionTypeId())
        .append('\n');
    for (Instruction param : function.params()) {
      sb.append("  ").append(param).append('\n');
    }
    for (Block block : function.blocks()) {
      sb.append(block).append(":\n");
      for (Instruction instruction : block.instructions()) {
        sb.append("  ").append(instruction).append('\n');
      }
    }
    sb.append("END\n");
  }
}
