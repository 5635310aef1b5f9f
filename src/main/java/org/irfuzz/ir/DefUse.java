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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Def-use analysis: which instruction, block or function defines each id, where each instruction
 * lives, and every use of every id. Computed from a snapshot of the module; see {@link
 * IrContext#invalidateAnalyses}.
 */
public final class DefUse {

  /** One use of an id: the operand at {@code operandIndex} of {@code user}. */
  public record Use(Instruction user, int operandIndex) {}

  private final Map<Integer, Instruction> defs = new HashMap<>();
  private final Map<Integer, Block> blocks = new HashMap<>();
  private final Map<Integer, Function> functions = new HashMap<>();
  private final Map<Integer, Function> blockFunctions = new HashMap<>();
  private final Map<Instruction, Block> instructionBlocks = new IdentityHashMap<>();
  private final Map<Instruction, Function> instructionFunctions = new IdentityHashMap<>();
  private final Map<Integer, List<Use>> uses = new HashMap<>();

  DefUse(Module module) {
    for (Instruction global : module.globals()) {
      define(global);
    }
    for (Function function : module.functions()) {
      functions.put(function.id(), function);
      for (Instruction param : function.params()) {
        define(param);
        instructionFunctions.put(param, function);
      }
      for (Block block : function.blocks()) {
        blocks.put(block.id(), block);
        blockFunctions.put(block.id(), function);
        for (Instruction instruction : block.instructions()) {
          define(instruction);
          instructionBlocks.put(instruction, block);
          instructionFunctions.put(instruction, function);
        }
      }
    }
  }

  private void define(Instruction instruction) {
    if (instruction.hasResultId()) {
      defs.put(instruction.resultId(), instruction);
    }
    for (int i = 0; i < instruction.numOperands(); i++) {
      if (instruction.operand(i).isId()) {
        uses.computeIfAbsent(instruction.idOperand(i), k -> new ArrayList<>())
            .add(new Use(instruction, i));
      }
    }
  }

  /** True if {@code id} is the result of an instruction, the label of a block, or a function. */
  public boolean isDefined(int id) {
    return defs.containsKey(id) || blocks.containsKey(id) || functions.containsKey(id);
  }

  /** The instruction whose result is {@code id}, or null. */
  public @Nullable Instruction def(int id) {
    return defs.get(id);
  }

  public @Nullable Block block(int id) {
    return blocks.get(id);
  }

  public @Nullable Function function(int id) {
    return functions.get(id);
  }

  /** The function containing the given block, or null if there is no such block. */
  public @Nullable Function functionOfBlock(int blockId) {
    return blockFunctions.get(blockId);
  }

  /** The block containing {@code instruction}, or null for globals and parameters. */
  public @Nullable Block blockOf(Instruction instruction) {
    return instructionBlocks.get(instruction);
  }

  /** The function containing {@code instruction} (a parameter or block instruction), or null. */
  public @Nullable Function functionOf(Instruction instruction) {
    return instructionFunctions.get(instruction);
  }

  /** True if {@code instruction} is a global declaration. */
  public boolean isGlobal(Instruction instruction) {
    return instruction.hasResultId()
        && defs.get(instruction.resultId()) == instruction
        && !instructionFunctions.containsKey(instruction);
  }

  /** All uses of {@code id}, in module order. */
  public ImmutableList<Use> uses(int id) {
    List<Use> result = uses.get(id);
    return (result == null) ? ImmutableList.of() : ImmutableList.copyOf(result);
  }
}
