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

package org.irfuzz.transform;

import com.google.common.base.Preconditions;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.jspecify.annotations.Nullable;

/**
 * Locates an instruction without relying on it having a result id: starting at the instruction
 * whose result is {@code baseInstructionResultId} (or at the start of the block with that label),
 * skip {@code numOpcodesToIgnore} instructions with opcode {@code targetOpcode} and take the next
 * one. Only instructions in the same block are considered.
 */
public record InstructionDescriptor(
    int baseInstructionResultId, Opcode targetOpcode, int numOpcodesToIgnore) {

  /** Returns the instruction this descriptor refers to, or null if there is none. */
  public @Nullable Instruction find(IrContext ir) {
    for (Function function : ir.module().functions()) {
      for (Block block : function.blocks()) {
        boolean foundBase = block.id() == baseInstructionResultId;
        int numIgnored = 0;
        for (Instruction instruction : block.instructions()) {
          if (instruction.hasResultId() && instruction.resultId() == baseInstructionResultId) {
            foundBase = true;
          }
          if (foundBase && instruction.opcode() == targetOpcode) {
            if (numIgnored == numOpcodesToIgnore) {
              return instruction;
            }
            numIgnored++;
          }
        }
        if (foundBase) {
          return null;
        }
      }
    }
    return null;
  }

  /** Returns a descriptor for {@code instruction}, which must be in {@code block}. */
  public static InstructionDescriptor of(Block block, Instruction instruction) {
    int index = block.indexOf(instruction);
    Preconditions.checkArgument(index >= 0, "%s is not in %s", instruction, block);
    if (instruction.hasResultId()) {
      return new InstructionDescriptor(instruction.resultId(), instruction.opcode(), 0);
    }
    int skipped = 0;
    for (int i = index - 1; i >= 0; i--) {
      Instruction candidate = block.get(i);
      if (candidate.opcode() == instruction.opcode()) {
        skipped++;
      }
      if (candidate.hasResultId()) {
        return new InstructionDescriptor(candidate.resultId(), instruction.opcode(), skipped);
      }
    }
    return new InstructionDescriptor(block.id(), instruction.opcode(), skipped);
  }
}
