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

import org.irfuzz.ir.Block;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.jspecify.annotations.Nullable;

/**
 * Locates one use of an id: operand {@code operandIndex} of the instruction described by {@code
 * enclosingInstruction}, which must currently refer to {@code idOfInterest}.
 */
public record IdUseDescriptor(
    int idOfInterest, InstructionDescriptor enclosingInstruction, int operandIndex) {

  /** Returns the instruction containing the use, or null if the use cannot be found. */
  public @Nullable Instruction findContainingInstruction(IrContext ir) {
    Instruction instruction = enclosingInstruction.find(ir);
    if (instruction == null
        || operandIndex < 0
        || operandIndex >= instruction.numOperands()
        || !instruction.operand(operandIndex).isId()
        || instruction.idOperand(operandIndex) != idOfInterest) {
      return null;
    }
    return instruction;
  }

  /** Describes the use of an id at operand {@code operandIndex} of {@code instruction}. */
  public static IdUseDescriptor of(Block block, Instruction instruction, int operandIndex) {
    return new IdUseDescriptor(
        instruction.idOperand(operandIndex),
        InstructionDescriptor.of(block, instruction),
        operandIndex);
  }
}
