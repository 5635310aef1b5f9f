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

package org.irfuzz.fuzz;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.irfuzz.transform.FlattenConditionalBranch;
import org.irfuzz.transform.FlattenConditionalBranch.InstructionFreshIds;
import org.irfuzz.transform.InstructionDescriptor;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;

/** Flattens randomly chosen selection constructs. */
public class FlattenConditionalBranchesPass extends FuzzerPass {

  /** The number of overflow ids given to each flattening, for needs found while applying it. */
  static final int NUM_OVERFLOW_IDS = 10;

  public FlattenConditionalBranchesPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    super(ir, transformationContext, fuzzerContext, transformations);
  }

  @Override
  public void apply() {
    // Flattening restructures the function, so choose the headers first.
    List<Integer> headers = new ArrayList<>();
    for (Function function : ir.module().functions()) {
      for (Block block : function.blocks()) {
        if (fuzzerContext.choosePercentage(fuzzerContext.chanceOfFlatteningConditionalBranch())
            && block.isSelectionHeader()
            && block.terminator().opcode() == Opcode.BRANCH_CONDITIONAL) {
          headers.add(block.id());
        }
      }
    }

    for (int headerId : headers) {
      Block header = ir.block(headerId);
      if (header == null
          || !header.isSelectionHeader()
          || header.terminator().opcode() != Opcode.BRANCH_CONDITIONAL) {
        continue;
      }
      List<Instruction> instructionsThatNeedIds = new ArrayList<>();
      if (!FlattenConditionalBranch.conditionalCanBeFlattened(
          ir, header, instructionsThatNeedIds)) {
        continue;
      }
      ImmutableList.Builder<InstructionFreshIds> freshIds = ImmutableList.builder();
      for (Instruction instruction : instructionsThatNeedIds) {
        int needed = FlattenConditionalBranch.numFreshIdsNeededByInstruction(ir, instruction);
        freshIds.add(
            new InstructionFreshIds(
                InstructionDescriptor.of(ir.defUse().blockOf(instruction), instruction),
                fuzzerContext.freshIds(needed)));
      }
      maybeApplyTransformation(
          new FlattenConditionalBranch(
              headerId, freshIds.build(), fuzzerContext.freshIds(NUM_OVERFLOW_IDS)));
    }
  }
}
