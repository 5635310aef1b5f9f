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
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.irfuzz.fact.Fact;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Cfg;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Operand;

/**
 * Turns a selection construct into straight-line code: both arms are laid out one after the
 * other and always executed, and each value merge at the point where the arms converge becomes a
 * {@link Opcode#SELECT} on the original condition.
 *
 * <p>Instructions with side effects in either arm are each wrapped in a new selection construct on
 * the original condition, so that they still only execute on their original path. If such an
 * instruction has a (non-void) result, the new construct gets a second block that provides an
 * {@link Opcode#UNDEF} placeholder, and a value merge restores the original result id. Wrapping
 * needs 2 fresh ids per instruction, or 5 if it has a non-void result; they come from the
 * per-instruction lists or, for instructions without a list, from {@code overflowIds}.
 */
public final class FlattenConditionalBranch implements Transformation {

  /** The fresh ids to use when wrapping the instruction described by {@code instruction}. */
  public record InstructionFreshIds(
      InstructionDescriptor instruction, ImmutableList<Integer> freshIds) {}

  private final int headerBlockId;
  private final ImmutableList<InstructionFreshIds> instructionsToFreshIds;
  private final ImmutableList<Integer> overflowIds;

  public FlattenConditionalBranch(
      int headerBlockId,
      List<InstructionFreshIds> instructionsToFreshIds,
      List<Integer> overflowIds) {
    this.headerBlockId = headerBlockId;
    this.instructionsToFreshIds = ImmutableList.copyOf(instructionsToFreshIds);
    this.overflowIds = ImmutableList.copyOf(overflowIds);
  }

  static FlattenConditionalBranch fromMessage(TransformationMessage.Reader reader) {
    int headerBlockId = reader.next();
    int numEntries = reader.nextLength(4);
    ImmutableList.Builder<InstructionFreshIds> entries = ImmutableList.builder();
    for (int i = 0; i < numEntries; i++) {
      InstructionDescriptor instruction = reader.nextInstructionDescriptor();
      entries.add(new InstructionFreshIds(instruction, reader.nextList()));
    }
    return new FlattenConditionalBranch(headerBlockId, entries.build(), reader.nextList());
  }

  @Override
  public boolean isApplicable(IrContext ir, TransformationContext context) {
    Block header = ir.block(headerBlockId);
    if (header == null
        || !header.isSelectionHeader()
        || header.terminator().opcode() != Opcode.BRANCH_CONDITIONAL) {
      return false;
    }
    List<Instruction> instructionsThatNeedIds = new ArrayList<>();
    if (!conditionalCanBeFlattened(ir, header, instructionsThatNeedIds)) {
      return false;
    }

    Set<Integer> usedFreshIds = new HashSet<>();
    for (int id : overflowIds) {
      if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(id, ir, usedFreshIds)) {
        return false;
      }
    }
    for (InstructionFreshIds entry : instructionsToFreshIds) {
      for (int id : entry.freshIds()) {
        if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(id, ir, usedFreshIds)) {
          return false;
        }
      }
    }

    Map<Instruction, ImmutableList<Integer>> freshIdsByInstruction =
        instructionsToFreshIdsMapping(ir);
    int remainingOverflowIds = overflowIds.size();
    for (Instruction instruction : instructionsThatNeedIds) {
      int needed = numFreshIdsNeededByInstruction(ir, instruction);
      ImmutableList<Integer> freshIds = freshIdsByInstruction.get(instruction);
      if (freshIds != null && !freshIds.isEmpty()) {
        if (freshIds.size() < needed) {
          return false;
        }
      } else {
        remainingOverflowIds -= needed;
        if (remainingOverflowIds < 0) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public void apply(IrContext ir, TransformationContext context) {
    Block header = ir.block(headerBlockId);
    Function function = ir.functionOfBlock(headerBlockId);
    int convergenceBlockId = convergenceBlockId(ir.cfg(function.id()), header);
    Map<Instruction, ImmutableList<Integer>> freshIdsByInstruction =
        instructionsToFreshIdsMapping(ir);
    List<Instruction> instructionsThatNeedIds = new ArrayList<>();
    conditionalCanBeFlattened(ir, header, instructionsThatNeedIds);
    Map<Instruction, Integer> numIdsNeeded = new IdentityHashMap<>();
    for (Instruction instruction : instructionsThatNeedIds) {
      numIdsNeeded.put(instruction, numFreshIdsNeededByInstruction(ir, instruction));
    }
    Iterator<Integer> overflow = overflowIds.iterator();
    Set<Integer> deadBlocks = new HashSet<>(context.factManager().deadBlocks());
    List<Integer> newDeadBlocks = new ArrayList<>();

    Instruction branch = header.terminator();
    int conditionId = branch.idOperand(0);
    int firstTrueBlockId = branch.idOperand(1);
    int firstFalseBlockId = branch.idOperand(2);
    Block lastTrueBlock = null;

    // The false arm is laid out first so that the true arm ends up immediately after the header.
    for (int arm = 2; arm >= 1; arm--) {
      Block block = header;
      int blockId = branch.idOperand(arm);
      while (blockId != convergenceBlockId) {
        function.moveBlockAfter(blockId, block);
        block = function.findBlock(blockId);
        blockId = block.terminator().idOperand(0);
        List<Instruction> problematic = new ArrayList<>();
        for (Instruction instruction : block.instructions()) {
          if (!instruction.opcode().isTerminator()
              && !FuzzerUtil.instructionHasNoSideEffects(instruction)) {
            problematic.add(instruction);
          }
        }
        for (Instruction instruction : problematic) {
          int needed = numIdsNeeded.get(instruction);
          List<Integer> freshIds = freshIdsByInstruction.get(instruction);
          if (freshIds == null || freshIds.isEmpty()) {
            freshIds = new ArrayList<>();
            for (int i = 0; i < needed; i++) {
              freshIds.add(overflow.next());
            }
          }
          block =
              encloseInstructionInConditional(
                  ir,
                  function,
                  block,
                  instruction,
                  freshIds,
                  needed,
                  conditionId,
                  arm == 1,
                  deadBlocks,
                  newDeadBlocks);
        }
        if (blockId == convergenceBlockId && arm == 1) {
          lastTrueBlock = block;
        }
      }
    }

    int afterHeader =
        (firstTrueBlockId != convergenceBlockId) ? firstTrueBlockId : firstFalseBlockId;
    Instruction merge = header.mergeInstruction();
    header.remove(branch);
    header.remove(merge);
    header.add(Instruction.withIds(Opcode.BRANCH, 0, 0, afterHeader));

    if (lastTrueBlock != null) {
      lastTrueBlock.terminator().setIdOperand(0, firstFalseBlockId);
      if (firstFalseBlockId != convergenceBlockId) {
        int lastTrueBlockId = lastTrueBlock.id();
        function
            .findBlock(firstFalseBlockId)
            .phis()
            .forEach(phi -> Function.replacePhiPredecessor(phi, headerBlockId, lastTrueBlockId));
      }
    }

    // Each value merge at the convergence block has one pair from each arm; the pair from the
    // true arm is the one whose predecessor is the end of the true arm (or the header itself).
    int truePredId = (lastTrueBlock != null) ? lastTrueBlock.id() : headerBlockId;
    for (Instruction phi : function.findBlock(convergenceBlockId).phis()) {
      int trueIndex = (phi.idOperand(1) == truePredId) ? 0 : 2;
      int trueValue = phi.idOperand(trueIndex);
      int falseValue = phi.idOperand(2 - trueIndex);
      phi.setOpcode(Opcode.SELECT);
      phi.setOperands(
          ImmutableList.of(Operand.id(conditionId), Operand.id(trueValue), Operand.id(falseValue)));
    }

    ir.invalidateAnalyses();
    for (int blockId : newDeadBlocks) {
      context.factManager().addFact(new Fact.BlockIsDead(blockId));
    }
  }

  /**
   * Splits {@code block} around {@code instruction} and wraps the instruction in a selection
   * construct on {@code conditionId}. Returns the merge block of the new construct, which holds
   * the instructions that followed {@code instruction}.
   */
  private static Block encloseInstructionInConditional(
      IrContext ir,
      Function function,
      Block block,
      Instruction instruction,
      List<Integer> freshIds,
      int numIdsNeeded,
      int conditionId,
      boolean executeIfConditionTrue,
      Set<Integer> deadBlocks,
      List<Integer> newDeadBlocks) {
    Preconditions.checkArgument(freshIds.size() >= numIdsNeeded, "Not enough fresh ids");
    for (int id : freshIds) {
      FuzzerUtil.updateModuleIdBound(ir, id);
    }
    boolean dead = deadBlocks.contains(block.id());

    Block executeBlock = function.splitBlock(block, block.indexOf(instruction), freshIds.get(0));
    Block mergeBlock = function.splitBlock(executeBlock, 1, freshIds.get(1));
    executeBlock.add(Instruction.withIds(Opcode.BRANCH, 0, 0, mergeBlock.id()));
    if (dead) {
      markDead(executeBlock, deadBlocks, newDeadBlocks);
      markDead(mergeBlock, deadBlocks, newDeadBlocks);
    }

    Block alternativeBlock = mergeBlock;
    if (numIdsNeeded == 5) {
      alternativeBlock = new Block(freshIds.get(2));
      int originalResultId = instruction.resultId();
      instruction.setResultId(freshIds.get(3));
      alternativeBlock.add(Instruction.of(Opcode.UNDEF, instruction.typeId(), freshIds.get(4)));
      alternativeBlock.add(Instruction.withIds(Opcode.BRANCH, 0, 0, mergeBlock.id()));
      function.insertBlockBefore(alternativeBlock, mergeBlock);
      mergeBlock.insert(
          0,
          Instruction.withIds(
              Opcode.PHI,
              instruction.typeId(),
              originalResultId,
              instruction.resultId(),
              executeBlock.id(),
              freshIds.get(4),
              alternativeBlock.id()));
      if (dead) {
        markDead(alternativeBlock, deadBlocks, newDeadBlocks);
      }
    }

    int ifBlockId = (executeIfConditionTrue ? executeBlock : alternativeBlock).id();
    int elseBlockId = (executeIfConditionTrue ? alternativeBlock : executeBlock).id();
    block.add(
        Instruction.of(Opcode.SELECTION_MERGE, Operand.id(mergeBlock.id()), Operand.literal(0)));
    block.add(
        Instruction.withIds(Opcode.BRANCH_CONDITIONAL, 0, 0, conditionId, ifBlockId, elseBlockId));
    return mergeBlock;
  }

  private static void markDead(Block block, Set<Integer> deadBlocks, List<Integer> newDeadBlocks) {
    deadBlocks.add(block.id());
    newDeadBlocks.add(block.id());
  }

  /**
   * Returns the block where the two arms of {@code header} converge: the first block, walking
   * back from the merge block through blocks with a single predecessor, that does not have a
   * single predecessor. Returns 0 if the walk reaches the header.
   */
  static int convergenceBlockId(Cfg cfg, Block header) {
    int convergenceBlockId = header.mergeBlockId();
    Set<Integer> seen = new HashSet<>();
    while (cfg.predecessors(convergenceBlockId).size() == 1) {
      if (convergenceBlockId == header.id() || !seen.add(convergenceBlockId)) {
        return 0;
      }
      convergenceBlockId = cfg.predecessors(convergenceBlockId).get(0);
    }
    return (convergenceBlockId == header.id()) ? 0 : convergenceBlockId;
  }

  /**
   * Returns true if the selection construct headed by {@code header} could be flattened given
   * enough fresh ids: its arms form a single-entry, single-exit region of blocks with no nested
   * constructs, each ending in an unconditional branch, and every instruction in them can be
   * handled. Appends the instructions that will need fresh ids, in layout order of each arm, to
   * {@code instructionsThatNeedIds}.
   */
  public static boolean conditionalCanBeFlattened(
      IrContext ir, Block header, List<Instruction> instructionsThatNeedIds) {
    Preconditions.checkArgument(
        header.isSelectionHeader() && header.terminator().opcode() == Opcode.BRANCH_CONDITIONAL,
        "%s is not the header of a conditional",
        header);
    int functionId = ir.functionOfBlock(header.id()).id();
    Cfg cfg = ir.cfg(functionId);
    int convergenceBlockId = convergenceBlockId(cfg, header);
    if (convergenceBlockId == 0
        || !ir.dominators(functionId).dominates(header.id(), convergenceBlockId)
        || !ir.postDominators(functionId).dominates(convergenceBlockId, header.id())) {
      return false;
    }

    Set<Integer> region = new HashSet<>();
    Deque<Integer> toCheck = new ArrayDeque<>(header.successorIds());
    while (!toCheck.isEmpty()) {
      int blockId = toCheck.removeFirst();
      if (blockId == convergenceBlockId || !region.add(blockId)) {
        continue;
      }
      Block block = ir.block(blockId);
      if (block == null || block.mergeInstruction() != null) {
        return false;
      }
      for (Instruction instruction : block.instructions()) {
        if (instruction.opcode().isTerminator()) {
          if (instruction.opcode() != Opcode.BRANCH) {
            return false;
          }
        } else if (!instructionCanBeHandled(ir, instruction)) {
          return false;
        } else if (!FuzzerUtil.instructionHasNoSideEffects(instruction)) {
          instructionsThatNeedIds.add(instruction);
        }
      }
      toCheck.addLast(block.terminator().idOperand(0));
    }

    // The arms must be the only way into the convergence block.
    for (int pred : cfg.predecessors(convergenceBlockId)) {
      if (pred != header.id() && !region.contains(pred)) {
        return false;
      }
    }
    return true;
  }

  /** The number of fresh ids needed to wrap {@code instruction}: 5 if it has a non-void result. */
  public static int numFreshIdsNeededByInstruction(IrContext ir, Instruction instruction) {
    return (instruction.hasResultId() && !ir.types().isVoid(instruction.typeId())) ? 5 : 2;
  }

  /**
   * True if {@code instruction} has no side effects, or can be wrapped in a conditional. Barriers,
   * instructions that must stay in the same block as their uses, and void-typed instructions whose
   * result is used cannot.
   */
  static boolean instructionCanBeHandled(IrContext ir, Instruction instruction) {
    if (FuzzerUtil.instructionHasNoSideEffects(instruction)) {
      return true;
    }
    Opcode opcode = instruction.opcode();
    if (opcode.isBarrier() || opcode == Opcode.SAMPLED_IMAGE) {
      return false;
    }
    return !(instruction.hasResultId()
        && ir.types().isVoid(instruction.typeId())
        && !ir.defUse().uses(instruction.resultId()).isEmpty());
  }

  private Map<Instruction, ImmutableList<Integer>> instructionsToFreshIdsMapping(IrContext ir) {
    Map<Instruction, ImmutableList<Integer>> result = new IdentityHashMap<>();
    for (InstructionFreshIds entry : instructionsToFreshIds) {
      Instruction instruction = entry.instruction().find(ir);
      if (instruction != null) {
        result.put(instruction, entry.freshIds());
      }
    }
    return result;
  }

  @Override
  public TransformationMessage toMessage() {
    TransformationMessage.Writer writer =
        new TransformationMessage.Writer(TransformationKind.FLATTEN_CONDITIONAL_BRANCH)
            .add(headerBlockId)
            .add(instructionsToFreshIds.size());
    for (InstructionFreshIds entry : instructionsToFreshIds) {
      writer.add(entry.instruction()).addList(entry.freshIds());
    }
    return writer.addList(overflowIds).build();
  }

  @Override
  public String toString() {
    return toMessage().toString();
  }
}
