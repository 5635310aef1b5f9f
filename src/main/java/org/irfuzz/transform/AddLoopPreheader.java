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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.irfuzz.fact.Fact;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.DominatorTree;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Operand;

/**
 * Gives a loop header a preheader: a new block, laid out just before the header, that becomes the
 * header's only predecessor from outside the loop.
 *
 * <p>Every predecessor of the header that the header does not dominate is redirected to the
 * preheader, which branches unconditionally to the header. A header that named such a
 * predecessor in a value merge now names the preheader instead. If there was more than one such
 * predecessor, each value merge of the header is split in two: a new merge in the preheader
 * (with result id taken from {@code phiIds}, in order) combines the values from outside the
 * loop, and the header's merge takes that result from the preheader. Any merge instruction that
 * named the header as its merge block names the preheader instead.
 */
public final class AddLoopPreheader implements Transformation {

  private final int loopHeaderBlockId;
  private final int freshId;
  private final ImmutableList<Integer> phiIds;

  public AddLoopPreheader(int loopHeaderBlockId, int freshId, List<Integer> phiIds) {
    this.loopHeaderBlockId = loopHeaderBlockId;
    this.freshId = freshId;
    this.phiIds = ImmutableList.copyOf(phiIds);
  }

  static AddLoopPreheader fromMessage(TransformationMessage.Reader reader) {
    int loopHeaderBlockId = reader.next();
    int freshId = reader.next();
    return new AddLoopPreheader(loopHeaderBlockId, freshId, reader.nextList());
  }

  public int loopHeaderBlockId() {
    return loopHeaderBlockId;
  }

  public int freshId() {
    return freshId;
  }

  public ImmutableList<Integer> phiIds() {
    return phiIds;
  }

  /**
   * The predecessors of {@code header} that it does not dominate, in predecessor order. For a
   * reachable loop header these are the ways into the loop.
   */
  static ImmutableList<Integer> outOfLoopPredecessors(IrContext ir, Block header) {
    int functionId = ir.functionOfBlock(header.id()).id();
    DominatorTree doms = ir.dominators(functionId);
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int pred : ir.cfg(functionId).predecessors(header.id())) {
      if (!doms.dominates(header.id(), pred)) {
        result.add(pred);
      }
    }
    return result.build();
  }

  /**
   * The number of value-merge ids that adding a preheader to {@code header} needs: one per value
   * merge if the loop has more than one way in, none otherwise.
   */
  public static int numPhiIdsNeeded(IrContext ir, Block header) {
    return (outOfLoopPredecessors(ir, header).size() > 1) ? header.phis().size() : 0;
  }

  /**
   * Returns the preheader of the loop headed by {@code header}, or 0 if it has none. A preheader
   * is the only predecessor from outside the loop; it ends in an unconditional branch and is not
   * a loop header itself.
   */
  public static int maybeFindLoopPreheader(IrContext ir, Block header) {
    ImmutableList<Integer> outside = outOfLoopPredecessors(ir, header);
    if (outside.size() != 1) {
      return 0;
    }
    Block pred = ir.block(outside.get(0));
    Instruction terminator = pred.terminator();
    return (terminator != null && terminator.opcode() == Opcode.BRANCH && !pred.isLoopHeader())
        ? pred.id()
        : 0;
  }

  @Override
  public boolean isApplicable(IrContext ir, TransformationContext context) {
    Block header = ir.block(loopHeaderBlockId);
    if (header == null || !header.isLoopHeader()) {
      return false;
    }
    Function function = ir.functionOfBlock(loopHeaderBlockId);
    if (function.entry() == header || !ir.cfg(function.id()).isReachable(loopHeaderBlockId)) {
      return false;
    }
    Set<Integer> usedIds = new HashSet<>();
    if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(freshId, ir, usedIds)) {
      return false;
    }
    for (int id : phiIds) {
      if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(id, ir, usedIds)) {
        return false;
      }
    }
    if (outOfLoopPredecessors(ir, header).isEmpty()
        || phiIds.size() < numPhiIdsNeeded(ir, header)) {
      return false;
    }
    DominatorTree doms = ir.dominators(function.id());
    for (Block block : function.blocks()) {
      if (block == header) {
        continue;
      }
      // Only the header's own loop may continue at it, and no construct inside the loop may
      // merge at it.
      if (block.continueTargetId() == loopHeaderBlockId) {
        return false;
      }
      if (block.mergeBlockId() == loopHeaderBlockId
          && doms.dominates(loopHeaderBlockId, block.id())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void apply(IrContext ir, TransformationContext context) {
    Block header = ir.block(loopHeaderBlockId);
    Function function = ir.functionOfBlock(loopHeaderBlockId);
    ImmutableList<Integer> outside = outOfLoopPredecessors(ir, header);
    Block preheader = new Block(freshId);

    if (outside.size() == 1) {
      for (Instruction phi : header.phis()) {
        Function.replacePhiPredecessor(phi, outside.get(0), freshId);
      }
    } else {
      ImmutableList<Instruction> phis = header.phis();
      for (int i = 0; i < phis.size(); i++) {
        Instruction phi = phis.get(i);
        int newPhiId = phiIds.get(i);
        List<Operand> fromOutside = new ArrayList<>();
        List<Operand> remaining = new ArrayList<>();
        remaining.add(Operand.id(newPhiId));
        remaining.add(Operand.id(freshId));
        for (int j = 0; j < phi.numOperands(); j += 2) {
          List<Operand> target = outside.contains(phi.idOperand(j + 1)) ? fromOutside : remaining;
          target.add(phi.operand(j));
          target.add(phi.operand(j + 1));
        }
        preheader.add(new Instruction(Opcode.PHI, phi.typeId(), newPhiId, fromOutside));
        phi.setOperands(remaining);
        ir.updateIdBound(newPhiId);
      }
    }
    preheader.add(Instruction.withIds(Opcode.BRANCH, 0, 0, loopHeaderBlockId));

    for (int predId : outside) {
      Instruction terminator = ir.block(predId).terminator();
      for (int i = 0; i < terminator.numOperands(); i++) {
        if (terminator.opcode().isLabelOperand(i)
            && terminator.idOperand(i) == loopHeaderBlockId) {
          terminator.setIdOperand(i, freshId);
        }
      }
    }
    for (Block block : function.blocks()) {
      if (block != header && block.mergeBlockId() == loopHeaderBlockId) {
        block.mergeInstruction().setIdOperand(0, freshId);
      }
    }
    function.insertBlockBefore(preheader, header);
    FuzzerUtil.updateModuleIdBound(ir, freshId);
    ir.invalidateAnalyses();

    // The preheader only runs on the way to the header.
    if (context.factManager().blockIsDead(loopHeaderBlockId)) {
      context.factManager().addFact(new Fact.BlockIsDead(freshId));
    }
  }

  @Override
  public TransformationMessage toMessage() {
    return new TransformationMessage.Writer(TransformationKind.ADD_LOOP_PREHEADER)
        .add(loopHeaderBlockId)
        .add(freshId)
        .addList(phiIds)
        .build();
  }

  @Override
  public String toString() {
    return toMessage().toString();
  }
}
