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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Cfg;
import org.irfuzz.ir.DefUse;
import org.irfuzz.ir.DominatorTree;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Operand;
import org.irfuzz.ir.StructuredCfg;
import org.jspecify.annotations.Nullable;

/**
 * Gives a function a single return, at the end of a new block {@code outerReturnId}.
 *
 * <p>The body of the function is wrapped in a new loop that executes once: the header {@code
 * outerHeaderId} is laid out after the entry block, and its merge block is {@code outerReturnId}.
 * Each reachable return becomes a branch to the merge block of its innermost loop (which is now
 * always defined). Each such loop merge block gets value merges recording whether the function is
 * returning ({@link ReturnMergingInfo#isReturningId}) and, for a non-void function, the value
 * being returned ({@link ReturnMergingInfo#maybeReturnValId}); when the function is returning it
 * branches on to the merge block of the enclosing loop instead of continuing. Existing value
 * merges in those blocks take a suitable placeholder value on their new incoming edges.
 *
 * <p>Merge blocks without a {@link ReturnMergingInfo} take their fresh ids from the overflow id
 * source, in the order they are processed.
 */
public final class MergeFunctionReturns implements Transformation {

  private final int functionId;
  private final int outerHeaderId;
  private final int outerReturnId;
  private final int returnValId;
  private final int anyReturnableValId;
  private final ImmutableList<ReturnMergingInfo> returnMergingInfo;

  public MergeFunctionReturns(
      int functionId,
      int outerHeaderId,
      int outerReturnId,
      int returnValId,
      int anyReturnableValId,
      List<ReturnMergingInfo> returnMergingInfo) {
    this.functionId = functionId;
    this.outerHeaderId = outerHeaderId;
    this.outerReturnId = outerReturnId;
    this.returnValId = returnValId;
    this.anyReturnableValId = anyReturnableValId;
    this.returnMergingInfo = ImmutableList.copyOf(returnMergingInfo);
  }

  static MergeFunctionReturns fromMessage(TransformationMessage.Reader reader) {
    int functionId = reader.next();
    int outerHeaderId = reader.next();
    int outerReturnId = reader.next();
    int returnValId = reader.next();
    int anyReturnableValId = reader.next();
    int numInfos = reader.nextLength(4);
    ImmutableList.Builder<ReturnMergingInfo> infos = ImmutableList.builder();
    for (int i = 0; i < numInfos; i++) {
      int mergeBlockId = reader.next();
      int isReturningId = reader.next();
      int maybeReturnValId = reader.next();
      int mapSize = reader.nextLength(2);
      ImmutableMap.Builder<Integer, Integer> map = ImmutableMap.builder();
      for (int j = 0; j < mapSize; j++) {
        map.put(reader.next(), reader.next());
      }
      infos.add(
          new ReturnMergingInfo(
              mergeBlockId, isReturningId, maybeReturnValId, map.buildKeepingLast()));
    }
    return new MergeFunctionReturns(
        functionId, outerHeaderId, outerReturnId, returnValId, anyReturnableValId, infos.build());
  }

  /**
   * The merge blocks of the loops that contain a reachable return of {@code function}, including
   * the merge blocks of the loops enclosing those loops, ordered innermost first (by decreasing
   * loop nesting depth, then by id).
   */
  public static ImmutableList<Integer> relevantMergeBlocks(IrContext ir, Function function) {
    StructuredCfg structured = ir.structuredCfg();
    Set<Integer> result = new LinkedHashSet<>();
    for (int returnBlock : ir.cfg(function.id()).reachableReturnBlocks()) {
      int merge = structured.loopMergeBlock(returnBlock);
      while (merge != 0 && result.add(merge)) {
        merge = structured.loopMergeBlock(merge);
      }
    }
    return result.stream()
        .sorted(
            Comparator.comparingInt((Integer b) -> -structured.loopNestingDepth(b))
                .thenComparingInt(b -> b))
        .collect(ImmutableList.toImmutableList());
  }

  /** Control-flow facts about the function, gathered before it is modified. */
  private record Plan(
      Function function,
      boolean isVoid,
      ImmutableList<Integer> returnBlocks,
      ImmutableList<Integer> mergeBlocks,
      Map<Integer, Integer> targets,
      Map<Integer, List<Integer>> returningPreds,
      Map<Integer, ImmutableList<Integer>> originalPreds) {

    List<Integer> newPreds(int mergeBlockId) {
      List<Integer> result = new ArrayList<>();
      for (int pred : returningPreds.getOrDefault(mergeBlockId, List.of())) {
        if (!originalPreds.get(mergeBlockId).contains(pred)) {
          result.add(pred);
        }
      }
      return result;
    }
  }

  private Plan plan(IrContext ir, Function function) {
    Cfg cfg = ir.cfg(function.id());
    StructuredCfg structured = ir.structuredCfg();
    ImmutableList<Integer> returnBlocks = cfg.reachableReturnBlocks();
    ImmutableList<Integer> mergeBlocks = relevantMergeBlocks(ir, function);
    // Where each return block, and each merge block when returning, will branch to: the merge
    // block of its innermost loop or, outside any loop, the outer return block.
    Map<Integer, Integer> targets = new HashMap<>();
    Map<Integer, List<Integer>> returningPreds = new LinkedHashMap<>();
    for (int block : Iterables.concat(returnBlocks, mergeBlocks)) {
      int merge = structured.loopMergeBlock(block);
      int target = (merge == 0) ? outerReturnId : merge;
      targets.put(block, target);
      returningPreds.computeIfAbsent(target, k -> new ArrayList<>()).add(block);
    }
    Map<Integer, ImmutableList<Integer>> originalPreds = new HashMap<>();
    for (int block : mergeBlocks) {
      originalPreds.put(block, cfg.predecessors(block));
    }
    return new Plan(
        function,
        ir.types().isVoid(function.returnTypeId()),
        returnBlocks,
        mergeBlocks,
        targets,
        returningPreds,
        originalPreds);
  }

  private Map<Integer, ReturnMergingInfo> infoByMergeBlock() {
    Map<Integer, ReturnMergingInfo> result = new HashMap<>();
    for (ReturnMergingInfo info : returnMergingInfo) {
      result.putIfAbsent(info.mergeBlockId(), info);
    }
    return result;
  }

  @Override
  public boolean isApplicable(IrContext ir, TransformationContext context) {
    Function function = ir.module().function(functionId);
    if (function == null || function.blocks().isEmpty()) {
      return false;
    }
    Block entry = function.entry();
    if (entry.terminator() == null
        || entry.terminator().opcode() != Opcode.BRANCH
        || entry.mergeInstruction() != null) {
      return false;
    }
    if (ir.cfg(functionId).reachableReturnBlocks().isEmpty()) {
      return false;
    }
    if (FuzzerUtil.maybeGetBoolConstant(ir, true) == 0
        || FuzzerUtil.maybeGetBoolConstant(ir, false) == 0) {
      return false;
    }
    Plan plan = plan(ir, function);

    Set<Integer> usedFreshIds = new HashSet<>();
    if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(outerHeaderId, ir, usedFreshIds)
        || !FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(
            outerReturnId, ir, usedFreshIds)) {
      return false;
    }
    if (!plan.isVoid()
        && !FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(
            returnValId, ir, usedFreshIds)) {
      return false;
    }

    Map<Integer, ReturnMergingInfo> infos = infoByMergeBlock();
    Cfg cfg = ir.cfg(functionId);
    for (int mergeBlockId : plan.mergeBlocks()) {
      Block mergeBlock = function.findBlock(mergeBlockId);
      if (mergeBlock == null || !cfg.isReachable(mergeBlockId)) {
        return false;
      }
      for (Instruction instruction : mergeBlock.instructions()) {
        if (instruction.opcode() != Opcode.PHI && instruction.opcode() != Opcode.BRANCH) {
          return false;
        }
      }
      ReturnMergingInfo info = infos.get(mergeBlockId);
      if (info == null) {
        if (!context.overflowIdSource().hasOverflowIds()) {
          return false;
        }
      } else if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(
              info.isReturningId(), ir, usedFreshIds)
          || (!plan.isVoid()
              && !FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(
                  info.maybeReturnValId(), ir, usedFreshIds))) {
        return false;
      }
      if (!plan.newPreds(mergeBlockId).isEmpty()) {
        for (Instruction phi : mergeBlock.phis()) {
          if (placeholderFor(ir, entry, phi, info) == 0) {
            return false;
          }
        }
      }
    }

    if (!plan.isVoid() && returnableValue(ir, function) == 0) {
      return false;
    }
    return newEdgesPreserveDominance(ir, plan);
  }

  /**
   * Each new edge into a merge block M must not make a definition that used to dominate M fail to
   * dominate a use that M dominates.
   */
  private static boolean newEdgesPreserveDominance(IrContext ir, Plan plan) {
    int fnId = plan.function().id();
    DominatorTree doms = ir.dominators(fnId);
    DefUse defUse = ir.defUse();
    for (int mergeBlockId : plan.mergeBlocks()) {
      List<Integer> newPreds = plan.newPreds(mergeBlockId);
      if (newPreds.isEmpty()) {
        continue;
      }
      for (int defBlockId : ir.cfg(fnId).reachableBlocks()) {
        if (!doms.strictlyDominates(defBlockId, mergeBlockId)
            || newPreds.stream().allMatch(p -> doms.dominates(defBlockId, p))) {
          continue;
        }
        for (Instruction def : ir.block(defBlockId).instructions()) {
          if (!def.hasResultId()) {
            continue;
          }
          for (DefUse.Use use : defUse.uses(def.resultId())) {
            Block useBlock =
                (use.user().opcode() == Opcode.PHI)
                    ? ir.block(use.user().idOperand(use.operandIndex() + 1))
                    : defUse.blockOf(use.user());
            if (useBlock != null && doms.dominates(mergeBlockId, useBlock.id())) {
              return false;
            }
          }
        }
      }
    }
    return true;
  }

  /**
   * The value to give {@code phi} on a new incoming edge: the id named by {@code info}, if it is
   * available at the end of the entry block and has the right type, or else the first id of the
   * right type that is a global, a parameter, or defined in the entry block. Returns 0 if there is
   * none.
   */
  private static int placeholderFor(
      IrContext ir, Block entry, Instruction phi, @Nullable ReturnMergingInfo info) {
    if (info != null) {
      Integer suitable = info.opPhiToSuitableId().get(phi.resultId());
      if (suitable != null) {
        Instruction def = ir.def(suitable);
        boolean ok =
            def != null
                && def.typeId() == phi.typeId()
                && FuzzerUtil.idIsAvailableBeforeInstruction(ir, entry.terminator(), suitable);
        return ok ? suitable : 0;
      }
    }
    return idAvailableAfterEntry(ir, entry, phi.typeId());
  }

  /**
   * Returns {@link #anyReturnableValId} if it is usable, any id of the return type available after
   * the entry block if it is 0 or undefined, or 0 if it is defined but has the wrong type or is not
   * available.
   */
  private int returnableValue(IrContext ir, Function function) {
    Instruction def = anyReturnableValId == 0 ? null : ir.def(anyReturnableValId);
    if (def == null) {
      return idAvailableAfterEntry(ir, function.entry(), function.returnTypeId());
    }
    boolean ok =
        def.typeId() == function.returnTypeId()
            && FuzzerUtil.idIsAvailableBeforeInstruction(
                ir, function.entry().terminator(), anyReturnableValId);
    return ok ? anyReturnableValId : 0;
  }

  private static int idAvailableAfterEntry(IrContext ir, Block entry, int typeId) {
    for (Instruction global : ir.module().globals()) {
      if (global.typeId() == typeId) {
        return global.resultId();
      }
    }
    for (Instruction param : ir.functionOfBlock(entry.id()).params()) {
      if (param.typeId() == typeId) {
        return param.resultId();
      }
    }
    for (Instruction instruction : entry.instructions()) {
      if (instruction.hasResultId() && instruction.typeId() == typeId) {
        return instruction.resultId();
      }
    }
    return 0;
  }

  @Override
  public void apply(IrContext ir, TransformationContext context) {
    Function function = ir.module().function(functionId);
    Block entry = function.entry();
    Plan plan = plan(ir, function);
    int trueId = FuzzerUtil.maybeGetBoolConstant(ir, true);
    int falseId = FuzzerUtil.maybeGetBoolConstant(ir, false);
    int boolTypeId = ir.types().boolTypeId();
    int returnableVal = plan.isVoid() ? 0 : returnableValue(ir, function);
    List<Integer> newIds = new ArrayList<>(List.of(outerHeaderId, outerReturnId));
    if (!plan.isVoid()) {
      newIds.add(returnValId);
    }

    // Fresh ids for each merge block, in processing order.
    Map<Integer, ReturnMergingInfo> infos = infoByMergeBlock();
    Map<Integer, Integer> isReturning = new HashMap<>();
    Map<Integer, Integer> maybeReturnVal = new HashMap<>();
    Map<Instruction, Integer> placeholders = new HashMap<>();
    for (int mergeBlockId : plan.mergeBlocks()) {
      ReturnMergingInfo info = infos.get(mergeBlockId);
      int isReturningId;
      int maybeReturnValId = 0;
      if (info != null) {
        isReturningId = info.isReturningId();
        maybeReturnValId = plan.isVoid() ? 0 : info.maybeReturnValId();
      } else {
        isReturningId = context.overflowIdSource().getNextOverflowId();
        if (!plan.isVoid()) {
          maybeReturnValId = context.overflowIdSource().getNextOverflowId();
        }
      }
      isReturning.put(mergeBlockId, isReturningId);
      newIds.add(isReturningId);
      if (!plan.isVoid()) {
        maybeReturnVal.put(mergeBlockId, maybeReturnValId);
        newIds.add(maybeReturnValId);
      }
      if (!plan.newPreds(mergeBlockId).isEmpty()) {
        for (Instruction phi : function.findBlock(mergeBlockId).phis()) {
          placeholders.put(phi, placeholderFor(ir, entry, phi, info));
        }
      }
    }

    // The value returned by each return block.
    Map<Integer, Integer> returnedValue = new HashMap<>();
    for (int returnBlockId : plan.returnBlocks()) {
      Block block = function.findBlock(returnBlockId);
      Instruction terminator = block.terminator();
      if (terminator.opcode() == Opcode.RETURN_VALUE) {
        returnedValue.put(returnBlockId, terminator.idOperand(0));
      }
      block.remove(terminator);
      block.add(
          Instruction.withIds(Opcode.BRANCH, 0, 0, plan.targets().get(returnBlockId)));
    }

    for (int mergeBlockId : plan.mergeBlocks()) {
      Block mergeBlock = function.findBlock(mergeBlockId);
      List<Integer> returningPreds = plan.returningPreds().getOrDefault(mergeBlockId, List.of());
      for (int newPred : plan.newPreds(mergeBlockId)) {
        for (Instruction phi : mergeBlock.phis()) {
          phi.addOperand(Operand.id(placeholders.get(phi)));
          phi.addOperand(Operand.id(newPred));
        }
      }

      List<Integer> isReturningPairs = new ArrayList<>();
      List<Integer> returnValPairs = new ArrayList<>();
      for (int pred : returningPreds) {
        boolean isReturnBlock = plan.returnBlocks().contains(pred);
        isReturningPairs.add(isReturnBlock ? trueId : isReturning.get(pred));
        isReturningPairs.add(pred);
        returnValPairs.add(isReturnBlock ? returnedValue.get(pred) : maybeReturnVal.get(pred));
        returnValPairs.add(pred);
      }
      for (int pred : plan.originalPreds().get(mergeBlockId)) {
        if (!returningPreds.contains(pred)) {
          isReturningPairs.add(falseId);
          isReturningPairs.add(pred);
          returnValPairs.add(returnableVal);
          returnValPairs.add(pred);
        }
      }
      int insertAt = mergeBlock.firstNonPhiIndex();
      if (!plan.isVoid()) {
        mergeBlock.insert(
            insertAt++,
            phi(function.returnTypeId(), maybeReturnVal.get(mergeBlockId), returnValPairs));
      }
      mergeBlock.insert(insertAt, phi(boolTypeId, isReturning.get(mergeBlockId), isReturningPairs));

      Instruction branch = mergeBlock.terminator();
      int originalSucc = branch.idOperand(0);
      int enclosingTarget = plan.targets().get(mergeBlockId);
      if (originalSucc != enclosingTarget) {
        mergeBlock.remove(branch);
        mergeBlock.add(
            Instruction.withIds(
                Opcode.BRANCH_CONDITIONAL,
                0,
                0,
                isReturning.get(mergeBlockId),
                enclosingTarget,
                originalSucc));
      }
    }

    // The outer loop, which executes exactly once.
    Instruction entryBranch = entry.terminator();
    int blockAfterEntry = entryBranch.idOperand(0);
    entryBranch.setIdOperand(0, outerHeaderId);
    Block outerHeader = new Block(outerHeaderId);
    outerHeader.add(
        Instruction.of(
            Opcode.LOOP_MERGE,
            Operand.id(outerReturnId),
            Operand.id(outerHeaderId),
            Operand.literal(0)));
    outerHeader.add(
        Instruction.withIds(
            Opcode.BRANCH_CONDITIONAL, 0, 0, trueId, blockAfterEntry, outerHeaderId));
    function.insertBlockAfter(outerHeader, entry);
    function
        .findBlock(blockAfterEntry)
        .phis()
        .forEach(phi -> Function.replacePhiPredecessor(phi, entry.id(), outerHeaderId));

    Block outerReturn = new Block(outerReturnId);
    if (plan.isVoid()) {
      outerReturn.add(Instruction.of(Opcode.RETURN));
    } else {
      List<Integer> pairs = new ArrayList<>();
      for (int pred : plan.returningPreds().get(outerReturnId)) {
        boolean isReturnBlock = plan.returnBlocks().contains(pred);
        pairs.add(isReturnBlock ? returnedValue.get(pred) : maybeReturnVal.get(pred));
        pairs.add(pred);
      }
      outerReturn.add(phi(function.returnTypeId(), returnValId, pairs));
      outerReturn.add(Instruction.withIds(Opcode.RETURN_VALUE, 0, 0, returnValId));
    }
    function.addBlock(outerReturn);

    newIds.forEach(ir::updateIdBound);
    ir.invalidateAnalyses();
  }

  private static Instruction phi(int typeId, int resultId, List<Integer> pairs) {
    return Instruction.withIds(
        Opcode.PHI, typeId, resultId, pairs.stream().mapToInt(Integer::intValue).toArray());
  }

  @Override
  public TransformationMessage toMessage() {
    TransformationMessage.Writer writer =
        new TransformationMessage.Writer(TransformationKind.MERGE_FUNCTION_RETURNS)
            .add(functionId)
            .add(outerHeaderId)
            .add(outerReturnId)
            .add(returnValId)
            .add(anyReturnableValId)
            .add(returnMergingInfo.size());
    for (ReturnMergingInfo info : returnMergingInfo) {
      writer
          .add(info.mergeBlockId())
          .add(info.isReturningId())
          .add(info.maybeReturnValId())
          .add(info.opPhiToSuitableId().size());
      info.opPhiToSuitableId()
          .forEach(
              (phi, id) -> {
                writer.add(phi);
                writer.add(id);
              });
    }
    return writer.build();
  }

  @Override
  public String toString() {
    return toMessage().toString();
  }
}
