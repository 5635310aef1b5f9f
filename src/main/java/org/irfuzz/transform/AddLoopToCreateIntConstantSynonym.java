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
import java.util.HashSet;
import java.util.Set;
import org.irfuzz.fact.Fact;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Constant;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Operand;
import org.irfuzz.ir.Type;

/**
 * Given integer constants C, I and S and a number of iterations N with C = I - S * N, inserts
 * before a block a loop that starts from I and subtracts S N times, and records the final value
 * as a synonym of C:
 *
 * <pre>
 * pred:
 *   ...
 *   BRANCH %loop                                   (was BRANCH %block_after)
 * loop:
 *   %ctr = PHI %int32 %zero %pred %incremented_ctr %loop
 *   %temp = PHI %type_of_I %I %pred %eventual_syn %loop
 *   %eventual_syn = ISUB %type_of_I %temp %S
 *   %incremented_ctr = IADD %int32 %ctr %one
 *   %cond = SLESS_THAN %bool %incremented_ctr %N
 *   LOOP_MERGE %merge %loop
 *   BRANCH_CONDITIONAL %cond %loop %merge
 * additional_block:                                (only if additional_block_id is not 0)
 *   %syn = PHI %type_of_I %eventual_syn %loop
 *   BRANCH %block_after
 * block_after:
 *   %syn = PHI %type_of_I %eventual_syn %loop     (if there is no additional block)
 *   ...
 * </pre>
 *
 * The merge block of the new loop is the additional block if there is one, {@code block_after}
 * otherwise.
 */
public final class AddLoopToCreateIntConstantSynonym implements Transformation {

  /** The number of fresh ids needed, not counting the optional additional block. */
  public static final int NUM_FRESH_IDS = 7;

  /** The largest number of iterations the loop may have. */
  public static final int MAX_ITERATIONS = 32;

  private final int constantId;
  private final int initialValId;
  private final int stepValId;
  private final int numIterationsId;
  private final int blockAfterLoopId;
  private final int synId;
  private final int loopId;
  private final int ctrId;
  private final int tempId;
  private final int eventualSynId;
  private final int incrementedCtrId;
  private final int condId;
  private final int additionalBlockId;

  public AddLoopToCreateIntConstantSynonym(
      int constantId,
      int initialValId,
      int stepValId,
      int numIterationsId,
      int blockAfterLoopId,
      int synId,
      int loopId,
      int ctrId,
      int tempId,
      int eventualSynId,
      int incrementedCtrId,
      int condId,
      int additionalBlockId) {
    this.constantId = constantId;
    this.initialValId = initialValId;
    this.stepValId = stepValId;
    this.numIterationsId = numIterationsId;
    this.blockAfterLoopId = blockAfterLoopId;
    this.synId = synId;
    this.loopId = loopId;
    this.ctrId = ctrId;
    this.tempId = tempId;
    this.eventualSynId = eventualSynId;
    this.incrementedCtrId = incrementedCtrId;
    this.condId = condId;
    this.additionalBlockId = additionalBlockId;
  }

  static AddLoopToCreateIntConstantSynonym fromMessage(TransformationMessage.Reader reader) {
    return new AddLoopToCreateIntConstantSynonym(
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next(),
        reader.next());
  }

  @Override
  public boolean isApplicable(IrContext ir, TransformationContext context) {
    long[] c = ir.constants().integerComponents(constantId);
    long[] i = ir.constants().integerComponents(initialValId);
    long[] s = ir.constants().integerComponents(stepValId);
    if (c == null || i == null || s == null) {
      return false;
    }
    int constantTypeId = ir.typeIdOf(constantId);
    Type.Int componentType = ir.types().integerComponent(constantTypeId);
    if (componentType == null || componentType.width() > 64) {
      return false;
    }
    if (!FuzzerUtil.typesAreEqualUpToSign(ir, constantTypeId, ir.typeIdOf(initialValId))
        || !FuzzerUtil.typesAreEqualUpToSign(ir, constantTypeId, ir.typeIdOf(stepValId))) {
      return false;
    }

    // N must be a 32-bit integer constant in [1, MAX_ITERATIONS].
    if (!(ir.constants().constant(numIterationsId) instanceof Constant.Scalar n)
        || !(ir.types().type(n.typeId()) instanceof Type.Int nType)
        || nType.width() != 32) {
      return false;
    }
    long numIterations = n.signExtended(nType);
    if (numIterations <= 0 || numIterations > MAX_ITERATIONS) {
      return false;
    }

    if (ir.constants().findIntConstant(0, 32, true) == 0
        || ir.constants().findIntConstant(1, 32, true) == 0
        || ir.types().boolTypeId() == 0) {
      return false;
    }

    // Sign extension makes the check independent of width and signedness.
    if (c.length != i.length || c.length != s.length) {
      return false;
    }
    for (int k = 0; k < c.length; k++) {
      if (c[k] != i[k] - s[k] * numIterations) {
        return false;
      }
    }

    if (context.factManager().idIsIrrelevant(constantId)) {
      return false;
    }

    Block block = ir.block(blockAfterLoopId);
    if (block == null) {
      return false;
    }
    Function function = ir.functionOfBlock(blockAfterLoopId);
    ImmutableList<Integer> preds = ir.cfg(function.id()).predecessors(blockAfterLoopId);
    if (preds.size() != 1 || preds.get(0) == blockAfterLoopId) {
      return false;
    }
    if (ir.structuredCfg().isMergeBlock(blockAfterLoopId)
        || ir.structuredCfg().isContinueBlock(blockAfterLoopId)) {
      return false;
    }

    Set<Integer> freshIds = new HashSet<>();
    for (int id :
        new int[] {synId, loopId, ctrId, tempId, eventualSynId, incrementedCtrId, condId}) {
      if (!FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(id, ir, freshIds)) {
        return false;
      }
    }
    return additionalBlockId == 0
        || FuzzerUtil.checkIdIsFreshAndNotUsedByThisTransformation(
            additionalBlockId, ir, freshIds);
  }

  @Override
  public void apply(IrContext ir, TransformationContext context) {
    Block blockAfter = ir.block(blockAfterLoopId);
    Function function = ir.functionOfBlock(blockAfterLoopId);
    int predId = ir.cfg(function.id()).predecessors(blockAfterLoopId).get(0);
    Block pred = ir.block(predId);
    int typeId = ir.typeIdOf(initialValId);
    int zeroId = ir.constants().findIntConstant(0, 32, true);
    int oneId = ir.constants().findIntConstant(1, 32, true);
    int int32TypeId = ir.typeIdOf(zeroId);
    int boolTypeId = ir.types().boolTypeId();
    int mergeId = (additionalBlockId != 0) ? additionalBlockId : blockAfterLoopId;

    Instruction predTerminator = pred.terminator();
    for (int k = 0; k < predTerminator.numOperands(); k++) {
      if (predTerminator.opcode().isLabelOperand(k)
          && predTerminator.idOperand(k) == blockAfterLoopId) {
        predTerminator.setIdOperand(k, loopId);
      }
    }

    Block loop = new Block(loopId);
    loop.add(
        Instruction.withIds(
            Opcode.PHI, int32TypeId, ctrId, zeroId, predId, incrementedCtrId, loopId));
    loop.add(
        Instruction.withIds(
            Opcode.PHI, typeId, tempId, initialValId, predId, eventualSynId, loopId));
    loop.add(Instruction.withIds(Opcode.ISUB, typeId, eventualSynId, tempId, stepValId));
    loop.add(Instruction.withIds(Opcode.IADD, int32TypeId, incrementedCtrId, ctrId, oneId));
    loop.add(
        Instruction.withIds(
            Opcode.SLESS_THAN, boolTypeId, condId, incrementedCtrId, numIterationsId));
    loop.add(
        Instruction.of(
            Opcode.LOOP_MERGE, Operand.id(mergeId), Operand.id(loopId), Operand.literal(0)));
    loop.add(Instruction.withIds(Opcode.BRANCH_CONDITIONAL, 0, 0, condId, loopId, mergeId));
    function.insertBlockBefore(loop, blockAfter);

    Instruction syn = Instruction.withIds(Opcode.PHI, typeId, synId, eventualSynId, loopId);
    if (additionalBlockId != 0) {
      Block additional = new Block(additionalBlockId);
      additional.add(syn);
      additional.add(Instruction.withIds(Opcode.BRANCH, 0, 0, blockAfterLoopId));
      function.insertBlockBefore(additional, blockAfter);
      blockAfter
          .phis()
          .forEach(phi -> Function.replacePhiPredecessor(phi, predId, additionalBlockId));
    } else {
      blockAfter.phis().forEach(phi -> Function.replacePhiPredecessor(phi, predId, loopId));
      blockAfter.insert(0, syn);
    }

    FuzzerUtil.updateModuleIdBound(
        ir, synId, loopId, ctrId, tempId, eventualSynId, incrementedCtrId, condId);
    if (additionalBlockId != 0) {
      FuzzerUtil.updateModuleIdBound(ir, additionalBlockId);
    }
    ir.invalidateAnalyses();

    FactManager facts = context.factManager();
    facts.addFact(new Fact.IdSynonym(synId, constantId));
    if (facts.blockIsDead(blockAfterLoopId)) {
      facts.addFact(new Fact.BlockIsDead(loopId));
      if (additionalBlockId != 0) {
        facts.addFact(new Fact.BlockIsDead(additionalBlockId));
      }
    }
  }

  @Override
  public TransformationMessage toMessage() {
    return new TransformationMessage.Writer(
            TransformationKind.ADD_LOOP_TO_CREATE_INT_CONSTANT_SYNONYM)
        .add(constantId)
        .add(initialValId)
        .add(stepValId)
        .add(numIterationsId)
        .add(blockAfterLoopId)
        .add(synId)
        .add(loopId)
        .add(ctrId)
        .add(tempId)
        .add(eventualSynId)
        .add(incrementedCtrId)
        .add(condId)
        .add(additionalBlockId)
        .build();
  }

  @Override
  public String toString() {
    return toMessage().toString();
  }
}
