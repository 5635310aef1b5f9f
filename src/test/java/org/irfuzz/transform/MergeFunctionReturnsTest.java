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

import static com.google.common.truth.Truth.assertThat;
import static org.irfuzz.testing.SampleModules.INT;
import static org.irfuzz.testing.SampleModules.ONE;
import static org.irfuzz.testing.SampleModules.TEN;
import static org.irfuzz.testing.SampleModules.TRUE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Validator;
import org.irfuzz.testing.Interpreter;
import org.irfuzz.testing.SampleModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MergeFunctionReturnsTest {

  /** An overflow id source that has no ids to give. */
  private static class NoOverflowIds implements OverflowIdSource {
    @Override
    public boolean hasOverflowIds() {
      return false;
    }

    @Override
    public int getNextOverflowId() {
      throw new IllegalStateException();
    }

    @Override
    public ImmutableSet<Integer> issuedOverflowIds() {
      return ImmutableSet.of();
    }
  }

  private static final ReturnMergingInfo LOOP_MERGE_INFO =
      new ReturnMergingInfo(30, 53, 54, ImmutableMap.of());

  private static TransformationContext context(IrContext ir) {
    return new TransformationContext(new FactManager(ir), new CounterOverflowIdSource(1000));
  }

  private static List<Integer> layout(IrContext ir) {
    return ir.module().function(20).blocks().stream().map(Block::id).toList();
  }

  private static MergeFunctionReturns mergeReturns(List<ReturnMergingInfo> infos) {
    return new MergeFunctionReturns(20, 50, 51, 52, 0, infos);
  }

  @Test
  public void returnInsideLoop() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    MergeFunctionReturns transformation = mergeReturns(ImmutableList.of(LOOP_MERGE_INFO));
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(layout(ir)).containsExactly(22, 50, 23, 25, 27, 28, 30, 32, 51).inOrder();
    assertThat(ir.block(22).terminator().toString()).isEqualTo("BRANCH %50");
    assertThat(ir.block(50).mergeBlockId()).isEqualTo(51);
    assertThat(ir.block(50).continueTargetId()).isEqualTo(50);
    assertThat(ir.block(50).terminator().toString()).isEqualTo("BRANCH_CONDITIONAL %6 %23 %50");
    assertThat(ir.block(23).get(0).toString()).isEqualTo("%24 = PHI %3 %8 %50 %29 %28");
    assertThat(ir.block(27).terminator().toString()).isEqualTo("BRANCH %30");
    assertThat(ir.block(32).terminator().toString()).isEqualTo("BRANCH %51");

    Block merge = ir.block(30);
    assertThat(merge.get(0).toString()).isEqualTo("%33 = PHI %3 %29 %28 %8 %27");
    assertThat(merge.get(1).toString()).isEqualTo("%54 = PHI %3 %24 %27 %8 %28");
    assertThat(merge.get(2).toString()).isEqualTo("%53 = PHI %2 %6 %27 %7 %28");
    assertThat(merge.terminator().toString()).isEqualTo("BRANCH_CONDITIONAL %53 %51 %32");

    Block outerReturn = ir.block(51);
    assertThat(outerReturn.get(0).toString()).isEqualTo("%52 = PHI %3 %33 %32 %54 %30");
    assertThat(outerReturn.terminator().toString()).isEqualTo("RETURN_VALUE %52");
    assertThat(Validator.validate(ir.module())).isEmpty();

    Interpreter interpreter = new Interpreter(ir.module());
    assertThat(interpreter.callInt(20, 3)).isEqualTo(4);
    assertThat(interpreter.callInt(20, 20)).isEqualTo(10);
    assertThat(interpreter.callInt(20, -5)).isEqualTo(0);
  }

  @Test
  public void overflowIdsForMergeBlocksWithoutInfo() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    MergeFunctionReturns transformation = mergeReturns(ImmutableList.of());
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(context.overflowIdSource().issuedOverflowIds()).containsExactly(1000, 1001);
    assertThat(ir.module().idBound()).isEqualTo(1002);
    assertThat(Validator.validate(ir.module())).isEmpty();
    assertThat(new Interpreter(ir.module()).callInt(20, 3)).isEqualTo(4);

    IrContext other = new IrContext(SampleModules.returnInLoop());
    TransformationContext noOverflow =
        new TransformationContext(new FactManager(other), new NoOverflowIds());
    assertThat(transformation.isApplicable(other, noOverflow)).isFalse();
  }

  @Test
  public void suitableIdForExistingValueMerge() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    MergeFunctionReturns transformation =
        mergeReturns(ImmutableList.of(new ReturnMergingInfo(30, 53, 54, ImmutableMap.of(33, TEN))));
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);
    assertThat(ir.block(30).get(0).toString()).isEqualTo("%33 = PHI %3 %29 %28 %11 %27");
    assertThat(Validator.validate(ir.module())).isEmpty();

    // %24 is not available at the end of the entry block.
    IrContext other = new IrContext(SampleModules.returnInLoop());
    MergeFunctionReturns unavailable =
        mergeReturns(ImmutableList.of(new ReturnMergingInfo(30, 53, 54, ImmutableMap.of(33, 24))));
    assertThat(unavailable.isApplicable(other, context(other))).isFalse();
  }

  @Test
  public void returnableValue() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    ImmutableList<ReturnMergingInfo> infos = ImmutableList.of(LOOP_MERGE_INFO);
    assertThat(new MergeFunctionReturns(20, 50, 51, 52, TRUE, infos).isApplicable(ir, context))
        .isFalse();
    MergeFunctionReturns withTen = new MergeFunctionReturns(20, 50, 51, 52, TEN, infos);
    assertThat(withTen.isApplicable(ir, context)).isTrue();
    withTen.apply(ir, context);
    assertThat(ir.block(30).get(1).toString()).isEqualTo("%54 = PHI %3 %24 %27 %11 %28");
    assertThat(new Interpreter(ir.module()).callInt(20, 20)).isEqualTo(10);
  }

  @Test
  public void undefinedReturnableValueFallsBackToAvailableId() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    ImmutableList<ReturnMergingInfo> infos = ImmutableList.of(LOOP_MERGE_INFO);
    // %24 is defined but only inside the loop.
    assertThat(new MergeFunctionReturns(20, 50, 51, 52, 24, infos).isApplicable(ir, context))
        .isFalse();
    MergeFunctionReturns undefined = new MergeFunctionReturns(20, 50, 51, 52, 99, infos);
    assertThat(undefined.isApplicable(ir, context)).isTrue();
    undefined.apply(ir, context);
    assertThat(ir.block(30).get(1).toString()).isEqualTo("%54 = PHI %3 %24 %27 %8 %28");
    assertThat(Validator.validate(ir.module())).isEmpty();
    assertThat(new Interpreter(ir.module()).callInt(20, 20)).isEqualTo(10);
  }

  @Test
  public void twoReturnsOutsideLoops() {
    IrContext ir = new IrContext(SampleModules.twoReturns());
    TransformationContext context = context(ir);
    assertThat(MergeFunctionReturns.relevantMergeBlocks(ir, ir.module().function(20))).isEmpty();
    MergeFunctionReturns transformation = mergeReturns(ImmutableList.of());
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(ir.block(25).terminator().toString()).isEqualTo("BRANCH %51");
    assertThat(ir.block(26).terminator().toString()).isEqualTo("BRANCH %51");
    assertThat(ir.block(51).get(0).toString()).isEqualTo("%52 = PHI %3 %28 %25 %12 %26");
    // The unreachable block is left alone.
    assertThat(ir.block(27).terminator().opcode()).isEqualTo(Opcode.UNREACHABLE);
    assertThat(context.overflowIdSource().issuedOverflowIds()).isEmpty();
    assertThat(Validator.validate(ir.module())).isEmpty();

    Interpreter interpreter = new Interpreter(ir.module());
    assertThat(interpreter.callInt(20, 5)).isEqualTo(6);
    assertThat(interpreter.callInt(20, -3)).isEqualTo(-1);
  }

  @Test
  public void voidFunction() {
    IrContext ir = new IrContext(SampleModules.voidWithEarlyReturn());
    TransformationContext context = context(ir);
    MergeFunctionReturns transformation =
        new MergeFunctionReturns(20, 50, 51, 0, 0, ImmutableList.of());
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(ir.block(51).instructions()).hasSize(1);
    assertThat(ir.block(51).terminator().opcode()).isEqualTo(Opcode.RETURN);
    assertThat(Validator.validate(ir.module())).isEmpty();

    Interpreter interpreter = new Interpreter(ir.module());
    assertThat(interpreter.call(20)).isNull();
    assertThat(interpreter.globalValue(19)).isEqualTo(10L);
    interpreter.call(20);
    assertThat(interpreter.globalValue(19)).isEqualTo(-1L);
  }

  @Test
  public void idsMustBeFreshAndDistinct() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    ImmutableList<ReturnMergingInfo> infos = ImmutableList.of(LOOP_MERGE_INFO);
    assertThat(new MergeFunctionReturns(20, 23, 51, 52, 0, infos).isApplicable(ir, context))
        .isFalse();
    assertThat(new MergeFunctionReturns(20, 50, 50, 52, 0, infos).isApplicable(ir, context))
        .isFalse();
    assertThat(new MergeFunctionReturns(20, 50, 51, 53, 0, infos).isApplicable(ir, context))
        .isFalse();
    ImmutableList<ReturnMergingInfo> staleInfo =
        ImmutableList.of(new ReturnMergingInfo(30, 24, 54, ImmutableMap.of()));
    assertThat(new MergeFunctionReturns(20, 50, 51, 52, 0, staleInfo).isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void mergeBlockMayOnlyHaveValueMergesAndBranch() {
    Module module = SampleModules.returnInLoop();
    module
        .function(20)
        .findBlock(30)
        .insert(1, Instruction.withIds(Opcode.IADD, INT, 60, 33, ONE));
    module.updateIdBound(60);
    IrContext ir = new IrContext(module);
    assertThat(mergeReturns(ImmutableList.of(LOOP_MERGE_INFO)).isApplicable(ir, context(ir)))
        .isFalse();
  }

  @Test
  public void entryMustEndInPlainBranch() {
    IrContext ir = new IrContext(SampleModules.ifElse());
    assertThat(mergeReturns(ImmutableList.of()).isApplicable(ir, context(ir))).isFalse();
    MergeFunctionReturns noSuchFunction =
        new MergeFunctionReturns(99, 50, 51, 52, 0, ImmutableList.of());
    assertThat(noSuchFunction.isApplicable(ir, context(ir))).isFalse();
  }

  @Test
  public void relevantMergeBlocks() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    assertThat(MergeFunctionReturns.relevantMergeBlocks(ir, ir.module().function(20)))
        .containsExactly(30);
  }

  @Test
  public void messageRoundTrip() {
    MergeFunctionReturns transformation =
        mergeReturns(ImmutableList.of(new ReturnMergingInfo(30, 53, 54, ImmutableMap.of(33, TEN))));
    TransformationMessage message = transformation.toMessage();
    assertThat(message.toString())
        .isEqualTo("MERGE_FUNCTION_RETURNS 20 50 51 52 0 1 30 53 54 1 33 11");
    assertThat(message.toTransformation().toMessage()).isEqualTo(message);
  }
}
