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
import static org.irfuzz.testing.SampleModules.TWO;
import static org.irfuzz.testing.SampleModules.UINT;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.irfuzz.fact.Fact;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.IrBuilder;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Validator;
import org.irfuzz.testing.Interpreter;
import org.irfuzz.testing.SampleModules;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class AddLoopToCreateIntConstantSynonymTest {

  private static final int C = 60;
  private static final int I = 61;
  private static final int S = 62;
  private static final int N = 63;
  private static final int UNSIGNED_C = 64;

  /** C = I - S * N. */
  enum Consistent {
    COUNT_DOWN(1, 10, 1, 9),
    NEGATIVE_RESULT(-5, 3, 1, 8),
    ZERO_STEP(7, 7, 0, 4),
    MAX_ITERATIONS(0, 32, 1, 32),
    LARGER_STEP(4, 10, 2, 3),
    NEGATIVE_STEP(-12, 4, 4, 4);

    final long c;
    final long i;
    final long s;
    final long n;

    Consistent(long c, long i, long s, long n) {
      this.c = c;
      this.i = i;
      this.s = s;
      this.n = n;
    }
  }

  enum Inconsistent {
    WRONG_RESULT(1, 10, 1, 8),
    TOO_MANY_ITERATIONS(1, 34, 1, 33),
    NO_ITERATIONS(1, 1, 1, 0),
    NEGATIVE_ITERATIONS(6, 5, 1, -1);

    final long c;
    final long i;
    final long s;
    final long n;

    Inconsistent(long c, long i, long s, long n) {
      this.c = c;
      this.i = i;
      this.s = s;
      this.n = n;
    }
  }

  /**
   * The straight-line sample with constants C, I, S and N added:
   *
   * <pre>
   * %21: %22 = 2 + 1; branch %23
   * %23: %24 = %22 * 2; return %24
   * </pre>
   */
  private static Module module(long c, long i, long s, long n) {
    return SampleModules.declareCommon(new IrBuilder())
        .constant(C, INT, c & 0xffffffffL)
        .constant(I, INT, i & 0xffffffffL)
        .constant(S, INT, s & 0xffffffffL)
        .constant(N, INT, n & 0xffffffffL)
        .constant(UNSIGNED_C, UINT, c & 0xffffffffL)
        .function(20, INT, SampleModules.FN_INT)
        .block(21)
        .op(Opcode.IADD, INT, 22, TWO, ONE)
        .branch(23)
        .block(23)
        .op(Opcode.IMUL, INT, 24, 22, TWO)
        .returnValue(24)
        .build();
  }

  private static AddLoopToCreateIntConstantSynonym transformation(
      int constantId, int additionalBlockId) {
    return new AddLoopToCreateIntConstantSynonym(
        constantId, I, S, N, 23, 70, 71, 72, 73, 74, 75, 76, additionalBlockId);
  }

  private static TransformationContext context(IrContext ir) {
    return new TransformationContext(new FactManager(ir), new CounterOverflowIdSource(1000));
  }

  /** Makes the function return the new synonym and runs it. */
  private static long returnSynonym(IrContext ir) {
    Block block = ir.block(23);
    block.terminator().setIdOperand(0, 70);
    ir.invalidateAnalyses();
    assertThat(Validator.validate(ir.module())).isEmpty();
    return new Interpreter(ir.module()).callInt(20);
  }

  @Test
  public void loopComputesConstant(
      @TestParameter Consistent values, @TestParameter boolean additionalBlock) {
    IrContext ir = new IrContext(module(values.c, values.i, values.s, values.n));
    TransformationContext context = context(ir);
    AddLoopToCreateIntConstantSynonym transformation =
        transformation(C, additionalBlock ? 77 : 0);
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(Validator.validate(ir.module())).isEmpty();
    assertThat(context.factManager().isSynonymous(70, C)).isTrue();
    assertThat(ir.block(21).terminator().idOperand(0)).isEqualTo(71);
    assertThat(ir.block(71).isLoopHeader()).isTrue();
    assertThat(ir.block(71).mergeBlockId()).isEqualTo(additionalBlock ? 77 : 23);
    assertThat(new Interpreter(ir.module()).callInt(20)).isEqualTo(6);
    assertThat(returnSynonym(ir)).isEqualTo(values.c);
  }

  @Test
  public void signednessMayDiffer(@TestParameter Consistent values) {
    IrContext ir = new IrContext(module(values.c, values.i, values.s, values.n));
    TransformationContext context = context(ir);
    AddLoopToCreateIntConstantSynonym transformation = transformation(UNSIGNED_C, 0);
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);
    assertThat(context.factManager().isSynonymous(70, UNSIGNED_C)).isTrue();
    assertThat(returnSynonym(ir)).isEqualTo(values.c);
  }

  @Test
  public void notApplicableUnlessConsistent(@TestParameter Inconsistent values) {
    IrContext ir = new IrContext(module(values.c, values.i, values.s, values.n));
    assertThat(transformation(C, 0).isApplicable(ir, context(ir))).isFalse();
  }

  @Test
  public void irrelevantConstant() {
    IrContext ir = new IrContext(module(1, 10, 1, 9));
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.IdIsIrrelevant(C));
    assertThat(transformation(C, 0).isApplicable(ir, context)).isFalse();
  }

  @Test
  public void idsMustBeFreshAndDistinct() {
    IrContext ir = new IrContext(module(1, 10, 1, 9));
    TransformationContext context = context(ir);
    assertThat(
            new AddLoopToCreateIntConstantSynonym(C, I, S, N, 23, 70, 71, 72, 73, 74, 75, 24, 0)
                .isApplicable(ir, context))
        .isFalse();
    assertThat(
            new AddLoopToCreateIntConstantSynonym(C, I, S, N, 23, 70, 71, 72, 73, 74, 75, 76, 70)
                .isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void blockAfterMustHaveOnePredecessor() {
    IrContext ir = new IrContext(module(1, 10, 1, 9));
    TransformationContext context = context(ir);
    // The entry block has no predecessor.
    assertThat(
            new AddLoopToCreateIntConstantSynonym(C, I, S, N, 21, 70, 71, 72, 73, 74, 75, 76, 0)
                .isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void mergeBlocksAreNotUsed() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    TransformationContext context = context(ir);
    // %30 is the merge block of the loop and has a single predecessor.
    AddLoopToCreateIntConstantSynonym transformation =
        new AddLoopToCreateIntConstantSynonym(
            ONE, TWO, ONE, ONE, 30, 70, 71, 72, 73, 74, 75, 76, 0);
    assertThat(transformation.isApplicable(ir, context)).isFalse();
  }

  @Test
  public void loopInDeadBlockIsDead() {
    IrContext ir = new IrContext(module(1, 10, 1, 9));
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.BlockIsDead(23));
    AddLoopToCreateIntConstantSynonym transformation = transformation(C, 77);
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);
    assertThat(context.factManager().deadBlocks()).containsExactly(23, 71, 77);
  }

  @Test
  public void messageRoundTrip() {
    AddLoopToCreateIntConstantSynonym transformation = transformation(C, 77);
    TransformationMessage message = transformation.toMessage();
    assertThat(message.toString())
        .isEqualTo(
            "ADD_LOOP_TO_CREATE_INT_CONSTANT_SYNONYM 60 61 62 63 23 70 71 72 73 74 75 76 77");
    assertThat(message.toTransformation().toMessage()).isEqualTo(message);
  }
}
