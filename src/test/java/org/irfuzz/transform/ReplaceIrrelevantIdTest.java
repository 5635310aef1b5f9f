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
import static org.irfuzz.testing.SampleModules.ONE;
import static org.irfuzz.testing.SampleModules.TEN;
import static org.irfuzz.testing.SampleModules.TRUE;
import static org.irfuzz.testing.SampleModules.TWO;

import org.irfuzz.fact.Fact;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.IrPrinter;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Validator;
import org.irfuzz.testing.Interpreter;
import org.irfuzz.testing.SampleModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReplaceIrrelevantIdTest {

  /** The use of TWO as the first operand of %22 = TWO + ONE in the straight-line sample. */
  private static final IdUseDescriptor USE_OF_TWO =
      new IdUseDescriptor(TWO, new InstructionDescriptor(22, Opcode.IADD, 0), 0);

  private static TransformationContext context(IrContext ir) {
    return new TransformationContext(new FactManager(ir), new CounterOverflowIdSource(1000));
  }

  @Test
  public void replacesUse() {
    IrContext ir = new IrContext(SampleModules.straightLine());
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.IdIsIrrelevant(TWO));

    ReplaceIrrelevantId transformation = new ReplaceIrrelevantId(USE_OF_TWO, TEN);
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(ir.def(22).idOperand(0)).isEqualTo(TEN);
    // The other use of TWO is untouched.
    assertThat(ir.def(24).idOperand(1)).isEqualTo(TWO);
    assertThat(Validator.validate(ir.module())).isEmpty();
    assertThat(new Interpreter(ir.module()).callInt(20)).isEqualTo(22);
  }

  @Test
  public void secondApplicationFindsNoUse() {
    IrContext ir = new IrContext(SampleModules.straightLine());
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.IdIsIrrelevant(TWO));
    ReplaceIrrelevantId transformation = new ReplaceIrrelevantId(USE_OF_TWO, TEN);
    transformation.apply(ir, context);
    String before = IrPrinter.print(ir.module());

    assertThat(transformation.isApplicable(ir, context)).isFalse();
    assertThat(IrPrinter.print(ir.module())).isEqualTo(before);
    assertThat(ir.def(22).idOperand(0)).isEqualTo(TEN);
  }

  @Test
  public void idMustBeIrrelevant() {
    IrContext ir = new IrContext(SampleModules.straightLine());
    assertThat(new ReplaceIrrelevantId(USE_OF_TWO, TEN).isApplicable(ir, context(ir))).isFalse();
  }

  @Test
  public void replacementMustMatch() {
    IrContext ir = new IrContext(SampleModules.straightLine());
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.IdIsIrrelevant(TWO));

    // Wrong type.
    assertThat(new ReplaceIrrelevantId(USE_OF_TWO, TRUE).isApplicable(ir, context)).isFalse();
    // Defined after the use.
    assertThat(new ReplaceIrrelevantId(USE_OF_TWO, 24).isApplicable(ir, context)).isFalse();
    // Not defined at all.
    assertThat(new ReplaceIrrelevantId(USE_OF_TWO, 99).isApplicable(ir, context)).isFalse();
    // The instruction itself.
    assertThat(new ReplaceIrrelevantId(USE_OF_TWO, 22).isApplicable(ir, context)).isFalse();
  }

  @Test
  public void useMustExist() {
    IrContext ir = new IrContext(SampleModules.straightLine());
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.IdIsIrrelevant(TWO));

    // Operand 1 of %22 is ONE, not TWO.
    IdUseDescriptor wrongOperand =
        new IdUseDescriptor(TWO, new InstructionDescriptor(22, Opcode.IADD, 0), 1);
    assertThat(new ReplaceIrrelevantId(wrongOperand, TEN).isApplicable(ir, context)).isFalse();
    IdUseDescriptor noSuchInstruction =
        new IdUseDescriptor(TWO, new InstructionDescriptor(22, Opcode.IADD, 1), 0);
    assertThat(new ReplaceIrrelevantId(noSuchInstruction, TEN).isApplicable(ir, context))
        .isFalse();
    IdUseDescriptor outOfRange =
        new IdUseDescriptor(TWO, new InstructionDescriptor(22, Opcode.IADD, 0), 2);
    assertThat(new ReplaceIrrelevantId(outOfRange, ONE).isApplicable(ir, context)).isFalse();
  }

  @Test
  public void valueMergeOperandNeedsIdAvailableOnItsEdge() {
    IrContext ir = new IrContext(SampleModules.ifElse());
    TransformationContext context = context(ir);
    context.factManager().addFact(new Fact.IdIsIrrelevant(29));
    // %31 = PHI %29 %25 %30 %26
    IdUseDescriptor use = new IdUseDescriptor(29, new InstructionDescriptor(31, Opcode.PHI, 0), 0);

    // %30 is defined in the other arm.
    assertThat(new ReplaceIrrelevantId(use, 30).isApplicable(ir, context)).isFalse();
    assertThat(new ReplaceIrrelevantId(use, 28).isApplicable(ir, context)).isTrue();
    ReplaceIrrelevantId useParameter = new ReplaceIrrelevantId(use, 22);
    assertThat(useParameter.isApplicable(ir, context)).isTrue();
    useParameter.apply(ir, context);
    assertThat(Validator.validate(ir.module())).isEmpty();
    // a < b now yields b + a.
    assertThat(new Interpreter(ir.module()).callInt(20, 1, 5)).isEqualTo(6);
  }

  @Test
  public void messageRoundTrip() {
    ReplaceIrrelevantId transformation = new ReplaceIrrelevantId(USE_OF_TWO, TEN);
    TransformationMessage message = transformation.toMessage();
    assertThat(message.toString())
        .isEqualTo("REPLACE_IRRELEVANT_ID 10 22 " + Opcode.IADD.ordinal() + " 0 0 11");
    ReplaceIrrelevantId decoded = (ReplaceIrrelevantId) message.toTransformation();
    assertThat(decoded.idUseDescriptor()).isEqualTo(USE_OF_TWO);
    assertThat(decoded.replacementId()).isEqualTo(TEN);
  }
}
