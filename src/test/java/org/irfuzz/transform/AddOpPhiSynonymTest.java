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
import static org.irfuzz.testing.SampleModules.TWO;

import com.google.common.collect.ImmutableMap;
import org.irfuzz.fact.Fact;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Validator;
import org.irfuzz.testing.Interpreter;
import org.irfuzz.testing.SampleModules;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AddOpPhiSynonymTest {

  /** {@code %50 = COPY_OBJECT ONE}, added to the entry block of the if/else sample. */
  private static final int COPY_OF_ONE = 50;

  private IrContext ir;
  private TransformationContext context;

  @Before
  public void setup() {
    Module module = SampleModules.ifElse();
    module
        .function(20)
        .findBlock(23)
        .insert(0, Instruction.withIds(Opcode.COPY_OBJECT, INT, COPY_OF_ONE, ONE));
    module.updateIdBound(COPY_OF_ONE);
    ir = new IrContext(module);
    context = new TransformationContext(new FactManager(ir), new CounterOverflowIdSource(1000));
    context.factManager().addFact(new Fact.IdSynonym(ONE, COPY_OF_ONE));
  }

  @Test
  public void addsSynonymousMerge() {
    AddOpPhiSynonym transformation =
        new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE, 26, COPY_OF_ONE), 60);
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);

    assertThat(ir.block(27).get(0).toString()).isEqualTo("%60 = PHI %3 %9 %25 %50 %26");
    assertThat(ir.module().idBound()).isGreaterThan(60);
    assertThat(context.factManager().isSynonymous(60, ONE)).isTrue();
    assertThat(context.factManager().isSynonymous(60, COPY_OF_ONE)).isTrue();
    assertThat(Validator.validate(ir.module())).isEmpty();
    assertThat(new Interpreter(ir.module()).callInt(20, 1, 5)).isEqualTo(5);
  }

  @Test
  public void sameIdFromEveryPredecessor() {
    AddOpPhiSynonym transformation = new AddOpPhiSynonym(27, ImmutableMap.of(25, TWO, 26, TWO), 60);
    assertThat(transformation.isApplicable(ir, context)).isTrue();
    transformation.apply(ir, context);
    assertThat(context.factManager().synonymsOf(60)).containsExactly(TWO);
  }

  @Test
  public void everyPredecessorMustBeCovered() {
    assertThat(new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE), 60).isApplicable(ir, context))
        .isFalse();
    assertThat(
            new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE, 26, ONE, 23, ONE), 60)
                .isApplicable(ir, context))
        .isFalse();
    // The entry block has no predecessors.
    assertThat(new AddOpPhiSynonym(23, ImmutableMap.of(), 60).isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void idsMustBeSynonymous() {
    assertThat(
            new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE, 26, TWO), 60)
                .isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void idMustBeAvailableAtEndOfPredecessor() {
    context.factManager().addFact(new Fact.IdSynonym(30, ONE));
    assertThat(
            new AddOpPhiSynonym(27, ImmutableMap.of(25, 30, 26, ONE), 60)
                .isApplicable(ir, context))
        .isFalse();
    assertThat(
            new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE, 26, 30), 60)
                .isApplicable(ir, context))
        .isTrue();
  }

  @Test
  public void irrelevantIdsAreNotUsed() {
    context.factManager().addFact(new Fact.IdIsIrrelevant(TEN));
    assertThat(
            new AddOpPhiSynonym(27, ImmutableMap.of(25, TEN, 26, TEN), 60)
                .isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void resultIdMustBeFresh() {
    assertThat(
            new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE, 26, COPY_OF_ONE), 31)
                .isApplicable(ir, context))
        .isFalse();
  }

  @Test
  public void messageRoundTrip() {
    AddOpPhiSynonym transformation =
        new AddOpPhiSynonym(27, ImmutableMap.of(25, ONE, 26, COPY_OF_ONE), 60);
    TransformationMessage message = transformation.toMessage();
    assertThat(message.toString()).isEqualTo("ADD_OP_PHI_SYNONYM 27 2 25 9 26 50 60");
    assertThat(message.toTransformation().toString()).isEqualTo(message.toString());
    assertThat(TransformationMessage.parse(message.toString())).isEqualTo(message);
  }
}
