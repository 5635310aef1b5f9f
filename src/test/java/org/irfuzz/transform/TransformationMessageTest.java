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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableIntArray;
import org.irfuzz.ir.Opcode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TransformationMessageTest {

  @Test
  public void parse() {
    TransformationMessage message =
        TransformationMessage.parse("  ADD_OP_PHI_SYNONYM 27  2 25 9 26 50 60 ");
    assertThat(message.kind()).isEqualTo(TransformationKind.ADD_OP_PHI_SYNONYM);
    assertThat(message.words()).isEqualTo(ImmutableIntArray.of(27, 2, 25, 9, 26, 50, 60));
    assertThat(message.toString()).isEqualTo("ADD_OP_PHI_SYNONYM 27 2 25 9 26 50 60");
    assertThat(message.toTransformation()).isInstanceOf(AddOpPhiSynonym.class);
  }

  @Test
  public void unknownKind() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> TransformationMessage.parse("SHUFFLE 1"));
    assertThat(e).hasMessageThat().isEqualTo("Unknown transformation kind: SHUFFLE");
    assertThrows(IllegalArgumentException.class, () -> TransformationMessage.parse("   "));
  }

  @Test
  public void badWord() {
    assertThrows(
        NumberFormatException.class,
        () -> TransformationMessage.parse("REPLACE_IRRELEVANT_ID 1 x"));
  }

  @Test
  public void truncatedMessage() {
    TransformationMessage message = TransformationMessage.parse("REPLACE_IRRELEVANT_ID 1 2");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, message::toTransformation);
    assertThat(e).hasMessageThat().isEqualTo("Truncated transformation message");
  }

  @Test
  public void extraWords() {
    TransformationMessage message = new AddOpPhiSynonym(27, ImmutableMap.of(25, 9), 60).toMessage();
    TransformationMessage longer = TransformationMessage.parse(message.toString() + " 7");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, longer::toTransformation);
    assertThat(e).hasMessageThat().isEqualTo("Extra words in transformation message");
  }

  @Test
  public void badListLength() {
    // Claims three pairs but only has words for one.
    TransformationMessage message =
        TransformationMessage.parse("ADD_OP_PHI_SYNONYM 27 3 25 9 60");
    assertThrows(IllegalArgumentException.class, message::toTransformation);
    TransformationMessage negative = TransformationMessage.parse("ADD_OP_PHI_SYNONYM 27 -1 60");
    assertThrows(IllegalArgumentException.class, negative::toTransformation);
  }

  @Test
  public void badOpcode() {
    TransformationMessage message =
        TransformationMessage.parse("REPLACE_IRRELEVANT_ID 9 22 -4 0 0 11");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, message::toTransformation);
    assertThat(e).hasMessageThat().isEqualTo("Bad opcode -4");
  }

  @Test
  public void sequenceText() {
    TransformationSequence sequence = new TransformationSequence();
    sequence.add(new AddOpPhiSynonym(27, ImmutableMap.of(25, 9, 26, 50), 60));
    sequence.add(new MergeFunctionReturns(20, 50, 51, 52, 0, ImmutableList.of()));
    sequence.add(
        new FlattenConditionalBranch(23, ImmutableList.of(), ImmutableList.of(70, 71)));
    String text = sequence.toText();
    assertThat(text)
        .isEqualTo(
            "ADD_OP_PHI_SYNONYM 27 2 25 9 26 50 60\n"
                + "MERGE_FUNCTION_RETURNS 20 50 51 52 0 0\n"
                + "FLATTEN_CONDITIONAL_BRANCH 23 0 2 70 71\n");

    TransformationSequence parsed = TransformationSequence.parse("\n" + text + "\n\n");
    assertThat(parsed.size()).isEqualTo(3);
    assertThat(parsed.messages()).isEqualTo(sequence.messages());
    assertThat(parsed.toText()).isEqualTo(text);
    assertThat(TransformationSequence.parse("").size()).isEqualTo(0);
  }

  @Test
  public void everyKindDecodesItsOwnMessages() {
    ImmutableList<Transformation> transformations =
        ImmutableList.of(
            new AddLoopPreheader(23, 50, ImmutableList.of(51, 52)),
            new AddLoopToCreateIntConstantSynonym(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 0),
            new AddOpPhiSynonym(27, ImmutableMap.of(25, 9), 60),
            new FlattenConditionalBranch(
                23,
                ImmutableList.of(
                    new FlattenConditionalBranch.InstructionFreshIds(
                        new InstructionDescriptor(28, Opcode.FUNCTION_CALL, 0),
                        ImmutableList.of(1, 2, 3, 4, 5))),
                ImmutableList.of(6)),
            new MergeFunctionReturns(
                20,
                50,
                51,
                52,
                9,
                ImmutableList.of(new ReturnMergingInfo(30, 53, 54, ImmutableMap.of(33, 8)))),
            new ReplaceIrrelevantId(
                new IdUseDescriptor(9, new InstructionDescriptor(22, Opcode.IADD, 0), 1),
                10));
    for (Transformation transformation : transformations) {
      TransformationMessage message = transformation.toMessage();
      TransformationMessage reparsed = TransformationMessage.parse(message.toString());
      assertThat(reparsed).isEqualTo(message);
      assertThat(reparsed.toTransformation().toMessage()).isEqualTo(message);
    }
    assertThat(transformations).hasSize(TransformationKind.values().length);
  }
}
