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

import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;

/**
 * Replaces one use of an irrelevant id with another id of the same type. Because the value of
 * the irrelevant id has no bearing on the module's behavior, any available id of the same type
 * will do.
 */
public final class ReplaceIrrelevantId implements Transformation {

  private final IdUseDescriptor idUseDescriptor;
  private final int replacementId;

  public ReplaceIrrelevantId(IdUseDescriptor idUseDescriptor, int replacementId) {
    this.idUseDescriptor = idUseDescriptor;
    this.replacementId = replacementId;
  }

  static ReplaceIrrelevantId fromMessage(TransformationMessage.Reader reader) {
    int idOfInterest = reader.next();
    InstructionDescriptor instruction = reader.nextInstructionDescriptor();
    int operandIndex = reader.next();
    return new ReplaceIrrelevantId(
        new IdUseDescriptor(idOfInterest, instruction, operandIndex), reader.next());
  }

  public IdUseDescriptor idUseDescriptor() {
    return idUseDescriptor;
  }

  public int replacementId() {
    return replacementId;
  }

  @Override
  public boolean isApplicable(IrContext ir, TransformationContext context) {
    int idOfInterest = idUseDescriptor.idOfInterest();
    if (!context.factManager().idIsIrrelevant(idOfInterest)) {
      return false;
    }
    Instruction use = idUseDescriptor.findContainingInstruction(ir);
    if (use == null) {
      return false;
    }
    Instruction replacement = ir.def(replacementId);
    Instruction original = ir.def(idOfInterest);
    if (replacement == null || original == null || replacement.typeId() != original.typeId()) {
      return false;
    }
    if (ir.types().isPointer(original.typeId())) {
      return false;
    }
    if (!FuzzerUtil.idUseCanBeReplaced(ir, use, idUseDescriptor.operandIndex())) {
      return false;
    }
    return FuzzerUtil.idIsAvailableAtUse(ir, use, idUseDescriptor.operandIndex(), replacementId);
  }

  @Override
  public void apply(IrContext ir, TransformationContext context) {
    Instruction use = idUseDescriptor.findContainingInstruction(ir);
    use.setIdOperand(idUseDescriptor.operandIndex(), replacementId);
    ir.invalidateAnalyses();
  }

  @Override
  public TransformationMessage toMessage() {
    return new TransformationMessage.Writer(TransformationKind.REPLACE_IRRELEVANT_ID)
        .add(idUseDescriptor.idOfInterest())
        .add(idUseDescriptor.enclosingInstruction())
        .add(idUseDescriptor.operandIndex())
        .add(replacementId)
        .build();
  }

  @Override
  public String toString() {
    return toMessage().toString();
  }
}
