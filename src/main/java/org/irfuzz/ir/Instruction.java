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

package org.irfuzz.ir;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.IntConsumer;
import org.irfuzz.util.StringUtil;

/**
 * A single IR instruction: an opcode, an optional result id, an optional type id, and a list of
 * operands. Instructions are mutable so that transformations can rewrite them in place; they hold
 * no reference to the block or function that contains them (see {@link DefUse#blockOf}).
 *
 * <p>Instructions use identity equality, so two instructions with the same contents are still
 * distinct.
 */
public final class Instruction {

  private Opcode opcode;

  /** Zero if this instruction has no result id. */
  private int resultId;

  /** Zero if this instruction has no type id. */
  private final int typeId;

  private final List<Operand> operands;

  public Instruction(Opcode opcode, int typeId, int resultId, List<Operand> operands) {
    Preconditions.checkArgument(opcode.hasResultId() == (resultId != 0), "%s result", opcode);
    Preconditions.checkArgument(opcode.hasTypeId() == (typeId != 0), "%s type", opcode);
    this.opcode = opcode;
    this.typeId = typeId;
    this.resultId = resultId;
    this.operands = new ArrayList<>(operands);
  }

  /** Creates an instruction with neither result nor type id. */
  public static Instruction of(Opcode opcode, Operand... operands) {
    return new Instruction(opcode, 0, 0, Arrays.asList(operands));
  }

  /** Creates an instruction with the given type and result ids. */
  public static Instruction of(Opcode opcode, int typeId, int resultId, Operand... operands) {
    return new Instruction(opcode, typeId, resultId, Arrays.asList(operands));
  }

  /** Creates an instruction whose operands are all ids. */
  public static Instruction withIds(Opcode opcode, int typeId, int resultId, int... ids) {
    return new Instruction(
        opcode, typeId, resultId, Arrays.stream(ids).mapToObj(Operand::id).toList());
  }

  public Opcode opcode() {
    return opcode;
  }

  /**
   * Changes the opcode. Only opcodes with the same result/type shape are allowed, e.g. {@code
   * PHI} to {@code SELECT} or {@code RETURN} to {@code BRANCH}.
   */
  public void setOpcode(Opcode opcode) {
    Preconditions.checkArgument(
        opcode.hasResultId() == this.opcode.hasResultId()
            && opcode.hasTypeId() == this.opcode.hasTypeId());
    this.opcode = opcode;
  }

  public boolean hasResultId() {
    return resultId != 0;
  }

  public int resultId() {
    return resultId;
  }

  public void setResultId(int resultId) {
    Preconditions.checkState(hasResultId() && resultId != 0);
    this.resultId = resultId;
  }

  public int typeId() {
    return typeId;
  }

  public int numOperands() {
    return operands.size();
  }

  public Operand operand(int index) {
    return operands.get(index);
  }

  /** Returns the id referenced by the operand at {@code index}, which must be an id operand. */
  public int idOperand(int index) {
    Operand operand = operands.get(index);
    Preconditions.checkState(operand.isId(), "Operand %s of %s is not an id", index, this);
    return operand.asId();
  }

  /** Returns the value of the literal operand at {@code index}. */
  public long literalOperand(int index) {
    Operand operand = operands.get(index);
    Preconditions.checkState(!operand.isId(), "Operand %s of %s is not a literal", index, this);
    return operand.value();
  }

  public void setOperand(int index, Operand operand) {
    operands.set(index, operand);
  }

  public void setIdOperand(int index, int id) {
    operands.set(index, Operand.id(id));
  }

  public void addOperand(Operand operand) {
    operands.add(operand);
  }

  public void setOperands(List<Operand> newOperands) {
    operands.clear();
    operands.addAll(newOperands);
  }

  /** An unmodifiable view of the operands. */
  public List<Operand> operands() {
    return Collections.unmodifiableList(operands);
  }

  /** Calls {@code consumer} with each id referenced by an operand, in operand order. */
  public void forEachIdOperand(IntConsumer consumer) {
    for (Operand operand : operands) {
      if (operand.isId()) {
        consumer.accept(operand.asId());
      }
    }
  }

  /** Returns a copy of this instruction with the same ids and operands. */
  public Instruction copy() {
    return new Instruction(opcode, typeId, resultId, operands);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (resultId != 0) {
      sb.append('%').append(resultId).append(" = ");
    }
    sb.append(opcode);
    if (typeId != 0) {
      sb.append(" %").append(typeId);
    }
    if (!operands.isEmpty()) {
      sb.append(StringUtil.joinElements(" ", " ", "", operands.size(), operands::get));
    }
    return sb.toString();
  }
}
