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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * A fluent builder for modules. Globals may be declared at any time; instructions are appended to
 * the most recently started block of the most recently started function.
 *
 * <pre>{@code
 * Module module =
 *     new IrBuilder()
 *         .typeVoid(1)
 *         .typeFunction(2, 1)
 *         .function(3, 1, 2)
 *         .block(4)
 *         .returnVoid()
 *         .build();
 * }</pre>
 */
public final class IrBuilder {

  private final Module module = new Module();
  private @Nullable Function function;
  private @Nullable Block block;

  @CanIgnoreReturnValue
  public IrBuilder typeVoid(int id) {
    return global(Instruction.of(Opcode.TYPE_VOID, 0, id));
  }

  @CanIgnoreReturnValue
  public IrBuilder typeBool(int id) {
    return global(Instruction.of(Opcode.TYPE_BOOL, 0, id));
  }

  @CanIgnoreReturnValue
  public IrBuilder typeInt(int id, int width, boolean signed) {
    return global(
        Instruction.of(
            Opcode.TYPE_INT, 0, id, Operand.literal(width), Operand.literal(signed ? 1 : 0)));
  }

  @CanIgnoreReturnValue
  public IrBuilder typeFloat(int id, int width) {
    return global(Instruction.of(Opcode.TYPE_FLOAT, 0, id, Operand.literal(width)));
  }

  @CanIgnoreReturnValue
  public IrBuilder typeVector(int id, int componentTypeId, int count) {
    return global(
        Instruction.of(
            Opcode.TYPE_VECTOR, 0, id, Operand.id(componentTypeId), Operand.literal(count)));
  }

  @CanIgnoreReturnValue
  public IrBuilder typeStruct(int id, int... memberTypeIds) {
    return global(Instruction.withIds(Opcode.TYPE_STRUCT, 0, id, memberTypeIds));
  }

  @CanIgnoreReturnValue
  public IrBuilder typePointer(int id, int pointeeTypeId) {
    return global(Instruction.withIds(Opcode.TYPE_POINTER, 0, id, pointeeTypeId));
  }

  @CanIgnoreReturnValue
  public IrBuilder typeFunction(int id, int returnTypeId, int... paramTypeIds) {
    int[] ids = new int[paramTypeIds.length + 1];
    ids[0] = returnTypeId;
    System.arraycopy(paramTypeIds, 0, ids, 1, paramTypeIds.length);
    return global(Instruction.withIds(Opcode.TYPE_FUNCTION, 0, id, ids));
  }

  @CanIgnoreReturnValue
  public IrBuilder constantTrue(int id, int boolTypeId) {
    return global(Instruction.of(Opcode.CONSTANT_TRUE, boolTypeId, id));
  }

  @CanIgnoreReturnValue
  public IrBuilder constantFalse(int id, int boolTypeId) {
    return global(Instruction.of(Opcode.CONSTANT_FALSE, boolTypeId, id));
  }

  /** Declares a scalar constant whose literal holds {@code bits}. */
  @CanIgnoreReturnValue
  public IrBuilder constant(int id, int typeId, long bits) {
    return global(Instruction.of(Opcode.CONSTANT, typeId, id, Operand.literal(bits)));
  }

  @CanIgnoreReturnValue
  public IrBuilder constantComposite(int id, int typeId, int... componentIds) {
    return global(Instruction.withIds(Opcode.CONSTANT_COMPOSITE, typeId, id, componentIds));
  }

  @CanIgnoreReturnValue
  public IrBuilder undef(int id, int typeId) {
    return global(Instruction.of(Opcode.UNDEF, typeId, id));
  }

  @CanIgnoreReturnValue
  public IrBuilder globalVariable(int id, int pointerTypeId) {
    return global(Instruction.of(Opcode.VARIABLE, pointerTypeId, id));
  }

  @CanIgnoreReturnValue
  public IrBuilder global(Instruction instruction) {
    module.addGlobal(instruction);
    return this;
  }

  /** Starts a new function; subsequent parameters and blocks are added to it. */
  @CanIgnoreReturnValue
  public IrBuilder function(int id, int returnTypeId, int functionTypeId) {
    function = new Function(id, returnTypeId, functionTypeId);
    block = null;
    module.addFunction(function);
    return this;
  }

  @CanIgnoreReturnValue
  public IrBuilder param(int id, int typeId) {
    Preconditions.checkState(function != null && block == null, "Parameters precede blocks");
    function.addParam(Instruction.of(Opcode.FUNCTION_PARAMETER, typeId, id));
    module.updateIdBound(id);
    return this;
  }

  /** Starts a new block at the end of the current function. */
  @CanIgnoreReturnValue
  public IrBuilder block(int id) {
    Preconditions.checkState(function != null, "No current function");
    block = new Block(id);
    function.addBlock(block);
    module.updateIdBound(id);
    return this;
  }

  /** Appends an instruction to the current block. */
  @CanIgnoreReturnValue
  public IrBuilder add(Instruction instruction) {
    Preconditions.checkState(block != null, "No current block");
    block.add(instruction);
    if (instruction.hasResultId()) {
      module.updateIdBound(instruction.resultId());
    }
    return this;
  }

  /** Appends a value instruction whose operands are all ids. */
  @CanIgnoreReturnValue
  public IrBuilder op(Opcode opcode, int typeId, int resultId, int... operandIds) {
    return add(Instruction.withIds(opcode, typeId, resultId, operandIds));
  }

  /** Appends a value merge; {@code pairs} alternates value ids and predecessor block ids. */
  @CanIgnoreReturnValue
  public IrBuilder phi(int typeId, int resultId, int... pairs) {
    Preconditions.checkArgument(pairs.length % 2 == 0);
    return op(Opcode.PHI, typeId, resultId, pairs);
  }

  @CanIgnoreReturnValue
  public IrBuilder variable(int id, int pointerTypeId) {
    return add(Instruction.of(Opcode.VARIABLE, pointerTypeId, id));
  }

  @CanIgnoreReturnValue
  public IrBuilder load(int typeId, int resultId, int pointerId) {
    return op(Opcode.LOAD, typeId, resultId, pointerId);
  }

  @CanIgnoreReturnValue
  public IrBuilder store(int pointerId, int valueId) {
    return add(Instruction.withIds(Opcode.STORE, 0, 0, pointerId, valueId));
  }

  @CanIgnoreReturnValue
  public IrBuilder call(int typeId, int resultId, int functionId, int... argumentIds) {
    int[] ids = new int[argumentIds.length + 1];
    ids[0] = functionId;
    System.arraycopy(argumentIds, 0, ids, 1, argumentIds.length);
    return op(Opcode.FUNCTION_CALL, typeId, resultId, ids);
  }

  @CanIgnoreReturnValue
  public IrBuilder selectionMerge(int mergeBlockId) {
    return add(
        Instruction.of(Opcode.SELECTION_MERGE, Operand.id(mergeBlockId), Operand.literal(0)));
  }

  @CanIgnoreReturnValue
  public IrBuilder loopMerge(int mergeBlockId, int continueTargetId) {
    return add(
        Instruction.of(
            Opcode.LOOP_MERGE,
            Operand.id(mergeBlockId),
            Operand.id(continueTargetId),
            Operand.literal(0)));
  }

  @CanIgnoreReturnValue
  public IrBuilder branch(int targetId) {
    return add(Instruction.withIds(Opcode.BRANCH, 0, 0, targetId));
  }

  @CanIgnoreReturnValue
  public IrBuilder branchConditional(int conditionId, int trueTargetId, int falseTargetId) {
    return add(
        Instruction.withIds(
            Opcode.BRANCH_CONDITIONAL, 0, 0, conditionId, trueTargetId, falseTargetId));
  }

  @CanIgnoreReturnValue
  public IrBuilder returnVoid() {
    return add(Instruction.of(Opcode.RETURN));
  }

  @CanIgnoreReturnValue
  public IrBuilder returnValue(int valueId) {
    return add(Instruction.withIds(Opcode.RETURN_VALUE, 0, 0, valueId));
  }

  @CanIgnoreReturnValue
  public IrBuilder unreachable() {
    return add(Instruction.of(Opcode.UNREACHABLE));
  }

  public Module build() {
    return module;
  }
}
