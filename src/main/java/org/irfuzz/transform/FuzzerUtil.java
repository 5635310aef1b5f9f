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
import java.util.Set;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.DefUse;
import org.irfuzz.ir.DominatorTree;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;
import org.irfuzz.ir.Type;

/** Static-only helpers shared by transformations and fuzzer passes. */
public class FuzzerUtil {

  private FuzzerUtil() {}

  /** True if {@code id} is a valid id that is not defined anywhere in the module. */
  public static boolean isFreshId(IrContext ir, int id) {
    return id > 0 && !ir.isDefined(id);
  }

  /**
   * True if {@code id} is fresh and not already in {@code usedIds}; in that case it is added to
   * {@code usedIds}.
   */
  public static boolean checkIdIsFreshAndNotUsedByThisTransformation(
      int id, IrContext ir, Set<Integer> usedIds) {
    return isFreshId(ir, id) && usedIds.add(id);
  }

  /** Registers each of {@code ids} with the module's id bound. */
  public static void updateModuleIdBound(IrContext ir, int... ids) {
    for (int id : ids) {
      ir.updateIdBound(id);
    }
  }

  public static boolean instructionHasNoSideEffects(Instruction instruction) {
    return instruction.opcode().noSideEffects;
  }

  /**
   * True if {@code id} can be used as operand {@code operandIndex} of {@code use}. For a value
   * merge the definition must be available at the end of the corresponding predecessor;
   * otherwise it must be available before {@code use}.
   */
  public static boolean idIsAvailableAtUse(
      IrContext ir, Instruction use, int operandIndex, int id) {
    if (use.opcode() == Opcode.PHI) {
      int pred = use.idOperand(operandIndex + 1);
      Block predBlock = ir.block(pred);
      Instruction terminator = (predBlock == null) ? null : predBlock.terminator();
      return terminator != null && idIsAvailableBeforeInstruction(ir, terminator, id);
    }
    return idIsAvailableBeforeInstruction(ir, use, id);
  }

  /**
   * True if the value {@code id} is defined on every path to {@code instruction}: it is a global,
   * a parameter of the enclosing function, or the result of an instruction that precedes {@code
   * instruction} in its block or is in a block that strictly dominates it.
   */
  public static boolean idIsAvailableBeforeInstruction(
      IrContext ir, Instruction instruction, int id) {
    DefUse defUse = ir.defUse();
    Instruction def = defUse.def(id);
    if (def == null || def.typeId() == 0 || def == instruction) {
      return false;
    }
    if (defUse.isGlobal(def)) {
      return true;
    }
    Function function = defUse.functionOf(instruction);
    if (function == null || defUse.functionOf(def) != function) {
      return false;
    }
    Block defBlock = defUse.blockOf(def);
    if (defBlock == null) {
      // A parameter of the same function.
      return true;
    }
    Block useBlock = defUse.blockOf(instruction);
    if (useBlock == null) {
      return false;
    }
    if (defBlock == useBlock) {
      return defBlock.indexOf(def) < useBlock.indexOf(instruction);
    }
    DominatorTree doms = ir.dominators(function.id());
    return doms.strictlyDominates(defBlock.id(), useBlock.id());
  }

  /**
   * True if operand {@code operandIndex} of {@code use} may be replaced by any other id of the
   * same type. That excludes literal operands, block labels, the callee of a call, the indices of
   * an access chain, variable initializers, and operands of global declarations.
   */
  public static boolean idUseCanBeReplaced(IrContext ir, Instruction use, int operandIndex) {
    if (operandIndex < 0 || operandIndex >= use.numOperands()) {
      return false;
    }
    Opcode opcode = use.opcode();
    if (!use.operand(operandIndex).isId() || opcode.isLabelOperand(operandIndex)) {
      return false;
    }
    if (ir.defUse().blockOf(use) == null) {
      return false;
    }
    return switch (opcode) {
      case FUNCTION_CALL -> operandIndex != 0;
      case ACCESS_CHAIN -> operandIndex == 0;
      case VARIABLE -> false;
      default -> true;
    };
  }

  /** The blocks of {@code function} that end in a return and are reachable from its entry. */
  public static ImmutableList<Integer> reachableReturnBlocks(IrContext ir, int functionId) {
    return ir.cfg(functionId).reachableReturnBlocks();
  }

  /** The id of a boolean constant with the given value, or 0 if the module has none. */
  public static int maybeGetBoolConstant(IrContext ir, boolean value) {
    return ir.constants().boolConstantId(value);
  }

  /**
   * True if the two type ids denote the same type, except perhaps for the signedness of integer
   * components.
   */
  public static boolean typesAreEqualUpToSign(IrContext ir, int typeId1, int typeId2) {
    return ir.types().equalUpToSign(typeId1, typeId2);
  }

  /** True if {@code typeId} is a boolean, numeric, or composite type. */
  public static boolean isDataType(IrContext ir, int typeId) {
    Type type = ir.types().type(typeId);
    return type instanceof Type.Bool
        || type instanceof Type.Int
        || type instanceof Type.Float
        || type instanceof Type.Vector
        || type instanceof Type.Matrix
        || type instanceof Type.Array
        || type instanceof Type.Struct;
  }
}
