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

/**
 * The operations of the IR. Type, constant and global-variable declarations are instructions too;
 * they live in {@link Module#globals()} rather than in a function body.
 *
 * <p>Operands are positional; which positions name blocks is described by {@link
 * #isLabelOperand}.
 */
public enum Opcode {
  // Type declarations: result id, no type id.
  TYPE_VOID(Category.TYPE),
  TYPE_BOOL(Category.TYPE),
  /** Operands: literal width, literal signedness (0 or 1). */
  TYPE_INT(Category.TYPE),
  /** Operands: literal width. */
  TYPE_FLOAT(Category.TYPE),
  /** Operands: component type, literal component count. */
  TYPE_VECTOR(Category.TYPE),
  /** Operands: column type, literal column count. */
  TYPE_MATRIX(Category.TYPE),
  /** Operands: element type, length (an integer constant). */
  TYPE_ARRAY(Category.TYPE),
  /** Operands: member types. */
  TYPE_STRUCT(Category.TYPE),
  /** Operands: pointee type. */
  TYPE_POINTER(Category.TYPE),
  /** Operands: return type, parameter types. */
  TYPE_FUNCTION(Category.TYPE),

  // Constants: result id and type id, no side effects.
  CONSTANT_TRUE(Category.CONSTANT),
  CONSTANT_FALSE(Category.CONSTANT),
  /** Operands: one literal holding the value bits. */
  CONSTANT(Category.CONSTANT),
  /** Operands: component constants. */
  CONSTANT_COMPOSITE(Category.CONSTANT),
  UNDEF(Category.CONSTANT),

  /** A global or function-local variable; the result type is a pointer. Operands: [initializer]. */
  VARIABLE(Category.VALUE, false),
  FUNCTION_PARAMETER(Category.VALUE, true),

  /** Operands: pointer. */
  LOAD(Category.VALUE, false),
  /** Operands: pointer, value. */
  STORE(Category.VOID, false),
  /** Operands: base pointer, indices. */
  ACCESS_CHAIN(Category.VALUE, true),
  COPY_OBJECT(Category.VALUE, true),
  /** Operands: callee function, arguments. The result type may be void. */
  FUNCTION_CALL(Category.VALUE, false),

  IADD(Category.VALUE, true),
  ISUB(Category.VALUE, true),
  IMUL(Category.VALUE, true),
  SDIV(Category.VALUE, true),
  SNEGATE(Category.VALUE, true),
  BITWISE_AND(Category.VALUE, true),
  BITWISE_OR(Category.VALUE, true),
  BITWISE_XOR(Category.VALUE, true),
  NOT(Category.VALUE, true),
  SHIFT_LEFT_LOGICAL(Category.VALUE, true),
  FADD(Category.VALUE, true),
  FSUB(Category.VALUE, true),
  FMUL(Category.VALUE, true),
  FDIV(Category.VALUE, true),
  LOGICAL_AND(Category.VALUE, true),
  LOGICAL_OR(Category.VALUE, true),
  LOGICAL_NOT(Category.VALUE, true),
  IEQUAL(Category.VALUE, true),
  INOT_EQUAL(Category.VALUE, true),
  SLESS_THAN(Category.VALUE, true),
  SLESS_THAN_EQUAL(Category.VALUE, true),
  SGREATER_THAN(Category.VALUE, true),
  ULESS_THAN(Category.VALUE, true),
  /** Operands: condition, value if true, value if false. */
  SELECT(Category.VALUE, true),
  /** Operands: pairs of (value, predecessor block). */
  PHI(Category.VALUE, true),
  COMPOSITE_CONSTRUCT(Category.VALUE, true),
  /** Operands: composite, literal indices. */
  COMPOSITE_EXTRACT(Category.VALUE, true),
  /** Must stay in the same block as its uses. */
  SAMPLED_IMAGE(Category.VALUE, false),

  /** Operands: literal execution scope, literal memory scope, literal semantics. */
  CONTROL_BARRIER(Category.VOID, false),
  /** Operands: literal memory scope, literal semantics. */
  MEMORY_BARRIER(Category.VOID, false),

  /** Operands: merge block, literal selection control. */
  SELECTION_MERGE(Category.MERGE),
  /** Operands: merge block, continue target, literal loop control. */
  LOOP_MERGE(Category.MERGE),

  /** Operands: target block. */
  BRANCH(Category.TERMINATOR),
  /** Operands: condition, true target, false target. */
  BRANCH_CONDITIONAL(Category.TERMINATOR),
  RETURN(Category.TERMINATOR),
  /** Operands: value. */
  RETURN_VALUE(Category.TERMINATOR),
  KILL(Category.TERMINATOR),
  UNREACHABLE(Category.TERMINATOR);

  /** Broad grouping of opcodes, which determines whether they have result and type ids. */
  public enum Category {
    TYPE,
    CONSTANT,
    /** Instructions in a function body that produce a typed result. */
    VALUE,
    /** Instructions in a function body with no result. */
    VOID,
    MERGE,
    TERMINATOR
  }

  public final Category category;

  /** True if executing this instruction can have no effect other than computing its result. */
  public final boolean noSideEffects;

  Opcode(Category category) {
    this(category, category == Category.TYPE || category == Category.CONSTANT);
  }

  Opcode(Category category, boolean noSideEffects) {
    this.category = category;
    this.noSideEffects = noSideEffects;
  }

  public boolean hasResultId() {
    return category == Category.TYPE
        || category == Category.CONSTANT
        || category == Category.VALUE;
  }

  public boolean hasTypeId() {
    return category == Category.CONSTANT || category == Category.VALUE;
  }

  public boolean isTerminator() {
    return category == Category.TERMINATOR;
  }

  /** True for the terminators that transfer control to another block of the same function. */
  public boolean isBranch() {
    return this == BRANCH || this == BRANCH_CONDITIONAL;
  }

  public boolean isReturn() {
    return this == RETURN || this == RETURN_VALUE;
  }

  public boolean isBarrier() {
    return this == CONTROL_BARRIER || this == MEMORY_BARRIER;
  }

  /** True if the operand at the given position of an instruction with this opcode names a block. */
  public boolean isLabelOperand(int index) {
    return switch (this) {
      case PHI -> index % 2 == 1;
      case BRANCH, SELECTION_MERGE -> index == 0;
      case LOOP_MERGE -> index == 0 || index == 1;
      case BRANCH_CONDITIONAL -> index == 1 || index == 2;
      default -> false;
    };
  }
}
