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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A basic block: a label id and an ordered list of instructions. A complete block ends with
 * exactly one terminator; a structured header additionally has a merge instruction ({@link
 * Opcode#SELECTION_MERGE} or {@link Opcode#LOOP_MERGE}) immediately before its terminator. Value
 * merges ({@link Opcode#PHI}) come first.
 *
 * <p>Edges are not stored; they are read from the terminator's operands.
 */
public final class Block {

  private final int id;

  private final List<Instruction> instructions = new ArrayList<>();

  public Block(int id) {
    Preconditions.checkArgument(id > 0);
    this.id = id;
  }

  /** The block's label id. */
  public int id() {
    return id;
  }

  /** An unmodifiable view of this block's instructions. */
  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  public int size() {
    return instructions.size();
  }

  public Instruction get(int index) {
    return instructions.get(index);
  }

  public int indexOf(Instruction instruction) {
    for (int i = 0; i < instructions.size(); i++) {
      if (instructions.get(i) == instruction) {
        return i;
      }
    }
    return -1;
  }

  public void add(Instruction instruction) {
    instructions.add(instruction);
  }

  public void insert(int index, Instruction instruction) {
    instructions.add(index, instruction);
  }

  public void remove(Instruction instruction) {
    int index = indexOf(instruction);
    Preconditions.checkArgument(index >= 0, "%s is not in block %s", instruction, id);
    instructions.remove(index);
  }

  /**
   * Removes the instructions from {@code from} to the end of the block and returns them in order.
   */
  List<Instruction> removeFrom(int from) {
    List<Instruction> tail = instructions.subList(from, instructions.size());
    List<Instruction> result = new ArrayList<>(tail);
    tail.clear();
    return result;
  }

  /** Returns the last instruction if it is a terminator, null otherwise. */
  public @Nullable Instruction terminator() {
    if (instructions.isEmpty()) {
      return null;
    }
    Instruction last = instructions.get(instructions.size() - 1);
    return last.opcode().isTerminator() ? last : null;
  }

  /** Returns the merge instruction if this block is a structured header, null otherwise. */
  public @Nullable Instruction mergeInstruction() {
    if (instructions.size() < 2 || terminator() == null) {
      return null;
    }
    Instruction candidate = instructions.get(instructions.size() - 2);
    return candidate.opcode().category == Opcode.Category.MERGE ? candidate : null;
  }

  public boolean isLoopHeader() {
    Instruction merge = mergeInstruction();
    return merge != null && merge.opcode() == Opcode.LOOP_MERGE;
  }

  public boolean isSelectionHeader() {
    Instruction merge = mergeInstruction();
    return merge != null && merge.opcode() == Opcode.SELECTION_MERGE;
  }

  /** The merge block named by this header, or 0 if this block is not a header. */
  public int mergeBlockId() {
    Instruction merge = mergeInstruction();
    return (merge == null) ? 0 : merge.idOperand(0);
  }

  /** The continue target named by this loop header, or 0 if this block is not a loop header. */
  public int continueTargetId() {
    return isLoopHeader() ? mergeInstruction().idOperand(1) : 0;
  }

  /** The value merges at the start of this block. */
  public ImmutableList<Instruction> phis() {
    ImmutableList.Builder<Instruction> result = ImmutableList.builder();
    for (Instruction instruction : instructions) {
      if (instruction.opcode() != Opcode.PHI) {
        break;
      }
      result.add(instruction);
    }
    return result.build();
  }

  /** The index of the first instruction that is not a value merge. */
  public int firstNonPhiIndex() {
    int i = 0;
    while (i < instructions.size() && instructions.get(i).opcode() == Opcode.PHI) {
      i++;
    }
    return i;
  }

  /**
   * The distinct blocks that this block's terminator may transfer control to, in operand order.
   * Empty if the block has no terminator or ends the function.
   */
  public ImmutableList<Integer> successorIds() {
    Instruction terminator = terminator();
    if (terminator == null) {
      return ImmutableList.of();
    }
    return switch (terminator.opcode()) {
      case BRANCH -> ImmutableList.of(terminator.idOperand(0));
      case BRANCH_CONDITIONAL -> {
        int t = terminator.idOperand(1);
        int f = terminator.idOperand(2);
        yield (t == f) ? ImmutableList.of(t) : ImmutableList.of(t, f);
      }
      default -> ImmutableList.of();
    };
  }

  @Override
  public String toString() {
    return "%" + id;
  }
}
