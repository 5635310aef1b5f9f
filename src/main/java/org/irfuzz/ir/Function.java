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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function: its id, its return and function types, its parameters, and its blocks in layout
 * order. The first block is the entry block.
 */
public final class Function {

  private final int id;
  private final int returnTypeId;
  private final int functionTypeId;
  private final List<Instruction> params = new ArrayList<>();
  private final List<Block> blocks = new ArrayList<>();

  public Function(int id, int returnTypeId, int functionTypeId) {
    this.id = id;
    this.returnTypeId = returnTypeId;
    this.functionTypeId = functionTypeId;
  }

  public int id() {
    return id;
  }

  public int returnTypeId() {
    return returnTypeId;
  }

  public int functionTypeId() {
    return functionTypeId;
  }

  /** The {@link Opcode#FUNCTION_PARAMETER} instructions, in order. */
  public List<Instruction> params() {
    return Collections.unmodifiableList(params);
  }

  public void addParam(Instruction param) {
    Preconditions.checkArgument(param.opcode() == Opcode.FUNCTION_PARAMETER);
    params.add(param);
  }

  /** An unmodifiable view of the blocks in layout order. */
  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public Block entry() {
    Preconditions.checkState(!blocks.isEmpty(), "Function %s has no blocks", this);
    return blocks.get(0);
  }

  public @Nullable Block findBlock(int blockId) {
    for (Block block : blocks) {
      if (block.id() == blockId) {
        return block;
      }
    }
    return null;
  }

  private int indexOf(Block block) {
    int index = blocks.indexOf(block);
    Preconditions.checkArgument(index >= 0, "%s is not in function %s", block, this);
    return index;
  }

  public void addBlock(Block block) {
    blocks.add(block);
  }

  public void insertBlockAfter(Block block, Block after) {
    blocks.add(indexOf(after) + 1, block);
  }

  public void insertBlockBefore(Block block, Block before) {
    blocks.add(indexOf(before), block);
  }

  /** Moves the block with the given id so that it is laid out immediately after {@code after}. */
  public void moveBlockAfter(int blockId, Block after) {
    Block block = findBlock(blockId);
    Preconditions.checkArgument(block != null, "No block %s in %s", blockId, this);
    if (block == after) {
      return;
    }
    blocks.remove(block);
    insertBlockAfter(block, after);
  }

  /**
   * Splits {@code block} before the instruction at {@code index}. That instruction and everything
   * after it move to a new block with label {@code newBlockId}, laid out immediately after {@code
   * block}; {@code block} is left without a terminator. Value merges in the successors of the new
   * block that named {@code block} as a predecessor are updated to name the new block.
   *
   * <p>The caller is responsible for registering {@code newBlockId} with the module's id bound.
   */
  @CanIgnoreReturnValue
  public Block splitBlock(Block block, int index, int newBlockId) {
    Preconditions.checkArgument(index >= block.firstNonPhiIndex() && index < block.size());
    Block newBlock = new Block(newBlockId);
    block.removeFrom(index).forEach(newBlock::add);
    insertBlockAfter(newBlock, block);
    for (int succId : newBlock.successorIds()) {
      Block succ = findBlock(succId);
      if (succ != null) {
        succ.phis().forEach(phi -> replacePhiPredecessor(phi, block.id(), newBlockId));
      }
    }
    return newBlock;
  }

  /** Rewrites each (value, {@code from}) pair of a value merge to (value, {@code to}). */
  public static void replacePhiPredecessor(Instruction phi, int from, int to) {
    for (int i = 1; i < phi.numOperands(); i += 2) {
      if (phi.idOperand(i) == from) {
        phi.setIdOperand(i, to);
      }
    }
  }

  @Override
  public String toString() {
    return "%" + id;
  }
}
