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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.irfuzz.fact.Fact;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Opcode;

/**
 * Adds a value merge to the start of a block, taking from each predecessor an id that is known
 * to be synonymous with the ids taken from the other predecessors. The result of the merge is
 * then synonymous with all of them.
 *
 * <pre>
 * %fresh = PHI %type %id_1 %pred_1 ... %id_n %pred_n
 * </pre>
 */
public final class AddOpPhiSynonym implements Transformation {

  private final int blockId;
  private final ImmutableMap<Integer, Integer> predToId;
  private final int freshId;

  /**
   * @param predToId maps each predecessor of the block to the id to take from it; iteration order
   *     determines the order of the merge's operands
   */
  public AddOpPhiSynonym(int blockId, Map<Integer, Integer> predToId, int freshId) {
    this.blockId = blockId;
    this.predToId = ImmutableMap.copyOf(predToId);
    this.freshId = freshId;
  }

  static AddOpPhiSynonym fromMessage(TransformationMessage.Reader reader) {
    int blockId = reader.next();
    int numPairs = reader.nextLength(2);
    ImmutableMap.Builder<Integer, Integer> predToId = ImmutableMap.builder();
    for (int i = 0; i < numPairs; i++) {
      predToId.put(reader.next(), reader.next());
    }
    return new AddOpPhiSynonym(blockId, predToId.buildOrThrow(), reader.next());
  }

  @Override
  public boolean isApplicable(IrContext ir, TransformationContext context) {
    Block block = ir.block(blockId);
    if (block == null || !FuzzerUtil.isFreshId(ir, freshId)) {
      return false;
    }
    ImmutableList<Integer> preds = ir.cfg(ir.functionOfBlock(blockId).id()).predecessors(blockId);
    if (preds.isEmpty() || !new HashSet<>(preds).equals(predToId.keySet())) {
      return false;
    }
    int typeId = 0;
    int firstId = 0;
    for (Map.Entry<Integer, Integer> entry : predToId.entrySet()) {
      int id = entry.getValue();
      Instruction def = ir.def(id);
      if (def == null || def.typeId() == 0) {
        return false;
      }
      if (context.factManager().idIsIrrelevant(id)
          || context.factManager().pointeeValueIsIrrelevant(id)) {
        return false;
      }
      if (typeId == 0) {
        typeId = def.typeId();
        firstId = id;
        if (!FuzzerUtil.isDataType(ir, typeId)) {
          return false;
        }
      } else if (def.typeId() != typeId
          || !context.factManager().isSynonymous(firstId, id)) {
        return false;
      }
      Instruction predTerminator = ir.block(entry.getKey()).terminator();
      if (predTerminator == null
          || !FuzzerUtil.idIsAvailableBeforeInstruction(ir, predTerminator, id)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void apply(IrContext ir, TransformationContext context) {
    Block block = ir.block(blockId);
    List<Integer> operands = new ArrayList<>();
    predToId.forEach(
        (pred, id) -> {
          operands.add(id);
          operands.add(pred);
        });
    int typeId = ir.typeIdOf(predToId.values().iterator().next());
    block.insert(
        0,
        Instruction.withIds(
            Opcode.PHI, typeId, freshId, operands.stream().mapToInt(Integer::intValue).toArray()));
    FuzzerUtil.updateModuleIdBound(ir, freshId);
    ir.invalidateAnalyses();
    for (int id : ImmutableSet.copyOf(predToId.values())) {
      context.factManager().addFact(new Fact.IdSynonym(freshId, id));
    }
  }

  @Override
  public TransformationMessage toMessage() {
    TransformationMessage.Writer writer =
        new TransformationMessage.Writer(TransformationKind.ADD_OP_PHI_SYNONYM).add(blockId);
    writer.add(predToId.size());
    predToId.forEach((pred, id) -> writer.add(pred).add(id));
    return writer.add(freshId).build();
  }

  @Override
  public String toString() {
    return toMessage().toString();
  }
}
