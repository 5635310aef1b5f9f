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

package org.irfuzz.fuzz;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.transform.AddOpPhiSynonym;
import org.irfuzz.transform.FuzzerUtil;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;
import org.jspecify.annotations.Nullable;

/**
 * At randomly chosen blocks, adds a value merge that takes, from each predecessor, some member of
 * a synonym class that is available there; the result is a new member of the class.
 */
public class AddOpPhiSynonymsPass extends FuzzerPass {

  public AddOpPhiSynonymsPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    super(ir, transformationContext, fuzzerContext, transformations);
  }

  @Override
  public void apply() {
    List<Integer> blocks = new ArrayList<>();
    for (Function function : ir.module().functions()) {
      if (!function.blocks().isEmpty()) {
        blocks.addAll(ir.cfg(function.id()).reachableBlocks());
      }
    }
    for (int blockId : blocks) {
      if (!fuzzerContext.choosePercentage(fuzzerContext.chanceOfAddingOpPhiSynonym())) {
        continue;
      }
      List<Integer> preds = ir.cfg(ir.functionOfBlock(blockId).id()).predecessors(blockId);
      if (preds.isEmpty()) {
        continue;
      }
      List<Set<Integer>> classes = new ArrayList<>(factManager().synonymClasses());
      fuzzerContext.shuffle(classes);
      for (Set<Integer> synonyms : classes) {
        Map<Integer, Integer> predToId = chooseIds(preds, synonyms);
        if (predToId != null) {
          maybeApplyTransformation(
              new AddOpPhiSynonym(blockId, predToId, fuzzerContext.freshId()));
          break;
        }
      }
    }
  }

  /**
   * Chooses, for each predecessor, a member of {@code synonyms} available at its end. All chosen
   * ids have the same data type. Returns null if that is not possible.
   */
  private @Nullable Map<Integer, Integer> chooseIds(List<Integer> preds, Set<Integer> synonyms) {
    Map<Integer, List<Integer>> byType = new LinkedHashMap<>();
    for (int id : synonyms) {
      int typeId = ir.typeIdOf(id);
      if (FuzzerUtil.isDataType(ir, typeId)) {
        byType.computeIfAbsent(typeId, k -> new ArrayList<>()).add(id);
      }
    }
    for (List<Integer> members : byType.values()) {
      Map<Integer, Integer> result = new LinkedHashMap<>();
      for (int pred : preds) {
        Instruction terminator = ir.block(pred).terminator();
        List<Integer> available = new ArrayList<>();
        for (int id : members) {
          if (terminator != null
              && FuzzerUtil.idIsAvailableBeforeInstruction(ir, terminator, id)) {
            available.add(id);
          }
        }
        if (available.isEmpty()) {
          break;
        }
        result.put(pred, fuzzerContext.randomElement(available));
      }
      if (result.size() == preds.size()) {
        return result;
      }
    }
    return null;
  }
}
