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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.DefUse;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.transform.FuzzerUtil;
import org.irfuzz.transform.IdUseDescriptor;
import org.irfuzz.transform.ReplaceIrrelevantId;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;

/** Replaces randomly chosen uses of irrelevant ids with other available ids of the same type. */
public class ReplaceIrrelevantIdsPass extends FuzzerPass {

  public ReplaceIrrelevantIdsPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    super(ir, transformationContext, fuzzerContext, transformations);
  }

  @Override
  public void apply() {
    DefUse defUse = ir.defUse();
    List<IdUseDescriptor> uses = new ArrayList<>();
    for (int id : factManager().irrelevantIds()) {
      for (DefUse.Use use : defUse.uses(id)) {
        if (FuzzerUtil.idUseCanBeReplaced(ir, use.user(), use.operandIndex())) {
          uses.add(
              IdUseDescriptor.of(defUse.blockOf(use.user()), use.user(), use.operandIndex()));
        }
      }
    }
    if (uses.isEmpty()) {
      return;
    }

    // No replacement defines a new id, so the candidates stay valid throughout.
    Map<Integer, List<Integer>> idsByType = idsByType();
    for (IdUseDescriptor use : uses) {
      if (!fuzzerContext.choosePercentage(fuzzerContext.chanceOfReplacingIrrelevantId())) {
        continue;
      }
      Instruction user = use.findContainingInstruction(ir);
      if (user == null) {
        continue;
      }
      int idOfInterest = use.idOfInterest();
      List<Integer> candidates = new ArrayList<>();
      for (int id : idsByType.getOrDefault(ir.typeIdOf(idOfInterest), List.of())) {
        if (id != idOfInterest && FuzzerUtil.idIsAvailableAtUse(ir, user, use.operandIndex(), id)) {
          candidates.add(id);
        }
      }
      if (!candidates.isEmpty()) {
        maybeApplyTransformation(
            new ReplaceIrrelevantId(use, fuzzerContext.randomElement(candidates)));
      }
    }
  }

  /** Every non-pointer value in the module, grouped by type id, in module order. */
  private Map<Integer, List<Integer>> idsByType() {
    Map<Integer, List<Integer>> result = new HashMap<>();
    List<Instruction> values = new ArrayList<>(ir.module().globals());
    for (Function function : ir.module().functions()) {
      values.addAll(function.params());
      for (Block block : function.blocks()) {
        values.addAll(block.instructions());
      }
    }
    for (Instruction value : values) {
      if (value.hasResultId()
          && value.typeId() != 0
          && !ir.types().isPointer(value.typeId())
          && !ir.types().isVoid(value.typeId())) {
        result.computeIfAbsent(value.typeId(), k -> new ArrayList<>()).add(value.resultId());
      }
    }
    return result;
  }
}
