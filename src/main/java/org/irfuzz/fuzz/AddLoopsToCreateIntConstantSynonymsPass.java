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
import java.util.Arrays;
import java.util.List;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.Type;
import org.irfuzz.transform.AddLoopToCreateIntConstantSynonym;
import org.irfuzz.transform.FuzzerUtil;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;
import org.jspecify.annotations.Nullable;

/**
 * Before randomly chosen blocks, adds a loop that computes an existing integer constant C from two
 * other existing constants I and S, as I - S * N, and makes its result a synonym of C.
 */
public class AddLoopsToCreateIntConstantSynonymsPass extends FuzzerPass {

  public AddLoopsToCreateIntConstantSynonymsPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    super(ir, transformationContext, fuzzerContext, transformations);
  }

  @Override
  public void apply() {
    List<Integer> intConstants = new ArrayList<>();
    List<Integer> iterationCounts = new ArrayList<>();
    for (Instruction global : ir.module().globals()) {
      int id = global.resultId();
      long[] components = ir.constants().integerComponents(id);
      if (components == null) {
        continue;
      }
      intConstants.add(id);
      Type type = ir.types().type(global.typeId());
      if (type instanceof Type.Int t
          && t.width() == 32
          && components[0] >= 1
          && components[0] <= AddLoopToCreateIntConstantSynonym.MAX_ITERATIONS) {
        iterationCounts.add(id);
      }
    }
    if (iterationCounts.isEmpty()) {
      return;
    }

    List<Integer> blocks = new ArrayList<>();
    for (Function function : ir.module().functions()) {
      for (Block block : function.blocks()) {
        blocks.add(block.id());
      }
    }
    for (int blockId : blocks) {
      if (!fuzzerContext.choosePercentage(
          fuzzerContext.chanceOfAddingLoopToCreateIntConstantSynonym())) {
        continue;
      }
      int constantId = fuzzerContext.randomElement(intConstants);
      if (factManager().idIsIrrelevant(constantId)) {
        continue;
      }
      int numIterationsId = fuzzerContext.randomElement(iterationCounts);
      long numIterations = ir.constants().integerComponents(numIterationsId)[0];
      int[] initialAndStep = findInitialAndStep(intConstants, constantId, numIterations);
      if (initialAndStep == null) {
        continue;
      }
      List<Integer> ids = fuzzerContext.freshIds(AddLoopToCreateIntConstantSynonym.NUM_FRESH_IDS);
      int additionalBlockId =
          fuzzerContext.choosePercentage(
                  fuzzerContext.chanceOfHavingTwoBlocksInLoopToCreateIntSynonym())
              ? fuzzerContext.freshId()
              : 0;
      maybeApplyTransformation(
          new AddLoopToCreateIntConstantSynonym(
              constantId,
              initialAndStep[0],
              initialAndStep[1],
              numIterationsId,
              blockId,
              ids.get(0),
              ids.get(1),
              ids.get(2),
              ids.get(3),
              ids.get(4),
              ids.get(5),
              ids.get(6),
              additionalBlockId));
    }
  }

  /**
   * Tries the constants of C's type (up to signedness) as the step S, in random order, and returns
   * {I, S} for the first one for which there is also a constant I = C + S * N. Returns null if
   * there is none.
   */
  private int @Nullable [] findInitialAndStep(List<Integer> intConstants, int constantId, long n) {
    int typeId = ir.typeIdOf(constantId);
    long[] c = ir.constants().integerComponents(constantId);
    List<Integer> sameType = new ArrayList<>();
    for (int id : intConstants) {
      if (FuzzerUtil.typesAreEqualUpToSign(ir, typeId, ir.typeIdOf(id))) {
        sameType.add(id);
      }
    }
    List<Integer> steps = new ArrayList<>(sameType);
    fuzzerContext.shuffle(steps);
    for (int stepId : steps) {
      long[] s = ir.constants().integerComponents(stepId);
      long[] wanted = new long[c.length];
      for (int k = 0; k < c.length; k++) {
        wanted[k] = c[k] + s[k] * n;
      }
      for (int initialId : sameType) {
        if (Arrays.equals(wanted, ir.constants().integerComponents(initialId))) {
          return new int[] {initialId, stepId};
        }
      }
    }
    return null;
  }
}
