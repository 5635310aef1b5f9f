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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.IrContext;
import org.irfuzz.transform.MergeFunctionReturns;
import org.irfuzz.transform.ReturnMergingInfo;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;

/** Gives randomly chosen functions a single return. */
public class MergeFunctionReturnsPass extends FuzzerPass {

  public MergeFunctionReturnsPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    super(ir, transformationContext, fuzzerContext, transformations);
  }

  @Override
  public void apply() {
    for (Function function : ImmutableList.copyOf(ir.module().functions())) {
      if (function.blocks().isEmpty()
          || !fuzzerContext.choosePercentage(fuzzerContext.chanceOfMergingFunctionReturns())) {
        continue;
      }
      boolean isVoid = ir.types().isVoid(function.returnTypeId());
      ImmutableList.Builder<ReturnMergingInfo> infos = ImmutableList.builder();
      for (int mergeBlockId : MergeFunctionReturns.relevantMergeBlocks(ir, function)) {
        int isReturningId = fuzzerContext.freshId();
        int maybeReturnValId = isVoid ? 0 : fuzzerContext.freshId();
        // Existing value merges take placeholders that the transformation finds itself.
        infos.add(
            new ReturnMergingInfo(
                mergeBlockId, isReturningId, maybeReturnValId, ImmutableMap.of()));
      }
      int outerHeaderId = fuzzerContext.freshId();
      int outerReturnId = fuzzerContext.freshId();
      int returnValId = isVoid ? 0 : fuzzerContext.freshId();
      maybeApplyTransformation(
          new MergeFunctionReturns(
              function.id(), outerHeaderId, outerReturnId, returnValId, 0, infos.build()));
    }
  }
}
