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
import java.util.List;
import org.irfuzz.ir.Block;
import org.irfuzz.ir.Function;
import org.irfuzz.ir.IrContext;
import org.irfuzz.transform.AddLoopPreheader;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;

/** Adds preheaders to randomly chosen loops that do not already have one. */
public class AddLoopPreheadersPass extends FuzzerPass {

  public AddLoopPreheadersPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    super(ir, transformationContext, fuzzerContext, transformations);
  }

  @Override
  public void apply() {
    List<Integer> headers = new ArrayList<>();
    for (Function function : ir.module().functions()) {
      for (Block block : function.blocks()) {
        if (block.isLoopHeader()) {
          headers.add(block.id());
        }
      }
    }
    for (int headerId : headers) {
      if (!fuzzerContext.choosePercentage(fuzzerContext.chanceOfAddingLoopPreheader())) {
        continue;
      }
      Block header = ir.block(headerId);
      if (!ir.cfg(ir.functionOfBlock(headerId).id()).isReachable(headerId)
          || AddLoopPreheader.maybeFindLoopPreheader(ir, header) != 0) {
        continue;
      }
      maybeApplyTransformation(
          new AddLoopPreheader(
              headerId,
              fuzzerContext.freshId(),
              fuzzerContext.freshIds(AddLoopPreheader.numPhiIdsNeeded(ir, header))));
    }
  }
}
