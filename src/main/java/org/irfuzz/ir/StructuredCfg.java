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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Classifies blocks by their role in the structured control flow of a module.
 *
 * <p>The construct headed by H is the set of blocks other than H that H dominates and H's merge
 * block does not. A block is in a loop if it is in the construct of a loop header; the innermost
 * such loop is the one whose header is deepest in the dominator tree.
 */
public final class StructuredCfg {

  private final Set<Integer> mergeBlocks = new HashSet<>();
  private final Set<Integer> continueTargets = new HashSet<>();
  private final Map<Integer, Integer> headerOfMerge = new HashMap<>();
  private final Map<Integer, Integer> innermostLoopHeader = new HashMap<>();
  private final Map<Integer, Integer> loopDepth = new HashMap<>();
  private final Map<Integer, Integer> mergeOfHeader = new HashMap<>();

  StructuredCfg(IrContext context) {
    for (Function function : context.module().functions()) {
      if (function.blocks().isEmpty()) {
        continue;
      }
      Cfg cfg = context.cfg(function.id());
      DominatorTree doms = context.dominators(function.id());
      Set<Integer> loopHeaders = new HashSet<>();
      for (Block block : function.blocks()) {
        int merge = block.mergeBlockId();
        if (merge == 0) {
          continue;
        }
        mergeBlocks.add(merge);
        headerOfMerge.put(merge, block.id());
        mergeOfHeader.put(block.id(), merge);
        if (block.isLoopHeader()) {
          continueTargets.add(block.continueTargetId());
          loopHeaders.add(block.id());
        }
      }
      for (int blockId : cfg.reachableBlocks()) {
        int innermost = 0;
        int depth = 0;
        for (int header : loopHeaders) {
          if (header != blockId
              && doms.dominates(header, blockId)
              && !doms.dominates(mergeOfHeader.get(header), blockId)) {
            depth++;
            if (innermost == 0 || doms.depth(header) > doms.depth(innermost)) {
              innermost = header;
            }
          }
        }
        innermostLoopHeader.put(blockId, innermost);
        loopDepth.put(blockId, depth);
      }
    }
  }

  /** True if {@code blockId} is named as the merge block of some header. */
  public boolean isMergeBlock(int blockId) {
    return mergeBlocks.contains(blockId);
  }

  /** True if {@code blockId} is named as the continue target of some loop header. */
  public boolean isContinueBlock(int blockId) {
    return continueTargets.contains(blockId);
  }

  /** The header whose merge block is {@code blockId}, or 0. */
  public int headerOfMerge(int blockId) {
    return headerOfMerge.getOrDefault(blockId, 0);
  }

  /** The header of the innermost loop containing {@code blockId}, or 0 if there is none. */
  public int innermostLoopHeader(int blockId) {
    return innermostLoopHeader.getOrDefault(blockId, 0);
  }

  /** The merge block of the innermost loop containing {@code blockId}, or 0 if there is none. */
  public int loopMergeBlock(int blockId) {
    int header = innermostLoopHeader(blockId);
    return (header == 0) ? 0 : mergeOfHeader.get(header);
  }

  /** The number of loops containing {@code blockId}. */
  public int loopNestingDepth(int blockId) {
    return loopDepth.getOrDefault(blockId, 0);
  }
}
