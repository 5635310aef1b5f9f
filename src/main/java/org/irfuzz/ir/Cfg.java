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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** The control-flow graph of one function, derived from its block terminators. */
public final class Cfg {

  private final Function function;
  private final Map<Integer, List<Integer>> preds = new HashMap<>();
  private final ImmutableList<Integer> reachable;

  Cfg(Function function) {
    this.function = function;
    for (Block block : function.blocks()) {
      preds.computeIfAbsent(block.id(), k -> new ArrayList<>());
      for (int succ : block.successorIds()) {
        preds.computeIfAbsent(succ, k -> new ArrayList<>()).add(block.id());
      }
    }
    reachable = computeReachable();
  }

  private ImmutableList<Integer> computeReachable() {
    if (function.blocks().isEmpty()) {
      return ImmutableList.of();
    }
    Set<Integer> seen = new LinkedHashSet<>();
    Deque<Integer> work = new ArrayDeque<>();
    work.push(function.entry().id());
    while (!work.isEmpty()) {
      int id = work.pop();
      Block block = function.findBlock(id);
      if (block == null || !seen.add(id)) {
        continue;
      }
      ImmutableList<Integer> succs = block.successorIds();
      for (int i = succs.size() - 1; i >= 0; i--) {
        work.push(succs.get(i));
      }
    }
    return ImmutableList.copyOf(seen);
  }

  public Function function() {
    return function;
  }

  /** The distinct predecessors of {@code blockId}, in layout order. */
  public ImmutableList<Integer> predecessors(int blockId) {
    List<Integer> result = preds.get(blockId);
    return (result == null) ? ImmutableList.of() : ImmutableList.copyOf(result);
  }

  public ImmutableList<Integer> successors(int blockId) {
    Block block = function.findBlock(blockId);
    return (block == null) ? ImmutableList.of() : block.successorIds();
  }

  /** The blocks reachable from the entry block, in depth-first preorder. */
  public ImmutableList<Integer> reachableBlocks() {
    return reachable;
  }

  public boolean isReachable(int blockId) {
    return reachable.contains(blockId);
  }

  /** The reachable blocks whose terminator is a return. */
  public ImmutableList<Integer> reachableReturnBlocks() {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    Set<Integer> seen = new HashSet<>();
    for (int id : reachable) {
      Block block = function.findBlock(id);
      Instruction terminator = block.terminator();
      if (terminator != null && terminator.opcode().isReturn() && seen.add(id)) {
        result.add(id);
      }
    }
    return result.build();
  }
}
