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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * A dominator (or post-dominator) tree over the blocks of one function, computed with the
 * iterative algorithm of Cooper, Harvey and Kennedy ("A Simple, Fast Dominance Algorithm").
 *
 * <p>Only blocks reachable from the root are in the tree. The post-dominator tree is rooted at a
 * virtual exit node, {@link #VIRTUAL_EXIT}, whose predecessors are the blocks with no successors;
 * blocks that cannot reach a function exit are not in it.
 */
public final class DominatorTree {

  /** The id used for the root of a post-dominator tree. */
  public static final int VIRTUAL_EXIT = 0;

  /** The block ids in reverse postorder; index 0 is the root. */
  private final int[] order;

  /** For each index in {@link #order}, the index of its immediate dominator (root: itself). */
  private final int[] idom;

  private final Map<Integer, Integer> indexOf = new HashMap<>();

  private DominatorTree(
      int root, IntFunction<List<Integer>> succs, IntFunction<List<Integer>> preds) {
    List<Integer> postorder = new ArrayList<>();
    postorder(root, succs, new HashSet<>(), postorder);
    int n = postorder.size();
    order = new int[n];
    for (int i = 0; i < n; i++) {
      order[i] = postorder.get(n - 1 - i);
      indexOf.put(order[i], i);
    }
    idom = new int[n];
    Arrays.fill(idom, -1);
    idom[0] = 0;
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = 1; i < n; i++) {
        int newIdom = -1;
        for (int pred : preds.apply(order[i])) {
          Integer p = indexOf.get(pred);
          if (p == null || idom[p] < 0) {
            continue;
          }
          newIdom = (newIdom < 0) ? p : intersect(p, newIdom);
        }
        if (newIdom != idom[i]) {
          idom[i] = newIdom;
          changed = true;
        }
      }
    }
  }

  /** Iterative depth-first walk; {@code out} receives the nodes in postorder. */
  private static void postorder(
      int root, IntFunction<List<Integer>> succs, Set<Integer> seen, List<Integer> out) {
    List<int[]> stack = new ArrayList<>();
    seen.add(root);
    stack.add(new int[] {root, 0});
    while (!stack.isEmpty()) {
      int[] top = stack.get(stack.size() - 1);
      List<Integer> next = succs.apply(top[0]);
      if (top[1] < next.size()) {
        int succ = next.get(top[1]++);
        if (seen.add(succ)) {
          stack.add(new int[] {succ, 0});
        }
      } else {
        out.add(top[0]);
        stack.remove(stack.size() - 1);
      }
    }
  }

  private int intersect(int a, int b) {
    while (a != b) {
      while (a > b) {
        a = idom[a];
      }
      while (b > a) {
        b = idom[b];
      }
    }
    return a;
  }

  /** Computes the dominator tree of a function, rooted at its entry block. */
  static DominatorTree dominators(Cfg cfg) {
    return new DominatorTree(cfg.function().entry().id(), cfg::successors, cfg::predecessors);
  }

  /** Computes the post-dominator tree of a function, rooted at {@link #VIRTUAL_EXIT}. */
  static DominatorTree postDominators(Cfg cfg) {
    List<Integer> exits = new ArrayList<>();
    for (int id : cfg.reachableBlocks()) {
      if (cfg.successors(id).isEmpty()) {
        exits.add(id);
      }
    }
    ImmutableList<Integer> exitList = ImmutableList.copyOf(exits);
    return new DominatorTree(
        VIRTUAL_EXIT,
        id -> (id == VIRTUAL_EXIT) ? exitList : cfg.predecessors(id),
        id -> {
          if (id == VIRTUAL_EXIT) {
            return ImmutableList.of();
          }
          ImmutableList<Integer> succs = cfg.successors(id);
          return succs.isEmpty() ? ImmutableList.of(VIRTUAL_EXIT) : succs;
        });
  }

  /** True if {@code blockId} is in the tree. */
  public boolean contains(int blockId) {
    return indexOf.containsKey(blockId);
  }

  /** True if {@code a} dominates {@code b}. Every block in the tree dominates itself. */
  public boolean dominates(int a, int b) {
    Integer ia = indexOf.get(a);
    Integer ib = indexOf.get(b);
    if (ia == null || ib == null) {
      return false;
    }
    int i = ib;
    // An immediate dominator always precedes its block in reverse postorder.
    while (i > ia) {
      i = idom[i];
    }
    return i == ia;
  }

  public boolean strictlyDominates(int a, int b) {
    return a != b && dominates(a, b);
  }

  /**
   * The immediate dominator of {@code blockId}, or -1 if it is the root or not in the tree. In a
   * post-dominator tree the result may be {@link #VIRTUAL_EXIT}.
   */
  public int immediateDominator(int blockId) {
    Integer i = indexOf.get(blockId);
    return (i == null || i == 0) ? -1 : order[idom[i]];
  }

  /** The number of strict dominators of {@code blockId}; -1 if it is not in the tree. */
  public int depth(int blockId) {
    Integer i = indexOf.get(blockId);
    if (i == null) {
      return -1;
    }
    int depth = 0;
    for (int j = i; j != 0; j = idom[j]) {
      depth++;
    }
    return depth;
  }
}
