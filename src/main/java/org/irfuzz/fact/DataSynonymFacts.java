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

package org.irfuzz.fact;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Equivalence classes of synonymous ids, kept as a union-find forest. Each class also keeps its
 * members in insertion order so that enumeration is deterministic.
 */
final class DataSynonymFacts {

  private final Map<Integer, Integer> parent = new HashMap<>();

  /** Members of each class, keyed by the class's root. */
  private final Map<Integer, List<Integer>> members = new LinkedHashMap<>();

  private int find(int id) {
    int root = id;
    while (true) {
      Integer next = parent.get(root);
      if (next == null || next == root) {
        break;
      }
      root = next;
    }
    // Path compression.
    while (id != root) {
      int next = parent.put(id, root);
      id = next;
    }
    return root;
  }

  private void ensure(int id) {
    if (!parent.containsKey(id)) {
      parent.put(id, id);
      List<Integer> singleton = new ArrayList<>();
      singleton.add(id);
      members.put(id, singleton);
    }
  }

  void addSynonym(int id1, int id2) {
    ensure(id1);
    ensure(id2);
    int root1 = find(id1);
    int root2 = find(id2);
    if (root1 == root2) {
      return;
    }
    List<Integer> small = members.get(root1);
    List<Integer> large = members.get(root2);
    if (small.size() > large.size()) {
      int tmp = root1;
      root1 = root2;
      root2 = tmp;
      small = members.get(root1);
      large = members.get(root2);
    }
    parent.put(root1, root2);
    large.addAll(small);
    members.remove(root1);
  }

  /** True if {@code id} is synonymous with at least one other id. */
  boolean hasSynonyms(int id) {
    return parent.containsKey(id) && members.get(find(id)).size() > 1;
  }

  boolean isSynonymous(int id1, int id2) {
    if (id1 == id2) {
      return true;
    }
    return parent.containsKey(id1) && parent.containsKey(id2) && find(id1) == find(id2);
  }

  /** The ids other than {@code id} that are synonymous with it. */
  ImmutableSet<Integer> synonymsOf(int id) {
    if (!parent.containsKey(id)) {
      return ImmutableSet.of();
    }
    ImmutableSet.Builder<Integer> result = ImmutableSet.builder();
    for (int member : members.get(find(id))) {
      if (member != id) {
        result.add(member);
      }
    }
    return result.build();
  }

  ImmutableList<ImmutableSet<Integer>> classes() {
    ImmutableList.Builder<ImmutableSet<Integer>> result = ImmutableList.builder();
    for (List<Integer> clazz : members.values()) {
      if (clazz.size() > 1) {
        result.add(ImmutableSet.copyOf(clazz));
      }
    }
    return result.build();
  }
}
