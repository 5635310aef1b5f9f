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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;

/** The blocks known never to execute. */
final class DeadBlockFacts {

  private final Set<Integer> deadBlocks = new LinkedHashSet<>();

  void addDeadBlock(int blockId) {
    deadBlocks.add(blockId);
  }

  boolean blockIsDead(int blockId) {
    return deadBlocks.contains(blockId);
  }

  ImmutableSet<Integer> deadBlocks() {
    return ImmutableSet.copyOf(deadBlocks);
  }
}
