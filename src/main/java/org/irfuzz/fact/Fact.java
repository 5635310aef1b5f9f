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

/**
 * A predicate about a module that cannot be recovered from the module itself. Facts are asserted
 * once, through {@link FactManager#addFact}, and trusted from then on.
 */
public interface Fact {

  /** The value of {@code id} has no bearing on the module's observable behavior. */
  record IdIsIrrelevant(int id) implements Fact {}

  /** The value that {@code pointerId} points to has no bearing on observable behavior. */
  record PointeeIsIrrelevant(int pointerId) implements Fact {}

  /** {@code id1} and {@code id2} always hold equal values at runtime. */
  record IdSynonym(int id1, int id2) implements Fact {}

  /** The block with label {@code blockId} is never executed. */
  record BlockIsDead(int blockId) implements Fact {}
}
