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

/** The ids whose values, or whose pointees' values, are irrelevant. */
final class IrrelevantValueFacts {

  private final Set<Integer> irrelevantIds = new LinkedHashSet<>();
  private final Set<Integer> pointersToIrrelevantPointees = new LinkedHashSet<>();

  void addIrrelevantId(int id) {
    irrelevantIds.add(id);
  }

  void addIrrelevantPointee(int pointerId) {
    pointersToIrrelevantPointees.add(pointerId);
  }

  boolean idIsIrrelevant(int id) {
    return irrelevantIds.contains(id);
  }

  boolean pointeeValueIsIrrelevant(int pointerId) {
    return pointersToIrrelevantPointees.contains(pointerId);
  }

  ImmutableSet<Integer> irrelevantIds() {
    return ImmutableSet.copyOf(irrelevantIds);
  }
}
