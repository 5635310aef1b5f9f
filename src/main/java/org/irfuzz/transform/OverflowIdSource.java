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

package org.irfuzz.transform;

import com.google.common.collect.ImmutableSet;

/**
 * A source of fresh ids for transformations that discover, while being applied, that they need
 * more ids than they were given.
 */
public interface OverflowIdSource {

  /** True if {@link #getNextOverflowId} may be called. */
  boolean hasOverflowIds();

  /** Returns an id that has not been returned before and is not used in the module. */
  int getNextOverflowId();

  /** The ids returned by {@link #getNextOverflowId} so far. */
  ImmutableSet<Integer> issuedOverflowIds();
}
