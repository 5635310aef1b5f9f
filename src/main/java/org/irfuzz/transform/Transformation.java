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

import org.irfuzz.ir.IrContext;

/**
 * An edit to a module that is checked before it is made. A Transformation holds only ids and
 * descriptors; it re-derives everything else from the module each time it is asked.
 *
 * <p>Implementations are immutable. A transformation is constructed, asked {@link #isApplicable},
 * and (only if that returned true, and without any intervening change to the module or facts)
 * applied with {@link #apply}; it is then discarded. Its {@link #toMessage message} is sufficient
 * to reconstruct it later for replay.
 */
public interface Transformation {

  /**
   * Returns true if this transformation can be applied to the given module in the given context.
   * Never changes the module, the facts, or the overflow id source.
   */
  boolean isApplicable(IrContext ir, TransformationContext context);

  /**
   * Applies this transformation. Only valid immediately after {@link #isApplicable} has returned
   * true for the same module and context; the preconditions are not checked again. Leaves the
   * module's analyses invalidated.
   */
  void apply(IrContext ir, TransformationContext context);

  /** Returns the flat record from which this transformation can be reconstructed. */
  TransformationMessage toMessage();
}
