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

import org.irfuzz.transform.TransformationMessage;

/**
 * Thrown when a transformation sequence cannot be replayed against a module, usually because the
 * sequence was recorded against a different module. The steps before the failing one have been
 * applied.
 */
public class ReplayException extends Exception {

  private final int stepIndex;
  private final TransformationMessage message;

  ReplayException(int stepIndex, TransformationMessage message, String reason) {
    super(String.format("Step %s (%s): %s", stepIndex, message, reason));
    this.stepIndex = stepIndex;
    this.message = message;
  }

  ReplayException(
      int stepIndex, TransformationMessage message, String reason, Throwable cause) {
    super(String.format("Step %s (%s): %s", stepIndex, message, reason), cause);
    this.stepIndex = stepIndex;
    this.message = message;
  }

  /** The zero-based index of the step that failed. */
  public int stepIndex() {
    return stepIndex;
  }

  /** The message of the transformation that failed. */
  public TransformationMessage transformationMessage() {
    return message;
  }
}
