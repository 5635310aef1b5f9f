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

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.IrContext;
import org.irfuzz.transform.Transformation;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;

/**
 * A single sweep over the module that proposes transformations of one kind at randomly chosen
 * sites. Each proposal is constructed with fresh ids from the {@link FuzzerContext} and kept only
 * if it turns out to be applicable; applied transformations are appended to the run's {@link
 * TransformationSequence}.
 */
public abstract class FuzzerPass {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  final IrContext ir;
  final TransformationContext transformationContext;
  final FuzzerContext fuzzerContext;
  private final TransformationSequence transformations;

  FuzzerPass(
      IrContext ir,
      TransformationContext transformationContext,
      FuzzerContext fuzzerContext,
      TransformationSequence transformations) {
    this.ir = ir;
    this.transformationContext = transformationContext;
    this.fuzzerContext = fuzzerContext;
    this.transformations = transformations;
  }

  /** Makes one sweep over the module. */
  public abstract void apply();

  FactManager factManager() {
    return transformationContext.factManager();
  }

  /** If {@code transformation} is applicable, applies it and returns true. */
  @CanIgnoreReturnValue
  boolean maybeApplyTransformation(Transformation transformation) {
    if (!transformation.isApplicable(ir, transformationContext)) {
      logger.atFinest().log("Not applicable: %s", transformation);
      return false;
    }
    doApply(transformation);
    return true;
  }

  /** Applies {@code transformation}, which must be applicable. */
  void applyTransformation(Transformation transformation) {
    Preconditions.checkState(
        transformation.isApplicable(ir, transformationContext),
        "Transformation is not applicable: %s",
        transformation);
    doApply(transformation);
  }

  private void doApply(Transformation transformation) {
    transformation.apply(ir, transformationContext);
    transformations.add(transformation);
    logger.atFine().log("Applied %s", transformation);
  }
}
