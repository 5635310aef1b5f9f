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

import com.google.common.flogger.FluentLogger;
import org.irfuzz.fact.Fact;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.IrContext;
import org.irfuzz.transform.CounterOverflowIdSource;
import org.irfuzz.transform.Transformation;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationMessage;
import org.irfuzz.transform.TransformationSequence;

/**
 * Re-applies a recorded {@link TransformationSequence} to a module. Replaying a sequence against
 * the module it was recorded from, with the same initial facts, reproduces the fuzzed module.
 */
public class Replayer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private Replayer() {}

  /**
   * Applies each transformation of {@code sequence} to {@code ir} in order, and returns the facts
   * that hold afterwards. Initial facts that do not hold for the module are ignored.
   *
   * @throws ReplayException if a message cannot be decoded or a transformation is not applicable;
   *     the module is left with the earlier steps applied
   */
  public static FactManager replay(
      IrContext ir, Iterable<Fact> initialFacts, TransformationSequence sequence)
      throws ReplayException {
    FactManager factManager = new FactManager(ir);
    for (Fact fact : initialFacts) {
      factManager.maybeAddFact(fact);
    }
    TransformationContext context =
        new TransformationContext(factManager, CounterOverflowIdSource.forModule(ir.module()));
    int step = 0;
    for (TransformationMessage message : sequence) {
      Transformation transformation;
      try {
        transformation = message.toTransformation();
      } catch (IllegalArgumentException e) {
        throw new ReplayException(step, message, "malformed message", e);
      }
      if (!transformation.isApplicable(ir, context)) {
        throw new ReplayException(step, message, "not applicable");
      }
      transformation.apply(ir, context);
      logger.atFine().log("Replayed step %s: %s", step, message);
      step++;
    }
    return factManager;
  }
}
