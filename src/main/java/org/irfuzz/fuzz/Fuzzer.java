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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.Random;
import org.irfuzz.fact.Fact;
import org.irfuzz.fact.FactManager;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.IrPrinter;
import org.irfuzz.ir.Validator;
import org.irfuzz.transform.CounterOverflowIdSource;
import org.irfuzz.transform.TransformationContext;
import org.irfuzz.transform.TransformationSequence;

/**
 * Runs randomly chosen fuzzer passes over a module until either {@link #maxPasses} passes have
 * run or at least {@link #maxTransformations} transformations have been applied.
 *
 * <p>Runs with the same seed, module and initial facts apply the same transformations.
 */
public class Fuzzer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The outcome of a run: the applied transformations and the facts that hold afterwards. */
  public record Result(TransformationSequence transformations, FactManager factManager) {}

  /** Creates a pass for one run. */
  interface PassFactory {
    FuzzerPass create(
        IrContext ir,
        TransformationContext transformationContext,
        FuzzerContext fuzzerContext,
        TransformationSequence transformations);
  }

  static final ImmutableList<PassFactory> PASSES =
      ImmutableList.of(
          AddLoopPreheadersPass::new,
          AddLoopsToCreateIntConstantSynonymsPass::new,
          AddOpPhiSynonymsPass::new,
          FlattenConditionalBranchesPass::new,
          MergeFunctionReturnsPass::new,
          ReplaceIrrelevantIdsPass::new);

  public int maxPasses = 20;
  public int maxTransformations = 2000;

  /**
   * If true, the module is checked with {@link Validator} after each pass, and an invalid module
   * is reported with an {@link IllegalStateException}.
   */
  public boolean validateAfterEachPass = false;

  private final long seed;

  public Fuzzer(long seed) {
    this.seed = seed;
  }

  /**
   * Fuzzes {@code ir} in place. Initial facts that do not hold for the module are ignored.
   */
  public Result run(IrContext ir, Iterable<Fact> initialFacts) {
    FactManager factManager = new FactManager(ir);
    for (Fact fact : initialFacts) {
      factManager.maybeAddFact(fact);
    }
    TransformationContext transformationContext =
        new TransformationContext(factManager, CounterOverflowIdSource.forModule(ir.module()));
    FuzzerContext fuzzerContext = new FuzzerContext(new Random(seed), ir.module());
    TransformationSequence transformations = new TransformationSequence();

    for (int i = 0; i < maxPasses && transformations.size() < maxTransformations; i++) {
      FuzzerPass pass =
          fuzzerContext
              .randomElement(PASSES)
              .create(ir, transformationContext, fuzzerContext, transformations);
      int before = transformations.size();
      pass.apply();
      logger.atFine().log(
          "Pass %s: %s applied %s transformations",
          i,
          pass.getClass().getSimpleName(),
          transformations.size() - before);
      if (validateAfterEachPass) {
        ImmutableList<String> problems = Validator.validate(ir.module());
        if (!problems.isEmpty()) {
          throw new IllegalStateException(
              String.format(
                  "Invalid module after %s: %s", pass.getClass().getSimpleName(), problems));
        }
      }
    }
    logger.atFinest().log("Fuzzed module:\n%s", lazy(() -> IrPrinter.print(ir.module())));
    return new Result(transformations, factManager);
  }
}
