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
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.irfuzz.ir.Module;
import org.irfuzz.transform.CounterOverflowIdSource;

/**
 * The random choices and fresh ids of one fuzzing run.
 *
 * <p>Each pass's chance of acting at a given site is drawn once per run from a fixed range, so
 * that different runs favor different transformations.
 */
public class FuzzerContext {

  /** An inclusive range of percentages. */
  record ChanceRange(int min, int max) {
    ChanceRange {
      Preconditions.checkArgument(0 <= min && min <= max && max <= 100);
    }
  }

  static final ChanceRange CHANCE_OF_ADDING_LOOP_PREHEADER = new ChanceRange(20, 70);
  static final ChanceRange CHANCE_OF_ADDING_LOOP_TO_CREATE_INT_CONSTANT_SYNONYM =
      new ChanceRange(5, 60);
  static final ChanceRange CHANCE_OF_ADDING_OP_PHI_SYNONYM = new ChanceRange(5, 70);
  static final ChanceRange CHANCE_OF_FLATTENING_CONDITIONAL_BRANCH = new ChanceRange(45, 95);
  static final ChanceRange CHANCE_OF_HAVING_TWO_BLOCKS_IN_LOOP_TO_CREATE_INT_SYNONYM =
      new ChanceRange(50, 80);
  static final ChanceRange CHANCE_OF_MERGING_FUNCTION_RETURNS = new ChanceRange(20, 95);
  static final ChanceRange CHANCE_OF_REPLACING_IRRELEVANT_ID = new ChanceRange(35, 75);

  private final Random random;
  private int nextFreshId;
  private final int freshIdLimit;

  private final int chanceOfAddingLoopPreheader;
  private final int chanceOfAddingLoopToCreateIntConstantSynonym;
  private final int chanceOfAddingOpPhiSynonym;
  private final int chanceOfFlatteningConditionalBranch;
  private final int chanceOfHavingTwoBlocksInLoopToCreateIntSynonym;
  private final int chanceOfMergingFunctionReturns;
  private final int chanceOfReplacingIrrelevantId;

  /**
   * Fresh ids start at {@code module}'s current id bound and stay below the ids that {@link
   * CounterOverflowIdSource#forModule} hands out for the same module.
   */
  public FuzzerContext(Random random, Module module) {
    this.random = random;
    this.nextFreshId = module.idBound();
    this.freshIdLimit = CounterOverflowIdSource.firstOverflowId(module);
    chanceOfAddingLoopPreheader = chooseBetween(CHANCE_OF_ADDING_LOOP_PREHEADER);
    chanceOfAddingLoopToCreateIntConstantSynonym =
        chooseBetween(CHANCE_OF_ADDING_LOOP_TO_CREATE_INT_CONSTANT_SYNONYM);
    chanceOfAddingOpPhiSynonym = chooseBetween(CHANCE_OF_ADDING_OP_PHI_SYNONYM);
    chanceOfFlatteningConditionalBranch = chooseBetween(CHANCE_OF_FLATTENING_CONDITIONAL_BRANCH);
    chanceOfHavingTwoBlocksInLoopToCreateIntSynonym =
        chooseBetween(CHANCE_OF_HAVING_TWO_BLOCKS_IN_LOOP_TO_CREATE_INT_SYNONYM);
    chanceOfMergingFunctionReturns = chooseBetween(CHANCE_OF_MERGING_FUNCTION_RETURNS);
    chanceOfReplacingIrrelevantId = chooseBetween(CHANCE_OF_REPLACING_IRRELEVANT_ID);
  }

  private int chooseBetween(ChanceRange range) {
    return range.min() + random.nextInt(range.max() - range.min() + 1);
  }

  /** Returns true with the given percentage chance. */
  public boolean choosePercentage(int percentage) {
    Preconditions.checkArgument(percentage >= 0 && percentage <= 100);
    return random.nextInt(100) < percentage;
  }

  public boolean chooseEven() {
    return random.nextBoolean();
  }

  /** Returns a random int in [0, bound). */
  public int randomIndex(int bound) {
    return random.nextInt(bound);
  }

  public <T> T randomElement(List<T> list) {
    Preconditions.checkArgument(!list.isEmpty());
    return list.get(random.nextInt(list.size()));
  }

  /** Randomly permutes {@code list} in place. */
  public void shuffle(List<?> list) {
    Collections.shuffle(list, random);
  }

  /** Returns an id that has not been returned before and was not in use when the run started. */
  public int freshId() {
    Preconditions.checkState(nextFreshId < freshIdLimit, "Fresh ids exhausted");
    return nextFreshId++;
  }

  public ImmutableList<Integer> freshIds(int count) {
    ImmutableList.Builder<Integer> result = ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      result.add(freshId());
    }
    return result.build();
  }

  public int chanceOfAddingLoopPreheader() {
    return chanceOfAddingLoopPreheader;
  }

  public int chanceOfAddingLoopToCreateIntConstantSynonym() {
    return chanceOfAddingLoopToCreateIntConstantSynonym;
  }

  public int chanceOfAddingOpPhiSynonym() {
    return chanceOfAddingOpPhiSynonym;
  }

  public int chanceOfFlatteningConditionalBranch() {
    return chanceOfFlatteningConditionalBranch;
  }

  public int chanceOfHavingTwoBlocksInLoopToCreateIntSynonym() {
    return chanceOfHavingTwoBlocksInLoopToCreateIntSynonym;
  }

  public int chanceOfMergingFunctionReturns() {
    return chanceOfMergingFunctionReturns;
  }

  public int chanceOfReplacingIrrelevantId() {
    return chanceOfReplacingIrrelevantId;
  }
}
