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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.irfuzz.fact.Fact;
import org.irfuzz.ir.IrContext;
import org.irfuzz.ir.IrPrinter;
import org.irfuzz.ir.Module;
import org.irfuzz.ir.Validator;
import org.irfuzz.testing.Interpreter;
import org.irfuzz.testing.SampleModules;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class FuzzerTest {

  /** A sample module and the calls of function %20 whose results should survive fuzzing. */
  enum Sample {
    IF_ELSE(SampleModules::ifElse, new long[][] {{1, 5}, {5, 1}, {-3, -3}}),
    IF_ELSE_WITH_SIDE_EFFECTS(
        SampleModules::ifElseWithSideEffects, new long[][] {{1, 5}, {5, 1}, {0, 7}}),
    TWO_RETURNS(SampleModules::twoReturns, new long[][] {{5}, {0}, {-3}}),
    RETURN_IN_LOOP(SampleModules::returnInLoop, new long[][] {{3}, {20}, {-5}, {9}}),
    LOOP_WITH_TWO_ENTRIES(SampleModules::loopWithTwoEntries, new long[][] {{5}, {0}, {-3}}),
    VOID_WITH_EARLY_RETURN(SampleModules::voidWithEarlyReturn, new long[][] {{}, {}, {}}),
    STRAIGHT_LINE(SampleModules::straightLine, new long[][] {{}});

    final Supplier<Module> module;
    final long[][] calls;

    Sample(Supplier<Module> module, long[][] calls) {
      this.module = module;
      this.calls = calls;
    }

    /** Makes each call in turn, recording its result and the state of any global variable. */
    List<Object> observe(Module module) {
      Interpreter interpreter = new Interpreter(module);
      List<Object> result = new ArrayList<>();
      for (long[] args : calls) {
        Object[] boxed = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
          boxed[i] = args[i];
        }
        result.add(String.valueOf(interpreter.call(20, boxed)));
        if (this == VOID_WITH_EARLY_RETURN) {
          result.add(interpreter.globalValue(19));
        }
      }
      return result;
    }
  }

  private static Fuzzer.Result fuzz(IrContext ir, long seed) {
    Fuzzer fuzzer = new Fuzzer(seed);
    fuzzer.validateAfterEachPass = true;
    return fuzzer.run(ir, ImmutableList.of());
  }

  @Test
  public void fuzzingPreservesBehavior(
      @TestParameter Sample sample, @TestParameter({"1", "2", "3", "17", "99"}) long seed) {
    List<Object> expected = sample.observe(sample.module.get());
    IrContext ir = new IrContext(sample.module.get());
    fuzz(ir, seed);
    assertThat(Validator.validate(ir.module())).isEmpty();
    assertThat(sample.observe(ir.module())).isEqualTo(expected);
  }

  @Test
  public void sameSeedSameResult(
      @TestParameter Sample sample, @TestParameter({"5", "6"}) long seed) {
    IrContext first = new IrContext(sample.module.get());
    IrContext second = new IrContext(sample.module.get());
    Fuzzer.Result firstResult = fuzz(first, seed);
    Fuzzer.Result secondResult = fuzz(second, seed);
    assertThat(secondResult.transformations().toText())
        .isEqualTo(firstResult.transformations().toText());
    assertThat(IrPrinter.print(second.module())).isEqualTo(IrPrinter.print(first.module()));
  }

  @Test
  public void facts() {
    IrContext ir = new IrContext(SampleModules.ifElse());
    Fuzzer fuzzer = new Fuzzer(7);
    Fuzzer.Result result =
        fuzzer.run(
            ir,
            ImmutableList.of(
                new Fact.IdIsIrrelevant(SampleModules.TEN),
                // Not a value; ignored.
                new Fact.IdIsIrrelevant(SampleModules.INT),
                new Fact.BlockIsDead(999)));
    assertThat(result.factManager().irrelevantIds()).containsExactly(SampleModules.TEN);
    assertThat(result.factManager().deadBlocks()).isEmpty();
  }

  @Test
  public void noPasses() {
    IrContext ir = new IrContext(SampleModules.ifElse());
    String before = IrPrinter.print(ir.module());
    Fuzzer fuzzer = new Fuzzer(1);
    fuzzer.maxPasses = 0;
    Fuzzer.Result result = fuzzer.run(ir, ImmutableList.of());
    assertThat(result.transformations().size()).isEqualTo(0);
    assertThat(IrPrinter.print(ir.module())).isEqualTo(before);
  }

  @Test
  public void transformationLimit() {
    IrContext ir = new IrContext(SampleModules.returnInLoop());
    Fuzzer fuzzer = new Fuzzer(3);
    fuzzer.maxPasses = 1000;
    fuzzer.maxTransformations = 0;
    assertThat(fuzzer.run(ir, ImmutableList.of()).transformations().size()).isEqualTo(0);
  }
}
