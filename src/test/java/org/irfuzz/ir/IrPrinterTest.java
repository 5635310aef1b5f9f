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

package org.irfuzz.ir;

import static com.google.common.truth.Truth.assertThat;

import org.irfuzz.testing.SampleModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IrPrinterTest {

  @Test
  public void printModule() {
    String text = IrPrinter.print(SampleModules.straightLine());
    assertThat(text).startsWith("%1 = TYPE_VOID\n%2 = TYPE_BOOL\n%3 = TYPE_INT 32 1\n");
    assertThat(text).contains("\n%12 = CONSTANT %3 4294967295\n");
    assertThat(text)
        .endsWith(
            "FUNCTION %20 %3 %16\n"
                + "%21:\n"
                + "  %22 = IADD %3 %10 %9\n"
                + "  BRANCH %23\n"
                + "%23:\n"
                + "  %24 = IMUL %3 %22 %10\n"
                + "  RETURN_VALUE %24\n"
                + "END\n");
  }

  @Test
  public void printFunctionWithParameters() {
    Module module = SampleModules.ifElseWithSideEffects();
    assertThat(IrPrinter.print(module.function(40)))
        .isEqualTo(
            "FUNCTION %40 %3 %13\n"
                + "  %41 = FUNCTION_PARAMETER %3\n"
                + "%42:\n"
                + "  %43 = IMUL %3 %41 %10\n"
                + "  RETURN_VALUE %43\n"
                + "END\n");
  }

  @Test
  public void equalModulesPrintEqually() {
    assertThat(IrPrinter.print(SampleModules.ifElse()))
        .isEqualTo(IrPrinter.print(SampleModules.ifElse()));
    assertThat(IrPrinter.print(SampleModules.ifElse()))
        .isNotEqualTo(IrPrinter.print(SampleModules.ifElseWithSideEffects()));
  }
}
