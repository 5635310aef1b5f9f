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
import static org.irfuzz.testing.SampleModules.BOOL;
import static org.irfuzz.testing.SampleModules.FALSE;
import static org.irfuzz.testing.SampleModules.INT;
import static org.irfuzz.testing.SampleModules.MINUS_ONE;
import static org.irfuzz.testing.SampleModules.ONE;
import static org.irfuzz.testing.SampleModules.PTR_INT;
import static org.irfuzz.testing.SampleModules.TRUE;
import static org.irfuzz.testing.SampleModules.TWO;
import static org.irfuzz.testing.SampleModules.UINT;
import static org.irfuzz.testing.SampleModules.VOID;

import org.irfuzz.testing.SampleModules;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TypeAndConstantTablesTest {

  private static final int VEC2 = 17;
  private static final int UVEC2 = 18;
  private static final int VEC_ONE_TWO = 19;
  private static final int LONG = 21;

  private final IrContext ir =
      new IrContext(
          SampleModules.declareCommon(new IrBuilder())
              .typeVector(VEC2, INT, 2)
              .typeVector(UVEC2, UINT, 2)
              .constantComposite(VEC_ONE_TWO, VEC2, ONE, TWO)
              .typeInt(LONG, 64, true)
              .build());

  @Test
  public void types() {
    TypeTable types = ir.types();
    assertThat(types.type(INT)).isEqualTo(new Type.Int(32, true));
    assertThat(types.type(VEC2)).isEqualTo(new Type.Vector(INT, 2));
    assertThat(types.type(ONE)).isNull();
    assertThat(types.typeOfId(ONE)).isEqualTo(new Type.Int(32, true));
    assertThat(types.typeOfId(INT)).isNull();
    assertThat(types.isPointer(PTR_INT)).isTrue();
    assertThat(types.isVoid(VOID)).isTrue();
    assertThat(types.boolTypeId()).isEqualTo(BOOL);
    assertThat(types.findIntType(64, true)).isEqualTo(LONG);
    assertThat(types.findIntType(16, true)).isEqualTo(0);
    assertThat(types.integerComponent(UVEC2)).isEqualTo(new Type.Int(32, false));
    assertThat(types.integerComponent(BOOL)).isNull();
  }

  @Test
  public void equalUpToSign() {
    TypeTable types = ir.types();
    assertThat(types.equalUpToSign(INT, UINT)).isTrue();
    assertThat(types.equalUpToSign(VEC2, UVEC2)).isTrue();
    assertThat(types.equalUpToSign(INT, LONG)).isFalse();
    assertThat(types.equalUpToSign(INT, VEC2)).isFalse();
    assertThat(types.equalUpToSign(BOOL, BOOL)).isTrue();
  }

  @Test
  public void constants() {
    ConstantTable constants = ir.constants();
    assertThat(constants.boolConstantId(true)).isEqualTo(TRUE);
    assertThat(constants.boolConstantId(false)).isEqualTo(FALSE);
    assertThat(constants.findIntConstant(-1, 32, true)).isEqualTo(MINUS_ONE);
    assertThat(constants.findIntConstant(1, 32, false)).isEqualTo(0);
    assertThat(constants.integerComponents(MINUS_ONE)).asList().containsExactly(-1L);
    assertThat(constants.integerComponents(VEC_ONE_TWO)).asList().containsExactly(1L, 2L);
    assertThat(constants.integerComponents(TRUE)).isNull();
    assertThat(constants.constant(INT)).isNull();
  }
}
