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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The constants declared by a module, keyed by result id. */
public final class ConstantTable {

  private final Map<Integer, Constant> constants = new HashMap<>();
  private final TypeTable types;
  private int trueId;
  private int falseId;

  ConstantTable(Module module, TypeTable types) {
    this.types = types;
    for (Instruction global : module.globals()) {
      Constant constant =
          switch (global.opcode()) {
            case CONSTANT_TRUE -> new Constant.Bool(global.typeId(), true);
            case CONSTANT_FALSE -> new Constant.Bool(global.typeId(), false);
            case CONSTANT -> new Constant.Scalar(global.typeId(), global.literalOperand(0));
            case CONSTANT_COMPOSITE -> {
              ImmutableList.Builder<Integer> components = ImmutableList.builder();
              global.forEachIdOperand(components::add);
              yield new Constant.Composite(global.typeId(), components.build());
            }
            default -> null;
          };
      if (constant == null) {
        continue;
      }
      constants.put(global.resultId(), constant);
      if (constant instanceof Constant.Bool b) {
        if (b.value() && trueId == 0) {
          trueId = global.resultId();
        } else if (!b.value() && falseId == 0) {
          falseId = global.resultId();
        }
      }
    }
  }

  /** The constant with result id {@code id}, or null if {@code id} is not a constant. */
  public @Nullable Constant constant(int id) {
    return constants.get(id);
  }

  /** The id of a boolean constant with the given value, or 0 if there is none. */
  public int boolConstantId(boolean value) {
    return value ? trueId : falseId;
  }

  /**
   * The id of a scalar integer constant of the given width and signedness whose value is {@code
   * value}, or 0 if there is none.
   */
  public int findIntConstant(long value, int width, boolean signed) {
    for (Map.Entry<Integer, Constant> entry : constants.entrySet()) {
      if (entry.getValue() instanceof Constant.Scalar scalar
          && types.type(scalar.typeId()) instanceof Type.Int t
          && t.width() == width
          && t.signed() == signed
          && scalar.signExtended(t) == value) {
        return entry.getKey();
      }
    }
    return 0;
  }

  /**
   * Returns the sign-extended components of an integer scalar or integer vector constant: one
   * element for a scalar. Returns null if {@code id} is not such a constant.
   */
  public long @Nullable [] integerComponents(int id) {
    Constant constant = constants.get(id);
    if (constant instanceof Constant.Scalar scalar) {
      return (types.type(scalar.typeId()) instanceof Type.Int t)
          ? new long[] {scalar.signExtended(t)}
          : null;
    } else if (constant instanceof Constant.Composite composite
        && types.type(composite.typeId()) instanceof Type.Vector) {
      long[] result = new long[composite.componentIds().size()];
      for (int i = 0; i < result.length; i++) {
        long[] component = integerComponents(composite.componentIds().get(i));
        if (component == null || component.length != 1) {
          return null;
        }
        result[i] = component[0];
      }
      return result;
    }
    return null;
  }
}
