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

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The structural types declared by a module, keyed by type id. */
public final class TypeTable {

  private final Map<Integer, Type> types = new HashMap<>();
  private final DefUse defUse;
  private int boolTypeId;

  TypeTable(Module module, DefUse defUse) {
    this.defUse = defUse;
    for (Instruction global : module.globals()) {
      if (global.opcode().category == Opcode.Category.TYPE) {
        Type type = Type.fromDeclaration(global);
        types.put(global.resultId(), type);
        if (type instanceof Type.Bool && boolTypeId == 0) {
          boolTypeId = global.resultId();
        }
      }
    }
  }

  /** The type declared with id {@code typeId}, or null if there is none. */
  public @Nullable Type type(int typeId) {
    return types.get(typeId);
  }

  /** The type of the value with result id {@code id}, or null if it is not a typed value. */
  public @Nullable Type typeOfId(int id) {
    Instruction def = defUse.def(id);
    return (def == null || def.typeId() == 0) ? null : types.get(def.typeId());
  }

  public boolean isPointer(int typeId) {
    return types.get(typeId) instanceof Type.Pointer;
  }

  public boolean isVoid(int typeId) {
    return types.get(typeId) instanceof Type.Void;
  }

  /** The id of the boolean type, or 0 if the module does not declare one. */
  public int boolTypeId() {
    return boolTypeId;
  }

  /** The id of an integer type with the given width and signedness, or 0 if there is none. */
  public int findIntType(int width, boolean signed) {
    for (Map.Entry<Integer, Type> entry : types.entrySet()) {
      if (entry.getValue() instanceof Type.Int t && t.width() == width && t.signed() == signed) {
        return entry.getKey();
      }
    }
    return 0;
  }

  /**
   * Returns the scalar integer type of a value of type {@code typeId}: the type itself if it is an
   * integer, the component type if it is a vector of integers, null otherwise.
   */
  public Type.@Nullable Int integerComponent(int typeId) {
    Type type = types.get(typeId);
    if (type instanceof Type.Vector vector) {
      type = types.get(vector.componentTypeId());
    }
    return (type instanceof Type.Int t) ? t : null;
  }

  /**
   * True if the two types are identical except possibly for the signedness of their integer
   * components; both must be integer scalars or integer vectors.
   */
  public boolean equalUpToSign(int typeId1, int typeId2) {
    if (typeId1 == typeId2) {
      return true;
    }
    Type t1 = types.get(typeId1);
    Type t2 = types.get(typeId2);
    if (t1 instanceof Type.Int i1 && t2 instanceof Type.Int i2) {
      return i1.width() == i2.width();
    }
    if (t1 instanceof Type.Vector v1 && t2 instanceof Type.Vector v2) {
      return v1.count() == v2.count()
          && equalUpToSign(v1.componentTypeId(), v2.componentTypeId());
    }
    return false;
  }
}
