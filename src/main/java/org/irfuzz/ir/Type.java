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

/**
 * The structural view of a type declaration. Component types are referred to by id; use {@link
 * TypeTable#type} to follow them.
 */
public interface Type {

  record Void() implements Type {}

  record Bool() implements Type {}

  record Int(int width, boolean signed) implements Type {}

  record Float(int width) implements Type {}

  record Vector(int componentTypeId, int count) implements Type {}

  record Matrix(int columnTypeId, int count) implements Type {}

  record Array(int elementTypeId, int lengthId) implements Type {}

  record Struct(ImmutableList<Integer> memberTypeIds) implements Type {}

  record Pointer(int pointeeTypeId) implements Type {}

  record FunctionType(int returnTypeId, ImmutableList<Integer> paramTypeIds) implements Type {}

  /** Returns the Type described by a type declaration instruction. */
  static Type fromDeclaration(Instruction decl) {
    return switch (decl.opcode()) {
      case TYPE_VOID -> new Void();
      case TYPE_BOOL -> new Bool();
      case TYPE_INT -> new Int((int) decl.literalOperand(0), decl.literalOperand(1) != 0);
      case TYPE_FLOAT -> new Float((int) decl.literalOperand(0));
      case TYPE_VECTOR -> new Vector(decl.idOperand(0), (int) decl.literalOperand(1));
      case TYPE_MATRIX -> new Matrix(decl.idOperand(0), (int) decl.literalOperand(1));
      case TYPE_ARRAY -> new Array(decl.idOperand(0), decl.idOperand(1));
      case TYPE_STRUCT -> {
        ImmutableList.Builder<Integer> members = ImmutableList.builder();
        decl.forEachIdOperand(members::add);
        yield new Struct(members.build());
      }
      case TYPE_POINTER -> new Pointer(decl.idOperand(0));
      case TYPE_FUNCTION -> {
        ImmutableList.Builder<Integer> params = ImmutableList.builder();
        for (int i = 1; i < decl.numOperands(); i++) {
          params.add(decl.idOperand(i));
        }
        yield new FunctionType(decl.idOperand(0), params.build());
      }
      default -> throw new IllegalArgumentException("Not a type declaration: " + decl);
    };
  }
}
