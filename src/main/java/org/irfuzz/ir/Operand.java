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

/**
 * One operand of an {@link Instruction}: either a reference to an id or a literal value (e.g. a
 * constant's bits, an integer width, or a composite index).
 */
public record Operand(Kind kind, long value) {

  public enum Kind {
    ID,
    LITERAL
  }

  public static Operand id(int id) {
    return new Operand(Kind.ID, id);
  }

  public static Operand literal(long value) {
    return new Operand(Kind.LITERAL, value);
  }

  public boolean isId() {
    return kind == Kind.ID;
  }

  /** Returns the referenced id; only valid for {@link Kind#ID} operands. */
  public int asId() {
    assert kind == Kind.ID;
    return (int) value;
  }

  @Override
  public String toString() {
    return (kind == Kind.ID) ? "%" + value : String.valueOf(value);
  }
}
