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

/** The value of a constant declaration. Composite components are referred to by id. */
public interface Constant {

  /** The id of the constant's type. */
  int typeId();

  record Bool(int typeId, boolean value) implements Constant {}

  /** An integer or float scalar; {@code bits} holds the raw literal. */
  record Scalar(int typeId, long bits) implements Constant {

    /**
     * Returns the value of this integer constant, sign-extended from its declared width. The
     * signedness of the type is ignored.
     */
    public long signExtended(Type.Int type) {
      int width = type.width();
      return (width >= 64) ? bits : (bits << (64 - width)) >> (64 - width);
    }
  }

  record Composite(int typeId, ImmutableList<Integer> componentIds) implements Constant {}
}
