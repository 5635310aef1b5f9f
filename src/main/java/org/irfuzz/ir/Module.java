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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The arena that owns all IR: global declarations (types, constants, undefs and global variables,
 * in declaration order) and functions. Everything else refers to IR by id.
 *
 * <p>The id bound is the smallest id that is guaranteed not to be in use; it only ever rises.
 */
public final class Module {

  private final List<Instruction> globals = new ArrayList<>();
  private final List<Function> functions = new ArrayList<>();
  private int idBound = 1;

  /** An unmodifiable view of the global declarations. */
  public List<Instruction> globals() {
    return Collections.unmodifiableList(globals);
  }

  public void addGlobal(Instruction global) {
    Preconditions.checkArgument(global.hasResultId());
    globals.add(global);
    updateIdBound(global.resultId());
  }

  /** An unmodifiable view of the functions. */
  public List<Function> functions() {
    return Collections.unmodifiableList(functions);
  }

  public void addFunction(Function function) {
    functions.add(function);
    updateIdBound(function.id());
  }

  public @Nullable Function function(int id) {
    for (Function function : functions) {
      if (function.id() == id) {
        return function;
      }
    }
    return null;
  }

  public int idBound() {
    return idBound;
  }

  /** Raises the id bound, if necessary, so that {@code id} is below it. */
  public void updateIdBound(int id) {
    Preconditions.checkArgument(id > 0 && id < Integer.MAX_VALUE, "Bad id %s", id);
    idBound = Math.max(idBound, id + 1);
  }
}
