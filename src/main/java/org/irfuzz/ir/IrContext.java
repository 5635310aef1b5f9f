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

/**
 * A module together with the analyses derived from it. Analyses are computed on first use and
 * cached until {@link #invalidateAnalyses} is called; any edit to the module must be followed by
 * a call to it before the next query.
 */
public final class IrContext {

  private final Module module;

  /** Incremented by each call to {@link #invalidateAnalyses}. */
  private int generation;

  private @Nullable DefUse defUse;
  private @Nullable TypeTable types;
  private @Nullable ConstantTable constants;
  private @Nullable StructuredCfg structuredCfg;
  private final Map<Integer, Cfg> cfgs = new HashMap<>();
  private final Map<Integer, DominatorTree> dominators = new HashMap<>();
  private final Map<Integer, DominatorTree> postDominators = new HashMap<>();

  public IrContext(Module module) {
    this.module = module;
  }

  public Module module() {
    return module;
  }

  public int generation() {
    return generation;
  }

  /** Discards every cached analysis. */
  public void invalidateAnalyses() {
    generation++;
    defUse = null;
    types = null;
    constants = null;
    structuredCfg = null;
    cfgs.clear();
    dominators.clear();
    postDominators.clear();
  }

  public DefUse defUse() {
    if (defUse == null) {
      defUse = new DefUse(module);
    }
    return defUse;
  }

  public TypeTable types() {
    if (types == null) {
      types = new TypeTable(module, defUse());
    }
    return types;
  }

  public ConstantTable constants() {
    if (constants == null) {
      constants = new ConstantTable(module, types());
    }
    return constants;
  }

  public StructuredCfg structuredCfg() {
    if (structuredCfg == null) {
      structuredCfg = new StructuredCfg(this);
    }
    return structuredCfg;
  }

  /** The control-flow graph of the function with the given id, which must exist. */
  public Cfg cfg(int functionId) {
    return cfgs.computeIfAbsent(functionId, id -> new Cfg(function(id)));
  }

  public DominatorTree dominators(int functionId) {
    return dominators.computeIfAbsent(functionId, id -> DominatorTree.dominators(cfg(id)));
  }

  public DominatorTree postDominators(int functionId) {
    return postDominators.computeIfAbsent(
        functionId, id -> DominatorTree.postDominators(cfg(id)));
  }

  private Function function(int functionId) {
    Function function = defUse().function(functionId);
    if (function == null) {
      throw new IllegalArgumentException("No function %" + functionId);
    }
    return function;
  }

  // Conveniences over the analyses.

  /** True if {@code id} is defined anywhere in the module. */
  public boolean isDefined(int id) {
    return defUse().isDefined(id);
  }

  public @Nullable Instruction def(int id) {
    return defUse().def(id);
  }

  public @Nullable Block block(int blockId) {
    return defUse().block(blockId);
  }

  public @Nullable Function functionOfBlock(int blockId) {
    return defUse().functionOfBlock(blockId);
  }

  /** The type id of the value {@code id}, or 0 if it has none. */
  public int typeIdOf(int id) {
    Instruction def = def(id);
    return (def == null) ? 0 : def.typeId();
  }

  /** Registers {@code id} with the module's id bound. */
  public void updateIdBound(int id) {
    module.updateIdBound(id);
  }
}
