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

package org.irfuzz.fact;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.irfuzz.ir.Instruction;
import org.irfuzz.ir.IrContext;
import org.jspecify.annotations.Nullable;

/**
 * The store of facts about a module. Facts are added but never retracted or revalidated; a fact
 * whose precondition does not hold is a caller bug and is rejected with an {@link
 * IllegalArgumentException}.
 *
 * <p>Synonymous ids must have the same type, up to the signedness of integer components.
 * Irrelevance and synonymy exclude each other: an id that is synonymous with another may not
 * be marked irrelevant (nor may its pointee), and an irrelevant id may not be made a synonym.
 */
public class FactManager {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final IrContext context;
  private final IrrelevantValueFacts irrelevantValueFacts = new IrrelevantValueFacts();
  private final DataSynonymFacts dataSynonymFacts = new DataSynonymFacts();
  private final DeadBlockFacts deadBlockFacts = new DeadBlockFacts();

  public FactManager(IrContext context) {
    this.context = context;
  }

  /** Adds {@code fact}, which must be consistent with the module and with existing facts. */
  public void addFact(Fact fact) {
    String problem = check(fact);
    Preconditions.checkArgument(problem == null, "%s: %s", problem, fact);
    record(fact);
  }

  /**
   * Adds {@code fact} if it is consistent with the module and with existing facts; otherwise
   * returns false. Used for facts that come from outside the fuzzer.
   */
  @CanIgnoreReturnValue
  public boolean maybeAddFact(Fact fact) {
    String problem = check(fact);
    if (problem != null) {
      logger.atInfo().log("Ignoring fact %s: %s", fact, problem);
      return false;
    }
    record(fact);
    return true;
  }

  /** Returns a description of why {@code fact} cannot be added, or null if it can. */
  private @Nullable String check(Fact fact) {
    if (fact instanceof Fact.IdIsIrrelevant f) {
      int typeId = valueTypeId(f.id());
      if (typeId == 0) {
        return "Not a typed value";
      } else if (context.types().isPointer(typeId)) {
        return "Pointer-typed";
      } else if (dataSynonymFacts.hasSynonyms(f.id())) {
        return "Already has synonyms";
      }
    } else if (fact instanceof Fact.PointeeIsIrrelevant f) {
      int typeId = valueTypeId(f.pointerId());
      if (typeId == 0) {
        return "Not a typed value";
      } else if (!context.types().isPointer(typeId)) {
        return "Not pointer-typed";
      } else if (dataSynonymFacts.hasSynonyms(f.pointerId())) {
        return "Already has synonyms";
      }
    } else if (fact instanceof Fact.IdSynonym f) {
      int typeId1 = valueTypeId(f.id1());
      int typeId2 = valueTypeId(f.id2());
      if (typeId1 == 0 || typeId2 == 0) {
        return "Not a typed value";
      } else if (!context.types().equalUpToSign(typeId1, typeId2)) {
        return "Types differ";
      } else if (isIrrelevant(f.id1()) || isIrrelevant(f.id2())) {
        return "Irrelevant ids cannot have synonyms";
      }
    } else if (fact instanceof Fact.BlockIsDead f) {
      if (context.block(f.blockId()) == null) {
        return "Not a block";
      }
    } else {
      throw new AssertionError();
    }
    return null;
  }

  private void record(Fact fact) {
    if (fact instanceof Fact.IdIsIrrelevant f) {
      irrelevantValueFacts.addIrrelevantId(f.id());
    } else if (fact instanceof Fact.PointeeIsIrrelevant f) {
      irrelevantValueFacts.addIrrelevantPointee(f.pointerId());
    } else if (fact instanceof Fact.IdSynonym f) {
      dataSynonymFacts.addSynonym(f.id1(), f.id2());
    } else if (fact instanceof Fact.BlockIsDead f) {
      deadBlockFacts.addDeadBlock(f.blockId());
    }
  }

  /** The type id of the value {@code id}, or 0 if {@code id} is not a typed value. */
  private int valueTypeId(int id) {
    Instruction def = context.def(id);
    return (def == null || context.types().type(def.typeId()) == null) ? 0 : def.typeId();
  }

  private boolean isIrrelevant(int id) {
    return irrelevantValueFacts.idIsIrrelevant(id)
        || irrelevantValueFacts.pointeeValueIsIrrelevant(id);
  }

  public boolean idIsIrrelevant(int id) {
    return irrelevantValueFacts.idIsIrrelevant(id);
  }

  public boolean pointeeValueIsIrrelevant(int pointerId) {
    return irrelevantValueFacts.pointeeValueIsIrrelevant(pointerId);
  }

  /** All ids marked irrelevant, in the order they were added. */
  public ImmutableSet<Integer> irrelevantIds() {
    return irrelevantValueFacts.irrelevantIds();
  }

  /** True if {@code id1} and {@code id2} are the same id or are known to be synonymous. */
  public boolean isSynonymous(int id1, int id2) {
    return dataSynonymFacts.isSynonymous(id1, id2);
  }

  /** The ids, other than {@code id} itself, known to be synonymous with {@code id}. */
  public ImmutableSet<Integer> synonymsOf(int id) {
    return dataSynonymFacts.synonymsOf(id);
  }

  /** Each class of two or more mutually synonymous ids. */
  public ImmutableList<ImmutableSet<Integer>> synonymClasses() {
    return dataSynonymFacts.classes();
  }

  public boolean blockIsDead(int blockId) {
    return deadBlockFacts.blockIsDead(blockId);
  }

  public ImmutableSet<Integer> deadBlocks() {
    return deadBlockFacts.deadBlocks();
  }
}
