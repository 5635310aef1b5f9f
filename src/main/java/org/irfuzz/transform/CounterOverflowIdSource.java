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

package org.irfuzz.transform;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.irfuzz.ir.Module;

/**
 * An {@link OverflowIdSource} that hands out consecutive ids starting from a fixed first id.
 *
 * <p>Replaying a transformation sequence must reproduce the overflow ids that were drawn while
 * fuzzing, so both start from {@link #forModule}, which places the overflow range well above the
 * ids that the fuzzer hands out as ordinary fresh ids.
 */
public class CounterOverflowIdSource implements OverflowIdSource {

  /** The distance between a module's original id bound and its first overflow id. */
  public static final int OVERFLOW_ID_GAP = 1 << 20;

  private int nextId;
  private final Set<Integer> issued = new LinkedHashSet<>();

  public CounterOverflowIdSource(int firstOverflowId) {
    Preconditions.checkArgument(firstOverflowId > 0);
    this.nextId = firstOverflowId;
  }

  /** Returns an overflow id source for fuzzing or replaying against {@code module}. */
  public static CounterOverflowIdSource forModule(Module module) {
    return new CounterOverflowIdSource(firstOverflowId(module));
  }

  /** The first overflow id used for a module with the given (original) id bound. */
  public static int firstOverflowId(Module module) {
    return module.idBound() + OVERFLOW_ID_GAP;
  }

  @Override
  public boolean hasOverflowIds() {
    return true;
  }

  @Override
  public int getNextOverflowId() {
    Preconditions.checkState(nextId < Integer.MAX_VALUE, "Overflow ids exhausted");
    int result = nextId++;
    issued.add(result);
    return result;
  }

  @Override
  public ImmutableSet<Integer> issuedOverflowIds() {
    return ImmutableSet.copyOf(issued);
  }
}
