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

import com.google.common.collect.ImmutableMap;

/**
 * The fresh ids that {@link MergeFunctionReturns} uses at one loop merge block: the result of
 * the new boolean value merge saying whether the function is returning, the result of the new
 * value merge holding the value being returned (0 for a void function), and, for each existing
 * value merge in the block, an id to use as its value on the new incoming edges.
 */
public record ReturnMergingInfo(
    int mergeBlockId,
    int isReturningId,
    int maybeReturnValId,
    ImmutableMap<Integer, Integer> opPhiToSuitableId) {}
