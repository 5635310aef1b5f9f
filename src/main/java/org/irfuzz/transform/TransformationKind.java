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

/**
 * The closed set of transformation kinds. Each kind knows how to rebuild a transformation from
 * the words of its {@link TransformationMessage}.
 */
public enum TransformationKind {
  ADD_LOOP_PREHEADER(AddLoopPreheader::fromMessage),
  ADD_LOOP_TO_CREATE_INT_CONSTANT_SYNONYM(AddLoopToCreateIntConstantSynonym::fromMessage),
  ADD_OP_PHI_SYNONYM(AddOpPhiSynonym::fromMessage),
  FLATTEN_CONDITIONAL_BRANCH(FlattenConditionalBranch::fromMessage),
  MERGE_FUNCTION_RETURNS(MergeFunctionReturns::fromMessage),
  REPLACE_IRRELEVANT_ID(ReplaceIrrelevantId::fromMessage);

  /** Rebuilds a transformation from the words of its message. */
  interface Decoder {
    Transformation decode(TransformationMessage.Reader reader);
  }

  private final Decoder decoder;

  TransformationKind(Decoder decoder) {
    this.decoder = decoder;
  }

  Transformation decode(TransformationMessage message) {
    TransformationMessage.Reader reader = message.reader();
    Transformation result = decoder.decode(reader);
    reader.checkDone();
    return result;
  }
}
