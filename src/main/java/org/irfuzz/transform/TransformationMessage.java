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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.irfuzz.ir.Opcode;

/**
 * The persisted form of a transformation: its kind and a flat list of integer words. The text form
 * is the kind's name followed by the words, separated by single spaces, e.g. {@code
 * ADD_OP_PHI_SYNONYM 20 1 18 30 40}. Opcodes are written as their ordinals.
 *
 * <p>Lists are written as a length word followed by their elements.
 */
public record TransformationMessage(TransformationKind kind, ImmutableIntArray words) {

  /** Reconstructs the transformation this message describes. */
  public Transformation toTransformation() {
    return kind.decode(this);
  }

  Reader reader() {
    return new Reader(words);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.name());
    words.forEach(w -> sb.append(' ').append(w));
    return sb.toString();
  }

  /** Parses the text form produced by {@link #toString}. */
  public static TransformationMessage parse(String text) {
    List<String> parts = Splitter.on(' ').omitEmptyStrings().splitToList(text.trim());
    Preconditions.checkArgument(!parts.isEmpty(), "Empty transformation message");
    TransformationKind kind;
    try {
      kind = TransformationKind.valueOf(parts.get(0));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown transformation kind: " + parts.get(0), e);
    }
    ImmutableIntArray.Builder words = ImmutableIntArray.builder(parts.size() - 1);
    for (String part : parts.subList(1, parts.size())) {
      words.add(Integer.parseInt(part));
    }
    return new TransformationMessage(kind, words.build());
  }

  /** Accumulates the words of a message. */
  static class Writer {
    private final TransformationKind kind;
    private final ImmutableIntArray.Builder words = ImmutableIntArray.builder();

    Writer(TransformationKind kind) {
      this.kind = kind;
    }

    @CanIgnoreReturnValue
    Writer add(int word) {
      words.add(word);
      return this;
    }

    @CanIgnoreReturnValue
    Writer addList(List<Integer> list) {
      words.add(list.size());
      list.forEach(words::add);
      return this;
    }

    @CanIgnoreReturnValue
    Writer add(InstructionDescriptor descriptor) {
      return add(descriptor.baseInstructionResultId())
          .add(descriptor.targetOpcode().ordinal())
          .add(descriptor.numOpcodesToIgnore());
    }

    TransformationMessage build() {
      return new TransformationMessage(kind, words.build());
    }
  }

  /** Reads the words of a message in order; running out of words is an error. */
  static class Reader {
    private final ImmutableIntArray words;
    private int next;

    Reader(ImmutableIntArray words) {
      this.words = words;
    }

    int next() {
      Preconditions.checkArgument(next < words.length(), "Truncated transformation message");
      return words.get(next++);
    }

    /** Reads a length word, checking that at least {@code wordsPerElement} words follow each. */
    int nextLength(int wordsPerElement) {
      int length = next();
      Preconditions.checkArgument(
          length >= 0 && (long) length * wordsPerElement <= words.length() - next,
          "Bad list length %s",
          length);
      return length;
    }

    ImmutableList<Integer> nextList() {
      int length = nextLength(1);
      ImmutableList.Builder<Integer> result = ImmutableList.builder();
      for (int i = 0; i < length; i++) {
        result.add(next());
      }
      return result.build();
    }

    InstructionDescriptor nextInstructionDescriptor() {
      int base = next();
      int opcode = next();
      Preconditions.checkArgument(
          opcode >= 0 && opcode < Opcode.values().length, "Bad opcode %s", opcode);
      return new InstructionDescriptor(base, Opcode.values()[opcode], next());
    }

    void checkDone() {
      Preconditions.checkArgument(next == words.length(), "Extra words in transformation message");
    }
  }
}
