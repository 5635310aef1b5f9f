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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * The ordered record of the transformations applied during a fuzzing run; the persisted artifact
 * from which the run can be replayed. Entries are only ever appended.
 *
 * <p>The text form has one {@link TransformationMessage} per line.
 */
public final class TransformationSequence implements Iterable<TransformationMessage> {

  private final List<TransformationMessage> messages = new ArrayList<>();

  public void add(Transformation transformation) {
    messages.add(transformation.toMessage());
  }

  public void add(TransformationMessage message) {
    messages.add(message);
  }

  public int size() {
    return messages.size();
  }

  public ImmutableList<TransformationMessage> messages() {
    return ImmutableList.copyOf(messages);
  }

  @Override
  public Iterator<TransformationMessage> iterator() {
    return messages().iterator();
  }

  /** Returns the text form, with a newline after each message. */
  public String toText() {
    StringBuilder sb = new StringBuilder();
    messages.forEach(m -> sb.append(m).append('\n'));
    return sb.toString();
  }

  /** Parses the text form produced by {@link #toText}; blank lines are ignored. */
  public static TransformationSequence parse(String text) {
    TransformationSequence result = new TransformationSequence();
    for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(text)) {
      result.add(TransformationMessage.parse(line));
    }
    return result;
  }

  @Override
  public String toString() {
    return toText();
  }
}
